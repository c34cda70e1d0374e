/*
 * Copyright 2009 Amazon Technologies, Inc. or its affiliates.
 * Amazon, Amazon.com and Carbonado are trademarks or registered trademarks
 * of Amazon Technologies, Inc. or its affiliates.  All rights reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.amazon.lexicon.repo.jdbc;

import java.sql.Clob;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import javax.sql.DataSource;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;

import org.joda.time.DateTime;

import com.amazon.lexicon.FetchException;
import com.amazon.lexicon.PersistException;
import com.amazon.lexicon.RepositoryException;
import com.amazon.lexicon.ScopedAction;

import com.amazon.lexicon.spi.Database;
import com.amazon.lexicon.spi.TransactionRunner;

import com.amazon.lexicon.sql.SQLDialect;
import com.amazon.lexicon.sql.SQLInsert;
import com.amazon.lexicon.sql.SQLManipulation;
import com.amazon.lexicon.sql.SQLSelect;
import com.amazon.lexicon.sql.SQLStatement;
import com.amazon.lexicon.sql.SQLStatementBuilder;
import com.amazon.lexicon.sql.SQLUpdate;
import com.amazon.lexicon.sql.TableDefinition;
import com.amazon.lexicon.sql.TableManipulation;

import static com.amazon.lexicon.sql.SQLExpression.*;

/**
 * Database implementation over a JDBC DataSource. Statements are rendered
 * with the configured dialect and all values are bound as parameters. Every
 * statement is logged as debug, along with its parameters.
 *
 * <p>Transactions are bound to the thread which started them, and all calls
 * made by that thread join the transaction. Nested transactions are
 * implemented with savepoints.
 */
public class JDBCDatabase implements Database, TransactionRunner {
    private final Log mLog = LogFactory.getLog(getClass());

    private final DataSource mDataSource;
    private final SQLDialect mDialect;
    private final JDBCExceptionTransformer mExTransformer;
    private final ThreadLocal<JDBCTransaction> mLocalTxn;

    public JDBCDatabase(DataSource dataSource) {
        this(dataSource, SQLDialect.getDefault());
    }

    public JDBCDatabase(DataSource dataSource, SQLDialect dialect) {
        if (dataSource == null || dialect == null) {
            throw new IllegalArgumentException();
        }
        mDataSource = dataSource;
        mDialect = dialect;
        mExTransformer = new JDBCExceptionTransformer();
        mLocalTxn = new ThreadLocal<JDBCTransaction>();
    }

    public SQLDialect getDialect() {
        return mDialect;
    }

    public <T> T inTransaction(ScopedAction<T> action) throws RepositoryException {
        JDBCTransaction parent = mLocalTxn.get();
        JDBCTransaction txn;
        try {
            if (parent == null) {
                Connection con = mDataSource.getConnection();
                try {
                    con.setAutoCommit(false);
                } catch (SQLException e) {
                    con.close();
                    throw e;
                }
                txn = new JDBCTransaction(con);
            } else {
                txn = new JDBCTransaction(parent);
            }
        } catch (SQLException e) {
            throw mExTransformer.toPersistException(e);
        }

        mLocalTxn.set(txn);
        try {
            T result = action.run();
            txn.commit();
            return result;
        } catch (SQLException e) {
            throw mExTransformer.toPersistException(e);
        } finally {
            mLocalTxn.set(parent);
            exit(txn);
        }
    }

    /**
     * Rolls back the transaction if it was not committed, and closes its
     * connection if it is the outermost transaction.
     */
    private void exit(JDBCTransaction txn) {
        try {
            Connection con = txn.abort();
            if (con != null) {
                con.close();
            }
        } catch (SQLException e) {
            mLog.error("Unable to end transaction", e);
        }
    }

    public List<Map<String, Object>> select(SQLSelect select) throws FetchException {
        SQLStatementBuilder b = select.build(mDialect);
        logStatement(b);
        try {
            Connection con = getConnection();
            try {
                PreparedStatement ps = con.prepareStatement(b.getSQL());
                try {
                    bind(ps, b.getParameters());
                    ResultSet rs = ps.executeQuery();
                    try {
                        return readRows(rs);
                    } finally {
                        rs.close();
                    }
                } finally {
                    ps.close();
                }
            } finally {
                yieldConnection(con);
            }
        } catch (SQLException e) {
            throw mExTransformer.toFetchException(e);
        }
    }

    public int execute(SQLStatement statement) throws PersistException {
        SQLStatementBuilder b = statement.build(mDialect);
        logStatement(b);
        try {
            Connection con = getConnection();
            try {
                PreparedStatement ps = con.prepareStatement(b.getSQL());
                try {
                    bind(ps, b.getParameters());
                    return ps.executeUpdate();
                } finally {
                    ps.close();
                }
            } finally {
                yieldConnection(con);
            }
        } catch (SQLException e) {
            throw mExTransformer.toPersistException(e);
        }
    }

    public void execute(SQLManipulation manipulation) throws PersistException {
        for (Map.Entry<String, TableManipulation> entry
                 : manipulation.getManipulations().entrySet())
        {
            String table = entry.getKey();
            TableManipulation m = entry.getValue();
            switch (m.getCommand()) {
            case INSERT:
                execute(m.toInsert(table));
                break;
            case UPDATE:
                SQLUpdate update = m.toUpdate(table);
                if (update != null) {
                    execute(update);
                }
                break;
            case UPSERT:
                upsert(table, m);
                break;
            case DELETE:
                execute(m.toDelete(table));
                break;
            default:
                throw new IllegalStateException("Unhandled command: " + m.getCommand());
            }
        }
    }

    private void upsert(String table, TableManipulation m) throws PersistException {
        if (m.getKeys().isEmpty()) {
            throw new IllegalStateException("Upsert into " + table + " requires keys");
        }
        SQLUpdate update = m.toUpdate(table);
        boolean found;
        if (update == null) {
            try {
                found = exists(table, m.getKeys());
            } catch (FetchException e) {
                throw e.toPersistException();
            }
        } else {
            found = execute(update) > 0;
        }
        if (!found) {
            execute(m.toInsert(table));
        }
    }

    private boolean exists(String table, Map<String, Object> keys) throws FetchException {
        String first = keys.keySet().iterator().next();
        SQLSelect select = new SQLSelect()
            .addColumn(first, column(table, first))
            .setFrom(table)
            .setLimit(1);
        for (Map.Entry<String, Object> key : keys.entrySet()) {
            select.addWhere(eq(column(table, key.getKey()), param(key.getValue())));
        }
        return !select(select).isEmpty();
    }

    public long insert(SQLInsert insert) throws PersistException {
        SQLStatementBuilder b = insert.build(mDialect);
        logStatement(b);
        try {
            Connection con = getConnection();
            try {
                PreparedStatement ps = con.prepareStatement
                    (b.getSQL(), Statement.RETURN_GENERATED_KEYS);
                try {
                    bind(ps, b.getParameters());
                    ps.executeUpdate();
                    ResultSet rs = ps.getGeneratedKeys();
                    try {
                        if (rs.next()) {
                            return rs.getLong(1);
                        }
                    } finally {
                        rs.close();
                    }
                } finally {
                    ps.close();
                }
            } finally {
                yieldConnection(con);
            }
        } catch (SQLException e) {
            throw mExTransformer.toPersistException(e);
        }
        throw new PersistException("No key generated by insert into " + insert.getTable());
    }

    public Map<String, String> getTableList() throws FetchException {
        Map<String, String> tables = new LinkedHashMap<String, String>();
        try {
            Connection con = getConnection();
            try {
                DatabaseMetaData md = con.getMetaData();
                ResultSet rs = md.getTables
                    (con.getCatalog(), con.getSchema(), null, new String[] {"TABLE"});
                try {
                    while (rs.next()) {
                        String name = rs.getString("TABLE_NAME");
                        tables.put(name.toLowerCase(), name);
                    }
                } finally {
                    rs.close();
                }
            } finally {
                yieldConnection(con);
            }
        } catch (SQLException e) {
            throw mExTransformer.toFetchException(e);
        }
        return tables;
    }

    public Set<String> getColumnNames(String table) throws FetchException {
        Set<String> columns = new LinkedHashSet<String>();
        try {
            Connection con = getConnection();
            try {
                DatabaseMetaData md = con.getMetaData();
                ResultSet rs = md.getColumns
                    (con.getCatalog(), con.getSchema(),
                     escapePattern(table, md.getSearchStringEscape()), null);
                try {
                    while (rs.next()) {
                        columns.add(rs.getString("COLUMN_NAME"));
                    }
                } finally {
                    rs.close();
                }
            } finally {
                yieldConnection(con);
            }
        } catch (SQLException e) {
            throw mExTransformer.toFetchException(e);
        }
        return columns;
    }

    public void createTable(TableDefinition definition) throws PersistException {
        if (mLog.isDebugEnabled()) {
            mLog.debug("Creating table if missing: " + definition.getName());
        }
        for (SQLStatement statement : definition.toStatements()) {
            execute(statement);
        }
    }

    private Connection getConnection() throws SQLException {
        JDBCTransaction txn = mLocalTxn.get();
        if (txn != null) {
            // Return the connection used by the current transaction.
            return txn.getConnection();
        }
        Connection con = mDataSource.getConnection();
        con.setAutoCommit(true);
        return con;
    }

    /**
     * Gives up a connection returned from getConnection. Connections of a
     * transaction stay open until it ends.
     */
    private void yieldConnection(Connection con) throws SQLException {
        if (mLocalTxn.get() == null) {
            con.close();
        }
    }

    private void bind(PreparedStatement ps, List<Object> params) throws SQLException {
        int i = 0;
        for (Object param : params) {
            i++;
            if (param instanceof DateTime) {
                ps.setTimestamp(i, new Timestamp(((DateTime) param).getMillis()));
            } else {
                ps.setObject(i, param);
            }
        }
    }

    private List<Map<String, Object>> readRows(ResultSet rs) throws SQLException {
        ResultSetMetaData md = rs.getMetaData();
        int count = md.getColumnCount();
        String[] labels = new String[count];
        for (int i=0; i<count; i++) {
            labels[i] = md.getColumnLabel(i + 1);
        }

        List<Map<String, Object>> rows = new ArrayList<Map<String, Object>>();
        while (rs.next()) {
            Map<String, Object> row = new LinkedHashMap<String, Object>(count * 2);
            for (int i=0; i<count; i++) {
                row.put(labels[i], toValue(rs.getObject(i + 1)));
            }
            rows.add(row);
        }
        return rows;
    }

    private static Object toValue(Object value) throws SQLException {
        if (value instanceof Timestamp) {
            return new DateTime(((Timestamp) value).getTime());
        }
        if (value instanceof Clob) {
            Clob clob = (Clob) value;
            return clob.getSubString(1, (int) clob.length());
        }
        return value;
    }

    private static String escapePattern(String name, String escape) {
        if (escape == null || escape.length() == 0) {
            return name;
        }
        StringBuilder b = new StringBuilder(name.length() + 4);
        for (int i=0; i<name.length(); i++) {
            char c = name.charAt(i);
            if (c == '_' || c == '%') {
                b.append(escape);
            }
            b.append(c);
        }
        return b.toString();
    }

    private void logStatement(SQLStatementBuilder b) {
        if (mLog.isDebugEnabled()) {
            List<Object> params = b.getParameters();
            if (params.isEmpty()) {
                mLog.debug(b.getSQL());
            } else {
                mLog.debug(b.getSQL() + " -- " + params);
            }
        }
    }

    @Override
    public String toString() {
        return "JDBCDatabase {dialect=" + mDialect + '}';
    }
}
