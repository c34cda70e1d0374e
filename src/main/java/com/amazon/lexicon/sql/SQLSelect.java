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

package com.amazon.lexicon.sql;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Mutable select statement. Tables are addressed by alias, and the physical
 * table behind an alias can be renamed without touching any expression
 * which refers to it.
 */
public class SQLSelect extends SQLStatement {
    private final Map<String, SQLExpression> mColumns;
    private final Map<String, TableReference> mFrom;

    private List<SQLExpression> mWhere;
    private List<SQLExpression> mOrderBy;
    private boolean mDistinct;
    private int mLimit = -1;

    public SQLSelect() {
        mColumns = new LinkedHashMap<String, SQLExpression>();
        mFrom = new LinkedHashMap<String, TableReference>();
        mWhere = new ArrayList<SQLExpression>();
        mOrderBy = new ArrayList<SQLExpression>();
    }

    /**
     * Adds a selected expression under the given result name. A column of
     * the same name is replaced.
     */
    public SQLSelect addColumn(String name, SQLExpression expr) {
        mColumns.put(name, expr);
        return this;
    }

    /**
     * Returns the selected expressions keyed by result name.
     */
    public Map<String, SQLExpression> getColumns() {
        return Collections.unmodifiableMap(mColumns);
    }

    /**
     * Sets the root table, which is aliased by its own name.
     */
    public SQLSelect setFrom(String table) {
        return setFrom(table, table);
    }

    public SQLSelect setFrom(String table, String alias) {
        if (getRoot() != null) {
            throw new IllegalStateException("Root table already set: " + getRoot());
        }
        // Root must come first.
        Map<String, TableReference> joins = new LinkedHashMap<String, TableReference>(mFrom);
        mFrom.clear();
        putReference(new TableReference(table, alias, TableReference.JoinType.FROM, null));
        for (TableReference ref : joins.values()) {
            putReference(ref);
        }
        return this;
    }

    public SQLSelect addLeftJoin(String table, String alias, SQLExpression filter) {
        putReference(new TableReference(table, alias, TableReference.JoinType.LEFT, filter));
        return this;
    }

    public SQLSelect addInnerJoin(String table, String alias, SQLExpression filter) {
        putReference(new TableReference(table, alias, TableReference.JoinType.INNER, filter));
        return this;
    }

    private void putReference(TableReference ref) {
        if (mFrom.containsKey(ref.getAlias())) {
            throw new IllegalArgumentException("Alias already used: " + ref.getAlias());
        }
        mFrom.put(ref.getAlias(), ref);
    }

    /**
     * Returns the root table reference, or null if not set.
     */
    public TableReference getRoot() {
        for (TableReference ref : mFrom.values()) {
            if (ref.getJoinType() == TableReference.JoinType.FROM) {
                return ref;
            }
        }
        return null;
    }

    public boolean hasAlias(String alias) {
        return mFrom.containsKey(alias);
    }

    /**
     * Returns the reference for the given alias, or null if none.
     */
    public TableReference getTableReference(String alias) {
        return mFrom.get(alias);
    }

    public Collection<TableReference> getTableReferences() {
        return Collections.unmodifiableCollection(mFrom.values());
    }

    /**
     * Replaces the filter of a joined table.
     *
     * @throws IllegalArgumentException if alias is unknown or is the root
     */
    public SQLSelect setJoinFilter(String alias, SQLExpression filter) {
        TableReference ref = mFrom.get(alias);
        if (ref == null) {
            throw new IllegalArgumentException("No table with alias: " + alias);
        }
        if (ref.getJoinType() == TableReference.JoinType.FROM || filter == null) {
            throw new IllegalArgumentException("Cannot set join filter of: " + alias);
        }
        ref.setFilter(filter);
        return this;
    }

    /**
     * Renames every reference to a physical table. Aliases are unchanged.
     *
     * @return number of references renamed
     */
    public int renameTable(String oldName, String newName) {
        int count = 0;
        for (TableReference ref : mFrom.values()) {
            if (ref.getTable().equals(oldName)) {
                ref.setTable(newName);
                count++;
            }
        }
        return count;
    }

    public SQLSelect addWhere(SQLExpression condition) {
        mWhere.add(condition);
        return this;
    }

    public List<SQLExpression> getWhere() {
        return Collections.unmodifiableList(mWhere);
    }

    public SQLSelect addOrderBy(SQLExpression expr) {
        mOrderBy.add(expr);
        return this;
    }

    public List<SQLExpression> getOrderBy() {
        return Collections.unmodifiableList(mOrderBy);
    }

    public SQLSelect setDistinct(boolean distinct) {
        mDistinct = distinct;
        return this;
    }

    /**
     * @param limit maximum rows, or negative for no limit
     */
    public SQLSelect setLimit(int limit) {
        mLimit = limit;
        return this;
    }

    /**
     * Replaces every reference to the given column in selected columns,
     * join filters, where conditions and ordering.
     */
    public void replaceColumn(String alias, String column, SQLExpression replacement) {
        for (Map.Entry<String, SQLExpression> entry : mColumns.entrySet()) {
            entry.setValue(entry.getValue().replaceColumn(alias, column, replacement));
        }
        for (TableReference ref : mFrom.values()) {
            SQLExpression filter = ref.getFilter();
            if (filter != null) {
                ref.setFilter(filter.replaceColumn(alias, column, replacement));
            }
        }
        mWhere = SQLExpression.replaceAll(mWhere, alias, column, replacement);
        mOrderBy = SQLExpression.replaceAll(mOrderBy, alias, column, replacement);
    }

    // Used by SubSelect; an alias defined here shadows the outer one.
    boolean referencesOuter(String alias) {
        if (mFrom.containsKey(alias)) {
            return false;
        }
        for (SQLExpression e : mWhere) {
            if (e.references(alias)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public void appendTo(SQLStatementBuilder b) {
        if (mColumns.isEmpty()) {
            throw new IllegalStateException("Nothing selected");
        }
        TableReference root = getRoot();
        if (root == null) {
            throw new IllegalStateException("No root table");
        }

        b.append("SELECT ");
        if (mDistinct) {
            b.append("DISTINCT ");
        }
        int i = 0;
        for (Map.Entry<String, SQLExpression> entry : mColumns.entrySet()) {
            if (i++ > 0) {
                b.append(", ");
            }
            SQLExpression expr = entry.getValue();
            expr.appendTo(b);
            if (!(expr instanceof Column) || !((Column) expr).getName().equals(entry.getKey())) {
                b.append(" AS ");
                b.appendIdentifier(entry.getKey());
            }
        }

        for (TableReference ref : mFrom.values()) {
            ref.appendTo(b);
        }

        if (!mWhere.isEmpty()) {
            b.append(" WHERE ");
            SQLExpression.and(mWhere).appendTo(b);
        }

        if (!mOrderBy.isEmpty()) {
            b.append(" ORDER BY ");
            for (i=0; i<mOrderBy.size(); i++) {
                if (i > 0) {
                    b.append(", ");
                }
                mOrderBy.get(i).appendTo(b);
            }
        }

        if (mLimit >= 0) {
            b.getDialect().appendLimit(b, mLimit);
        }
    }
}
