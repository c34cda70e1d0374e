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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;

import org.joda.time.DateTime;

import com.amazon.lexicon.DataRecord;
import com.amazon.lexicon.FetchException;
import com.amazon.lexicon.PersistException;
import com.amazon.lexicon.RepositoryException;
import com.amazon.lexicon.ScopedAction;
import com.amazon.lexicon.Stage;
import com.amazon.lexicon.VersioningMode;

import com.amazon.lexicon.capability.VersionedCapability;

import com.amazon.lexicon.info.RecordType;
import com.amazon.lexicon.info.TableInfo;

import com.amazon.lexicon.locale.LocaleState;

import com.amazon.lexicon.spi.QueryContext;
import com.amazon.lexicon.spi.RecordAugmenter;
import com.amazon.lexicon.spi.WriteContext;

import com.amazon.lexicon.sql.ColumnType;
import com.amazon.lexicon.sql.SQLExpression;
import com.amazon.lexicon.sql.SQLInsert;
import com.amazon.lexicon.sql.SQLManipulation;
import com.amazon.lexicon.sql.SQLSelect;
import com.amazon.lexicon.sql.TableDefinition;
import com.amazon.lexicon.sql.TableManipulation;

import static com.amazon.lexicon.sql.SQLExpression.*;

/**
 * Stores the records of one type in its tables. Each table of the type holds
 * one row per record, keyed by ID. Versioned types also have live tables,
 * which hold published rows under the same IDs, and versions tables, which
 * gain a row for every write.
 *
 * <p>Reads and writes are built as statement trees, which the registered
 * augmenters may rewrite before they are executed.
 */
public class JDBCRecordStorage {
    public static final String ID = "ID";
    public static final String CLASS_NAME = "ClassName";
    public static final String CREATED = "Created";
    public static final String LAST_EDITED = "LastEdited";

    static String liveTable(String table) {
        return table + Stage.LIVE.getTableSuffix();
    }

    static String versionsTable(String table) {
        return table + "_Versions";
    }

    private final Log mLog = LogFactory.getLog(getClass());

    private final RecordType mType;
    private final boolean mVersioned;
    private final JDBCDatabase mDatabase;
    private final LocaleState mLocaleState;
    private final VersionedQueryAugmenter mVersionedAugmenter;
    private final List<RecordAugmenter> mAugmenters;

    /**
     * @param augmenters augmenters called in order on every read and write
     */
    JDBCRecordStorage(RecordType type, JDBCDatabase database, LocaleState localeState,
                      List<RecordAugmenter> augmenters)
    {
        mType = type;
        mVersioned = type.hasCapability(VersionedCapability.class);
        mDatabase = database;
        mLocaleState = localeState;
        mVersionedAugmenter = new VersionedQueryAugmenter(type);
        mAugmenters = Collections.unmodifiableList(new ArrayList<RecordAugmenter>(augmenters));
    }

    public RecordType getRecordType() {
        return mType;
    }

    public boolean isVersioned() {
        return mVersioned;
    }

    public List<RecordAugmenter> getAugmenters() {
        return mAugmenters;
    }

    /**
     * Returns a new unsaved record of the given class, or of the type's
     * first class if null.
     */
    public DataRecord create(String className) {
        if (className == null) {
            className = mType.getClassNames().iterator().next();
        }
        return new DataRecord(mType.getName(), className);
    }

    /**
     * Loads the draft of a record, without localizing it.
     *
     * @return null if not found
     */
    public DataRecord load(long id) throws FetchException {
        return get(id, new QueryContext(null));
    }

    /**
     * Loads a record from the given stage in the current locale.
     *
     * @return null if not found
     */
    public DataRecord get(long id, Stage stage) throws FetchException {
        return get(id, QueryContext.forStage(stage, mLocaleState.getLocale()));
    }

    /**
     * @return null if not found
     */
    public DataRecord get(long id, QueryContext context) throws FetchException {
        List<DataRecord> records = query(context, eq(column(mType.getBaseTable(), ID), param(id)));
        return records.isEmpty() ? null : records.get(0);
    }

    /**
     * Returns all records of the given stage in the current locale, ordered
     * by ID.
     */
    public List<DataRecord> select(Stage stage) throws FetchException {
        return select(QueryContext.forStage(stage, mLocaleState.getLocale()));
    }

    public List<DataRecord> select(QueryContext context) throws FetchException {
        return query(context, null);
    }

    /**
     * Returns every version of a record in the current locale, oldest first.
     */
    public List<DataRecord> getVersions(long id) throws FetchException {
        return query(QueryContext.forMode(VersioningMode.ALL_VERSIONS, mLocaleState.getLocale()),
                     eq(column(mType.getBaseTable(), ID), param(id)));
    }

    private List<DataRecord> query(QueryContext context, SQLExpression where)
        throws FetchException
    {
        String base = mType.getBaseTable();

        SQLSelect select = new SQLSelect().setFrom(base);
        select.addColumn(ID, column(base, ID));
        select.addColumn(CLASS_NAME, column(base, CLASS_NAME));
        select.addColumn(CREATED, column(base, CREATED));
        select.addColumn(LAST_EDITED, column(base, LAST_EDITED));
        if (mVersioned) {
            select.addColumn(VersionedCapability.VERSION_COLUMN,
                             column(base, VersionedCapability.VERSION_COLUMN));
        }

        for (TableInfo table : mType.getTables()) {
            String name = table.getName();
            if (!name.equals(base)) {
                select.addLeftJoin(name, name, eq(column(base, ID), column(name, ID)));
            }
            for (String field : table.getFieldNames()) {
                select.addColumn(field, column(name, field));
            }
        }

        if (where != null) {
            select.addWhere(where);
        }
        select.addOrderBy(column(base, ID));

        mVersionedAugmenter.augmentQuery(select, context);
        for (RecordAugmenter augmenter : mAugmenters) {
            augmenter.augmentQuery(select, context);
        }

        List<Map<String, Object>> rows = mDatabase.select(select);
        List<DataRecord> records = new ArrayList<DataRecord>(rows.size());
        for (Map<String, Object> row : rows) {
            records.add(toRecord(row));
        }
        return records;
    }

    private DataRecord toRecord(Map<String, Object> row) {
        DataRecord record = new DataRecord(mType.getName(), (String) row.get(CLASS_NAME));
        record.setId(((Number) row.get(ID)).longValue());
        record.setCreated((DateTime) row.get(CREATED));
        record.setLastEdited((DateTime) row.get(LAST_EDITED));
        if (mVersioned) {
            Number version = (Number) row.get(VersionedCapability.VERSION_COLUMN);
            record.setVersion(version == null ? 0 : version.intValue());
        }
        for (TableInfo table : mType.getTables()) {
            for (String field : table.getFieldNames()) {
                record.set(field, row.get(field));
            }
        }
        return record;
    }

    /**
     * Returns true if the record has a live row.
     */
    public boolean isPublished(long id) throws FetchException {
        if (!mVersioned) {
            return false;
        }
        String live = liveTable(mType.getBaseTable());
        SQLSelect select = new SQLSelect()
            .addColumn(ID, column(live, ID))
            .setFrom(live)
            .addWhere(eq(column(live, ID), param(id)))
            .setLimit(1);
        return !mDatabase.select(select).isEmpty();
    }

    /**
     * Saves the record to draft in the current locale. Versioned types also
     * gain a new version. A record without an ID is inserted and is assigned
     * an ID.
     */
    public void writeToDraft(DataRecord record) throws PersistException {
        write(record, false);
    }

    /**
     * Saves the record to draft and live in the current locale, as a new
     * published version.
     *
     * @throws IllegalStateException if type is not versioned
     */
    public void publish(DataRecord record) throws PersistException {
        if (!mVersioned) {
            throw new IllegalStateException("Record type is not versioned: " + mType.getName());
        }
        write(record, true);
    }

    private void write(final DataRecord record, final boolean publish) throws PersistException {
        if (!mType.getName().equals(record.getTypeName())) {
            throw new IllegalArgumentException("Record is not of type " + mType.getName());
        }
        try {
            mDatabase.inTransaction(new ScopedAction<Object>() {
                public Object run() throws RepositoryException {
                    doWrite(record, publish);
                    return null;
                }
            });
        } catch (RepositoryException e) {
            throw e.toPersistException();
        }
    }

    private void doWrite(DataRecord record, boolean publish) throws PersistException {
        DateTime now = new DateTime();
        String base = mType.getBaseTable();
        String versionColumn = VersionedCapability.VERSION_COLUMN;

        if (record.getClassName() == null) {
            record.setClassName(mType.getClassNames().iterator().next());
        }

        if (record.getId() == null) {
            Map<String, Object> values = new LinkedHashMap<String, Object>();
            values.put(CLASS_NAME, record.getClassName());
            values.put(CREATED, now);
            values.put(LAST_EDITED, now);
            if (mVersioned) {
                values.put(versionColumn, 0);
            }
            record.setId(mDatabase.insert(new SQLInsert(base, values)));
            record.setCreated(now);
        }

        long id = record.getId();
        int version = mVersioned ? record.getVersion() + 1 : record.getVersion();
        Stage stage = publish ? Stage.LIVE : Stage.DRAFT;

        SQLManipulation manipulation = new SQLManipulation();

        for (TableInfo table : mType.getTables()) {
            String name = table.getName();
            boolean isBase = name.equals(base);
            TableManipulation draft = new TableManipulation
                (isBase ? TableManipulation.Command.UPDATE : TableManipulation.Command.UPSERT, id)
                .setKey(ID, id);
            if (isBase) {
                draft.setField(CLASS_NAME, record.getClassName());
                draft.setField(LAST_EDITED, now);
                if (mVersioned) {
                    draft.setField(versionColumn, version);
                }
            }
            copyFields(record, table, draft);
            manipulation.put(name, draft);
        }

        if (publish) {
            for (TableInfo table : mType.getTables()) {
                String name = table.getName();
                TableManipulation live = new TableManipulation
                    (TableManipulation.Command.UPSERT, id).setKey(ID, id);
                if (name.equals(base)) {
                    live.setField(CLASS_NAME, record.getClassName());
                    live.setField(CREATED, record.getCreated());
                    live.setField(LAST_EDITED, now);
                    live.setField(versionColumn, version);
                }
                copyFields(record, table, live);
                manipulation.put(liveTable(name), live);
            }
        }

        if (mVersioned) {
            for (TableInfo table : mType.getTables()) {
                String name = table.getName();
                TableManipulation versions = new TableManipulation
                    (TableManipulation.Command.INSERT, id)
                    .setField(VersionedQueryAugmenter.RECORD_ID, id)
                    .setField(versionColumn, version);
                if (name.equals(base)) {
                    versions.setField(CLASS_NAME, record.getClassName());
                    versions.setField(CREATED, record.getCreated());
                    versions.setField(LAST_EDITED, now);
                    versions.setField(VersionedQueryAugmenter.WAS_PUBLISHED, publish);
                }
                copyFields(record, table, versions);
                manipulation.put(versionsTable(name), versions);
            }
        }

        WriteContext context = new WriteContext(mLocaleState.getLocale(), stage);
        for (RecordAugmenter augmenter : mAugmenters) {
            augmenter.augmentWrite(manipulation, context);
        }

        if (mLog.isDebugEnabled()) {
            mLog.debug((publish ? "Publishing " : "Writing ") + mType.getName() + ' ' + id
                       + " version " + version + " in locale " + mLocaleState.getLocaleCode());
        }

        try {
            mDatabase.execute(manipulation);
        } finally {
            for (RecordAugmenter augmenter : mAugmenters) {
                augmenter.afterWrite(id);
            }
        }

        record.setVersion(version);
        record.setLastEdited(now);
    }

    private static void copyFields(DataRecord record, TableInfo table, TableManipulation m) {
        for (String field : table.getFieldNames()) {
            if (record.has(field)) {
                m.setField(field, record.get(field));
            }
        }
    }

    /**
     * Deletes a record from the given stage, in all locales. Unversioned
     * types only have a draft stage.
     */
    public void delete(final long id, Stage stage) throws PersistException {
        final Stage target = mVersioned ? stage : Stage.DRAFT;
        final SQLManipulation manipulation = new SQLManipulation();
        for (TableInfo table : mType.getTables()) {
            String name = table.getName();
            manipulation.put(target == Stage.LIVE ? liveTable(name) : name,
                             new TableManipulation(TableManipulation.Command.DELETE, id)
                             .setKey(ID, id));
        }

        WriteContext context = new WriteContext(mLocaleState.getLocale(), target);
        for (RecordAugmenter augmenter : mAugmenters) {
            augmenter.augmentDelete(manipulation, context);
        }

        try {
            mDatabase.inTransaction(new ScopedAction<Object>() {
                public Object run() throws RepositoryException {
                    mDatabase.execute(manipulation);
                    return null;
                }
            });
        } catch (RepositoryException e) {
            throw e.toPersistException();
        } finally {
            for (RecordAugmenter augmenter : mAugmenters) {
                augmenter.afterWrite(id);
            }
        }
    }

    /**
     * Returns definitions of the type's draft, live and versions tables.
     */
    public List<TableDefinition> getTableDefinitions() {
        List<TableDefinition> definitions = new ArrayList<TableDefinition>();
        String base = mType.getBaseTable();
        String versionColumn = VersionedCapability.VERSION_COLUMN;

        for (TableInfo table : mType.getTables()) {
            String name = table.getName();
            boolean isBase = name.equals(base);

            TableDefinition draft = new TableDefinition(name);
            draft.addColumn(ID, isBase ? ColumnType.IDENTITY : ColumnType.RECORD_ID);
            if (isBase) {
                addSystemColumns(draft);
                if (mVersioned) {
                    draft.addColumn(versionColumn, ColumnType.INTEGER);
                }
            }
            draft.addColumns(table.getFields());
            definitions.add(draft);

            if (!mVersioned) {
                continue;
            }

            TableDefinition live = new TableDefinition(liveTable(name));
            live.addColumn(ID, ColumnType.RECORD_ID);
            if (isBase) {
                addSystemColumns(live);
                live.addColumn(versionColumn, ColumnType.INTEGER);
            }
            live.addColumns(table.getFields());
            definitions.add(live);

            TableDefinition versions = new TableDefinition(versionsTable(name));
            versions.addColumn(ID, ColumnType.IDENTITY);
            versions.addColumn(VersionedQueryAugmenter.RECORD_ID, ColumnType.BIGINT);
            versions.addColumn(versionColumn, ColumnType.INTEGER);
            if (isBase) {
                addSystemColumns(versions);
                versions.addColumn(VersionedQueryAugmenter.WAS_PUBLISHED, ColumnType.BOOLEAN);
            }
            versions.addColumns(table.getFields());
            definitions.add(versions);
        }

        return definitions;
    }

    private static void addSystemColumns(TableDefinition def) {
        def.addColumn(CLASS_NAME, ColumnType.VARCHAR);
        def.addColumn(CREATED, ColumnType.TIMESTAMP);
        def.addColumn(LAST_EDITED, ColumnType.TIMESTAMP);
    }

    @Override
    public String toString() {
        return "JDBCRecordStorage {type=" + mType.getName() + '}';
    }
}
