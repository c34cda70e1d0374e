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

package com.amazon.lexicon.migrate;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.joda.time.DateTime;

import com.amazon.lexicon.ConfigurationException;
import com.amazon.lexicon.DataRecord;
import com.amazon.lexicon.FetchException;
import com.amazon.lexicon.PersistException;
import com.amazon.lexicon.RepositoryException;
import com.amazon.lexicon.ScopedAction;
import com.amazon.lexicon.Stage;

import com.amazon.lexicon.capability.LocalizedCapability;

import com.amazon.lexicon.info.RecordType;
import com.amazon.lexicon.info.RecordTypeRegistry;

import com.amazon.lexicon.locale.LocaleDefinition;
import com.amazon.lexicon.locale.LocaleRegistry;
import com.amazon.lexicon.locale.LocaleState;

import com.amazon.lexicon.localized.TableNames;

import com.amazon.lexicon.spi.Database;
import com.amazon.lexicon.spi.PrivilegedExecutor;
import com.amazon.lexicon.spi.PublishWorkflow;
import com.amazon.lexicon.spi.RecordLoader;
import com.amazon.lexicon.spi.TransactionRunner;

import com.amazon.lexicon.sql.SQLDelete;
import com.amazon.lexicon.sql.SQLDropColumn;
import com.amazon.lexicon.sql.SQLDropTable;
import com.amazon.lexicon.sql.SQLSelect;
import com.amazon.lexicon.sql.SQLStatement;
import com.amazon.lexicon.sql.SQLUpdate;

import static com.amazon.lexicon.sql.SQLExpression.*;

/**
 * Converts records stored in the legacy model, where each locale has its own
 * copy of a record and copies are linked by a translation groups table, into
 * one record per group with localized rows per locale.
 *
 * <p>For each localized record type which still has a translation groups
 * table, every group member is rewritten through the regular write path with
 * its locale current, preserving whether it was published. Localized rows of
 * all members are then moved to the canonical record, which is the member in
 * the default locale or else the oldest member. The canonical record keeps
 * only its own version history. Once all types have been
 * converted, base rows of other locales, the legacy locale column and the
 * groups tables are removed.
 *
 * <p>The migration runs once, with elevated privileges, in a single
 * transaction. Any failure leaves the data unchanged.
 *
 * @see TranslationGroupMigrationBuilder
 */
public class TranslationGroupMigration {
    public static final String GROUP_ID = "TranslationGroupID";
    public static final String ORIGINAL_ID = "OriginalID";

    private static final String ID = "ID";
    private static final String CLASS_NAME = "ClassName";
    private static final String CREATED = "Created";

    private final LocaleState mLocaleState;
    private final LocaleRegistry mLocaleRegistry;
    private final RecordTypeRegistry mTypes;
    private final Database mDatabase;
    private final TransactionRunner mTransactions;
    private final PrivilegedExecutor mPrivileged;
    private final PublishWorkflow mWorkflow;
    private final RecordLoader mLoader;
    private final Log mLog;

    TranslationGroupMigration(TranslationGroupMigrationBuilder builder) {
        mLocaleState = builder.getLocaleState();
        mLocaleRegistry = mLocaleState.getRegistry();
        mTypes = builder.getRecordTypes();
        mDatabase = builder.getDatabase();
        mTransactions = builder.getTransactionRunner();
        mPrivileged = builder.getPrivilegedExecutor();
        mWorkflow = builder.getPublishWorkflow();
        mLoader = builder.getRecordLoader();
        Log log = builder.getLog();
        mLog = log == null ? new CommonsLog(TranslationGroupMigration.class) : log;
    }

    /**
     * Runs the full migration.
     *
     * @throws ConfigurationException if no locales or no default locale are
     * configured, before anything is changed
     * @throws PublishException if a published record could not be
     * republished, in which case nothing is changed
     */
    public MigrationResult run() throws RepositoryException {
        checkInstalled();
        final LocaleDefinition defaultLocale = mLocaleRegistry.getDefault();

        return mPrivileged.runPrivileged(new ScopedAction<MigrationResult>() {
            public MigrationResult run() throws RepositoryException {
                return mTransactions.inTransaction(new ScopedAction<MigrationResult>() {
                    public MigrationResult run() throws RepositoryException {
                        return migrate(defaultLocale);
                    }
                });
            }
        });
    }

    private void checkInstalled() throws ConfigurationException {
        List<LocaleDefinition> locales;
        try {
            locales = mLocaleRegistry.getLocales();
        } catch (ConfigurationException e) {
            throw new ConfigurationException
                ("Configure locales prior to migrating translation groups", e);
        }
        if (locales.isEmpty()) {
            throw new ConfigurationException
                ("Configure locales prior to migrating translation groups");
        }
        try {
            mLocaleRegistry.getDefault();
        } catch (ConfigurationException e) {
            throw new ConfigurationException
                ("Configure a default locale prior to migrating translation groups", e);
        }
    }

    private MigrationResult migrate(LocaleDefinition defaultLocale) throws RepositoryException {
        MigrationResult result = new MigrationResult();

        List<RecordType> types = mTypes.getTypesWith(LocalizedCapability.class);
        if (types.isEmpty()) {
            log("No record types are localized, so skipping.");
        }

        Map<String, String> tables = mDatabase.getTableList();
        List<RecordType> migrated = new ArrayList<RecordType>(types.size());
        List<String> groupTables = new ArrayList<String>(types.size());

        for (RecordType type : types) {
            String groupTable = findTable
                (tables, TableNames.translationGroupsTable(type.getBaseTable()));
            if (groupTable == null) {
                log("Ignoring record type without translation groups table: " + type.getName());
                continue;
            }
            migrateType(type, groupTable, tables, defaultLocale, result);
            migrated.add(type);
            groupTables.add(groupTable);
            result.typeMigrated();
        }

        // Schema changes last.
        for (int i=0; i<migrated.size(); i++) {
            prune(migrated.get(i), groupTables.get(i), tables, defaultLocale);
        }

        log("Migration finished: " + result);

        return result;
    }

    private void migrateType(RecordType type, String groupTable, Map<String, String> tables,
                             LocaleDefinition defaultLocale, MigrationResult result)
        throws RepositoryException
    {
        for (Long groupId : selectLongs(new SQLSelect()
                                        .addColumn(GROUP_ID, column(groupTable, GROUP_ID))
                                        .setFrom(groupTable)
                                        .setDistinct(true)
                                        .addOrderBy(column(groupTable, GROUP_ID)),
                                        GROUP_ID))
        {
            List<Long> itemIds = selectLongs
                (new SQLSelect()
                 .addColumn(ORIGINAL_ID, column(groupTable, ORIGINAL_ID))
                 .setFrom(groupTable)
                 .addWhere(eq(column(groupTable, GROUP_ID), param(groupId))),
                 ORIGINAL_ID);

            if (itemIds.isEmpty()) {
                continue;
            }

            TranslationGroup group = loadGroup(type, groupId, itemIds, result);
            if (group.isEmpty()) {
                log("Skipping empty translation group " + groupId + " of " + type.getName());
                continue;
            }

            log(group.getMembers().size() + " members for " + type.getName()
                + ": " + group.getItemIds() + " " + group.getMembers());

            long canonicalId = group.getCanonicalId(defaultLocale.getCode());

            for (TranslationGroup.Member member : group.getMembers()) {
                replay(type, member, canonicalId, result);
            }

            retire(type, canonicalId, group.getItemIds(), tables);
            adopt(type, canonicalId, tables, defaultLocale);
            repoint(type, canonicalId, group.getItemIds(), tables);

            result.groupMigrated();
        }
    }

    /**
     * Reads the legacy locale of each member straight from the base table,
     * since it is not part of the record type.
     */
    private TranslationGroup loadGroup(RecordType type, long groupId, List<Long> itemIds,
                                       MigrationResult result)
        throws FetchException
    {
        String base = type.getBaseTable();
        String localeColumn = TableNames.LOCALE;

        SQLSelect select = new SQLSelect()
            .addColumn(ID, column(base, ID))
            .addColumn(CLASS_NAME, column(base, CLASS_NAME))
            .addColumn(CREATED, column(base, CREATED))
            .addColumn(localeColumn, column(base, localeColumn))
            .setFrom(base)
            .addWhere(in(column(base, ID), itemIds))
            .addOrderBy(column(base, CREATED))
            .addOrderBy(column(base, ID));

        TranslationGroup group = new TranslationGroup(groupId, itemIds);

        for (Map<String, Object> row : mDatabase.select(select)) {
            long id = ((Number) row.get(ID)).longValue();
            String className = (String) row.get(CLASS_NAME);
            Object created = row.get(CREATED);
            String locale = (String) row.get(localeColumn);

            if (locale == null || locale.length() == 0) {
                log("Skipping " + className + " with ID " + id + ": couldn't find Locale");
                result.recordSkipped();
                continue;
            }

            if (!type.isCurrentClassName(className)) {
                log("Skipping " + className + " with ID " + id
                    + " because it is from an obsolete class");
                result.recordSkipped();
                continue;
            }

            if (mLocaleRegistry.findLocale(locale) == null) {
                log("Skipping " + className + " with ID " + id
                    + " because locale is not configured: " + locale);
                result.recordSkipped();
                continue;
            }

            TranslationGroup.Member replaced = group.add
                (new TranslationGroup.Member(id, className,
                                             created == null ? null : new DateTime(created),
                                             locale));
            if (replaced != null) {
                log("Replacing " + replaced + " with newer member of same locale: " + id);
                result.recordSkipped();
            }
        }

        return group;
    }

    private void replay(final RecordType type, final TranslationGroup.Member member,
                        long canonicalId, MigrationResult result)
        throws RepositoryException
    {
        final DataRecord record = mLoader.load(type, member.getId());
        if (record == null) {
            log("Skipping " + member + " because it could not be loaded");
            result.recordSkipped();
            return;
        }

        log("Updating " + member.getClassName() + " (" + member.getId()
            + ") [RecordID: " + canonicalId + "] with locale " + member.getLocale());

        mLocaleState.withLocale(member.getLocale(), new ScopedAction<Object>() {
            public Object run() throws RepositoryException {
                if (!mWorkflow.isPublished(record)) {
                    mWorkflow.writeToDraft(record);
                    log("  --  Saved to draft");
                } else if (!mWorkflow.publish(record)) {
                    log("  --  Publishing FAILED");
                    throw new PublishException
                        ("Failed to publish " + type.getName() + " " + member.getId()
                         + " in locale " + member.getLocale());
                } else {
                    log("  --  Published");
                }
                return null;
            }
        });

        result.recordReplayed();
    }

    /**
     * Deletes the base version rows of every group item other than the
     * canonical one, including rows written by the replay, so that the
     * canonical record keeps one row per version.
     */
    private void retire(RecordType type, long canonicalId, List<Long> itemIds,
                        Map<String, String> tables)
        throws RepositoryException
    {
        String table = findTable(tables, TableNames.versionsTable(type.getBaseTable()));
        if (table == null) {
            return;
        }
        List<Long> others = new ArrayList<Long>(itemIds.size());
        for (Long id : itemIds) {
            if (id.longValue() != canonicalId) {
                others.add(id);
            }
        }
        if (others.isEmpty()) {
            return;
        }
        execute(new SQLDelete(table)
                .addWhere(in(column(null, TableNames.RECORD_ID), others)));
    }

    /**
     * Marks the canonical record's legacy rows as being in the default
     * locale, so that pruning keeps them.
     */
    private void adopt(RecordType type, long canonicalId, Map<String, String> tables,
                       LocaleDefinition defaultLocale)
        throws RepositoryException
    {
        String base = type.getBaseTable();
        String[] names = {
            base, TableNames.stageTable(base, Stage.LIVE), TableNames.versionsTable(base)
        };
        for (String name : names) {
            String table = findTable(tables, name);
            if (table == null || !hasColumn(table, TableNames.LOCALE)) {
                continue;
            }
            String key = name.endsWith(TableNames.SUFFIX_VERSIONS) ? TableNames.RECORD_ID : ID;
            execute(new SQLUpdate(table)
                    .set(TableNames.LOCALE, defaultLocale.getCode())
                    .addWhere(eq(column(null, key), param(canonicalId))));
        }
    }

    /**
     * Moves rows written under each member's own ID to the canonical ID.
     */
    private void repoint(RecordType type, long canonicalId, List<Long> itemIds,
                         Map<String, String> tables)
        throws RepositoryException
    {
        List<String> names = new ArrayList<String>();
        LocalizedCapability localized = type.getCapability(LocalizedCapability.class);
        for (String table : localized.getLocalizedTables().keySet()) {
            names.add(TableNames.localizedTable(table));
            names.add(TableNames.localizedTable(table, Stage.LIVE));
            names.add(TableNames.localizedVersionsTable(table));
        }

        for (String name : names) {
            String table = findTable(tables, name);
            if (table == null) {
                continue;
            }
            execute(new SQLUpdate(table)
                    .set(TableNames.RECORD_ID, canonicalId)
                    .addWhere(in(column(null, TableNames.RECORD_ID), itemIds)));
        }
    }

    private void prune(RecordType type, String groupTable, Map<String, String> tables,
                       LocaleDefinition defaultLocale)
        throws RepositoryException
    {
        String base = type.getBaseTable();
        String[] names = {
            base, TableNames.versionsTable(base), TableNames.stageTable(base, Stage.LIVE)
        };

        // Delete old base rows which don't have the default locale.
        for (String name : names) {
            String table = findTable(tables, name);
            if (table == null || !hasColumn(table, TableNames.LOCALE)) {
                continue;
            }
            execute(new SQLDelete(table)
                    .addWhere(ne(column(null, TableNames.LOCALE),
                                 param(defaultLocale.getCode()))));
        }

        String baseTable = findTable(tables, base);
        if (baseTable != null && hasColumn(baseTable, TableNames.LOCALE)) {
            log("Dropping \"Locale\" column from " + baseTable);
            execute(new SQLDropColumn(baseTable, TableNames.LOCALE));
        }

        log("Deleting translation groups table " + groupTable);
        execute(new SQLDropTable(groupTable));
    }

    private List<Long> selectLongs(SQLSelect select, String column) throws FetchException {
        List<Map<String, Object>> rows = mDatabase.select(select);
        List<Long> values = new ArrayList<Long>(rows.size());
        for (Map<String, Object> row : rows) {
            Object value = row.get(column);
            if (value != null) {
                values.add(((Number) value).longValue());
            }
        }
        return values;
    }

    private void execute(SQLStatement statement) throws PersistException {
        log(statement.toString());
        mDatabase.execute(statement);
    }

    private boolean hasColumn(String table, String column) throws FetchException {
        Set<String> columns = mDatabase.getColumnNames(table);
        for (String name : columns) {
            if (name.equalsIgnoreCase(column)) {
                return true;
            }
        }
        return false;
    }

    private static String findTable(Map<String, String> tables, String name) {
        return tables.get(name.toLowerCase());
    }

    private void log(String message) {
        if (mLog.isEnabled()) {
            mLog.write(message);
        }
    }
}
