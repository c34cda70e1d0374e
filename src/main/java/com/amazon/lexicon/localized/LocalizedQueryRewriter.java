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

package com.amazon.lexicon.localized;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.amazon.lexicon.Stage;
import com.amazon.lexicon.VersioningMode;

import com.amazon.lexicon.capability.LocalizedCapability;
import com.amazon.lexicon.capability.VersionedCapability;

import com.amazon.lexicon.info.RecordType;

import com.amazon.lexicon.locale.LocaleDefinition;
import com.amazon.lexicon.locale.LocaleRegistry;

import com.amazon.lexicon.spi.QueryContext;

import com.amazon.lexicon.sql.SQLExpression;
import com.amazon.lexicon.sql.SQLSelect;
import com.amazon.lexicon.sql.TableReference;

import static com.amazon.lexicon.sql.SQLExpression.*;

/**
 * Rewrites selects of one record type so that localized fields are read
 * from the localized tables of the requested locale.
 *
 * <p>Every table with localized fields is joined to its localized table for
 * the current locale. Reads of a non-draft stage are redirected to the live
 * localized tables, and version reads to the localized versions tables,
 * joined once per locale of the fallback chain and matched on version.
 * Finally each localized column is replaced by the first non-null value in
 * join order, falling back to the base row.
 */
public class LocalizedQueryRewriter {
    private final RecordType mType;
    private final LocalizedCapability mLocalized;
    private final boolean mVersioned;
    private final LocaleRegistry mRegistry;

    public LocalizedQueryRewriter(RecordType type, LocaleRegistry registry) {
        LocalizedCapability localized = type.getCapability(LocalizedCapability.class);
        if (localized == null) {
            throw new IllegalArgumentException("Record type is not localized: " + type.getName());
        }
        mType = type;
        mLocalized = localized;
        mVersioned = type.hasCapability(VersionedCapability.class);
        mRegistry = registry;
    }

    public RecordType getRecordType() {
        return mType;
    }

    /**
     * Rewrites the given query in place. Does nothing if the context has no
     * locale.
     *
     * @throws com.amazon.lexicon.UnsupportedVersioningModeException if the
     * versioning mode is not recognized, in which case the query is not
     * changed
     */
    public void rewrite(SQLSelect query, QueryContext context) {
        LocaleDefinition locale = context.getLocale();
        if (locale == null) {
            return;
        }

        VersioningMode mode = mVersioned ? context.getVersioningMode() : null;

        Map<String, List<String>> tables = getLocalizedTables(query);
        if (tables.isEmpty()) {
            return;
        }

        for (String table : tables.keySet()) {
            addLocaleJoin(query, table, locale);
        }

        List<LocaleDefinition> joinedLocales = Collections.singletonList(locale);

        if (mode != null) {
            switch (mode) {
            case STAGE:
            case STAGE_UNIQUE:
                // Draft reads stay on the unsuffixed tables.
                if (context.getStage() != Stage.DRAFT) {
                    renameLocalizedTables(query, tables);
                }
                break;
            case ARCHIVE:
            case ALL_VERSIONS:
            case LATEST_VERSIONS:
            case VERSION:
                joinedLocales = mRegistry.resolveChain(locale);
                rewriteVersionedTables(query, tables, joinedLocales);
                break;
            default:
                throw new IllegalStateException("Unhandled mode: " + mode);
            }
        }

        coalesceLocalizedFields(query, tables, joinedLocales);
    }

    /**
     * Returns the localized tables of this type which the query selects
     * from, with their localized fields.
     */
    private Map<String, List<String>> getLocalizedTables(SQLSelect query) {
        Map<String, List<String>> tables = new LinkedHashMap<String, List<String>>();
        for (Map.Entry<String, List<String>> entry : mLocalized.getLocalizedTables().entrySet()) {
            if (query.hasAlias(entry.getKey())) {
                tables.put(entry.getKey(), entry.getValue());
            }
        }
        return tables;
    }

    private void addLocaleJoin(SQLSelect query, String table, LocaleDefinition locale) {
        String alias = TableNames.localizedAlias(table, locale.getCode());
        query.addLeftJoin(TableNames.localizedTable(table), alias,
                          and(eq(column(table, "ID"), column(alias, TableNames.RECORD_ID)),
                              eq(column(alias, TableNames.LOCALE), param(locale.getCode()))));
    }

    private void renameLocalizedTables(SQLSelect query, Map<String, List<String>> tables) {
        for (String table : tables.keySet()) {
            query.renameTable(TableNames.localizedTable(table),
                              TableNames.localizedTable(table, Stage.LIVE));
        }
    }

    private void rewriteVersionedTables(SQLSelect query, Map<String, List<String>> tables,
                                        List<LocaleDefinition> chain)
    {
        TableReference root = query.getRoot();
        if (root == null) {
            throw new IllegalArgumentException("Query has no root table");
        }
        String base = root.getAlias();

        for (String table : tables.keySet()) {
            String versionsTable = TableNames.localizedVersionsTable(table);
            query.renameTable(TableNames.localizedTable(table), versionsTable);
            addLocaleFallbackChain(query, base, table, versionsTable, chain);
        }
    }

    // Version must match the base versions row, or rows of other versions
    // would be joined.
    private void addLocaleFallbackChain(SQLSelect query, String base, String table,
                                        String versionsTable, List<LocaleDefinition> chain)
    {
        String version = VersionedCapability.VERSION_COLUMN;
        for (LocaleDefinition joinLocale : chain) {
            String alias = TableNames.localizedAlias(table, joinLocale.getCode());
            SQLExpression filter =
                and(eq(column(base, TableNames.RECORD_ID), column(alias, TableNames.RECORD_ID)),
                    eq(column(alias, TableNames.LOCALE), param(joinLocale.getCode())),
                    eq(column(alias, version), column(base, version)));
            if (query.hasAlias(alias)) {
                query.setJoinFilter(alias, filter);
            } else {
                query.addLeftJoin(versionsTable, alias, filter);
            }
        }
    }

    private void coalesceLocalizedFields(SQLSelect query, Map<String, List<String>> tables,
                                         List<LocaleDefinition> locales)
    {
        for (Map.Entry<String, List<String>> entry : tables.entrySet()) {
            String table = entry.getKey();
            for (String field : entry.getValue()) {
                List<SQLExpression> args = new ArrayList<SQLExpression>(locales.size() + 1);
                for (LocaleDefinition locale : locales) {
                    args.add(column(TableNames.localizedAlias(table, locale.getCode()), field));
                }
                args.add(column(table, field));
                query.replaceColumn(table, field, coalesce(args));
            }
        }
    }
}
