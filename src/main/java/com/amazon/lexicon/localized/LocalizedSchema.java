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
import java.util.List;
import java.util.Map;

import com.amazon.lexicon.Stage;

import com.amazon.lexicon.capability.LocalizedCapability;
import com.amazon.lexicon.capability.VersionedCapability;

import com.amazon.lexicon.info.RecordType;
import com.amazon.lexicon.info.TableInfo;

import com.amazon.lexicon.sql.ColumnType;
import com.amazon.lexicon.sql.TableDefinition;

/**
 * Defines the localized tables of a record type. Each table with localized
 * fields gets a draft localized table, and versioned types also get live and
 * versions localized tables.
 */
public class LocalizedSchema {
    public static final String RECORD_INDEX = "RecordLocale";
    public static final String VERSION_INDEX = "RecordLocaleVersion";

    private LocalizedSchema() {
    }

    public static List<TableDefinition> getTableDefinitions(RecordType type) {
        List<TableDefinition> definitions = new ArrayList<TableDefinition>();

        LocalizedCapability localized = type.getCapability(LocalizedCapability.class);
        if (localized == null) {
            return definitions;
        }

        boolean versioned = type.hasCapability(VersionedCapability.class);

        for (Map.Entry<String, List<String>> entry : localized.getLocalizedTables().entrySet()) {
            String table = entry.getKey();
            TableInfo info = type.getTable(table);

            definitions.add(stageTable(TableNames.localizedTable(table), info, entry.getValue()));

            if (versioned) {
                definitions.add(stageTable(TableNames.localizedTable(table, Stage.LIVE),
                                           info, entry.getValue()));

                TableDefinition versions =
                    new TableDefinition(TableNames.localizedVersionsTable(table));
                addKeyColumns(versions);
                versions.addColumn(VersionedCapability.VERSION_COLUMN, ColumnType.INTEGER);
                addFieldColumns(versions, info, entry.getValue());
                versions.addUniqueIndex(VERSION_INDEX, TableNames.RECORD_ID, TableNames.LOCALE,
                                        VersionedCapability.VERSION_COLUMN);
                definitions.add(versions);
            }
        }

        return definitions;
    }

    private static TableDefinition stageTable(String name, TableInfo info, List<String> fields) {
        TableDefinition def = new TableDefinition(name);
        addKeyColumns(def);
        addFieldColumns(def, info, fields);
        def.addUniqueIndex(RECORD_INDEX, TableNames.RECORD_ID, TableNames.LOCALE);
        return def;
    }

    private static void addKeyColumns(TableDefinition def) {
        def.addColumn("ID", ColumnType.IDENTITY);
        def.addColumn(TableNames.RECORD_ID, ColumnType.BIGINT);
        def.addColumn(TableNames.LOCALE, ColumnType.LOCALE);
    }

    private static void addFieldColumns(TableDefinition def, TableInfo info, List<String> fields) {
        for (String field : fields) {
            def.addColumn(field, info.getFieldType(field));
        }
    }
}
