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

import com.amazon.lexicon.Stage;

/**
 * Naming scheme of physical tables. A base table name is never given a
 * locale suffix; locale codes only appear in join aliases.
 */
public class TableNames {
    public static final String SUFFIX_LOCALISED = "_Localised";
    public static final String SUFFIX_LIVE = Stage.LIVE.getTableSuffix();
    public static final String SUFFIX_VERSIONS = "_Versions";
    public static final String SUFFIX_TRANSLATION_GROUPS = "_translationgroups";

    public static final String RECORD_ID = "RecordID";
    public static final String LOCALE = "Locale";

    private TableNames() {
    }

    /**
     * Returns the draft localized table of the given table.
     */
    public static String localizedTable(String table) {
        return table + SUFFIX_LOCALISED;
    }

    /**
     * Returns the localized table of the given table for a stage.
     */
    public static String localizedTable(String table, Stage stage) {
        return localizedTable(table) + stage.getTableSuffix();
    }

    public static String localizedVersionsTable(String table) {
        return localizedTable(table) + SUFFIX_VERSIONS;
    }

    /**
     * Returns the alias under which the localized table of the given table
     * is joined for a locale.
     */
    public static String localizedAlias(String table, String locale) {
        return localizedTable(table) + '_' + locale;
    }

    public static String stageTable(String table, Stage stage) {
        return table + stage.getTableSuffix();
    }

    public static String versionsTable(String table) {
        return table + SUFFIX_VERSIONS;
    }

    /**
     * Returns the legacy table which grouped per-locale copies of records.
     */
    public static String translationGroupsTable(String baseTable) {
        return baseTable + SUFFIX_TRANSLATION_GROUPS;
    }
}
