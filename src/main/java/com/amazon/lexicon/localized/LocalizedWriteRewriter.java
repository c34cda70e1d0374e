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

import java.util.List;
import java.util.Map;

import com.amazon.lexicon.Stage;

import com.amazon.lexicon.capability.LocalizedCapability;
import com.amazon.lexicon.capability.VersionedCapability;

import com.amazon.lexicon.info.RecordType;

import com.amazon.lexicon.locale.LocaleDefinition;

import com.amazon.lexicon.spi.WriteContext;

import com.amazon.lexicon.sql.SQLManipulation;
import com.amazon.lexicon.sql.TableManipulation;

/**
 * Rewrites writes of one record type so that localized field values go to
 * the localized tables of the current locale.
 *
 * <p>For every base write of a table with localized fields, a write of the
 * localized values is added against the localized table with the same stage
 * or versions suffix. Draft and live rows are upserted by record ID and
 * locale, and versions rows are appended. Unless the locale is the default,
 * the localized values are then removed from the base write, so the base row
 * keeps the default locale's values.
 */
public class LocalizedWriteRewriter {
    private static final String[] VERSIONED_SUFFIXES = {
        "", TableNames.SUFFIX_LIVE, TableNames.SUFFIX_VERSIONS
    };

    private static final String[] UNVERSIONED_SUFFIXES = {""};

    private final RecordType mType;
    private final LocalizedCapability mLocalized;
    private final boolean mVersioned;

    public LocalizedWriteRewriter(RecordType type) {
        LocalizedCapability localized = type.getCapability(LocalizedCapability.class);
        if (localized == null) {
            throw new IllegalArgumentException("Record type is not localized: " + type.getName());
        }
        mType = type;
        mLocalized = localized;
        mVersioned = type.hasCapability(VersionedCapability.class);
    }

    public RecordType getRecordType() {
        return mType;
    }

    /**
     * Rewrites the given write in place. Does nothing if the context has no
     * locale.
     */
    public void rewrite(SQLManipulation manipulation, WriteContext context) {
        LocaleDefinition locale = context.getLocale();
        if (locale == null) {
            return;
        }

        String[] suffixes = mVersioned ? VERSIONED_SUFFIXES : UNVERSIONED_SUFFIXES;

        for (Map.Entry<String, List<String>> entry : mLocalized.getLocalizedTables().entrySet()) {
            String table = entry.getKey();
            for (String suffix : suffixes) {
                localizeTable(manipulation, table + suffix,
                              TableNames.localizedTable(table) + suffix,
                              entry.getValue(), locale,
                              TableNames.SUFFIX_VERSIONS.equals(suffix));
            }
        }
    }

    private void localizeTable(SQLManipulation manipulation, String source, String target,
                               List<String> fields, LocaleDefinition locale, boolean versions)
    {
        TableManipulation base = manipulation.get(source);
        if (base == null || base.getCommand() == TableManipulation.Command.DELETE) {
            return;
        }

        long recordId = base.getRecordId();
        TableManipulation localized;

        if (versions) {
            String version = VersionedCapability.VERSION_COLUMN;
            localized = new TableManipulation(TableManipulation.Command.INSERT, recordId)
                .setField(TableNames.RECORD_ID, recordId)
                .setField(TableNames.LOCALE, locale.getCode())
                .setField(version, base.getField(version));
        } else {
            localized = new TableManipulation(TableManipulation.Command.UPSERT, recordId)
                .setKey(TableNames.RECORD_ID, recordId)
                .setKey(TableNames.LOCALE, locale.getCode());
        }

        for (String field : fields) {
            if (base.hasField(field)) {
                localized.setField(field, base.getField(field));
            }
        }

        manipulation.put(target, localized);

        if (!locale.isDefault()) {
            for (String field : fields) {
                base.removeField(field);
            }
        }
    }

    /**
     * Returns the localized table which deletes from the given stage must
     * also apply to.
     */
    public String getDeleteTableTarget(String table, Stage stage) {
        if (mVersioned && stage == Stage.LIVE) {
            return TableNames.localizedTable(table, Stage.LIVE);
        }
        return TableNames.localizedTable(table);
    }

    /**
     * Extends a delete of a record from a stage to the localized rows of
     * every locale in that stage.
     */
    public void rewriteDelete(SQLManipulation manipulation, WriteContext context) {
        Stage stage = mVersioned ? context.getStage() : Stage.DRAFT;
        for (String table : mLocalized.getLocalizedTables().keySet()) {
            TableManipulation base = manipulation.get(TableNames.stageTable(table, stage));
            if (base == null || base.getCommand() != TableManipulation.Command.DELETE) {
                continue;
            }
            long recordId = base.getRecordId();
            manipulation.put(getDeleteTableTarget(table, stage),
                             new TableManipulation(TableManipulation.Command.DELETE, recordId)
                             .setKey(TableNames.RECORD_ID, recordId));
        }
    }

    /**
     * Returns a manipulation which removes only the given locale's rows of a
     * record from the context's stage. The base rows are not touched.
     */
    public SQLManipulation buildLocaleDelete(long recordId, String locale, Stage stage) {
        if (!mVersioned) {
            stage = Stage.DRAFT;
        }
        SQLManipulation manipulation = new SQLManipulation();
        for (String table : mLocalized.getLocalizedTables().keySet()) {
            manipulation.put(getDeleteTableTarget(table, stage),
                             new TableManipulation(TableManipulation.Command.DELETE, recordId)
                             .setKey(TableNames.RECORD_ID, recordId)
                             .setKey(TableNames.LOCALE, locale));
        }
        return manipulation;
    }
}
