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

import java.util.List;

import org.joda.time.DateTime;

import com.amazon.lexicon.Stage;
import com.amazon.lexicon.VersioningMode;

import com.amazon.lexicon.capability.VersionedCapability;

import com.amazon.lexicon.info.RecordType;
import com.amazon.lexicon.info.TableInfo;

import com.amazon.lexicon.spi.QueryContext;

import com.amazon.lexicon.sql.SQLExpression;
import com.amazon.lexicon.sql.SQLSelect;

import static com.amazon.lexicon.sql.SQLExpression.*;

/**
 * Applies the stage and version rules of a versioned record type to a
 * select over its base tables. Stage reads of anything but draft go to the
 * live tables. Version reads go to the versions tables, where the record ID
 * is held by the RecordID column and rows are matched by version.
 */
class VersionedQueryAugmenter {
    static final String RECORD_ID = "RecordID";
    static final String WAS_PUBLISHED = "WasPublished";

    private static final String LATEST_ALIAS = "Latest";

    private final RecordType mType;

    VersionedQueryAugmenter(RecordType type) {
        mType = type;
    }

    /**
     * @throws com.amazon.lexicon.UnsupportedVersioningModeException if the
     * versioning mode is not recognized
     * @throws IllegalArgumentException if a parameter required by the mode
     * is missing
     */
    void augmentQuery(SQLSelect query, QueryContext context) {
        if (!mType.hasCapability(VersionedCapability.class)) {
            return;
        }

        VersioningMode mode = context.getVersioningMode();
        if (mode == null) {
            return;
        }

        switch (mode) {
        case STAGE:
        case STAGE_UNIQUE:
            if (context.getStage() != Stage.DRAFT) {
                for (TableInfo table : mType.getTables()) {
                    query.renameTable(table.getName(),
                                      JDBCRecordStorage.liveTable(table.getName()));
                }
            }
            return;

        case VERSION:
            Integer version = context.getVersion();
            if (version == null) {
                throw new IllegalArgumentException("Version is required for mode " + mode);
            }
            useVersionsTables(query);
            query.addWhere(eq(versionColumn(), param(version)));
            return;

        case ALL_VERSIONS:
            useVersionsTables(query);
            query.addOrderBy(versionColumn());
            return;

        case LATEST_VERSIONS:
            useVersionsTables(query);
            query.addWhere(eq(versionColumn(), subSelect(maxVersion(null))));
            return;

        case ARCHIVE:
            DateTime date = context.getDate();
            if (date == null) {
                throw new IllegalArgumentException("Date is required for mode " + mode);
            }
            useVersionsTables(query);
            query.addWhere(eq(versionColumn(), subSelect(maxVersion(date))));
            return;

        default:
            throw new IllegalStateException("Unhandled mode: " + mode);
        }
    }

    private SQLExpression versionColumn() {
        return column(mType.getBaseTable(), VersionedCapability.VERSION_COLUMN);
    }

    private void useVersionsTables(SQLSelect query) {
        String base = mType.getBaseTable();
        String version = VersionedCapability.VERSION_COLUMN;

        List<TableInfo> tables = mType.getTables();
        for (TableInfo table : tables) {
            query.renameTable(table.getName(), JDBCRecordStorage.versionsTable(table.getName()));
        }

        // Versions rows have their own ID.
        query.replaceColumn(base, "ID", column(base, RECORD_ID));

        for (TableInfo table : tables) {
            String name = table.getName();
            if (!name.equals(base) && query.hasAlias(name)) {
                query.setJoinFilter(name, and(eq(column(base, RECORD_ID), column(name, RECORD_ID)),
                                              eq(column(base, version), column(name, version))));
            }
        }
    }

    /**
     * Returns the highest version of the outer record, which was published
     * no later than the given date if not null.
     */
    private SQLSelect maxVersion(DateTime date) {
        String base = mType.getBaseTable();
        SQLSelect select = new SQLSelect()
            .addColumn(VersionedCapability.VERSION_COLUMN,
                       max(column(LATEST_ALIAS, VersionedCapability.VERSION_COLUMN)))
            .setFrom(JDBCRecordStorage.versionsTable(base), LATEST_ALIAS)
            .addWhere(eq(column(LATEST_ALIAS, RECORD_ID), column(base, RECORD_ID)));
        if (date != null) {
            select.addWhere(le(column(LATEST_ALIAS, "LastEdited"), param(date)));
            select.addWhere(eq(column(LATEST_ALIAS, WAS_PUBLISHED), param(Boolean.TRUE)));
        }
        return select;
    }
}
