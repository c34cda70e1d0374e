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

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;

import org.cojen.util.KeyFactory;

import com.amazon.lexicon.FetchException;

import com.amazon.lexicon.spi.Database;

import com.amazon.lexicon.sql.SQLSelect;

import static com.amazon.lexicon.sql.SQLExpression.*;

/**
 * Memoizes whether a record has a row in a localized table for a locale.
 * Answers may also be prepopulated for a whole table and locale at once, in
 * which case an ID not loaded is known to have no row.
 *
 * <p>Cached answers become stale after writes, and so {@link #flush} must be
 * called whenever a localized table is written to.
 */
public class LocaleExistenceCache {
    private final Log mLog = LogFactory.getLog(getClass());

    private final Database mDatabase;

    // Composite key of table, locale and record ID.
    private final Map<Object, Boolean> mMemo;

    // Composite key of table and locale.
    private final Map<Object, Set<Long>> mPrepopulated;

    public LocaleExistenceCache(Database database) {
        if (database == null) {
            throw new IllegalArgumentException("Database is required");
        }
        mDatabase = database;
        mMemo = new HashMap<Object, Boolean>();
        mPrepopulated = new HashMap<Object, Set<Long>>();
    }

    /**
     * Returns true if the given localized table has a row for the record in
     * the locale.
     */
    public boolean contains(String table, String locale, long recordId)
        throws FetchException
    {
        Set<Long> ids = mPrepopulated.get(KeyFactory.createKey(new Object[] {table, locale}));
        if (ids != null) {
            return ids.contains(recordId);
        }

        Object key = KeyFactory.createKey(new Object[] {table, locale, recordId});
        Boolean exists = mMemo.get(key);
        if (exists == null) {
            SQLSelect select = new SQLSelect()
                .addColumn(TableNames.RECORD_ID, column(table, TableNames.RECORD_ID))
                .setFrom(table)
                .addWhere(eq(column(table, TableNames.RECORD_ID), param(recordId)))
                .addWhere(eq(column(table, TableNames.LOCALE), param(locale)))
                .setLimit(1);
            exists = !mDatabase.select(select).isEmpty();
            mMemo.put(key, exists);
        }
        return exists;
    }

    /**
     * Loads the IDs of all records which have a row in the given localized
     * table for the locale. Subsequent lookups against the same table and
     * locale are answered without queries.
     */
    public void prepopulate(String table, String locale) throws FetchException {
        SQLSelect select = new SQLSelect()
            .addColumn(TableNames.RECORD_ID, column(table, TableNames.RECORD_ID))
            .setFrom(table)
            .addWhere(eq(column(table, TableNames.LOCALE), param(locale)));

        List<Map<String, Object>> rows = mDatabase.select(select);
        Set<Long> ids = new HashSet<Long>(rows.size() * 2);
        for (Map<String, Object> row : rows) {
            Object id = row.get(TableNames.RECORD_ID);
            if (id != null) {
                ids.add(((Number) id).longValue());
            }
        }

        mPrepopulated.put(KeyFactory.createKey(new Object[] {table, locale}), ids);

        if (mLog.isDebugEnabled()) {
            mLog.debug("Prepopulated " + ids.size() + " records of " + table + " in " + locale);
        }
    }

    public boolean isPrepopulated(String table, String locale) {
        return mPrepopulated.containsKey(KeyFactory.createKey(new Object[] {table, locale}));
    }

    /**
     * Discards all memoized and prepopulated answers.
     */
    public void flush() {
        mMemo.clear();
        mPrepopulated.clear();
    }
}
