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

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;

import com.amazon.lexicon.ConfigurationException;
import com.amazon.lexicon.FetchException;
import com.amazon.lexicon.PersistException;
import com.amazon.lexicon.Stage;

import com.amazon.lexicon.capability.LocalizedCapability;
import com.amazon.lexicon.capability.VersionedCapability;

import com.amazon.lexicon.info.RecordType;

import com.amazon.lexicon.locale.LocaleDefinition;
import com.amazon.lexicon.locale.LocaleState;

import com.amazon.lexicon.spi.Database;
import com.amazon.lexicon.spi.QueryContext;
import com.amazon.lexicon.spi.RecordAugmenter;
import com.amazon.lexicon.spi.WriteContext;

import com.amazon.lexicon.sql.SQLManipulation;
import com.amazon.lexicon.sql.SQLSelect;

/**
 * Augmenter which stores the localized fields of one record type per
 * locale. Also answers whether a record has been written in a locale.
 *
 * @see LocalizedQueryRewriter
 * @see LocalizedWriteRewriter
 */
public class LocalizedAugmenter implements RecordAugmenter {
    private final Log mLog = LogFactory.getLog(getClass());

    private final RecordType mType;
    private final LocaleState mLocaleState;
    private final Database mDatabase;
    private final boolean mVersioned;
    private final boolean mPrepopulated;
    private final String mExistenceTable;

    private final LocalizedQueryRewriter mQueryRewriter;
    private final LocalizedWriteRewriter mWriteRewriter;
    private final LocaleExistenceCache mCache;

    /**
     * @throws ConfigurationException if no locales or no default locale
     * are configured
     */
    public LocalizedAugmenter(RecordType type, LocaleState localeState, Database database)
        throws ConfigurationException
    {
        if (type == null || localeState == null || database == null) {
            throw new IllegalArgumentException();
        }
        LocalizedCapability localized = type.getCapability(LocalizedCapability.class);
        if (localized == null || localized.getLocalizedTables().isEmpty()) {
            throw new IllegalArgumentException("Record type is not localized: " + type.getName());
        }

        // Fails unless locales and a default locale are configured.
        localeState.getRegistry().getLocales();
        localeState.getRegistry().getDefault();

        mType = type;
        mLocaleState = localeState;
        mDatabase = database;
        mVersioned = type.hasCapability(VersionedCapability.class);
        mPrepopulated = localized.isPrepopulated();

        // Every write adds a row to each localized table, so any of them
        // tells whether a record exists in a locale.
        String base = type.getBaseTable();
        if (localized.getLocalizedTables().containsKey(base)) {
            mExistenceTable = base;
        } else {
            mExistenceTable = localized.getLocalizedTables().keySet().iterator().next();
        }

        mQueryRewriter = new LocalizedQueryRewriter(type, localeState.getRegistry());
        mWriteRewriter = new LocalizedWriteRewriter(type);
        mCache = new LocaleExistenceCache(database);
    }

    public RecordType getRecordType() {
        return mType;
    }

    public void augmentQuery(SQLSelect query, QueryContext context) {
        mQueryRewriter.rewrite(query, context);
    }

    public void augmentWrite(SQLManipulation manipulation, WriteContext context) {
        mWriteRewriter.rewrite(manipulation, context);
    }

    public void augmentDelete(SQLManipulation manipulation, WriteContext context) {
        mWriteRewriter.rewriteDelete(manipulation, context);
    }

    public void afterWrite(long recordId) {
        mCache.flush();
    }

    /**
     * Returns true if the record has draft content in the current locale.
     */
    public boolean isDraftedInLocale(long recordId) throws FetchException {
        return isDraftedInLocale(recordId, mLocaleState.getLocaleCode());
    }

    /**
     * Returns true if the record has draft content in the given locale,
     * which is false if locale is null.
     */
    public boolean isDraftedInLocale(long recordId, String locale) throws FetchException {
        return isStoredInLocale(recordId, locale, Stage.DRAFT);
    }

    /**
     * Returns true if the record has published content in the current
     * locale.
     */
    public boolean isPublishedInLocale(long recordId) throws FetchException {
        return isPublishedInLocale(recordId, mLocaleState.getLocaleCode());
    }

    /**
     * Returns true if the record has published content in the given locale,
     * which is false if locale is null. Records of unversioned types are
     * published as soon as they are written.
     */
    public boolean isPublishedInLocale(long recordId, String locale) throws FetchException {
        return isStoredInLocale(recordId, locale, mVersioned ? Stage.LIVE : Stage.DRAFT);
    }

    public boolean existsInLocale(long recordId) throws FetchException {
        return existsInLocale(recordId, mLocaleState.getLocaleCode());
    }

    /**
     * Returns true if the record has draft or published content in the
     * given locale.
     */
    public boolean existsInLocale(long recordId, String locale) throws FetchException {
        return isDraftedInLocale(recordId, locale) || isPublishedInLocale(recordId, locale);
    }

    private boolean isStoredInLocale(long recordId, String locale, Stage stage)
        throws FetchException
    {
        if (locale == null) {
            return false;
        }
        String table = TableNames.localizedTable(mExistenceTable, stage);
        if (mPrepopulated && !mCache.isPrepopulated(table, locale)) {
            mCache.prepopulate(table, locale);
        }
        return mCache.contains(table, locale, recordId);
    }

    /**
     * Loads existence answers of all records in the given locale, for draft
     * and live content.
     */
    public void prepopulate(String locale) throws FetchException {
        mCache.prepopulate(TableNames.localizedTable(mExistenceTable, Stage.DRAFT), locale);
        if (mVersioned) {
            mCache.prepopulate(TableNames.localizedTable(mExistenceTable, Stage.LIVE), locale);
        }
    }

    public void flushCache() {
        mCache.flush();
    }

    /**
     * Removes only the context locale's content of a record from the
     * context's stage. Base rows and other locales are not changed.
     *
     * @throws IllegalArgumentException if context has no locale
     */
    public void deleteFromLocale(long recordId, WriteContext context) throws PersistException {
        LocaleDefinition locale = context.getLocale();
        if (locale == null) {
            throw new IllegalArgumentException("Locale is required");
        }
        if (mLog.isDebugEnabled()) {
            mLog.debug("Deleting " + mType.getName() + " " + recordId
                       + " from locale " + locale.getCode() + " in " + context.getStage());
        }
        try {
            mDatabase.execute
                (mWriteRewriter.buildLocaleDelete(recordId, locale.getCode(), context.getStage()));
        } finally {
            mCache.flush();
        }
    }

    @Override
    public String toString() {
        return "LocalizedAugmenter {type=" + mType.getName() + '}';
    }
}
