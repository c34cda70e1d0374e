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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;

import com.amazon.lexicon.ConfigurationException;
import com.amazon.lexicon.DataRecord;
import com.amazon.lexicon.FetchException;
import com.amazon.lexicon.PersistException;
import com.amazon.lexicon.RepositoryException;
import com.amazon.lexicon.ScopedAction;

import com.amazon.lexicon.capability.LocalizedCapability;

import com.amazon.lexicon.info.RecordType;
import com.amazon.lexicon.info.RecordTypeRegistry;

import com.amazon.lexicon.locale.LocaleRegistry;
import com.amazon.lexicon.locale.LocaleState;

import com.amazon.lexicon.localized.LocalizedAugmenter;
import com.amazon.lexicon.localized.LocalizedSchema;

import com.amazon.lexicon.migrate.TranslationGroupMigration;
import com.amazon.lexicon.migrate.TranslationGroupMigrationBuilder;

import com.amazon.lexicon.spi.PrivilegedExecutor;
import com.amazon.lexicon.spi.PublishWorkflow;
import com.amazon.lexicon.spi.RecordAugmenter;
import com.amazon.lexicon.spi.RecordLoader;
import com.amazon.lexicon.spi.TransactionRunner;

import com.amazon.lexicon.sql.TableDefinition;

/**
 * Repository of records backed by a JDBC accessible database. Each
 * registered record type gets a storage, and localized types get an
 * augmenter which stores their localized fields per locale.
 *
 * @see LocalizedRepositoryBuilder
 */
public class LocalizedRepository implements RecordLoader {
    private final Log mLog = LogFactory.getLog(getClass());

    private final String mName;
    private final JDBCDatabase mDatabase;
    private final LocaleState mLocaleState;
    private final RecordTypeRegistry mRecordTypes;
    private final Map<String, JDBCRecordStorage> mStorages;
    private final Map<String, LocalizedAugmenter> mAugmenters;
    private final PrivilegedExecutor mPrivilegedExecutor;
    private final PublishWorkflow mPublishWorkflow;

    LocalizedRepository(LocalizedRepositoryBuilder builder) throws RepositoryException {
        mName = builder.getName();
        mDatabase = new JDBCDatabase(builder.getDataSource(), builder.getDialect());
        mLocaleState = new LocaleState(builder.getLocaleRegistry());

        mRecordTypes = new RecordTypeRegistry();
        mStorages = new LinkedHashMap<String, JDBCRecordStorage>();
        mAugmenters = new LinkedHashMap<String, LocalizedAugmenter>();

        for (RecordType type : builder.getRecordTypes()) {
            mRecordTypes.register(type);

            List<RecordAugmenter> augmenters = new ArrayList<RecordAugmenter>(1);
            if (type.hasCapability(LocalizedCapability.class)) {
                LocalizedAugmenter augmenter = new LocalizedAugmenter(type, mLocaleState, mDatabase);
                mAugmenters.put(type.getName(), augmenter);
                augmenters.add(augmenter);
            }

            mStorages.put(type.getName(),
                          new JDBCRecordStorage(type, mDatabase, mLocaleState, augmenters));
        }

        PrivilegedExecutor executor = builder.getPrivilegedExecutor();
        mPrivilegedExecutor = executor == null ? new DirectExecutor() : executor;
        mPublishWorkflow = new JDBCPublishWorkflow(this);

        if (builder.isSchemaInstalled()) {
            installSchema();
        }
    }

    public String getName() {
        return mName;
    }

    public JDBCDatabase getDatabase() {
        return mDatabase;
    }

    public TransactionRunner getTransactionRunner() {
        return mDatabase;
    }

    public LocaleState getLocaleState() {
        return mLocaleState;
    }

    public LocaleRegistry getLocaleRegistry() {
        return mLocaleState.getRegistry();
    }

    public RecordTypeRegistry getRecordTypes() {
        return mRecordTypes;
    }

    public PublishWorkflow getPublishWorkflow() {
        return mPublishWorkflow;
    }

    public PrivilegedExecutor getPrivilegedExecutor() {
        return mPrivilegedExecutor;
    }

    /**
     * @throws IllegalArgumentException if type is not registered
     */
    public JDBCRecordStorage getStorage(String typeName) {
        JDBCRecordStorage storage = mStorages.get(typeName);
        if (storage == null) {
            throw new IllegalArgumentException("Record type is not registered: " + typeName);
        }
        return storage;
    }

    /**
     * Returns the augmenter of a localized type, or null if the type is not
     * localized.
     */
    public LocalizedAugmenter getLocalizedAugmenter(String typeName) {
        return mAugmenters.get(typeName);
    }

    public DataRecord load(RecordType type, long id) throws FetchException {
        return getStorage(type.getName()).load(id);
    }

    /**
     * Creates all tables which are missing, including localized tables.
     */
    public void installSchema() throws PersistException {
        for (JDBCRecordStorage storage : mStorages.values()) {
            List<TableDefinition> definitions = storage.getTableDefinitions();
            definitions.addAll(LocalizedSchema.getTableDefinitions(storage.getRecordType()));
            for (TableDefinition definition : definitions) {
                mDatabase.createTable(definition);
            }
        }
        if (mLog.isDebugEnabled()) {
            mLog.debug("Installed schema of repository " + mName);
        }
    }

    /**
     * Returns a migration builder with every collaborator set to those of
     * this repository.
     */
    public TranslationGroupMigrationBuilder createMigrationBuilder() {
        TranslationGroupMigrationBuilder builder = new TranslationGroupMigrationBuilder();
        builder.setLocaleState(mLocaleState);
        builder.setRecordTypes(mRecordTypes);
        builder.setDatabase(mDatabase);
        builder.setTransactionRunner(mDatabase);
        builder.setPrivilegedExecutor(mPrivilegedExecutor);
        builder.setPublishWorkflow(mPublishWorkflow);
        builder.setRecordLoader(this);
        return builder;
    }

    public TranslationGroupMigration createMigration() throws ConfigurationException {
        return createMigrationBuilder().build();
    }

    @Override
    public String toString() {
        return "LocalizedRepository {name=" + mName + ", types=" + mStorages.keySet() + '}';
    }

    /**
     * Runs actions without changing privileges, for hosts which have no
     * privilege model.
     */
    private static class DirectExecutor implements PrivilegedExecutor {
        public <T> T runPrivileged(ScopedAction<T> action) throws RepositoryException {
            return action.run();
        }
    }
}
