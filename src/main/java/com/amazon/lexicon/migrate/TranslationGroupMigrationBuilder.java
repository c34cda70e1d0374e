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
import java.util.Collection;

import com.amazon.lexicon.ConfigurationException;

import com.amazon.lexicon.info.RecordTypeRegistry;

import com.amazon.lexicon.locale.LocaleState;

import com.amazon.lexicon.spi.Database;
import com.amazon.lexicon.spi.PrivilegedExecutor;
import com.amazon.lexicon.spi.PublishWorkflow;
import com.amazon.lexicon.spi.RecordLoader;
import com.amazon.lexicon.spi.TransactionRunner;

/**
 * Builds a {@link TranslationGroupMigration}. All collaborators are
 * required, except for the log, which defaults to Commons Logging.
 */
public class TranslationGroupMigrationBuilder {
    private LocaleState mLocaleState;
    private RecordTypeRegistry mRecordTypes;
    private Database mDatabase;
    private TransactionRunner mTransactionRunner;
    private PrivilegedExecutor mPrivilegedExecutor;
    private PublishWorkflow mPublishWorkflow;
    private RecordLoader mRecordLoader;
    private Log mLog;

    public TranslationGroupMigrationBuilder() {
    }

    public TranslationGroupMigration build() throws ConfigurationException {
        assertReady();
        return new TranslationGroupMigration(this);
    }

    public LocaleState getLocaleState() {
        return mLocaleState;
    }

    /**
     * Set the locale state which migrated records are written under. Its
     * registry supplies the configured locales.
     */
    public void setLocaleState(LocaleState state) {
        mLocaleState = state;
    }

    public RecordTypeRegistry getRecordTypes() {
        return mRecordTypes;
    }

    public void setRecordTypes(RecordTypeRegistry types) {
        mRecordTypes = types;
    }

    public Database getDatabase() {
        return mDatabase;
    }

    public void setDatabase(Database database) {
        mDatabase = database;
    }

    public TransactionRunner getTransactionRunner() {
        return mTransactionRunner;
    }

    public void setTransactionRunner(TransactionRunner runner) {
        mTransactionRunner = runner;
    }

    public PrivilegedExecutor getPrivilegedExecutor() {
        return mPrivilegedExecutor;
    }

    public void setPrivilegedExecutor(PrivilegedExecutor executor) {
        mPrivilegedExecutor = executor;
    }

    public PublishWorkflow getPublishWorkflow() {
        return mPublishWorkflow;
    }

    public void setPublishWorkflow(PublishWorkflow workflow) {
        mPublishWorkflow = workflow;
    }

    public RecordLoader getRecordLoader() {
        return mRecordLoader;
    }

    public void setRecordLoader(RecordLoader loader) {
        mRecordLoader = loader;
    }

    public Log getLog() {
        return mLog;
    }

    /**
     * Set the log to report progress to, which is optional.
     */
    public void setLog(Log log) {
        mLog = log;
    }

    /**
     * Throw a configuration exception if the configuration is not filled out
     * sufficiently and correctly such that a migration could be built.
     */
    public final void assertReady() throws ConfigurationException {
        ArrayList<String> messages = new ArrayList<String>();
        errorCheck(messages);
        int size = messages.size();
        if (size == 0) {
            return;
        }
        StringBuilder b = new StringBuilder();
        if (size > 1) {
            b.append("Multiple problems: ");
        }
        for (int i=0; i<size; i++) {
            if (i > 0) {
                b.append("; ");
            }
            b.append(messages.get(i));
        }
        throw new ConfigurationException(b.toString());
    }

    /**
     * @param messages add any error messages to this list
     */
    public void errorCheck(Collection<String> messages) {
        if (mLocaleState == null) {
            messages.add("localeState missing");
        }
        if (mRecordTypes == null) {
            messages.add("recordTypes missing");
        }
        if (mDatabase == null) {
            messages.add("database missing");
        }
        if (mTransactionRunner == null) {
            messages.add("transactionRunner missing");
        }
        if (mPrivilegedExecutor == null) {
            messages.add("privilegedExecutor missing");
        }
        if (mPublishWorkflow == null) {
            messages.add("publishWorkflow missing");
        }
        if (mRecordLoader == null) {
            messages.add("recordLoader missing");
        }
    }
}
