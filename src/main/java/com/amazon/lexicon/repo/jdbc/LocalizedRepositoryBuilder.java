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
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import javax.sql.DataSource;

import com.amazon.lexicon.ConfigurationException;
import com.amazon.lexicon.RepositoryException;

import com.amazon.lexicon.info.RecordType;

import com.amazon.lexicon.locale.LocaleRegistry;

import com.amazon.lexicon.spi.PrivilegedExecutor;

import com.amazon.lexicon.sql.SQLDialect;

/**
 * Builds a repository instance backed by a JDBC accessible database. Unless
 * disabled, all missing tables of the registered record types are created
 * when the repository is built.
 *
 * <pre>
 * LocalizedRepositoryBuilder builder = new LocalizedRepositoryBuilder();
 * builder.setName("site");
 * builder.setDataSource(dataSource);
 * builder.setLocaleRegistry(locales);
 * builder.addRecordType(pageType);
 * LocalizedRepository repo = builder.build();
 * </pre>
 */
public class LocalizedRepositoryBuilder {
    private String mName;
    private DataSource mDataSource;
    private SQLDialect mDialect;
    private LocaleRegistry mLocaleRegistry;
    private final List<RecordType> mRecordTypes;
    private PrivilegedExecutor mPrivilegedExecutor;
    private boolean mSchemaInstalled = true;

    public LocalizedRepositoryBuilder() {
        mRecordTypes = new ArrayList<RecordType>();
    }

    public LocalizedRepository build() throws RepositoryException {
        assertReady();
        return new LocalizedRepository(this);
    }

    public String getName() {
        return mName;
    }

    public void setName(String name) {
        mName = name;
    }

    public DataSource getDataSource() {
        return mDataSource;
    }

    /**
     * Set the source of JDBC connections. The source must support
     * transactions and savepoints.
     */
    public void setDataSource(DataSource dataSource) {
        mDataSource = dataSource;
    }

    /**
     * Returns the dialect to render statements with, which is the default
     * dialect unless set.
     */
    public SQLDialect getDialect() {
        return mDialect == null ? SQLDialect.getDefault() : mDialect;
    }

    public void setDialect(SQLDialect dialect) {
        mDialect = dialect;
    }

    public LocaleRegistry getLocaleRegistry() {
        return mLocaleRegistry;
    }

    public void setLocaleRegistry(LocaleRegistry registry) {
        mLocaleRegistry = registry;
    }

    public List<RecordType> getRecordTypes() {
        return mRecordTypes;
    }

    public void addRecordType(RecordType type) {
        mRecordTypes.add(type);
    }

    public PrivilegedExecutor getPrivilegedExecutor() {
        return mPrivilegedExecutor;
    }

    /**
     * Set the executor which migrations run privileged actions with. By
     * default, actions are run directly.
     */
    public void setPrivilegedExecutor(PrivilegedExecutor executor) {
        mPrivilegedExecutor = executor;
    }

    public boolean isSchemaInstalled() {
        return mSchemaInstalled;
    }

    /**
     * By default, missing tables are created when the repository is built.
     */
    public void setSchemaInstalled(boolean b) {
        mSchemaInstalled = b;
    }

    /**
     * Throw a configuration exception if the configuration is not filled out
     * sufficiently and correctly such that a repository could be built.
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
        if (mName == null) {
            messages.add("name missing");
        }
        if (mDataSource == null) {
            messages.add("dataSource missing");
        }
        if (mLocaleRegistry == null) {
            messages.add("localeRegistry missing");
        }
        if (mRecordTypes.isEmpty()) {
            messages.add("no record types");
        }
        Set<String> names = new HashSet<String>();
        for (RecordType type : mRecordTypes) {
            if (!names.add(type.getName())) {
                messages.add("record type added more than once: " + type.getName());
            }
        }
    }
}
