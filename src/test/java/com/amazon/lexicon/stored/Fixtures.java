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

package com.amazon.lexicon.stored;

import java.io.InputStream;
import java.io.IOException;

import java.util.Properties;

import java.util.concurrent.atomic.AtomicInteger;

import javax.sql.DataSource;

import org.h2.jdbcx.JdbcDataSource;

import com.amazon.lexicon.ConfigurationException;

import com.amazon.lexicon.info.RecordType;

import com.amazon.lexicon.locale.LocaleRegistry;
import com.amazon.lexicon.locale.LocaleRegistryBuilder;

import com.amazon.lexicon.repo.jdbc.LocalizedRepositoryBuilder;

import com.amazon.lexicon.sql.ColumnType;

/**
 * Record types, locales and databases shared by tests.
 */
public class Fixtures {
    public static final String LOCALES_RESOURCE = "/lexicon-test.properties";

    private static final AtomicInteger cDatabaseCount = new AtomicInteger();

    private Fixtures() {
    }

    /**
     * Loads locales en_US (default), fr_FR, de_DE and de_AT.
     */
    public static LocaleRegistry locales() throws ConfigurationException {
        return LocaleRegistryBuilder.fromProperties(localeProperties()).build();
    }

    public static Properties localeProperties() {
        Properties props = new Properties();
        InputStream in = Fixtures.class.getResourceAsStream(LOCALES_RESOURCE);
        if (in == null) {
            throw new IllegalStateException("Missing resource: " + LOCALES_RESOURCE);
        }
        try {
            try {
                props.load(in);
            } finally {
                in.close();
            }
        } catch (IOException e) {
            throw new IllegalStateException(e);
        }
        return props;
    }

    /**
     * Versioned page type, stored in tables SiteTree and Page. Title and
     * MenuTitle are localized.
     */
    public static RecordType pageType() throws ConfigurationException {
        return new RecordType.Builder("Page")
            .addTable("SiteTree")
            .addLocalizedField("SiteTree", "Title", ColumnType.VARCHAR)
            .addField("SiteTree", "URLSegment", ColumnType.VARCHAR)
            .addField("SiteTree", "Sort", ColumnType.INTEGER)
            .addLocalizedField("Page", "MenuTitle", ColumnType.VARCHAR)
            .addClassName("Page")
            .addClassName("RedirectorPage")
            .setVersioned(true)
            .build();
    }

    /**
     * Unversioned region type, stored in table Region. Name is localized.
     */
    public static RecordType regionType() throws ConfigurationException {
        return new RecordType.Builder("Region")
            .addLocalizedField("Region", "Name", ColumnType.VARCHAR)
            .addField("Region", "Code", ColumnType.VARCHAR)
            .build();
    }

    /**
     * Unlocalized type, which migrations must leave alone.
     */
    public static RecordType memberType() throws ConfigurationException {
        return new RecordType.Builder("Member")
            .addField("Member", "Email", ColumnType.VARCHAR)
            .build();
    }

    /**
     * Returns a data source for a new, empty in-memory database.
     */
    public static DataSource newDataSource() {
        JdbcDataSource ds = new JdbcDataSource();
        ds.setURL("jdbc:h2:mem:lexicon" + cDatabaseCount.incrementAndGet() + ";DB_CLOSE_DELAY=-1");
        ds.setUser("sa");
        ds.setPassword("");
        return ds;
    }

    /**
     * Returns a builder for a repository of pages, regions and members over
     * a new database.
     */
    public static LocalizedRepositoryBuilder repositoryBuilder() throws ConfigurationException {
        LocalizedRepositoryBuilder builder = new LocalizedRepositoryBuilder();
        builder.setName("test");
        builder.setDataSource(newDataSource());
        builder.setLocaleRegistry(locales());
        builder.addRecordType(pageType());
        builder.addRecordType(regionType());
        builder.addRecordType(memberType());
        return builder;
    }
}
