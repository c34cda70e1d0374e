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

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import javax.sql.DataSource;

import junit.framework.TestCase;
import junit.framework.TestSuite;

import com.amazon.lexicon.ConfigurationException;
import com.amazon.lexicon.DataRecord;
import com.amazon.lexicon.FetchException;
import com.amazon.lexicon.PersistException;
import com.amazon.lexicon.RepositoryException;
import com.amazon.lexicon.ScopedAction;
import com.amazon.lexicon.Stage;

import com.amazon.lexicon.locale.LocaleDefinition;
import com.amazon.lexicon.locale.LocaleRegistry;
import com.amazon.lexicon.locale.LocaleState;

import com.amazon.lexicon.localized.LocalizedAugmenter;

import com.amazon.lexicon.repo.jdbc.JDBCRecordStorage;
import com.amazon.lexicon.repo.jdbc.LocalizedRepository;
import com.amazon.lexicon.repo.jdbc.LocalizedRepositoryBuilder;

import com.amazon.lexicon.spi.PrivilegedExecutor;
import com.amazon.lexicon.spi.PublishWorkflow;

import com.amazon.lexicon.stored.Fixtures;

/**
 * Tests conversion of legacy translation groups, with the legacy data set up
 * directly in an in-memory database.
 */
public class TestTranslationGroupMigration extends TestCase {
    public static void main(String[] args) {
        junit.textui.TestRunner.run(suite());
    }

    public static TestSuite suite() {
        return new TestSuite(TestTranslationGroupMigration.class);
    }

    private static final String GROUPS = "SiteTree_translationgroups";

    private DataSource mDataSource;
    private LocalizedRepository mRepository;
    private LocaleState mState;
    private JDBCRecordStorage mPages;
    private LocalizedAugmenter mPageLocales;
    private List<String> mMessages;

    public TestTranslationGroupMigration(String name) {
        super(name);
    }

    @Override
    protected void setUp() throws Exception {
        LocalizedRepositoryBuilder builder = Fixtures.repositoryBuilder();
        mDataSource = builder.getDataSource();
        mRepository = builder.build();
        mState = mRepository.getLocaleState();
        mPages = mRepository.getStorage("Page");
        mPageLocales = mRepository.getLocalizedAugmenter("Page");
        mMessages = new ArrayList<String>();

        sql("ALTER TABLE \"SiteTree\" ADD COLUMN \"Locale\" VARCHAR(20)");
        sql("ALTER TABLE \"SiteTree_Live\" ADD COLUMN \"Locale\" VARCHAR(20)");
        sql("ALTER TABLE \"SiteTree_Versions\" ADD COLUMN \"Locale\" VARCHAR(20)");
        sql("CREATE TABLE \"" + GROUPS + "\" (\"TranslationGroupID\" BIGINT, \"OriginalID\" BIGINT)");
    }

    private TranslationGroupMigrationBuilder migrationBuilder() {
        TranslationGroupMigrationBuilder builder = mRepository.createMigrationBuilder();
        builder.setLog(new Log() {
            public boolean isEnabled() {
                return true;
            }

            public void write(String message) {
                mMessages.add(message);
            }
        });
        return builder;
    }

    private MigrationResult migrate() throws Exception {
        return migrationBuilder().build().run();
    }

    /**
     * Writes a record the way the legacy model stored it, as a copy of its
     * own in one locale.
     */
    private long legacy(String title, String locale, boolean publish, String className)
        throws Exception
    {
        mState.setLocale(null);
        DataRecord page = mPages.create(className);
        page.set("Title", title);
        page.set("URLSegment", title.toLowerCase());
        if (publish) {
            mPages.publish(page);
        } else {
            mPages.writeToDraft(page);
        }
        long id = page.getId();
        if (locale != null) {
            sql("UPDATE \"SiteTree\" SET \"Locale\" = ? WHERE \"ID\" = ?", locale, id);
            sql("UPDATE \"SiteTree_Live\" SET \"Locale\" = ? WHERE \"ID\" = ?", locale, id);
            sql("UPDATE \"SiteTree_Versions\" SET \"Locale\" = ? WHERE \"RecordID\" = ?",
                locale, id);
        }
        return id;
    }

    private void group(long groupId, long... ids) throws SQLException {
        for (long id : ids) {
            sql("INSERT INTO \"" + GROUPS + "\" VALUES (?, ?)", groupId, id);
        }
    }

    private DataRecord read(long id, String locale, Stage stage) throws Exception {
        mState.setLocale(locale);
        return mPages.get(id, stage);
    }

    public void testMigrateGroup() throws Exception {
        long en = legacy("Hello", "en_US", true, null);
        long fr = legacy("Bonjour", "fr_FR", false, null);
        long de = legacy("Hallo", "de_DE", true, null);
        group(1, en, fr, de);

        MigrationResult result = migrate();

        assertEquals(1, result.getTypesMigrated());
        assertEquals(1, result.getGroupsMigrated());
        assertEquals(3, result.getRecordsReplayed());
        assertEquals(0, result.getRecordsSkipped());

        assertEquals("Hello", read(en, "en_US", Stage.DRAFT).get("Title"));
        assertEquals("Bonjour", read(en, "fr_FR", Stage.DRAFT).get("Title"));
        assertEquals("Hallo", read(en, "de_DE", Stage.DRAFT).get("Title"));
        assertEquals("Hallo", read(en, "de_DE", Stage.LIVE).get("Title"));
        assertEquals("Hello", read(en, "en_US", Stage.LIVE).get("Title"));

        assertTrue(mPageLocales.isPublishedInLocale(en, "en_US"));
        assertTrue(mPageLocales.isDraftedInLocale(en, "fr_FR"));
        assertFalse(mPageLocales.isPublishedInLocale(en, "fr_FR"));
        assertTrue(mPageLocales.isPublishedInLocale(en, "de_DE"));

        // Other copies are gone.
        mState.setLocale("en_US");
        List<DataRecord> pages = mPages.select(Stage.DRAFT);
        assertEquals(1, pages.size());
        assertEquals(en, pages.get(0).getId().longValue());
        assertNull(mPages.load(fr));
        assertNull(mPages.load(de));
        assertEquals(1, mPages.select(Stage.LIVE).size());

        assertFalse(hasColumn("SiteTree", "Locale"));
        assertFalse(mRepository.getDatabase().getTableList().containsKey(GROUPS.toLowerCase()));

        assertEquals(0, rows("SELECT * FROM \"SiteTree_Versions\" WHERE \"RecordID\" IN ("
                             + fr + ", " + de + ")").size());
        assertOneRowPerVersion(en);

        mState.setLocale("en_US");
        List<DataRecord> versions = mPages.getVersions(en);
        assertEquals(2, versions.size());
        for (int i=0; i<versions.size(); i++) {
            assertEquals(i + 1, versions.get(i).getVersion());
            assertEquals("hello", versions.get(i).get("URLSegment"));
        }

        assertTrue(mMessages.contains("  --  Saved to draft"));
        assertTrue(mMessages.contains("  --  Published"));
    }

    public void testOldestMemberIsCanonicalWithoutDefaultLocale() throws Exception {
        long fr = legacy("Bonjour", "fr_FR", false, null);
        long de = legacy("Hallo", "de_DE", false, null);
        group(3, de, fr);

        MigrationResult result = migrate();
        assertEquals(2, result.getRecordsReplayed());

        assertEquals("Bonjour", read(fr, "fr_FR", Stage.DRAFT).get("Title"));
        assertEquals("Hallo", read(fr, "de_DE", Stage.DRAFT).get("Title"));
        assertNull(mPages.load(de));
    }

    public void testSkippedMembers() throws Exception {
        long older = legacy("Old", "en_US", false, null);
        long newer = legacy("New", "en_US", false, null);
        long noLocale = legacy("Nowhere", null, false, null);
        long obsolete = legacy("Virtuel", "fr_FR", false, "VirtualPage");
        long unknown = legacy("Hola", "es_ES", false, null);
        group(7, older, newer, noLocale, obsolete, unknown);

        MigrationResult result = migrate();

        assertEquals(1, result.getGroupsMigrated());
        assertEquals(1, result.getRecordsReplayed());
        assertEquals(4, result.getRecordsSkipped());

        assertTrue(mPageLocales.isDraftedInLocale(newer, "en_US"));
        assertFalse(mPageLocales.isDraftedInLocale(older, "en_US"));
        assertFalse(mPageLocales.isDraftedInLocale(obsolete, "fr_FR"));
        assertFalse(mPageLocales.isDraftedInLocale(newer, "fr_FR"));

        assertNull(mPages.load(obsolete));
        assertNull(mPages.load(unknown));

        assertOneRowPerVersion(newer);
    }

    public void testEmptyGroup() throws Exception {
        long id = legacy("Nowhere", null, false, null);
        group(5, id);

        MigrationResult result = migrate();
        assertEquals(1, result.getTypesMigrated());
        assertEquals(0, result.getGroupsMigrated());
        assertEquals(1, result.getRecordsSkipped());
        assertNotNull(mPages.load(id));
    }

    public void testPublishFailureRollsBack() throws Exception {
        long en = legacy("Hello", "en_US", true, null);
        long fr = legacy("Bonjour", "fr_FR", false, null);
        final long de = legacy("Hallo", "de_DE", true, null);
        group(1, en, fr, de);

        String[] tables = {
            "SiteTree", "SiteTree_Live", "SiteTree_Versions",
            "SiteTree_Localised", "SiteTree_Localised_Live", "SiteTree_Localised_Versions"
        };
        List<Object> before = snapshot(tables);

        final PublishWorkflow workflow = mRepository.getPublishWorkflow();
        TranslationGroupMigrationBuilder builder = migrationBuilder();
        builder.setPublishWorkflow(new PublishWorkflow() {
            public boolean isPublished(DataRecord record) throws FetchException {
                return workflow.isPublished(record);
            }

            public void writeToDraft(DataRecord record) throws PersistException {
                workflow.writeToDraft(record);
            }

            public boolean publish(DataRecord record) throws PersistException {
                if (record.getId().longValue() == de) {
                    return false;
                }
                return workflow.publish(record);
            }
        });

        try {
            builder.build().run();
            fail();
        } catch (PublishException e) {
        }

        assertTrue(mMessages.contains("  --  Publishing FAILED"));
        assertEquals(before, snapshot(tables));
        assertTrue(hasColumn("SiteTree", "Locale"));
        assertEquals(3, rows("SELECT * FROM \"" + GROUPS + "\"").size());
    }

    public void testNoLocalesConfigured() throws Exception {
        long id = legacy("Hello", "en_US", false, null);
        group(1, id);

        TranslationGroupMigrationBuilder builder = migrationBuilder();
        builder.setLocaleState(new LocaleState(new BrokenRegistry(true)));
        try {
            builder.build().run();
            fail();
        } catch (ConfigurationException e) {
            assertTrue(e.getMessage().indexOf("Configure locales") >= 0);
        }

        builder.setLocaleState(new LocaleState(new BrokenRegistry(false)));
        try {
            builder.build().run();
            fail();
        } catch (ConfigurationException e) {
            assertTrue(e.getMessage().indexOf("default locale") >= 0);
        }

        assertTrue(hasColumn("SiteTree", "Locale"));
        assertEquals(1, rows("SELECT * FROM \"" + GROUPS + "\"").size());
    }

    public void testTypesWithoutGroupsTable() throws Exception {
        sql("DROP TABLE \"" + GROUPS + "\"");

        MigrationResult result = migrate();
        assertEquals(0, result.getTypesMigrated());
        assertTrue(hasColumn("SiteTree", "Locale"));
    }

    public void testRunsPrivileged() throws Exception {
        final int[] calls = new int[1];
        TranslationGroupMigrationBuilder builder = migrationBuilder();
        builder.setPrivilegedExecutor(new PrivilegedExecutor() {
            public <T> T runPrivileged(ScopedAction<T> action) throws RepositoryException {
                calls[0]++;
                return action.run();
            }
        });
        builder.build().run();
        assertEquals(1, calls[0]);
    }

    public void testBuilderErrors() {
        TranslationGroupMigrationBuilder builder = new TranslationGroupMigrationBuilder();
        try {
            builder.build();
            fail();
        } catch (ConfigurationException e) {
            assertTrue(e.getMessage().startsWith("Multiple problems"));
        }

        List<String> messages = new ArrayList<String>();
        builder.errorCheck(messages);
        assertEquals(7, messages.size());
        assertTrue(messages.contains("database missing"));

        // Log is optional.
        messages.clear();
        mRepository.createMigrationBuilder().errorCheck(messages);
        assertTrue(messages.isEmpty());
    }

    private void assertOneRowPerVersion(long id) throws SQLException {
        List<Map<String, Object>> versions = rows
            ("SELECT \"Version\" FROM \"SiteTree_Versions\" WHERE \"RecordID\" = " + id
             + " ORDER BY \"Version\"");
        assertFalse(versions.isEmpty());
        for (int i=1; i<versions.size(); i++) {
            assertFalse(versions.get(i).get("Version").equals(versions.get(i - 1).get("Version")));
        }
    }

    private boolean hasColumn(String table, String column) throws Exception {
        for (String name : mRepository.getDatabase().getColumnNames(table)) {
            if (name.equalsIgnoreCase(column)) {
                return true;
            }
        }
        return false;
    }

    private List<Object> snapshot(String[] tables) throws SQLException {
        List<Object> snapshot = new ArrayList<Object>();
        for (String table : tables) {
            snapshot.add(rows("SELECT * FROM \"" + table + "\" ORDER BY \"ID\""));
        }
        return snapshot;
    }

    private List<Map<String, Object>> rows(String sql) throws SQLException {
        List<Map<String, Object>> rows = new ArrayList<Map<String, Object>>();
        Connection con = mDataSource.getConnection();
        try {
            PreparedStatement ps = con.prepareStatement(sql);
            try {
                ResultSet rs = ps.executeQuery();
                try {
                    int count = rs.getMetaData().getColumnCount();
                    while (rs.next()) {
                        Map<String, Object> row = new LinkedHashMap<String, Object>();
                        for (int i=1; i<=count; i++) {
                            row.put(rs.getMetaData().getColumnLabel(i), rs.getObject(i));
                        }
                        rows.add(row);
                    }
                } finally {
                    rs.close();
                }
            } finally {
                ps.close();
            }
        } finally {
            con.close();
        }
        return rows;
    }

    private void sql(String sql, Object... params) throws SQLException {
        Connection con = mDataSource.getConnection();
        try {
            PreparedStatement ps = con.prepareStatement(sql);
            try {
                for (int i=0; i<params.length; i++) {
                    ps.setObject(i + 1, params[i]);
                }
                ps.executeUpdate();
            } finally {
                ps.close();
            }
        } finally {
            con.close();
        }
    }

    /**
     * Registry with either no locales, or locales but no default.
     */
    private static class BrokenRegistry implements LocaleRegistry {
        private final boolean mNoLocales;
        private final LocaleRegistry mLocales;

        BrokenRegistry(boolean noLocales) throws ConfigurationException {
            mNoLocales = noLocales;
            mLocales = Fixtures.locales();
        }

        public List<LocaleDefinition> getLocales() throws ConfigurationException {
            if (mNoLocales) {
                throw new ConfigurationException("No locales have been configured");
            }
            return mLocales.getLocales();
        }

        public LocaleDefinition getDefault() throws ConfigurationException {
            throw new ConfigurationException("No default locale has been configured");
        }

        public LocaleDefinition findLocale(String code) {
            return mNoLocales ? null : mLocales.findLocale(code);
        }

        public List<LocaleDefinition> resolveChain(LocaleDefinition locale) {
            return mLocales.resolveChain(locale);
        }
    }
}
