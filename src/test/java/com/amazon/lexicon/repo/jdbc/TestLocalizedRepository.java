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

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.joda.time.DateTime;

import junit.framework.TestCase;
import junit.framework.TestSuite;

import com.amazon.lexicon.ConfigurationException;
import com.amazon.lexicon.DataRecord;
import com.amazon.lexicon.Stage;
import com.amazon.lexicon.UniqueConstraintException;
import com.amazon.lexicon.UnsupportedVersioningModeException;
import com.amazon.lexicon.VersioningMode;

import com.amazon.lexicon.locale.LocaleRegistryBuilder;
import com.amazon.lexicon.locale.LocaleState;

import com.amazon.lexicon.localized.LocalizedAugmenter;

import com.amazon.lexicon.spi.QueryContext;
import com.amazon.lexicon.spi.WriteContext;

import com.amazon.lexicon.sql.SQLInsert;

import com.amazon.lexicon.stored.Fixtures;

/**
 * Tests localized reads and writes against an in-memory database.
 */
public class TestLocalizedRepository extends TestCase {
    public static void main(String[] args) {
        junit.textui.TestRunner.run(suite());
    }

    public static TestSuite suite() {
        return new TestSuite(TestLocalizedRepository.class);
    }

    private LocalizedRepository mRepository;
    private LocaleState mState;
    private JDBCRecordStorage mPages;
    private LocalizedAugmenter mPageLocales;

    public TestLocalizedRepository(String name) {
        super(name);
    }

    @Override
    protected void setUp() throws Exception {
        mRepository = Fixtures.repositoryBuilder().build();
        mState = mRepository.getLocaleState();
        mPages = mRepository.getStorage("Page");
        mPageLocales = mRepository.getLocalizedAugmenter("Page");
    }

    private long newPage(String locale, String title) throws Exception {
        mState.setLocale(locale);
        DataRecord page = mPages.create(null);
        page.set("Title", title);
        page.set("URLSegment", title.toLowerCase());
        page.set("Sort", 1);
        page.set("MenuTitle", title + " menu");
        mPages.writeToDraft(page);
        assertNotNull(page.getId());
        return page.getId();
    }

    private DataRecord read(long id, String locale, Stage stage) throws Exception {
        mState.setLocale(locale);
        return mPages.get(id, stage);
    }

    public void testWriteInLocales() throws Exception {
        long id = newPage("en_US", "Hello");

        DataRecord fr = read(id, "fr_FR", Stage.DRAFT);
        assertEquals("Hello", fr.get("Title"));
        assertEquals(1, fr.getVersion());

        fr.set("Title", "Bonjour");
        fr.set("MenuTitle", "Salut");
        mPages.writeToDraft(fr);
        assertEquals(2, fr.getVersion());

        fr = read(id, "fr_FR", Stage.DRAFT);
        assertEquals("Bonjour", fr.get("Title"));
        assertEquals("Salut", fr.get("MenuTitle"));
        assertEquals("hello", fr.get("URLSegment"));
        assertEquals("Page", fr.getClassName());

        DataRecord en = read(id, "en_US", Stage.DRAFT);
        assertEquals("Hello", en.get("Title"));
        assertEquals("Hello menu", en.get("MenuTitle"));

        // Locales without content read the base row.
        assertEquals("Hello", read(id, "de_DE", Stage.DRAFT).get("Title"));
        assertEquals("Hello", mPages.load(id).get("Title"));
    }

    public void testUnlocalizedFieldsAreShared() throws Exception {
        long id = newPage("en_US", "Shared");

        DataRecord fr = read(id, "fr_FR", Stage.DRAFT);
        fr.set("Sort", 7);
        mPages.writeToDraft(fr);

        assertEquals(7, ((Number) read(id, "en_US", Stage.DRAFT).get("Sort")).intValue());
    }

    public void testDraftAndLive() throws Exception {
        long id = newPage("en_US", "Draft");
        assertNull(read(id, "en_US", Stage.LIVE));
        assertFalse(mPages.isPublished(id));

        DataRecord page = read(id, "en_US", Stage.DRAFT);
        page.set("Title", "Published");
        mPages.publish(page);
        assertTrue(mPages.isPublished(id));

        page.set("Title", "Changed");
        mPages.writeToDraft(page);

        assertEquals("Published", read(id, "en_US", Stage.LIVE).get("Title"));
        assertEquals("Changed", read(id, "en_US", Stage.DRAFT).get("Title"));

        DataRecord fr = read(id, "fr_FR", Stage.DRAFT);
        fr.set("Title", "Publié");
        mPages.publish(fr);

        assertEquals("Publié", read(id, "fr_FR", Stage.LIVE).get("Title"));
        assertEquals("Published", read(id, "en_US", Stage.LIVE).get("Title"));
        assertEquals(1, mPages.select(Stage.LIVE).size());
    }

    public void testVersions() throws Exception {
        long id = newPage("en_US", "v1");

        DataRecord page = read(id, "en_US", Stage.DRAFT);
        page.set("Title", "v2");
        mPages.publish(page);

        DataRecord fr = read(id, "fr_FR", Stage.DRAFT);
        fr.set("Title", "fr3");
        mPages.writeToDraft(fr);
        assertEquals(3, fr.getVersion());

        mState.setLocale("fr_FR");
        List<DataRecord> versions = mPages.getVersions(id);
        assertEquals(3, versions.size());
        for (int i=0; i<3; i++) {
            assertEquals(i + 1, versions.get(i).getVersion());
            assertEquals(id, versions.get(i).getId().longValue());
        }
        // Versions written in English are read through the fallback.
        assertEquals("v1", versions.get(0).get("Title"));
        assertEquals("v2", versions.get(1).get("Title"));
        assertEquals("fr3", versions.get(2).get("Title"));

        DataRecord v2 = mPages.get
            (id, QueryContext.forVersion(2, mRepository.getLocaleRegistry().findLocale("en_US")));
        assertEquals("v2", v2.get("Title"));
        assertEquals(2, v2.getVersion());

        List<DataRecord> latest = mPages.select
            (QueryContext.forMode(VersioningMode.LATEST_VERSIONS, mState.getLocale()));
        assertEquals(1, latest.size());
        assertEquals(3, latest.get(0).getVersion());
        assertEquals("fr3", latest.get(0).get("Title"));
    }

    public void testVersionFallbackChain() throws Exception {
        long id = newPage("de_DE", "Hallo");

        QueryContext context = QueryContext.forVersion
            (1, mRepository.getLocaleRegistry().findLocale("de_AT"));
        assertEquals("Hallo", mPages.get(id, context).get("Title"));

        // Stage reads only join the current locale.
        assertNull(read(id, "de_AT", Stage.DRAFT).get("Title"));
        assertEquals("Hallo", read(id, "de_DE", Stage.DRAFT).get("Title"));
    }

    public void testArchiveDate() throws Exception {
        long id = newPage("en_US", "v1");
        DateTime beforePublish = pause();

        DataRecord page = read(id, "en_US", Stage.DRAFT);
        page.set("Title", "v2");
        mPages.publish(page);
        DateTime afterEnglish = pause();

        DataRecord fr = read(id, "fr_FR", Stage.DRAFT);
        fr.set("Title", "pub-fr");
        mPages.publish(fr);
        DateTime afterFrench = pause();

        fr = read(id, "fr_FR", Stage.DRAFT);
        fr.set("Title", "draft-fr");
        mPages.writeToDraft(fr);
        assertEquals(4, fr.getVersion());

        assertNull(archived(id, beforePublish, "fr_FR"));

        // Nothing was published in French yet, so English is read through
        // the fallback.
        DataRecord v2 = archived(id, afterEnglish, "fr_FR");
        assertEquals(2, v2.getVersion());
        assertEquals("v2", v2.get("Title"));

        DataRecord v3 = archived(id, afterFrench, "fr_FR");
        assertEquals(3, v3.getVersion());
        assertEquals("pub-fr", v3.get("Title"));

        // Draft versions are never archived.
        v3 = archived(id, new DateTime(), "fr_FR");
        assertEquals(3, v3.getVersion());
        assertEquals("pub-fr", v3.get("Title"));
    }

    private DataRecord archived(long id, DateTime date, String locale) throws Exception {
        return mPages.get
            (id, QueryContext.forArchiveDate(date, mRepository.getLocaleRegistry().findLocale(locale)));
    }

    /**
     * Returns a time strictly between the writes before and after the call.
     */
    private static DateTime pause() throws InterruptedException {
        Thread.sleep(20);
        DateTime now = new DateTime();
        Thread.sleep(20);
        return now;
    }

    public void testUnknownMode() throws Exception {
        mState.setLocale("en_US");
        QueryContext context = new QueryContext(mState.getLocale())
            .setQueryParam(QueryContext.MODE, "sideways");
        try {
            mPages.select(context);
            fail();
        } catch (UnsupportedVersioningModeException e) {
        }
    }

    public void testExistence() throws Exception {
        long id = newPage("en_US", "Exists");

        assertTrue(mPageLocales.isDraftedInLocale(id, "en_US"));
        assertFalse(mPageLocales.isPublishedInLocale(id, "en_US"));
        assertFalse(mPageLocales.existsInLocale(id, "fr_FR"));

        mPages.publish(read(id, "en_US", Stage.DRAFT));
        assertTrue(mPageLocales.isPublishedInLocale(id, "en_US"));

        DataRecord fr = read(id, "fr_FR", Stage.DRAFT);
        fr.set("Title", "Existe");
        mPages.writeToDraft(fr);

        assertTrue(mPageLocales.isDraftedInLocale(id));
        assertFalse(mPageLocales.isPublishedInLocale(id));
        assertTrue(mPageLocales.existsInLocale(id));

        mState.setLocale(null);
        assertFalse(mPageLocales.isDraftedInLocale(id));
        assertFalse(mPageLocales.existsInLocale(id, null));

        mPageLocales.prepopulate("fr_FR");
        assertTrue(mPageLocales.isDraftedInLocale(id, "fr_FR"));
        assertFalse(mPageLocales.isDraftedInLocale(id + 1, "fr_FR"));
    }

    public void testDeleteFromLocale() throws Exception {
        long id = newPage("en_US", "Hello");
        DataRecord fr = read(id, "fr_FR", Stage.DRAFT);
        fr.set("Title", "Bonjour");
        mPages.writeToDraft(fr);
        assertTrue(mPageLocales.isDraftedInLocale(id, "fr_FR"));

        mPageLocales.deleteFromLocale(id, new WriteContext(mState.getLocale(), Stage.DRAFT));

        assertFalse(mPageLocales.isDraftedInLocale(id, "fr_FR"));
        assertTrue(mPageLocales.isDraftedInLocale(id, "en_US"));
        assertEquals("Hello", read(id, "fr_FR", Stage.DRAFT).get("Title"));

        try {
            mPageLocales.deleteFromLocale(id, new WriteContext(null, Stage.DRAFT));
            fail();
        } catch (IllegalArgumentException e) {
        }
    }

    public void testDelete() throws Exception {
        long id = newPage("en_US", "Gone");
        mPages.publish(read(id, "en_US", Stage.DRAFT));

        mPages.delete(id, Stage.LIVE);
        assertNull(read(id, "en_US", Stage.LIVE));
        assertFalse(mPageLocales.isPublishedInLocale(id, "en_US"));
        assertNotNull(read(id, "en_US", Stage.DRAFT));

        mPages.delete(id, Stage.DRAFT);
        assertNull(mPages.load(id));
        assertFalse(mPageLocales.isDraftedInLocale(id, "en_US"));
    }

    public void testUnversionedType() throws Exception {
        JDBCRecordStorage regions = mRepository.getStorage("Region");
        LocalizedAugmenter regionLocales = mRepository.getLocalizedAugmenter("Region");

        mState.setLocale("en_US");
        DataRecord region = regions.create(null);
        region.set("Name", "Bavaria");
        region.set("Code", "BY");
        regions.writeToDraft(region);
        long id = region.getId();
        assertEquals(0, region.getVersion());

        mState.setLocale("fr_FR");
        DataRecord fr = regions.get(id, Stage.LIVE);
        assertEquals("Bavaria", fr.get("Name"));
        fr.set("Name", "Bavière");
        regions.writeToDraft(fr);

        assertEquals("Bavière", regions.get(id, Stage.DRAFT).get("Name"));
        mState.setLocale("en_US");
        assertEquals("Bavaria", regions.get(id, Stage.DRAFT).get("Name"));
        assertEquals("BY", regions.get(id, Stage.DRAFT).get("Code"));

        assertTrue(regionLocales.isPublishedInLocale(id, "fr_FR"));
        assertFalse(regionLocales.isPublishedInLocale(id, "de_DE"));
        assertFalse(regions.isPublished(id));

        try {
            regions.publish(region);
            fail();
        } catch (IllegalStateException e) {
        }
    }

    public void testUnlocalizedType() throws Exception {
        assertNull(mRepository.getLocalizedAugmenter("Member"));

        JDBCRecordStorage members = mRepository.getStorage("Member");
        mState.setLocale("fr_FR");
        DataRecord member = members.create(null);
        member.set("Email", "a@example.com");
        members.writeToDraft(member);

        mState.setLocale("en_US");
        assertEquals("a@example.com", members.get(member.getId(), Stage.DRAFT).get("Email"));
    }

    public void testUnknownType() {
        try {
            mRepository.getStorage("Missing");
            fail();
        } catch (IllegalArgumentException e) {
        }
    }

    public void testWrongRecordType() throws Exception {
        DataRecord member = mRepository.getStorage("Member").create(null);
        try {
            mPages.writeToDraft(member);
            fail();
        } catch (IllegalArgumentException e) {
        }
    }

    public void testBuilderErrors() throws Exception {
        LocalizedRepositoryBuilder builder = new LocalizedRepositoryBuilder();
        try {
            builder.build();
            fail();
        } catch (ConfigurationException e) {
            assertTrue(e.getMessage().startsWith("Multiple problems"));
        }

        builder = Fixtures.repositoryBuilder();
        builder.addRecordType(Fixtures.pageType());
        try {
            builder.build();
            fail();
        } catch (ConfigurationException e) {
            assertTrue(e.getMessage().indexOf("Page") >= 0);
        }
    }

    public void testLocalesRequired() throws Exception {
        LocalizedRepositoryBuilder builder = Fixtures.repositoryBuilder();
        builder.setLocaleRegistry(new LocaleRegistryBuilder()
                                  .addLocale("en_US")
                                  .addLocale("fr_FR", "en_US")
                                  .build());
        try {
            builder.build();
            fail();
        } catch (ConfigurationException e) {
            assertTrue(e.getMessage().indexOf("default locale") >= 0);
        }

        builder.setLocaleRegistry(new LocaleRegistryBuilder().build());
        try {
            builder.build();
            fail();
        } catch (ConfigurationException e) {
            assertTrue(e.getMessage().indexOf("No locales") >= 0);
        }
    }

    public void testUniqueLocaleRows() throws Exception {
        long id = newPage("en_US", "Unique");
        JDBCDatabase db = mRepository.getDatabase();

        Map<String, Object> row = new LinkedHashMap<String, Object>();
        row.put("RecordID", id);
        row.put("Locale", "en_US");
        try {
            db.execute(new SQLInsert("SiteTree_Localised", row));
            fail();
        } catch (UniqueConstraintException e) {
        }
    }
}
