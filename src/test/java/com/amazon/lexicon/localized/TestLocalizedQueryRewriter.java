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

import java.util.Arrays;

import org.joda.time.DateTime;

import junit.framework.TestCase;
import junit.framework.TestSuite;

import com.amazon.lexicon.Stage;
import com.amazon.lexicon.UnsupportedVersioningModeException;
import com.amazon.lexicon.VersioningMode;

import com.amazon.lexicon.info.RecordType;

import com.amazon.lexicon.locale.LocaleDefinition;
import com.amazon.lexicon.locale.LocaleRegistry;

import com.amazon.lexicon.spi.QueryContext;

import com.amazon.lexicon.sql.SQLDialect;
import com.amazon.lexicon.sql.SQLSelect;
import com.amazon.lexicon.sql.SQLStatementBuilder;

import com.amazon.lexicon.stored.Fixtures;

import static com.amazon.lexicon.sql.SQLExpression.*;

/**
 * Tests localized rewriting of selects, without a database.
 */
public class TestLocalizedQueryRewriter extends TestCase {
    public static void main(String[] args) {
        junit.textui.TestRunner.run(suite());
    }

    public static TestSuite suite() {
        return new TestSuite(TestLocalizedQueryRewriter.class);
    }

    private LocaleRegistry mLocales;
    private LocalizedQueryRewriter mPages;

    public TestLocalizedQueryRewriter(String name) {
        super(name);
    }

    @Override
    protected void setUp() throws Exception {
        mLocales = Fixtures.locales();
        mPages = new LocalizedQueryRewriter(Fixtures.pageType(), mLocales);
    }

    private LocaleDefinition locale(String code) {
        LocaleDefinition locale = mLocales.findLocale(code);
        assertNotNull(code, locale);
        return locale;
    }

    private static SQLSelect siteTreeQuery() {
        return new SQLSelect()
            .addColumn("ID", column("SiteTree", "ID"))
            .addColumn("Title", column("SiteTree", "Title"))
            .setFrom("SiteTree");
    }

    private static SQLStatementBuilder build(SQLSelect query) {
        return query.build(SQLDialect.getDefault());
    }

    public void testJoinsCurrentLocale() {
        SQLSelect query = siteTreeQuery();
        mPages.rewrite(query, new QueryContext(locale("fr_FR")));

        SQLStatementBuilder b = build(query);
        assertEquals("SELECT \"SiteTree\".\"ID\","
                     + " COALESCE(\"SiteTree_Localised_fr_FR\".\"Title\", \"SiteTree\".\"Title\")"
                     + " AS \"Title\" FROM \"SiteTree\""
                     + " LEFT JOIN \"SiteTree_Localised\" \"SiteTree_Localised_fr_FR\""
                     + " ON \"SiteTree\".\"ID\" = \"SiteTree_Localised_fr_FR\".\"RecordID\""
                     + " AND \"SiteTree_Localised_fr_FR\".\"Locale\" = ?",
                     b.getSQL());
        assertEquals(Arrays.<Object>asList("fr_FR"), b.getParameters());
    }

    public void testSubclassTable() {
        SQLSelect query = siteTreeQuery()
            .addColumn("MenuTitle", column("Page", "MenuTitle"))
            .addLeftJoin("Page", "Page", eq(column("SiteTree", "ID"), column("Page", "ID")));
        mPages.rewrite(query, new QueryContext(locale("de_DE")));

        String sql = build(query).getSQL();
        assertTrue(sql, sql.indexOf("COALESCE(\"Page_Localised_de_DE\".\"MenuTitle\","
                                    + " \"Page\".\"MenuTitle\") AS \"MenuTitle\"") >= 0);
        assertTrue(sql, sql.indexOf("LEFT JOIN \"Page_Localised\" \"Page_Localised_de_DE\""
                                    + " ON \"Page\".\"ID\" = \"Page_Localised_de_DE\".\"RecordID\"")
                   >= 0);
    }

    public void testTablesNotQueriedAreIgnored() {
        SQLSelect query = new SQLSelect()
            .addColumn("Email", column("Member", "Email"))
            .setFrom("Member");
        String before = build(query).getSQL();
        mPages.rewrite(query, new QueryContext(locale("fr_FR")));
        assertEquals(before, build(query).getSQL());
    }

    public void testNoLocale() {
        SQLSelect query = siteTreeQuery();
        String before = build(query).getSQL();
        mPages.rewrite(query, new QueryContext(null));
        assertEquals(before, build(query).getSQL());
    }

    public void testLiveStage() {
        SQLSelect query = siteTreeQuery();
        mPages.rewrite(query, QueryContext.forStage(Stage.LIVE, locale("fr_FR")));
        assertTrue(build(query).getSQL().indexOf
                   ("LEFT JOIN \"SiteTree_Localised_Live\" \"SiteTree_Localised_fr_FR\"") >= 0);
    }

    public void testStageWithoutStageParameterReadsLive() {
        SQLSelect query = siteTreeQuery();
        mPages.rewrite(query, QueryContext.forMode(VersioningMode.STAGE_UNIQUE, locale("fr_FR")));
        assertTrue(build(query).getSQL().indexOf("\"SiteTree_Localised_Live\"") >= 0);
    }

    public void testDraftStage() {
        SQLSelect query = siteTreeQuery();
        mPages.rewrite(query, QueryContext.forStage(Stage.DRAFT, locale("fr_FR")));
        String sql = build(query).getSQL();
        assertTrue(sql.indexOf("LEFT JOIN \"SiteTree_Localised\" \"SiteTree_Localised_fr_FR\"") >= 0);
        assertTrue(sql.indexOf("_Live") < 0);
    }

    public void testVersionFallbackChain() {
        SQLSelect query = siteTreeQuery();
        mPages.rewrite(query, QueryContext.forVersion(3, locale("de_AT")));

        SQLStatementBuilder b = build(query);
        String sql = b.getSQL();

        assertTrue(sql, sql.indexOf("COALESCE(\"SiteTree_Localised_de_AT\".\"Title\","
                                    + " \"SiteTree_Localised_de_DE\".\"Title\","
                                    + " \"SiteTree_Localised_en_US\".\"Title\","
                                    + " \"SiteTree\".\"Title\") AS \"Title\"") >= 0);

        for (String code : new String[] {"de_AT", "de_DE", "en_US"}) {
            String alias = "\"SiteTree_Localised_" + code + '"';
            assertTrue(sql, sql.indexOf("LEFT JOIN \"SiteTree_Localised_Versions\" " + alias
                                        + " ON \"SiteTree\".\"RecordID\" = " + alias
                                        + ".\"RecordID\" AND " + alias + ".\"Locale\" = ? AND "
                                        + alias + ".\"Version\" = \"SiteTree\".\"Version\"") >= 0);
        }

        assertEquals(Arrays.<Object>asList("de_AT", "de_DE", "en_US"), b.getParameters());
    }

    public void testArchiveFallbackChain() {
        SQLSelect query = siteTreeQuery();
        mPages.rewrite(query, QueryContext.forArchiveDate(new DateTime(), locale("fr_FR")));

        SQLStatementBuilder b = build(query);
        String sql = b.getSQL();

        assertTrue(sql, sql.indexOf("COALESCE(\"SiteTree_Localised_fr_FR\".\"Title\","
                                    + " \"SiteTree_Localised_en_US\".\"Title\","
                                    + " \"SiteTree\".\"Title\") AS \"Title\"") >= 0);
        assertTrue(sql, sql.indexOf("LEFT JOIN \"SiteTree_Localised_Versions\""
                                    + " \"SiteTree_Localised_en_US\"") >= 0);
        assertTrue(sql, sql.indexOf("\"SiteTree_Localised_fr_FR\".\"Version\""
                                    + " = \"SiteTree\".\"Version\"") >= 0);

        assertEquals(Arrays.<Object>asList("fr_FR", "en_US"), b.getParameters());
    }

    public void testUnknownModeLeavesQueryAlone() {
        SQLSelect query = siteTreeQuery();
        String before = build(query).getSQL();

        QueryContext context = new QueryContext(locale("fr_FR"))
            .setQueryParam(QueryContext.MODE, "bogus");
        try {
            mPages.rewrite(query, context);
            fail();
        } catch (UnsupportedVersioningModeException e) {
            assertEquals("bogus", e.getMode());
        }

        assertEquals(before, build(query).getSQL());
    }

    public void testUnversionedTypeIgnoresMode() throws Exception {
        RecordType regions = Fixtures.regionType();
        LocalizedQueryRewriter rewriter = new LocalizedQueryRewriter(regions, mLocales);

        SQLSelect query = new SQLSelect()
            .addColumn("Name", column("Region", "Name"))
            .setFrom("Region");
        rewriter.rewrite(query, QueryContext.forMode(VersioningMode.ALL_VERSIONS, locale("de_AT")));

        SQLStatementBuilder b = build(query);
        assertEquals("SELECT COALESCE(\"Region_Localised_de_AT\".\"Name\", \"Region\".\"Name\")"
                     + " AS \"Name\" FROM \"Region\""
                     + " LEFT JOIN \"Region_Localised\" \"Region_Localised_de_AT\""
                     + " ON \"Region\".\"ID\" = \"Region_Localised_de_AT\".\"RecordID\""
                     + " AND \"Region_Localised_de_AT\".\"Locale\" = ?",
                     b.getSQL());
    }

    public void testRequiresLocalizedType() throws Exception {
        try {
            new LocalizedQueryRewriter(Fixtures.memberType(), mLocales);
            fail();
        } catch (IllegalArgumentException e) {
        }
    }
}
