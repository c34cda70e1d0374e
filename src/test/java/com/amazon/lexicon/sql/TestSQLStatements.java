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

package com.amazon.lexicon.sql;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import junit.framework.TestCase;
import junit.framework.TestSuite;

import static com.amazon.lexicon.sql.SQLExpression.*;

/**
 * Tests rendering of statement trees.
 */
public class TestSQLStatements extends TestCase {
    public static void main(String[] args) {
        junit.textui.TestRunner.run(suite());
    }

    public static TestSuite suite() {
        return new TestSuite(TestSQLStatements.class);
    }

    private SQLDialect mDialect;

    public TestSQLStatements(String name) {
        super(name);
    }

    @Override
    protected void setUp() {
        mDialect = SQLDialect.getDefault();
    }

    public void testQuoteIdentifier() {
        assertEquals("\"SiteTree\"", mDialect.quoteIdentifier("SiteTree"));
        assertEquals("\"a\"\"b\"", mDialect.quoteIdentifier("a\"b"));
        assertEquals("\"x; DROP TABLE y\"", mDialect.quoteIdentifier("x; DROP TABLE y"));

        try {
            mDialect.quoteIdentifier("");
            fail();
        } catch (IllegalArgumentException e) {
        }
        try {
            mDialect.quoteIdentifier(null);
            fail();
        } catch (IllegalArgumentException e) {
        }
        try {
            mDialect.quoteIdentifier("a\u0000b");
            fail();
        } catch (IllegalArgumentException e) {
        }
    }

    public void testSelect() {
        SQLSelect select = new SQLSelect()
            .addColumn("ID", column("SiteTree", "ID"))
            .addColumn("Label", column("SiteTree", "Title"))
            .setFrom("SiteTree")
            .addLeftJoin("Page", "Page", eq(column("SiteTree", "ID"), column("Page", "ID")))
            .addWhere(eq(column("SiteTree", "ID"), param(5L)))
            .addWhere(ne(column("SiteTree", "URLSegment"), param("home")))
            .addOrderBy(column("SiteTree", "ID"))
            .setLimit(10);

        SQLStatementBuilder b = select.build(mDialect);
        assertEquals("SELECT \"SiteTree\".\"ID\", \"SiteTree\".\"Title\" AS \"Label\""
                     + " FROM \"SiteTree\""
                     + " LEFT JOIN \"Page\" ON \"SiteTree\".\"ID\" = \"Page\".\"ID\""
                     + " WHERE \"SiteTree\".\"ID\" = ? AND \"SiteTree\".\"URLSegment\" <> ?"
                     + " ORDER BY \"SiteTree\".\"ID\" LIMIT 10",
                     b.getSQL());
        assertEquals(Arrays.<Object>asList(5L, "home"), b.getParameters());
    }

    public void testRootIsFirst() {
        SQLSelect select = new SQLSelect()
            .addColumn("ID", column("t", "ID"))
            .addInnerJoin("Other", "o", eq(column("t", "ID"), column("o", "ID")))
            .setFrom("Table", "t");

        assertEquals("SELECT \"t\".\"ID\" FROM \"Table\" \"t\""
                     + " INNER JOIN \"Other\" \"o\" ON \"t\".\"ID\" = \"o\".\"ID\"",
                     select.build(mDialect).getSQL());
        assertEquals("t", select.getRoot().getAlias());

        try {
            select.setFrom("Again");
            fail();
        } catch (IllegalStateException e) {
        }
    }

    public void testRenameTableKeepsAlias() {
        SQLSelect select = new SQLSelect()
            .addColumn("Title", column("SiteTree", "Title"))
            .setFrom("SiteTree");

        assertEquals(1, select.renameTable("SiteTree", "SiteTree_Live"));
        assertEquals(0, select.renameTable("Missing", "Other"));
        assertEquals("SELECT \"SiteTree\".\"Title\" FROM \"SiteTree_Live\" \"SiteTree\"",
                     select.build(mDialect).getSQL());
    }

    public void testReplaceColumn() {
        SQLSelect select = new SQLSelect()
            .addColumn("Title", column("SiteTree", "Title"))
            .setFrom("SiteTree")
            .addWhere(eq(column("SiteTree", "Title"), param("x")))
            .addOrderBy(column("SiteTree", "Title"));

        List<SQLExpression> args = Arrays.<SQLExpression>asList
            (column("L", "Title"), column("SiteTree", "Title"));
        select.replaceColumn("SiteTree", "Title", coalesce(args));

        assertEquals("SELECT COALESCE(\"L\".\"Title\", \"SiteTree\".\"Title\") AS \"Title\""
                     + " FROM \"SiteTree\""
                     + " WHERE COALESCE(\"L\".\"Title\", \"SiteTree\".\"Title\") = ?"
                     + " ORDER BY COALESCE(\"L\".\"Title\", \"SiteTree\".\"Title\")",
                     select.build(mDialect).getSQL());
    }

    public void testJoinFilter() {
        SQLSelect select = new SQLSelect()
            .addColumn("ID", column("A", "ID"))
            .setFrom("A")
            .addLeftJoin("B", "B", eq(column("A", "ID"), column("B", "ID")));

        select.setJoinFilter("B", and(eq(column("A", "ID"), column("B", "RecordID")),
                                      eq(column("B", "Locale"), param("fr_FR"))));
        assertEquals("SELECT \"A\".\"ID\" FROM \"A\" LEFT JOIN \"B\""
                     + " ON \"A\".\"ID\" = \"B\".\"RecordID\" AND \"B\".\"Locale\" = ?",
                     select.build(mDialect).getSQL());

        try {
            select.setJoinFilter("A", eq(param(1), param(1)));
            fail();
        } catch (IllegalArgumentException e) {
        }
        try {
            select.setJoinFilter("C", eq(param(1), param(1)));
            fail();
        } catch (IllegalArgumentException e) {
        }
        try {
            select.addLeftJoin("B", "B", eq(param(1), param(1)));
            fail();
        } catch (IllegalArgumentException e) {
        }
    }

    public void testSubSelect() {
        SQLSelect inner = new SQLSelect()
            .addColumn("Version", max(column("Latest", "Version")))
            .setFrom("SiteTree_Versions", "Latest")
            .addWhere(eq(column("Latest", "RecordID"), column("SiteTree", "RecordID")));

        SQLSelect outer = new SQLSelect()
            .addColumn("ID", column("SiteTree", "RecordID"))
            .setFrom("SiteTree_Versions", "SiteTree")
            .addWhere(eq(column("SiteTree", "Version"), subSelect(inner)));

        assertTrue(subSelect(inner).references("SiteTree"));
        assertFalse(subSelect(inner).references("Latest"));

        assertEquals("SELECT \"SiteTree\".\"RecordID\" AS \"ID\""
                     + " FROM \"SiteTree_Versions\" \"SiteTree\""
                     + " WHERE \"SiteTree\".\"Version\" = (SELECT MAX(\"Latest\".\"Version\")"
                     + " AS \"Version\" FROM \"SiteTree_Versions\" \"Latest\""
                     + " WHERE \"Latest\".\"RecordID\" = \"SiteTree\".\"RecordID\")",
                     outer.build(mDialect).getSQL());
    }

    public void testManipulationStatements() {
        Map<String, Object> values = new LinkedHashMap<String, Object>();
        values.put("Title", "Hello");
        values.put("Sort", 3);
        Map<String, Object> keys = new LinkedHashMap<String, Object>();
        keys.put("ID", 7L);

        SQLStatementBuilder b = new SQLUpdate("SiteTree", values, keys).build(mDialect);
        assertEquals("UPDATE \"SiteTree\" SET \"Title\" = ?, \"Sort\" = ? WHERE \"ID\" = ?",
                     b.getSQL());
        assertEquals(Arrays.<Object>asList("Hello", 3, 7L), b.getParameters());

        b = new SQLInsert("SiteTree", values).build(mDialect);
        assertEquals("INSERT INTO \"SiteTree\" (\"Title\", \"Sort\") VALUES (?, ?)", b.getSQL());

        b = new SQLDelete("SiteTree", keys).build(mDialect);
        assertEquals("DELETE FROM \"SiteTree\" WHERE \"ID\" = ?", b.getSQL());

        b = new SQLUpdate("SiteTree_Localised")
            .set("RecordID", 1L)
            .addWhere(in(column(null, "RecordID"), Arrays.asList(1L, 2L, 3L)))
            .build(mDialect);
        assertEquals("UPDATE \"SiteTree_Localised\" SET \"RecordID\" = ?"
                     + " WHERE \"RecordID\" IN (?, ?, ?)", b.getSQL());
        assertEquals(4, b.getParameters().size());

        assertEquals("ALTER TABLE \"SiteTree\" DROP COLUMN \"Locale\"",
                     new SQLDropColumn("SiteTree", "Locale").build(mDialect).getSQL());
        assertEquals("DROP TABLE IF EXISTS \"SiteTree_translationgroups\"",
                     new SQLDropTable("SiteTree_translationgroups").build(mDialect).getSQL());
        assertTrue(new SQLDropTable("x").isSchemaChange());
        assertFalse(new SQLDelete("x").isSchemaChange());
    }

    public void testTableDefinition() {
        TableDefinition def = new TableDefinition("SiteTree_Localised")
            .addColumn("ID", ColumnType.IDENTITY)
            .addColumn("RecordID", ColumnType.BIGINT)
            .addColumn("Locale", ColumnType.LOCALE)
            .addColumn("Title", ColumnType.VARCHAR)
            .addUniqueIndex("RecordLocale", "RecordID", "Locale");

        List<SQLStatement> statements = def.toStatements();
        assertEquals(2, statements.size());
        assertEquals("CREATE TABLE IF NOT EXISTS \"SiteTree_Localised\" ("
                     + "\"ID\" BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY, "
                     + "\"RecordID\" BIGINT, \"Locale\" VARCHAR(20), \"Title\" VARCHAR(255))",
                     statements.get(0).build(mDialect).getSQL());
        assertEquals("CREATE UNIQUE INDEX IF NOT EXISTS \"SiteTree_Localised_RecordLocale\""
                     + " ON \"SiteTree_Localised\" (\"RecordID\", \"Locale\")",
                     statements.get(1).build(mDialect).getSQL());
    }

    public void testTableManipulation() {
        TableManipulation m = new TableManipulation(TableManipulation.Command.UPSERT, 4L)
            .setKey("RecordID", 4L)
            .setKey("Locale", "fr_FR");

        assertNull(m.toUpdate("T"));
        assertEquals("INSERT INTO \"T\" (\"RecordID\", \"Locale\") VALUES (?, ?)",
                     m.toInsert("T").build(mDialect).getSQL());

        m.setField("Title", "Bonjour");
        assertEquals("UPDATE \"T\" SET \"Title\" = ? WHERE \"RecordID\" = ? AND \"Locale\" = ?",
                     m.toUpdate("T").build(mDialect).getSQL());
        assertEquals("Bonjour", m.removeField("Title"));
        assertFalse(m.hasField("Title"));

        try {
            new TableManipulation(TableManipulation.Command.DELETE, 1L).toDelete("T");
            fail();
        } catch (IllegalStateException e) {
        }
    }
}
