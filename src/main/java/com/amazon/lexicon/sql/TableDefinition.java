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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Describes a table and its indexes, for creating tables which do not yet
 * exist.
 */
public class TableDefinition {
    private final String mName;
    private final Map<String, ColumnType> mColumns;
    private final Map<String, List<String>> mUniqueIndexes;

    public TableDefinition(String name) {
        mName = name;
        mColumns = new LinkedHashMap<String, ColumnType>();
        mUniqueIndexes = new LinkedHashMap<String, List<String>>();
    }

    public String getName() {
        return mName;
    }

    public TableDefinition addColumn(String name, ColumnType type) {
        mColumns.put(name, type);
        return this;
    }

    public TableDefinition addColumns(Map<String, ColumnType> columns) {
        mColumns.putAll(columns);
        return this;
    }

    public Map<String, ColumnType> getColumns() {
        return Collections.unmodifiableMap(mColumns);
    }

    /**
     * Adds a unique index. The physical index name is prefixed with the
     * table name, since index names are usually schema wide.
     */
    public TableDefinition addUniqueIndex(String name, String... columns) {
        List<String> list = new ArrayList<String>(columns.length);
        for (String column : columns) {
            list.add(column);
        }
        mUniqueIndexes.put(name, list);
        return this;
    }

    public Map<String, List<String>> getUniqueIndexes() {
        return Collections.unmodifiableMap(mUniqueIndexes);
    }

    /**
     * Returns the statements which create this table and its indexes.
     */
    public List<SQLStatement> toStatements() {
        List<SQLStatement> statements = new ArrayList<SQLStatement>(1 + mUniqueIndexes.size());
        statements.add(new CreateTable());
        for (Map.Entry<String, List<String>> index : mUniqueIndexes.entrySet()) {
            statements.add(new CreateIndex(mName + '_' + index.getKey(), index.getValue()));
        }
        return statements;
    }

    @Override
    public String toString() {
        return "TableDefinition {name=" + mName + ", columns=" + mColumns
            + ", uniqueIndexes=" + mUniqueIndexes + '}';
    }

    private class CreateTable extends SQLStatement {
        @Override
        public void appendTo(SQLStatementBuilder b) {
            b.append("CREATE TABLE IF NOT EXISTS ");
            b.appendIdentifier(mName);
            b.append(" (");
            int i = 0;
            for (Map.Entry<String, ColumnType> column : mColumns.entrySet()) {
                if (i++ > 0) {
                    b.append(", ");
                }
                b.appendIdentifier(column.getKey());
                b.append(' ');
                b.append(b.getDialect().typeName(column.getValue()));
            }
            b.append(')');
        }

        @Override
        public boolean isSchemaChange() {
            return true;
        }
    }

    private class CreateIndex extends SQLStatement {
        private final String mIndexName;
        private final List<String> mIndexColumns;

        CreateIndex(String name, List<String> columns) {
            mIndexName = name;
            mIndexColumns = columns;
        }

        @Override
        public void appendTo(SQLStatementBuilder b) {
            b.append("CREATE UNIQUE INDEX IF NOT EXISTS ");
            b.appendIdentifier(mIndexName);
            b.append(" ON ");
            b.appendIdentifier(mName);
            b.append(" (");
            for (int i=0; i<mIndexColumns.size(); i++) {
                if (i > 0) {
                    b.append(", ");
                }
                b.appendIdentifier(mIndexColumns.get(i));
            }
            b.append(')');
        }

        @Override
        public boolean isSchemaChange() {
            return true;
        }
    }
}
