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

/**
 * Dialect specific rendering rules. All identifiers pass through
 * {@link #quoteIdentifier quoteIdentifier}, and values are only ever bound
 * as statement parameters. The default rules suit H2.
 */
public class SQLDialect {
    private static SQLDialect cDefault;

    /**
     * Returns a shared instance with default rules.
     */
    public static SQLDialect getDefault() {
        if (cDefault == null) {
            cDefault = new SQLDialect();
        }
        return cDefault;
    }

    public SQLDialect() {
    }

    /**
     * Quotes a table, alias or column name. Embedded quote characters are
     * doubled.
     *
     * @throws IllegalArgumentException if name is empty or contains a NUL
     */
    public String quoteIdentifier(String name) {
        if (name == null || name.length() == 0) {
            throw new IllegalArgumentException("Identifier is empty");
        }
        StringBuilder b = new StringBuilder(name.length() + 2);
        b.append('"');
        for (int i=0; i<name.length(); i++) {
            char c = name.charAt(i);
            if (c == 0) {
                throw new IllegalArgumentException("Illegal character in identifier: " + name);
            }
            if (c == '"') {
                b.append('"');
            }
            b.append(c);
        }
        b.append('"');
        return b.toString();
    }

    /**
     * Returns the column type declaration for the given type.
     */
    public String typeName(ColumnType type) {
        switch (type) {
        case IDENTITY:
            return "BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY";
        case RECORD_ID:
            return "BIGINT NOT NULL PRIMARY KEY";
        case BIGINT:
            return "BIGINT";
        case INTEGER:
            return "INT";
        case BOOLEAN:
            return "BOOLEAN";
        case LOCALE:
            return "VARCHAR(20)";
        case VARCHAR:
            return "VARCHAR(255)";
        case TEXT:
            return "CLOB";
        case TIMESTAMP:
            return "TIMESTAMP";
        default:
            throw new IllegalArgumentException("Unknown column type: " + type);
        }
    }

    /**
     * Appends a row limit to a select statement.
     */
    public void appendLimit(SQLStatementBuilder b, int limit) {
        b.append(" LIMIT ");
        b.append(Integer.toString(limit));
    }
}
