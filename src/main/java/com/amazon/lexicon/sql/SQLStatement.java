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
 * Simple DOM representing a SQL statement. Statements are only turned into
 * text by {@link #build build}.
 */
public abstract class SQLStatement {
    /**
     * Renders this statement for the given dialect.
     */
    public SQLStatementBuilder build(SQLDialect dialect) {
        SQLStatementBuilder b = new SQLStatementBuilder(dialect);
        appendTo(b);
        return b;
    }

    public abstract void appendTo(SQLStatementBuilder b);

    /**
     * Returns true if this statement changes table structure, which many
     * databases commit implicitly.
     */
    public boolean isSchemaChange() {
        return false;
    }

    /**
     * Just used for debugging.
     */
    @Override
    public String toString() {
        return build(SQLDialect.getDefault()).toString();
    }
}
