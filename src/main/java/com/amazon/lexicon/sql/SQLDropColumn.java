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
 * Removes a column from a table.
 */
public class SQLDropColumn extends SQLStatement {
    private final String mTable;
    private final String mColumn;

    public SQLDropColumn(String table, String column) {
        mTable = table;
        mColumn = column;
    }

    @Override
    public void appendTo(SQLStatementBuilder b) {
        b.append("ALTER TABLE ");
        b.appendIdentifier(mTable);
        b.append(" DROP COLUMN ");
        b.appendIdentifier(mColumn);
    }

    @Override
    public boolean isSchemaChange() {
        return true;
    }
}
