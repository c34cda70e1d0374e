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
 * Reference to a column of a table alias.
 */
public class Column extends SQLExpression {
    private final String mAlias;
    private final String mName;

    /**
     * @param alias table alias, or null if unqualified
     * @param name column name
     */
    public Column(String alias, String name) {
        if (name == null) {
            throw new IllegalArgumentException("Column name is required");
        }
        mAlias = alias;
        mName = name;
    }

    public String getAlias() {
        return mAlias;
    }

    public String getName() {
        return mName;
    }

    public boolean isColumn(String alias, String name) {
        return mName.equals(name) && (mAlias == null ? alias == null : mAlias.equals(alias));
    }

    @Override
    public void appendTo(SQLStatementBuilder b) {
        b.appendColumn(mAlias, mName);
    }

    @Override
    public SQLExpression replaceColumn(String alias, String column, SQLExpression replacement) {
        return isColumn(alias, column) ? replacement : this;
    }

    @Override
    public boolean references(String alias) {
        return mAlias != null && mAlias.equals(alias);
    }

    @Override
    public int hashCode() {
        return mName.hashCode() * 31 + (mAlias == null ? 0 : mAlias.hashCode());
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj instanceof Column) {
            Column other = (Column) obj;
            return other.isColumn(mAlias, mName);
        }
        return false;
    }
}
