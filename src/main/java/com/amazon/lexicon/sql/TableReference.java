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
 * Entry of a select's FROM clause: a physical table under an alias, joined
 * by a filter unless it is the root table. Renaming the table keeps the
 * alias, so column references stay valid.
 */
public class TableReference {
    public enum JoinType {
        /** Root table of the select */
        FROM(null),
        INNER(" INNER JOIN "),
        LEFT(" LEFT JOIN ");

        final String mText;

        private JoinType(String text) {
            mText = text;
        }
    }

    private final String mAlias;
    private final JoinType mJoinType;

    private String mTable;
    private SQLExpression mFilter;

    TableReference(String table, String alias, JoinType joinType, SQLExpression filter) {
        if (table == null || alias == null) {
            throw new IllegalArgumentException("Table and alias are required");
        }
        if ((joinType == JoinType.FROM) != (filter == null)) {
            throw new IllegalArgumentException("Only joined tables have a join filter");
        }
        mTable = table;
        mAlias = alias;
        mJoinType = joinType;
        mFilter = filter;
    }

    public String getTable() {
        return mTable;
    }

    public String getAlias() {
        return mAlias;
    }

    public JoinType getJoinType() {
        return mJoinType;
    }

    /**
     * Returns the join filter, or null for the root table.
     */
    public SQLExpression getFilter() {
        return mFilter;
    }

    void setTable(String table) {
        mTable = table;
    }

    void setFilter(SQLExpression filter) {
        mFilter = filter;
    }

    void appendTo(SQLStatementBuilder b) {
        if (mJoinType == JoinType.FROM) {
            b.append(" FROM ");
        } else {
            b.append(mJoinType.mText);
        }
        b.appendIdentifier(mTable);
        if (!mTable.equals(mAlias)) {
            b.append(' ');
            b.appendIdentifier(mAlias);
        }
        if (mFilter != null) {
            b.append(" ON ");
            mFilter.appendTo(b);
        }
    }

    @Override
    public String toString() {
        return "{table=" + mTable + ", alias=" + mAlias + ", join=" + mJoinType
            + (mFilter == null ? "" : ", filter=" + mFilter) + '}';
    }
}
