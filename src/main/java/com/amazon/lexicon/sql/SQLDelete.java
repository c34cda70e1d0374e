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
import java.util.List;
import java.util.Map;

/**
 * Delete of all rows of one table which match every condition.
 */
public class SQLDelete extends SQLStatement {
    private final String mTable;
    private final List<SQLExpression> mWhere;

    public SQLDelete(String table) {
        mTable = table;
        mWhere = new ArrayList<SQLExpression>();
    }

    public SQLDelete(String table, Map<String, ?> keys) {
        this(table);
        for (Map.Entry<String, ?> key : keys.entrySet()) {
            addWhere(SQLExpression.eq(SQLExpression.column(null, key.getKey()),
                                      SQLExpression.param(key.getValue())));
        }
    }

    public String getTable() {
        return mTable;
    }

    public SQLDelete addWhere(SQLExpression condition) {
        mWhere.add(condition);
        return this;
    }

    public List<SQLExpression> getWhere() {
        return Collections.unmodifiableList(mWhere);
    }

    @Override
    public void appendTo(SQLStatementBuilder b) {
        b.append("DELETE FROM ");
        b.appendIdentifier(mTable);
        if (!mWhere.isEmpty()) {
            b.append(" WHERE ");
            SQLExpression.and(mWhere).appendTo(b);
        }
    }
}
