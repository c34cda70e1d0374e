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
 * Update of all rows of one table which match every condition.
 */
public class SQLUpdate extends SQLStatement {
    private final String mTable;
    private final Map<String, Object> mValues;
    private final List<SQLExpression> mWhere;

    public SQLUpdate(String table) {
        mTable = table;
        mValues = new LinkedHashMap<String, Object>();
        mWhere = new ArrayList<SQLExpression>();
    }

    public SQLUpdate(String table, Map<String, ?> values, Map<String, ?> keys) {
        this(table);
        mValues.putAll(values);
        for (Map.Entry<String, ?> key : keys.entrySet()) {
            addWhere(SQLExpression.eq(SQLExpression.column(null, key.getKey()),
                                      SQLExpression.param(key.getValue())));
        }
    }

    public String getTable() {
        return mTable;
    }

    public SQLUpdate set(String column, Object value) {
        mValues.put(column, value);
        return this;
    }

    public Map<String, Object> getValues() {
        return Collections.unmodifiableMap(mValues);
    }

    public SQLUpdate addWhere(SQLExpression condition) {
        mWhere.add(condition);
        return this;
    }

    @Override
    public void appendTo(SQLStatementBuilder b) {
        if (mValues.isEmpty()) {
            throw new IllegalStateException("No values to update in " + mTable);
        }
        b.append("UPDATE ");
        b.appendIdentifier(mTable);
        b.append(" SET ");
        int i = 0;
        for (Map.Entry<String, Object> entry : mValues.entrySet()) {
            if (i++ > 0) {
                b.append(", ");
            }
            b.appendIdentifier(entry.getKey());
            b.append(" = ");
            b.appendParameter(entry.getValue());
        }
        if (!mWhere.isEmpty()) {
            b.append(" WHERE ");
            SQLExpression.and(mWhere).appendTo(b);
        }
    }
}
