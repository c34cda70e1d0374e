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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Insert of a single row.
 */
public class SQLInsert extends SQLStatement {
    private final String mTable;
    private final Map<String, Object> mValues;

    public SQLInsert(String table, Map<String, ?> values) {
        if (values.isEmpty()) {
            throw new IllegalArgumentException("No values to insert into " + table);
        }
        mTable = table;
        mValues = new LinkedHashMap<String, Object>(values);
    }

    public String getTable() {
        return mTable;
    }

    public Map<String, Object> getValues() {
        return Collections.unmodifiableMap(mValues);
    }

    @Override
    public void appendTo(SQLStatementBuilder b) {
        b.append("INSERT INTO ");
        b.appendIdentifier(mTable);
        b.append(" (");
        int i = 0;
        for (String column : mValues.keySet()) {
            if (i++ > 0) {
                b.append(", ");
            }
            b.appendIdentifier(column);
        }
        b.append(") VALUES (");
        i = 0;
        for (Object value : mValues.values()) {
            if (i++ > 0) {
                b.append(", ");
            }
            b.appendParameter(value);
        }
        b.append(')');
    }
}
