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

package com.amazon.lexicon.info;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import com.amazon.lexicon.sql.ColumnType;

/**
 * Data fields of one table in a record type's hierarchy. System columns,
 * such as ID and ClassName, are not listed.
 */
public class TableInfo {
    private final String mName;
    private final Map<String, ColumnType> mFields;

    TableInfo(String name) {
        mName = name;
        mFields = new LinkedHashMap<String, ColumnType>();
    }

    public String getName() {
        return mName;
    }

    public Set<String> getFieldNames() {
        return Collections.unmodifiableSet(mFields.keySet());
    }

    public Map<String, ColumnType> getFields() {
        return Collections.unmodifiableMap(mFields);
    }

    public ColumnType getFieldType(String field) {
        return mFields.get(field);
    }

    void addField(String name, ColumnType type) {
        mFields.put(name, type);
    }

    @Override
    public String toString() {
        return mName + mFields.keySet();
    }
}
