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

package com.amazon.lexicon;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import org.joda.time.DateTime;

/**
 * One row of a record type as seen by callers: system properties plus the
 * field values of every table in the type's hierarchy, keyed by column
 * name. Localized fields hold the value resolved for the locale the record
 * was read in.
 */
public class DataRecord {
    private final String mTypeName;
    private final Map<String, Object> mValues;

    private Long mId;
    private String mClassName;
    private int mVersion;
    private DateTime mCreated;
    private DateTime mLastEdited;

    public DataRecord(String typeName, String className) {
        if (typeName == null) {
            throw new IllegalArgumentException("Type name is required");
        }
        mTypeName = typeName;
        mClassName = className == null ? typeName : className;
        mValues = new LinkedHashMap<String, Object>();
    }

    public String getTypeName() {
        return mTypeName;
    }

    /**
     * Returns the record ID, or null if never written.
     */
    public Long getId() {
        return mId;
    }

    public void setId(Long id) {
        mId = id;
    }

    public String getClassName() {
        return mClassName;
    }

    public void setClassName(String className) {
        mClassName = className;
    }

    /**
     * Returns the version this record was read at, or last written as. Zero
     * for unversioned types and new records.
     */
    public int getVersion() {
        return mVersion;
    }

    public void setVersion(int version) {
        mVersion = version;
    }

    public DateTime getCreated() {
        return mCreated;
    }

    public void setCreated(DateTime created) {
        mCreated = created;
    }

    public DateTime getLastEdited() {
        return mLastEdited;
    }

    public void setLastEdited(DateTime lastEdited) {
        mLastEdited = lastEdited;
    }

    public Object get(String field) {
        return mValues.get(field);
    }

    public String getString(String field) {
        Object value = mValues.get(field);
        return value == null ? null : value.toString();
    }

    public DataRecord set(String field, Object value) {
        mValues.put(field, value);
        return this;
    }

    public boolean has(String field) {
        return mValues.containsKey(field);
    }

    /**
     * Returns an unmodifiable view of all field values.
     */
    public Map<String, Object> getValues() {
        return Collections.unmodifiableMap(mValues);
    }

    @Override
    public String toString() {
        StringBuilder b = new StringBuilder();
        b.append(mClassName);
        b.append(" {ID=");
        b.append(mId);
        if (mVersion > 0) {
            b.append(", Version=");
            b.append(mVersion);
        }
        for (Map.Entry<String, Object> entry : mValues.entrySet()) {
            b.append(", ");
            b.append(entry.getKey());
            b.append('=');
            b.append(entry.getValue());
        }
        b.append('}');
        return b.toString();
    }
}
