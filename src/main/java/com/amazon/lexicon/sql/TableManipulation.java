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
 * Write against one physical table on behalf of one record. Key columns
 * identify the affected row, and field columns carry the values to write.
 * For inserts, keys and fields are both written.
 */
public class TableManipulation {
    public enum Command {
        /** Append a new row */
        INSERT,
        /** Change an existing row, if any */
        UPDATE,
        /** Change the row with the given keys, inserting it if missing */
        UPSERT,
        /** Remove rows with the given keys */
        DELETE;
    }

    private final Command mCommand;
    private final long mRecordId;
    private final Map<String, Object> mKeys;
    private final Map<String, Object> mFields;

    /**
     * @param command write command
     * @param recordId ID of the logical record being written
     */
    public TableManipulation(Command command, long recordId) {
        if (command == null) {
            throw new IllegalArgumentException("Command is required");
        }
        mCommand = command;
        mRecordId = recordId;
        mKeys = new LinkedHashMap<String, Object>(4);
        mFields = new LinkedHashMap<String, Object>();
    }

    public Command getCommand() {
        return mCommand;
    }

    public long getRecordId() {
        return mRecordId;
    }

    public TableManipulation setKey(String column, Object value) {
        mKeys.put(column, value);
        return this;
    }

    public Map<String, Object> getKeys() {
        return Collections.unmodifiableMap(mKeys);
    }

    public TableManipulation setField(String column, Object value) {
        mFields.put(column, value);
        return this;
    }

    public boolean hasField(String column) {
        return mFields.containsKey(column);
    }

    public Object getField(String column) {
        return mFields.get(column);
    }

    public Object removeField(String column) {
        return mFields.remove(column);
    }

    public Map<String, Object> getFields() {
        return Collections.unmodifiableMap(mFields);
    }

    /**
     * Returns keys and fields combined, keys first.
     */
    public Map<String, Object> getRow() {
        Map<String, Object> row = new LinkedHashMap<String, Object>(mKeys);
        row.putAll(mFields);
        return row;
    }

    /**
     * Returns the update half of this manipulation, or null if there are no
     * fields to update.
     */
    public SQLUpdate toUpdate(String table) {
        if (mFields.isEmpty()) {
            return null;
        }
        return new SQLUpdate(table, mFields, mKeys);
    }

    public SQLInsert toInsert(String table) {
        return new SQLInsert(table, getRow());
    }

    public SQLDelete toDelete(String table) {
        if (mKeys.isEmpty()) {
            throw new IllegalStateException("Refusing to delete without keys from " + table);
        }
        return new SQLDelete(table, mKeys);
    }

    @Override
    public String toString() {
        return "{command=" + mCommand + ", recordId=" + mRecordId
            + ", keys=" + mKeys + ", fields=" + mFields + '}';
    }
}
