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
import java.util.Set;

/**
 * All table writes produced for one record write, keyed by physical table
 * name. Writes are applied in the order their tables were added, and hooks
 * may edit the manipulation in place before it is applied.
 */
public class SQLManipulation {
    private final Map<String, TableManipulation> mTables;

    public SQLManipulation() {
        mTables = new LinkedHashMap<String, TableManipulation>();
    }

    public SQLManipulation put(String table, TableManipulation manipulation) {
        mTables.put(table, manipulation);
        return this;
    }

    /**
     * Returns the manipulation for the given table, or null if none.
     */
    public TableManipulation get(String table) {
        return mTables.get(table);
    }

    public boolean contains(String table) {
        return mTables.containsKey(table);
    }

    public TableManipulation remove(String table) {
        return mTables.remove(table);
    }

    public Set<String> getTables() {
        return Collections.unmodifiableSet(mTables.keySet());
    }

    public Map<String, TableManipulation> getManipulations() {
        return Collections.unmodifiableMap(mTables);
    }

    public boolean isEmpty() {
        return mTables.isEmpty();
    }

    @Override
    public String toString() {
        return "SQLManipulation " + mTables;
    }
}
