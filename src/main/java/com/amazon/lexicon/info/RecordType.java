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

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.amazon.lexicon.ConfigurationException;

import com.amazon.lexicon.capability.Capability;
import com.amazon.lexicon.capability.LocalizedCapability;
import com.amazon.lexicon.capability.VersionedCapability;

import com.amazon.lexicon.sql.ColumnType;

/**
 * Describes a record type: its hierarchy of tables, the concrete class names
 * which may be stored in it, and the capabilities it was registered with.
 * The first table is the base table, which holds the record ID.
 */
public class RecordType {
    private final String mName;
    private final List<TableInfo> mTables;
    private final Set<String> mClassNames;
    private final Map<Class<? extends Capability>, Capability> mCapabilities;

    private RecordType(Builder builder) {
        mName = builder.mName;
        mTables = Collections.unmodifiableList(new ArrayList<TableInfo>(builder.mTables.values()));
        mClassNames = Collections.unmodifiableSet(new LinkedHashSet<String>(builder.mClassNames));
        mCapabilities = new LinkedHashMap<Class<? extends Capability>, Capability>();

        if (builder.mVersioned) {
            mCapabilities.put(VersionedCapability.class, new Versioned());
        }
        if (!builder.mLocalized.isEmpty()) {
            mCapabilities.put(LocalizedCapability.class,
                              new Localized(builder.mLocalized, builder.mPrepopulated));
        }
    }

    public String getName() {
        return mName;
    }

    public String getBaseTable() {
        return mTables.get(0).getName();
    }

    /**
     * Returns the tables of the hierarchy, base table first.
     */
    public List<TableInfo> getTables() {
        return mTables;
    }

    /**
     * Returns the table with the given name, or null if not part of this
     * type.
     */
    public TableInfo getTable(String name) {
        for (TableInfo table : mTables) {
            if (table.getName().equals(name)) {
                return table;
            }
        }
        return null;
    }

    /**
     * Returns the class names which records of this type may currently have.
     */
    public Set<String> getClassNames() {
        return mClassNames;
    }

    /**
     * Returns false if records with the given class name were left behind by
     * a class which no longer exists.
     */
    public boolean isCurrentClassName(String className) {
        return className != null && mClassNames.contains(className);
    }

    /**
     * Returns the given capability, or null if this type was not registered
     * with it.
     */
    public <C extends Capability> C getCapability(Class<C> capabilityType) {
        Capability capability = mCapabilities.get(capabilityType);
        if (capability == null) {
            for (Capability c : mCapabilities.values()) {
                if (capabilityType.isInstance(c)) {
                    capability = c;
                    break;
                }
            }
        }
        return capabilityType.cast(capability);
    }

    public boolean hasCapability(Class<? extends Capability> capabilityType) {
        return getCapability(capabilityType) != null;
    }

    @Override
    public String toString() {
        return "RecordType {name=" + mName + ", tables=" + mTables
            + ", capabilities=" + mCapabilities.keySet() + '}';
    }

    /**
     * Builds record types. Tables are added implicitly by adding fields, in
     * the order of first use; the base table must therefore come first.
     *
     * <pre>
     * RecordType.Builder builder = new RecordType.Builder("SiteTree");
     * builder.addTable("SiteTree");
     * builder.addLocalizedField("SiteTree", "Title", ColumnType.VARCHAR);
     * builder.addField("SiteTree", "URLSegment", ColumnType.VARCHAR);
     * builder.addClassName("Page");
     * builder.setVersioned(true);
     * RecordType type = builder.build();
     * </pre>
     */
    public static class Builder {
        private final String mName;
        private final Map<String, TableInfo> mTables;
        private final Map<String, List<String>> mLocalized;
        private final Set<String> mClassNames;
        private boolean mVersioned;
        private boolean mPrepopulated;

        public Builder(String name) {
            mName = name;
            mTables = new LinkedHashMap<String, TableInfo>();
            mLocalized = new LinkedHashMap<String, List<String>>();
            mClassNames = new LinkedHashSet<String>();
        }

        public Builder addTable(String table) {
            if (!mTables.containsKey(table)) {
                mTables.put(table, new TableInfo(table));
            }
            return this;
        }

        public Builder addField(String table, String field, ColumnType type) {
            addTable(table);
            mTables.get(table).addField(field, type);
            return this;
        }

        /**
         * Adds a field which is stored once per locale.
         */
        public Builder addLocalizedField(String table, String field, ColumnType type) {
            addField(table, field, type);
            List<String> fields = mLocalized.get(table);
            if (fields == null) {
                fields = new ArrayList<String>();
                mLocalized.put(table, fields);
            }
            if (!fields.contains(field)) {
                fields.add(field);
            }
            return this;
        }

        public Builder addClassName(String className) {
            mClassNames.add(className);
            return this;
        }

        public Builder setVersioned(boolean versioned) {
            mVersioned = versioned;
            return this;
        }

        public Builder setPrepopulated(boolean prepopulated) {
            mPrepopulated = prepopulated;
            return this;
        }

        public RecordType build() throws ConfigurationException {
            ArrayList<String> messages = new ArrayList<String>();
            errorCheck(messages);
            if (!messages.isEmpty()) {
                StringBuilder b = new StringBuilder();
                b.append("Record type ").append(mName).append(": ");
                for (int i=0; i<messages.size(); i++) {
                    if (i > 0) {
                        b.append("; ");
                    }
                    b.append(messages.get(i));
                }
                throw new ConfigurationException(b.toString());
            }
            if (mClassNames.isEmpty()) {
                mClassNames.add(mName);
            }
            return new RecordType(this);
        }

        public void errorCheck(Collection<String> messages) {
            if (mName == null) {
                messages.add("name missing");
            }
            if (mTables.isEmpty()) {
                messages.add("no tables");
            }
            if (mPrepopulated && mLocalized.isEmpty()) {
                messages.add("only localized types can be prepopulated");
            }
        }
    }

    private static class Versioned implements VersionedCapability {
        @Override
        public String toString() {
            return "VersionedCapability";
        }
    }

    private static class Localized implements LocalizedCapability {
        private final Map<String, List<String>> mTables;
        private final boolean mPrepopulated;

        Localized(Map<String, List<String>> tables, boolean prepopulated) {
            Map<String, List<String>> copy = new LinkedHashMap<String, List<String>>();
            for (Map.Entry<String, List<String>> entry : tables.entrySet()) {
                copy.put(entry.getKey(),
                         Collections.unmodifiableList(new ArrayList<String>(entry.getValue())));
            }
            mTables = Collections.unmodifiableMap(copy);
            mPrepopulated = prepopulated;
        }

        public Map<String, List<String>> getLocalizedTables() {
            return mTables;
        }

        public List<String> getLocalizedFields(String table) {
            List<String> fields = mTables.get(table);
            if (fields == null) {
                return Collections.emptyList();
            }
            return fields;
        }

        public boolean isPrepopulated() {
            return mPrepopulated;
        }

        @Override
        public String toString() {
            return "LocalizedCapability " + mTables;
        }
    }
}
