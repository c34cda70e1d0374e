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
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.amazon.lexicon.capability.Capability;

/**
 * Registry of all known record types, consulted instead of introspecting
 * classes at runtime.
 */
public class RecordTypeRegistry {
    private final Map<String, RecordType> mTypes;

    public RecordTypeRegistry() {
        mTypes = new LinkedHashMap<String, RecordType>();
    }

    /**
     * @throws IllegalArgumentException if a type of the same name, or with
     * the same base table, is already registered
     */
    public synchronized void register(RecordType type) {
        for (RecordType existing : mTypes.values()) {
            if (existing.getName().equals(type.getName())
                || existing.getBaseTable().equals(type.getBaseTable()))
            {
                throw new IllegalArgumentException("Record type already registered: " + existing);
            }
        }
        mTypes.put(type.getName(), type);
    }

    /**
     * Returns the type with the given name, or null if not registered.
     */
    public synchronized RecordType getType(String name) {
        return mTypes.get(name);
    }

    public synchronized List<RecordType> getTypes() {
        return Collections.unmodifiableList(new ArrayList<RecordType>(mTypes.values()));
    }

    /**
     * Returns all types registered with the given capability, in
     * registration order.
     */
    public synchronized List<RecordType> getTypesWith(Class<? extends Capability> capabilityType) {
        List<RecordType> types = new ArrayList<RecordType>();
        for (RecordType type : mTypes.values()) {
            if (type.hasCapability(capabilityType)) {
                types.add(type);
            }
        }
        return types;
    }
}
