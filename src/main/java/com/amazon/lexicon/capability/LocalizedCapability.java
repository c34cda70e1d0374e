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

package com.amazon.lexicon.capability;

import java.util.List;
import java.util.Map;

/**
 * Capability of record types which store some fields once per locale. Each
 * table of the type's hierarchy may declare localized fields, which are kept
 * in a companion localized table keyed by record ID and locale.
 */
public interface LocalizedCapability extends Capability {
    /**
     * Returns the tables which have localized fields, in hierarchy order,
     * mapped to their localized field names. Tables without localized
     * fields are not included.
     */
    Map<String, List<String>> getLocalizedTables();

    /**
     * Returns the localized fields of the given table, which is empty if the
     * table has none.
     */
    List<String> getLocalizedFields(String table);

    /**
     * Returns true if existence checks for this type should load the IDs of
     * all records in a locale at once. Intended for types which are listed
     * in bulk, such as page trees.
     */
    boolean isPrepopulated();
}
