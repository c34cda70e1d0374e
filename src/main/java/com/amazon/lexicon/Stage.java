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

/**
 * Lifecycle stage of a record. Draft data lives in unsuffixed tables and
 * published data is mirrored into tables with the live suffix.
 */
public enum Stage {
    DRAFT(""),

    LIVE("_Live");

    private final String mSuffix;

    private Stage(String suffix) {
        mSuffix = suffix;
    }

    /**
     * Returns the physical table suffix for this stage, which is empty for
     * draft.
     */
    public String getTableSuffix() {
        return mSuffix;
    }

    /**
     * Returns the stage matching the given name, ignoring case.
     *
     * @throws IllegalArgumentException if name is unknown
     */
    public static Stage forName(String name) {
        for (Stage stage : values()) {
            if (stage.name().equalsIgnoreCase(name)) {
                return stage;
            }
        }
        throw new IllegalArgumentException("Unknown stage: " + name);
    }
}
