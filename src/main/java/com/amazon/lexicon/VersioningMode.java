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
 * Value of the {@code Versioned.mode} query parameter, which selects how a
 * read is scoped to stages or versions.
 */
public enum VersioningMode {
    /** Read the current data of one stage */
    STAGE("stage", false),

    /** Read the current data of one stage, without duplicates */
    STAGE_UNIQUE("stage_unique", false),

    /** Read the latest published version as of a given date */
    ARCHIVE("archive", true),

    /** Read every version of a record */
    ALL_VERSIONS("all_versions", true),

    /** Read the latest version of every record */
    LATEST_VERSIONS("latest_versions", true),

    /** Read one specific version */
    VERSION("version", true);

    private final String mName;
    private final boolean mReadsVersions;

    private VersioningMode(String name, boolean readsVersions) {
        mName = name;
        mReadsVersions = readsVersions;
    }

    /**
     * Returns the parameter value for this mode, as passed in queries.
     */
    public String getName() {
        return mName;
    }

    /**
     * Returns true if reads in this mode are answered from the versions
     * tables.
     */
    public boolean readsVersions() {
        return mReadsVersions;
    }

    /**
     * Converts a query parameter value into a mode.
     *
     * @param value mode instance or mode name; null yields null
     * @throws UnsupportedVersioningModeException if value is not recognized
     */
    public static VersioningMode forValue(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof VersioningMode) {
            return (VersioningMode) value;
        }
        if (value instanceof String) {
            for (VersioningMode mode : values()) {
                if (mode.mName.equals(value)) {
                    return mode;
                }
            }
        }
        throw new UnsupportedVersioningModeException(value);
    }

    @Override
    public String toString() {
        return mName;
    }
}
