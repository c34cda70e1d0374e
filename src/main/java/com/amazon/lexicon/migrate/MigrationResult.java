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

package com.amazon.lexicon.migrate;

/**
 * Counts of what a migration run did.
 */
public class MigrationResult {
    private int mTypesMigrated;
    private int mGroupsMigrated;
    private int mRecordsReplayed;
    private int mRecordsSkipped;

    MigrationResult() {
    }

    /**
     * Returns the number of record types which had a translation groups
     * table.
     */
    public int getTypesMigrated() {
        return mTypesMigrated;
    }

    /**
     * Returns the number of translation groups consolidated into one record.
     */
    public int getGroupsMigrated() {
        return mGroupsMigrated;
    }

    public int getRecordsReplayed() {
        return mRecordsReplayed;
    }

    /**
     * Returns the number of group members which were not replayed, because
     * their locale was missing or unknown, or their class was obsolete.
     */
    public int getRecordsSkipped() {
        return mRecordsSkipped;
    }

    void typeMigrated() {
        mTypesMigrated++;
    }

    void groupMigrated() {
        mGroupsMigrated++;
    }

    void recordReplayed() {
        mRecordsReplayed++;
    }

    void recordSkipped() {
        mRecordsSkipped++;
    }

    @Override
    public String toString() {
        return "MigrationResult {types=" + mTypesMigrated + ", groups=" + mGroupsMigrated
            + ", replayed=" + mRecordsReplayed + ", skipped=" + mRecordsSkipped + '}';
    }
}
