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

package com.amazon.lexicon.repo.jdbc;

import com.amazon.lexicon.DataRecord;
import com.amazon.lexicon.FetchException;
import com.amazon.lexicon.PersistException;

import com.amazon.lexicon.spi.PublishWorkflow;

/**
 * Publish workflow which writes records through the storage of their type.
 * Records of unversioned types cannot be published.
 */
class JDBCPublishWorkflow implements PublishWorkflow {
    private final LocalizedRepository mRepository;

    JDBCPublishWorkflow(LocalizedRepository repository) {
        mRepository = repository;
    }

    public boolean isPublished(DataRecord record) throws FetchException {
        Long id = record.getId();
        if (id == null) {
            return false;
        }
        return mRepository.getStorage(record.getTypeName()).isPublished(id);
    }

    public void writeToDraft(DataRecord record) throws PersistException {
        mRepository.getStorage(record.getTypeName()).writeToDraft(record);
    }

    public boolean publish(DataRecord record) throws PersistException {
        JDBCRecordStorage storage = mRepository.getStorage(record.getTypeName());
        if (!storage.isVersioned()) {
            return false;
        }
        storage.publish(record);
        return true;
    }
}
