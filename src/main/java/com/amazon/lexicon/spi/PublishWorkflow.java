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

package com.amazon.lexicon.spi;

import com.amazon.lexicon.DataRecord;
import com.amazon.lexicon.FetchException;
import com.amazon.lexicon.PersistException;

/**
 * Draft and publish operations of the host. Writes are localized for the
 * locale that is current when they are called.
 */
public interface PublishWorkflow {
    /**
     * Returns true if the record has a live row.
     */
    boolean isPublished(DataRecord record) throws FetchException;

    void writeToDraft(DataRecord record) throws PersistException;

    /**
     * Writes the record to draft and copies it to live.
     *
     * @return false if the host refused to publish the record
     */
    boolean publish(DataRecord record) throws PersistException;
}
