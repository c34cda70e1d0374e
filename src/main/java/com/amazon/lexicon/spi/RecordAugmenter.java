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

import com.amazon.lexicon.sql.SQLManipulation;
import com.amazon.lexicon.sql.SQLSelect;

/**
 * Hook points which the host storage calls for every read, write and delete
 * of one record type, in registration order. Augmenters edit the statements
 * in place before they are executed.
 */
public interface RecordAugmenter {
    /**
     * Called with the select built for a read, after the host has applied
     * its own stage and version rules.
     */
    void augmentQuery(SQLSelect query, QueryContext context);

    /**
     * Called with the manipulation built for a write, which covers every
     * stage and versions table the host writes to.
     */
    void augmentWrite(SQLManipulation manipulation, WriteContext context);

    /**
     * Called with the manipulation built to delete a record from the
     * context's stage.
     */
    void augmentDelete(SQLManipulation manipulation, WriteContext context);

    /**
     * Called after a write or delete has been applied.
     */
    void afterWrite(long recordId);
}
