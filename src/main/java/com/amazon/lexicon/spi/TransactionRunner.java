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

import com.amazon.lexicon.RepositoryException;
import com.amazon.lexicon.ScopedAction;

/**
 * Runs work inside a transaction which commits only if the action returns
 * normally.
 */
public interface TransactionRunner {
    /**
     * Runs the action in a transaction. If one is already in progress on
     * this thread, the action runs in a nested scope which rolls back on
     * failure without ending the outer transaction.
     */
    <T> T inTransaction(ScopedAction<T> action) throws RepositoryException;
}
