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

package com.amazon.lexicon.sql;

/**
 * Column types which tables are created with. Rendering is left to
 * {@link SQLDialect#typeName}.
 */
public enum ColumnType {
    /** Generated surrogate primary key */
    IDENTITY,
    /** Primary key assigned from a base table */
    RECORD_ID,
    BIGINT,
    INTEGER,
    BOOLEAN,
    /** Locale code */
    LOCALE,
    VARCHAR,
    TEXT,
    TIMESTAMP;
}
