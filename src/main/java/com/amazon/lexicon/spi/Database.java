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

import java.util.List;
import java.util.Map;
import java.util.Set;

import com.amazon.lexicon.FetchException;
import com.amazon.lexicon.PersistException;

import com.amazon.lexicon.sql.SQLInsert;
import com.amazon.lexicon.sql.SQLManipulation;
import com.amazon.lexicon.sql.SQLSelect;
import com.amazon.lexicon.sql.SQLStatement;
import com.amazon.lexicon.sql.TableDefinition;

/**
 * Executes statement trees against a database. When called within a
 * transaction, all calls join it.
 */
public interface Database {
    /**
     * Returns all rows, each mapping result column names to values.
     */
    List<Map<String, Object>> select(SQLSelect select) throws FetchException;

    /**
     * @return number of rows affected
     */
    int execute(SQLStatement statement) throws PersistException;

    /**
     * Applies every table write of the manipulation, in order.
     */
    void execute(SQLManipulation manipulation) throws PersistException;

    /**
     * Inserts a row into a table with a generated key.
     *
     * @return generated key
     */
    long insert(SQLInsert insert) throws PersistException;

    /**
     * Returns all table names, keyed by their lowercase form.
     */
    Map<String, String> getTableList() throws FetchException;

    /**
     * Returns the column names of the given table, which is empty if the
     * table does not exist.
     */
    Set<String> getColumnNames(String table) throws FetchException;

    /**
     * Creates the table and its indexes, if not already present.
     */
    void createTable(TableDefinition definition) throws PersistException;
}
