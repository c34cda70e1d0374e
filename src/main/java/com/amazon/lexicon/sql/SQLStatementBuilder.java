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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Accumulates statement text and bound parameters. Only keywords and
 * punctuation are appended directly; identifiers are quoted by the dialect
 * and values become parameters.
 */
public class SQLStatementBuilder {
    private final SQLDialect mDialect;
    private final StringBuilder mText;
    private final List<Object> mParameters;

    public SQLStatementBuilder(SQLDialect dialect) {
        mDialect = dialect;
        mText = new StringBuilder(100);
        mParameters = new ArrayList<Object>();
    }

    public SQLDialect getDialect() {
        return mDialect;
    }

    public SQLStatementBuilder append(char c) {
        mText.append(c);
        return this;
    }

    SQLStatementBuilder append(String keywords) {
        mText.append(keywords);
        return this;
    }

    public SQLStatementBuilder appendIdentifier(String name) {
        mText.append(mDialect.quoteIdentifier(name));
        return this;
    }

    /**
     * Appends a qualified column reference, or an unqualified one if alias
     * is null.
     */
    public SQLStatementBuilder appendColumn(String alias, String column) {
        if (alias != null) {
            appendIdentifier(alias);
            mText.append('.');
        }
        return appendIdentifier(column);
    }

    public SQLStatementBuilder appendParameter(Object value) {
        mText.append('?');
        mParameters.add(value);
        return this;
    }

    public String getSQL() {
        return mText.toString();
    }

    public List<Object> getParameters() {
        return Collections.unmodifiableList(mParameters);
    }

    @Override
    public String toString() {
        if (mParameters.isEmpty()) {
            return mText.toString();
        }
        return mText.toString() + " -- " + mParameters;
    }
}
