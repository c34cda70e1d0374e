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

import java.util.Collections;
import java.util.List;

/**
 * Tests an expression against a list of bound values.
 */
public class InList extends SQLExpression {
    private final SQLExpression mLeft;
    private final List<Object> mValues;

    public InList(SQLExpression left, List<Object> values) {
        if (values.isEmpty()) {
            throw new IllegalArgumentException("IN list is empty");
        }
        mLeft = left;
        mValues = Collections.unmodifiableList(values);
    }

    public List<Object> getValues() {
        return mValues;
    }

    @Override
    public void appendTo(SQLStatementBuilder b) {
        mLeft.appendTo(b);
        b.append(" IN (");
        for (int i=0; i<mValues.size(); i++) {
            if (i > 0) {
                b.append(", ");
            }
            b.appendParameter(mValues.get(i));
        }
        b.append(')');
    }

    @Override
    public SQLExpression replaceColumn(String alias, String column, SQLExpression replacement) {
        SQLExpression left = mLeft.replaceColumn(alias, column, replacement);
        return left == mLeft ? this : new InList(left, mValues);
    }

    @Override
    public boolean references(String alias) {
        return mLeft.references(alias);
    }
}
