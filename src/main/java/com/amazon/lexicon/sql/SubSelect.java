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
 * Scalar select used as an expression. The nested select is rendered as is;
 * column replacement does not descend into it.
 */
public class SubSelect extends SQLExpression {
    private final SQLSelect mSelect;

    public SubSelect(SQLSelect select) {
        mSelect = select;
    }

    public SQLSelect getSelect() {
        return mSelect;
    }

    @Override
    public void appendTo(SQLStatementBuilder b) {
        b.append('(');
        mSelect.appendTo(b);
        b.append(')');
    }

    @Override
    public boolean references(String alias) {
        return mSelect.referencesOuter(alias);
    }
}
