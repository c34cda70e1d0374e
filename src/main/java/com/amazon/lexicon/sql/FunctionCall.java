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
 * Call of one of a fixed set of SQL functions.
 */
public class FunctionCall extends SQLExpression {
    public enum Function {
        COALESCE, MAX;
    }

    private final Function mFunction;
    private final List<SQLExpression> mArguments;

    public FunctionCall(Function function, List<? extends SQLExpression> arguments) {
        if (arguments.isEmpty()) {
            throw new IllegalArgumentException("No arguments");
        }
        mFunction = function;
        mArguments = Collections.unmodifiableList(new ArrayList<SQLExpression>(arguments));
    }

    public Function getFunction() {
        return mFunction;
    }

    public List<SQLExpression> getArguments() {
        return mArguments;
    }

    @Override
    public void appendTo(SQLStatementBuilder b) {
        b.append(mFunction.name());
        b.append('(');
        for (int i=0; i<mArguments.size(); i++) {
            if (i > 0) {
                b.append(", ");
            }
            mArguments.get(i).appendTo(b);
        }
        b.append(')');
    }

    @Override
    public SQLExpression replaceColumn(String alias, String column, SQLExpression replacement) {
        List<SQLExpression> args = replaceAll(mArguments, alias, column, replacement);
        return args == mArguments ? this : new FunctionCall(mFunction, args);
    }

    @Override
    public boolean references(String alias) {
        for (SQLExpression arg : mArguments) {
            if (arg.references(alias)) {
                return true;
            }
        }
        return false;
    }
}
