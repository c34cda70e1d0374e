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
import java.util.Arrays;
import java.util.Collection;
import java.util.List;

/**
 * Node of an expression tree used in select lists, join filters, where
 * clauses and ordering. Nodes are immutable; rewriting produces new trees.
 */
public abstract class SQLExpression {
    public static Column column(String alias, String name) {
        return new Column(alias, name);
    }

    public static Parameter param(Object value) {
        return new Parameter(value);
    }

    public static Comparison eq(SQLExpression left, SQLExpression right) {
        return new Comparison(left, Comparison.Operator.EQ, right);
    }

    public static Comparison ne(SQLExpression left, SQLExpression right) {
        return new Comparison(left, Comparison.Operator.NE, right);
    }

    public static Comparison le(SQLExpression left, SQLExpression right) {
        return new Comparison(left, Comparison.Operator.LE, right);
    }

    public static SQLExpression and(SQLExpression... operands) {
        return and(Arrays.asList(operands));
    }

    public static SQLExpression and(List<? extends SQLExpression> operands) {
        if (operands.size() == 1) {
            return operands.get(0);
        }
        return new Conjunction(operands);
    }

    public static InList in(SQLExpression left, Collection<?> values) {
        return new InList(left, new ArrayList<Object>(values));
    }

    public static FunctionCall coalesce(List<? extends SQLExpression> arguments) {
        return new FunctionCall(FunctionCall.Function.COALESCE, arguments);
    }

    public static FunctionCall max(SQLExpression argument) {
        return new FunctionCall(FunctionCall.Function.MAX, Arrays.asList(argument));
    }

    public static SubSelect subSelect(SQLSelect select) {
        return new SubSelect(select);
    }

    SQLExpression() {
    }

    public abstract void appendTo(SQLStatementBuilder b);

    /**
     * Returns a tree in which every reference to the given column is
     * replaced. Returns this if no reference was found.
     */
    public SQLExpression replaceColumn(String alias, String column, SQLExpression replacement) {
        return this;
    }

    /**
     * Returns true if the given table alias is referenced anywhere in this
     * tree.
     */
    public boolean references(String alias) {
        return false;
    }

    /**
     * Just used for debugging.
     */
    @Override
    public String toString() {
        SQLStatementBuilder b = new SQLStatementBuilder(SQLDialect.getDefault());
        appendTo(b);
        return b.toString();
    }

    static List<SQLExpression> replaceAll(List<SQLExpression> list, String alias, String column,
                                          SQLExpression replacement)
    {
        List<SQLExpression> replaced = null;
        for (int i=0; i<list.size(); i++) {
            SQLExpression e = list.get(i);
            SQLExpression r = e.replaceColumn(alias, column, replacement);
            if (r != e) {
                if (replaced == null) {
                    replaced = new ArrayList<SQLExpression>(list);
                }
                replaced.set(i, r);
            }
        }
        return replaced == null ? list : replaced;
    }
}
