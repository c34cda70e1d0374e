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
 * Binary comparison of two expressions.
 */
public class Comparison extends SQLExpression {
    public enum Operator {
        EQ(" = "), NE(" <> "), LE(" <= ");

        final String mText;

        private Operator(String text) {
            mText = text;
        }
    }

    private final SQLExpression mLeft;
    private final Operator mOperator;
    private final SQLExpression mRight;

    public Comparison(SQLExpression left, Operator op, SQLExpression right) {
        if (left == null || op == null || right == null) {
            throw new IllegalArgumentException();
        }
        mLeft = left;
        mOperator = op;
        mRight = right;
    }

    public SQLExpression getLeft() {
        return mLeft;
    }

    public Operator getOperator() {
        return mOperator;
    }

    public SQLExpression getRight() {
        return mRight;
    }

    @Override
    public void appendTo(SQLStatementBuilder b) {
        mLeft.appendTo(b);
        b.append(mOperator.mText);
        mRight.appendTo(b);
    }

    @Override
    public SQLExpression replaceColumn(String alias, String column, SQLExpression replacement) {
        SQLExpression left = mLeft.replaceColumn(alias, column, replacement);
        SQLExpression right = mRight.replaceColumn(alias, column, replacement);
        if (left == mLeft && right == mRight) {
            return this;
        }
        return new Comparison(left, mOperator, right);
    }

    @Override
    public boolean references(String alias) {
        return mLeft.references(alias) || mRight.references(alias);
    }
}
