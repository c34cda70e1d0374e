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
 * Expressions joined by AND.
 */
public class Conjunction extends SQLExpression {
    private final List<SQLExpression> mOperands;

    public Conjunction(List<? extends SQLExpression> operands) {
        if (operands.isEmpty()) {
            throw new IllegalArgumentException("No operands");
        }
        mOperands = Collections.unmodifiableList(new ArrayList<SQLExpression>(operands));
    }

    public List<SQLExpression> getOperands() {
        return mOperands;
    }

    @Override
    public void appendTo(SQLStatementBuilder b) {
        for (int i=0; i<mOperands.size(); i++) {
            if (i > 0) {
                b.append(" AND ");
            }
            SQLExpression operand = mOperands.get(i);
            if (operand instanceof Conjunction) {
                b.append('(');
                operand.appendTo(b);
                b.append(')');
            } else {
                operand.appendTo(b);
            }
        }
    }

    @Override
    public SQLExpression replaceColumn(String alias, String column, SQLExpression replacement) {
        List<SQLExpression> operands = replaceAll(mOperands, alias, column, replacement);
        return operands == mOperands ? this : new Conjunction(operands);
    }

    @Override
    public boolean references(String alias) {
        for (SQLExpression operand : mOperands) {
            if (operand.references(alias)) {
                return true;
            }
        }
        return false;
    }
}
