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

package com.amazon.lexicon.repo.jdbc;

import java.sql.SQLException;

import com.amazon.lexicon.FetchException;
import com.amazon.lexicon.PersistException;
import com.amazon.lexicon.UniqueConstraintException;

/**
 * Transforms SQL exceptions into repository exceptions, according to their
 * SQLSTATE code.
 */
class JDBCExceptionTransformer {
    // SQLSTATE codes are five characters long, where the first two indicate
    // error class. The codes are fairly standard across all major database
    // implementations.

    /** Two digit SQLSTATE class prefix for all constraint violations */
    public static final String SQLSTATE_CONSTRAINT_VIOLATION_CLASS_CODE = "23";

    /**
     * Five digit SQLSTATE code for "A violation of the constraint imposed by a
     * unique index or a unique constraint occurred"
     */
    public static final String SQLSTATE_UNIQUE_CONSTRAINT_VIOLATION = "23505";

    JDBCExceptionTransformer() {
    }

    /**
     * Examines the SQLSTATE code of the given SQL exception and determines if
     * it is a generic constaint violation.
     */
    public boolean isConstraintError(SQLException e) {
        if (e != null) {
            String sqlstate = e.getSQLState();
            if (sqlstate != null) {
                return sqlstate.startsWith(SQLSTATE_CONSTRAINT_VIOLATION_CLASS_CODE);
            }
        }
        return false;
    }

    /**
     * Examines the SQLSTATE code of the given SQL exception and determines if
     * it is a unique constaint violation.
     */
    public boolean isUniqueConstraintError(SQLException e) {
        if (isConstraintError(e)) {
            String sqlstate = e.getSQLState();
            return SQLSTATE_UNIQUE_CONSTRAINT_VIOLATION.equals(sqlstate);
        }
        return false;
    }

    /**
     * Transforms the given throwable into an appropriate fetch exception. If
     * it already is a fetch exception, it is simply casted.
     *
     * @param e required exception to transform
     * @return FetchException, never null
     */
    public FetchException toFetchException(Throwable e) {
        if (e instanceof FetchException) {
            return (FetchException) e;
        }
        return new FetchException(e);
    }

    /**
     * Transforms the given throwable into an appropriate persist exception. If
     * it already is a persist exception, it is simply casted.
     *
     * @param e required exception to transform
     * @return PersistException, never null
     */
    public PersistException toPersistException(Throwable e) {
        if (e instanceof PersistException) {
            return (PersistException) e;
        }
        if (e instanceof FetchException) {
            return ((FetchException) e).toPersistException();
        }
        if (e instanceof SQLException) {
            SQLException se = (SQLException) e;
            if (isUniqueConstraintError(se)) {
                return new UniqueConstraintException(e);
            }
            if (isConstraintError(se)) {
                return new PersistException("Constraint violation", e);
            }
        }
        return new PersistException(e);
    }
}
