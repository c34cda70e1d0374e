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

import java.sql.Connection;
import java.sql.Savepoint;
import java.sql.SQLException;

/**
 * JDBCTransaction is just a wrapper around a connection and (optionally) a
 * savepoint.
 */
class JDBCTransaction {
    private final boolean mIsNested;
    private final Connection mConnection;

    private boolean mReady = true;

    private Savepoint mSavepoint;

    /**
     * @param con connection with auto-commit disabled
     */
    JDBCTransaction(Connection con) {
        mIsNested = false;
        mConnection = con;
    }

    /**
     * Construct a nested transaction.
     */
    JDBCTransaction(JDBCTransaction parent) throws SQLException {
        mIsNested = true;
        mConnection = parent.mConnection;
        mSavepoint = mConnection.setSavepoint();
    }

    Connection getConnection() {
        return mConnection;
    }

    boolean isNested() {
        return mIsNested;
    }

    void commit() throws SQLException {
        if (mIsNested) {
            if (mSavepoint != null) {
                mConnection.releaseSavepoint(mSavepoint);
                mSavepoint = null;
            }
        } else {
            mConnection.commit();
        }
        mReady = false;
    }

    /**
     * Rolls back if not committed.
     *
     * @return connection to close, or null if not ready to because this was a
     * nested transaction
     */
    Connection abort() throws SQLException {
        if (mIsNested) {
            if (mReady) {
                if (mSavepoint != null) {
                    mConnection.rollback(mSavepoint);
                    mSavepoint = null;
                }
                mReady = false;
            }
            return null;
        } else {
            if (mReady) {
                mConnection.rollback();
                mReady = false;
            }
            return mConnection;
        }
    }
}
