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

package com.amazon.lexicon;

/**
 * General checked exception thrown when accessing localized record storage.
 *
 * @see FetchException
 * @see PersistException
 */
public class RepositoryException extends Exception {

    private static final long serialVersionUID = 2954683203748239165L;

    public RepositoryException() {
        super();
    }

    public RepositoryException(String message) {
        super(message);
    }

    public RepositoryException(String message, Throwable cause) {
        super(message, cause);
    }

    public RepositoryException(Throwable cause) {
        super(cause);
    }

    /**
     * Recursively calls getCause, until the root cause is found. Returns this
     * if no root cause.
     */
    public Throwable getRootCause() {
        Throwable cause = this;
        while (cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause;
    }

    /**
     * Converts RepositoryException into an appropriate PersistException.
     */
    public final PersistException toPersistException() {
        return toPersistException(null);
    }

    /**
     * Converts RepositoryException into an appropriate PersistException, prepending
     * the specified message. If message is null, original exception message is
     * preserved.
     *
     * @param message message to prepend, which may be null
     */
    public final PersistException toPersistException(final String message) {
        if (this instanceof PersistException && message == null) {
            return (PersistException) this;
        }
        return new PersistException(prepend(message), this);
    }

    /**
     * Converts RepositoryException into an appropriate FetchException.
     */
    public final FetchException toFetchException() {
        return toFetchException(null);
    }

    /**
     * Converts RepositoryException into an appropriate FetchException, prepending
     * the specified message. If message is null, original exception message is
     * preserved.
     *
     * @param message message to prepend, which may be null
     */
    public final FetchException toFetchException(final String message) {
        if (this instanceof FetchException && message == null) {
            return (FetchException) this;
        }
        return new FetchException(prepend(message), this);
    }

    private String prepend(String message) {
        String causeMessage = getMessage();
        if (causeMessage == null) {
            return message;
        } else if (message != null) {
            return message + " : " + causeMessage;
        }
        return causeMessage;
    }
}
