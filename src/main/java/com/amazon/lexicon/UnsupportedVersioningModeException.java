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
 * Thrown when a query carries a versioning mode which the localized query
 * rewriter does not recognize. This indicates a mismatch between the caller
 * and the rewriter, and is never caused by stored data.
 */
public class UnsupportedVersioningModeException extends IllegalArgumentException {

    private static final long serialVersionUID = -7385096716257704281L;

    private final Object mMode;

    public UnsupportedVersioningModeException(Object mode) {
        super("Bad value for query parameter Versioned.mode: " + mode);
        mMode = mode;
    }

    /**
     * Returns the rejected mode value, which may be null.
     */
    public Object getMode() {
        return mMode;
    }
}
