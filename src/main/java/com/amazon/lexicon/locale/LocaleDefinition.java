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

package com.amazon.lexicon.locale;

import java.util.Collections;
import java.util.List;

/**
 * Immutable definition of one configured locale. Instances are created by
 * {@link LocaleRegistryBuilder}, which also resolves the fallback chain.
 */
public class LocaleDefinition {
    private final String mCode;
    private final String mTitle;
    private final boolean mDefault;
    private final List<String> mFallbacks;
    private final List<String> mChain;

    LocaleDefinition(String code, String title, boolean isDefault,
                     List<String> fallbacks, List<String> chain)
    {
        mCode = code;
        mTitle = title == null ? code : title;
        mDefault = isDefault;
        mFallbacks = Collections.unmodifiableList(fallbacks);
        mChain = Collections.unmodifiableList(chain);
    }

    /**
     * Returns the locale code, for example "en_US". Codes are stored in the
     * Locale column of localized tables and appear in join aliases.
     */
    public String getCode() {
        return mCode;
    }

    public String getTitle() {
        return mTitle;
    }

    /**
     * Returns true if this is the process-wide default locale, whose data is
     * held on the base row.
     */
    public boolean isDefault() {
        return mDefault;
    }

    /**
     * Returns the directly configured fallback codes, in order.
     */
    public List<String> getFallbacks() {
        return mFallbacks;
    }

    /**
     * Returns the resolved fallback chain as codes, starting with this
     * locale. The chain is finite and contains no duplicates.
     */
    public List<String> getChain() {
        return mChain;
    }

    @Override
    public int hashCode() {
        return mCode.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj instanceof LocaleDefinition) {
            return mCode.equals(((LocaleDefinition) obj).mCode);
        }
        return false;
    }

    @Override
    public String toString() {
        return mCode;
    }
}
