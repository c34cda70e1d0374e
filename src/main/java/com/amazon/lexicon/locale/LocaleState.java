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

import com.amazon.lexicon.RepositoryException;
import com.amazon.lexicon.ScopedAction;

/**
 * Holds the locale that reads and writes are currently localized for. An
 * instance is owned by one logical worker and is passed to the components
 * that need it. It is not thread-safe.
 *
 * <p>Prefer {@link #withLocale withLocale} over {@link #setLocale setLocale},
 * since it restores the previous locale however the action exits.
 */
public class LocaleState {
    private final LocaleRegistry mRegistry;

    private LocaleDefinition mLocale;

    public LocaleState(LocaleRegistry registry) {
        if (registry == null) {
            throw new IllegalArgumentException("Locale registry is required");
        }
        mRegistry = registry;
    }

    public LocaleRegistry getRegistry() {
        return mRegistry;
    }

    /**
     * Returns the current locale, or null if none is set, in which case
     * reads and writes are not localized.
     */
    public LocaleDefinition getLocale() {
        return mLocale;
    }

    /**
     * Returns the code of the current locale, or null if none.
     */
    public String getLocaleCode() {
        LocaleDefinition locale = mLocale;
        return locale == null ? null : locale.getCode();
    }

    /**
     * @param code locale code, or null to clear
     * @throws IllegalArgumentException if code is not configured
     */
    public void setLocale(String code) {
        mLocale = lookup(code);
    }

    /**
     * Runs the given action with the given locale as current, restoring the
     * prior locale afterwards.
     *
     * @param code locale code, or null to run unlocalized
     * @throws IllegalArgumentException if code is not configured
     */
    public <T> T withLocale(String code, ScopedAction<T> action) throws RepositoryException {
        LocaleDefinition locale = lookup(code);
        LocaleDefinition previous = mLocale;
        mLocale = locale;
        try {
            return action.run();
        } finally {
            mLocale = previous;
        }
    }

    private LocaleDefinition lookup(String code) {
        if (code == null) {
            return null;
        }
        LocaleDefinition locale = mRegistry.findLocale(code);
        if (locale == null) {
            throw new IllegalArgumentException("Locale is not configured: " + code);
        }
        return locale;
    }

    @Override
    public String toString() {
        return "LocaleState {locale=" + mLocale + '}';
    }
}
