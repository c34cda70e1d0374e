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

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.Set;

import com.amazon.lexicon.ConfigurationException;

/**
 * Builds a {@link LocaleRegistry}. Locales are added in order, and fallback
 * chains are resolved once when the registry is built.
 *
 * <pre>
 * LocaleRegistryBuilder builder = new LocaleRegistryBuilder();
 * builder.addLocale("en_US");
 * builder.addLocale("de_AT", "de_DE", "en_US");
 * builder.addLocale("de_DE", "en_US");
 * builder.setDefault("en_US");
 * LocaleRegistry registry = builder.build();
 * </pre>
 *
 * An empty builder is valid and yields a registry which reports that no
 * locales are configured.
 */
public class LocaleRegistryBuilder {
    public static final String PROPERTY_LOCALES = "locales";
    public static final String PROPERTY_DEFAULT = "locale.default";

    private final Map<String, Entry> mEntries;
    private final List<String> mDuplicates;
    private String mDefault;

    public LocaleRegistryBuilder() {
        mEntries = new LinkedHashMap<String, Entry>();
        mDuplicates = new ArrayList<String>(1);
    }

    /**
     * Loads locales from properties. Recognized keys are {@code locales} (a
     * comma separated list of codes), {@code locale.default}, and for each
     * code {@code locale.<code>.fallbacks} and {@code locale.<code>.title}.
     */
    public static LocaleRegistryBuilder fromProperties(Properties props) {
        LocaleRegistryBuilder builder = new LocaleRegistryBuilder();
        for (String code : split(props.getProperty(PROPERTY_LOCALES))) {
            List<String> fallbacks = split(props.getProperty("locale." + code + ".fallbacks"));
            builder.addLocale(code, props.getProperty("locale." + code + ".title"), fallbacks);
        }
        String def = props.getProperty(PROPERTY_DEFAULT);
        if (def != null && def.trim().length() > 0) {
            builder.setDefault(def.trim());
        }
        return builder;
    }

    /**
     * Adds a locale with optional fallbacks, which are consulted in the
     * order given.
     */
    public LocaleRegistryBuilder addLocale(String code, String... fallbacks) {
        List<String> list = new ArrayList<String>(fallbacks.length);
        for (String fallback : fallbacks) {
            list.add(fallback);
        }
        return addLocale(code, null, list);
    }

    /**
     * Adds a locale with a display title and optional fallbacks.
     */
    public LocaleRegistryBuilder addLocale(String code, String title, List<String> fallbacks) {
        if (code == null) {
            throw new IllegalArgumentException("Locale code is required");
        }
        List<String> list = new ArrayList<String>(fallbacks);
        if (mEntries.containsKey(code)) {
            mDuplicates.add(code);
        } else {
            mEntries.put(code, new Entry(code, title, list));
        }
        return this;
    }

    public LocaleRegistryBuilder setDefault(String code) {
        mDefault = code;
        return this;
    }

    public String getDefault() {
        return mDefault;
    }

    public LocaleRegistry build() throws ConfigurationException {
        assertReady();

        List<LocaleDefinition> locales = new ArrayList<LocaleDefinition>(mEntries.size());
        for (Entry entry : mEntries.values()) {
            Set<String> chain = new LinkedHashSet<String>();
            resolveChain(entry.mCode, chain);
            locales.add(new LocaleDefinition(entry.mCode, entry.mTitle,
                                             entry.mCode.equals(mDefault),
                                             entry.mFallbacks,
                                             new ArrayList<String>(chain)));
        }

        return new SimpleLocaleRegistry(locales);
    }

    // Depth first, so a fallback's own fallbacks are consulted before the
    // next sibling. The visited set cuts any configured cycle.
    private void resolveChain(String code, Set<String> chain) {
        if (!chain.add(code)) {
            return;
        }
        Entry entry = mEntries.get(code);
        if (entry != null) {
            for (String fallback : entry.mFallbacks) {
                resolveChain(fallback, chain);
            }
        }
    }

    /**
     * Throw a configuration exception if the configuration is inconsistent.
     */
    public final void assertReady() throws ConfigurationException {
        ArrayList<String> messages = new ArrayList<String>();
        errorCheck(messages);
        int size = messages.size();
        if (size == 0) {
            return;
        }
        StringBuilder b = new StringBuilder();
        if (size > 1) {
            b.append("Multiple problems: ");
        }
        for (int i=0; i<size; i++) {
            if (i > 0) {
                b.append("; ");
            }
            b.append(messages.get(i));
        }
        throw new ConfigurationException(b.toString());
    }

    /**
     * @param messages add any error messages to this list
     */
    public void errorCheck(Collection<String> messages) {
        for (String code : mDuplicates) {
            messages.add("Locale configured more than once: " + code);
        }
        if (mDefault != null && !mEntries.containsKey(mDefault)) {
            messages.add("Default locale is not configured: " + mDefault);
        }
        for (Entry entry : mEntries.values()) {
            for (String fallback : entry.mFallbacks) {
                if (!mEntries.containsKey(fallback)) {
                    messages.add("Unknown fallback for " + entry.mCode + ": " + fallback);
                }
            }
        }
    }

    private static List<String> split(String value) {
        List<String> list = new ArrayList<String>();
        if (value != null) {
            for (String part : value.split(",")) {
                part = part.trim();
                if (part.length() > 0) {
                    list.add(part);
                }
            }
        }
        return list;
    }

    private static class Entry {
        final String mCode;
        final String mTitle;
        final List<String> mFallbacks;

        Entry(String code, String title, List<String> fallbacks) {
            mCode = code;
            mTitle = title;
            mFallbacks = fallbacks;
        }
    }
}
