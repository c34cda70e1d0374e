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
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.amazon.lexicon.ConfigurationException;

/**
 * LocaleRegistry over a fixed set of definitions.
 */
class SimpleLocaleRegistry implements LocaleRegistry {
    private final Map<String, LocaleDefinition> mLocales;
    private final LocaleDefinition mDefault;

    SimpleLocaleRegistry(List<LocaleDefinition> locales) {
        mLocales = new LinkedHashMap<String, LocaleDefinition>();
        LocaleDefinition def = null;
        for (LocaleDefinition locale : locales) {
            mLocales.put(locale.getCode(), locale);
            if (locale.isDefault()) {
                def = locale;
            }
        }
        mDefault = def;
    }

    public List<LocaleDefinition> getLocales() throws ConfigurationException {
        if (mLocales.isEmpty()) {
            throw new ConfigurationException("No locales have been configured");
        }
        return Collections.unmodifiableList(new ArrayList<LocaleDefinition>(mLocales.values()));
    }

    public LocaleDefinition getDefault() throws ConfigurationException {
        if (mDefault == null) {
            throw new ConfigurationException("No default locale has been configured");
        }
        return mDefault;
    }

    public LocaleDefinition findLocale(String code) {
        return code == null ? null : mLocales.get(code);
    }

    public List<LocaleDefinition> resolveChain(LocaleDefinition locale) {
        List<String> codes = locale.getChain();
        List<LocaleDefinition> chain = new ArrayList<LocaleDefinition>(codes.size());
        for (String code : codes) {
            LocaleDefinition link = mLocales.get(code);
            if (link != null) {
                chain.add(link);
            }
        }
        return chain;
    }

    @Override
    public String toString() {
        return "LocaleRegistry {locales=" + mLocales.keySet() + ", default=" + mDefault + '}';
    }
}
