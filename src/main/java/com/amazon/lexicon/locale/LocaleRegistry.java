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

import java.util.List;

import com.amazon.lexicon.ConfigurationException;

/**
 * Source of configured locales. Every localized operation depends on it, and
 * must refuse to proceed when it reports a configuration problem.
 */
public interface LocaleRegistry {
    /**
     * Returns all configured locales in configuration order.
     *
     * @throws ConfigurationException if no locales are configured
     */
    List<LocaleDefinition> getLocales() throws ConfigurationException;

    /**
     * Returns the default locale.
     *
     * @throws ConfigurationException if no default locale is configured
     */
    LocaleDefinition getDefault() throws ConfigurationException;

    /**
     * Returns the locale with the given code, or null if not configured.
     */
    LocaleDefinition findLocale(String code);

    /**
     * Resolves the fallback chain of the given locale, starting with the
     * locale itself.
     */
    List<LocaleDefinition> resolveChain(LocaleDefinition locale);
}
