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

package com.amazon.lexicon.spi;

import com.amazon.lexicon.Stage;

import com.amazon.lexicon.locale.LocaleDefinition;

/**
 * Parameters of one write or delete: the locale being written, if any, and
 * the stage the host is currently writing to.
 */
public class WriteContext {
    private final LocaleDefinition mLocale;
    private final Stage mStage;

    /**
     * @param locale locale being written, or null for an unlocalized write
     * @param stage active stage, never null
     */
    public WriteContext(LocaleDefinition locale, Stage stage) {
        if (stage == null) {
            throw new IllegalArgumentException("Stage is required");
        }
        mLocale = locale;
        mStage = stage;
    }

    public LocaleDefinition getLocale() {
        return mLocale;
    }

    public Stage getStage() {
        return mStage;
    }

    @Override
    public String toString() {
        return "WriteContext {locale=" + mLocale + ", stage=" + mStage + '}';
    }
}
