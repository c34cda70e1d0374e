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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import org.joda.time.DateTime;

import com.amazon.lexicon.Stage;
import com.amazon.lexicon.VersioningMode;

import com.amazon.lexicon.locale.LocaleDefinition;

/**
 * Parameters of one read: the locale to read in, if any, and the versioning
 * parameters which select stage or version storage.
 */
public class QueryContext {
    public static final String MODE = "Versioned.mode";
    public static final String STAGE = "Versioned.stage";
    public static final String VERSION = "Versioned.version";
    public static final String DATE = "Versioned.date";

    /**
     * Returns a context for reading the current data of a stage.
     */
    public static QueryContext forStage(Stage stage, LocaleDefinition locale) {
        return new QueryContext(locale)
            .setQueryParam(MODE, VersioningMode.STAGE)
            .setQueryParam(STAGE, stage);
    }

    /**
     * Returns a context for reading one specific version.
     */
    public static QueryContext forVersion(int version, LocaleDefinition locale) {
        return new QueryContext(locale)
            .setQueryParam(MODE, VersioningMode.VERSION)
            .setQueryParam(VERSION, version);
    }

    /**
     * Returns a context for reading the latest version published as of the
     * given date.
     */
    public static QueryContext forArchiveDate(DateTime date, LocaleDefinition locale) {
        return new QueryContext(locale)
            .setQueryParam(MODE, VersioningMode.ARCHIVE)
            .setQueryParam(DATE, date);
    }

    public static QueryContext forMode(VersioningMode mode, LocaleDefinition locale) {
        return new QueryContext(locale).setQueryParam(MODE, mode);
    }

    private final LocaleDefinition mLocale;
    private final Map<String, Object> mParams;

    /**
     * @param locale locale to read in, or null for an unlocalized read
     */
    public QueryContext(LocaleDefinition locale) {
        mLocale = locale;
        mParams = new LinkedHashMap<String, Object>(4);
    }

    /**
     * Returns the locale to read in, or null if the read is not localized.
     */
    public LocaleDefinition getLocale() {
        return mLocale;
    }

    /**
     * Returns a copy of this context with a different locale.
     */
    public QueryContext withLocale(LocaleDefinition locale) {
        QueryContext copy = new QueryContext(locale);
        copy.mParams.putAll(mParams);
        return copy;
    }

    public QueryContext setQueryParam(String name, Object value) {
        if (value == null) {
            mParams.remove(name);
        } else {
            mParams.put(name, value);
        }
        return this;
    }

    public Object getQueryParam(String name) {
        return mParams.get(name);
    }

    public Map<String, Object> getQueryParams() {
        return Collections.unmodifiableMap(mParams);
    }

    /**
     * Returns the versioning mode, or null if none is set.
     *
     * @throws com.amazon.lexicon.UnsupportedVersioningModeException if the
     * mode parameter is not recognized
     */
    public VersioningMode getVersioningMode() {
        return VersioningMode.forValue(mParams.get(MODE));
    }

    /**
     * Returns the stage parameter, or null if none is set.
     */
    public Stage getStage() {
        Object stage = mParams.get(STAGE);
        if (stage == null || stage instanceof Stage) {
            return (Stage) stage;
        }
        return Stage.forName(stage.toString());
    }

    /**
     * Returns the version parameter, or null if none is set.
     */
    public Integer getVersion() {
        Object version = mParams.get(VERSION);
        if (version == null || version instanceof Integer) {
            return (Integer) version;
        }
        return Integer.valueOf(version.toString());
    }

    /**
     * Returns the archive date parameter, or null if none is set.
     */
    public DateTime getDate() {
        Object date = mParams.get(DATE);
        if (date == null || date instanceof DateTime) {
            return (DateTime) date;
        }
        return new DateTime(date);
    }

    @Override
    public String toString() {
        return "QueryContext {locale=" + mLocale + ", params=" + mParams + '}';
    }
}
