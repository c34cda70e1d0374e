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

package com.amazon.lexicon.migrate;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.joda.time.DateTime;

/**
 * Legacy records which hold the same content in different locales. At most
 * one member is kept per locale.
 */
class TranslationGroup {
    private final long mGroupId;
    private final List<Long> mItemIds;
    private final Map<String, Member> mMembers;

    /**
     * @param itemIds IDs of all records listed in the group
     */
    TranslationGroup(long groupId, List<Long> itemIds) {
        mGroupId = groupId;
        mItemIds = Collections.unmodifiableList(new ArrayList<Long>(itemIds));
        mMembers = new LinkedHashMap<String, Member>();
    }

    long getGroupId() {
        return mGroupId;
    }

    List<Long> getItemIds() {
        return mItemIds;
    }

    /**
     * Adds a member. A member already present for the same locale is
     * replaced, but the locale keeps its original position.
     *
     * @return replaced member, or null if none
     */
    Member add(Member member) {
        return mMembers.put(member.getLocale(), member);
    }

    boolean isEmpty() {
        return mMembers.isEmpty();
    }

    Collection<Member> getMembers() {
        return Collections.unmodifiableCollection(mMembers.values());
    }

    /**
     * Returns the ID which all members are consolidated under: that of the
     * member in the default locale, or else that of the first member.
     *
     * @throws IllegalStateException if group is empty
     */
    long getCanonicalId(String defaultLocale) {
        Member member = mMembers.get(defaultLocale);
        if (member == null) {
            if (mMembers.isEmpty()) {
                throw new IllegalStateException("Translation group is empty: " + mGroupId);
            }
            member = mMembers.values().iterator().next();
        }
        return member.getId();
    }

    @Override
    public String toString() {
        return "TranslationGroup {id=" + mGroupId + ", items=" + mItemIds
            + ", members=" + mMembers.values() + '}';
    }

    static class Member {
        private final long mId;
        private final String mClassName;
        private final DateTime mCreated;
        private final String mLocale;

        Member(long id, String className, DateTime created, String locale) {
            mId = id;
            mClassName = className;
            mCreated = created;
            mLocale = locale;
        }

        long getId() {
            return mId;
        }

        String getClassName() {
            return mClassName;
        }

        DateTime getCreated() {
            return mCreated;
        }

        String getLocale() {
            return mLocale;
        }

        @Override
        public String toString() {
            return mClassName + '(' + mId + ", " + mLocale + ')';
        }
    }
}
