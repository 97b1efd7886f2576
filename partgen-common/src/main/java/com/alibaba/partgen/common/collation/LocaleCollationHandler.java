/*
 * Copyright [2013-2021], Alibaba Group Holding Limited
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *    http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.alibaba.partgen.common.collation;

import java.text.Collator;
import java.util.Locale;

/**
 * Linguistic ordering of a locale, backed by {@link Collator}.
 */
public class LocaleCollationHandler implements CollationHandler {

    private final String name;

    private final Locale locale;

    private final boolean caseSensitive;

    public LocaleCollationHandler(String name, Locale locale, boolean caseSensitive) {
        this.name = name;
        this.locale = locale;
        this.caseSensitive = caseSensitive;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public boolean isCaseSensitive() {
        return caseSensitive;
    }

    public Locale getLocale() {
        return locale;
    }

    @Override
    public int compare(String str1, String str2) {
        if (str1 == null || str2 == null) {
            return CollationHandler.super.compare(str1, str2);
        }
        // Collator is not thread safe, take a fresh instance per comparison
        Collator collator = Collator.getInstance(locale);
        collator.setStrength(caseSensitive ? Collator.TERTIARY : Collator.SECONDARY);
        int cmp = collator.compare(str1, str2);
        if (cmp == 0 && caseSensitive) {
            // deterministic collations fall back to a binary comparison on ties
            cmp = str1.compareTo(str2);
        }
        return cmp;
    }
}
