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

import com.alibaba.partgen.common.exception.PartGenRuntimeException;
import com.alibaba.partgen.common.exception.code.ErrorCode;
import org.apache.commons.lang3.StringUtils;

import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Lookup of collation handlers by collation name. "default", "C", "POSIX" and "ucs_basic" compare
 * binary; locale names such as "en_US" or "de-DE" use the locale's linguistic order, and a "_ci" suffix
 * makes them case insensitive.
 */
public class CollationHandlers {

    public static final String DEFAULT_COLLATION = "default";

    public static final CollationHandler DEFAULT_HANDLER = new BinaryCollationHandler(DEFAULT_COLLATION);

    private static final Map<String, CollationHandler> HANDLERS = new ConcurrentHashMap<>();

    private static final String CASE_INSENSITIVE_SUFFIX = "_ci";

    static {
        register(DEFAULT_HANDLER);
        register(new BinaryCollationHandler("C"));
        register(new BinaryCollationHandler("POSIX"));
        register(new BinaryCollationHandler("ucs_basic"));
    }

    public static void register(CollationHandler handler) {
        HANDLERS.put(handler.getName(), handler);
    }

    public static boolean isDefault(String collation) {
        return collation == null || DEFAULT_COLLATION.equals(collation);
    }

    public static CollationHandler getHandler(String collation) {
        if (isDefault(collation)) {
            return DEFAULT_HANDLER;
        }
        return HANDLERS.computeIfAbsent(collation, CollationHandlers::createLocaleHandler);
    }

    private static CollationHandler createLocaleHandler(String collation) {
        boolean caseSensitive = true;
        String localeName = collation;
        if (StringUtils.endsWithIgnoreCase(localeName, CASE_INSENSITIVE_SUFFIX)) {
            caseSensitive = false;
            localeName = localeName.substring(0, localeName.length() - CASE_INSENSITIVE_SUFFIX.length());
        }
        // drop an encoding suffix such as en_US.utf8
        localeName = StringUtils.substringBefore(localeName, ".");
        Locale locale = Locale.forLanguageTag(localeName.replace('_', '-'));
        if (StringUtils.isEmpty(locale.getLanguage())) {
            throw new PartGenRuntimeException(ErrorCode.ERR_PARTITION_INVALID_SPEC,
                "collation \"" + collation + "\" does not exist");
        }
        return new LocaleCollationHandler(collation, locale, caseSensitive);
    }
}
