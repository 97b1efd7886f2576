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

/**
 * Ordering of character data under one named collation.
 */
public interface CollationHandler {

    String getName();

    boolean isCaseSensitive();

    default int compare(String str1, String str2) {
        if (str1 == null) {
            return str2 == null ? 0 : -1;
        } else if (str2 == null) {
            return 1;
        }
        return isCaseSensitive() ? str1.compareTo(str2) : str1.compareToIgnoreCase(str2);
    }
}
