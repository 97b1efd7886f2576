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

package com.alibaba.partgen.common.utils;

import com.alibaba.partgen.common.exception.PartGenRuntimeException;
import com.alibaba.partgen.common.exception.code.ErrorCode;

/**
 * Internal invariant checks of the partition expansion. A failed check is an internal error of the
 * caller, never a problem of the partition definition being expanded.
 */
public final class Assert {

    private Assert() {
    }

    /**
     * @return {@code object}, so that a checked value can be assigned in place
     */
    public static <T> T assertNotNull(T object, String what) {
        if (object == null) {
            throw new PartGenRuntimeException(ErrorCode.ERR_ASSERT_NULL, what);
        }
        return object;
    }

    public static void assertTrue(boolean invariant, String message) {
        if (!invariant) {
            throw new PartGenRuntimeException(ErrorCode.ERR_ASSERT_TRUE, message);
        }
    }
}
