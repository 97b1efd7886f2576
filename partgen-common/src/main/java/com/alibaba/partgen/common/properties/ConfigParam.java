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

package com.alibaba.partgen.common.properties;

import com.alibaba.partgen.common.exception.PartGenRuntimeException;
import com.alibaba.partgen.common.exception.code.ErrorCode;

public class ConfigParam {

    protected String name;
    private final String defaultValue;
    private final boolean mutable;

    public ConfigParam(String configName, String configDefault, boolean mutable) {
        name = configName;
        defaultValue = configDefault;
        this.mutable = mutable;

        validateName(name);

        PartitionParams.addSupportedParam(this);
    }

    public String getName() {
        return name;
    }

    public String getDefault() {
        return defaultValue;
    }

    public boolean isMutable() {
        return mutable;
    }

    private void validateName(String name) {
        if ((name == null) || (name.length() < 1)) {
            throw new PartGenRuntimeException(ErrorCode.ERR_CONFIG,
                "A configuration parameter name can't be null or 0 length");
        }
    }

    /**
     * Rejects a value of this param with {@link ErrorCode#ERR_CONFIG}.
     */
    public void validateValue(String value) {
    }

    @Override
    public String toString() {
        return name;
    }
}
