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
import org.apache.commons.lang3.StringUtils;

public class StringConfigParam extends ConfigParam {

    private final boolean allowEmpty;

    public StringConfigParam(String configName, String defaultValue, boolean allowEmpty, boolean mutable) {
        super(configName, defaultValue, mutable);
        this.allowEmpty = allowEmpty;
    }

    @Override
    public void validateValue(String value) {
        if (value == null || (!allowEmpty && StringUtils.isBlank(value))) {
            throw new PartGenRuntimeException(ErrorCode.ERR_CONFIG, name + " can not be empty");
        }
    }
}
