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

/**
 * Integer param accepted within {@code [min, max]}.
 */
public class IntConfigParam extends ConfigParam {

    private final int min;
    private final int max;

    public IntConfigParam(String configName, int min, int max, int defaultValue, boolean mutable) {
        super(configName, String.valueOf(defaultValue), mutable);
        this.min = min;
        this.max = max;
    }

    public int parse(String value) {
        int parsed;
        try {
            parsed = Integer.parseInt(StringUtils.trim(value));
        } catch (NumberFormatException e) {
            throw new PartGenRuntimeException(ErrorCode.ERR_CONFIG, e,
                String.format("%s expects an integer, got \"%s\"", name, value));
        }
        if (parsed < min || parsed > max) {
            throw new PartGenRuntimeException(ErrorCode.ERR_CONFIG,
                String.format("%s must be between %d and %d, got %d", name, min, max, parsed));
        }
        return parsed;
    }

    @Override
    public void validateValue(String value) {
        parse(value);
    }
}
