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

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

public class ParamManager {

    private static final ParamManager DEFAULT = new ParamManager(Collections.emptyMap());

    protected Map<String, String> props = new HashMap<String, String>();

    public ParamManager(Map<String, String> connectionMap) {
        if (connectionMap != null) {
            validateMap(connectionMap);
            props = new HashMap<>(connectionMap);
        }
    }

    public static ParamManager getDefault() {
        return DEFAULT;
    }

    public String get(ConfigParam configParam) {
        return getVal(props, configParam);
    }

    public int getInt(IntConfigParam configParam) {
        return configParam.parse(get(configParam));
    }

    public String getString(StringConfigParam configParam) {
        return get(configParam);
    }

    /**
     * Comma separated value of the param, trimmed and lower cased, in declaration order.
     */
    public Set<String> getStringSet(StringConfigParam configParam) {
        String val = get(configParam);
        if (StringUtils.isBlank(val)) {
            return Collections.emptySet();
        }
        return Arrays.stream(StringUtils.split(val, ','))
            .map(String::trim)
            .filter(StringUtils::isNotEmpty)
            .map(String::toLowerCase)
            .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    public static void validateMap(Map<String, String> props) {
        for (Map.Entry<String, String> entry : props.entrySet()) {
            ConfigParam param = PartitionParams.SUPPORTED_PARAMS.get(entry.getKey());
            if (param == null) {
                throw new PartGenRuntimeException(ErrorCode.ERR_CONFIG,
                    entry.getKey() + " is not a valid partition expansion parameter");
            }
            param.validateValue(entry.getValue());
        }
    }

    public static String getVal(Map<String, String> props, ConfigParam param) {
        String val = props.get(param.getName());
        if (val == null) {
            val = param.getDefault();
        }
        return val;
    }

    public Map<String, String> getProps() {
        return Collections.unmodifiableMap(props);
    }
}
