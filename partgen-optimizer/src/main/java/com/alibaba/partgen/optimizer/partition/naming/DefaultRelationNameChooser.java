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

package com.alibaba.partgen.optimizer.partition.naming;

import com.alibaba.partgen.common.exception.PartGenRuntimeException;
import com.alibaba.partgen.common.exception.code.ErrorCode;
import com.alibaba.partgen.common.properties.ParamManager;
import com.alibaba.partgen.common.properties.PartitionParams;
import com.alibaba.partgen.common.utils.Assert;
import com.google.common.collect.ImmutableSet;

import java.util.Collection;
import java.util.Set;

/**
 * Name chooser over a fixed snapshot of the relation names that already exist. Names are compared
 * per schema-qualified name when a schema is given.
 */
public class DefaultRelationNameChooser implements RelationNameChooser {

    private final Set<String> existingNames;
    private final int maxIdentifierLength;

    public DefaultRelationNameChooser(Collection<String> existingNames, int maxIdentifierLength) {
        Assert.assertTrue(maxIdentifierLength > 0, "identifier length limit must be positive");
        this.existingNames = ImmutableSet.copyOf(existingNames);
        this.maxIdentifierLength = maxIdentifierLength;
    }

    public DefaultRelationNameChooser(Collection<String> existingNames, ParamManager paramManager) {
        this(existingNames, paramManager.getInt(PartitionParams.MAX_IDENTIFIER_LENGTH));
    }

    @Override
    public String makeObjectName(String name1, String name2, String label) {
        int overhead = 0;
        int name1Chars = name1.length();
        int name2Chars = 0;
        if (label != null) {
            overhead += label.length() + 1;
        }
        if (name2 != null) {
            name2Chars = name2.length();
            overhead++;
        }
        int availChars = maxIdentifierLength - overhead;
        if (availChars < 0) {
            throw new PartGenRuntimeException(ErrorCode.ERR_PARTITION_INVALID_SPEC,
                String.format("name \"%s\" is too long for a relation name of at most %d characters", label,
                    maxIdentifierLength));
        }
        // shorten the longer of the two names, one char at a time
        while (name1Chars + name2Chars > availChars) {
            if (name1Chars > name2Chars) {
                name1Chars--;
            } else {
                name2Chars--;
            }
        }

        StringBuilder sb = new StringBuilder(maxIdentifierLength);
        sb.append(name1, 0, name1Chars);
        if (name2 != null) {
            sb.append('_').append(name2, 0, name2Chars);
        }
        if (label != null) {
            sb.append('_').append(label);
        }
        return sb.toString();
    }

    @Override
    public String chooseRelationName(String name1, String name2, String label, String schemaName) {
        String modLabel = label;
        int pass = 0;
        while (true) {
            String relName = makeObjectName(name1, name2, modLabel);
            if (!exists(schemaName, relName)) {
                return relName;
            }
            modLabel = label + (++pass);
        }
    }

    private boolean exists(String schemaName, String relName) {
        return existingNames.contains(relName) || (schemaName != null
            && existingNames.contains(schemaName + "." + relName));
    }
}
