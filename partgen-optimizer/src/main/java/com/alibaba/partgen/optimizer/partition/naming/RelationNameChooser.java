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

/**
 * Builds relation names of the form {@code name1_name2_label} within the identifier length limit of
 * the catalog.
 */
public interface RelationNameChooser {

    /**
     * {@code name1_name2_label}, shortening name1 and name2 (never the label) to fit the limit.
     * {@code name2} and {@code label} may be {@code null}.
     */
    String makeObjectName(String name1, String name2, String label);

    /**
     * Like {@link #makeObjectName}, but appends 1, 2, ... to the label until the name is not taken
     * in the schema.
     */
    String chooseRelationName(String name1, String name2, String label, String schemaName);
}
