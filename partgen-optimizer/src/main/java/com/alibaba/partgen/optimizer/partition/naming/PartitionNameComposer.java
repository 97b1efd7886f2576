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
 * Naming state of one {@code generatePartitions} call: the level string, the running partition
 * number of the level and the legacy {@code tablename} override of the current element.
 */
public class PartitionNameComposer {

    private final RelationNameChooser nameChooser;
    private final String parentName;
    private final String schemaName;
    private final String levelStr;
    private final String prefix;
    private final int maxIdentifierLength;

    private int partitionNumber = 0;
    private String tablename;

    public PartitionNameComposer(RelationNameChooser nameChooser, String schemaName, String parentName, int level,
                                 String prefix, int maxIdentifierLength) {
        this.nameChooser = nameChooser;
        this.schemaName = schemaName;
        this.parentName = parentName;
        this.levelStr = String.valueOf(level);
        this.prefix = prefix;
        this.maxIdentifierLength = maxIdentifierLength;
    }

    public void setTablename(String tablename) {
        this.tablename = tablename;
    }

    public String getTablename() {
        return tablename;
    }

    /**
     * Name of the next partition. An explicit tablename is taken as is and does not count; otherwise
     * the partition number advances even for named partitions.
     */
    public String nextName(String partitionName) {
        if (tablename != null) {
            return tablename;
        }
        int partNum = ++partitionNumber;
        if (partitionName != null) {
            return nameChooser.makeObjectName(parentName, levelStr, truncate(prefix + partitionName));
        }
        return nameChooser.chooseRelationName(parentName, levelStr, prefix + partNum, schemaName);
    }

    /**
     * {@code name_n} for the n-th partition of an EVERY element.
     */
    public String everyName(String partitionName, int n) {
        return truncate(partitionName + "_" + n);
    }

    private String truncate(String name) {
        return name.length() > maxIdentifierLength ? name.substring(0, maxIdentifierLength) : name;
    }

    public int getPartitionNumber() {
        return partitionNumber;
    }

    public String getLevelStr() {
        return levelStr;
    }
}
