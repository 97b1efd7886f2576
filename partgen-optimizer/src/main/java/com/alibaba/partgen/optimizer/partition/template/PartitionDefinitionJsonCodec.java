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

package com.alibaba.partgen.optimizer.partition.template;

import com.alibaba.fastjson.JSON;
import com.alibaba.fastjson.JSONArray;
import com.alibaba.fastjson.JSONException;
import com.alibaba.fastjson.JSONObject;
import com.alibaba.partgen.common.exception.PartGenRuntimeException;
import com.alibaba.partgen.common.exception.code.ErrorCode;
import com.alibaba.partgen.optimizer.partition.ast.ColumnEncodingDirective;
import com.alibaba.partgen.optimizer.partition.ast.ListPartitionBoundSpec;
import com.alibaba.partgen.optimizer.partition.ast.PartitionBoundSpec;
import com.alibaba.partgen.optimizer.partition.ast.PartitionDefinition;
import com.alibaba.partgen.optimizer.partition.ast.PartitionDefinitionElement;
import com.alibaba.partgen.optimizer.partition.ast.PartitionValueExpr;
import com.alibaba.partgen.optimizer.partition.ast.RangePartitionBoundSpec;
import com.alibaba.partgen.optimizer.partition.datatype.IntervalValue;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Text form of a partition definition. Literal values are written with their Java type so that a
 * definition reads back equal to the one written.
 */
public class PartitionDefinitionJsonCodec {

    public String encode(PartitionDefinition definition) {
        return definitionToJson(definition).toJSONString();
    }

    public PartitionDefinition decode(String text) {
        try {
            return definitionFromJson(JSON.parseObject(text));
        } catch (JSONException | IllegalArgumentException | ClassCastException | DateTimeParseException e) {
            throw new PartGenRuntimeException(ErrorCode.ERR_PARTITION_TEMPLATE, e,
                "malformed definition: " + e.getMessage());
        }
    }

    private JSONObject definitionToJson(PartitionDefinition definition) {
        JSONObject json = new JSONObject();
        json.put("template", definition.isTemplate());
        json.put("location", definition.getLocation());
        JSONArray elements = new JSONArray();
        for (PartitionDefinitionElement element : definition.getElements()) {
            elements.add(elementToJson(element));
        }
        json.put("elements", elements);
        json.put("encodings", encodingsToJson(definition.getEncodings()));
        return json;
    }

    private PartitionDefinition definitionFromJson(JSONObject json) {
        JSONArray array = json == null ? null : json.getJSONArray("elements");
        if (array == null) {
            throw new PartGenRuntimeException(ErrorCode.ERR_PARTITION_TEMPLATE, "definition without elements");
        }
        List<PartitionDefinitionElement> elements = new ArrayList<>();
        for (int i = 0; i < array.size(); i++) {
            elements.add(elementFromJson(objectAt(array, i, "element")));
        }
        return new PartitionDefinition(elements, encodingsFromJson(json.getJSONArray("encodings")),
            json.getBooleanValue("template"), json.getIntValue("location"));
    }

    private JSONObject elementToJson(PartitionDefinitionElement element) {
        JSONObject json = new JSONObject();
        json.put("name", element.getName());
        json.put("default", element.isDefault());
        json.put("location", element.getLocation());
        json.put("accessMethod", element.getAccessMethod());
        json.put("tablespace", element.getTablespace());
        json.put("options", optionsToJson(element.getOptions()));
        json.put("encodings", encodingsToJson(element.getColumnEncodings()));
        if (element.getBoundSpec() != null) {
            json.put("bound", boundToJson(element.getBoundSpec()));
        }
        if (element.getSubDefinition() != null) {
            json.put("subDefinition", definitionToJson(element.getSubDefinition()));
        }
        return json;
    }

    private PartitionDefinitionElement elementFromJson(JSONObject json) {
        PartitionDefinitionElement.Builder builder = PartitionDefinitionElement.builder()
            .name(json.getString("name"))
            .location(json.getIntValue("location"))
            .accessMethod(json.getString("accessMethod"))
            .tablespace(json.getString("tablespace"))
            .options(optionsFromJson(json.getJSONArray("options")))
            .columnEncodings(encodingsFromJson(json.getJSONArray("encodings")));
        if (json.getBooleanValue("default")) {
            builder.asDefault();
        }
        if (json.containsKey("bound")) {
            builder.bound(boundFromJson(json.getJSONObject("bound")));
        }
        if (json.containsKey("subDefinition")) {
            builder.subDefinition(definitionFromJson(json.getJSONObject("subDefinition")));
        }
        return builder.build();
    }

    private JSONObject boundToJson(PartitionBoundSpec boundSpec) {
        JSONObject json = new JSONObject();
        json.put("location", boundSpec.getLocation());
        if (boundSpec instanceof RangePartitionBoundSpec) {
            RangePartitionBoundSpec range = (RangePartitionBoundSpec) boundSpec;
            json.put("kind", "range");
            json.put("start", exprsToJson(range.getStart()));
            json.put("end", exprsToJson(range.getEnd()));
            json.put("endInclusive", range.isEndInclusive());
            json.put("every", exprsToJson(range.getEvery()));
        } else if (boundSpec instanceof ListPartitionBoundSpec) {
            json.put("kind", "list");
            JSONArray tuples = new JSONArray();
            for (List<PartitionValueExpr> tuple : ((ListPartitionBoundSpec) boundSpec).getValues()) {
                tuples.add(exprsToJson(tuple));
            }
            json.put("values", tuples);
        } else {
            throw new PartGenRuntimeException(ErrorCode.ERR_PARTITION_TEMPLATE,
                "unsupported bound " + boundSpec.getClass().getSimpleName());
        }
        return json;
    }

    private PartitionBoundSpec boundFromJson(JSONObject json) {
        if (json == null) {
            throw new PartGenRuntimeException(ErrorCode.ERR_PARTITION_TEMPLATE, "null bound");
        }
        String kind = json.getString("kind");
        int location = json.getIntValue("location");
        if ("range".equals(kind)) {
            return new RangePartitionBoundSpec(exprsFromJson(json.getJSONArray("start")),
                exprsFromJson(json.getJSONArray("end")), json.getBooleanValue("endInclusive"),
                exprsFromJson(json.getJSONArray("every")), location);
        } else if ("list".equals(kind)) {
            JSONArray tuples = json.getJSONArray("values");
            if (tuples == null) {
                throw new PartGenRuntimeException(ErrorCode.ERR_PARTITION_TEMPLATE, "list bound without values");
            }
            List<List<PartitionValueExpr>> values = new ArrayList<>(tuples.size());
            for (int i = 0; i < tuples.size(); i++) {
                JSONArray tuple = tuples.getJSONArray(i);
                if (tuple == null) {
                    throw new PartGenRuntimeException(ErrorCode.ERR_PARTITION_TEMPLATE, "null value list at " + i);
                }
                values.add(exprsFromJson(tuple));
            }
            return new ListPartitionBoundSpec(values, location);
        }
        throw new PartGenRuntimeException(ErrorCode.ERR_PARTITION_TEMPLATE, "unknown bound kind " + kind);
    }

    private JSONArray exprsToJson(List<PartitionValueExpr> exprs) {
        if (exprs == null) {
            return null;
        }
        JSONArray array = new JSONArray();
        for (PartitionValueExpr expr : exprs) {
            JSONObject json = valueToJson(expr.getValue());
            json.put("collation", expr.getCollation());
            json.put("location", expr.getLocation());
            array.add(json);
        }
        return array;
    }

    private List<PartitionValueExpr> exprsFromJson(JSONArray array) {
        if (array == null) {
            return null;
        }
        List<PartitionValueExpr> exprs = new ArrayList<>(array.size());
        for (int i = 0; i < array.size(); i++) {
            JSONObject json = objectAt(array, i, "value");
            exprs.add(new PartitionValueExpr(valueFromJson(json), json.getString("collation"),
                json.getIntValue("location")));
        }
        return exprs;
    }

    private JSONArray encodingsToJson(List<ColumnEncodingDirective> directives) {
        JSONArray array = new JSONArray();
        for (ColumnEncodingDirective directive : directives) {
            JSONObject json = new JSONObject();
            json.put("column", directive.getColumn());
            json.put("default", directive.isDefault());
            json.put("options", optionsToJson(directive.getOptions()));
            array.add(json);
        }
        return array;
    }

    private List<ColumnEncodingDirective> encodingsFromJson(JSONArray array) {
        List<ColumnEncodingDirective> directives = new ArrayList<>();
        if (array == null) {
            return directives;
        }
        for (int i = 0; i < array.size(); i++) {
            JSONObject json = objectAt(array, i, "encoding");
            Map<String, Object> options = optionsFromJson(json.getJSONArray("options"));
            directives.add(json.getBooleanValue("default") ? ColumnEncodingDirective.defaultEncoding(options)
                : ColumnEncodingDirective.forColumn(json.getString("column"), options));
        }
        return directives;
    }

    /**
     * Options keep their order, so they are written as a list of name/value pairs.
     */
    private JSONArray optionsToJson(Map<String, Object> options) {
        JSONArray array = new JSONArray();
        for (Map.Entry<String, Object> entry : options.entrySet()) {
            JSONObject json = valueToJson(entry.getValue());
            json.put("name", entry.getKey());
            array.add(json);
        }
        return array;
    }

    private Map<String, Object> optionsFromJson(JSONArray array) {
        Map<String, Object> options = new LinkedHashMap<>();
        if (array == null) {
            return options;
        }
        for (int i = 0; i < array.size(); i++) {
            JSONObject json = objectAt(array, i, "option");
            options.put(json.getString("name"), valueFromJson(json));
        }
        return options;
    }

    private static JSONObject objectAt(JSONArray array, int index, String what) {
        JSONObject json = array.getJSONObject(index);
        if (json == null) {
            throw new PartGenRuntimeException(ErrorCode.ERR_PARTITION_TEMPLATE, "null " + what + " at " + index);
        }
        return json;
    }

    private JSONObject valueToJson(Object value) {
        JSONObject json = new JSONObject();
        if (value == null) {
            json.put("type", "null");
        } else if (value instanceof String) {
            json.put("type", "string");
            json.put("value", value);
        } else if (value instanceof Boolean) {
            json.put("type", "boolean");
            json.put("value", value);
        } else if (value instanceof Short) {
            json.put("type", "smallint");
            json.put("value", value);
        } else if (value instanceof Integer) {
            json.put("type", "integer");
            json.put("value", value);
        } else if (value instanceof Long) {
            json.put("type", "bigint");
            json.put("value", value);
        } else if (value instanceof BigDecimal) {
            json.put("type", "numeric");
            json.put("value", value.toString());
        } else if (value instanceof Double) {
            json.put("type", "double");
            json.put("value", value);
        } else if (value instanceof LocalDate) {
            json.put("type", "date");
            json.put("value", value.toString());
        } else if (value instanceof LocalDateTime) {
            json.put("type", "timestamp");
            json.put("value", value.toString());
        } else if (value instanceof OffsetDateTime) {
            json.put("type", "timestamptz");
            json.put("value", value.toString());
        } else if (value instanceof IntervalValue) {
            IntervalValue interval = (IntervalValue) value;
            json.put("type", "interval");
            json.put("months", interval.getMonths());
            json.put("days", interval.getDays());
            json.put("micros", interval.getMicros());
        } else {
            throw new PartGenRuntimeException(ErrorCode.ERR_PARTITION_TEMPLATE,
                "unsupported value of type " + value.getClass().getName());
        }
        return json;
    }

    private Object valueFromJson(JSONObject json) {
        String type = json.getString("type");
        if (type == null) {
            throw new PartGenRuntimeException(ErrorCode.ERR_PARTITION_TEMPLATE, "value without type");
        }
        switch (type) {
        case "null":
            return null;
        case "string":
            return json.getString("value");
        case "boolean":
            return json.getBooleanValue("value");
        case "smallint":
            return json.getShortValue("value");
        case "integer":
            return json.getIntValue("value");
        case "bigint":
            return json.getLongValue("value");
        case "numeric":
            return new BigDecimal(json.getString("value"));
        case "double":
            return json.getDoubleValue("value");
        case "date":
            return LocalDate.parse(json.getString("value"));
        case "timestamp":
            return LocalDateTime.parse(json.getString("value"));
        case "timestamptz":
            return OffsetDateTime.parse(json.getString("value"));
        case "interval":
            return new IntervalValue(json.getIntValue("months"), json.getIntValue("days"), json.getLongValue("micros"));
        default:
            throw new PartGenRuntimeException(ErrorCode.ERR_PARTITION_TEMPLATE, "unknown value type " + type);
        }
    }
}
