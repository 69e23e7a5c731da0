package com.example.demo.sheetgen.data;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns typed rows into key-value rows suitable for dynamic column discovery.
 * Map-valued fields are expanded into one entry per key named
 * {@code <field>_<key>}; keys present in only some rows are filled with "".
 *
 * Input: [ Product(name="A", attributes={color=red}), Product(name="B", attributes={size=L}) ]
 * Output: [ {name=A, attributes_color=red, attributes_size=""},
 *           {name=B, attributes_color="", attributes_size=L} ]
 */
public final class RecordFlattener {

    private RecordFlattener() {
    }

    public static Map<String, Object> flatten(Object row) {
        RecordAccessor accessor = RecordAccessors.of(row)
                .orElseThrow(() -> new IllegalArgumentException(
                        "Expected a record, bean or map, got " + (row == null ? "null" : row.getClass().getName())));
        Map<String, Object> flat = new LinkedHashMap<>();
        for (String field : accessor.fieldNames()) {
            Object value = accessor.fieldValue(field);
            if (value instanceof Map) {
                for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
                    flat.put(field + "_" + entry.getKey(), entry.getValue());
                }
            } else {
                flat.put(field, value);
            }
        }
        return flat;
    }

    public static List<Map<String, Object>> flattenAll(List<?> rows) {
        List<Map<String, Object>> result = new ArrayList<>(rows.size());
        Set<String> allKeys = new LinkedHashSet<>();
        for (Object row : rows) {
            Map<String, Object> flat = flatten(row);
            allKeys.addAll(flat.keySet());
            result.add(flat);
        }
        for (int i = 0; i < result.size(); i++) {
            Map<String, Object> flat = result.get(i);
            if (flat.size() == allKeys.size()) {
                continue;
            }
            Map<String, Object> padded = new LinkedHashMap<>();
            for (String key : allKeys) {
                padded.put(key, flat.getOrDefault(key, ""));
            }
            result.set(i, padded);
        }
        return result;
    }
}
