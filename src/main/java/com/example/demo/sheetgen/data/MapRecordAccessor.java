package com.example.demo.sheetgen.data;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Key-value row. Field names follow the map's own iteration order.
 */
public class MapRecordAccessor implements RecordAccessor {
    private final Map<?, ?> row;

    public MapRecordAccessor(Map<?, ?> row) {
        this.row = row;
    }

    @Override
    public Object fieldValue(String name) {
        return row.get(name);
    }

    @Override
    public Set<String> fieldNames() {
        Set<String> names = new LinkedHashSet<>();
        for (Object key : row.keySet()) {
            if (key != null) {
                names.add(key.toString());
            }
        }
        return Collections.unmodifiableSet(names);
    }
}
