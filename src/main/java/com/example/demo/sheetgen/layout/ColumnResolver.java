package com.example.demo.sheetgen.layout;

import com.example.demo.sheetgen.data.RecordAccessor;
import com.example.demo.sheetgen.data.RecordAccessors;
import com.example.demo.sheetgen.model.ColumnConfig;
import com.example.demo.sheetgen.model.SectionConfig;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Merges the explicit columns of a section with the fields discovered in its data.
 * Explicit columns keep their order; discovered fields are appended after them.
 */
@Slf4j
public class ColumnResolver {
    /**
     * Key-value rows may be heterogeneous, so keys of up to this many rows are unioned.
     */
    public static final int DISCOVERY_SCAN_LIMIT = 50;

    private final double defaultColumnWidth;

    public ColumnResolver(double defaultColumnWidth) {
        this.defaultColumnWidth = defaultColumnWidth;
    }

    public ResolvedSection resolve(SectionConfig section) {
        return resolve(section, section.getData());
    }

    /**
     * Resolves against data other than the bound data, used when the rows
     * arrive in batches.
     */
    public ResolvedSection resolve(SectionConfig section, List<?> data) {
        List<ColumnConfig> explicit = section.getColumns() != null ? section.getColumns() : List.of();
        return new ResolvedSection(section, resolveColumns(explicit, data));
    }

    public List<ColumnConfig> resolveColumns(List<ColumnConfig> explicit, List<?> data) {
        List<ColumnConfig> resolved = new ArrayList<>(explicit);
        if (data == null || data.isEmpty()) {
            return Collections.unmodifiableList(resolved);
        }
        Set<String> present = new HashSet<>();
        for (ColumnConfig column : explicit) {
            present.add(column.getFieldName());
        }
        for (String field : discoverFieldNames(data)) {
            if (present.add(field)) {
                resolved.add(ColumnConfig.builder()
                        .fieldName(field)
                        .header(field)
                        .width(defaultColumnWidth)
                        .build());
            }
        }
        return Collections.unmodifiableList(resolved);
    }

    /**
     * @return discoverable field names in a stable order; empty for unsupported data
     */
    public Set<String> discoverFieldNames(List<?> data) {
        Set<String> fields = new LinkedHashSet<>();
        if (data == null || data.isEmpty()) {
            return fields;
        }
        Object first = data.get(0);
        Optional<RecordAccessor> accessor = RecordAccessors.of(first);
        if (accessor.isEmpty()) {
            log.warn("Cannot discover columns from data of type {}; keeping explicit columns only",
                    first == null ? "null" : first.getClass().getName());
            return fields;
        }
        if (!(first instanceof Map)) {
            fields.addAll(accessor.get().fieldNames());
            return fields;
        }
        int limit = Math.min(data.size(), DISCOVERY_SCAN_LIMIT);
        for (int i = 0; i < limit; i++) {
            Object row = data.get(i);
            if (row instanceof Map) {
                for (Object key : ((Map<?, ?>) row).keySet()) {
                    if (key != null) {
                        fields.add(key.toString());
                    }
                }
            }
        }
        return fields;
    }
}
