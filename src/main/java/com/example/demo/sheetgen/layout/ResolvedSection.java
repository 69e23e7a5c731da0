package com.example.demo.sheetgen.layout;

import com.example.demo.sheetgen.model.ColumnConfig;
import com.example.demo.sheetgen.model.SectionConfig;
import lombok.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A section together with its effective column list, frozen for one render.
 * Both layout passes and the streaming writer read geometry from here.
 */
@Value
public class ResolvedSection {
    SectionConfig config;
    List<ColumnConfig> columns;

    public String getId() {
        return config.getId();
    }

    public boolean hasTitleRow() {
        return config.hasTitle();
    }

    public boolean hasHiddenFieldRow() {
        return !config.isTitleOnly() && columns.stream().anyMatch(ColumnConfig::hasHiddenField);
    }

    public boolean hasHeaderRow() {
        return !config.isTitleOnly() && config.isShowHeader();
    }

    /**
     * Rows between the anchor and the first data row.
     */
    public int leadingRows() {
        int rows = hasTitleRow() ? 1 : 0;
        if (hasHiddenFieldRow()) {
            rows++;
        }
        if (hasHeaderRow()) {
            rows++;
        }
        return rows;
    }

    /**
     * Columns covered by the (merged) title cell.
     */
    public int titleSpan() {
        if (config.isTitleOnly()) {
            if (config.getColSpan() > 1) {
                return config.getColSpan();
            }
            return Math.max(1, columns.size());
        }
        return Math.max(1, columns.size());
    }

    /**
     * Horizontal extent used to advance the column cursor.
     */
    public int span() {
        if (config.isTitleOnly()) {
            return titleSpan();
        }
        if (columns.isEmpty()) {
            return hasTitleRow() ? 1 : 0;
        }
        return columns.size();
    }

    public boolean isCellLocked(ColumnConfig column) {
        return config.isHidden() || column.isLocked(config.isLocked());
    }

    public boolean isTitleLocked() {
        return config.isHidden() || config.isLocked();
    }

    /**
     * True when any cell of this section ends up locked.
     */
    public boolean usesLocks() {
        if (config.isLocked() || config.isHidden() || hasHiddenFieldRow()) {
            return true;
        }
        return columns.stream().anyMatch(c -> Boolean.TRUE.equals(c.getLocked()));
    }

    public double dataRowHeight() {
        double height = config.getDataHeight();
        for (ColumnConfig column : columns) {
            height = Math.max(height, column.getHeight());
        }
        return height;
    }

    public Map<String, Integer> fieldOffsets() {
        Map<String, Integer> offsets = new LinkedHashMap<>();
        for (int i = 0; i < columns.size(); i++) {
            offsets.putIfAbsent(columns.get(i).getFieldName(), i);
        }
        return Collections.unmodifiableMap(offsets);
    }
}
