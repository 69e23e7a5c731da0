package com.example.demo.sheetgen.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * A titled block of a sheet. Sections are laid out in declaration order.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SectionConfig {
    /**
     * Required for late data binding, streaming writes and cross-references
     */
    private String id;

    private String title;

    @Builder.Default
    private SectionType type = SectionType.FULL;

    @Builder.Default
    private SectionDirection direction = SectionDirection.VERTICAL;

    /**
     * Explicit anchor cell such as "C5". Overrides automatic placement.
     */
    private String position;

    /**
     * Section-level lock, the default for every column without its own setting
     */
    private boolean locked;

    private boolean showHeader;

    /**
     * Columns spanned by the title of a title-only section
     */
    private int colSpan;

    /**
     * Sections whose resolved row count this section mirrors when it has no data of its own
     */
    @Builder.Default
    private List<String> sourceSections = new ArrayList<>();

    private StyleTemplate titleStyle;
    private StyleTemplate headerStyle;
    private StyleTemplate dataStyle;

    private double titleHeight;
    private double headerHeight;
    private double dataHeight;

    /**
     * Adds an autofilter over the header and data rows (requires showHeader)
     */
    private boolean hasFilter;

    @Builder.Default
    private List<ColumnConfig> columns = new ArrayList<>();

    /**
     * Rows bound at runtime
     */
    @JsonIgnore
    private List<?> data;

    @JsonIgnore
    public SectionType effectiveType() {
        return type != null ? type : SectionType.FULL;
    }

    @JsonIgnore
    public boolean isTitleOnly() {
        return effectiveType() == SectionType.TITLE;
    }

    @JsonIgnore
    public boolean isHidden() {
        return effectiveType() == SectionType.HIDDEN;
    }

    @JsonIgnore
    public boolean isHorizontal() {
        return direction == SectionDirection.HORIZONTAL;
    }

    @JsonIgnore
    public boolean hasTitle() {
        return title != null && !title.isEmpty();
    }

    @JsonIgnore
    public boolean hasId() {
        return id != null && !id.isEmpty();
    }

    @JsonIgnore
    public boolean hasPosition() {
        return position != null && !position.isBlank();
    }

    /**
     * Explicitly configured column by field name, for post-hoc mutation.
     */
    public Optional<ColumnConfig> getColumn(String fieldName) {
        if (columns == null) {
            return Optional.empty();
        }
        return columns.stream()
                .filter(c -> c.getFieldName() != null && c.getFieldName().equals(fieldName))
                .findFirst();
    }
}
