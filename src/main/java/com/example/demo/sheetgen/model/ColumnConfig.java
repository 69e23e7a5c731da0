package com.example.demo.sheetgen.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.function.Function;

/**
 * A column of a section.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ColumnConfig {
    /**
     * Lookup key into a data item (record component, bean property or map key)
     */
    private String fieldName;

    private String header;

    /**
     * Width in characters; 0 leaves the column width untouched
     */
    private double width;

    /**
     * Minimum data row height in points for rows of the owning section
     */
    private double height;

    /**
     * Column-level lock override. When null the section lock applies.
     */
    private Boolean locked;

    /**
     * Name of a formatter registered on the exporter
     */
    private String formatter;

    /**
     * Programmatic formatter; takes precedence over the named one
     */
    @JsonIgnore
    private Function<Object, Object> formatterFunction;

    /**
     * Backend field name written into the hidden (locked, invisible) metadata row
     */
    private String hiddenFieldName;

    /**
     * When set together with {@link #compareAgainst}, data cells of this column hold
     * a formula flagging rows where the two referenced cells differ.
     */
    private CompareConfig compareWith;

    private CompareConfig compareAgainst;

    /**
     * Effective lock state: an explicit column setting wins over the section default.
     */
    public boolean isLocked(boolean sectionLocked) {
        return locked != null ? locked : sectionLocked;
    }

    @JsonIgnore
    public boolean isComparison() {
        return compareWith != null;
    }

    @JsonIgnore
    public boolean hasHiddenField() {
        return hiddenFieldName != null && !hiddenFieldName.isEmpty();
    }
}
