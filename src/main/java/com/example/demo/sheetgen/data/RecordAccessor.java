package com.example.demo.sheetgen.data;

import java.util.Set;

/**
 * Uniform read access to one data row, whatever its concrete shape.
 * Data objects may implement this directly; otherwise {@link RecordAccessors}
 * adapts maps, Java records and JavaBeans.
 */
public interface RecordAccessor {

    /**
     * @return the value of the field, or null when the row has no such field
     */
    Object fieldValue(String name);

    /**
     * @return field names in a stable iteration order
     */
    Set<String> fieldNames();
}
