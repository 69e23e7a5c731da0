package com.example.demo.sheetgen.data;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.util.Map;
import java.util.Set;

/**
 * Java record row. Field names are the record components in declaration order.
 */
public class JavaRecordAccessor implements RecordAccessor {
    private final Object row;
    private final Map<String, Method> accessors;

    JavaRecordAccessor(Object row, Map<String, Method> accessors) {
        this.row = row;
        this.accessors = accessors;
    }

    @Override
    public Object fieldValue(String name) {
        Method accessor = accessors.get(name);
        if (accessor == null) {
            return null;
        }
        try {
            return accessor.invoke(row);
        } catch (IllegalAccessException | InvocationTargetException e) {
            throw new IllegalStateException("Cannot read component '" + name + "' of " + row.getClass().getName(), e);
        }
    }

    @Override
    public Set<String> fieldNames() {
        return accessors.keySet();
    }
}
