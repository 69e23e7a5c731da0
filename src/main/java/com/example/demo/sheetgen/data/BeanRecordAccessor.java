package com.example.demo.sheetgen.data;

import com.fasterxml.jackson.databind.introspect.AnnotatedMember;

import java.util.Map;
import java.util.Set;

/**
 * JavaBean or plain object row, read through the public properties Jackson
 * discovers for its class (getters and public fields).
 */
public class BeanRecordAccessor implements RecordAccessor {
    private final Object row;
    private final Map<String, AnnotatedMember> properties;

    BeanRecordAccessor(Object row, Map<String, AnnotatedMember> properties) {
        this.row = row;
        this.properties = properties;
    }

    @Override
    public Object fieldValue(String name) {
        AnnotatedMember member = properties.get(name);
        return member != null ? member.getValue(row) : null;
    }

    @Override
    public Set<String> fieldNames() {
        return properties.keySet();
    }
}
