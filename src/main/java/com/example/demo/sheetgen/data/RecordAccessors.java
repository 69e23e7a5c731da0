package com.example.demo.sheetgen.data;

import com.fasterxml.jackson.databind.BeanDescription;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.introspect.AnnotatedMember;
import com.fasterxml.jackson.databind.introspect.BeanPropertyDefinition;
import lombok.extern.slf4j.Slf4j;

import java.lang.reflect.Method;
import java.lang.reflect.RecordComponent;
import java.time.temporal.TemporalAccessor;
import java.util.Collections;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Adapts arbitrary row objects to {@link RecordAccessor}.
 * Class shapes are introspected once and cached.
 */
@Slf4j
public final class RecordAccessors {
    private static final ObjectMapper INTROSPECTION_MAPPER = new ObjectMapper();
    private static final Map<Class<?>, Map<String, Method>> RECORD_SHAPES = new ConcurrentHashMap<>();
    private static final Map<Class<?>, Map<String, AnnotatedMember>> BEAN_SHAPES = new ConcurrentHashMap<>();

    private RecordAccessors() {
    }

    /**
     * @return an accessor for the row, or empty when the row is null or a scalar
     */
    public static Optional<RecordAccessor> of(Object row) {
        if (row == null) {
            return Optional.empty();
        }
        if (row instanceof RecordAccessor) {
            return Optional.of((RecordAccessor) row);
        }
        if (row instanceof Map) {
            return Optional.of(new MapRecordAccessor((Map<?, ?>) row));
        }
        if (isScalar(row)) {
            return Optional.empty();
        }
        Class<?> type = row.getClass();
        if (type.isRecord()) {
            return Optional.of(new JavaRecordAccessor(row, RECORD_SHAPES.computeIfAbsent(type, RecordAccessors::recordShape)));
        }
        Map<String, AnnotatedMember> shape = BEAN_SHAPES.computeIfAbsent(type, RecordAccessors::beanShape);
        if (shape.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new BeanRecordAccessor(row, shape));
    }

    /**
     * Reads one field, treating unsupported rows as having no fields.
     */
    public static Object valueOf(Object row, String fieldName) {
        return of(row).map(a -> a.fieldValue(fieldName)).orElse(null);
    }

    private static boolean isScalar(Object value) {
        return value instanceof CharSequence
                || value instanceof Number
                || value instanceof Boolean
                || value instanceof Character
                || value instanceof Enum
                || value instanceof TemporalAccessor
                || value instanceof Date
                || value.getClass().isArray();
    }

    private static Map<String, Method> recordShape(Class<?> type) {
        Map<String, Method> accessors = new LinkedHashMap<>();
        for (RecordComponent component : type.getRecordComponents()) {
            Method accessor = component.getAccessor();
            try {
                accessor.setAccessible(true);
            } catch (RuntimeException e) {
                log.debug("Record accessor {} of {} stays non-accessible: {}", accessor.getName(), type.getName(), e.getMessage());
            }
            accessors.put(component.getName(), accessor);
        }
        return Collections.unmodifiableMap(accessors);
    }

    private static Map<String, AnnotatedMember> beanShape(Class<?> type) {
        BeanDescription description = INTROSPECTION_MAPPER.getSerializationConfig()
                .introspect(INTROSPECTION_MAPPER.constructType(type));
        Map<String, AnnotatedMember> properties = new LinkedHashMap<>();
        for (BeanPropertyDefinition property : description.findProperties()) {
            AnnotatedMember accessor = property.getAccessor();
            if (accessor == null) {
                continue;
            }
            accessor.fixAccess(true);
            properties.put(property.getName(), accessor);
        }
        if (properties.isEmpty()) {
            log.debug("No readable properties found on {}", type.getName());
        }
        return Collections.unmodifiableMap(properties);
    }
}
