package com.atelier.sync.core.validation;

import com.atelier.project.validation.PayloadValidator;
import com.atelier.project.validation.ValidationResult;
import java.lang.reflect.Array;
import java.lang.reflect.Field;
import java.lang.reflect.InaccessibleObjectException;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Modifier;
import java.lang.reflect.RecordComponent;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Date;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rejects payloads that embed inline binary data anywhere in their object graph.
 *
 * <p>Inline binary is a string carrying the {@code data:} URL marker or a raw {@code byte[]}. The walker descends
 * into maps, iterables, arrays, optionals, record components and instance fields, visiting each object once.
 *
 * <pre>{@code
 * ValidationResult result = new InlineBinaryDetector().validate(state);
 * // rejected: "Inline binary data at state.generatedModelHistory[3].imageUrl"
 * }</pre>
 */
public class InlineBinaryDetector implements PayloadValidator {

    private static final Logger log = LoggerFactory.getLogger(InlineBinaryDetector.class);
    private static final String DATA_URL_MARKER = "data:";

    @Override
    public ValidationResult validate(Object payload) {
        if (payload == null) return ValidationResult.accepted();
        String path = detect(rootName(payload), payload, new IdentityHashMap<>());
        if (path == null) return ValidationResult.accepted();
        return ValidationResult.rejected("Inline binary data at " + path + "; externalize it to the blob store first", path);
    }

    public static boolean isInlineBinary(String value) {
        return value != null
                && value.length() >= DATA_URL_MARKER.length()
                && value.regionMatches(true, 0, DATA_URL_MARKER, 0, DATA_URL_MARKER.length());
    }

    private static String detect(String path, Object value, Map<Object, Boolean> visited) {
        if (value == null) return null;
        if (value instanceof CharSequence chars) {
            return isInlineBinary(chars.toString()) ? path : null;
        }
        if (value instanceof byte[]) return path;
        Class<?> clazz = value.getClass();
        if (isTerminalValue(clazz)) return null;
        if (visited.put(value, Boolean.TRUE) != null) return null;

        if (value instanceof Map<?, ?> map) {
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                String hit = detect(path + "[" + entry.getKey() + "]", entry.getValue(), visited);
                if (hit != null) return hit;
            }
            return null;
        }
        if (value instanceof Iterable<?> iterable) {
            int idx = 0;
            for (Object element : iterable) {
                String hit = detect(path + "[" + idx++ + "]", element, visited);
                if (hit != null) return hit;
            }
            return null;
        }
        if (clazz.isArray()) {
            int length = Array.getLength(value);
            for (int i = 0; i < length; i++) {
                String hit = detect(path + "[" + i + "]", Array.get(value, i), visited);
                if (hit != null) return hit;
            }
            return null;
        }
        if (value instanceof Optional<?> optional) {
            return optional.map(nested -> detect(path, nested, visited)).orElse(null);
        }
        if (clazz.isRecord()) {
            for (RecordComponent component : clazz.getRecordComponents()) {
                try {
                    String hit = detect(path + "." + component.getName(), component.getAccessor().invoke(value), visited);
                    if (hit != null) return hit;
                } catch (IllegalAccessException | InvocationTargetException | InaccessibleObjectException e) {
                    log.debug("Skipping unreadable component {}.{}", clazz.getName(), component.getName(), e);
                }
            }
            return null;
        }
        for (Field field : allFields(clazz)) {
            if (Modifier.isStatic(field.getModifiers()) || Modifier.isTransient(field.getModifiers())) {
                continue;
            }
            try {
                if (!field.canAccess(value)) {
                    field.setAccessible(true);
                }
                String hit = detect(path + "." + field.getName(), field.get(value), visited);
                if (hit != null) return hit;
            } catch (IllegalAccessException | InaccessibleObjectException e) {
                log.debug("Skipping unreadable field {}.{}", clazz.getName(), field.getName(), e);
            }
        }
        return null;
    }

    private static boolean isTerminalValue(Class<?> clazz) {
        return clazz.isPrimitive()
                || Number.class.isAssignableFrom(clazz)
                || Boolean.class.equals(clazz)
                || Character.class.equals(clazz)
                || Enum.class.isAssignableFrom(clazz)
                || UUID.class.equals(clazz)
                || Date.class.isAssignableFrom(clazz)
                || TemporalAccessor.class.isAssignableFrom(clazz)
                || Class.class.equals(clazz);
    }

    private static String rootName(Object payload) {
        String simple = payload.getClass().getSimpleName();
        if (simple.isEmpty()) return "payload";
        if (simple.endsWith("State")) return "state";
        return simple.substring(0, 1).toLowerCase(Locale.ROOT) + simple.substring(1);
    }

    private static List<Field> allFields(Class<?> type) {
        if (type == null || Object.class.equals(type)) {
            return Collections.emptyList();
        }
        List<Field> fields = new ArrayList<>();
        Class<?> current = type;
        while (current != null && !Object.class.equals(current)) {
            Collections.addAll(fields, current.getDeclaredFields());
            current = current.getSuperclass();
        }
        return fields;
    }
}
