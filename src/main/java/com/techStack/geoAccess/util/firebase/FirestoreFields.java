package com.techStack.geoAccess.util.firebase;

import com.google.cloud.Timestamp;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Date;
import java.util.List;
import java.util.Map;

/**
 * Safe reads and writes of Firestore document fields.
 */
public final class FirestoreFields {

    private FirestoreFields() {}

    public static String getString(Map<String, Object> data, String key) {
        Object value = data.get(key);
        return value != null ? value.toString() : null;
    }

    public static boolean getBoolean(Map<String, Object> data, String key) {
        Object value = data.get(key);
        if (value instanceof Boolean bool) {
            return bool;
        }
        return value != null && Boolean.parseBoolean(value.toString());
    }

    public static long getLong(Map<String, Object> data, String key) {
        Object value = data.get(key);
        if (value instanceof Number number) {
            return number.longValue();
        }
        if (value != null) {
            try {
                return Long.parseLong(value.toString());
            } catch (NumberFormatException e) {
                return 0L;
            }
        }
        return 0L;
    }

    public static Double getDouble(Map<String, Object> data, String key) {
        Object value = data.get(key);
        return value instanceof Number number ? number.doubleValue() : null;
    }

    public static Instant getInstant(Map<String, Object> data, String key) {
        Object value = data.get(key);
        if (value instanceof Timestamp timestamp) {
            return Instant.ofEpochSecond(timestamp.getSeconds(), timestamp.getNanos());
        }
        if (value instanceof Date date) {
            return date.toInstant();
        }
        if (value instanceof String text && !text.isBlank()) {
            return Instant.parse(text);
        }
        return null;
    }

    public static List<String> getStringList(Map<String, Object> data, String key) {
        Object value = data.get(key);
        if (value instanceof List<?> list) {
            List<String> result = new ArrayList<>(list.size());
            for (Object item : list) {
                if (item != null) {
                    result.add(item.toString());
                }
            }
            return result;
        }
        return Collections.emptyList();
    }

    public static <E extends Enum<E>> E getEnum(Map<String, Object> data, String key, Class<E> type) {
        String value = getString(data, key);
        if (value == null) {
            return null;
        }
        try {
            return Enum.valueOf(type, value);
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    public static Timestamp toTimestamp(Instant instant) {
        return instant != null ? Timestamp.ofTimeSecondsAndNanos(instant.getEpochSecond(), instant.getNano()) : null;
    }

    public static void putTimestamp(Map<String, Object> data, String key, Instant instant) {
        data.put(key, toTimestamp(instant));
    }

    public static String enumName(Enum<?> value) {
        return value != null ? value.name() : null;
    }
}
