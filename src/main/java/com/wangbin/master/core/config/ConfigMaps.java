package com.wangbin.master.core.config;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * JSON 解析结果（Map）的取值辅助方法
 */
final class ConfigMaps {

    private ConfigMaps() {
    }

    static String getString(Map<String, Object> map, String key) {
        Object value = map.get(key);
        return value != null ? value.toString().trim() : null;
    }

    /**
     * 数字或数字字符串转换为 Long，无法转换返回 null
     */
    static Long getLong(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value instanceof Number number) {
            if (number instanceof Double || number instanceof Float) {
                double d = number.doubleValue();
                return d == Math.rint(d) ? (long) d : null;
            }
            return number.longValue();
        }
        if (value instanceof String text && !text.isBlank()) {
            try {
                return Long.parseLong(text.trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    static Boolean getBoolean(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof String text) {
            if ("true".equalsIgnoreCase(text.trim())) {
                return Boolean.TRUE;
            }
            if ("false".equalsIgnoreCase(text.trim())) {
                return Boolean.FALSE;
            }
        }
        return null;
    }

    @SuppressWarnings("unchecked")
    static Map<String, Object> getMap(Map<String, Object> map, String key) {
        Object value = map.get(key);
        return value instanceof Map<?, ?> m ? (Map<String, Object>) m : null;
    }

    @SuppressWarnings("unchecked")
    static List<Map<String, Object>> getMapList(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value == null) {
            return Collections.emptyList();
        }
        if (!(value instanceof List<?> list)) {
            return null;
        }
        for (Object item : list) {
            if (!(item instanceof Map)) {
                return null;
            }
        }
        return (List<Map<String, Object>>) list;
    }
}
