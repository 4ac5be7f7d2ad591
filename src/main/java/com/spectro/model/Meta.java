package com.spectro.model;

import java.util.Map;

public final class Meta {

    private Meta() {}

    public static Double asDouble(Object v) {
        if (v == null) return null;
        if (v instanceof Number) return ((Number) v).doubleValue();
        try {
            return Double.parseDouble(v.toString().trim().replace('D', 'E'));
        } catch (NumberFormatException e) {
            return null;
        }
    }

    public static Long asLong(Object v) {
        if (v == null) return null;
        if (v instanceof Number) return ((Number) v).longValue();
        try {
            return Long.parseLong(v.toString().trim());
        } catch (NumberFormatException e) {
            Double d = asDouble(v);
            return (d == null || d != Math.rint(d)) ? null : d.longValue();
        }
    }

    public static double getDouble(Map<String, Object> meta, String key, double def) {
        Double d = (meta == null) ? null : asDouble(meta.get(key));
        return d == null ? def : d;
    }

    public static int getInt(Map<String, Object> meta, String key, int def) {
        Long l = (meta == null) ? null : asLong(meta.get(key));
        return l == null ? def : l.intValue();
    }
}
