package com.spectro.model;

import java.util.Locale;

public enum Flavor {
    SCIENCE, ARC, FLAT, UNKNOWN;

    // Tipo de exposición a partir de la cabecera; cualquier valor no reconocido es UNKNOWN.
    public static Flavor parse(String s) {
        if (s == null) return UNKNOWN;
        String v = s.trim().toUpperCase(Locale.ROOT);
        for (Flavor f : values()) {
            if (f != UNKNOWN && f.name().equals(v)) return f;
        }
        return UNKNOWN;
    }
}
