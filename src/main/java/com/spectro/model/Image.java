package com.spectro.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public class Image {

    public final double[][] pix;
    public final double[][] ivar;
    public final String camera;
    private final Map<String, Object> meta;

    public Image(double[][] pix, double[][] ivar, String camera, Map<String, Object> meta) {
        if (pix.length != ivar.length || (pix.length > 0 && pix[0].length != ivar[0].length)) {
            throw new IllegalArgumentException("IMAGE e IVAR con formas distintas");
        }
        this.pix = pix;
        this.ivar = ivar;
        this.camera = camera;
        Map<String, Object> m = new LinkedHashMap<>();
        if (meta != null) m.putAll(meta);
        this.meta = Collections.unmodifiableMap(m);
    }

    public int ny() { return pix.length; }
    public int nx() { return pix.length == 0 ? 0 : pix[0].length; }

    public Map<String, Object> getMeta() { return meta; }

    public boolean has(String key) { return meta.containsKey(key); }

    public Object get(String key) { return meta.get(key); }

    // Copia con metadatos adicionales; las claves dadas reemplazan a las existentes.
    public Image withMeta(Map<String, Object> extra) {
        Map<String, Object> m = new LinkedHashMap<>(meta);
        m.putAll(extra);
        return new Image(pix, ivar, camera, m);
    }
}
