package com.spectro.model;

import java.io.File;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public class RunReport {
    public final RunDirectives directives;
    public final String flavor;           // null fuera del modo automático
    public final Frame frame;
    public final Map<OutputProduct, File> outputs;
    public final double elapsedSeconds;

    public RunReport(RunDirectives directives, String flavor, Frame frame, Map<OutputProduct, File> outputs, double elapsedSeconds) {
        this.directives = directives;
        this.flavor = flavor;
        this.frame = frame;
        this.outputs = Collections.unmodifiableMap(new LinkedHashMap<>(outputs));
        this.elapsedSeconds = elapsedSeconds;
    }
}
