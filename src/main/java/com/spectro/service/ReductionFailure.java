package com.spectro.service;

public enum ReductionFailure {
    CONFIGURATION(12),
    METADATA(13),
    CALIBRATION(14),
    SELECTION(15),
    IO(16),
    // Error no previsto de un algoritmo o de los datos (RuntimeException)
    INTERNAL(17);

    public final int exitCode;

    ReductionFailure(int exitCode) { this.exitCode = exitCode; }
}
