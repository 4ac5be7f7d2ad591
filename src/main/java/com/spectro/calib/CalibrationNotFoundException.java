package com.spectro.calib;

public class CalibrationNotFoundException extends Exception {

    private final String product;

    public CalibrationNotFoundException(String product, String message) {
        super(message);
        this.product = product;
    }

    public String getProduct() { return product; }
}
