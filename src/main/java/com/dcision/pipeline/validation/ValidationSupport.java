package com.dcision.pipeline.validation;

final class ValidationSupport {

    private ValidationSupport() {
    }

    static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    static boolean isUnitInterval(Double value) {
        return value != null && !value.isNaN() && value >= 0.0 && value <= 1.0;
    }
}
