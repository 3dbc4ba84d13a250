package com.propertyintel.hydrant.model;

/**
 * Static pressure bands (psi), right-closed: (-inf,20], (20,40], (40,60], (60,inf).
 */
public enum PressureCategory {
    INSUFFICIENT,
    MARGINAL,
    ADEQUATE,
    EXCELLENT;

    public static PressureCategory of(Double staticPressure) {
        if (staticPressure == null) return null;
        if (staticPressure <= 20) return INSUFFICIENT;
        if (staticPressure <= 40) return MARGINAL;
        if (staticPressure <= 60) return ADEQUATE;
        return EXCELLENT;
    }
}
