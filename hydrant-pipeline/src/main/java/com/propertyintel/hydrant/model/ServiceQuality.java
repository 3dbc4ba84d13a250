package com.propertyintel.hydrant.model;

public enum ServiceQuality {
    HIGH,
    MEDIUM,
    LOW,
    INACTIVE,
    UNKNOWN
}
