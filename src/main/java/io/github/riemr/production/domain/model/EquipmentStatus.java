package io.github.riemr.production.domain.model;

public enum EquipmentStatus {
    AVAILABLE,
    IN_USE,
    MAINTENANCE,
    RETIRED;

    public boolean isOperational() {
        return this == AVAILABLE || this == IN_USE;
    }
}
