package io.github.riemr.production.domain.model;

public enum ProficiencyChangeReason {
    MANUAL,
    AUTO_INCREASE,
    AUTO_DECREASE;

    public boolean isAutomatic() {
        return this != MANUAL;
    }
}
