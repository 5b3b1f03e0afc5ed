package com.focus.gate.model;

public enum SessionState {
    IDLE,
    ACTIVE,
    COMPLETED, // Natural expiry
    UNLOCKED, // Ended early with the secret
    EMERGENCY_TERMINATED; // Enforcement process could not be kept alive

    public boolean terminal() {
        return this == COMPLETED || this == UNLOCKED || this == EMERGENCY_TERMINATED;
    }
}
