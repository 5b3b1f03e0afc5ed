package com.focus.gate.model;

public enum AdmissionAction {
    ALLOW,
    BLOCK;

    public boolean allowed() {
        return this == ALLOW;
    }
}
