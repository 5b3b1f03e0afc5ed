package com.focus.gate.engine.mission;

public class MissionValidationException extends RuntimeException {

    public MissionValidationException(String message) {
        super(message);
    }
}
