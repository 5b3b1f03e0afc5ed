package com.focus.gate.session;

public class ProcessSpawnException extends RuntimeException {

    public ProcessSpawnException(String message) {
        super(message);
    }

    public ProcessSpawnException(String message, Throwable cause) {
        super(message, cause);
    }
}
