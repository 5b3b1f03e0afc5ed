package com.focus.gate.session;

import com.focus.gate.model.SessionState;

public class SessionAlreadyActiveException extends RuntimeException {

    public SessionAlreadyActiveException(SessionState state) {
        super("A focus session is already running (state " + state + ")");
    }
}
