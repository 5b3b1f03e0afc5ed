package com.focus.gate.session;

import com.focus.gate.model.SessionState;

import java.time.Instant;

public interface SessionEventListener {

    void sessionStarted(String task, Instant endTime, boolean resumed);

    void sessionEnded(String task, SessionState outcome);
}
