package com.focus.gate.session;

import java.time.Duration;

public interface EnforcementHandle {

    EnforcementHandle NONE = new EnforcementHandle() {
        @Override
        public long pid() {
            return -1;
        }

        @Override
        public boolean isAlive() {
            return false;
        }

        @Override
        public void terminate(Duration grace, Duration killTimeout) {
            // nothing running
        }
    };

    long pid();

    boolean isAlive();

    /**
     * Asks the process to stop, waits up to {@code grace}, then force-kills it and waits
     * up to {@code killTimeout} for it to go away. Never blocks longer than the two bounds.
     */
    void terminate(Duration grace, Duration killTimeout);
}
