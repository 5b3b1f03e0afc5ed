package com.focus.gate.session;

import java.time.Duration;

public record SessionSettings(
        Duration healthInterval,
        Duration expiryInterval,
        int maxRestartAttempts,
        Duration terminateGrace,
        Duration killTimeout,
        Duration loopJoinTimeout,
        double maxDurationHours
) {}
