package com.focus.gate.config;

import com.focus.gate.repository.SessionRecordRepository;
import com.focus.gate.service.MissionService;
import com.focus.gate.service.NotificationService;
import com.focus.gate.session.EnforcementLauncher;
import com.focus.gate.session.ProcessEnforcementLauncher;
import com.focus.gate.session.SessionSettings;
import com.focus.gate.session.SessionSupervisor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.util.List;

@Configuration
public class SessionConfig {

    @Value("${focus.session.command}")
    private List<String> command;

    @Value("${focus.session.health-interval:5s}")
    private Duration healthInterval;

    @Value("${focus.session.expiry-interval:60s}")
    private Duration expiryInterval;

    @Value("${focus.session.max-restart-attempts:10}")
    private int maxRestartAttempts;

    @Value("${focus.session.startup-grace:3s}")
    private Duration startupGrace;

    @Value("${focus.session.terminate-grace:10s}")
    private Duration terminateGrace;

    @Value("${focus.session.kill-timeout:5s}")
    private Duration killTimeout;

    @Value("${focus.session.loop-join-timeout:15s}")
    private Duration loopJoinTimeout;

    @Value("${focus.session.max-duration-hours:5}")
    private double maxDurationHours;

    @Bean
    public SessionSettings sessionSettings() {
        if (loopJoinTimeout.compareTo(startupGrace) <= 0) {
            throw new IllegalStateException("focus.session.loop-join-timeout must exceed focus.session.startup-grace");
        }
        return new SessionSettings(healthInterval, expiryInterval, maxRestartAttempts,
                terminateGrace, killTimeout, loopJoinTimeout, maxDurationHours);
    }

    @Bean
    public EnforcementLauncher enforcementLauncher() {
        return new ProcessEnforcementLauncher(command, startupGrace);
    }

    @Bean
    public SecureRandom secureRandom() {
        return new SecureRandom();
    }

    @Bean(destroyMethod = "shutdown")
    public SessionSupervisor sessionSupervisor(SessionRecordRepository repository,
                                               MissionService missionService,
                                               EnforcementLauncher enforcementLauncher,
                                               NotificationService notificationService,
                                               SessionSettings sessionSettings,
                                               Clock clock,
                                               SecureRandom secureRandom) {
        return new SessionSupervisor(repository, missionService, enforcementLauncher,
                notificationService, sessionSettings, clock, secureRandom);
    }
}
