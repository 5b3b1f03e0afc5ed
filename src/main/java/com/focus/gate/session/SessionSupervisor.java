package com.focus.gate.session;

import com.focus.gate.dto.SessionStartResult;
import com.focus.gate.dto.SessionStatusView;
import com.focus.gate.model.SessionRecord;
import com.focus.gate.model.SessionState;
import com.focus.gate.repository.SessionRecordRepository;
import com.focus.gate.service.MissionService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;

/**
 * Owns the focus session lifecycle: IDLE → ACTIVE → {COMPLETED, UNLOCKED,
 * EMERGENCY_TERMINATED} → IDLE.
 *
 * <p>While a session is active two loops run on the session's own scheduler: the expiry
 * loop compares the clock with the end time and the health loop restarts the enforcement
 * process when it dies. Loops never take the lifecycle lock. When a loop decides the
 * session is over it hands the shutdown to the lifecycle executor, which cancels and
 * joins the loops before stopping the process, so no loop can respawn a process that
 * is being shut down.
 */
@Slf4j
public class SessionSupervisor {

    private final SessionRecordRepository repository;
    private final MissionService missionService;
    private final EnforcementLauncher launcher;
    private final SessionEventListener listener;
    private final SessionSettings settings;
    private final Clock clock;
    private final SecureRandom random;
    private final ExecutorService lifecycleExecutor;

    private final Object lifecycleLock = new Object();
    private volatile SessionState state = SessionState.IDLE;
    private volatile SessionState lastOutcome;
    private volatile ActiveSession active;

    public SessionSupervisor(SessionRecordRepository repository,
                             MissionService missionService,
                             EnforcementLauncher launcher,
                             SessionEventListener listener,
                             SessionSettings settings,
                             Clock clock,
                             SecureRandom random) {
        this.repository = repository;
        this.missionService = missionService;
        this.launcher = launcher;
        this.listener = listener;
        this.settings = settings;
        this.clock = clock;
        this.random = random;
        this.lifecycleExecutor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "session-lifecycle");
            t.setDaemon(true);
            return t;
        });
    }

    public SessionStartResult startSession(double durationHours, String task) {
        if (!(durationHours > 0) || durationHours > settings.maxDurationHours()) {
            throw new IllegalArgumentException("Duration must be between 0 and "
                    + settings.maxDurationHours() + " hours, got " + durationHours);
        }
        if (task == null || task.isBlank()) {
            throw new IllegalArgumentException("Task must not be blank");
        }

        ActiveSession session;
        String secret;
        synchronized (lifecycleLock) {
            if (state != SessionState.IDLE) {
                throw new SessionAlreadyActiveException(state);
            }

            secret = SessionSecret.generate(random);
            Instant start = clock.instant();
            Instant end = start.plusMillis(Math.round(durationHours * 3_600_000));
            missionService.reload();

            SessionRecord record = repository.save(SessionRecord.builder()
                    .task(task.trim())
                    .startTime(start)
                    .endTime(end)
                    .durationHours(durationHours)
                    .secretHash(SessionSecret.hash(secret))
                    .build());

            EnforcementHandle handle;
            try {
                handle = launcher.launch();
            } catch (ProcessSpawnException e) {
                log.error("Could not start enforcement process, rolling back session: {}", e.getMessage());
                deleteRecord(record.getId());
                throw e;
            }
            try {
                record.setProcessId(handle.pid());
                repository.save(record);
            } catch (RuntimeException e) {
                log.error("Could not persist session, stopping enforcement process: {}", e.getMessage());
                handle.terminate(settings.terminateGrace(), settings.killTimeout());
                deleteRecord(record.getId());
                throw e;
            }

            session = new ActiveSession(record.getId(), record.getTask(), start, end, record.getSecretHash(), handle);
            activate(session);
        }

        log.info("Focus session started: task='{}' until {}", session.task(), session.endTime());
        listener.sessionStarted(session.task(), session.endTime(), false);
        return new SessionStartResult(secret, SessionSecret.split(secret), session.endTime());
    }

    public boolean endSession(String providedSecret) {
        ActiveSession session = active;
        if (session == null || state != SessionState.ACTIVE) {
            log.info("End requested with no active session");
            return false;
        }
        if (!SessionSecret.matches(providedSecret, session.secretHash())) {
            log.warn("Incorrect secret provided, session stays active");
            return false;
        }
        return finish(session, SessionState.UNLOCKED);
    }

    public SessionStatusView status() {
        ActiveSession session = active;
        if (session == null) {
            return SessionStatusView.idle(state, lastOutcome);
        }
        Duration remaining = Duration.between(clock.instant(), session.endTime());
        return new SessionStatusView(
                state == SessionState.ACTIVE,
                state,
                lastOutcome,
                session.task(),
                session.endTime(),
                remaining.isNegative() ? Duration.ZERO : remaining);
    }

    public SessionState state() {
        return state;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void resume() {
        ActiveSession session;
        synchronized (lifecycleLock) {
            if (state != SessionState.IDLE) {
                return;
            }
            Optional<SessionRecord> persisted;
            try {
                persisted = repository.findFirstByOrderByIdDesc();
            } catch (RuntimeException e) {
                log.error("Could not read persisted session, nothing to resume: {}", e.getMessage());
                return;
            }
            if (persisted.isEmpty()) {
                return;
            }
            SessionRecord record = persisted.get();
            if (!record.getEndTime().isAfter(clock.instant())) {
                log.info("Persisted session '{}' expired at {}, cleaning up", record.getTask(), record.getEndTime());
                try {
                    repository.deleteAll();
                } catch (RuntimeException e) {
                    log.warn("Could not remove expired session: {}", e.getMessage());
                }
                return;
            }

            missionService.reload();
            EnforcementHandle handle;
            try {
                handle = launcher.launch();
            } catch (ProcessSpawnException e) {
                // the health loop retries and escalates if the process never comes up
                log.error("Enforcement process failed to start on resume: {}", e.getMessage());
                handle = EnforcementHandle.NONE;
            }
            session = new ActiveSession(record.getId(), record.getTask(), record.getStartTime(),
                    record.getEndTime(), record.getSecretHash(), handle);
            activate(session);
        }

        log.info("Resumed focus session '{}' until {}", session.task(), session.endTime());
        listener.sessionStarted(session.task(), session.endTime(), true);
    }

    public void shutdown() {
        synchronized (lifecycleLock) {
            ActiveSession session = active;
            if (session != null && session.beginTermination()) {
                log.info("Supervisor stopping, session '{}' will resume on restart", session.task());
                session.stopMonitors(settings.loopJoinTimeout());
                session.handle().terminate(settings.terminateGrace(), settings.killTimeout());
                active = null;
                state = SessionState.IDLE;
            }
        }
        lifecycleExecutor.shutdownNow();
    }

    private void activate(ActiveSession session) {
        active = session;
        state = SessionState.ACTIVE;
        session.startMonitors(
                () -> checkExpiry(session), settings.expiryInterval(),
                () -> checkHealth(session), settings.healthInterval());
    }

    void checkExpiry(ActiveSession session) {
        if (session.terminating()) {
            return;
        }
        if (!clock.instant().isBefore(session.endTime())) {
            log.info("Focus session '{}' reached its end time", session.task());
            requestFinish(session, SessionState.COMPLETED);
        }
    }

    void checkHealth(ActiveSession session) {
        if (session.terminating()) {
            return;
        }
        if (session.handle().isAlive()) {
            session.resetFailures();
            return;
        }
        if (session.failures() >= settings.maxRestartAttempts()) {
            log.error("Enforcement process could not be kept alive after {} attempts, emergency termination",
                    session.failures());
            requestFinish(session, SessionState.EMERGENCY_TERMINATED);
            return;
        }

        int attempt = session.recordFailure();
        log.warn("Enforcement process is not running, restart attempt {}/{}", attempt, settings.maxRestartAttempts());
        try {
            session.replaceHandle(launcher.launch());
        } catch (ProcessSpawnException e) {
            log.error("Restart attempt {} failed: {}", attempt, e.getMessage());
        }
    }

    private void requestFinish(ActiveSession session, SessionState outcome) {
        try {
            lifecycleExecutor.execute(() -> finish(session, outcome));
        } catch (RejectedExecutionException e) {
            log.warn("Supervisor is shutting down, {} not applied", outcome);
        }
    }

    boolean finish(ActiveSession session, SessionState outcome) {
        synchronized (lifecycleLock) {
            if (active != session || !session.beginTermination()) {
                return false;
            }
            state = outcome;
            try {
                session.stopMonitors(settings.loopJoinTimeout());
                session.handle().terminate(settings.terminateGrace(), settings.killTimeout());
                deleteRecord(session.recordId());
            } finally {
                active = null;
                lastOutcome = outcome;
                state = SessionState.IDLE;
            }
        }

        if (outcome == SessionState.EMERGENCY_TERMINATED) {
            log.error("Focus session '{}' was terminated in emergency mode", session.task());
        } else {
            log.info("Focus session '{}' ended: {}", session.task(), outcome);
        }
        listener.sessionEnded(session.task(), outcome);
        return true;
    }

    private void deleteRecord(Long recordId) {
        try {
            repository.deleteById(recordId);
        } catch (RuntimeException e) {
            log.warn("Could not remove persisted session {}: {}", recordId, e.getMessage());
        }
    }
}
