package com.focus.gate.session;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

@Slf4j
public class ProcessEnforcementLauncher implements EnforcementLauncher {

    private final List<String> command;
    private final Duration startupGrace;

    public ProcessEnforcementLauncher(List<String> command, Duration startupGrace) {
        if (command.isEmpty()) {
            throw new IllegalArgumentException("focus.session.command must not be empty");
        }
        this.command = List.copyOf(command);
        this.startupGrace = startupGrace;
    }

    @Override
    public EnforcementHandle launch() {
        Process process;
        try {
            process = new ProcessBuilder(command)
                    .redirectErrorStream(true)
                    .redirectOutput(ProcessBuilder.Redirect.DISCARD)
                    .start();
        } catch (IOException e) {
            throw new ProcessSpawnException("Failed to start enforcement process " + command.get(0), e);
        }

        try {
            if (process.waitFor(startupGrace.toMillis(), TimeUnit.MILLISECONDS)) {
                throw new ProcessSpawnException("Enforcement process exited during startup with code "
                        + process.exitValue());
            }
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new ProcessSpawnException("Interrupted while starting enforcement process", e);
        }

        log.info("Enforcement process started (pid {})", process.pid());
        return new OsProcessHandle(process);
    }

    static final class OsProcessHandle implements EnforcementHandle {

        private final Process process;

        OsProcessHandle(Process process) {
            this.process = process;
        }

        @Override
        public long pid() {
            return process.pid();
        }

        @Override
        public boolean isAlive() {
            return process.isAlive();
        }

        @Override
        public void terminate(Duration grace, Duration killTimeout) {
            if (!process.isAlive()) {
                return;
            }
            process.destroy();
            try {
                if (process.waitFor(grace.toMillis(), TimeUnit.MILLISECONDS)) {
                    log.info("Enforcement process {} stopped", process.pid());
                    return;
                }
                log.warn("Enforcement process {} ignored terminate, killing it", process.pid());
                process.destroyForcibly();
                if (!process.waitFor(killTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                    log.error("Enforcement process {} still alive {} ms after kill", process.pid(), killTimeout.toMillis());
                }
            } catch (InterruptedException e) {
                process.destroyForcibly();
                Thread.currentThread().interrupt();
            }
        }
    }
}
