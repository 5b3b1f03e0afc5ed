package com.focus.gate.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.focus.gate.dto.MissionDocument;
import com.focus.gate.engine.mission.Mission;
import com.focus.gate.engine.mission.MissionValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

@Service
@Slf4j
public class MissionService {

    static final MissionDocument DEFAULT_MISSION = new MissionDocument(
            "Focus on productive work and learning, avoiding social media and entertainment distractions",
            List.of(),
            List.of()
    );

    private final ObjectMapper objectMapper;
    private final Path missionFile;
    private final int minLength;
    private final AtomicReference<Mission> current = new AtomicReference<>();

    public MissionService(ObjectMapper objectMapper,
                          @Value("${focus.mission.file}") Path missionFile,
                          @Value("${focus.mission.min-length:10}") int minLength) {
        this.objectMapper = objectMapper;
        this.missionFile = missionFile;
        this.minLength = minLength;
    }

    public Optional<Mission> current() {
        return Optional.ofNullable(current.get());
    }

    @EventListener(ApplicationReadyEvent.class)
    public void loadOnStartup() {
        if (current.get() == null) {
            reload();
        }
    }

    public Mission reload() {
        MissionDocument document = readDocument().orElseGet(() -> {
            log.warn("Mission file {} missing or unreadable, using default mission", missionFile);
            writeDocument(DEFAULT_MISSION);
            return DEFAULT_MISSION;
        });

        if (document.mission() == null || document.mission().isBlank()) {
            log.warn("No mission text found in {}, using default mission", missionFile);
            document = DEFAULT_MISSION;
        }

        Mission mission = toMission(document);
        current.set(mission);
        log.info("Mission loaded: {}", mission.text());
        return mission;
    }

    public Mission replace(MissionDocument document) {
        if (document.mission() == null || document.mission().trim().length() < minLength) {
            throw new MissionValidationException(
                    "Mission statement must be at least " + minLength + " characters long");
        }

        Mission mission = toMission(document);
        writeDocument(document);
        current.set(mission);
        log.info("Mission replaced: {}", mission.text());
        return mission;
    }

    public MissionDocument document() {
        Mission mission = current.get();
        if (mission == null) {
            return readDocument().orElse(DEFAULT_MISSION);
        }
        return new MissionDocument(mission.text(), mission.allowedDomains(), mission.allowedKeywords());
    }

    private Mission toMission(MissionDocument document) {
        return Mission.of(document.mission(), document.allowedDomains(), document.allowedKeywords());
    }

    private Optional<MissionDocument> readDocument() {
        if (!Files.exists(missionFile)) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(missionFile.toFile(), MissionDocument.class));
        } catch (IOException e) {
            log.error("Error loading mission from {}: {}", missionFile, e.getMessage());
            return Optional.empty();
        }
    }

    private void writeDocument(MissionDocument document) {
        try {
            Path parent = missionFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(missionFile.toFile(), document);
        } catch (IOException e) {
            log.error("Error writing mission file {}: {}", missionFile, e.getMessage());
        }
    }
}
