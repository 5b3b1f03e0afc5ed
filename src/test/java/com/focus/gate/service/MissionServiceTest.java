package com.focus.gate.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.focus.gate.dto.MissionDocument;
import com.focus.gate.engine.mission.Mission;
import com.focus.gate.engine.mission.MissionValidationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MissionServiceTest {

    @TempDir
    Path tempDir;

    private Path missionFile;
    private MissionService service;

    @BeforeEach
    void setUp() {
        missionFile = tempDir.resolve("config/mission.json");
        service = new MissionService(new ObjectMapper(), missionFile, 10);
    }

    @Test
    void missingFile_usesAndWritesDefaultMission() {
        Mission mission = service.reload();

        assertEquals(MissionService.DEFAULT_MISSION.mission(), mission.text());
        assertTrue(Files.exists(missionFile));
        assertTrue(service.current().isPresent());
    }

    @Test
    void readsDocumentWithAllowLists() throws IOException {
        Files.createDirectories(missionFile.getParent());
        Files.writeString(missionFile, "{\"mission\": \"Learn Kubernetes networking\","
                + " \"allowed_domains\": [\"kubernetes.io\"],"
                + " \"allowed_keywords\": [\"CNI\"],"
                + " \"updated_by\": \"setup\"}");

        Mission mission = service.reload();

        assertEquals("Learn Kubernetes networking", mission.text());
        assertEquals(List.of("kubernetes.io"), mission.allowedDomains());
        assertTrue(mission.keywords().contains("cni"));
        assertTrue(mission.keywords().contains("kubernetes"));
    }

    @Test
    void blankMissionText_fallsBackToDefault() throws IOException {
        Files.createDirectories(missionFile.getParent());
        Files.writeString(missionFile, "{\"mission\": \"  \"}");

        assertEquals(MissionService.DEFAULT_MISSION.mission(), service.reload().text());
    }

    @Test
    void corruptFile_fallsBackToDefault() throws IOException {
        Files.createDirectories(missionFile.getParent());
        Files.writeString(missionFile, "{not json");

        assertEquals(MissionService.DEFAULT_MISSION.mission(), service.reload().text());
    }

    @Test
    void replace_persistsForTheNextReload() {
        service.replace(new MissionDocument("Write the quarterly report", List.of("docs.google.com"), List.of()));

        MissionService reopened = new MissionService(new ObjectMapper(), missionFile, 10);
        Mission mission = reopened.reload();
        assertEquals("Write the quarterly report", mission.text());
        assertEquals(List.of("docs.google.com"), mission.allowedDomains());
    }

    @Test
    void replace_rejectsShortMissionsAndKeepsTheCurrentOne() {
        service.reload();
        assertThrows(MissionValidationException.class,
                () -> service.replace(new MissionDocument("code", List.of(), List.of())));
        assertEquals(MissionService.DEFAULT_MISSION.mission(), service.current().orElseThrow().text());
    }
}
