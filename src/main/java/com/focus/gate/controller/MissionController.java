package com.focus.gate.controller;

import com.focus.gate.dto.MissionDocument;
import com.focus.gate.service.MissionService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/mission")
@RequiredArgsConstructor
public class MissionController {

    private final MissionService missionService;

    @GetMapping
    public ResponseEntity<MissionDocument> getMission() {
        return ResponseEntity.ok(missionService.document());
    }

    @PutMapping
    public ResponseEntity<MissionDocument> replaceMission(@RequestBody MissionDocument document) {
        missionService.replace(document);
        return ResponseEntity.ok(missionService.document());
    }
}
