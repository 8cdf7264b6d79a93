package com.visaeligibility.controller;

import com.visaeligibility.exception.EligibilityException;
import com.visaeligibility.service.data.SeedDataLoader;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/admin")
@RequiredArgsConstructor
public class AdminController {

    private final SeedDataLoader seedDataLoader;

    @PostMapping("/reload-data")
    public ResponseEntity<?> reloadData() {
        log.info("Reloading seed data");
        try {
            return ResponseEntity.ok(Map.of("status", "reloaded", "counts", seedDataLoader.load()));
        } catch (EligibilityException e) {
            return ResponseEntity.internalServerError().body(Map.of("error", e.getMessage()));
        }
    }
}
