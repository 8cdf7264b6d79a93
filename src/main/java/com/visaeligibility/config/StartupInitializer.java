package com.visaeligibility.config;

import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import com.visaeligibility.exception.EligibilityException;
import com.visaeligibility.service.data.SeedDataLoader;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@Component
@RequiredArgsConstructor
public class StartupInitializer implements ApplicationRunner {

    private final SeedDataLoader seedDataLoader;

    @Override
    public void run(ApplicationArguments args) {
        log.info("\n{}", "=".repeat(70));
        log.info("INITIALIZING VISA ELIGIBILITY ENGINE");
        log.info("{}\n", "=".repeat(70));

        try {
            seedDataLoader.load();

            log.info("\n{}", "=".repeat(70));
            log.info("SYSTEM READY");
            log.info("{}\n", "=".repeat(70));

        } catch (EligibilityException e) {
            log.error("\n{}", "=".repeat(70));
            log.error("INITIALIZATION FAILED");
            log.error("{}\n", "=".repeat(70));
            log.error("Error: {}", e.getMessage(), e);
            log.warn("Application started without seed data; use /api/admin/reload-data once fixed");
        }
    }
}
