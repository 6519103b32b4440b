package com.solverlog.errorlog.controller;

import com.solverlog.errorlog.config.DatabaseSettings;
import com.solverlog.errorlog.service.DatabaseConfigService;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/config/database")
@Slf4j
public class DatabaseConfigController {

    private final DatabaseConfigService configService;

    public DatabaseConfigController(DatabaseConfigService configService) {
        this.configService = configService;
    }

    /** Current connection settings, password masked. */
    @GetMapping
    public ResponseEntity<DatabaseSettings> current() {
        return ResponseEntity.ok(configService.currentSettings().masked());
    }

    /** Switch to new settings and save them. */
    @PutMapping
    public ResponseEntity<DatabaseSettings> apply(@Valid @RequestBody DatabaseSettings settings) {
        log.info("Database reconfiguration requested via API");
        return ResponseEntity.ok(configService.reconfigure(settings).masked());
    }
}
