package com.tradeadvisor.backend.controller;

import com.tradeadvisor.backend.config.OpenApiConfig;
import com.tradeadvisor.backend.dto.SettingsDTO;
import com.tradeadvisor.backend.service.UserSettingsService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@Slf4j
@RestController
@RequestMapping("/api/settings")
@RequiredArgsConstructor
@Tag(name = "Settings")
public class SettingsController {

    private final UserSettingsService userSettingsService;

    @GetMapping
    @Operation(summary = "Risk profile, limits and auto-confirm flag")
    public ResponseEntity<SettingsDTO> getSettings(@RequestHeader(OpenApiConfig.USER_ID_HEADER) Long userId) {
        return ResponseEntity.ok(SettingsDTO.from(userSettingsService.getOrCreate(userId)));
    }

    @PutMapping
    @Operation(summary = "Update settings; omitted fields keep their value")
    public ResponseEntity<SettingsDTO> updateSettings(@RequestHeader(OpenApiConfig.USER_ID_HEADER) Long userId,
                                                      @Valid @RequestBody SettingsDTO request) {
        return ResponseEntity.ok(SettingsDTO.from(userSettingsService.update(userId, request)));
    }
}
