package com.modelregistry.api.controller;

import com.modelregistry.api.util.PasswordGenerator;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@Tag(name = "Users", description = "MongoDB user management")
public class PasswordController {

    @GetMapping("/generate_password")
    @Operation(summary = "Generate a secure password")
    public ResponseEntity<Map<String, String>> generatePassword(
            @Parameter(description = "Length of the password (1-1024)")
            @RequestParam(defaultValue = "" + PasswordGenerator.DEFAULT_LENGTH) int length,
            @Parameter(description = "Whether to include special characters")
            @RequestParam(name = "special_chars", defaultValue = "false") boolean specialChars) {
        return ResponseEntity.ok(Map.of("password", PasswordGenerator.generate(length, specialChars)));
    }
}
