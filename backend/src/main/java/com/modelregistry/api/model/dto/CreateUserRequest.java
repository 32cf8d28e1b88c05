package com.modelregistry.api.model.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CreateUserRequest {

    @NotBlank(message = "Username is required")
    private String username;

    @NotBlank(message = "Password is required")
    private String password;

    /**
     * Built-in or custom MongoDB role, e.g. {@code read} or {@code readWrite}.
     */
    @NotBlank(message = "Role is required")
    private String role;

    @NotBlank(message = "Database is required")
    private String database;
}
