package com.modelregistry.api.model.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class DeleteUserRequest {

    @NotBlank(message = "Username is required")
    private String username;

    @NotBlank(message = "Database is required")
    private String database;
}
