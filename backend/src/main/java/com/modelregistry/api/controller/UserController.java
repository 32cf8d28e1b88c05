package com.modelregistry.api.controller;

import com.modelregistry.api.model.dto.CreateUserRequest;
import com.modelregistry.api.model.dto.DeleteUserRequest;
import com.modelregistry.api.model.dto.UserListResponse;
import com.modelregistry.api.service.MongoUserService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequiredArgsConstructor
@Tag(name = "Users", description = "MongoDB user management")
public class UserController {

    private final MongoUserService userService;

    @PostMapping("/create_user")
    @Operation(summary = "Create a new user in the specified MongoDB database")
    public ResponseEntity<Map<String, String>> createUser(@Valid @RequestBody CreateUserRequest request) {
        userService.createUser(request);
        return ResponseEntity.ok(Map.of("message", String.format(
                "User '%s' created successfully in database '%s'.",
                request.getUsername(), request.getDatabase())));
    }

    @DeleteMapping("/delete_user")
    @Operation(summary = "Delete a user from the specified MongoDB database")
    public ResponseEntity<Map<String, String>> deleteUser(@Valid @RequestBody DeleteUserRequest request) {
        userService.deleteUser(request);
        return ResponseEntity.ok(Map.of("message", String.format(
                "User '%s' deleted successfully from database '%s'.",
                request.getUsername(), request.getDatabase())));
    }

    @GetMapping("/list_users")
    @Operation(summary = "List users defined in the specified MongoDB database")
    public ResponseEntity<UserListResponse> listUsers(@RequestParam String database) {
        return ResponseEntity.ok(userService.listUsers(database));
    }
}
