package com.modelregistry.api.service;

import com.modelregistry.api.exception.ApiException;
import com.modelregistry.api.model.dto.CreateUserRequest;
import com.modelregistry.api.model.dto.DeleteUserRequest;
import com.modelregistry.api.model.dto.UserListResponse;
import com.mongodb.MongoCommandException;
import com.mongodb.client.MongoClient;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.bson.Document;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Manages MongoDB database users through the user management commands
 * ({@code createUser}, {@code dropUser}, {@code usersInfo}).
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MongoUserService {

    private final MongoClient mongoClient;

    public void createUser(CreateUserRequest request) {
        Document command = new Document("createUser", request.getUsername())
                .append("pwd", request.getPassword())
                .append("roles", List.of(
                        new Document("role", request.getRole()).append("db", request.getDatabase())));

        runUserCommand(request.getDatabase(), command, "create user '" + request.getUsername() + "'");
        log.info("Created user '{}' with role '{}' in database '{}'",
                request.getUsername(), request.getRole(), request.getDatabase());
    }

    public void deleteUser(DeleteUserRequest request) {
        Document command = new Document("dropUser", request.getUsername());

        runUserCommand(request.getDatabase(), command, "delete user '" + request.getUsername() + "'");
        log.info("Deleted user '{}' from database '{}'", request.getUsername(), request.getDatabase());
    }

    public UserListResponse listUsers(String database) {
        Document result = runUserCommand(database, new Document("usersInfo", 1), "list users");

        List<UserListResponse.UserInfo> users = result.getList("users", Document.class, List.of()).stream()
                .map(user -> UserListResponse.UserInfo.builder()
                        .user(user.getString("user"))
                        .roles(user.getList("roles", Document.class, List.of()).stream()
                                .map(role -> UserListResponse.RoleInfo.builder()
                                        .role(role.getString("role"))
                                        .db(role.getString("db"))
                                        .build())
                                .toList())
                        .build())
                .toList();

        return UserListResponse.builder()
                .database(database)
                .users(users)
                .build();
    }

    private Document runUserCommand(String database, Document command, String action) {
        try {
            return mongoClient.getDatabase(database).runCommand(command);
        } catch (MongoCommandException e) {
            log.warn("Failed to {} in database '{}': {}", action, database, e.getErrorMessage());
            throw new ApiException(e.getErrorMessage(), HttpStatus.BAD_REQUEST, e);
        }
    }
}
