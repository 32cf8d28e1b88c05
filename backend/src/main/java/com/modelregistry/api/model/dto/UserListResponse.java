package com.modelregistry.api.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;

import java.util.List;

@Data
@Builder
@AllArgsConstructor
public class UserListResponse {

    private String database;
    private List<UserInfo> users;

    @Data
    @Builder
    @AllArgsConstructor
    public static class UserInfo {
        private String user;
        private List<RoleInfo> roles;
    }

    @Data
    @Builder
    @AllArgsConstructor
    public static class RoleInfo {
        private String role;
        private String db;
    }
}
