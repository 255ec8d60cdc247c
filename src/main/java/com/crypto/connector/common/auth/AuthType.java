package com.crypto.connector.common.auth;

public enum AuthType {
    API_KEY("api_key"),
    JWT_SERVICE("jwt_service"),
    OAUTH("oauth"),
    NONE("none");

    private final String id;

    AuthType(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }
}
