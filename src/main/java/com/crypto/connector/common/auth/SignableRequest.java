package com.crypto.connector.common.auth;

/**
 * A request as the client intends to send it, before any authentication is applied.
 * {@code path} is the full request path on {@code host}; {@code query} and {@code body} are
 * already encoded and may be empty but never null.
 */
public class SignableRequest {
    public final String method;
    public final String host;
    public final String path;
    public final String query;
    public final String body;

    public SignableRequest(String method, String host, String path, String query, String body) {
        this.method = method;
        this.host = host;
        this.path = path;
        this.query = query == null ? "" : query;
        this.body = body == null ? "" : body;
    }

    public String pathWithQuery() {
        return query.isEmpty() ? path : path + "?" + query;
    }
}
