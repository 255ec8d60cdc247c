package com.crypto.connector.common.auth;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public class SignedRequest {
    public final String query;
    public final Map<String, String> headers;
    public final String body;

    public SignedRequest(String query, Map<String, String> headers, String body) {
        this.query = query == null ? "" : query;
        this.headers = headers == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(headers));
        this.body = body == null ? "" : body;
    }

    public static SignedRequest unsigned(SignableRequest request) {
        return new SignedRequest(request.query, Map.of(), request.body);
    }
}
