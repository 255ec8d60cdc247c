package com.crypto.connector.common.auth;

public interface JwtTokenFactory {
    /**
     * Builds a short-lived bearer token for one request.
     *
     * @param keyName       CDP key name ({@code organizations/.../apiKeys/...})
     * @param privateKeyPem EC private key in SEC1 or PKCS#8 PEM form
     * @param uri           {@code "METHOD host/path"} of the request being authorized
     */
    String createToken(String keyName, String privateKeyPem, String uri);
}
