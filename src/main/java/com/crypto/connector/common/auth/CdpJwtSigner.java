package com.crypto.connector.common.auth;

import com.crypto.connector.common.model.CredentialValidationException;
import org.apache.commons.lang3.StringUtils;

import java.util.Locale;
import java.util.Map;

public class CdpJwtSigner implements RequestSigner {
    private final String keyName;
    private final String privateKeyPem;
    private final JwtTokenFactory tokenFactory;

    public CdpJwtSigner(String keyName, String privateKeyPem, JwtTokenFactory tokenFactory) {
        this.keyName = keyName;
        this.privateKeyPem = privateKeyPem;
        this.tokenFactory = tokenFactory;
    }

    @Override
    public AuthType authType() {
        return AuthType.JWT_SERVICE;
    }

    @Override
    public SignedRequest sign(SignableRequest request) {
        if (StringUtils.isBlank(keyName) || StringUtils.isBlank(privateKeyPem)) {
            throw new CredentialValidationException("Missing JWT key name or private key for coinbase");
        }
        String uri = request.method.toUpperCase(Locale.ROOT) + " " + request.host + request.path;
        String token = tokenFactory.createToken(keyName, privateKeyPem, uri);
        return new SignedRequest(request.query, Map.of("Authorization", "Bearer " + token), request.body);
    }
}
