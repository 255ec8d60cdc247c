package com.crypto.connector.common.auth;

public class NoAuthSigner implements RequestSigner {
    @Override
    public AuthType authType() {
        return AuthType.NONE;
    }

    @Override
    public SignedRequest sign(SignableRequest request) {
        return SignedRequest.unsigned(request);
    }
}
