package com.crypto.connector.common.auth;

public interface RequestSigner {
    AuthType authType();

    SignedRequest sign(SignableRequest request);
}
