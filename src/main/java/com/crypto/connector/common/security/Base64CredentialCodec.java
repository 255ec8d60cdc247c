package com.crypto.connector.common.security;

import com.crypto.connector.common.model.CredentialValidationException;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

/**
 * Plain base64. Reversible but offers no confidentiality; only used when no key is configured.
 */
public class Base64CredentialCodec implements CredentialCodec {
    @Override
    public String encode(String plaintext) {
        if (plaintext == null) {
            return null;
        }
        return Base64.getEncoder().encodeToString(plaintext.getBytes(StandardCharsets.UTF_8));
    }

    @Override
    public String decode(String encoded) {
        if (encoded == null) {
            return null;
        }
        try {
            return new String(Base64.getDecoder().decode(encoded), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            throw new CredentialValidationException("Stored credential is not valid base64", e);
        }
    }
}
