package com.crypto.connector.common.security;

/**
 * Reversible encoding of secret values at rest. {@code decode(encode(x))} returns {@code x}
 * for every string, including multi-line PEM blocks; {@code null} passes through.
 */
public interface CredentialCodec {
    String encode(String plaintext);

    String decode(String encoded);
}
