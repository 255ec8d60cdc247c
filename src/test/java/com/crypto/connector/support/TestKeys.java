package com.crypto.connector.support;

import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.spec.ECGenParameterSpec;
import java.util.Base64;

public final class TestKeys {
    public static final String CDP_KEY_NAME = "organizations/0f1e2d3c-aaaa-bbbb-cccc-1234567890ab/apiKeys/9a8b7c6d-1111-2222-3333-abcdefabcdef";

    private TestKeys() {
    }

    public static KeyPair p256() {
        try {
            KeyPairGenerator generator = KeyPairGenerator.getInstance("EC");
            generator.initialize(new ECGenParameterSpec("secp256r1"));
            return generator.generateKeyPair();
        } catch (Exception e) {
            throw new IllegalStateException(e);
        }
    }

    public static String pkcs8Pem(KeyPair pair) {
        return pem("PRIVATE KEY", pair.getPrivate().getEncoded());
    }

    public static String pem(String type, byte[] der) {
        String body = Base64.getMimeEncoder(64, "\n".getBytes()).encodeToString(der);
        return "-----BEGIN " + type + "-----\n" + body + "\n-----END " + type + "-----";
    }

    /**
     * Base64 of 64 bytes, the shape of a Kraken or Coinbase Exchange secret.
     */
    public static String base64Secret() {
        byte[] bytes = new byte[64];
        for (int i = 0; i < bytes.length; i++) {
            bytes[i] = (byte) (i * 7 + 3);
        }
        return Base64.getEncoder().encodeToString(bytes);
    }
}
