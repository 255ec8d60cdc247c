package com.crypto.connector.common.auth;

import com.crypto.connector.common.model.CredentialValidationException;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.Base64;
import java.util.HexFormat;

public final class Hmacs {
    private Hmacs() {
    }

    public static String hmacSha256Hex(String secret, String data) {
        byte[] digest = mac("HmacSHA256", secret.getBytes(StandardCharsets.UTF_8), data.getBytes(StandardCharsets.UTF_8));
        return HexFormat.of().formatHex(digest);
    }

    public static byte[] hmacSha256(byte[] key, byte[] data) {
        return mac("HmacSHA256", key, data);
    }

    public static byte[] hmacSha512(byte[] key, byte[] data) {
        return mac("HmacSHA512", key, data);
    }

    public static byte[] sha256(byte[] data) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(data);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    public static byte[] decodeBase64Secret(String secret, String provider) {
        try {
            return Base64.getDecoder().decode(secret.trim());
        } catch (IllegalArgumentException e) {
            throw new CredentialValidationException(provider + " API secret must be base64 encoded");
        }
    }

    private static byte[] mac(String algorithm, byte[] key, byte[] data) {
        try {
            Mac mac = Mac.getInstance(algorithm);
            mac.init(new SecretKeySpec(key, algorithm));
            return mac.doFinal(data);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Failed to calculate " + algorithm + " signature", e);
        }
    }
}
