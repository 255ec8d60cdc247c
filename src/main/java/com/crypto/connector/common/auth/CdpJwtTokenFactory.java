package com.crypto.connector.common.auth;

import com.crypto.connector.common.model.CredentialValidationException;
import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JOSEObjectType;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.JWSHeader;
import com.nimbusds.jose.crypto.ECDSASigner;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.SignedJWT;

import java.security.SecureRandom;
import java.security.interfaces.ECPrivateKey;
import java.time.Clock;
import java.time.Instant;
import java.util.Date;
import java.util.HexFormat;

/**
 * ES256 tokens in the Coinbase Developer Platform format: {@code kid} and {@code sub} carry the
 * key name, a random {@code nonce} header, and a two minute validity window.
 */
public class CdpJwtTokenFactory implements JwtTokenFactory {
    static final String ISSUER = "cdp";
    static final long TTL_SECONDS = 120;

    private final Clock clock;
    private final SecureRandom random = new SecureRandom();

    public CdpJwtTokenFactory(Clock clock) {
        this.clock = clock;
    }

    @Override
    public String createToken(String keyName, String privateKeyPem, String uri) {
        ECPrivateKey key = PemKeys.parseEcPrivateKey(privateKeyPem);
        Instant now = clock.instant();
        JWSHeader header = new JWSHeader.Builder(JWSAlgorithm.ES256)
                .keyID(keyName)
                .type(JOSEObjectType.JWT)
                .customParam("nonce", nonce())
                .build();
        JWTClaimsSet claims = new JWTClaimsSet.Builder()
                .issuer(ISSUER)
                .subject(keyName)
                .notBeforeTime(Date.from(now))
                .expirationTime(Date.from(now.plusSeconds(TTL_SECONDS)))
                .claim("uri", uri)
                .build();
        SignedJWT jwt = new SignedJWT(header, claims);
        try {
            jwt.sign(new ECDSASigner(key));
        } catch (JOSEException e) {
            throw new CredentialValidationException("Unable to sign CDP JWT with the supplied key", e);
        }
        return jwt.serialize();
    }

    private String nonce() {
        byte[] bytes = new byte[16];
        random.nextBytes(bytes);
        return HexFormat.of().formatHex(bytes);
    }
}
