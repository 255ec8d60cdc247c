package com.crypto.connector.common.security;

import com.crypto.connector.common.model.CredentialValidationException;
import com.crypto.connector.support.TestKeys;
import org.junit.jupiter.api.Test;

import java.util.Base64;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AesGcmCredentialCodecTest {
    private static final byte[] KEY = new byte[32];

    static {
        for (int i = 0; i < KEY.length; i++) {
            KEY[i] = (byte) i;
        }
    }

    private final AesGcmCredentialCodec codec = new AesGcmCredentialCodec(KEY);

    @Test
    void pemBlocksSurviveEncryption() {
        String pem = TestKeys.pkcs8Pem(TestKeys.p256());

        String sealed = codec.encode(pem);

        assertThat(sealed).doesNotContain("PRIVATE KEY");
        assertThat(codec.decode(sealed)).isEqualTo(pem);
    }

    @Test
    void sameValueEncryptsDifferentlyEachTime() {
        assertThat(codec.encode("secret")).isNotEqualTo(codec.encode("secret"));
    }

    @Test
    void nullPassesThrough() {
        assertThat(codec.encode(null)).isNull();
        assertThat(codec.decode(null)).isNull();
    }

    @Test
    void tamperedValueIsRejected() {
        byte[] raw = Base64.getDecoder().decode(codec.encode("secret"));
        raw[raw.length - 1] ^= 1;

        assertThatThrownBy(() -> codec.decode(Base64.getEncoder().encodeToString(raw)))
                .isInstanceOf(CredentialValidationException.class)
                .hasMessage("Stored credential could not be decrypted");
    }

    @Test
    void otherKeyCannotDecrypt() {
        byte[] otherKey = KEY.clone();
        otherKey[0] = 42;

        String sealed = codec.encode("secret");

        assertThatThrownBy(() -> new AesGcmCredentialCodec(otherKey).decode(sealed))
                .isInstanceOf(CredentialValidationException.class);
    }

    @Test
    void keyMustBe32Bytes() {
        assertThatThrownBy(() -> AesGcmCredentialCodec.fromBase64Key(Base64.getEncoder().encodeToString(new byte[16])))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(AesGcmCredentialCodec.fromBase64Key(Base64.getEncoder().encodeToString(KEY)).decode(codec.encode("x")))
                .isEqualTo("x");
    }
}
