package com.crypto.connector.common.security;

import com.crypto.connector.common.model.CredentialValidationException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class Base64CredentialCodecTest {
    private final Base64CredentialCodec codec = new Base64CredentialCodec();

    @Test
    void roundTripsMultiLineValues() {
        String value = "line one\nline two\n";

        assertThat(codec.encode(value)).isEqualTo("bGluZSBvbmUKbGluZSB0d28K");
        assertThat(codec.decode(codec.encode(value))).isEqualTo(value);
    }

    @Test
    void garbageIsRejected() {
        assertThatThrownBy(() -> codec.decode("not base64!"))
                .isInstanceOf(CredentialValidationException.class);
    }
}
