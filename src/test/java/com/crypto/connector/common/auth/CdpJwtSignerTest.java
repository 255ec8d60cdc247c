package com.crypto.connector.common.auth;

import com.crypto.connector.common.model.CredentialValidationException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CdpJwtSignerTest {
    @Mock
    private JwtTokenFactory tokenFactory;

    @Test
    void bindsTokenToMethodHostAndPath() {
        when(tokenFactory.createToken("key-name", "pem", "GET api.coinbase.com/api/v3/brokerage/accounts"))
                .thenReturn("jwt-token");
        CdpJwtSigner signer = new CdpJwtSigner("key-name", "pem", tokenFactory);

        SignedRequest signed = signer.sign(new SignableRequest("get", "api.coinbase.com",
                "/api/v3/brokerage/accounts", "limit=250", ""));

        assertThat(signed.headers).containsEntry("Authorization", "Bearer jwt-token");
        assertThat(signed.query).isEqualTo("limit=250");
    }

    @Test
    void missingKeyMaterialFailsWithoutCallingTheFactory() {
        CdpJwtSigner signer = new CdpJwtSigner("key-name", " ", tokenFactory);

        assertThatThrownBy(() -> signer.sign(new SignableRequest("GET", "h", "/p", "", "")))
                .isInstanceOf(CredentialValidationException.class);
        verify(tokenFactory, never()).createToken(anyString(), anyString(), anyString());
    }
}
