package com.crypto.connector.common.auth;

import com.crypto.connector.common.model.OperationNotSupportedException;
import org.apache.commons.lang3.StringUtils;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.List;
import java.util.Map;

/**
 * OAuth connections carry no signing secret. Requests are authorized with an access token
 * once the external code exchange has stored one; until then every call is refused.
 */
public class OAuthSigner implements RequestSigner {
    public static final String ACCESS_TOKEN_KEY = "accessToken";

    private final String accessToken;

    public OAuthSigner(String accessToken) {
        this.accessToken = accessToken;
    }

    @Override
    public AuthType authType() {
        return AuthType.OAUTH;
    }

    @Override
    public SignedRequest sign(SignableRequest request) {
        if (StringUtils.isBlank(accessToken)) {
            throw new OperationNotSupportedException("OAuth authorization has not been completed for this connection");
        }
        return new SignedRequest(request.query, Map.of("Authorization", "Bearer " + accessToken), request.body);
    }

    public static String authorizationUrl(String authorizeUrl, String clientId, String redirectUri,
                                          List<String> scopes, String state) {
        UriComponentsBuilder builder = UriComponentsBuilder.fromHttpUrl(authorizeUrl)
                .queryParam("redirect_uri", redirectUri)
                .queryParam("response_type", "code")
                .queryParam("scope", String.join(" ", scopes));
        if (StringUtils.isNotBlank(clientId)) {
            builder.queryParam("client_id", clientId);
        }
        if (StringUtils.isNotBlank(state)) {
            builder.queryParam("state", state);
        }
        return builder.encode().build().toUriString();
    }

    /**
     * The authorization-code exchange happens outside this module.
     */
    public static String exchangeAuthorizationCode(String code) {
        throw new OperationNotSupportedException("OAuth code exchange is not implemented");
    }
}
