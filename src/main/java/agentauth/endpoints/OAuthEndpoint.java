package agentauth.endpoints;

import agentauth.model.AuthorizationCode;
import agentauth.model.RefreshToken;
import agentauth.model.RegisteredClient;
import agentauth.repository.KeyValueStore;
import agentauth.secure.TokenGenerator;
import agentauth.user.WorkspaceUser;
import org.springframework.http.CacheControl;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;

import java.time.Clock;
import java.time.temporal.ChronoUnit;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.Map;

public interface OAuthEndpoint {

    /**
     * The only place where access and refresh tokens are minted, for both grant types.
     */
    default Map<String, Object> tokenEndpointResponse(RegisteredClient client, String userId, String workspaceId) {
        TokenGenerator tokenGenerator = getTokenGenerator();
        String accessToken = tokenGenerator.generateAccessToken(userId, workspaceId, client.getClientId());
        String refreshTokenValue = tokenGenerator.generateRefreshToken();
        Date refreshTokenExpiresIn = Date.from(getClock().instant().plus(getRefreshTokenValidityDays(), ChronoUnit.DAYS));
        getRefreshTokenStore().put(
                new RefreshToken(refreshTokenValue, client.getClientId(), userId, workspaceId, refreshTokenExpiresIn));

        Map<String, Object> map = new LinkedHashMap<>();
        map.put("access_token", accessToken);
        map.put("token_type", "Bearer");
        map.put("expires_in", tokenGenerator.getAccessTokenValidity());
        map.put("refresh_token", refreshTokenValue);
        return map;
    }

    default AuthorizationCode constructAuthorizationCode(RegisteredClient client, WorkspaceUser user, String redirectUri,
                                                         String codeChallenge, String codeChallengeMethod) {
        return new AuthorizationCode(
                getTokenGenerator().generateAuthorizationCode(),
                client.getClientId(),
                user.getUserId(),
                user.getWorkspaceId(),
                redirectUri,
                codeChallenge,
                codeChallengeMethod,
                tokenValidity(getAuthorizationCodeValidityMinutes() * 60L));
    }

    default Date tokenValidity(long seconds) {
        return Date.from(getClock().instant().plusSeconds(seconds));
    }

    default HttpHeaders getResponseHeaders() {
        HttpHeaders headers = new HttpHeaders();
        headers.setCacheControl(CacheControl.noStore());
        headers.setPragma("no-cache");
        headers.setContentType(MediaType.APPLICATION_JSON);
        return headers;
    }

    TokenGenerator getTokenGenerator();

    KeyValueStore<RefreshToken> getRefreshTokenStore();

    Clock getClock();

    default int getRefreshTokenValidityDays() {
        return 30;
    }

    default int getAuthorizationCodeValidityMinutes() {
        return 10;
    }
}
