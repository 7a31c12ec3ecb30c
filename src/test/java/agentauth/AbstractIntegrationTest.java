package agentauth;

import agentauth.model.AuthorizationCode;
import agentauth.model.RefreshToken;
import agentauth.model.RegisteredClient;
import agentauth.model.RevokedAccessToken;
import agentauth.repository.KeyValueStore;
import agentauth.secure.TokenGenerator;
import io.restassured.RestAssured;
import io.restassured.http.ContentType;
import io.restassured.response.Response;
import io.restassured.specification.RequestSpecification;
import org.junit.Before;
import org.junit.runner.RunWith;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.junit4.SpringRunner;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.util.StringUtils;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.Collections;
import java.util.Date;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static io.restassured.RestAssured.given;
import static org.junit.Assert.assertEquals;

/**
 * Override the @ActiveProfiles annotation if you don't want every request to be signed in as the dev user
 */
@RunWith(SpringRunner.class)
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT,
        properties = {
                "cron.node-cron-job-responsible=false",
                "base_url=http://localhost:8080",
                "login.url=http://localhost:3000/login",
                "static-client.client-id=static-agent",
                "static-client.client-secret=static-secret",
                "static-client.redirect-uris=http://localhost:9000/static/callback",
                "access_token_secret=integration-test-secret-which-is-long-enough-for-hs256"
        })
@ActiveProfiles("dev")
public abstract class AbstractIntegrationTest implements TestUtils {

    protected static final String REDIRECT_URI = "http://localhost:9000/callback";

    @LocalServerPort
    protected int port;

    @Autowired
    protected TokenGenerator tokenGenerator;

    @Autowired
    protected KeyValueStore<RegisteredClient> registeredClientStore;

    @Autowired
    protected KeyValueStore<AuthorizationCode> authorizationCodeStore;

    @Autowired
    protected KeyValueStore<RefreshToken> refreshTokenStore;

    @Autowired
    protected KeyValueStore<RevokedAccessToken> revokedAccessTokenStore;

    @Before
    public void before() {
        RestAssured.port = port;
        registeredClientStore.deleteAll();
        authorizationCodeStore.deleteAll();
        refreshTokenStore.deleteAll();
        revokedAccessTokenStore.deleteAll();
    }

    protected Map<String, Object> register() {
        return register(Collections.singletonList(REDIRECT_URI));
    }

    protected Map<String, Object> register(List<String> redirectUris) {
        Map<String, Object> body = new HashMap<>();
        body.put("client_name", "Test agent");
        body.put("redirect_uris", redirectUris);
        return given()
                .contentType(ContentType.JSON)
                .body(body)
                .post("oauth/register")
                .then()
                .statusCode(201)
                .extract()
                .as(mapTypeRef);
    }

    protected Response doAuthorize(String clientId, String redirectUri, String codeChallenge,
                                   String codeChallengeMethod, String state) {
        RequestSpecification request = given().redirects().follow(false)
                .queryParam("response_type", "code")
                .queryParam("client_id", clientId)
                .queryParam("redirect_uri", redirectUri);
        if (StringUtils.hasText(codeChallenge)) {
            request = request.queryParam("code_challenge", codeChallenge);
        }
        if (StringUtils.hasText(codeChallengeMethod)) {
            request = request.queryParam("code_challenge_method", codeChallengeMethod);
        }
        if (StringUtils.hasText(state)) {
            request = request.queryParam("state", state);
        }
        return request.get("oauth/authorize");
    }

    protected String doAuthorize(String clientId) {
        Response response = doAuthorize(clientId, REDIRECT_URI, null, null, null);
        assertEquals(302, response.getStatusCode());
        return getCode(response);
    }

    protected String getCode(Response response) {
        String location = response.getHeader("Location");
        return UriComponentsBuilder.fromUriString(location).build().getQueryParams().getFirst("code");
    }

    protected Response doToken(Map<String, String> formParams) {
        return given()
                .contentType(ContentType.URLENC)
                .formParams(formParams)
                .post("oauth/token");
    }

    protected Response doToken(String code, Map<String, Object> client, String codeVerifier) {
        Map<String, String> formParams = new HashMap<>();
        formParams.put("grant_type", "authorization_code");
        formParams.put("code", code);
        formParams.put("client_id", (String) client.get("client_id"));
        formParams.put("client_secret", (String) client.get("client_secret"));
        formParams.put("redirect_uri", REDIRECT_URI);
        if (codeVerifier != null) {
            formParams.put("code_verifier", codeVerifier);
        }
        return doToken(formParams);
    }

    protected Response doRefresh(String refreshToken, Map<String, Object> client) {
        Map<String, String> formParams = new HashMap<>();
        formParams.put("grant_type", "refresh_token");
        formParams.put("refresh_token", refreshToken);
        formParams.put("client_id", (String) client.get("client_id"));
        formParams.put("client_secret", (String) client.get("client_secret"));
        return doToken(formParams);
    }

    protected Map<String, Object> doTokens(Map<String, Object> client) {
        String code = doAuthorize((String) client.get("client_id"));
        return doToken(code, client, null).then().statusCode(200).extract().as(mapTypeRef);
    }

    protected void expireAuthorizationCode(String code) {
        AuthorizationCode authorizationCode = authorizationCodeStore.find(code).orElseThrow(IllegalArgumentException::new);
        ReflectionTestUtils.setField(authorizationCode, "expiresIn", new Date(System.currentTimeMillis() - 60_000L));
        authorizationCodeStore.put(authorizationCode);
    }

    protected void expireRefreshToken(String value) {
        RefreshToken refreshToken = refreshTokenStore.find(value).orElseThrow(IllegalArgumentException::new);
        ReflectionTestUtils.setField(refreshToken, "expiresIn", new Date(System.currentTimeMillis() - 60_000L));
        refreshTokenStore.put(refreshToken);
    }
}
