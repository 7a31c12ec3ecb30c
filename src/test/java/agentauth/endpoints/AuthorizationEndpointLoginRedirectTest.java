package agentauth.endpoints;

import agentauth.AbstractIntegrationTest;
import io.restassured.response.Response;
import org.junit.Test;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.util.MultiValueMap;
import org.springframework.web.util.UriComponentsBuilder;
import org.springframework.web.util.UriUtils;

import java.nio.charset.StandardCharsets;
import java.util.Map;

import static io.restassured.RestAssured.given;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

@ActiveProfiles(value = "prod", inheritProfiles = false)
public class AuthorizationEndpointLoginRedirectTest extends AbstractIntegrationTest {

    @Test
    public void redirectToLogin() {
        Map<String, Object> client = register();
        Response response = doAuthorize((String) client.get("client_id"), REDIRECT_URI, null, null, "state");
        assertEquals(302, response.getStatusCode());

        String location = response.getHeader("Location");
        assertTrue(location.startsWith("http://localhost:3000/login?redirect_url="));
        MultiValueMap<String, String> queryParams = UriComponentsBuilder.fromUriString(location).build().getQueryParams();
        String returnUrl = UriUtils.decode(queryParams.getFirst("redirect_url"), StandardCharsets.UTF_8);
        assertTrue(returnUrl.startsWith("http://localhost:8080/oauth/authorize?"));
        assertTrue(returnUrl.contains("client_id=" + client.get("client_id")));
        assertEquals(0L, authorizationCodeStore.count());
    }

    @Test
    public void missingWorkspaceRedirectsToLogin() {
        Map<String, Object> client = register();
        Response response = given().redirects().follow(false)
                .header("X-Authenticated-User-Id", "user")
                .queryParam("response_type", "code")
                .queryParam("client_id", client.get("client_id"))
                .queryParam("redirect_uri", REDIRECT_URI)
                .get("oauth/authorize");
        assertEquals(302, response.getStatusCode());
        assertTrue(response.getHeader("Location").startsWith("http://localhost:3000/login"));
    }

    @Test
    public void authenticatedThroughHeaders() {
        Map<String, Object> client = register();
        Response response = given().redirects().follow(false)
                .header("X-Authenticated-User-Id", "user")
                .header("X-Active-Workspace-Id", "workspace")
                .queryParam("response_type", "code")
                .queryParam("client_id", client.get("client_id"))
                .queryParam("redirect_uri", REDIRECT_URI)
                .get("oauth/authorize");
        assertEquals(302, response.getStatusCode());
        String code = getCode(response);
        assertEquals("user", authorizationCodeStore.find(code).get().getUserId());
        assertEquals("workspace", authorizationCodeStore.find(code).get().getWorkspaceId());
    }
}
