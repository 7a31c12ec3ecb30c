package agentauth.endpoints;

import agentauth.AbstractIntegrationTest;
import org.junit.Test;

import static io.restassured.RestAssured.given;
import static org.junit.Assert.assertEquals;

public class CorsTest extends AbstractIntegrationTest {

    @Test
    public void preflight() {
        String allowOrigin = given()
                .header("Origin", "https://agent.example.com")
                .header("Access-Control-Request-Method", "POST")
                .header("Access-Control-Request-Headers", "Content-Type")
                .options("oauth/token")
                .then()
                .statusCode(204)
                .extract()
                .header("Access-Control-Allow-Origin");
        assertEquals("*", allowOrigin);
    }

    @Test
    public void optionsWithoutPreflightHeaders() {
        given()
                .options("oauth/token")
                .then()
                .statusCode(204);
    }

    @Test
    public void optionsWithOriginOnly() {
        String allowOrigin = given()
                .header("Origin", "https://agent.example.com")
                .options("oauth/register")
                .then()
                .statusCode(204)
                .extract()
                .header("Access-Control-Allow-Origin");
        assertEquals("*", allowOrigin);
    }

    @Test
    public void preflightUnsupportedMethod() {
        given()
                .header("Origin", "https://agent.example.com")
                .header("Access-Control-Request-Method", "DELETE")
                .options("oauth/token")
                .then()
                .statusCode(403);
    }

    @Test
    public void simpleRequest() {
        String allowOrigin = given()
                .header("Origin", "https://agent.example.com")
                .get("/.well-known/oauth-authorization-server")
                .then()
                .statusCode(200)
                .extract()
                .header("Access-Control-Allow-Origin");
        assertEquals("*", allowOrigin);
    }
}
