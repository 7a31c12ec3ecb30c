package agentauth.endpoints;

import agentauth.exceptions.InvalidTokenException;
import agentauth.log.MDCContext;
import agentauth.model.VerifiedAccessToken;
import agentauth.secure.AccessTokenVerifier;
import com.nimbusds.oauth2.sdk.ParseException;
import com.nimbusds.oauth2.sdk.token.BearerAccessToken;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.HttpHeaders;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
public class UserInfoEndpoint {

    private final AccessTokenVerifier accessTokenVerifier;

    public UserInfoEndpoint(AccessTokenVerifier accessTokenVerifier) {
        this.accessTokenVerifier = accessTokenVerifier;
    }

    @GetMapping("oauth/userinfo")
    public Map<String, Object> getUserInfo(HttpServletRequest request) {
        return userInfo(request);
    }

    @PostMapping("oauth/userinfo")
    public Map<String, Object> postUserInfo(HttpServletRequest request) {
        return userInfo(request);
    }

    private Map<String, Object> userInfo(HttpServletRequest request) {
        MDCContext.mdcContext("action", "UserInfo");
        BearerAccessToken bearerAccessToken;
        try {
            bearerAccessToken = BearerAccessToken.parse(request.getHeader(HttpHeaders.AUTHORIZATION));
        } catch (ParseException e) {
            throw new InvalidTokenException("Missing or malformed Bearer access token");
        }
        VerifiedAccessToken accessToken = accessTokenVerifier.verify(bearerAccessToken.getValue())
                .orElseThrow(() -> new InvalidTokenException("Invalid or expired access token"));

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("sub", accessToken.getUserId());
        result.put("workspace_id", accessToken.getWorkspaceId());
        result.put("client_id", accessToken.getClientId());
        return result;
    }
}
