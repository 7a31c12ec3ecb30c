package agentauth.secure;

import agentauth.model.RevokedAccessToken;
import agentauth.model.VerifiedAccessToken;
import agentauth.repository.KeyValueStore;
import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JWSVerifier;
import com.nimbusds.jose.crypto.MACVerifier;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.SignedJWT;
import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.text.ParseException;
import java.time.Clock;
import java.util.Date;
import java.util.Optional;

import static agentauth.secure.TokenGenerator.ACCESS_TOKEN_TYPE;
import static agentauth.secure.TokenGenerator.CLIENT_ID_CLAIM;
import static agentauth.secure.TokenGenerator.TYPE_CLAIM;
import static agentauth.secure.TokenGenerator.WORKSPACE_ID_CLAIM;
import static agentauth.secure.TokenGenerator.signingAlg;

/**
 * Verifies access tokens for resource endpoints. Every failure yields {@link Optional#empty()}; callers
 * treat that as unauthenticated.
 */
@Component
public class AccessTokenVerifier {

    private static final Log LOG = LogFactory.getLog(AccessTokenVerifier.class);

    private final JWSVerifier verifier;
    private final String issuer;
    private final Clock clock;
    private final KeyValueStore<RevokedAccessToken> revokedAccessTokenStore;

    @Autowired
    public AccessTokenVerifier(@Value("${issuer}") String issuer,
                               @Value("${access_token_secret}") String secret,
                               KeyValueStore<RevokedAccessToken> revokedAccessTokenStore,
                               Clock clock) throws JOSEException {
        this.verifier = new MACVerifier(AccessTokenSecret.bytes(secret));
        this.issuer = issuer;
        this.revokedAccessTokenStore = revokedAccessTokenStore;
        this.clock = clock;
    }

    public Optional<VerifiedAccessToken> verify(String token) {
        if (!StringUtils.hasText(token)) {
            return Optional.empty();
        }
        try {
            SignedJWT signedJWT = SignedJWT.parse(token);
            if (!signingAlg.equals(signedJWT.getHeader().getAlgorithm()) || !signedJWT.verify(verifier)) {
                return rejected("invalid signature");
            }
            JWTClaimsSet claims = signedJWT.getJWTClaimsSet();
            if (!issuer.equals(claims.getIssuer())) {
                return rejected("issuer " + claims.getIssuer());
            }
            if (!ACCESS_TOKEN_TYPE.equals(claims.getStringClaim(TYPE_CLAIM))) {
                return rejected("type " + claims.getStringClaim(TYPE_CLAIM));
            }
            Date expirationTime = claims.getExpirationTime();
            if (expirationTime == null || !clock.instant().isBefore(expirationTime.toInstant())) {
                return rejected("expired");
            }
            String subject = claims.getSubject();
            String workspaceId = claims.getStringClaim(WORKSPACE_ID_CLAIM);
            if (!StringUtils.hasText(subject) || !StringUtils.hasText(workspaceId)) {
                return rejected("missing sub or workspace_id");
            }
            String jwtId = claims.getJWTID();
            if (jwtId != null && revokedAccessTokenStore.find(jwtId).isPresent()) {
                return rejected("revoked jti " + jwtId);
            }
            return Optional.of(new VerifiedAccessToken(jwtId, subject, workspaceId,
                    claims.getStringClaim(CLIENT_ID_CLAIM), expirationTime));
        } catch (ParseException | JOSEException e) {
            return rejected(e.getMessage());
        }
    }

    private Optional<VerifiedAccessToken> rejected(String reason) {
        LOG.debug("Rejected access token: " + reason);
        return Optional.empty();
    }
}
