package agentauth.secure;

import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.JWSHeader;
import com.nimbusds.jose.JWSSigner;
import com.nimbusds.jose.JOSEObjectType;
import com.nimbusds.jose.crypto.MACSigner;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.SignedJWT;
import lombok.SneakyThrows;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Instant;
import java.util.Date;
import java.util.HexFormat;
import java.util.Random;
import java.util.UUID;

/**
 * Mints every credential handed out by this server: HS256 signed access tokens and the opaque random
 * values for refresh tokens, authorization codes and client credentials.
 */
@Component
public class TokenGenerator {

    public static final JWSAlgorithm signingAlg = JWSAlgorithm.HS256;
    public static final String ACCESS_TOKEN_TYPE = "access";
    public static final String WORKSPACE_ID_CLAIM = "workspace_id";
    public static final String CLIENT_ID_CLAIM = "client_id";
    public static final String TYPE_CLAIM = "type";

    private static final char[] DEFAULT_CODEC = "1234567890ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz"
            .toCharArray();

    private final Random random = new SecureRandom();

    private final String issuer;

    private final JWSSigner signer;

    private final int accessTokenValidity;

    private final Clock clock;

    @Autowired
    public TokenGenerator(@Value("${issuer}") String issuer,
                          @Value("${access_token_secret}") String secret,
                          @Value("${token.access-token-validity-seconds}") int accessTokenValidity,
                          Clock clock) throws JOSEException {
        this.issuer = issuer;
        //MACSigner refuses secrets shorter than 256 bits
        this.signer = new MACSigner(AccessTokenSecret.bytes(secret));
        this.accessTokenValidity = accessTokenValidity;
        this.clock = clock;
    }

    @SneakyThrows
    public String generateAccessToken(String userId, String workspaceId, String clientId) {
        Instant now = clock.instant();
        JWTClaimsSet claimsSet = new JWTClaimsSet.Builder()
                .subject(userId)
                .claim(WORKSPACE_ID_CLAIM, workspaceId)
                .claim(TYPE_CLAIM, ACCESS_TOKEN_TYPE)
                .claim(CLIENT_ID_CLAIM, clientId)
                .issuer(issuer)
                .issueTime(Date.from(now))
                .expirationTime(Date.from(now.plusSeconds(accessTokenValidity)))
                .jwtID(UUID.randomUUID().toString())
                .build();
        JWSHeader header = new JWSHeader.Builder(signingAlg).type(JOSEObjectType.JWT).build();
        SignedJWT signedJWT = new SignedJWT(header, claimsSet);
        signedJWT.sign(signer);
        return signedJWT.serialize();
    }

    public String generateRefreshToken() {
        return randomHex(32);
    }

    public String generateClientSecret() {
        return randomHex(32);
    }

    public String generateClientId() {
        return UUID.randomUUID().toString();
    }

    public String generateAuthorizationCode() {
        char[] chars = new char[32];
        for (int i = 0; i < chars.length; i++) {
            chars[i] = DEFAULT_CODEC[random.nextInt(DEFAULT_CODEC.length)];
        }
        return new String(chars);
    }

    public int getAccessTokenValidity() {
        return accessTokenValidity;
    }

    private String randomHex(int numberOfBytes) {
        byte[] bytes = new byte[numberOfBytes];
        random.nextBytes(bytes);
        return HexFormat.of().formatHex(bytes);
    }
}
