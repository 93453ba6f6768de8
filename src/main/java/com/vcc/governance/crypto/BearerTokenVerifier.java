package com.vcc.governance.crypto;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.time.Clock;
import java.util.Base64;
import java.util.Optional;

/**
 * Verifies HS256-signed bearer tokens (compact JWS) and exposes their claims.
 * Never throws on bad input: malformed, unsigned, wrongly signed or expired tokens
 * all yield an empty result.
 */
public class BearerTokenVerifier {
    private static final Logger log = LoggerFactory.getLogger(BearerTokenVerifier.class);

    private static final String HMAC_ALGORITHM = "HmacSHA256";

    private final byte[] secret;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public BearerTokenVerifier(String secret, ObjectMapper objectMapper, Clock clock) {
        this.secret = secret.getBytes(StandardCharsets.UTF_8);
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * Extract the token from an {@code Authorization} header value.
     *
     * @return the token, or empty if the header is missing or not a bearer credential
     */
    public static Optional<String> extractBearer(String authorizationHeader) {
        if (authorizationHeader == null || authorizationHeader.isBlank()) {
            return Optional.empty();
        }
        String trimmed = authorizationHeader.strip();
        if (trimmed.length() < 7 || !trimmed.regionMatches(true, 0, "Bearer ", 0, 7)) {
            return Optional.empty();
        }
        String token = trimmed.substring(7).strip();
        return token.isEmpty() ? Optional.empty() : Optional.of(token);
    }

    /**
     * Verify the token and return its claims.
     */
    public Optional<JsonNode> verify(String token) {
        String[] parts = token.split("\\.", -1);
        if (parts.length != 3) {
            return Optional.empty();
        }
        try {
            JsonNode header = objectMapper.readTree(Base64.getUrlDecoder().decode(parts[0]));
            if (!"HS256".equals(header.path("alg").asText())) {
                log.debug("Rejecting token with alg={}", header.path("alg").asText());
                return Optional.empty();
            }

            byte[] expected = sign(parts[0] + "." + parts[1]);
            byte[] actual = Base64.getUrlDecoder().decode(parts[2]);
            if (!MessageDigest.isEqual(expected, actual)) {
                log.debug("Rejecting token with invalid signature");
                return Optional.empty();
            }

            JsonNode claims = objectMapper.readTree(Base64.getUrlDecoder().decode(parts[1]));
            if (!claims.isObject()) {
                return Optional.empty();
            }
            JsonNode exp = claims.get("exp");
            if (exp != null && exp.isNumber() && exp.asLong() <= clock.instant().getEpochSecond()) {
                log.debug("Rejecting expired token (exp={})", exp.asLong());
                return Optional.empty();
            }
            return Optional.of(claims);
        } catch (IllegalArgumentException | IOException e) {
            log.debug("Malformed bearer token: {}", e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Compute the HS256 signature of a signing input.
     */
    public byte[] sign(String signingInput) {
        try {
            Mac mac = Mac.getInstance(HMAC_ALGORITHM);
            mac.init(new SecretKeySpec(secret, HMAC_ALGORITHM));
            return mac.doFinal(signingInput.getBytes(StandardCharsets.UTF_8));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HmacSHA256 algorithm not available", e);
        }
    }

    /**
     * Mask a credential for logging (show first 8 chars).
     */
    public static String mask(String credential) {
        if (credential == null || credential.length() < 8) {
            return "****";
        }
        return credential.substring(0, 8) + "...";
    }
}
