package com.aldar.middleware.security;

import com.aldar.middleware.config.AppAuthProperties;
import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.crypto.MACVerifier;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.SignedJWT;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.text.ParseException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Verifies HS256 bearer tokens issued upstream and extracts the calling user.
 * The signing key is the SHA-256 digest of the configured secret; rotated secrets stay
 * valid while listed in {@code previous-secrets}.
 */
@Component
public class JwtPrincipalVerifier {

    private static final Logger log = LoggerFactory.getLogger(JwtPrincipalVerifier.class);

    private final AppAuthProperties properties;
    private final Clock clock;
    private final AtomicBoolean missingSecretWarned = new AtomicBoolean(false);

    public JwtPrincipalVerifier(AppAuthProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
    }

    public Optional<JwtPrincipal> verify(String token) {
        if (!StringUtils.hasText(token)) {
            return Optional.empty();
        }

        SignedJWT jwt;
        JWTClaimsSet claimsSet;
        try {
            jwt = SignedJWT.parse(token.trim());
            claimsSet = jwt.getJWTClaimsSet();
        } catch (ParseException ex) {
            log.debug("bearer token parse failed token={}", maskToken(token));
            return Optional.empty();
        }

        if (!JWSAlgorithm.HS256.equals(jwt.getHeader().getAlgorithm())) {
            log.debug("bearer token rejected, unexpected alg={}", jwt.getHeader().getAlgorithm());
            return Optional.empty();
        }
        if (!verifySignature(jwt, resolveSigningSecrets())) {
            return Optional.empty();
        }

        Instant now = clock.instant();
        Date expiration = claimsSet.getExpirationTime();
        if (expiration == null || !expiration.toInstant().isAfter(now)) {
            log.debug("bearer token expired or without exp token={}", maskToken(token));
            return Optional.empty();
        }
        if (StringUtils.hasText(properties.getIssuer()) && !properties.getIssuer().trim().equals(claimsSet.getIssuer())) {
            log.debug("bearer token issuer mismatch issuer={}", claimsSet.getIssuer());
            return Optional.empty();
        }

        String userId = stringClaim(claimsSet, properties.getUserClaim());
        if (!StringUtils.hasText(userId)) {
            userId = claimsSet.getSubject();
        }
        if (!StringUtils.hasText(userId)) {
            return Optional.empty();
        }
        return Optional.of(new JwtPrincipal(userId.trim(), claimsSet.getIssuer(), expiration.toInstant()));
    }

    static byte[] deriveSigningKey(String secret) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(secret.getBytes(StandardCharsets.UTF_8));
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("SHA-256 not available", ex);
        }
    }

    private boolean verifySignature(SignedJWT jwt, List<String> secrets) {
        if (secrets.isEmpty()) {
            if (missingSecretWarned.compareAndSet(false, true)) {
                log.warn("app.auth.secret is missing, every bearer token is rejected");
            }
            return false;
        }
        for (String secret : secrets) {
            try {
                if (jwt.verify(new MACVerifier(deriveSigningKey(secret)))) {
                    return true;
                }
            } catch (JOSEException ex) {
                log.debug("bearer token signature verification failed token={}", maskToken(jwt.serialize()));
            }
        }
        return false;
    }

    private List<String> resolveSigningSecrets() {
        List<String> secrets = new ArrayList<>();
        if (StringUtils.hasText(properties.getSecret())) {
            secrets.add(properties.getSecret().trim());
        }
        if (StringUtils.hasText(properties.getPreviousSecrets())) {
            for (String item : properties.getPreviousSecrets().split(",")) {
                if (StringUtils.hasText(item)) {
                    secrets.add(item.trim());
                }
            }
        }
        return secrets;
    }

    private static String stringClaim(JWTClaimsSet claimsSet, String key) {
        if (!StringUtils.hasText(key)) {
            return null;
        }
        Object value = claimsSet.getClaim(key.trim());
        return value == null ? null : String.valueOf(value);
    }

    private static String maskToken(String token) {
        if (!StringUtils.hasText(token)) {
            return "<empty>";
        }
        String normalized = token.trim();
        if (normalized.length() <= 12) {
            return "***";
        }
        return normalized.substring(0, 6) + "..." + normalized.substring(normalized.length() - 4);
    }

    public record JwtPrincipal(String userId, String issuer, Instant expiresAt) {
    }
}
