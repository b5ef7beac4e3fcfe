package com.docfederation.service.webhook;

import com.docfederation.configuration.AppProperties;
import com.docfederation.exception.InvalidSignatureException;
import com.google.common.hash.Hashing;
import com.google.common.io.BaseEncoding;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Locale;

/**
 * Checks the {@code X-Hub-Signature-256} header: {@code sha256=} followed by
 * the hex HMAC-SHA256 of the raw request body under the shared secret.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class WebhookSignatureVerifier {

    static final String PREFIX = "sha256=";

    private final AppProperties appProperties;

    /**
     * @throws InvalidSignatureException if the header is missing, malformed or wrong,
     *                                   or no secret is configured
     */
    public void verify(byte[] payload, String signatureHeader) {
        String secret = appProperties.getGithub().getWebhookSecret();
        if (secret == null || secret.isEmpty()) {
            log.warn("Rejecting webhook: app.github.webhook-secret is not configured");
            throw new InvalidSignatureException("Webhook secret is not configured");
        }
        if (signatureHeader == null || !signatureHeader.startsWith(PREFIX)) {
            throw new InvalidSignatureException("Missing or malformed signature header");
        }

        byte[] received;
        try {
            received = BaseEncoding.base16().decode(signatureHeader.substring(PREFIX.length()).toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new InvalidSignatureException("Signature is not valid hex");
        }
        byte[] expected = sign(secret, payload);

        // Constant-time comparison
        if (!MessageDigest.isEqual(expected, received)) {
            throw new InvalidSignatureException("Signature mismatch");
        }
    }

    static byte[] sign(String secret, byte[] payload) {
        return Hashing.hmacSha256(secret.getBytes(StandardCharsets.UTF_8)).hashBytes(payload).asBytes();
    }

    /**
     * Header value GitHub would send for {@code payload}.
     */
    public static String signatureHeader(String secret, byte[] payload) {
        return PREFIX + BaseEncoding.base16().lowerCase().encode(sign(secret, payload));
    }
}
