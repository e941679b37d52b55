/*
 * Copyright 2024-2026 Firefly Software Solutions Inc
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.solarcrm.webhooks.core.signing;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.HexFormat;

/**
 * Signs outbound webhook bodies with HMAC-SHA256.
 * <p>
 * The signature is the lowercase hex digest of exactly the bytes sent as the request body,
 * keyed with the endpoint secret. Receivers recompute it over the raw body they received and
 * compare it with the {@value #SIGNATURE_HEADER} header.
 */
@Component
@Slf4j
public class WebhookSigner {

    public static final String SIGNATURE_HEADER = "X-Webhook-Signature";
    public static final String TIMESTAMP_HEADER = "X-Webhook-Timestamp";
    private static final String ALGORITHM = "HmacSHA256";

    /**
     * Computes the signature of a payload.
     *
     * @param payload the exact bytes that will be transmitted
     * @param secret the endpoint secret
     * @return lowercase hex HMAC-SHA256
     * @throws IllegalArgumentException if the secret is missing or blank
     */
    public String sign(byte[] payload, String secret) {
        if (secret == null || secret.isBlank()) {
            throw new IllegalArgumentException("Webhook secret must not be blank");
        }
        if (payload == null) {
            throw new IllegalArgumentException("Webhook payload must not be null");
        }
        return HexFormat.of().formatHex(hmac(payload, secret));
    }

    /**
     * Verifies a signature in constant time.
     *
     * @param payload the received bytes
     * @param signatureHex the hex signature that came with them
     * @param secret the shared secret
     * @return true if the signature matches, false if it does not or is not valid hex
     * @throws IllegalArgumentException if the secret is missing or blank
     */
    public boolean verify(byte[] payload, String signatureHex, String secret) {
        if (secret == null || secret.isBlank()) {
            throw new IllegalArgumentException("Webhook secret must not be blank");
        }
        if (payload == null || signatureHex == null) {
            return false;
        }

        byte[] provided;
        try {
            provided = HexFormat.of().parseHex(signatureHex.trim());
        } catch (IllegalArgumentException e) {
            log.debug("Rejecting malformed webhook signature: {}", e.getMessage());
            return false;
        }

        return MessageDigest.isEqual(hmac(payload, secret), provided);
    }

    private byte[] hmac(byte[] payload, String secret) {
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), ALGORITHM));
            return mac.doFinal(payload);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HmacSHA256 is not available", e);
        }
    }
}
