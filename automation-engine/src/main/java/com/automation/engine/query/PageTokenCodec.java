package com.automation.engine.query;

import com.automation.core.exception.InvalidPageTokenException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.util.Base64;

/**
 * Encodes page tokens as {@code base64url(json).base64url(hmac)}.
 *
 * The signature binds the token to the filter it continues, so clients
 * cannot widen a query by editing a token. Without a configured secret
 * a random key is used and tokens do not survive a restart.
 */
public class PageTokenCodec {

    private static final String ALGORITHM = "HmacSHA256";
    private static final Base64.Encoder ENCODER = Base64.getUrlEncoder().withoutPadding();
    private static final Base64.Decoder DECODER = Base64.getUrlDecoder();

    private final ObjectMapper objectMapper;
    private final SecretKeySpec key;

    public PageTokenCodec(ObjectMapper objectMapper, String secret) {
        this.objectMapper = objectMapper;
        byte[] keyBytes;
        if (secret == null || secret.isBlank()) {
            keyBytes = new byte[32];
            new SecureRandom().nextBytes(keyBytes);
        } else {
            keyBytes = secret.getBytes(StandardCharsets.UTF_8);
        }
        this.key = new SecretKeySpec(keyBytes, ALGORITHM);
    }

    public String encode(PageToken token) {
        byte[] body;
        try {
            body = objectMapper.writeValueAsBytes(token);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize page token", e);
        }
        return ENCODER.encodeToString(body) + "." + ENCODER.encodeToString(sign(body));
    }

    /**
     * @throws InvalidPageTokenException if the token is empty, malformed or its signature does not match
     */
    public PageToken decode(String token) {
        if (token == null || token.isBlank()) {
            throw new InvalidPageTokenException("token is empty");
        }
        int dot = token.indexOf('.');
        if (dot <= 0 || dot == token.length() - 1) {
            throw new InvalidPageTokenException("token is malformed");
        }

        byte[] body;
        byte[] signature;
        try {
            body = DECODER.decode(token.substring(0, dot));
            signature = DECODER.decode(token.substring(dot + 1));
        } catch (IllegalArgumentException e) {
            throw new InvalidPageTokenException("token is not base64url", e);
        }
        if (!MessageDigest.isEqual(sign(body), signature)) {
            throw new InvalidPageTokenException("signature does not match");
        }

        PageToken decoded;
        try {
            decoded = objectMapper.readValue(body, PageToken.class);
        } catch (IOException e) {
            throw new InvalidPageTokenException("token body is unreadable", e);
        }
        if (decoded.filter() == null || decoded.offset() < 0 || decoded.pageSize() <= 0) {
            throw new InvalidPageTokenException("token body is incomplete");
        }
        return decoded;
    }

    private byte[] sign(byte[] body) {
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(key);
            return mac.doFinal(body);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HMAC-SHA256 unavailable", e);
        }
    }
}
