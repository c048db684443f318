package com.github.dimitryivaniuta.domainflow.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.domainflow.domain.GenerationSpec;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Stable SHA-256 hashes: generation config fingerprints and page content hashes.
 *
 * <p>Fingerprints are lower-case hex over the canonical JSON of the normalised spec, so two requests
 * that differ only in character order, case or TLD dots share a cursor.</p>
 */
@Service
public class FingerprintService {

    private final ObjectMapper canonicalObjectMapper;

    /**
     * Creates the service.
     *
     * @param canonicalObjectMapper canonical mapper
     */
    public FingerprintService(@Qualifier("canonicalObjectMapper") ObjectMapper canonicalObjectMapper) {
        this.canonicalObjectMapper = canonicalObjectMapper;
    }

    /**
     * Computes hex(SHA-256(canonicalJson(spec))).
     *
     * @param spec normalised generation spec
     * @return 64-character fingerprint
     */
    public String fingerprint(GenerationSpec spec) {
        try {
            return sha256Hex(canonicalObjectMapper.writeValueAsBytes(spec));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize generation spec for fingerprinting", e);
        }
    }

    /**
     * Hash of extracted page text, used for downstream de-duplication.
     *
     * @param content page text
     * @return hex digest
     */
    public String contentHash(String content) {
        return sha256Hex(content.getBytes(StandardCharsets.UTF_8));
    }

    public static String sha256Hex(byte[] data) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(data));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
