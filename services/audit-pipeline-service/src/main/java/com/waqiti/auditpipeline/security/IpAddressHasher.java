package com.waqiti.auditpipeline.security;

import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * One-way, fixed-length digest of network identities. Equal inputs give equal
 * hashes, so stored records stay joinable for fraud analysis.
 */
@Component
public class IpAddressHasher {

    private static final String HASH_ALGORITHM = "SHA-256";
    static final int HASH_LENGTH = 16;

    public String hash(String ipAddress) {
        if (ipAddress == null || ipAddress.isBlank()) {
            return null;
        }
        try {
            MessageDigest digest = MessageDigest.getInstance(HASH_ALGORITHM);
            byte[] hash = digest.digest(ipAddress.trim().getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash).substring(0, HASH_LENGTH);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(HASH_ALGORITHM + " not available", e);
        }
    }
}
