package com.feedblend.common.privacy;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Salted SHA-256 pseudonymization of account ids. Aliases are stable for a given
 * salt, so they can key collaborator-side data without exposing the raw id.
 */
public final class UserAliasGenerator {

    private static final Logger log = LoggerFactory.getLogger(UserAliasGenerator.class);

    private final String salt;

    public UserAliasGenerator(String salt) {
        this.salt = salt != null ? salt : "";
        if (this.salt.isEmpty()) {
            log.warn("[UserAliasGenerator] Empty salt used for user pseudonymization; set USER_HASH_SALT");
        }
    }

    /**
     * @return 64-character lowercase hex alias, or {@code null} for a null user id
     */
    public String alias(String userId) {
        if (userId == null) {
            return null;
        }
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest((userId + salt).getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            // every JRE ships SHA-256
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
