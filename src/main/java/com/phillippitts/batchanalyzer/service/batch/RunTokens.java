package com.phillippitts.batchanalyzer.service.batch;

import com.phillippitts.batchanalyzer.domain.BatchItem;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.List;

/**
 * Derives run tokens from batch contents so that re-submitting the same items resumes the same
 * checkpoint.
 */
final class RunTokens {

    private static final int TOKEN_LENGTH = 16;

    private RunTokens() {
    }

    /**
     * First 16 hex characters of SHA-256 over the ordered item ids, newline separated.
     */
    static String derive(List<BatchItem> items) {
        MessageDigest digest;
        try {
            digest = MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
        for (BatchItem item : items) {
            digest.update(item.id().getBytes(StandardCharsets.UTF_8));
            digest.update((byte) '\n');
        }
        return HexFormat.of().formatHex(digest.digest()).substring(0, TOKEN_LENGTH);
    }
}
