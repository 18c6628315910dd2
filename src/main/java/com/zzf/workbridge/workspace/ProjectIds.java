package com.zzf.workbridge.workspace;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Deterministic project identifiers of the form {@code <safe-name>-<8 hex chars>}.
 */
public final class ProjectIds {
    private static final int HASH_CHARS = 8;

    private ProjectIds() {}

    public static String generate(String projectPath) {
        String normalized = WorkspacePaths.normalize(projectPath);
        String base = normalized;
        int idx = normalized.lastIndexOf('/');
        if (idx >= 0) {
            base = normalized.substring(idx + 1);
        }
        String safeName = base
                .replaceAll("[^a-zA-Z0-9]", "-")
                .replaceAll("-+", "-")
                .replaceAll("^-|-$", "");
        if (safeName.isEmpty()) {
            safeName = "root";
        }
        return safeName + "-" + sha256Hex(normalized).substring(0, HASH_CHARS);
    }

    private static String sha256Hex(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(value.getBytes(StandardCharsets.UTF_8));
            StringBuilder sb = new StringBuilder(hash.length * 2);
            for (byte b : hash) {
                sb.append(String.format("%02x", b));
            }
            return sb.toString();
        } catch (NoSuchAlgorithmException e) {
            // every JRE ships SHA-256
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    }
}
