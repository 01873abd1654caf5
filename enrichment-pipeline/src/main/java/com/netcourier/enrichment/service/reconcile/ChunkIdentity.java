package com.netcourier.enrichment.service.reconcile;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Locale;
import java.util.UUID;

public final class ChunkIdentity {

    private ChunkIdentity() {
    }

    public static String documentId(byte[] pdf) {
        return "doc-" + sha256(pdf).substring(0, 16);
    }

    public static String chunkId(String documentId, int order, String text) {
        String key = documentId + "|" + order + "|" + normalize(text);
        return sha256(key.getBytes(StandardCharsets.UTF_8));
    }

    public static String pointId(String chunkId) {
        return UUID.nameUUIDFromBytes(chunkId.getBytes(StandardCharsets.UTF_8)).toString();
    }

    public static String normalize(String text) {
        return text == null ? "" : text.replaceAll("\\s+", " ").trim().toLowerCase(Locale.ROOT);
    }

    private static String sha256(byte[] input) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(input);
            StringBuilder builder = new StringBuilder();
            for (byte b : hash) {
                builder.append(String.format("%02x", b));
            }
            return builder.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }
}
