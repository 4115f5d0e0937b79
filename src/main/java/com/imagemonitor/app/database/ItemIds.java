package com.imagemonitor.app.database;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Identidades estáveis derivadas do caminho absoluto: re-scan sobrescreve em vez de duplicar.
 */
public final class ItemIds {

    private static final HexFormat HEX = HexFormat.of();

    private ItemIds() {}

    public static String archiveId(String absolutePath) {
        return sha256Prefix("archive:" + absolutePath);
    }

    public static String imageId(String absolutePath) {
        return sha256Prefix("image:" + absolutePath);
    }

    public static String entryId(String archivePath, String internalPath) {
        return sha256Prefix("entry:" + archivePath + "!" + internalPath);
    }

    public static String scanHistoryId(String directoryPath, long scanMillis) {
        return sha256Prefix("scan:" + directoryPath + "_" + scanMillis);
    }

    private static String sha256Prefix(String value) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            byte[] digest = md.digest(value.getBytes(StandardCharsets.UTF_8));
            return HEX.formatHex(digest, 0, 16);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    }
}
