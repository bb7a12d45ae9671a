package com.eainde.safepulse.truthlock;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.List;

public final class EvidenceHasher {

    private static final String ALGORITHM = "SHA-256";

    private EvidenceHasher() {
    }

    /** Lower-case hex SHA-256 of the UTF-8 bytes of {@code payload}. */
    public static String hash(String payload) {
        return HexFormat.of().formatHex(newDigest().digest(payload.getBytes(StandardCharsets.UTF_8)));
    }

    /**
     * Hash of an evidence snapshot, taken at lock time. Depends on item order, types and
     * item hashes; an empty snapshot hashes the empty string.
     */
    public static String snapshotHash(List<EvidenceItem> evidence) {
        MessageDigest digest = newDigest();
        for (EvidenceItem item : evidence) {
            digest.update(item.type().getBytes(StandardCharsets.UTF_8));
            digest.update((byte) ':');
            digest.update(item.integrityHash().getBytes(StandardCharsets.UTF_8));
            digest.update((byte) '\n');
        }
        return HexFormat.of().formatHex(digest.digest());
    }

    private static MessageDigest newDigest() {
        try {
            return MessageDigest.getInstance(ALGORITHM);
        } catch (NoSuchAlgorithmException e) {
            // every JRE is required to ship SHA-256
            throw new IllegalStateException(ALGORITHM + " not available", e);
        }
    }
}
