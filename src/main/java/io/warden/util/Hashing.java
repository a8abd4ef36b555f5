package io.warden.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;

public final class Hashing {
    public static final String GENESIS_HASH = "0".repeat(64);

    private Hashing() {
    }

    public static String sha256Hex(String text) {
        return sha256Hex(text.getBytes(StandardCharsets.UTF_8));
    }

    public static String sha256Hex(byte[] bytes) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(bytes));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    public static boolean isSha256Hex(String value) {
        if (value == null || value.length() != 64) {
            return false;
        }
        for (int i = 0; i < value.length(); i++) {
            char ch = value.charAt(i);
            if (!((ch >= '0' && ch <= '9') || (ch >= 'a' && ch <= 'f'))) {
                return false;
            }
        }
        return true;
    }

    /**
     * Merkle root over hex leaves. Odd levels duplicate their last leaf; an empty input hashes
     * the empty string.
     */
    public static String merkleRoot(List<String> leaves) {
        if (leaves == null || leaves.isEmpty()) {
            return sha256Hex("");
        }
        List<String> level = new ArrayList<>(leaves);
        while (level.size() > 1) {
            if (level.size() % 2 == 1) {
                level.add(level.get(level.size() - 1));
            }
            List<String> parent = new ArrayList<>(level.size() / 2);
            for (int i = 0; i < level.size(); i += 2) {
                parent.add(sha256Hex(level.get(i) + level.get(i + 1)));
            }
            level = parent;
        }
        return level.get(0);
    }
}
