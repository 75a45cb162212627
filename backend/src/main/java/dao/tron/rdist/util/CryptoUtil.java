package dao.tron.rdist.util;

import org.bouncycastle.jcajce.provider.digest.Keccak;

import java.nio.charset.StandardCharsets;

/**
 * Hashing and hex helpers shared by the tree builder and the ledger client.
 */
public final class CryptoUtil {
    private CryptoUtil() {}

    public static final int HASH_BYTES = 32;

    public static byte[] keccak256(byte[] data) {
        Keccak.Digest256 digest = new Keccak.Digest256();
        digest.update(data, 0, data.length);
        return digest.digest();
    }

    public static byte[] keccak256(String utf8) {
        return keccak256(utf8.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Unsigned lexicographic comparison.
     */
    public static int compareBytes(byte[] a, byte[] b) {
        int len = Math.min(a.length, b.length);
        for (int i = 0; i < len; i++) {
            int ai = a[i] & 0xff;
            int bi = b[i] & 0xff;
            if (ai != bi) return ai - bi;
        }
        return a.length - b.length;
    }

    public static byte[] concat(byte[]... parts) {
        int len = 0;
        for (byte[] p : parts) len += p.length;
        byte[] out = new byte[len];
        int pos = 0;
        for (byte[] p : parts) {
            System.arraycopy(p, 0, out, pos, p.length);
            pos += p.length;
        }
        return out;
    }

    public static String toHex0x(byte[] bytes) {
        StringBuilder sb = new StringBuilder(2 + bytes.length * 2);
        sb.append("0x");
        for (byte b : bytes) sb.append(String.format("%02x", b & 0xff));
        return sb.toString();
    }

    public static String cleanHex(String value) {
        if (value == null) return "";
        return (value.startsWith("0x") || value.startsWith("0X"))
                ? value.substring(2)
                : value;
    }

    public static byte[] fromHex(String hex) {
        String c = cleanHex(hex);
        if (c.length() % 2 != 0) {
            throw new IllegalArgumentException("odd-length hex string");
        }
        byte[] out = new byte[c.length() / 2];
        for (int i = 0; i < out.length; i++) {
            int hi = Character.digit(c.charAt(2 * i), 16);
            int lo = Character.digit(c.charAt(2 * i + 1), 16);
            if (hi < 0 || lo < 0) {
                throw new IllegalArgumentException("invalid hex character in " + hex);
            }
            out[i] = (byte) ((hi << 4) | lo);
        }
        return out;
    }

    /**
     * Decode a 0x-prefixed bytes32, rejecting any other width.
     */
    public static byte[] fromHex32(String hex) {
        byte[] b = fromHex(hex);
        if (b.length != HASH_BYTES) {
            throw new IllegalArgumentException("expected 32 bytes, got " + b.length + ": " + hex);
        }
        return b;
    }
}
