package dao.bridge.dataworker.util;

import org.tron.trident.utils.Numeric;

import java.util.regex.Pattern;

/**
 * Hex helpers shared by the Merkle, ABI and contract-client code.
 */
public final class HexUtil {
    private HexUtil() {}

    private static final Pattern HEX = Pattern.compile("[0-9a-fA-F]*");

    public static String toHex0x(byte[] bytes) {
        return Numeric.toHexString(bytes);
    }

    public static String cleanHex(String value) {
        if (value == null) return "";
        return (value.startsWith("0x") || value.startsWith("0X"))
                ? value.substring(2)
                : value;
    }

    public static String ensure0x(String hex) {
        String h = hex == null ? "" : hex;
        return (h.startsWith("0x") || h.startsWith("0X")) ? h : ("0x" + h);
    }

    public static byte[] toBytes(String hex) {
        String c = cleanHex(hex);
        if (c.length() % 2 != 0) {
            throw new IllegalArgumentException("Odd-length hex string: " + hex);
        }
        if (!HEX.matcher(c).matches()) {
            throw new IllegalArgumentException("Invalid hex string: " + hex);
        }
        return Numeric.hexStringToByteArray(c);
    }

    public static byte[] toBytes32(String hex) {
        byte[] b = toBytes(hex);
        if (b.length != 32) {
            throw new IllegalArgumentException("Expected 32 bytes, got " + b.length + ": " + hex);
        }
        return b;
    }

    /**
     * Lower-case, 0x-prefixed, left-padded to 32 bytes. Used to compare roots from different sources.
     */
    public static String normalizeHex32(String hex) {
        String c = cleanHex(hex).toLowerCase();
        int n = 32 * 2;
        if (c.length() < n) {
            c = "0".repeat(n - c.length()) + c;
        } else if (c.length() > n) {
            c = c.substring(c.length() - n);
        }
        return "0x" + c;
    }
}
