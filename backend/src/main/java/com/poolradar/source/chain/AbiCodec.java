package com.poolradar.source.chain;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;

/**
 * Minimal ABI encoding for static-argument eth_call requests and decoding of 32-byte result words.
 */
public final class AbiCodec {

    private static final int WORD_HEX = 64;
    private static final BigInteger TWO_256 = BigInteger.ONE.shiftLeft(256);
    private static final BigInteger INT256_MAX = BigInteger.ONE.shiftLeft(255).subtract(BigInteger.ONE);

    public static final String ZERO_ADDRESS = "0x0000000000000000000000000000000000000000";

    private AbiCodec() {}

    /**
     * Selector followed by the given pre-encoded words.
     */
    public static String encodeCall(String selector, String... words) {
        StringBuilder sb = new StringBuilder(selector);
        for (String w : words) {
            sb.append(w);
        }
        return sb.toString();
    }

    public static String addressWord(String address) {
        String hex = strip0x(address).toLowerCase();
        if (hex.length() != 40) {
            throw new IllegalArgumentException("Not an address: " + address);
        }
        return "0".repeat(WORD_HEX - 40) + hex;
    }

    public static String uintWord(long value) {
        if (value < 0) {
            throw new IllegalArgumentException("uint must not be negative: " + value);
        }
        String hex = Long.toHexString(value);
        return "0".repeat(WORD_HEX - hex.length()) + hex;
    }

    /**
     * True for the empty results returned by calls to addresses without code.
     */
    public static boolean isEmptyResult(String result) {
        return result == null || strip0x(result).isEmpty();
    }

    public static int wordCount(String result) {
        return strip0x(result).length() / WORD_HEX;
    }

    public static BigInteger uintAt(String result, int index) {
        return new BigInteger(word(result, index), 16);
    }

    /**
     * Two's complement signed word, e.g. int24 tick sign-extended to 256 bits.
     */
    public static BigInteger intAt(String result, int index) {
        BigInteger raw = uintAt(result, index);
        return raw.compareTo(INT256_MAX) > 0 ? raw.subtract(TWO_256) : raw;
    }

    public static String addressAt(String result, int index) {
        String w = word(result, index);
        return "0x" + w.substring(WORD_HEX - 40);
    }

    /**
     * Decode ABI-encoded string: dynamic (offset + length + data) or bytes32 right-padded with zeros.
     */
    public static String decodeString(String result) {
        String raw = strip0x(result);
        if (raw.length() < WORD_HEX) {
            return "";
        }
        try {
            if (raw.length() >= 2 * WORD_HEX && new BigInteger(raw.substring(0, WORD_HEX), 16).intValue() == 32) {
                int len = new BigInteger(raw.substring(WORD_HEX, 2 * WORD_HEX), 16).intValue();
                int dataStart = 2 * WORD_HEX;
                if (len <= 0 || raw.length() < dataStart + len * 2) {
                    return "";
                }
                return new String(hexToBytes(raw.substring(dataStart, dataStart + len * 2)), StandardCharsets.UTF_8).trim();
            }
            byte[] bytes = hexToBytes(raw.substring(0, WORD_HEX));
            int end = 0;
            while (end < bytes.length && bytes[end] != 0) end++;
            return new String(bytes, 0, end, StandardCharsets.UTF_8).trim();
        } catch (RuntimeException e) {
            return "";
        }
    }

    private static String word(String result, int index) {
        String raw = strip0x(result);
        int start = index * WORD_HEX;
        if (raw.length() < start + WORD_HEX) {
            throw new IllegalArgumentException("Result has no word " + index + ": " + result);
        }
        return raw.substring(start, start + WORD_HEX);
    }

    private static String strip0x(String hex) {
        if (hex == null) {
            return "";
        }
        return hex.startsWith("0x") || hex.startsWith("0X") ? hex.substring(2) : hex;
    }

    private static byte[] hexToBytes(String hex) {
        int len = hex.length();
        byte[] out = new byte[len / 2];
        for (int i = 0; i < len; i += 2) {
            out[i / 2] = (byte) Integer.parseInt(hex.substring(i, i + 2), 16);
        }
        return out;
    }
}
