package com.procureinsight.discovery.cache;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Locale;

/**
 * Cache key construction. Keys are a readable prefix followed by a SHA-256 fingerprint.
 */
public final class CacheKeys {

    public static final String SEARCH_PREFIX = "search:";
    public static final String SUPPLIER_PREFIX = "supplier:";
    public static final String MARKET_PREFIX = "market:";

    private CacheKeys() {
    }

    /**
     * Key for an aggregated result set of one search kind and (query, location) pair
     */
    public static String searchKey(String kind, String query, String location) {
        return SEARCH_PREFIX + kind + ":" + fingerprint(normalize(query), normalize(location));
    }

    /**
     * Stable fingerprint of a candidate: its name and a hash of its description
     */
    public static String supplierKey(String name, String description) {
        return SUPPLIER_PREFIX + fingerprint(normalize(name), sha256(description == null ? "" : description));
    }

    public static String marketKey(String product, String timeframe, String region) {
        return MARKET_PREFIX + fingerprint(normalize(product), normalize(timeframe), normalize(region));
    }

    /**
     * SHA-256 over the parts joined with a unit separator, first 16 bytes as hex
     */
    public static String fingerprint(String... parts) {
        String input = String.join("\u001f", parts);
        return sha256(input).substring(0, 32);
    }

    static String sha256(String input) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            byte[] hash = md.digest(input.getBytes(StandardCharsets.UTF_8));
            StringBuilder hexString = new StringBuilder(hash.length * 2);
            for (byte b : hash) {
                String hex = Integer.toHexString(0xff & b);
                if (hex.length() == 1) hexString.append('0');
                hexString.append(hex);
            }
            return hexString.toString();
        } catch (NoSuchAlgorithmException e) {
            // every JVM ships SHA-256
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }

    private static String normalize(String value) {
        if (value == null) {
            return "";
        }
        return value.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
    }
}
