package com.dedicatedcode.hakemisto.service;

/**
 * Tuning of prefix lookups.
 *
 * @param minFullPrefixLength prefixes at least this long match every key starting with them
 * @param minPrefixRatio      shorter prefixes only match keys where prefix length / key length reaches this ratio
 * @param maxResults          more ids than this fail the lookup
 */
public record PrefixMatchPolicy(int minFullPrefixLength, double minPrefixRatio, int maxResults) {

    public static final PrefixMatchPolicy DEFAULT = new PrefixMatchPolicy(3, 0.5, 2000);

    public PrefixMatchPolicy {
        if (minFullPrefixLength < 0) {
            throw new IllegalArgumentException("minFullPrefixLength must not be negative");
        }
        if (maxResults < 1) {
            throw new IllegalArgumentException("maxResults must be positive");
        }
    }

    public boolean accepts(String prefix, String key) {
        return prefix.length() >= minFullPrefixLength
                || (prefix.length() * 1.0 / key.length()) >= minPrefixRatio;
    }
}
