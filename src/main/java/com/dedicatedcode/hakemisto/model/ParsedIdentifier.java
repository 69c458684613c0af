/*
 *  This file is part of hakemisto.
 *
 *  Hakemisto is free software: you can redistribute it and/or
 *  modify it under the terms of the GNU Affero General Public License
 *  as published by the Free Software Foundation, either version 3 or
 *  any later version.
 *
 *  Hakemisto is distributed in the hope that it will be useful,
 *  but WITHOUT ANY WARRANTY; without even the implied
 *  warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.
 *  See the GNU Affero General Public License for more details.
 * You should have received a copy of the GNU Affero General Public License
 * along with Hakemisto. If not, see <https://www.gnu.org/licenses/>.
 */

package com.dedicatedcode.hakemisto.model;

/**
 * Result of classifying a user supplied identifier string.
 * <p>
 * Forms are tried in order: legacy, numeric, {@code namespace:value}. A legacy id is 24 characters
 * and no long has more than 19 digits, so an all-digit legacy id is never numeric. Input containing
 * a colon that is not a valid {@code namespace:value} is unparseable. Anything else that is not
 * blank is a slug candidate which only the slug index can resolve. {@code featureId} is set for
 * the first three kinds and {@code null} otherwise.
 */
public record ParsedIdentifier(Kind kind, String input, FeatureId featureId) {

    public enum Kind {
        NUMERIC,
        LEGACY,
        HUMAN_READABLE,
        SLUG,
        UNPARSEABLE
    }

    public static ParsedIdentifier classify(String input) {
        if (input == null || input.isBlank()) {
            return new ParsedIdentifier(Kind.UNPARSEABLE, input, null);
        }
        String trimmed = input.trim();

        if (FeatureId.isLegacyHex(trimmed)) {
            return new ParsedIdentifier(Kind.LEGACY, input, FeatureId.fromLegacyHex(trimmed));
        }

        Long numeric = parseNonNegativeLong(trimmed);
        if (numeric != null) {
            return new ParsedIdentifier(Kind.NUMERIC, input, FeatureId.fromLong(numeric));
        }

        int separator = trimmed.indexOf(':');
        if (separator >= 0) {
            String label = trimmed.substring(0, separator);
            Long value = parseNonNegativeLong(trimmed.substring(separator + 1));
            FeatureNamespace namespace = FeatureNamespace.fromLabel(label).orElse(null);
            if (namespace != null && value != null) {
                return new ParsedIdentifier(Kind.HUMAN_READABLE, input, FeatureId.of(namespace, value));
            }
            // slugs never contain a colon
            return new ParsedIdentifier(Kind.UNPARSEABLE, input, null);
        }

        return new ParsedIdentifier(Kind.SLUG, input, null);
    }

    public boolean isResolved() {
        return featureId != null;
    }

    private static Long parseNonNegativeLong(String s) {
        if (s.isEmpty()) {
            return null;
        }
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c < '0' || c > '9') {
                return null;
            }
        }
        try {
            return Long.parseLong(s);
        } catch (NumberFormatException e) {
            // more digits than a long holds
            return null;
        }
    }
}
