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

import com.dedicatedcode.hakemisto.exception.FeatureIdParseException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.nio.ByteBuffer;
import java.util.HexFormat;
import java.util.regex.Pattern;

/**
 * Identifier of a stored feature.
 * <p>
 * The canonical form is 12 bytes: a 4 byte namespace followed by an 8 byte value, both big endian.
 * The legacy form is exactly those bytes as 24 hex characters. Ids whose namespace fits into the
 * top byte and whose value fits into the remaining 56 bits also have a compact {@code long} form.
 */
public record FeatureId(int namespace, long value) {

    public static final int BYTES = Integer.BYTES + Long.BYTES;

    private static final Pattern LEGACY_PATTERN = Pattern.compile("[0-9a-fA-F]{24}");
    private static final HexFormat HEX = HexFormat.of();
    private static final int NAMESPACE_SHIFT = 56;
    private static final long VALUE_MASK = (1L << NAMESPACE_SHIFT) - 1;

    public static FeatureId of(FeatureNamespace namespace, long value) {
        return new FeatureId(namespace.getId(), value);
    }

    /**
     * Decodes the compact form: namespace in the top 8 bits, value in the low 56 bits.
     */
    public static FeatureId fromLong(long longId) {
        if (longId < 0) {
            throw new FeatureIdParseException(Long.toString(longId), "negative numeric feature id");
        }
        return new FeatureId((int) (longId >>> NAMESPACE_SHIFT), longId & VALUE_MASK);
    }

    public static FeatureId fromBytes(byte[] bytes) {
        if (bytes == null || bytes.length != BYTES) {
            throw new FeatureIdParseException(bytes == null ? "null" : HEX.formatHex(bytes),
                    "expected " + BYTES + " bytes");
        }
        ByteBuffer buffer = ByteBuffer.wrap(bytes);
        return new FeatureId(buffer.getInt(), buffer.getLong());
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static FeatureId fromLegacyHex(String hex) {
        if (!isLegacyHex(hex)) {
            throw new FeatureIdParseException(hex, "not a 24 character hex id");
        }
        return fromBytes(HEX.parseHex(hex));
    }

    /**
     * Parses any of the surface forms. Throws if the input is neither numeric, legacy nor
     * {@code namespace:value}; slugs cannot be resolved without the slug index.
     */
    public static FeatureId parse(String input) {
        ParsedIdentifier parsed = ParsedIdentifier.classify(input);
        if (parsed.featureId() == null) {
            throw new FeatureIdParseException(input, "not a feature id");
        }
        return parsed.featureId();
    }

    static boolean isLegacyHex(String input) {
        return input != null && LEGACY_PATTERN.matcher(input).matches();
    }

    public boolean hasLongForm() {
        return namespace >= 0 && namespace < 128 && value >= 0 && value <= VALUE_MASK;
    }

    public long toLong() {
        if (!hasLongForm()) {
            throw new IllegalStateException("feature id " + toLegacyHex() + " has no compact numeric form");
        }
        return ((long) namespace << NAMESPACE_SHIFT) | value;
    }

    public byte[] toBytes() {
        return ByteBuffer.allocate(BYTES).putInt(namespace).putLong(value).array();
    }

    @JsonValue
    public String toLegacyHex() {
        return HEX.formatHex(toBytes());
    }

    public String toHumanReadable() {
        return FeatureNamespace.fromId(namespace)
                .map(ns -> ns.getLabel() + ":" + value)
                .orElseGet(this::toLegacyHex);
    }

    @Override
    public String toString() {
        return toHumanReadable();
    }
}
