package com.dedicatedcode.hakemisto.model;

import com.dedicatedcode.hakemisto.exception.FeatureIdParseException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FeatureIdTest {

    @Test
    void testParsePlainNumber() {
        assertEquals(new FeatureId(0, 42), FeatureId.parse("42"));
    }

    @Test
    void testParseHumanReadable() {
        assertEquals(FeatureId.of(FeatureNamespace.GEONAMES, 5128581), FeatureId.parse("geonameid:5128581"));
        assertEquals(new FeatureId(5, 240109189), FeatureId.parse("osm:240109189"));
    }

    @Test
    void testParseSlugFails() {
        assertThrows(FeatureIdParseException.class, () -> FeatureId.parse("nyc-times-square"));
    }

    @Test
    void testLegacyHex() {
        FeatureId id = FeatureId.fromLegacyHex("507f1f77bcf86cd799439011");

        assertEquals(0x507f1f77, id.namespace());
        assertEquals(0xbcf86cd799439011L, id.value());
        assertEquals("507f1f77bcf86cd799439011", id.toLegacyHex());
    }

    @Test
    void testParseLegacyHexReturnsSameId() {
        // hex digits all 0-9
        for (FeatureId id : List.of(new FeatureId(1, 4194304), new FeatureId(99, 1), new FeatureId(1, 5128581))) {
            assertEquals(id, FeatureId.parse(id.toLegacyHex()));
        }
    }

    @Test
    void testLegacyHexIsCaseInsensitive() {
        assertEquals(FeatureId.fromLegacyHex("507f1f77bcf86cd799439011"),
                FeatureId.fromLegacyHex("507F1F77BCF86CD799439011"));
    }

    @Test
    void testLegacyHexRejectsWrongLength() {
        assertThrows(FeatureIdParseException.class, () -> FeatureId.fromLegacyHex("507f1f77"));
        assertThrows(FeatureIdParseException.class, () -> FeatureId.fromLegacyHex("zz7f1f77bcf86cd799439011"));
    }

    @Test
    void testLongForm() {
        FeatureId id = FeatureId.of(FeatureNamespace.GEONAMES, 5128581);

        assertTrue(id.hasLongForm());
        assertEquals((1L << 56) | 5128581L, id.toLong());
        assertEquals(id, FeatureId.fromLong(id.toLong()));
    }

    @Test
    void testNegativeLongIsRejected() {
        assertThrows(FeatureIdParseException.class, () -> FeatureId.fromLong(-1));
    }

    @Test
    void testNoLongFormForWideNamespace() {
        FeatureId id = new FeatureId(200, 1);

        assertFalse(id.hasLongForm());
        assertThrows(IllegalStateException.class, id::toLong);
    }

    @Test
    void testBytesLayout() {
        byte[] bytes = new FeatureId(1, 2).toBytes();

        assertEquals(FeatureId.BYTES, bytes.length);
        assertEquals(1, bytes[3]);
        assertEquals(2, bytes[11]);
        assertEquals(new FeatureId(1, 2), FeatureId.fromBytes(bytes));
        assertThrows(FeatureIdParseException.class, () -> FeatureId.fromBytes(new byte[8]));
    }

    @Test
    void testHumanReadable() {
        assertEquals("osm:123", new FeatureId(5, 123).toHumanReadable());
        assertEquals("geonameid:5128581", new FeatureId(1, 5128581).toString());
        // unknown namespaces fall back to the legacy form
        assertEquals("000000630000000000000001", new FeatureId(99, 1).toHumanReadable());
    }

    @Test
    void testJsonUsesLegacyHex() throws Exception {
        ObjectMapper mapper = new ObjectMapper();
        FeatureId id = new FeatureId(1, 5);

        String json = mapper.writeValueAsString(id);

        assertEquals("\"000000010000000000000005\"", json);
        assertEquals(id, mapper.readValue(json, FeatureId.class));
    }
}
