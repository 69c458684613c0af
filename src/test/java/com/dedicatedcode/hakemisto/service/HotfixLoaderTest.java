package com.dedicatedcode.hakemisto.service;

import com.dedicatedcode.hakemisto.exception.MalformedHotfixLineException;
import com.dedicatedcode.hakemisto.index.IndexFixtures;
import com.dedicatedcode.hakemisto.model.FeatureId;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class HotfixLoaderTest {

    private static final FeatureId NYC = FeatureId.fromLegacyHex("507f1f77bcf86cd799439011");
    private static final FeatureId BERLIN = FeatureId.fromLegacyHex("000000010000000000003c3f");

    private Path tempDataDir;

    @BeforeEach
    void setUp() throws Exception {
        tempDataDir = Files.createTempDirectory("hakemisto-test");
    }

    @AfterEach
    void tearDown() {
        IndexFixtures.deleteDirectory(tempDataDir.toFile());
    }

    private void write(String fileName, String content) throws Exception {
        Files.writeString(tempDataDir.resolve(fileName), content, StandardCharsets.UTF_8);
    }

    @Test
    void testParseBoostLine() {
        Map.Entry<FeatureId, Integer> boost = HotfixLoader.parseBoostLine("507f1f77bcf86cd799439011|5");

        assertEquals(NYC, boost.getKey());
        assertEquals(5, boost.getValue());
    }

    @Test
    void testBoostSeparators() {
        assertEquals(-3, HotfixLoader.parseBoostLine("507f1f77bcf86cd799439011,-3").getValue());
        assertEquals(7, HotfixLoader.parseBoostLine("507f1f77bcf86cd799439011\t7").getValue());
        assertEquals(8, HotfixLoader.parseBoostLine("507f1f77bcf86cd799439011 8").getValue());
        assertEquals(9, HotfixLoader.parseBoostLine("  507f1f77bcf86cd799439011|9  ").getValue());
    }

    @Test
    void testSingleTokenIsMalformed() {
        MalformedHotfixLineException e = assertThrows(MalformedHotfixLineException.class,
                () -> HotfixLoader.parseBoostLine("justoneToken"));
        assertEquals("justoneToken", e.getInput());
    }

    @Test
    void testMalformedBoosts() {
        assertThrows(MalformedHotfixLineException.class,
                () -> HotfixLoader.parseBoostLine("507f1f77bcf86cd799439011|5|6"));
        assertThrows(MalformedHotfixLineException.class,
                () -> HotfixLoader.parseBoostLine("507f1f77bcf86cd799439011|lots"));
        assertThrows(MalformedHotfixLineException.class,
                () -> HotfixLoader.parseBoostLine("nyc-times-square|5"));
    }

    @Test
    void testLoadBoostsFile() throws Exception {
        write(HotfixLoader.BOOSTS_FILE, "507f1f77bcf86cd799439011|5\n\n000000010000000000003c3f,2\n");

        Map<FeatureId, Integer> boosts = HotfixLoader.loadBoosts(tempDataDir.resolve(HotfixLoader.BOOSTS_FILE));

        assertEquals(Map.of(NYC, 5, BERLIN, 2), boosts);
    }

    @Test
    void testLoadDeletesFile() throws Exception {
        write(HotfixLoader.DELETES_FILE, "507f1f77bcf86cd799439011\n\n  000000010000000000003c3f  \n");

        Set<FeatureId> deletes = HotfixLoader.loadDeletes(tempDataDir.resolve(HotfixLoader.DELETES_FILE));

        assertEquals(Set.of(NYC, BERLIN), deletes);
    }

    @Test
    void testMalformedDeleteLine() throws Exception {
        write(HotfixLoader.DELETES_FILE, "507f1f77bcf86cd799439011\nberlin\n");

        assertThrows(MalformedHotfixLineException.class,
                () -> HotfixLoader.loadDeletes(tempDataDir.resolve(HotfixLoader.DELETES_FILE)));
    }

    @Test
    void testMissingFilesYieldEmptyOverlay() {
        assertTrue(HotfixLoader.loadBoosts(tempDataDir.resolve(HotfixLoader.BOOSTS_FILE)).isEmpty());

        HotfixOverlay overlay = HotfixLoader.load(tempDataDir);

        assertTrue(overlay.isEmpty());
        assertEquals(0, overlay.boostFor(NYC));
        assertFalse(overlay.isDeleted(NYC));
    }

    @Test
    void testLoadOverlay() throws Exception {
        write(HotfixLoader.DELETES_FILE, "000000010000000000003c3f\n");
        write(HotfixLoader.BOOSTS_FILE, "507f1f77bcf86cd799439011|5\n");

        HotfixOverlay overlay = HotfixLoader.load(tempDataDir);

        assertTrue(overlay.isDeleted(BERLIN));
        assertFalse(overlay.isDeleted(NYC));
        assertEquals(5, overlay.boostFor(NYC));
        assertEquals(0, overlay.boostFor(BERLIN));
        assertThrows(UnsupportedOperationException.class, () -> overlay.deletes().add(NYC));
    }
}
