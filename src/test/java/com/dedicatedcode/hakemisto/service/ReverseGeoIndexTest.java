package com.dedicatedcode.hakemisto.service;

import com.dedicatedcode.hakemisto.exception.MissingMetadataException;
import com.dedicatedcode.hakemisto.index.IndexFixtures;
import com.dedicatedcode.hakemisto.index.Indexes;
import com.dedicatedcode.hakemisto.index.RocksDbIndexReader;
import com.dedicatedcode.hakemisto.model.CellGeometry;
import com.dedicatedcode.hakemisto.model.FeatureId;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ReverseGeoIndexTest {

    private static final double LAT = 52.5200;
    private static final double LON = 13.4050;

    private final S2Helper s2Helper = new S2Helper();
    private Path tempDataDir;
    private RocksDbIndexReader reader;

    @BeforeEach
    void setUp() throws Exception {
        tempDataDir = Files.createTempDirectory("hakemisto-test");
    }

    @AfterEach
    void tearDown() {
        if (reader != null) {
            reader.close();
        }
        IndexFixtures.deleteDirectory(tempDataDir.toFile());
    }

    private ReverseGeoIndex open(Map<Long, List<CellGeometry>> cells, Map<String, String> metadata) throws Exception {
        IndexFixtures.write(tempDataDir, Indexes.S2_INDEX, cells, metadata);
        reader = RocksDbIndexReader.open(Indexes.S2_INDEX.resolve(tempDataDir), false);
        return new ReverseGeoIndex(reader, s2Helper);
    }

    private static Map<String, String> levels(String min, String max, String mod) {
        return Map.of(Indexes.MIN_S2_LEVEL, min, Indexes.MAX_S2_LEVEL, max, Indexes.LEVEL_MOD, mod);
    }

    private static CellGeometry full(long value) {
        return new CellGeometry(new FeatureId(1, value), "ADMIN1", true, null);
    }

    @Test
    void testReadsLevelsFromMetadata() throws Exception {
        ReverseGeoIndex index = open(Map.of(), levels("8", "12", "2"));

        assertEquals(8, index.getMinS2Level());
        assertEquals(12, index.getMaxS2Level());
        assertEquals(2, index.getLevelMod());
        assertArrayEquals(new int[]{12, 10, 8}, index.queryLevels());
    }

    @Test
    void testMissingLevelModFailsOnOpen() throws Exception {
        Map<String, String> metadata = Map.of(Indexes.MIN_S2_LEVEL, "8", Indexes.MAX_S2_LEVEL, "12");

        MissingMetadataException e = assertThrows(MissingMetadataException.class, () -> open(Map.of(), metadata));
        assertEquals(Indexes.LEVEL_MOD, e.getInput());
        assertEquals("s2_index", e.getIndexName());
    }

    @Test
    void testNonNumericLevelFailsOnOpen() {
        assertThrows(MissingMetadataException.class, () -> open(Map.of(), levels("eight", "12", "2")));
    }

    @Test
    void testInvalidLevelRangeFailsOnOpen() {
        assertThrows(MissingMetadataException.class, () -> open(Map.of(), levels("12", "8", "1")));
    }

    @Test
    void testCellLookup() throws Exception {
        long cellId = s2Helper.getCellId(LAT, LON, 10);
        ReverseGeoIndex index = open(Map.of(cellId, List.of(full(1), full(2))), levels("8", "12", "2"));

        assertEquals(List.of(full(1).featureId(), full(2).featureId()),
                index.cellLookup(cellId).stream().map(CellGeometry::featureId).toList());
        assertEquals(List.of(), index.cellLookup(s2Helper.getCellId(-33.86, 151.2, 10)));
    }

    @Test
    void testPointLookupConcatenatesLevelsFinestFirst() throws Exception {
        Map<Long, List<CellGeometry>> cells = Map.of(
                s2Helper.getCellId(LAT, LON, 8), List.of(full(8)),
                s2Helper.getCellId(LAT, LON, 12), List.of(full(12)),
                // not an indexed level
                s2Helper.getCellId(LAT, LON, 9), List.of(full(9)));
        ReverseGeoIndex index = open(cells, levels("8", "12", "2"));

        List<FeatureId> found = index.pointLookup(LAT, LON).stream().map(CellGeometry::featureId).toList();

        assertEquals(List.of(new FeatureId(1, 12), new FeatureId(1, 8)), found);
    }
}
