package com.dedicatedcode.hakemisto.service;

import com.dedicatedcode.hakemisto.exception.IndexNotBuiltException;
import com.dedicatedcode.hakemisto.index.IndexFixtures;
import com.dedicatedcode.hakemisto.index.Indexes;
import com.dedicatedcode.hakemisto.model.FeatureId;
import com.dedicatedcode.hakemisto.model.FeatureRecord;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.Polygon;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs against a small data directory written into a temp folder.
 */
class StorageServiceTest {

    private static final FeatureId TIMES_SQUARE = new FeatureId(0, 42);
    private static final FeatureId NEW_YORK = new FeatureId(1, 5128581);

    private Path tempDataDir;
    private StorageService storageService;

    @BeforeEach
    void setUp() throws Exception {
        tempDataDir = Files.createTempDirectory("hakemisto-test");
        IndexFixtures.write(tempDataDir, Indexes.NAME_INDEX, Map.of(
                "new york", List.of(NEW_YORK),
                "times square", List.of(TIMES_SQUARE)));
        IndexFixtures.write(tempDataDir, Indexes.FEATURE_INDEX, Map.of(
                NEW_YORK, record(NEW_YORK, "New York", "CITY"),
                TIMES_SQUARE, record(TIMES_SQUARE, "Times Square", "NEIGHBORHOOD")));
    }

    @AfterEach
    void tearDown() {
        if (storageService != null) {
            storageService.close();
        }
        IndexFixtures.deleteDirectory(tempDataDir.toFile());
    }

    private static FeatureRecord record(FeatureId id, String name, String type) {
        return new FeatureRecord(id, name, type, 40.75, -73.98, Map.of("en", name), 0);
    }

    private StorageService open() {
        storageService = new StorageService(tempDataDir, false, PrefixMatchPolicy.DEFAULT, new S2Helper());
        return storageService;
    }

    @Test
    void testNameLookups() {
        StorageService storage = open();

        assertEquals(List.of(NEW_YORK), storage.getIdsByName("new york"));
        assertEquals(List.of(TIMES_SQUARE), storage.getIdsByNamePrefix("times"));
        assertEquals(List.of(), storage.getIdsByName("boston"));

        List<FeatureRecord> features = storage.getByName("new york");
        assertEquals(1, features.size());
        assertEquals("New York", features.get(0).name());
    }

    @Test
    void testGetByFeatureIdsSkipsMissing() {
        Map<FeatureId, FeatureRecord> features = open().getByFeatureIds(List.of(NEW_YORK, new FeatureId(1, 1)));

        assertEquals(1, features.size());
        assertEquals("CITY", features.get(NEW_YORK).featureType());
    }

    @Test
    void testSlugAndIdResolveToSameFeature() throws Exception {
        IndexFixtures.write(tempDataDir, Indexes.ID_MAPPING_INDEX, Map.of("nyc-times-square", TIMES_SQUARE));
        StorageService storage = open();

        Map<String, FeatureRecord> result = storage.getBySlugOrFeatureIds(List.of("nyc-times-square", "42"));

        assertEquals(2, result.size());
        assertSame(result.get("nyc-times-square"), result.get("42"));
        assertEquals(TIMES_SQUARE, result.get("42").id());
    }

    @Test
    void testResolveIdentifier() throws Exception {
        IndexFixtures.write(tempDataDir, Indexes.ID_MAPPING_INDEX, Map.of("nyc-times-square", TIMES_SQUARE));
        StorageService storage = open();

        assertEquals(Optional.of(NEW_YORK), storage.resolveIdentifier("geonameid:5128581"));
        assertEquals(Optional.of(NEW_YORK), storage.resolveIdentifier(NEW_YORK.toLegacyHex()));
        assertEquals(Optional.of(TIMES_SQUARE), storage.resolveIdentifier(" nyc-times-square "));
        assertEquals(Optional.empty(), storage.resolveIdentifier("unknown-slug"));
        assertEquals(Optional.empty(), storage.resolveIdentifier(""));
    }

    @Test
    void testColonInputsNeverUseSlugTable() throws Exception {
        IndexFixtures.write(tempDataDir, Indexes.ID_MAPPING_INDEX, Map.of("foo:123", TIMES_SQUARE));
        StorageService storage = open();

        assertEquals(Optional.empty(), storage.resolveIdentifier("foo:123"));
        assertTrue(storage.getBySlugOrFeatureIds(List.of("foo:123")).isEmpty());
    }

    @Test
    void testLegacyIdFromResponseResolvesToSameFeature() {
        StorageService storage = open();

        Map<String, FeatureRecord> result = storage.getBySlugOrFeatureIds(List.of(NEW_YORK.toLegacyHex()));

        assertEquals(NEW_YORK, result.get(NEW_YORK.toLegacyHex()).id());
    }

    @Test
    void testSlugsWithoutIdMapping() {
        StorageService storage = open();

        assertEquals(Optional.empty(), storage.resolveIdentifier("nyc-times-square"));
        Map<String, FeatureRecord> result = storage.getBySlugOrFeatureIds(List.of("nyc-times-square", "42"));
        assertEquals(List.of("42"), List.copyOf(result.keySet()));
    }

    @Test
    void testMissingRequiredIndex() {
        IndexFixtures.deleteDirectory(Indexes.FEATURE_INDEX.resolve(tempDataDir).toFile());

        IndexNotBuiltException e = assertThrows(IndexNotBuiltException.class, this::open);
        assertEquals("features", e.getInput());
    }

    @Test
    void testReverseGeocodingWithoutS2Index() {
        StorageService storage = open();

        assertFalse(storage.hasReverseGeoIndex());
        assertThrows(IndexNotBuiltException.class, () -> storage.getByPoint(40.75, -73.98));
        assertThrows(IndexNotBuiltException.class, () -> storage.getByS2CellId(1L));
        assertThrows(IndexNotBuiltException.class, storage::getMinS2Level);
    }

    @Test
    void testGeometriesWithoutGeometryIndex() {
        StorageService storage = open();

        assertTrue(storage.getPolygonByFeatureId(NEW_YORK).isEmpty());
        assertTrue(storage.getPolygonByFeatureIds(List.of(NEW_YORK)).isEmpty());
    }

    @Test
    void testGeometries() throws Exception {
        Polygon square = new GeometryFactory().createPolygon(new Coordinate[]{
                new Coordinate(-74.02, 40.70), new Coordinate(-73.93, 40.70), new Coordinate(-73.93, 40.80),
                new Coordinate(-74.02, 40.80), new Coordinate(-74.02, 40.70)});
        IndexFixtures.write(tempDataDir, Indexes.GEOMETRY_INDEX, Map.of(NEW_YORK, square));
        StorageService storage = open();

        Geometry geometry = storage.getPolygonByFeatureId(NEW_YORK).orElseThrow();
        assertTrue(square.equalsExact(geometry));

        Map<FeatureId, Geometry> geometries = storage.getPolygonByFeatureIds(List.of(NEW_YORK, TIMES_SQUARE));
        assertEquals(1, geometries.size());
        assertTrue(geometries.containsKey(NEW_YORK));
    }

    @Test
    void testHotfixesAreLoadedButNotApplied() throws Exception {
        Files.writeString(tempDataDir.resolve("hotfixes_deletes.txt"), NEW_YORK.toLegacyHex() + "\n");
        StorageService storage = open();

        assertTrue(storage.hotfixes().isDeleted(NEW_YORK));
        assertEquals(List.of(NEW_YORK), storage.getIdsByName("new york"));
    }
}
