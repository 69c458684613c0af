package com.dedicatedcode.hakemisto.controller;

import com.dedicatedcode.hakemisto.dto.GeoJsonGeometry;
import com.dedicatedcode.hakemisto.exception.FeatureNotFoundException;
import com.dedicatedcode.hakemisto.model.CellGeometry;
import com.dedicatedcode.hakemisto.model.FeatureId;
import com.dedicatedcode.hakemisto.model.FeatureRecord;
import com.dedicatedcode.hakemisto.service.ReverseGeocodingService;
import com.dedicatedcode.hakemisto.service.StorageService;
import com.google.common.geometry.S2CellId;
import org.locationtech.jts.geom.Geometry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * REST controller for name, id and coordinate lookups.
 */
@RestController
@RequestMapping("/api/v1")
public class LookupController {

    private static final Logger logger = LoggerFactory.getLogger(LookupController.class);

    private static final String NO_CACHE = "no-store, no-cache, must-revalidate, proxy-revalidate, max-age=0";

    private final StorageService storageService;
    private final ReverseGeocodingService reverseGeocodingService;

    public LookupController(StorageService storageService, ReverseGeocodingService reverseGeocodingService) {
        this.storageService = storageService;
        this.reverseGeocodingService = reverseGeocodingService;
    }

    /**
     * Features whose normalized name equals {@code name} exactly.
     */
    @GetMapping("/names/{name}")
    public ResponseEntity<Map<String, Object>> byName(@PathVariable String name) {
        logger.debug("Exact name lookup: {}", name);
        List<FeatureRecord> results = storageService.getByName(name);
        return results(results, Map.of("name", name));
    }

    /**
     * Features whose normalized name starts with {@code q}. Fails with 400 when the prefix
     * matches too many features.
     */
    @GetMapping("/prefix")
    public ResponseEntity<Map<String, Object>> byPrefix(@RequestParam("q") String prefix) {
        logger.debug("Prefix lookup: {}", prefix);
        if (prefix.isEmpty()) {
            return error("Invalid prefix. Must not be empty.");
        }
        List<FeatureId> ids = storageService.getIdsByNamePrefix(prefix);
        List<FeatureRecord> results = new ArrayList<>(storageService.getByFeatureIds(ids).values());
        return results(results, Map.of("q", prefix));
    }

    /**
     * Batch lookup by feature ids or slugs, keyed by the strings passed in.
     *
     * @param ids comma separated ids in any supported form, or slugs
     */
    @GetMapping("/features")
    public ResponseEntity<Map<String, Object>> byIds(@RequestParam List<String> ids) {
        logger.debug("Feature lookup for {} ids", ids.size());
        Map<String, FeatureRecord> features = storageService.getBySlugOrFeatureIds(ids);

        Map<String, Object> response = new HashMap<>();
        response.put("features", features);
        response.put("count", features.size());
        return ResponseEntity.ok()
                .header("X-Result-Count", String.valueOf(features.size()))
                .body(response);
    }

    /**
     * Reverse geocode a coordinate to the features containing it.
     *
     * @param lat Latitude in degrees
     * @param lon Longitude in degrees
     */
    @GetMapping("/reverse")
    public ResponseEntity<Map<String, Object>> reverse(@RequestParam double lat, @RequestParam double lon) {
        logger.debug("Reverse geocoding request: lat={}, lon={}", lat, lon);

        if (lat < -90 || lat > 90) {
            return error("Invalid latitude. Must be between -90 and 90.");
        }
        if (lon < -180 || lon > 180) {
            return error("Invalid longitude. Must be between -180 and 180.");
        }

        List<FeatureRecord> results = reverseGeocodingService.findFeaturesAt(lat, lon);
        return results(results, Map.of("lat", lat, "lon", lon));
    }

    /**
     * Raw S2 index entries stored for one cell.
     *
     * @param cellId S2 cell id as an unsigned decimal number
     */
    @GetMapping("/cells/{cellId}")
    public ResponseEntity<Map<String, Object>> byCell(@PathVariable String cellId) {
        long id;
        try {
            // cells on faces 4 and 5 have the top bit set
            id = Long.parseUnsignedLong(cellId);
        } catch (NumberFormatException e) {
            return error("Invalid cell id. Must be an unsigned 64 bit S2 cell id.");
        }
        List<CellGeometry> entries = storageService.getByS2CellId(id);

        Map<String, Object> response = new HashMap<>();
        response.put("cellId", Long.toUnsignedString(id));
        response.put("token", new S2CellId(id).toToken());
        response.put("entries", entries);
        response.put("count", entries.size());
        return ResponseEntity.ok()
                .header("X-Result-Count", String.valueOf(entries.size()))
                .body(response);
    }

    /**
     * Polygon of a feature as GeoJSON.
     *
     * @param id feature id in any supported form, or a slug
     */
    @GetMapping("/geometry/{id}")
    public ResponseEntity<GeoJsonGeometry> geometry(@PathVariable String id) {
        logger.debug("Geometry request for {}", id);
        FeatureId featureId = storageService.resolveIdentifier(id)
                .orElseThrow(() -> new FeatureNotFoundException(id, "No feature found for " + id));
        Geometry geometry = storageService.getPolygonByFeatureId(featureId)
                .orElseThrow(() -> new FeatureNotFoundException(id, "No geometry stored for " + featureId));
        return ResponseEntity.ok()
                .header("X-Result-Count", "1")
                .body(GeoJsonGeometry.fromJts(geometry));
    }

    /**
     * Health check endpoint.
     */
    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> indices = new LinkedHashMap<>();
        boolean reverse = storageService.hasReverseGeoIndex();
        indices.put("reverseGeocoding", reverse);
        if (reverse) {
            indices.put("minS2Level", storageService.getMinS2Level());
            indices.put("maxS2Level", storageService.getMaxS2Level());
            indices.put("levelMod", storageService.getLevelMod());
        }

        Map<String, Object> response = new HashMap<>();
        response.put("status", "ok");
        response.put("service", "hakemisto");
        response.put("indices", indices);
        return ResponseEntity.ok()
                .header("Cache-Control", NO_CACHE)
                .body(response);
    }

    private ResponseEntity<Map<String, Object>> results(List<FeatureRecord> results, Map<String, Object> query) {
        Map<String, Object> response = new HashMap<>();
        response.put("results", results);
        response.put("count", results.size());
        response.put("query", query);
        return ResponseEntity.ok()
                .header("X-Result-Count", String.valueOf(results.size()))
                .header("Cache-Control", NO_CACHE)
                .body(response);
    }

    private static ResponseEntity<Map<String, Object>> error(String message) {
        Map<String, Object> error = new HashMap<>();
        error.put("error", message);
        return ResponseEntity.badRequest().body(error);
    }
}
