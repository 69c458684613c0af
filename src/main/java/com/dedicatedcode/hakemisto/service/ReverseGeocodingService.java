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

package com.dedicatedcode.hakemisto.service;

import com.dedicatedcode.hakemisto.index.Codecs;
import com.dedicatedcode.hakemisto.model.CellGeometry;
import com.dedicatedcode.hakemisto.model.FeatureId;
import com.dedicatedcode.hakemisto.model.FeatureRecord;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.Point;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Finds the features containing a coordinate.
 * <p>
 * Candidates come from the S2 index. A candidate matches when its cell lies completely inside
 * the feature or when the clipped shape stored with the cell contains the point. Hotfix deletes
 * are dropped and hotfix boosts decide the order.
 */
@Service
public class ReverseGeocodingService {

    private static final Logger logger = LoggerFactory.getLogger(ReverseGeocodingService.class);

    private final StorageService storageService;
    private final HotfixOverlay hotfixes;
    private final GeometryFactory geometryFactory = new GeometryFactory();

    public ReverseGeocodingService(StorageService storageService, HotfixOverlay hotfixes) {
        this.storageService = storageService;
        this.hotfixes = hotfixes;
    }

    /**
     * @param lat Latitude in degrees
     * @param lon Longitude in degrees
     * @return features containing the point, highest boost first
     */
    public List<FeatureRecord> findFeaturesAt(double lat, double lon) {
        logger.debug("Reverse geocoding lat={}, lon={}", lat, lon);
        Point point = geometryFactory.createPoint(new Coordinate(lon, lat));

        Set<FeatureId> matches = new LinkedHashSet<>();
        Set<FeatureId> rejected = new LinkedHashSet<>();
        for (CellGeometry candidate : storageService.getByPoint(lat, lon)) {
            FeatureId id = candidate.featureId();
            if (matches.contains(id) || hotfixes.isDeleted(id)) {
                continue;
            }
            if (containsPoint(candidate, point)) {
                matches.add(id);
                rejected.remove(id);
            } else {
                rejected.add(id);
            }
        }
        logger.debug("{} features contain the point, {} candidates rejected", matches.size(), rejected.size());

        Map<FeatureId, FeatureRecord> features = storageService.getByFeatureIds(matches);
        List<FeatureRecord> results = new ArrayList<>(features.values());
        results.sort(Comparator.comparingInt((FeatureRecord f) -> hotfixes.boostFor(f.id())).reversed());
        return results;
    }

    private boolean containsPoint(CellGeometry candidate, Point point) {
        if (candidate.full()) {
            return true;
        }
        byte[] wkb = candidate.wkbGeometry();
        if (wkb == null || wkb.length == 0) {
            return false;
        }
        Geometry geometry = Codecs.GEOMETRY.decode(wkb);
        return geometry.covers(point);
    }
}
