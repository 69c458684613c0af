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

import com.google.common.geometry.S2CellId;
import com.google.common.geometry.S2LatLng;
import com.google.common.geometry.S2LatLngRect;
import com.google.common.geometry.S2Polygon;
import com.google.common.geometry.S2Region;
import com.google.common.geometry.S2RegionCoverer;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.OptionalInt;
import java.util.Set;

/**
 * Turns rectangles and polygons into S2 cell coverings.
 * <p>
 * {@link #coverAtAllLevels} defines which cells a reverse geocode index holds for a geometry, and
 * {@link S2Helper#getQueryCellIds} must ask for exactly those levels. Both sides need the same
 * {@code minLevel}, {@code maxLevel} and {@code levelMod}.
 */
@Service
public class CellCoveringService {

    private static final Logger logger = LoggerFactory.getLogger(CellCoveringService.class);

    /**
     * Returns the cells covering the rectangle spanned by two corners given as {lat, lon}.
     */
    public List<S2CellId> rectCover(double[] topRight, double[] bottomLeft,
                                    int minLevel, int maxLevel, OptionalInt levelMod) {
        S2LatLng topRightPoint = S2LatLng.fromDegrees(topRight[0], topRight[1]);
        S2LatLng bottomLeftPoint = S2LatLng.fromDegrees(bottomLeft[0], bottomLeft[1]);
        S2LatLngRect rect = S2LatLngRect.fromPointPair(topRightPoint, bottomLeftPoint);
        return rectCover(rect, minLevel, maxLevel, levelMod);
    }

    public List<S2CellId> rectCover(S2LatLngRect rect, int minLevel, int maxLevel, OptionalInt levelMod) {
        return cover(rect, minLevel, maxLevel, OptionalInt.empty(), levelMod);
    }

    /**
     * Covers the bounding box of a geometry.
     */
    public List<S2CellId> boundingBoxCovering(Geometry geometry, int minLevel, int maxLevel) {
        Envelope envelope = geometry.getEnvelopeInternal();
        return rectCover(
                new double[]{envelope.getMaxY(), envelope.getMaxX()},
                new double[]{envelope.getMinY(), envelope.getMinX()},
                minLevel, maxLevel, OptionalInt.empty());
    }

    /**
     * Covers the polygons of a geometry. {@code maxCellsHint} is passed to the coverer, which
     * returns more cells whenever the level bounds require it.
     */
    public List<S2CellId> polygonCovering(Geometry geometry, int minLevel, int maxLevel,
                                          OptionalInt maxCellsHint, OptionalInt levelMod) {
        S2Polygon polygon = S2Geometry.polygonFromRings(geometry);
        return cover(polygon, minLevel, maxLevel, maxCellsHint, levelMod);
    }

    /**
     * Cells to index a geometry under. The geometry is covered at {@code maxLevel} only; each of
     * those cells is emitted together with its ancestors at every {@code levelMod}-th level down
     * to {@code minLevel}. Descendants of coarser cells are never added.
     */
    public Set<S2CellId> coverAtAllLevels(Geometry geometry, int minLevel, int maxLevel, OptionalInt levelMod) {
        int step = levelMod.orElse(1);
        S2Helper.validateLevels(minLevel, maxLevel, step);

        List<S2CellId> initialCovering = polygonCovering(geometry, maxLevel, maxLevel,
                OptionalInt.empty(), levelMod);

        // at most all parents of the initial covering, bounded by 4/3 of its size
        Set<S2CellId> allCells = new HashSet<>(Math.max(16, initialCovering.size() * 4 / 3 * 2));
        for (S2CellId cellId : initialCovering) {
            int level = cellId.level();
            allCells.add(cellId);
            for (int l = level - step; l >= minLevel; l -= step) {
                allCells.add(cellId.parent(l));
            }
        }

        logger.debug("Covered geometry with {} cells at level {}, {} cells over levels {}-{} (levelMod {})",
                initialCovering.size(), maxLevel, allCells.size(), minLevel, maxLevel, step);
        return allCells;
    }

    private List<S2CellId> cover(S2Region region, int minLevel, int maxLevel,
                                 OptionalInt maxCells, OptionalInt levelMod) {
        S2Helper.validateLevels(minLevel, maxLevel, levelMod.orElse(1));

        S2RegionCoverer.Builder builder = S2RegionCoverer.builder()
                .setMinLevel(minLevel)
                .setMaxLevel(maxLevel);
        maxCells.ifPresent(builder::setMaxCells);
        levelMod.ifPresent(builder::setLevelMod);

        ArrayList<S2CellId> covering = new ArrayList<>();
        builder.build().getCovering(region, covering);
        return covering;
    }
}
