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

import com.dedicatedcode.hakemisto.exception.MissingMetadataException;
import com.dedicatedcode.hakemisto.index.IndexDescriptor;
import com.dedicatedcode.hakemisto.index.Indexes;
import com.dedicatedcode.hakemisto.index.SortedIndexReader;
import com.dedicatedcode.hakemisto.model.CellGeometry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * S2 cell id -> geometries whose covering contains the cell.
 * <p>
 * The level range and level step the index was built with are read when it is opened. The index
 * is unusable without them, so a missing value fails construction.
 */
public class ReverseGeoIndex {

    private static final Logger logger = LoggerFactory.getLogger(ReverseGeoIndex.class);
    private static final IndexDescriptor<Long, List<CellGeometry>> INDEX = Indexes.S2_INDEX;

    private final SortedIndexReader reader;
    private final S2Helper s2Helper;
    private final int minS2Level;
    private final int maxS2Level;
    private final int levelMod;

    public ReverseGeoIndex(SortedIndexReader reader, S2Helper s2Helper) {
        this.reader = reader;
        this.s2Helper = s2Helper;
        this.minS2Level = readInt(reader, Indexes.MIN_S2_LEVEL);
        this.maxS2Level = readInt(reader, Indexes.MAX_S2_LEVEL);
        this.levelMod = readInt(reader, Indexes.LEVEL_MOD);
        try {
            s2Helper.getIndexedLevels(minS2Level, maxS2Level, levelMod);
        } catch (IllegalArgumentException e) {
            throw new MissingMetadataException(reader.name(), Indexes.LEVEL_MOD,
                    String.format("%d (levels %d-%d)", levelMod, minS2Level, maxS2Level));
        }
        logger.info("Reverse geocode index covers S2 levels {}-{} with levelMod {}", minS2Level, maxS2Level, levelMod);
    }

    private static int readInt(SortedIndexReader reader, String key) {
        String value = reader.metadata(key)
                .orElseThrow(() -> new MissingMetadataException(reader.name(), key));
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new MissingMetadataException(reader.name(), key, value);
        }
    }

    public int getMinS2Level() {
        return minS2Level;
    }

    public int getMaxS2Level() {
        return maxS2Level;
    }

    public int getLevelMod() {
        return levelMod;
    }

    /**
     * Levels a point has to be looked up at, finest first.
     */
    public int[] queryLevels() {
        return s2Helper.getIndexedLevels(minS2Level, maxS2Level, levelMod);
    }

    public List<CellGeometry> cellLookup(long cellId) {
        return reader.get(INDEX.keyCodec().encode(cellId))
                .map(INDEX.valueCodec()::decode)
                .orElse(List.of());
    }

    /**
     * Looks up the point's cell at every indexed level and concatenates the results.
     * A feature may appear once per level.
     */
    public List<CellGeometry> pointLookup(double lat, double lon) {
        List<CellGeometry> result = new ArrayList<>();
        for (long cellId : s2Helper.getQueryCellIds(lat, lon, minS2Level, maxS2Level, levelMod)) {
            result.addAll(cellLookup(cellId));
        }
        logger.debug("Found {} cell geometries for lat={}, lon={}", result.size(), lat, lon);
        return result;
    }
}
