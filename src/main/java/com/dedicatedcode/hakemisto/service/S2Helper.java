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
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * S2 cell arithmetic shared by index lookups and coverings.
 */
@Service
public class S2Helper {

    /**
     * Returns the id of the cell at {@code level} containing the coordinate.
     */
    public long getCellId(double lat, double lon, int level) {
        // S2 takes (lat, lon), JTS coordinates are (x = lon, y = lat)
        return S2CellId.fromLatLng(S2LatLng.fromDegrees(lat, lon)).parent(level).id();
    }

    /**
     * Levels materialized in a reverse geocode index: {@code maxLevel}, then every
     * {@code levelMod}-th coarser level down to {@code minLevel}, finest first.
     */
    public int[] getIndexedLevels(int minLevel, int maxLevel, int levelMod) {
        validateLevels(minLevel, maxLevel, levelMod);
        int count = (maxLevel - minLevel) / levelMod + 1;
        int[] levels = new int[count];
        for (int i = 0; i < count; i++) {
            levels[i] = maxLevel - i * levelMod;
        }
        return levels;
    }

    /**
     * Cell ids of the coordinate at every indexed level, finest first. These are exactly the
     * cells {@link CellCoveringService#coverAtAllLevels} writes for a geometry touching the point.
     */
    public List<Long> getQueryCellIds(double lat, double lon, int minLevel, int maxLevel, int levelMod) {
        S2CellId leaf = S2CellId.fromLatLng(S2LatLng.fromDegrees(lat, lon));
        List<Long> cellIds = new ArrayList<>();
        for (int level : getIndexedLevels(minLevel, maxLevel, levelMod)) {
            cellIds.add(leaf.parent(level).id());
        }
        return cellIds;
    }

    public int getLevel(long cellId) {
        return new S2CellId(cellId).level();
    }

    static void validateLevels(int minLevel, int maxLevel, int levelMod) {
        if (minLevel < 0 || maxLevel > S2CellId.MAX_LEVEL || minLevel > maxLevel) {
            throw new IllegalArgumentException(
                    String.format("invalid level range [%d, %d]", minLevel, maxLevel));
        }
        if (levelMod < 1) {
            throw new IllegalArgumentException("levelMod must be at least 1, got " + levelMod);
        }
    }
}
