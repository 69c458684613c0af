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

package com.dedicatedcode.hakemisto.index;

import com.dedicatedcode.hakemisto.model.CellGeometry;
import com.dedicatedcode.hakemisto.model.FeatureId;
import com.dedicatedcode.hakemisto.model.FeatureRecord;
import org.locationtech.jts.geom.Geometry;

import java.util.List;

public final class Indexes {

    private Indexes() {
    }

    public static final IndexDescriptor<String, List<FeatureId>> NAME_INDEX =
            new IndexDescriptor<>("name_index", Codecs.STRING, Codecs.FEATURE_ID_LIST);

    public static final IndexDescriptor<String, List<FeatureId>> PREFIX_INDEX =
            new IndexDescriptor<>("prefix_index", Codecs.STRING, Codecs.FEATURE_ID_LIST);

    public static final IndexDescriptor<FeatureId, FeatureRecord> FEATURE_INDEX =
            new IndexDescriptor<>("features", Codecs.FEATURE_ID, Codecs.FEATURE_RECORD);

    public static final IndexDescriptor<FeatureId, Geometry> GEOMETRY_INDEX =
            new IndexDescriptor<>("geometry", Codecs.FEATURE_ID, Codecs.GEOMETRY);

    public static final IndexDescriptor<Long, List<CellGeometry>> S2_INDEX =
            new IndexDescriptor<>("s2_index", Codecs.CELL_ID, Codecs.CELL_GEOMETRIES);

    public static final IndexDescriptor<String, FeatureId> ID_MAPPING_INDEX =
            new IndexDescriptor<>("id-mapping", Codecs.STRING, Codecs.FEATURE_ID);

    // metadata keys
    public static final String MAX_PREFIX_LENGTH = "MAX_PREFIX_LENGTH";
    public static final String MIN_S2_LEVEL = "minS2Level";
    public static final String MAX_S2_LEVEL = "maxS2Level";
    public static final String LEVEL_MOD = "levelMod";
}
