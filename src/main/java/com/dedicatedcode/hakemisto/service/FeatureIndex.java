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

import com.dedicatedcode.hakemisto.index.IndexDescriptor;
import com.dedicatedcode.hakemisto.index.Indexes;
import com.dedicatedcode.hakemisto.index.SortedIndexReader;
import com.dedicatedcode.hakemisto.model.FeatureId;
import com.dedicatedcode.hakemisto.model.FeatureRecord;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Feature id -> serving record.
 */
public class FeatureIndex {

    private static final IndexDescriptor<FeatureId, FeatureRecord> INDEX = Indexes.FEATURE_INDEX;

    private final SortedIndexReader reader;

    public FeatureIndex(SortedIndexReader reader) {
        this.reader = reader;
    }

    public Optional<FeatureRecord> get(FeatureId id) {
        return reader.get(INDEX.keyCodec().encode(id)).map(INDEX.valueCodec()::decode);
    }

    /**
     * Looks up every id; ids without a record are left out of the result.
     */
    public Map<FeatureId, FeatureRecord> getByFeatureIds(Collection<FeatureId> ids) {
        Map<FeatureId, FeatureRecord> result = new LinkedHashMap<>();
        for (FeatureId id : ids) {
            get(id).ifPresent(feature -> result.put(id, feature));
        }
        return result;
    }
}
