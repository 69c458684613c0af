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
import com.dedicatedcode.hakemisto.model.FeatureId;

import java.util.List;

/**
 * Precomputed prefix -> ids table covering prefixes up to {@code MAX_PREFIX_LENGTH} characters.
 */
public class PrefixIndex {

    private static final IndexDescriptor<String, List<FeatureId>> INDEX = Indexes.PREFIX_INDEX;

    private final SortedIndexReader reader;
    private final int maxPrefixLength;

    public PrefixIndex(SortedIndexReader reader) {
        this.reader = reader;
        String value = reader.metadata(Indexes.MAX_PREFIX_LENGTH)
                .orElseThrow(() -> new MissingMetadataException(reader.name(), Indexes.MAX_PREFIX_LENGTH));
        try {
            this.maxPrefixLength = Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new MissingMetadataException(reader.name(), Indexes.MAX_PREFIX_LENGTH, value);
        }
    }

    public int getMaxPrefixLength() {
        return maxPrefixLength;
    }

    public List<FeatureId> get(String prefix) {
        return reader.get(INDEX.keyCodec().encode(prefix))
                .map(INDEX.valueCodec()::decode)
                .orElse(List.of());
    }
}
