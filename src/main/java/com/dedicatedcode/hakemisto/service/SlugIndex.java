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

import java.util.Optional;

/**
 * Human readable slug, e.g. "nyc-times-square" -> feature id.
 */
public class SlugIndex {

    private static final IndexDescriptor<String, FeatureId> INDEX = Indexes.ID_MAPPING_INDEX;

    private final SortedIndexReader reader;

    public SlugIndex(SortedIndexReader reader) {
        this.reader = reader;
    }

    public Optional<FeatureId> get(String slug) {
        return reader.get(INDEX.keyCodec().encode(slug)).map(INDEX.valueCodec()::decode);
    }
}
