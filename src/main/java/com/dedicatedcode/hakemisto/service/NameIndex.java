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

import com.dedicatedcode.hakemisto.exception.TooManyMatchesException;
import com.dedicatedcode.hakemisto.index.IndexCursor;
import com.dedicatedcode.hakemisto.index.IndexDescriptor;
import com.dedicatedcode.hakemisto.index.Indexes;
import com.dedicatedcode.hakemisto.index.SortedIndexReader;
import com.dedicatedcode.hakemisto.model.FeatureId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Exact and prefix lookups of normalized names.
 */
public class NameIndex {

    private static final Logger logger = LoggerFactory.getLogger(NameIndex.class);
    private static final IndexDescriptor<String, List<FeatureId>> INDEX = Indexes.NAME_INDEX;

    private final SortedIndexReader reader;
    private final PrefixIndex prefixIndex;
    private final PrefixMatchPolicy policy;

    /**
     * @param prefixIndex precomputed prefix table, or null to always scan the name index
     */
    public NameIndex(SortedIndexReader reader, PrefixIndex prefixIndex, PrefixMatchPolicy policy) {
        this.reader = reader;
        this.prefixIndex = prefixIndex;
        this.policy = policy;
    }

    public List<FeatureId> exactLookup(String name) {
        return reader.get(INDEX.keyCodec().encode(name))
                .map(INDEX.valueCodec()::decode)
                .orElse(List.of());
    }

    /**
     * Ids of all names starting with {@code name}, in key order.
     *
     * @throws TooManyMatchesException if more than {@link PrefixMatchPolicy#maxResults()} ids match
     */
    public List<FeatureId> prefixLookup(String name) {
        List<FeatureId> result;
        if (prefixIndex != null && name.length() <= prefixIndex.getMaxPrefixLength()) {
            result = prefixIndex.get(name);
            if (result.size() > policy.maxResults()) {
                throw new TooManyMatchesException(name, policy.maxResults());
            }
        } else {
            result = scanPrefix(name);
        }
        logger.debug("Prefix lookup for '{}' returned {} ids", name, result.size());
        return result;
    }

    private List<FeatureId> scanPrefix(String name) {
        List<FeatureId> result = new ArrayList<>();
        try (IndexCursor cursor = reader.scanFrom(INDEX.keyCodec().encode(name))) {
            if (cursor.isValid() && !keyOf(cursor).startsWith(name)) {
                cursor.next();
            }

            while (cursor.isValid()) {
                String key = keyOf(cursor);
                if (!key.startsWith(name)) {
                    break;
                }
                if (policy.accepts(name, key)) {
                    result.addAll(INDEX.valueCodec().decode(cursor.value()));
                    if (result.size() > policy.maxResults()) {
                        throw new TooManyMatchesException(name, policy.maxResults());
                    }
                }
                cursor.next();
            }
        }
        return result;
    }

    private static String keyOf(IndexCursor cursor) {
        return INDEX.keyCodec().decode(cursor.key());
    }
}
