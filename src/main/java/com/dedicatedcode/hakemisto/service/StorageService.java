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

import com.dedicatedcode.hakemisto.exception.IndexNotBuiltException;
import com.dedicatedcode.hakemisto.index.IndexDescriptor;
import com.dedicatedcode.hakemisto.index.Indexes;
import com.dedicatedcode.hakemisto.index.RocksDbIndexReader;
import com.dedicatedcode.hakemisto.index.SortedIndexReader;
import com.dedicatedcode.hakemisto.model.CellGeometry;
import com.dedicatedcode.hakemisto.model.FeatureId;
import com.dedicatedcode.hakemisto.model.FeatureRecord;
import com.dedicatedcode.hakemisto.model.ParsedIdentifier;
import org.locationtech.jts.geom.Geometry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Query facade over all indices of one data snapshot.
 * <p>
 * Everything is opened in the constructor and is read-only afterwards, so all methods may be
 * called concurrently. Optional indices that are absent simply disable the features that need
 * them; the reverse geocode operations throw {@link IndexNotBuiltException} in that case.
 */
public class StorageService implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(StorageService.class);

    private final Path basePath;
    private final List<SortedIndexReader> readers = new ArrayList<>();

    private final NameIndex nameIndex;
    private final FeatureIndex featureIndex;
    private final GeometryIndex geometryIndex;
    private final ReverseGeoIndex reverseGeoIndex;
    private final SlugIndex slugIndex;
    private final HotfixOverlay hotfixes;

    public StorageService(Path basePath, boolean preload, PrefixMatchPolicy prefixMatchPolicy, S2Helper s2Helper) {
        // resolve symlinks once so a swapped link does not change the data under us
        this.basePath = toRealPath(basePath);
        logger.info("Opening indices in {} (preload={})", this.basePath, preload);

        try {
            SortedIndexReader names = openRequired(Indexes.NAME_INDEX, preload);
            PrefixIndex prefixIndex = openOptional(Indexes.PREFIX_INDEX, preload)
                    .map(PrefixIndex::new)
                    .orElse(null);
            this.nameIndex = new NameIndex(names, prefixIndex, prefixMatchPolicy);
            this.featureIndex = new FeatureIndex(openRequired(Indexes.FEATURE_INDEX, preload));
            this.geometryIndex = openOptional(Indexes.GEOMETRY_INDEX, preload)
                    .map(GeometryIndex::new)
                    .orElse(null);
            this.reverseGeoIndex = openOptional(Indexes.S2_INDEX, preload)
                    .map(reader -> new ReverseGeoIndex(reader, s2Helper))
                    .orElse(null);
            this.slugIndex = openOptional(Indexes.ID_MAPPING_INDEX, preload)
                    .map(SlugIndex::new)
                    .orElse(null);
            this.hotfixes = HotfixLoader.load(this.basePath);
        } catch (RuntimeException e) {
            close();
            throw e;
        }

        logger.info("Storage ready: prefix index {}, geometry {}, s2 index {}, slugs {}",
                present(Indexes.PREFIX_INDEX), geometryIndex != null, reverseGeoIndex != null, slugIndex != null);
    }

    private static Path toRealPath(Path path) {
        try {
            return path.toRealPath();
        } catch (IOException e) {
            throw new UncheckedIOException("Data directory not accessible: " + path, e);
        }
    }

    private SortedIndexReader openRequired(IndexDescriptor<?, ?> descriptor, boolean preload) {
        if (!descriptor.existsIn(basePath)) {
            throw new IndexNotBuiltException(descriptor.fileName(),
                    "required index " + descriptor.fileName() + " not found in " + basePath);
        }
        return open(descriptor, preload);
    }

    private Optional<SortedIndexReader> openOptional(IndexDescriptor<?, ?> descriptor, boolean preload) {
        if (!descriptor.existsIn(basePath)) {
            logger.info("Optional index {} not found in {}", descriptor.fileName(), basePath);
            return Optional.empty();
        }
        return Optional.of(open(descriptor, preload));
    }

    private SortedIndexReader open(IndexDescriptor<?, ?> descriptor, boolean preload) {
        SortedIndexReader reader = RocksDbIndexReader.open(descriptor.resolve(basePath), preload);
        readers.add(reader);
        return reader;
    }

    private boolean present(IndexDescriptor<?, ?> descriptor) {
        return descriptor.existsIn(basePath);
    }

    public Path getBasePath() {
        return basePath;
    }

    // --- NAMES ---

    public List<FeatureId> getIdsByName(String name) {
        return nameIndex.exactLookup(name);
    }

    public List<FeatureId> getIdsByNamePrefix(String name) {
        return nameIndex.prefixLookup(name);
    }

    public List<FeatureRecord> getByName(String name) {
        return new ArrayList<>(getByFeatureIds(nameIndex.exactLookup(name)).values());
    }

    // --- FEATURES ---

    public Map<FeatureId, FeatureRecord> getByFeatureIds(Collection<FeatureId> ids) {
        return featureIndex.getByFeatureIds(ids);
    }

    /**
     * Resolves a numeric, legacy or {@code namespace:value} id directly and anything else through
     * the slug index.
     */
    public Optional<FeatureId> resolveIdentifier(String input) {
        ParsedIdentifier parsed = ParsedIdentifier.classify(input);
        switch (parsed.kind()) {
            case NUMERIC:
            case LEGACY:
            case HUMAN_READABLE:
                return Optional.of(parsed.featureId());
            case SLUG:
                return slugIndex == null ? Optional.empty() : slugIndex.get(input.trim());
            default:
                return Optional.empty();
        }
    }

    /**
     * Looks up features by id or slug and keys the result by the strings that were passed in.
     * Inputs that resolve to nothing, or to an id without a record, are left out.
     */
    public Map<String, FeatureRecord> getBySlugOrFeatureIds(Collection<String> inputs) {
        Map<FeatureId, List<String>> inputsById = new LinkedHashMap<>();
        for (String input : inputs) {
            resolveIdentifier(input).ifPresent(id ->
                    inputsById.computeIfAbsent(id, k -> new ArrayList<>()).add(input));
        }

        Map<String, FeatureRecord> result = new LinkedHashMap<>();
        getByFeatureIds(inputsById.keySet()).forEach((id, feature) ->
                inputsById.get(id).forEach(input -> result.put(input, feature)));
        return result;
    }

    // --- GEOMETRIES ---

    public Optional<Geometry> getPolygonByFeatureId(FeatureId id) {
        if (geometryIndex == null) {
            return Optional.empty();
        }
        return geometryIndex.get(id);
    }

    public Map<FeatureId, Geometry> getPolygonByFeatureIds(Collection<FeatureId> ids) {
        if (geometryIndex == null) {
            return Map.of();
        }
        return geometryIndex.getByFeatureIds(ids);
    }

    // --- REVERSE GEOCODING ---

    private ReverseGeoIndex reverseGeoIndex() {
        if (reverseGeoIndex == null) {
            throw new IndexNotBuiltException(Indexes.S2_INDEX.fileName(),
                    "s2/revgeo index not built, please build " + Indexes.S2_INDEX.fileName());
        }
        return reverseGeoIndex;
    }

    public boolean hasReverseGeoIndex() {
        return reverseGeoIndex != null;
    }

    public List<CellGeometry> getByS2CellId(long cellId) {
        return reverseGeoIndex().cellLookup(cellId);
    }

    public List<CellGeometry> getByPoint(double lat, double lon) {
        return reverseGeoIndex().pointLookup(lat, lon);
    }

    public int getMinS2Level() {
        return reverseGeoIndex().getMinS2Level();
    }

    public int getMaxS2Level() {
        return reverseGeoIndex().getMaxS2Level();
    }

    public int getLevelMod() {
        return reverseGeoIndex().getLevelMod();
    }

    // --- HOTFIXES ---

    public HotfixOverlay hotfixes() {
        return hotfixes;
    }

    @Override
    public void close() {
        for (SortedIndexReader reader : readers) {
            reader.close();
        }
        readers.clear();
    }
}
