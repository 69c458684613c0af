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

import com.dedicatedcode.hakemisto.exception.FeatureIdParseException;
import com.dedicatedcode.hakemisto.exception.MalformedHotfixLineException;
import com.dedicatedcode.hakemisto.model.FeatureId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Reads {@value #DELETES_FILE} and {@value #BOOSTS_FILE} from the data directory.
 * Both files are optional; a missing file contributes nothing.
 */
public final class HotfixLoader {

    private static final Logger logger = LoggerFactory.getLogger(HotfixLoader.class);

    public static final String DELETES_FILE = "hotfixes_deletes.txt";
    public static final String BOOSTS_FILE = "hotfixes_boosts.txt";

    private static final Pattern BOOST_SEPARATOR = Pattern.compile("[|\t, ]");

    private HotfixLoader() {
    }

    public static HotfixOverlay load(Path basePath) {
        Set<FeatureId> deletes = loadDeletes(basePath.resolve(DELETES_FILE));
        Map<FeatureId, Integer> boosts = loadBoosts(basePath.resolve(BOOSTS_FILE));
        if (!deletes.isEmpty() || !boosts.isEmpty()) {
            logger.info("Loaded hotfixes: {} deletes, {} boosts", deletes.size(), boosts.size());
        }
        return new HotfixOverlay(deletes, boosts);
    }

    static Set<FeatureId> loadDeletes(Path file) {
        Set<FeatureId> deletes = new HashSet<>();
        for (String line : readLines(file)) {
            String trimmed = line.trim();
            if (trimmed.isEmpty()) continue;
            try {
                deletes.add(FeatureId.fromLegacyHex(trimmed));
            } catch (FeatureIdParseException e) {
                throw new MalformedHotfixLineException(line, "not a legacy feature id", e);
            }
        }
        return deletes;
    }

    static Map<FeatureId, Integer> loadBoosts(Path file) {
        Map<FeatureId, Integer> boosts = new HashMap<>();
        for (String line : readLines(file)) {
            if (line.isBlank()) continue;
            Map.Entry<FeatureId, Integer> boost = parseBoostLine(line);
            boosts.put(boost.getKey(), boost.getValue());
        }
        return boosts;
    }

    /**
     * Parses {@code <legacy id><sep><boost>} where the separator is one of {@code | , \t} or a space.
     */
    static Map.Entry<FeatureId, Integer> parseBoostLine(String line) {
        String[] parts = BOOST_SEPARATOR.split(line.trim());
        if (parts.length != 2) {
            throw new MalformedHotfixLineException(line, "expected 2 fields, got " + parts.length);
        }
        try {
            return Map.entry(FeatureId.fromLegacyHex(parts[0]), Integer.parseInt(parts[1]));
        } catch (FeatureIdParseException | NumberFormatException e) {
            throw new MalformedHotfixLineException(line, e.getMessage(), e);
        }
    }

    private static List<String> readLines(Path file) {
        if (!Files.exists(file)) {
            return List.of();
        }
        try {
            return Files.readAllLines(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + file, e);
        }
    }
}
