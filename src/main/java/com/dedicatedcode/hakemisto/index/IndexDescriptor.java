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

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Where an index lives below the data directory and how its keys and values are encoded.
 */
public record IndexDescriptor<K, V>(String fileName, Codec<K> keyCodec, Codec<V> valueCodec) {

    public Path resolve(Path basePath) {
        return basePath.resolve(fileName);
    }

    public boolean existsIn(Path basePath) {
        return Files.exists(resolve(basePath));
    }
}
