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

import java.util.Optional;

/**
 * Read access to an immutable index whose keys are sorted bytewise.
 * Implementations must be safe for concurrent reads.
 */
public interface SortedIndexReader extends AutoCloseable {

    /**
     * Name of the index, used in log and error messages.
     */
    String name();

    Optional<byte[]> get(byte[] key);

    /**
     * Opens a cursor positioned at the first key greater than or equal to {@code key}.
     * The caller closes it.
     */
    IndexCursor scanFrom(byte[] key);

    /**
     * Key/value metadata written when the index was built.
     */
    Optional<String> metadata(String key);

    @Override
    void close();
}
