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

/**
 * Forward cursor over the entries of a {@link SortedIndexReader}.
 * {@link #key()} and {@link #value()} may only be called while {@link #isValid()} is true.
 */
public interface IndexCursor extends AutoCloseable {

    boolean isValid();

    byte[] key();

    byte[] value();

    void next();

    @Override
    void close();
}
