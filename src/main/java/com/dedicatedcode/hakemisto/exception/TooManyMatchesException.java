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

package com.dedicatedcode.hakemisto.exception;

/**
 * A prefix matched more ids than the configured cap. No partial result is returned.
 */
public class TooManyMatchesException extends StorageException {

    private final int limit;

    public TooManyMatchesException(String prefix, int limit) {
        super(prefix, String.format("too many matches for prefix \"%s\" (limit %d)", prefix, limit));
        this.limit = limit;
    }

    public int getLimit() {
        return limit;
    }
}
