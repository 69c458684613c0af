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
 * A metadata key the index cannot be used without is absent or unreadable.
 */
public class MissingMetadataException extends StorageException {

    private final String indexName;

    public MissingMetadataException(String indexName, String key) {
        super(key, String.format("index %s is missing metadata %s", indexName, key));
        this.indexName = indexName;
    }

    public MissingMetadataException(String indexName, String key, String value) {
        super(key, String.format("index %s has invalid metadata %s=%s", indexName, key, value));
        this.indexName = indexName;
    }

    public String getIndexName() {
        return indexName;
    }
}
