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

package com.dedicatedcode.hakemisto.model;

import java.util.Optional;

/**
 * Known id namespaces. The numeric id is what gets stored in the first four bytes of a
 * {@link FeatureId}, the name is what appears in front of the colon in its human readable form.
 */
public enum FeatureNamespace {
    MAPONICS(0, "maponics"),
    GEONAMES(1, "geonameid"),
    GEONAMES_ZIP(2, "geonamezip"),
    ADMIN(3, "adminid"),
    WOEID(4, "woeid"),
    OSM(5, "osm");

    private final int id;
    private final String label;

    FeatureNamespace(int id, String label) {
        this.id = id;
        this.label = label;
    }

    public int getId() {
        return id;
    }

    public String getLabel() {
        return label;
    }

    public static Optional<FeatureNamespace> fromId(int id) {
        for (FeatureNamespace namespace : values()) {
            if (namespace.id == id) {
                return Optional.of(namespace);
            }
        }
        return Optional.empty();
    }

    public static Optional<FeatureNamespace> fromLabel(String label) {
        for (FeatureNamespace namespace : values()) {
            if (namespace.label.equals(label)) {
                return Optional.of(namespace);
            }
        }
        return Optional.empty();
    }
}
