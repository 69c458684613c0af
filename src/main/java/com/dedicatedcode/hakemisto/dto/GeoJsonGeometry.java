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

package com.dedicatedcode.hakemisto.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.LineString;
import org.locationtech.jts.geom.Polygon;

public class GeoJsonGeometry {

    @JsonProperty("type")
    private String type;

    @JsonProperty("coordinates")
    private Object coordinates;

    public GeoJsonGeometry() {}

    public GeoJsonGeometry(String type, Object coordinates) {
        this.type = type;
        this.coordinates = coordinates;
    }

    /**
     * Converts Points, Polygons and MultiPolygons. Other types come back as type "Unknown"
     * without coordinates.
     */
    public static GeoJsonGeometry fromJts(Geometry geometry) {
        String geometryType = geometry.getGeometryType();
        switch (geometryType) {
            case "Point":
                Coordinate c = geometry.getCoordinate();
                return new GeoJsonGeometry(geometryType, new double[]{c.x, c.y});
            case "Polygon":
                return new GeoJsonGeometry(geometryType, polygonCoordinates((Polygon) geometry));
            case "MultiPolygon":
                double[][][][] polygons = new double[geometry.getNumGeometries()][][][];
                for (int i = 0; i < polygons.length; i++) {
                    polygons[i] = polygonCoordinates((Polygon) geometry.getGeometryN(i));
                }
                return new GeoJsonGeometry(geometryType, polygons);
            default:
                return new GeoJsonGeometry("Unknown", null);
        }
    }

    // GeoJSON polygon: exterior ring first, then holes, each as [[x, y], ...]
    private static double[][][] polygonCoordinates(Polygon polygon) {
        double[][][] rings = new double[polygon.getNumInteriorRing() + 1][][];
        rings[0] = ringCoordinates(polygon.getExteriorRing());
        for (int i = 0; i < polygon.getNumInteriorRing(); i++) {
            rings[i + 1] = ringCoordinates(polygon.getInteriorRingN(i));
        }
        return rings;
    }

    private static double[][] ringCoordinates(LineString ring) {
        Coordinate[] coords = ring.getCoordinates();
        double[][] result = new double[coords.length][2];
        for (int i = 0; i < coords.length; i++) {
            result[i][0] = coords[i].x; // longitude
            result[i][1] = coords[i].y; // latitude
        }
        return result;
    }

    public String getType() {
        return type;
    }

    public void setType(String type) {
        this.type = type;
    }

    public Object getCoordinates() {
        return coordinates;
    }

    public void setCoordinates(Object coordinates) {
        this.coordinates = coordinates;
    }
}
