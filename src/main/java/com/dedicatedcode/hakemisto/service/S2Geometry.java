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

import com.dedicatedcode.hakemisto.exception.GeometryException;
import com.google.common.geometry.S2LatLng;
import com.google.common.geometry.S2Polygon;
import com.google.common.geometry.S2PolygonBuilder;
import org.locationtech.jts.algorithm.Orientation;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.Polygon;

import java.util.ArrayList;
import java.util.List;

public class S2Geometry {

    private S2Geometry() {
    }

    /**
     * Converts the polygons of a JTS geometry (a Polygon, MultiPolygon or a collection holding
     * polygons) into a single S2Polygon. Only exterior rings are used; members that are not
     * polygons are skipped.
     *
     * @throws GeometryException if any vertex lies beyond a pole
     */
    public static S2Polygon polygonFromRings(Geometry geometry) {
        for (Coordinate c : geometry.getCoordinates()) {
            if (c.y > 90 || c.y < -90) {
                throw new GeometryException(geometry.toText(),
                        "Geometry trying to cross a pole, can't handle latitude " + c.y);
            }
        }

        List<S2Polygon> polygons = new ArrayList<>();
        for (int i = 0; i < geometry.getNumGeometries(); i++) {
            Geometry member = geometry.getGeometryN(i);
            if (member instanceof Polygon polygon) {
                polygons.add(ringToPolygon(polygon.getExteriorRing().getCoordinates()));
            }
        }

        S2PolygonBuilder builder = new S2PolygonBuilder();
        polygons.forEach(builder::addPolygon);
        return builder.assemblePolygon();
    }

    private static S2Polygon ringToPolygon(Coordinate[] ring) {
        // the builder works on directed edges and keeps the interior on the left
        Coordinate[] coords = Orientation.isCCW(ring) ? ring : reversed(ring);

        S2PolygonBuilder builder = new S2PolygonBuilder();
        for (int i = 0; i < coords.length; i++) {
            // JTS rings repeat the first point, the builder ignores the resulting zero length edge
            Coordinate from = coords[i];
            Coordinate to = coords[(i + 1) % coords.length];
            builder.addEdge(
                    S2LatLng.fromDegrees(from.y, from.x).toPoint(),
                    S2LatLng.fromDegrees(to.y, to.x).toPoint());
        }
        return builder.assemblePolygon();
    }

    private static Coordinate[] reversed(Coordinate[] coords) {
        Coordinate[] result = new Coordinate[coords.length];
        for (int i = 0; i < coords.length; i++) {
            result[i] = coords[coords.length - 1 - i];
        }
        return result;
    }
}
