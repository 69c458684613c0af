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

import com.dedicatedcode.hakemisto.exception.IndexReadException;
import com.dedicatedcode.hakemisto.model.CellGeometry;
import com.dedicatedcode.hakemisto.model.FeatureId;
import com.dedicatedcode.hakemisto.model.FeatureRecord;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.io.ParseException;
import org.locationtech.jts.io.WKBReader;
import org.locationtech.jts.io.WKBWriter;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * The fixed set of codecs the indices are written with.
 */
public final class Codecs {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private Codecs() {
    }

    public static final Codec<String> STRING = new Codec<>() {
        @Override
        public byte[] encode(String value) {
            return value.getBytes(StandardCharsets.UTF_8);
        }

        @Override
        public String decode(byte[] bytes) {
            return new String(bytes, StandardCharsets.UTF_8);
        }
    };

    /**
     * S2 cell ids as 8 byte big endian values, so bytewise key order equals unsigned cell id order.
     */
    public static final Codec<Long> CELL_ID = new Codec<>() {
        @Override
        public byte[] encode(Long value) {
            return ByteBuffer.allocate(Long.BYTES).putLong(value).array();
        }

        @Override
        public Long decode(byte[] bytes) {
            if (bytes == null || bytes.length != Long.BYTES) {
                throw new IndexReadException("cell-id", "expected " + Long.BYTES + " bytes for a cell id", null);
            }
            return ByteBuffer.wrap(bytes).getLong();
        }
    };

    public static final Codec<FeatureId> FEATURE_ID = new Codec<>() {
        @Override
        public byte[] encode(FeatureId value) {
            return value.toBytes();
        }

        @Override
        public FeatureId decode(byte[] bytes) {
            return FeatureId.fromBytes(bytes);
        }
    };

    /**
     * Concatenated 12 byte feature ids.
     */
    public static final Codec<List<FeatureId>> FEATURE_ID_LIST = new Codec<>() {
        @Override
        public byte[] encode(List<FeatureId> value) {
            ByteBuffer buffer = ByteBuffer.allocate(value.size() * FeatureId.BYTES);
            for (FeatureId id : value) {
                buffer.putInt(id.namespace()).putLong(id.value());
            }
            return buffer.array();
        }

        @Override
        public List<FeatureId> decode(byte[] bytes) {
            if (bytes == null) return List.of();
            if (bytes.length % FeatureId.BYTES != 0) {
                throw new IndexReadException("feature-id-list",
                        "length " + bytes.length + " is not a multiple of " + FeatureId.BYTES, null);
            }
            ByteBuffer buffer = ByteBuffer.wrap(bytes);
            List<FeatureId> ids = new ArrayList<>(bytes.length / FeatureId.BYTES);
            while (buffer.hasRemaining()) {
                ids.add(new FeatureId(buffer.getInt(), buffer.getLong()));
            }
            return ids;
        }
    };

    public static final Codec<FeatureRecord> FEATURE_RECORD = json(new TypeReference<FeatureRecord>() {});

    public static final Codec<List<CellGeometry>> CELL_GEOMETRIES = json(new TypeReference<List<CellGeometry>>() {});

    /**
     * JTS geometries as WKB.
     */
    public static final Codec<Geometry> GEOMETRY = new Codec<>() {
        @Override
        public byte[] encode(Geometry value) {
            return new WKBWriter().write(value);
        }

        @Override
        public Geometry decode(byte[] bytes) {
            try {
                // WKBReader keeps state, one per call
                return new WKBReader().read(bytes);
            } catch (ParseException e) {
                throw new IndexReadException("geometry", "invalid WKB geometry", e);
            }
        }
    };

    private static <T> Codec<T> json(TypeReference<T> type) {
        return new Codec<>() {
            @Override
            public byte[] encode(T value) {
                try {
                    return MAPPER.writeValueAsBytes(value);
                } catch (JsonProcessingException e) {
                    throw new IllegalArgumentException("cannot serialize " + value, e);
                }
            }

            @Override
            public T decode(byte[] bytes) {
                try {
                    return MAPPER.readValue(bytes, type);
                } catch (IOException e) {
                    throw new IndexReadException("json", "cannot decode " + type.getType().getTypeName(), e);
                }
            }
        };
    }
}
