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
import org.rocksdb.ColumnFamilyDescriptor;
import org.rocksdb.ColumnFamilyHandle;
import org.rocksdb.DBOptions;
import org.rocksdb.Options;
import org.rocksdb.RocksDB;
import org.rocksdb.RocksDBException;
import org.rocksdb.RocksIterator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * {@link SortedIndexReader} over a RocksDB database opened read-only.
 * <p>
 * Entries live in the default column family. Build time metadata lives in the optional
 * {@value #METADATA_COLUMN_FAMILY} column family as UTF-8 key/value pairs and is read completely
 * when the index is opened.
 */
public class RocksDbIndexReader implements SortedIndexReader {

    private static final Logger logger = LoggerFactory.getLogger(RocksDbIndexReader.class);

    public static final String METADATA_COLUMN_FAMILY = "metadata";
    private static final long SLOW_LOOKUP_MILLIS = 100;

    private final String name;
    private final DBOptions dbOptions;
    private final RocksDB db;
    private final List<ColumnFamilyHandle> handles;
    private final ColumnFamilyHandle dataHandle;
    private final Map<String, String> metadata;

    private RocksDbIndexReader(String name, DBOptions dbOptions, RocksDB db, List<ColumnFamilyHandle> handles,
                               ColumnFamilyHandle dataHandle, Map<String, String> metadata) {
        this.name = name;
        this.dbOptions = dbOptions;
        this.db = db;
        this.handles = handles;
        this.dataHandle = dataHandle;
        this.metadata = metadata;
    }

    /**
     * Opens the index at {@code path}. With {@code preload} every entry is read once so the
     * block cache and the OS page cache are warm before the first query.
     */
    public static RocksDbIndexReader open(Path path, boolean preload) {
        String name = path.getFileName().toString();
        RocksDB.loadLibrary();

        long start = System.currentTimeMillis();
        DBOptions dbOptions = new DBOptions();
        List<ColumnFamilyHandle> handles = new ArrayList<>();
        RocksDB db = null;
        try {
            List<byte[]> families;
            try (Options options = new Options()) {
                families = RocksDB.listColumnFamilies(options, path.toString());
            }
            List<ColumnFamilyDescriptor> descriptors = new ArrayList<>();
            descriptors.add(new ColumnFamilyDescriptor(RocksDB.DEFAULT_COLUMN_FAMILY));
            for (byte[] family : families) {
                if (!Arrays.equals(family, RocksDB.DEFAULT_COLUMN_FAMILY)) {
                    descriptors.add(new ColumnFamilyDescriptor(family));
                }
            }

            db = RocksDB.openReadOnly(dbOptions, path.toString(), descriptors, handles);
            ColumnFamilyHandle dataHandle = handles.get(0);
            Map<String, String> metadata = Map.of();
            for (int i = 1; i < descriptors.size(); i++) {
                String family = new String(descriptors.get(i).getName(), StandardCharsets.UTF_8);
                if (METADATA_COLUMN_FAMILY.equals(family)) {
                    metadata = readMetadata(db, handles.get(i));
                }
            }

            RocksDbIndexReader reader = new RocksDbIndexReader(name, dbOptions, db, handles, dataHandle, metadata);
            logger.info("Opened index {} at {} in {} ms ({} metadata entries)",
                    name, path, System.currentTimeMillis() - start, metadata.size());
            if (preload) {
                reader.preload();
            }
            return reader;
        } catch (RocksDBException e) {
            release(handles, db, dbOptions);
            throw new IndexReadException(name, "Failed to open index at " + path, e);
        } catch (RuntimeException e) {
            release(handles, db, dbOptions);
            throw e;
        }
    }

    /**
     * Releases everything a failed {@link #open} acquired. {@code db} is null if opening the
     * database itself failed.
     */
    static void release(List<ColumnFamilyHandle> handles, RocksDB db, DBOptions dbOptions) {
        handles.forEach(ColumnFamilyHandle::close);
        handles.clear();
        if (db != null) {
            db.close();
        }
        dbOptions.close();
    }

    private static Map<String, String> readMetadata(RocksDB db, ColumnFamilyHandle handle) throws RocksDBException {
        Map<String, String> metadata = new HashMap<>();
        try (RocksIterator iterator = db.newIterator(handle)) {
            for (iterator.seekToFirst(); iterator.isValid(); iterator.next()) {
                metadata.put(new String(iterator.key(), StandardCharsets.UTF_8),
                        new String(iterator.value(), StandardCharsets.UTF_8));
            }
            iterator.status();
        }
        return Map.copyOf(metadata);
    }

    private void preload() {
        long start = System.currentTimeMillis();
        long entries = 0;
        try (IndexCursor cursor = scanFrom(new byte[0])) {
            while (cursor.isValid()) {
                cursor.value();
                entries++;
                cursor.next();
            }
        }
        logger.info("Took {} ms to read {} entries of {}", System.currentTimeMillis() - start, entries, name);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public Optional<byte[]> get(byte[] key) {
        long start = System.currentTimeMillis();
        byte[] value;
        try {
            value = db.get(dataHandle, key);
        } catch (RocksDBException e) {
            throw new IndexReadException(name, "Database error reading from " + name, e);
        }

        long duration = System.currentTimeMillis() - start;
        if (duration > SLOW_LOOKUP_MILLIS) {
            logger.info("Reading a key from index {} took {} ms, value is {} bytes long",
                    name, duration, value == null ? 0 : value.length);
        }
        return Optional.ofNullable(value);
    }

    @Override
    public IndexCursor scanFrom(byte[] key) {
        RocksIterator iterator = db.newIterator(dataHandle);
        iterator.seek(key);
        return new RocksDbCursor(iterator);
    }

    @Override
    public Optional<String> metadata(String key) {
        return Optional.ofNullable(metadata.get(key));
    }

    @Override
    public void close() {
        release(handles, db, dbOptions);
        logger.debug("Closed index {}", name);
    }

    private final class RocksDbCursor implements IndexCursor {

        private final RocksIterator iterator;

        private RocksDbCursor(RocksIterator iterator) {
            this.iterator = iterator;
        }

        @Override
        public boolean isValid() {
            if (iterator.isValid()) {
                return true;
            }
            try {
                iterator.status();
            } catch (RocksDBException e) {
                throw new IndexReadException(name, "Error scanning " + name, e);
            }
            return false;
        }

        @Override
        public byte[] key() {
            return iterator.key();
        }

        @Override
        public byte[] value() {
            return iterator.value();
        }

        @Override
        public void next() {
            iterator.next();
        }

        @Override
        public void close() {
            iterator.close();
        }
    }
}
