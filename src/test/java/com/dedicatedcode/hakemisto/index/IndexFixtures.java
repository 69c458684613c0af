package com.dedicatedcode.hakemisto.index;

import org.rocksdb.ColumnFamilyDescriptor;
import org.rocksdb.ColumnFamilyHandle;
import org.rocksdb.DBOptions;
import org.rocksdb.RocksDB;
import org.rocksdb.RocksDBException;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Writes small indices the same way the index builder lays them out: entries in the default
 * column family, metadata in the "metadata" column family.
 */
public final class IndexFixtures {

    private IndexFixtures() {
    }

    public static <K, V> Path write(Path dataDir, IndexDescriptor<K, V> descriptor, Map<K, V> entries) throws RocksDBException {
        return write(dataDir, descriptor, entries, Map.of());
    }

    public static <K, V> Path write(Path dataDir, IndexDescriptor<K, V> descriptor, Map<K, V> entries,
                                    Map<String, String> metadata) throws RocksDBException {
        RocksDB.loadLibrary();
        Path path = descriptor.resolve(dataDir);

        List<ColumnFamilyDescriptor> descriptors = List.of(
                new ColumnFamilyDescriptor(RocksDB.DEFAULT_COLUMN_FAMILY),
                new ColumnFamilyDescriptor(RocksDbIndexReader.METADATA_COLUMN_FAMILY.getBytes(StandardCharsets.UTF_8)));
        List<ColumnFamilyHandle> handles = new ArrayList<>();

        try (DBOptions options = new DBOptions().setCreateIfMissing(true).setCreateMissingColumnFamilies(true);
             RocksDB db = RocksDB.open(options, path.toString(), descriptors, handles)) {
            try {
                for (Map.Entry<K, V> entry : entries.entrySet()) {
                    db.put(handles.get(0),
                            descriptor.keyCodec().encode(entry.getKey()),
                            descriptor.valueCodec().encode(entry.getValue()));
                }
                for (Map.Entry<String, String> entry : metadata.entrySet()) {
                    db.put(handles.get(1),
                            entry.getKey().getBytes(StandardCharsets.UTF_8),
                            entry.getValue().getBytes(StandardCharsets.UTF_8));
                }
            } finally {
                handles.forEach(ColumnFamilyHandle::close);
            }
        }
        return path;
    }

    public static void deleteDirectory(File directory) {
        File[] files = directory.listFiles();
        if (files != null) {
            for (File file : files) {
                if (file.isDirectory()) {
                    deleteDirectory(file);
                } else {
                    file.delete();
                }
            }
        }
        directory.delete();
    }
}
