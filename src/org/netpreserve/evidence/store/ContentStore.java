package org.netpreserve.evidence.store;

import org.jdbi.v3.core.JdbiException;
import org.jetbrains.annotations.Nullable;
import org.netpreserve.evidence.CaptureReference;
import org.netpreserve.evidence.PostId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.channels.Channels;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/**
 * Content-addressed store of archived payloads.
 * <p>
 * Each distinct payload is kept once as {@code data/<DIGEST>.gz} and has one row in the {@code file} table; captures
 * of posts are linked to those rows. The bytes always reach disk before the row is committed, so a crash can leave
 * an unindexed file (adopted by {@link #recover()}) but never a row without its file.
 * <p>
 * All methods block and are safe to call from multiple threads.
 */
public class ContentStore implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ContentStore.class);
    static final String DATABASE_FILE = "store.sqlite3";
    static final String DATA_DIR = "data";
    static final String TEMP_SUFFIX = ".tmp";
    private static final int LOCK_STRIPES = 64;
    private final Path directory;
    private final Path dataDir;
    private final Database db;
    private final ReentrantLock[] locks = new ReentrantLock[LOCK_STRIPES];

    /**
     * Opens (creating if necessary) the store in the given directory and reconciles it after any earlier crash.
     */
    public static ContentStore open(Path directory) {
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new ContentStoreException("Unable to create store directory " + directory, e);
        }
        Database db;
        try {
            db = Database.open(directory.resolve(DATABASE_FILE));
        } catch (RuntimeException e) {
            throw new ContentStoreException("Unable to open store database in " + directory, e);
        }
        var store = new ContentStore(directory, db);
        store.recover();
        return store;
    }

    public ContentStore(Path directory, Database db) {
        this.directory = directory;
        this.dataDir = directory.resolve(DATA_DIR);
        this.db = db;
        for (int i = 0; i < locks.length; i++) {
            locks[i] = new ReentrantLock();
        }
        try {
            Files.createDirectories(dataDir);
        } catch (IOException e) {
            throw new ContentStoreException("Unable to create " + dataDir, e);
        }
    }

    /**
     * Digest of the payload already linked to this capture of the post, if any.
     */
    public Optional<String> lookup(PostId postId, Instant captureTimestamp) {
        try {
            return db.captures().findDigest(postId.statusId(), captureTimestamp.toEpochMilli());
        } catch (JdbiException e) {
            throw new ContentStoreException("Capture lookup failed", e);
        }
    }

    public Optional<ContentDigestRecord> find(String digest) {
        try {
            return db.files().find(digest);
        } catch (JdbiException e) {
            throw new ContentStoreException("Digest lookup failed", e);
        }
    }

    public Path put(String digest, byte[] bytes) {
        return put(digest, bytes, null);
    }

    /**
     * Stores a payload under its digest unless it is already present.
     *
     * @param discoveredBy post whose capture brought the payload in, recorded only when the payload is new
     * @return where the payload is stored
     * @throws IllegalArgumentException if the digest doesn't match the bytes
     */
    public Path put(String digest, byte[] bytes, @Nullable PostId discoveredBy) {
        if (!ContentDigests.isValid(digest)) throw new IllegalArgumentException("Invalid digest: " + digest);
        String actual = ContentDigests.sha1(bytes);
        if (!actual.equals(digest)) {
            throw new IllegalArgumentException("Digest " + digest + " does not match content (" + actual + ")");
        }
        ReentrantLock lock = lockFor(digest);
        lock.lock();
        try {
            var existing = find(digest);
            if (existing.isPresent()) {
                Path path = directory.resolve(existing.get().path());
                if (Files.exists(path)) return path;
                log.warn("Stored payload {} is missing its file, rewriting it", digest);
            }
            String relativePath = relativePath(digest);
            Path path = directory.resolve(relativePath);
            writeAtomically(path, bytes);
            try {
                db.files().insertOrGetId(digest, relativePath, bytes.length,
                        discoveredBy == null ? null : discoveredBy.statusId(), Instant.now().toEpochMilli());
            } catch (JdbiException e) {
                throw new ContentStoreException("Unable to record payload " + digest, e);
            }
            log.atDebug().addKeyValue("digest", digest).addKeyValue("size", bytes.length)
                    .log("Stored payload");
            return path;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Links a capture of a post to an already stored payload.
     *
     * @return false if this capture was already linked
     * @throws ContentStoreException if the payload is not stored
     */
    public boolean record(PostId postId, CaptureReference capture, String digest) {
        try {
            return db.inTransaction(txn -> {
                long fileId = txn.files().findId(digest)
                        .orElseThrow(() -> new ContentStoreException("Payload " + digest + " is not stored"));
                long rowId = txn.posts().insertOrGetId(postId.statusId(), postId.screenName());
                return txn.captures().insert(rowId, fileId, postId.screenName(),
                        capture.timestamp().toEpochMilli(), capture.url()) > 0;
            });
        } catch (JdbiException e) {
            throw new ContentStoreException("Unable to link capture of " + postId, e);
        }
    }

    public List<ContentDigestRecord> digestsForPost(PostId postId) {
        try {
            return db.captures().digestsForPost(postId.statusId());
        } catch (JdbiException e) {
            throw new ContentStoreException("Digest lookup failed", e);
        }
    }

    public List<CaptureLink> links() {
        try {
            return db.captures().list();
        } catch (JdbiException e) {
            throw new ContentStoreException("Capture listing failed", e);
        }
    }

    public List<ContentDigestRecord> files() {
        try {
            return db.files().list();
        } catch (JdbiException e) {
            throw new ContentStoreException("File listing failed", e);
        }
    }

    public long fileCount() {
        try {
            return db.files().count();
        } catch (JdbiException e) {
            throw new ContentStoreException("File count failed", e);
        }
    }

    public Optional<Path> path(String digest) {
        return find(digest).map(record -> directory.resolve(record.path()));
    }

    /**
     * Reads back a stored payload, uncompressed.
     */
    public Optional<byte[]> read(String digest) {
        Optional<Path> path = path(digest);
        if (path.isEmpty()) return Optional.empty();
        try {
            return Optional.of(readGzip(path.get()));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            throw new ContentStoreException("Unable to read payload " + digest, e);
        }
    }

    /**
     * Re-hashes every indexed payload and compares it with its digest. Nothing is repaired: a corrupt payload is left
     * in place for inspection, and {@link #recover()} already drops rows whose file is gone.
     */
    public StoreVerification verify() {
        int valid = 0;
        var missing = new ArrayList<String>();
        var corrupt = new ArrayList<String>();
        for (ContentDigestRecord record : files()) {
            String actual;
            try (InputStream in = openGzip(directory.resolve(record.path()))) {
                actual = ContentDigests.sha1(in);
            } catch (NoSuchFileException e) {
                log.warn("Payload {} is missing its file", record.digest());
                missing.add(record.digest());
                continue;
            } catch (IOException e) {
                log.warn("Payload {} is unreadable: {}", record.digest(), e.toString());
                corrupt.add(record.digest());
                continue;
            }
            if (actual.equals(record.digest())) {
                valid++;
            } else {
                log.warn("Payload {} hashes to {}", record.digest(), actual);
                corrupt.add(record.digest());
            }
        }
        log.atInfo().addKeyValue("valid", valid).addKeyValue("corrupt", corrupt.size())
                .addKeyValue("missing", missing.size()).log("Verified store contents");
        return new StoreVerification(valid, missing, corrupt);
    }

    /**
     * Brings the index and the data directory back in agreement after an interrupted run: removes partially
     * written temp files, forgets rows whose file is gone, and adopts complete files that were never indexed.
     *
     * @return number of repairs made
     */
    public int recover() {
        int repairs = 0;
        try {
            var known = new HashSet<String>();
            for (ContentDigestRecord record : db.files().list()) {
                if (Files.exists(directory.resolve(record.path()))) {
                    known.add(record.digest());
                    continue;
                }
                db.useTransaction(txn -> {
                    txn.captures().deleteForDigest(record.digest());
                    txn.files().delete(record.digest());
                });
                log.warn("Removed index entry for missing payload {}", record.digest());
                repairs++;
            }

            List<Path> entries;
            try (var stream = Files.list(dataDir)) {
                entries = stream.toList();
            }
            for (Path entry : entries) {
                String name = entry.getFileName().toString();
                if (name.endsWith(TEMP_SUFFIX)) {
                    Files.deleteIfExists(entry);
                    log.info("Deleted partial write {}", name);
                    repairs++;
                } else if (name.endsWith(".gz")) {
                    String digest = name.substring(0, name.length() - ".gz".length());
                    if (known.contains(digest)) continue;
                    if (adopt(entry, digest)) {
                        log.info("Adopted unindexed payload {}", digest);
                    } else {
                        Files.deleteIfExists(entry);
                        log.warn("Deleted corrupt payload file {}", name);
                    }
                    repairs++;
                }
            }
        } catch (IOException e) {
            throw new ContentStoreException("Store recovery failed in " + directory, e);
        } catch (JdbiException e) {
            throw new ContentStoreException("Store recovery failed in " + directory, e);
        }
        if (repairs > 0) {
            log.atInfo().addKeyValue("repairs", repairs).addKeyValue("store", directory).log("Recovered store");
        }
        return repairs;
    }

    private boolean adopt(Path file, String digest) {
        if (!ContentDigests.isValid(digest)) return false;
        byte[] bytes;
        try {
            bytes = readGzip(file);
        } catch (IOException e) {
            return false;
        }
        if (!ContentDigests.sha1(bytes).equals(digest)) return false;
        db.files().insertOrGetId(digest, relativePath(digest), bytes.length, null, Instant.now().toEpochMilli());
        return true;
    }

    private void writeAtomically(Path target, byte[] bytes) {
        Path temp = null;
        try {
            temp = Files.createTempFile(dataDir, target.getFileName().toString() + ".", TEMP_SUFFIX);
            try (var channel = FileChannel.open(temp, StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING);
                 var out = new GZIPOutputStream(Channels.newOutputStream(channel))) {
                out.write(bytes);
                out.finish();
                channel.force(true);
            }
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            if (temp != null) {
                try {
                    Files.deleteIfExists(temp);
                } catch (IOException suppressed) {
                    e.addSuppressed(suppressed);
                }
            }
            throw new ContentStoreException("Unable to write " + target, e);
        }
    }

    private static byte[] readGzip(Path path) throws IOException {
        try (InputStream in = openGzip(path)) {
            return in.readAllBytes();
        }
    }

    private static InputStream openGzip(Path path) throws IOException {
        InputStream file = Files.newInputStream(path);
        try {
            return new GZIPInputStream(file);
        } catch (IOException e) {
            file.close();
            throw e;
        }
    }

    static String relativePath(String digest) {
        return DATA_DIR + "/" + digest + ".gz";
    }

    private ReentrantLock lockFor(String digest) {
        return locks[Math.floorMod(digest.hashCode(), locks.length)];
    }

    @Override
    public void close() {
        db.close();
    }
}
