package com.phillippitts.slotwatch.service.subscriber;

import com.phillippitts.slotwatch.exception.SlotWatchException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Collection;
import java.util.List;
import java.util.TreeSet;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Subscriber store persisted as a JSON array of ids, e.g. {@code [1001, 1002]}.
 *
 * <p>The file is created empty (with parent directories) on first use. Every mutation rewrites
 * the whole file in ascending id order through a temporary file and an atomic move. All reads
 * and writes go through one lock; the file is re-read on every call so edits made while the
 * service runs are picked up.
 *
 * <p>A file that cannot be parsed, or an I/O failure, surfaces as {@link SlotWatchException};
 * the file is never rewritten from a failed read.
 */
public class FileSubscriberStore implements SubscriberStore {

    private static final Logger LOG = LogManager.getLogger(FileSubscriberStore.class);

    private final Path file;
    private final ReentrantLock lock = new ReentrantLock();

    public FileSubscriberStore(Path file) {
        this.file = file;
        lock.lock();
        try {
            ensureExists();
        } finally {
            lock.unlock();
        }
        LOG.info("Subscriber file: {}", file.toAbsolutePath());
    }

    @Override
    public Collection<Long> all() {
        lock.lock();
        try {
            return List.copyOf(read());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean add(long id) {
        lock.lock();
        try {
            TreeSet<Long> ids = read();
            if (!ids.add(id)) {
                return false;
            }
            write(ids);
            LOG.info("Subscribed {} ({} total)", id, ids.size());
            return true;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean remove(long id) {
        lock.lock();
        try {
            TreeSet<Long> ids = read();
            if (!ids.remove(id)) {
                return false;
            }
            write(ids);
            LOG.info("Unsubscribed {} ({} total)", id, ids.size());
            return true;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean exists(long id) {
        lock.lock();
        try {
            return read().contains(id);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int count() {
        lock.lock();
        try {
            return read().size();
        } finally {
            lock.unlock();
        }
    }

    Path file() {
        return file;
    }

    private void ensureExists() {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            if (!Files.exists(file)) {
                Files.writeString(file, "[]", StandardCharsets.UTF_8);
            }
        } catch (IOException e) {
            throw new SlotWatchException("Cannot create subscriber file " + file, e);
        }
    }

    private TreeSet<Long> read() {
        ensureExists();
        TreeSet<Long> ids = new TreeSet<>();
        String json;
        try {
            json = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new SlotWatchException("Cannot read subscriber file " + file, e);
        }
        if (json.isBlank()) {
            return ids;
        }
        try {
            JSONArray array = new JSONArray(json);
            for (int i = 0; i < array.length(); i++) {
                ids.add(array.getLong(i));
            }
        } catch (JSONException e) {
            LOG.error("Subscriber file {} is not a JSON array of ids; leaving it untouched", file);
            throw new SlotWatchException("Subscriber file " + file + " is not a JSON array of ids", e);
        }
        return ids;
    }

    private void write(TreeSet<Long> ids) {
        Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
        try {
            Files.writeString(tmp, new JSONArray(ids).toString(), StandardCharsets.UTF_8);
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new SlotWatchException("Cannot write subscriber file " + file, e);
        }
    }
}
