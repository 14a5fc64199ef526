package com.graysky.api.storage;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.graysky.api.exception.StorageException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * A JSON array document on disk, guarded for concurrent use.
 *
 * <p>Readers share a process-wide read lock. Writers take the write lock for the whole
 * read-modify-write, plus an exclusive {@link FileLock} on a sibling {@code .lock} file so
 * that other processes on the host are serialized too. Every write replaces the document
 * through an atomic rename, so a reader never sees a half-written file and a failed
 * write leaves the previous content intact.
 *
 * <p>The write lock is reentrant: {@link #withExclusiveLock} calls may nest, and reads
 * made while holding it see the caller's own earlier writes.
 *
 * @param <T> element type of the array
 */
@Slf4j
public class LockedJsonDocument<T> {

    private final Path path;
    private final Path lockPath;
    private final ObjectMapper mapper;
    private final JavaType listType;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock(true);

    public LockedJsonDocument(Path path, Class<T> elementType, ObjectMapper mapper) {
        this.path = path.toAbsolutePath();
        this.lockPath = this.path.resolveSibling(this.path.getFileName() + ".lock");
        this.mapper = mapper.copy()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(SerializationFeature.INDENT_OUTPUT);
        this.listType = this.mapper.getTypeFactory().constructCollectionType(List.class, elementType);
    }

    public Path getPath() {
        return path;
    }

    /**
     * Creates the parent directory and an empty {@code []} document if missing.
     */
    public void initialize() {
        withExclusiveLock(() -> {
            if (!Files.exists(path)) {
                writeUnderLock(new ArrayList<>());
                log.info("Created data file {}", path);
            }
            return null;
        });
    }

    /**
     * @return a fresh, mutable copy of the whole document
     */
    public List<T> read() {
        lock.readLock().lock();
        try {
            return readUnderLock();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Re-reads the document, hands it to {@code mutation}, and writes the result back.
     */
    public void update(Consumer<List<T>> mutation) {
        withExclusiveLock(() -> {
            List<T> items = readUnderLock();
            mutation.accept(items);
            writeUnderLock(items);
            return null;
        });
    }

    /**
     * Replaces the whole document.
     */
    public void write(List<T> items) {
        withExclusiveLock(() -> {
            writeUnderLock(items);
            return null;
        });
    }

    /**
     * Runs {@code work} while holding the exclusive lock. Reads and updates made by
     * {@code work} happen inside the same critical section.
     */
    public <R> R withExclusiveLock(Supplier<R> work) {
        lock.writeLock().lock();
        try {
            if (lock.getWriteHoldCount() > 1) {
                return work.get();
            }
            return withHostLock(work);
        } finally {
            lock.writeLock().unlock();
        }
    }

    private <R> R withHostLock(Supplier<R> work) {
        try {
            createParentDirectories();
            try (FileChannel channel = FileChannel.open(lockPath,
                    StandardOpenOption.CREATE, StandardOpenOption.WRITE);
                 FileLock ignored = channel.lock()) {
                return work.get();
            }
        } catch (IOException e) {
            throw new StorageException("Failed to lock data file " + path, e);
        }
    }

    private List<T> readUnderLock() {
        try {
            if (!Files.exists(path) || Files.size(path) == 0) {
                return new ArrayList<>();
            }
            List<T> items = mapper.readValue(path.toFile(), listType);
            return items == null ? new ArrayList<>() : new ArrayList<>(items);
        } catch (IOException e) {
            throw new StorageException("Failed to read data file " + path, e);
        }
    }

    private void writeUnderLock(List<T> items) {
        Path temp = null;
        try {
            createParentDirectories();
            temp = Files.createTempFile(path.getParent(), path.getFileName().toString(), ".tmp");
            mapper.writeValue(temp.toFile(), items);
            Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            temp = null;
        } catch (IOException e) {
            throw new StorageException("Failed to write data file " + path, e);
        } finally {
            if (temp != null) {
                deleteQuietly(temp);
            }
        }
    }

    private void createParentDirectories() throws IOException {
        Path parent = path.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
    }

    private void deleteQuietly(Path temp) {
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.warn("Failed to remove temp file {}: {}", temp, e.getMessage());
        }
    }
}
