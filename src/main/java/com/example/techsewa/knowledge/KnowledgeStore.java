package com.example.techsewa.knowledge;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Owns the problem records and the alias index derived from them.
 *
 * <p>Readers take {@link #snapshot()} and work on that immutable view.  Mutations are
 * serialised by a single writer lock; each one builds a complete new snapshot and
 * publishes it with a single volatile write, then notifies listeners before the
 * write lock is released.</p>
 */
public class KnowledgeStore {
    private static final Logger log = LoggerFactory.getLogger(KnowledgeStore.class);

    private final Path source;
    private final KnowledgeBaseCodec codec;
    private final ReentrantLock writeLock = new ReentrantLock();
    private final List<KnowledgeListener> listeners = new CopyOnWriteArrayList<>();
    private volatile KnowledgeSnapshot snapshot;

    KnowledgeStore(Path source, KnowledgeBaseCodec codec, List<ProblemRecord> records) {
        this.source = source;
        this.codec = codec;
        this.snapshot = KnowledgeSnapshot.of(0, records);
    }

    /**
     * Load the store from a JSON file.
     *
     * @throws KnowledgeBaseNotFoundException when {@code source} does not exist
     * @throws KnowledgeBaseFormatException   when the payload is not an array of records
     */
    public static KnowledgeStore load(Path source, KnowledgeBaseCodec codec) {
        if (source == null || !Files.isRegularFile(source)) {
            throw new KnowledgeBaseNotFoundException(source);
        }
        String json;
        try {
            json = Files.readString(source, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new KnowledgeBaseFormatException("Could not read " + source, e);
        }
        List<ProblemRecord> records = withDistinctIds(codec.decode(json), source);
        log.info("[KB] loaded {} records from {}", records.size(), source);
        return new KnowledgeStore(source, codec, records);
    }

    public KnowledgeSnapshot snapshot() {
        return snapshot;
    }

    /** Read-only view of the current records. */
    public List<ProblemRecord> records() {
        return snapshot.records();
    }

    public int size() {
        return snapshot.records().size();
    }

    public Path getSource() {
        return source;
    }

    public void addListener(KnowledgeListener listener) {
        listeners.add(listener);
    }

    /**
     * Append a record, rebuild the index and persist synchronously.  A missing or
     * already used id is replaced by a fresh content-derived one.
     *
     * @return the record as stored
     * @throws IllegalArgumentException      when the record has no non-blank alias
     * @throws KnowledgePersistenceException when the write fails; the record stays in memory
     */
    public ProblemRecord append(ProblemRecord record) {
        if (!record.hasAnyAlias()) {
            throw new IllegalArgumentException("record " + record.getId() + " has no aliases");
        }
        writeLock.lock();
        try {
            KnowledgeSnapshot current = snapshot;
            ProblemRecord stored = withUniqueId(current, record);
            KnowledgeSnapshot next = current.append(stored);
            snapshot = next;
            for (KnowledgeListener l : listeners) {
                try {
                    l.onAppend(next, stored);
                } catch (RuntimeException e) {
                    log.warn("[KB] listener {} failed on append of {}", l, stored.getId(), e);
                }
            }
            try {
                persist(next.records());
            } catch (IOException e) {
                log.error("[KB] record {} kept in memory but not persisted to {}", stored.getId(), source, e);
                throw new KnowledgePersistenceException(stored, e);
            }
            log.info("[KB] appended record {} (total={})", stored.getId(), next.records().size());
            return stored;
        } finally {
            writeLock.unlock();
        }
    }

    private static ProblemRecord withUniqueId(KnowledgeSnapshot current, ProblemRecord record) {
        String id = record.getId();
        if (id != null && !id.isBlank() && !current.containsId(id)) {
            return record;
        }
        return record.toBuilder().id(ProblemIds.unique(record.firstAlias(), current::containsId)).build();
    }

    /** Later records whose persisted id is already taken get a fresh one derived from their first alias. */
    static List<ProblemRecord> withDistinctIds(List<ProblemRecord> records, Path source) {
        Set<String> taken = new HashSet<>();
        List<ProblemRecord> out = new ArrayList<>(records.size());
        for (ProblemRecord r : records) {
            if (taken.add(r.getId())) {
                out.add(r);
                continue;
            }
            String fresh = ProblemIds.unique(r.firstAlias(), taken::contains);
            taken.add(fresh);
            log.warn("[KB] duplicate id {} in {}; reassigned as {}", r.getId(), source, fresh);
            out.add(r.toBuilder().id(fresh).build());
        }
        return out;
    }

    /** Write to a temp file next to the target, then move it into place. */
    void persist(List<ProblemRecord> records) throws IOException {
        Path target = source.toAbsolutePath();
        Path dir = target.getParent();
        Files.createDirectories(dir);
        Path tmp = Files.createTempFile(dir, target.getFileName().toString(), ".tmp");
        try {
            Files.writeString(tmp, codec.encode(records), StandardCharsets.UTF_8);
            try {
                Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(tmp);
        }
    }
}
