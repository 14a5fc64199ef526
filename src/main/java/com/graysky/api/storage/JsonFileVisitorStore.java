package com.graysky.api.storage;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.graysky.api.model.visitor.IdentityKey;
import com.graysky.api.model.visitor.VisitorRecord;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Visitor store backed by a single JSON array file.
 *
 * Every operation re-reads the whole file and every write rewrites it, all writers
 * serialized behind one lock. That is fine for the retention ceiling this service keeps
 * (about a thousand entries); larger volumes belong in {@link JpaVisitorStore}.
 */
@Slf4j
public class JsonFileVisitorStore implements VisitorStore {

    static final Comparator<VisitorRecord> MOST_RECENT_FIRST = Comparator
            .comparing(VisitorRecord::getVisitTime, Comparator.nullsLast(Comparator.reverseOrder()))
            .thenComparing(VisitorRecord::getId, Comparator.nullsLast(Comparator.naturalOrder()));

    private final LockedJsonDocument<VisitorRecord> document;

    public JsonFileVisitorStore(Path dataFile, ObjectMapper objectMapper) {
        this.document = new LockedJsonDocument<>(dataFile, VisitorRecord.class, objectMapper);
        this.document.initialize();
        log.info("Visitor store using JSON file {}", document.getPath());
    }

    @Override
    public Optional<VisitorRecord> findByIdentity(IdentityKey identity) {
        // files written by older releases may hold several entries per identity; the latest wins
        return load().stream()
                .filter(identity::matches)
                .sorted(MOST_RECENT_FIRST)
                .findFirst();
    }

    @Override
    public boolean hasVisitSince(String name, LocalDateTime since) {
        return load().stream()
                .anyMatch(r -> name.equals(r.getName())
                        && r.getVisitTime() != null
                        && r.getVisitTime().isAfter(since));
    }

    @Override
    public void upsert(VisitorRecord record) {
        VisitorRecord copy = copyOf(record);
        document.update(records -> {
            for (int i = 0; i < records.size(); i++) {
                if (copy.getId().equals(records.get(i).getId())) {
                    records.set(i, copy);
                    return;
                }
            }
            records.add(copy);
        });
    }

    @Override
    public List<VisitorRecord> listRecent(int limit) {
        return load().stream()
                .sorted(MOST_RECENT_FIRST)
                .limit(limit)
                .collect(Collectors.toList());
    }

    @Override
    public int trimToCapacity(int maxRecords) {
        int removed = document.withExclusiveLock(() -> {
            List<VisitorRecord> records = document.read();
            if (records.size() <= maxRecords) {
                return 0;
            }
            records.sort(MOST_RECENT_FIRST);
            int excess = records.size() - maxRecords;
            document.write(new ArrayList<>(records.subList(0, maxRecords)));
            return excess;
        });
        if (removed > 0) {
            log.info("Trimmed {} oldest visitors from {}", removed, document.getPath());
        }
        return removed;
    }

    @Override
    public long count() {
        return document.read().size();
    }

    @Override
    public <T> T inWriteTransaction(String visitorName, Supplier<T> work) {
        // one whole-file lock for every name
        return document.withExclusiveLock(work);
    }

    private List<VisitorRecord> load() {
        List<VisitorRecord> records = document.read();
        for (VisitorRecord record : records) {
            if (record.getVisitCount() < 1) {
                record.setVisitCount(1);
            }
        }
        return records;
    }

    private static VisitorRecord copyOf(VisitorRecord record) {
        return record.toBuilder()
                .answers(new LinkedHashMap<>(record.getAnswers()))
                .build();
    }
}
