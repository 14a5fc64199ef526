package com.graysky.api.storage;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.graysky.api.model.feedback.FeedbackRecord;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

@Slf4j
public class JsonFileFeedbackStore implements FeedbackStore {

    private static final Comparator<FeedbackRecord> NEWEST_FIRST = Comparator
            .comparing(FeedbackRecord::getSubmissionTime, Comparator.nullsLast(Comparator.reverseOrder()))
            .thenComparing(FeedbackRecord::getId, Comparator.nullsLast(Comparator.naturalOrder()));

    private final LockedJsonDocument<FeedbackRecord> document;

    public JsonFileFeedbackStore(Path dataFile, ObjectMapper objectMapper) {
        this.document = new LockedJsonDocument<>(dataFile, FeedbackRecord.class, objectMapper);
        this.document.initialize();
        log.info("Feedback store using JSON file {}", document.getPath());
    }

    @Override
    public void insert(FeedbackRecord record) {
        document.update(records -> records.add(record));
    }

    @Override
    public List<FeedbackRecord> listRecent(int limit) {
        return document.read().stream()
                .sorted(NEWEST_FIRST)
                .limit(limit)
                .collect(Collectors.toList());
    }

    @Override
    public int trimToCapacity(int maxRecords) {
        return document.withExclusiveLock(() -> {
            List<FeedbackRecord> records = document.read();
            if (records.size() <= maxRecords) {
                return 0;
            }
            records.sort(NEWEST_FIRST);
            document.write(new ArrayList<>(records.subList(0, maxRecords)));
            int removed = records.size() - maxRecords;
            log.info("Trimmed {} oldest feedback entries", removed);
            return removed;
        });
    }
}
