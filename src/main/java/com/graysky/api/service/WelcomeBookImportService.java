package com.graysky.api.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.graysky.api.configuration.AppProperties;
import com.graysky.api.exception.StorageException;
import com.graysky.api.model.visitor.VisitorRecord;
import com.graysky.api.storage.LockedJsonDocument;
import com.graysky.api.storage.VisitorStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.UUID;

/**
 * Copies a welcome book JSON document into the active visitor store.
 *
 * Records keep their id, visit time, visit count and answers. An identity that already
 * exists in the store is left alone. Files written by older releases can hold several
 * entries for one identity; only the most recent of them is imported.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class WelcomeBookImportService {

    private final VisitorStore visitorStore;
    private final AppProperties appProperties;
    private final ObjectMapper objectMapper;

    /**
     * @return number of visitors imported; 0 if the file does not exist
     */
    public int importFrom(Path jsonFile) {
        if (!Files.exists(jsonFile)) {
            log.warn("Welcome book file not found: {}", jsonFile);
            return 0;
        }

        List<VisitorRecord> records = new LockedJsonDocument<>(jsonFile, VisitorRecord.class, objectMapper).read();
        if (records.isEmpty()) {
            log.info("No visitors found in {}", jsonFile);
            return 0;
        }
        records.sort(Comparator.comparing(VisitorRecord::getVisitTime,
                Comparator.nullsLast(Comparator.reverseOrder())));

        int imported = 0;
        for (VisitorRecord record : records) {
            if (record.getName() == null || record.getName().isBlank() || record.getVisitTime() == null) {
                log.warn("Skipping malformed welcome book entry {}", record.getId());
                continue;
            }
            try {
                if (importOne(record)) {
                    imported++;
                }
            } catch (StorageException e) {
                log.error("Failed to import visitor {} ({})", record.getId(), record.getName(), e);
            }
        }

        visitorStore.trimToCapacity(appProperties.getVisitors().getMaxRecords());
        log.info("Imported {} visitors from {}", imported, jsonFile);
        return imported;
    }

    private boolean importOne(VisitorRecord record) {
        return visitorStore.inWriteTransaction(record.getName(), () -> {
            if (visitorStore.findByIdentity(record.identity()).isPresent()) {
                return false;
            }
            VisitorRecord copy = record.toBuilder()
                    .id(record.getId() == null ? UUID.randomUUID().toString() : record.getId())
                    .visitCount(Math.max(1, record.getVisitCount()))
                    .answers(new LinkedHashMap<>(record.getAnswers()))
                    .build();
            visitorStore.upsert(copy);
            return true;
        });
    }
}
