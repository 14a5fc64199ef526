package com.graysky.api.service.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.graysky.api.configuration.AppProperties;
import com.graysky.api.configuration.VisitorProperties;
import com.graysky.api.exception.DuplicateIdentityException;
import com.graysky.api.exception.RateLimitExceededException;
import com.graysky.api.exception.StorageException;
import com.graysky.api.exception.ValidationException;
import com.graysky.api.model.dto.VisitRequest;
import com.graysky.api.model.visitor.IdentityKey;
import com.graysky.api.model.visitor.VisitorRecord;
import com.graysky.api.service.VisitorRegistry;
import com.graysky.api.storage.VisitorStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static com.graysky.api.util.InputSanitizer.MAX_ANSWER_KEY_LENGTH;
import static com.graysky.api.util.InputSanitizer.MAX_FIELD_LENGTH;
import static com.graysky.api.util.InputSanitizer.MAX_NAME_LENGTH;
import static com.graysky.api.util.InputSanitizer.length;
import static com.graysky.api.util.InputSanitizer.sanitize;
import static com.graysky.api.util.InputSanitizer.sanitizeOptional;

/**
 * Implementation of VisitorRegistry.
 *
 * Flow per visit: validate, sanitize, then inside one store write transaction check the
 * rate limit, resolve the identity and upsert. Retention trimming runs afterwards.
 *
 * The rate limit looks at the name only while identity uses (name, agent type), so a
 * visitor who comes back within the hour under a different agent type is still refused.
 * Nothing is cached in memory: both checks are answered by the store on every call.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class VisitorRegistryImpl implements VisitorRegistry {

    static final int MAX_ANSWERS_JSON_LENGTH = 2000;
    static final int MIN_LIST_LIMIT = 1;
    static final int MAX_LIST_LIMIT = 100;

    private final VisitorStore visitorStore;
    private final AppProperties appProperties;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Override
    public VisitorRecord registerVisit(VisitRequest request) {
        Map<String, String> errors = validate(request);
        if (!errors.isEmpty()) {
            log.warn("Rejected visit: {}", errors);
            throw new ValidationException("visitor", errors);
        }

        SanitizedVisit visit = sanitizeVisit(request);
        VisitorRecord record;
        try {
            record = admit(visit);
        } catch (DuplicateIdentityException e) {
            // another writer inserted this identity first; rerun against its committed record
            log.info("Concurrent first visit for '{}' lost the insert, retrying", visit.name());
            record = admit(visit);
        }

        trimQuietly();
        log.info("Visitor '{}' ({}) signed the welcome book, visit #{}",
                record.getName(), record.getAgentType(), record.getVisitCount());
        return record;
    }

    @Override
    public List<VisitorRecord> listVisitors(int limit) {
        int clamped = Math.min(Math.max(MIN_LIST_LIMIT, limit), MAX_LIST_LIMIT);
        return visitorStore.listRecent(clamped);
    }

    private VisitorRecord admit(SanitizedVisit visit) {
        VisitorProperties settings = appProperties.getVisitors();
        return visitorStore.inWriteTransaction(visit.name(), () -> {
            LocalDateTime now = LocalDateTime.now(clock);

            if (visitorStore.hasVisitSince(visit.name(), now.minus(settings.getRateLimitWindow()))) {
                log.warn("Rate limit hit for visitor '{}'", visit.name());
                throw new RateLimitExceededException(visit.name());
            }

            Optional<VisitorRecord> existing = visitorStore.findByIdentity(visit.identity());
            VisitorRecord record = existing
                    .map(previous -> previous.toBuilder()
                            .purpose(visit.purpose())
                            .visitTime(now)
                            .visitCount(previous.getVisitCount() + 1)
                            .answers(new LinkedHashMap<>(visit.answers()))
                            .build())
                    .orElseGet(() -> VisitorRecord.builder()
                            .id(UUID.randomUUID().toString())
                            .name(visit.name())
                            .agentType(visit.agentType())
                            .purpose(visit.purpose())
                            .visitTime(now)
                            .visitCount(1)
                            .answers(new LinkedHashMap<>(visit.answers()))
                            .build());

            visitorStore.upsert(record);
            return record;
        });
    }

    private void trimQuietly() {
        try {
            visitorStore.trimToCapacity(appProperties.getVisitors().getMaxRecords());
        } catch (StorageException e) {
            // the visit itself is committed; trimming is retried on the next write
            log.warn("Retention trim failed, will retry on next visit", e);
        }
    }

    private Map<String, String> validate(VisitRequest request) {
        Map<String, String> errors = new LinkedHashMap<>();
        if (request == null) {
            errors.put("name", "Name is required");
            return errors;
        }

        String name = request.getName();
        if (name == null || name.trim().isEmpty()) {
            errors.put("name", "Name is required");
        } else if (length(name) > MAX_NAME_LENGTH) {
            errors.put("name", "Name must be at most " + MAX_NAME_LENGTH + " characters");
        }

        if (length(request.getAgentType()) > MAX_FIELD_LENGTH) {
            errors.put("agent_type", "Agent type must be at most " + MAX_FIELD_LENGTH + " characters");
        }
        if (length(request.getPurpose()) > MAX_FIELD_LENGTH) {
            errors.put("purpose", "Purpose must be at most " + MAX_FIELD_LENGTH + " characters");
        }

        Map<String, String> answers = request.getAnswers();
        if (answers != null && !answers.isEmpty()) {
            if (answersJsonLength(answers) > MAX_ANSWERS_JSON_LENGTH) {
                errors.put("answers", "Answers exceeded maximum allowed size of " + MAX_ANSWERS_JSON_LENGTH + " characters");
            } else if (answers.keySet().stream().anyMatch(k -> k == null || k.isEmpty())) {
                errors.put("answers", "Answer keys must not be empty");
            } else if (answers.keySet().stream().anyMatch(k -> length(k) > MAX_ANSWER_KEY_LENGTH)) {
                errors.put("answers", "Answer keys must be at most " + MAX_ANSWER_KEY_LENGTH + " characters");
            }
        }
        return errors;
    }

    private int answersJsonLength(Map<String, String> answers) {
        try {
            return objectMapper.writeValueAsString(answers).length();
        } catch (JsonProcessingException e) {
            throw new ValidationException("visitor", Map.of("answers", "Answers could not be serialized"));
        }
    }

    private SanitizedVisit sanitizeVisit(VisitRequest request) {
        Map<String, String> answers = new LinkedHashMap<>();
        if (request.getAnswers() != null) {
            request.getAnswers().forEach((key, value) ->
                    answers.put(sanitize(key, MAX_ANSWER_KEY_LENGTH), sanitize(value, MAX_FIELD_LENGTH)));
        }
        return new SanitizedVisit(
                sanitize(request.getName(), MAX_NAME_LENGTH),
                sanitizeOptional(request.getAgentType(), MAX_FIELD_LENGTH),
                sanitizeOptional(request.getPurpose(), MAX_FIELD_LENGTH),
                answers);
    }

    private record SanitizedVisit(String name, String agentType, String purpose, Map<String, String> answers) {

        IdentityKey identity() {
            return new IdentityKey(name, agentType);
        }
    }
}
