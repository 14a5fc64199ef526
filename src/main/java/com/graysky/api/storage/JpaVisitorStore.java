package com.graysky.api.storage;

import com.google.common.util.concurrent.Striped;
import com.graysky.api.exception.DuplicateIdentityException;
import com.graysky.api.exception.StorageException;
import com.graysky.api.model.visitor.AnswerEntity;
import com.graysky.api.model.visitor.IdentityKey;
import com.graysky.api.model.visitor.VisitorEntity;
import com.graysky.api.model.visitor.VisitorRecord;
import com.graysky.api.repository.AnswerRepository;
import com.graysky.api.repository.VisitorRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.NestedExceptionUtils;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.Lock;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Visitor store backed by the {@code visitors} and {@code answers} tables.
 *
 * <p>Identity uniqueness is guarded by the unique {@code identity_key} column. Two writers
 * that both looked up an identity and found nothing will both try to insert; the database
 * lets the first commit through and rejects the second, which surfaces here as a
 * {@link DuplicateIdentityException} and rolls the loser's transaction back.
 *
 * <p>Within one process, write transactions for the same visitor name also queue on a
 * striped lock, so the rate-limit check and the insert of a second submission under that
 * name always run after the first one has committed. Different names proceed in parallel.
 *
 * <p>Answers are replaced by deleting every row of the visitor and inserting the new set,
 * in the same transaction as the visitor row.
 */
@Slf4j
public class JpaVisitorStore implements VisitorStore {

    private static final String IDENTITY_CONSTRAINT = "uk_visitors_identity";

    private final VisitorRepository visitorRepository;
    private final AnswerRepository answerRepository;
    private final TransactionTemplate writeTemplate;
    private final TransactionTemplate readTemplate;
    private final Striped<Lock> nameLocks = Striped.lazyWeakLock(64);

    public JpaVisitorStore(VisitorRepository visitorRepository,
                           AnswerRepository answerRepository,
                           PlatformTransactionManager transactionManager) {
        this.visitorRepository = visitorRepository;
        this.answerRepository = answerRepository;
        this.writeTemplate = new TransactionTemplate(transactionManager);
        this.readTemplate = new TransactionTemplate(transactionManager);
        this.readTemplate.setReadOnly(true);
        log.info("Visitor store using relational tables");
    }

    @Override
    public Optional<VisitorRecord> findByIdentity(IdentityKey identity) {
        return read(() -> visitorRepository.findByIdentityKey(identity.digest())
                .map(entity -> toRecord(entity, loadAnswers(entity.getId()))));
    }

    @Override
    public boolean hasVisitSince(String name, LocalDateTime since) {
        return read(() -> visitorRepository.existsByNameAndVisitTimeAfter(name, since));
    }

    @Override
    public void upsert(VisitorRecord record) {
        try {
            writeTemplate.executeWithoutResult(status -> {
                VisitorEntity saved = visitorRepository.saveAndFlush(VisitorEntity.fromRecord(record));
                replaceAnswers(saved, record.getAnswers());
            });
        } catch (DataIntegrityViolationException e) {
            if (isIdentityConflict(e)) {
                throw new DuplicateIdentityException(record.identity().digest(), e);
            }
            throw new StorageException("Failed to save visitor " + record.getId(), e);
        } catch (DataAccessException e) {
            throw new StorageException("Failed to save visitor " + record.getId(), e);
        }
    }

    @Override
    public List<VisitorRecord> listRecent(int limit) {
        return read(() -> {
            List<VisitorEntity> entities = visitorRepository.findAllByOrderByVisitTimeDescIdAsc(PageRequest.of(0, limit));
            if (entities.isEmpty()) {
                return new ArrayList<>();
            }
            List<String> ids = entities.stream().map(VisitorEntity::getId).collect(Collectors.toList());
            Map<String, Map<String, String>> answersByVisitor = new LinkedHashMap<>();
            for (AnswerEntity answer : answerRepository.findByVisitor_IdInOrderByIdAsc(ids)) {
                answersByVisitor.computeIfAbsent(answer.getVisitor().getId(), id -> new LinkedHashMap<>())
                        .put(answer.getKey(), answer.getValue());
            }
            return entities.stream()
                    .map(e -> toRecord(e, answersByVisitor.getOrDefault(e.getId(), new LinkedHashMap<>())))
                    .collect(Collectors.toList());
        });
    }

    @Override
    public int trimToCapacity(int maxRecords) {
        try {
            Integer removed = writeTemplate.execute(status -> {
                long total = visitorRepository.count();
                if (total <= maxRecords) {
                    return 0;
                }
                int excess = (int) (total - maxRecords);
                List<String> oldest = visitorRepository.findIdsOldestFirst(PageRequest.of(0, excess));
                return visitorRepository.deleteByIdIn(oldest);
            });
            if (removed != null && removed > 0) {
                log.info("Trimmed {} oldest visitors", removed);
            }
            return removed == null ? 0 : removed;
        } catch (DataAccessException e) {
            throw new StorageException("Failed to trim visitors", e);
        }
    }

    @Override
    public long count() {
        return read(visitorRepository::count);
    }

    @Override
    public <T> T inWriteTransaction(String visitorName, Supplier<T> work) {
        Lock lock = nameLocks.get(visitorName);
        lock.lock();
        try {
            return writeTemplate.execute(status -> work.get());
        } catch (DataIntegrityViolationException e) {
            if (isIdentityConflict(e)) {
                throw new DuplicateIdentityException("(commit)", e);
            }
            throw new StorageException("Visitor transaction failed", e);
        } catch (DataAccessException e) {
            throw new StorageException("Visitor transaction failed", e);
        } finally {
            lock.unlock();
        }
    }

    private void replaceAnswers(VisitorEntity visitor, Map<String, String> answers) {
        answerRepository.deleteByVisitorId(visitor.getId());
        if (answers == null || answers.isEmpty()) {
            return;
        }
        List<AnswerEntity> rows = answers.entrySet().stream()
                .map(e -> new AnswerEntity(visitor, e.getKey(), e.getValue() == null ? "" : e.getValue()))
                .collect(Collectors.toList());
        answerRepository.saveAllAndFlush(rows);
    }

    private Map<String, String> loadAnswers(String visitorId) {
        Map<String, String> answers = new LinkedHashMap<>();
        for (AnswerEntity answer : answerRepository.findByVisitor_IdOrderByIdAsc(visitorId)) {
            answers.put(answer.getKey(), answer.getValue());
        }
        return answers;
    }

    private <T> T read(Supplier<T> query) {
        try {
            return readTemplate.execute(status -> query.get());
        } catch (DataAccessException e) {
            throw new StorageException("Failed to read visitors", e);
        }
    }

    private static boolean isIdentityConflict(DataIntegrityViolationException e) {
        String message = NestedExceptionUtils.getMostSpecificCause(e).getMessage();
        return message != null && message.toLowerCase(Locale.ROOT).contains(IDENTITY_CONSTRAINT);
    }

    private static VisitorRecord toRecord(VisitorEntity entity, Map<String, String> answers) {
        return VisitorRecord.builder()
                .id(entity.getId())
                .name(entity.getName())
                .agentType(entity.getAgentType())
                .purpose(entity.getPurpose())
                .visitTime(entity.getVisitTime())
                .visitCount(entity.getVisitCount())
                .answers(answers)
                .build();
    }
}
