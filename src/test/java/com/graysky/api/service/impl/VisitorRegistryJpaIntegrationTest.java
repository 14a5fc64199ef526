package com.graysky.api.service.impl;

import com.graysky.api.MutableClock;
import com.graysky.api.TestClockConfig;
import com.graysky.api.exception.RateLimitExceededException;
import com.graysky.api.model.dto.VisitRequest;
import com.graysky.api.model.visitor.IdentityKey;
import com.graysky.api.model.visitor.VisitorRecord;
import com.graysky.api.repository.AnswerRepository;
import com.graysky.api.repository.VisitorRepository;
import com.graysky.api.service.VisitorRegistry;
import com.graysky.api.storage.VisitorStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Registry flows against the relational store, with real commits.
 */
@SpringBootTest(properties = "app.visitors.storage=jpa")
@ActiveProfiles("test")
@Import(TestClockConfig.class)
@DisplayName("Visitor registry on the relational store")
class VisitorRegistryJpaIntegrationTest {

    @Autowired
    private VisitorRegistry registry;

    @Autowired
    private VisitorStore store;

    @Autowired
    private MutableClock clock;

    @Autowired
    private VisitorRepository visitorRepository;

    @Autowired
    private AnswerRepository answerRepository;

    @BeforeEach
    void reset() {
        answerRepository.deleteAllInBatch();
        visitorRepository.deleteAllInBatch();
        clock.set(Instant.parse("2025-03-01T10:00:00Z"));
    }

    @Test
    void repeatVisitUpdatesTheSameRow() {
        VisitorRecord first = registry.registerVisit(request("Ada", "GPT", Map.of("q", "x")));
        clock.advance(Duration.ofMinutes(61));
        VisitorRecord second = registry.registerVisit(request("Ada", "GPT", Map.of("q", "y", "r", "z")));

        assertThat(second.getId()).isEqualTo(first.getId());
        assertThat(visitorRepository.count()).isEqualTo(1);
        assertThat(answerRepository.countByVisitor_Id(first.getId())).isEqualTo(2);
        assertThat(store.findByIdentity(new IdentityKey("Ada", "GPT")).orElseThrow().getVisitCount()).isEqualTo(2);
    }

    @Test
    void supplementaryCharactersUpToTheLimitsAreStored() {
        String emoji = "\uD83D\uDE00";
        VisitorRecord record = registry.registerVisit(VisitRequest.builder()
                .name(emoji.repeat(100))
                .agentType(emoji.repeat(500))
                .purpose(emoji.repeat(500))
                .answers(Map.of(emoji.repeat(50), emoji.repeat(500)))
                .build());

        VisitorRecord stored = store.findByIdentity(new IdentityKey(emoji.repeat(100), emoji.repeat(500))).orElseThrow();
        assertThat(stored.getId()).isEqualTo(record.getId());
        assertThat(stored.getPurpose()).isEqualTo(emoji.repeat(500));
        assertThat(stored.getAnswers()).containsExactly(Map.entry(emoji.repeat(50), emoji.repeat(500)));

        VisitorRecord other = registry.registerVisit(request("Zed", null, Map.of(emoji.repeat(50), "v")));
        assertThat(answerRepository.countByVisitor_Id(other.getId())).isEqualTo(1);
    }

    @Test
    void concurrentFirstVisitsCreateExactlyOneRow() throws Exception {
        int callers = 6;
        List<Future<VisitorRecord>> futures = runConcurrently(callers, () -> registry.registerVisit(request("Bob", null, null)));

        int succeeded = 0;
        int rateLimited = 0;
        for (Future<VisitorRecord> future : futures) {
            try {
                future.get(30, TimeUnit.SECONDS);
                succeeded++;
            } catch (ExecutionException e) {
                assertThat(e.getCause()).isInstanceOf(RateLimitExceededException.class);
                rateLimited++;
            }
        }

        assertThat(succeeded).isEqualTo(1);
        assertThat(rateLimited).isEqualTo(callers - 1);
        assertThat(visitorRepository.count()).isEqualTo(1);
    }

    @Test
    void concurrentVisitsForDifferentNamesAllLand() throws Exception {
        List<Callable<VisitorRecord>> calls = new ArrayList<>();
        for (int i = 0; i < 6; i++) {
            String name = "Visitor-" + i;
            calls.add(() -> registry.registerVisit(request(name, "GPT", Map.of("n", name))));
        }

        ExecutorService pool = Executors.newFixedThreadPool(calls.size());
        try {
            for (Future<VisitorRecord> future : pool.invokeAll(calls, 30, TimeUnit.SECONDS)) {
                assertThat(future.get().getVisitCount()).isEqualTo(1);
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(visitorRepository.count()).isEqualTo(6);
        assertThat(answerRepository.count()).isEqualTo(6);
    }

    private static VisitRequest request(String name, String agentType, Map<String, String> answers) {
        return VisitRequest.builder().name(name).agentType(agentType).answers(answers).build();
    }

    private static List<Future<VisitorRecord>> runConcurrently(int callers, Callable<VisitorRecord> call) {
        ExecutorService pool = Executors.newFixedThreadPool(callers);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<VisitorRecord>> futures = new ArrayList<>();
        for (int i = 0; i < callers; i++) {
            futures.add(pool.submit(() -> {
                start.await();
                return call.call();
            }));
        }
        start.countDown();
        pool.shutdown();
        return futures;
    }
}
