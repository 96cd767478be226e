package com.ai.leadqualifier.component;

import com.ai.leadqualifier.conversation.LeadConversation;
import com.ai.leadqualifier.conversation.MessageRole;
import com.ai.leadqualifier.conversation.QualificationStatus;
import com.ai.leadqualifier.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;

class ConversationStoreTest {

    private static final String PHONE = "5511999990000";

    private MutableClock clock;
    private ConversationStore store;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
        store = new ConversationStore(clock);
    }

    @Test
    void getOrCreateCreatesOnceAndKeepsDisplayName() {
        ConversationStore.ConversationHandle first = store.getOrCreate(PHONE, "Ana");
        ConversationStore.ConversationHandle second = store.getOrCreate(PHONE, "Outro nome");

        assertThat(first.isCreated()).isTrue();
        assertThat(second.isCreated()).isFalse();
        assertThat(second.getSnapshot().getStatus()).isEqualTo(QualificationStatus.IN_PROGRESS);
        assertThat(second.getSnapshot().getDisplayName()).isEqualTo("Ana");
        assertThat(store.size()).isEqualTo(1);
    }

    @Test
    void readersGetDetachedCopies() {
        store.withLock(PHONE, null, c -> c.incrementAttempts());

        LeadConversation read = store.find(PHONE).orElseThrow();
        read.incrementAttempts();

        assertThat(store.find(PHONE).orElseThrow().getAttempts()).isEqualTo(1);
    }

    @Test
    void samePhoneIsSerialized() throws Exception {
        int workers = 8;
        int perWorker = 50;
        AtomicInteger inside = new AtomicInteger();
        AtomicInteger maxInside = new AtomicInteger();
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(workers);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int w = 0; w < workers; w++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < perWorker; i++) {
                        store.withLock(PHONE, null, c -> {
                            maxInside.accumulateAndGet(inside.incrementAndGet(), Math::max);
                            int before = c.getAttempts();
                            Thread.yield();
                            c.incrementAttempts();
                            inside.decrementAndGet();
                            return before;
                        });
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> f : futures) f.get(10, TimeUnit.SECONDS);
        } finally {
            pool.shutdownNow();
        }

        assertThat(maxInside.get()).isEqualTo(1);
        assertThat(store.find(PHONE).orElseThrow().getAttempts()).isEqualTo(workers * perWorker);
    }

    @Test
    void differentPhonesDoNotBlockEachOther() throws Exception {
        CountDownLatch holding = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        ExecutorService pool = Executors.newSingleThreadExecutor();
        try {
            Future<?> blocker = pool.submit(() -> store.withLock(PHONE, null, c -> {
                holding.countDown();
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return null;
            }));
            assertThat(holding.await(5, TimeUnit.SECONDS)).isTrue();

            Integer attempts = store.withLock("5521988887777", null, LeadConversation::incrementAttempts);

            assertThat(attempts).isEqualTo(1);
            release.countDown();
            blocker.get(5, TimeUnit.SECONDS);
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void withExistingLockIsEmptyForUnknownPhone() {
        assertThat(store.withExistingLock(PHONE, LeadConversation::getAttempts)).isEmpty();
        assertThat(store.find(PHONE)).isEmpty();
    }

    @Test
    void sweepTimesOutIdleConversationExactlyOnce() {
        store.withLock(PHONE, null, c -> c.addMessage(MessageRole.USER, "Oi", null, clock.instant()));
        clock.advance(Duration.ofMinutes(31));

        List<String> first = store.sweepExpired(clock.instant(), Duration.ofMinutes(30));
        List<String> second = store.sweepExpired(clock.instant(), Duration.ofMinutes(30));

        assertThat(first).containsExactly(PHONE);
        assertThat(second).isEmpty();
        LeadConversation c = store.find(PHONE).orElseThrow();
        assertThat(c.getStatus()).isEqualTo(QualificationStatus.TIMEOUT);
        assertThat(c.getEndedAt()).isEqualTo(clock.instant());
        assertThat(c.getNotes()).anyMatch(n -> n.contains("Conversa expirada"));
    }

    @Test
    void sweepMeasuresIdleTimeFromLastActivity() {
        store.getOrCreate(PHONE, null);
        clock.advance(Duration.ofMinutes(25));
        store.withLock(PHONE, null, c -> c.addMessage(MessageRole.USER, "Ainda aqui", null, clock.instant()));
        clock.advance(Duration.ofMinutes(10));

        assertThat(store.sweepExpired(clock.instant(), Duration.ofMinutes(30))).isEmpty();
        assertThat(store.findActive()).hasSize(1);
    }

    @Test
    void sweepDoesNotWaitOnBusyConversationThatIsNotIdle() throws Exception {
        CountDownLatch holding = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        ExecutorService pool = Executors.newSingleThreadExecutor();
        try {
            Future<?> turn = pool.submit(() -> store.withLock(PHONE, null, c -> {
                holding.countDown();
                try {
                    release.await(10, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return null;
            }));
            assertThat(holding.await(5, TimeUnit.SECONDS)).isTrue();
            clock.advance(Duration.ofMinutes(5));

            List<String> expired = assertTimeoutPreemptively(Duration.ofSeconds(2),
                    () -> store.sweepExpired(clock.instant(), Duration.ofMinutes(30)));

            assertThat(expired).isEmpty();
            release.countDown();
            turn.get(5, TimeUnit.SECONDS);
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void countByStatusIncludesEveryStatus() {
        store.getOrCreate(PHONE, null);
        store.withLock("5521988887777", null, c -> {
            c.transitionTo(QualificationStatus.QUALIFIED, clock.instant());
            return null;
        });

        assertThat(store.countByStatus())
                .containsEntry(QualificationStatus.IN_PROGRESS, 1L)
                .containsEntry(QualificationStatus.QUALIFIED, 1L)
                .containsEntry(QualificationStatus.TIMEOUT, 0L)
                .hasSize(QualificationStatus.values().length);
        assertThat(store.findActive()).extracting(LeadConversation::getPhone).containsExactly(PHONE);
    }
}
