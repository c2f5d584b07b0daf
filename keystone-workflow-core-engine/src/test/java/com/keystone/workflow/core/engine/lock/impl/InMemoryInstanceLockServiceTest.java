package com.keystone.workflow.core.engine.lock.impl;

import com.keystone.workflow.core.engine.lock.KeystoneInstanceLock;
import com.keystone.workflow.core.exception.lock.WorkflowLockedException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link InMemoryInstanceLockService}.
 */
class InMemoryInstanceLockServiceTest {

    private static final Duration LOCK_DURATION = Duration.ofMinutes(1);

    private final AtomicReference<Instant> now = new AtomicReference<>(Instant.parse("2026-03-01T10:00:00Z"));
    private InMemoryInstanceLockService lockService;

    @BeforeEach
    void setUp() {
        Clock clock = new Clock() {
            @Override
            public ZoneId getZone() {
                return ZoneOffset.UTC;
            }

            @Override
            public Clock withZone(ZoneId zone) {
                return this;
            }

            @Override
            public Instant instant() {
                return now.get();
            }
        };
        lockService = new InMemoryInstanceLockService(clock, Duration.ofMillis(5));
    }

    @Nested
    @DisplayName("Acquire and Release")
    class AcquireReleaseTests {

        @Test
        @DisplayName("should grant the lock to one owner at a time")
        void shouldGrantExclusiveLock() {
            assertTrue(lockService.tryAcquire("wf_1", "owner-a", LOCK_DURATION, "transition").block());
            assertFalse(lockService.tryAcquire("wf_1", "owner-b", LOCK_DURATION, "abort").block());
            assertTrue(lockService.tryAcquire("wf_2", "owner-b", LOCK_DURATION, "abort").block());
            assertTrue(lockService.isLocked("wf_1").block());
        }

        @Test
        @DisplayName("should refresh the expiry when the holder re-acquires")
        void shouldRefreshOwnLock() {
            // Given
            lockService.tryAcquire("wf_1", "owner-a", LOCK_DURATION, "transition").block();
            now.set(now.get().plusSeconds(30));

            // When
            assertTrue(lockService.tryAcquire("wf_1", "owner-a", LOCK_DURATION, "transition").block());

            // Then
            Optional<KeystoneInstanceLock> lock = lockService.getLockInfo("wf_1").block();
            assertTrue(lock.isPresent());
            assertEquals(now.get().plus(LOCK_DURATION), lock.get().getExpiresAt());
        }

        @Test
        @DisplayName("should let another owner take over an expired lock")
        void shouldTakeOverExpiredLock() {
            // Given
            lockService.tryAcquire("wf_1", "owner-a", LOCK_DURATION, "transition").block();
            now.set(now.get().plus(LOCK_DURATION).plusSeconds(1));
            assertFalse(lockService.isLocked("wf_1").block());

            // When / Then
            assertTrue(lockService.tryAcquire("wf_1", "owner-b", LOCK_DURATION, "abort").block());
            assertEquals("owner-b", lockService.getLockInfo("wf_1").block().get().getOwnerId());
        }

        @Test
        @DisplayName("should only release for the holder")
        void shouldReleaseOnlyForOwner() {
            // Given
            lockService.tryAcquire("wf_1", "owner-a", LOCK_DURATION, "transition").block();

            // When / Then
            assertFalse(lockService.release("wf_1", "owner-b").block());
            assertTrue(lockService.isLocked("wf_1").block());
            assertTrue(lockService.release("wf_1", "owner-a").block());
            assertFalse(lockService.isLocked("wf_1").block());
            assertFalse(lockService.release("wf_1", "owner-a").block());
        }

        @Test
        @DisplayName("should reject null identifiers")
        void shouldRejectNullIds() {
            StepVerifier.create(lockService.tryAcquire(null, "owner-a", LOCK_DURATION, "transition"))
                    .expectError(IllegalArgumentException.class)
                    .verify();
        }
    }

    @Nested
    @DisplayName("Waiting and Scoped Execution")
    class WaitingTests {

        @Test
        @DisplayName("should give up after the wait timeout")
        void shouldTimeOutWhileWaiting() {
            // Given
            lockService.tryAcquire("wf_1", "owner-a", LOCK_DURATION, "transition").block();

            // When / Then
            StepVerifier.create(lockService.acquireWithWait("wf_1", "owner-b", LOCK_DURATION,
                            Duration.ofMillis(50), "abort"))
                    .expectNext(false)
                    .verifyComplete();
            assertEquals("owner-a", lockService.getLockInfo("wf_1").block().get().getOwnerId());
        }

        @Test
        @DisplayName("should report a lock taken just as the wait timed out as acquired")
        void shouldReportLockWonAtTimeout() {
            // Given
            lockService.tryAcquireSync("wf_1", "owner-b", LOCK_DURATION, "abort");
            lockService.tryAcquireSync("wf_2", "owner-a", LOCK_DURATION, "transition");

            // When / Then
            assertTrue(lockService.onWaitTimeout("wf_1", "owner-b", "abort"));
            assertFalse(lockService.onWaitTimeout("wf_2", "owner-b", "abort"));
            assertFalse(lockService.onWaitTimeout("wf_3", "owner-b", "abort"));
            assertEquals("owner-a", lockService.getLockInfo("wf_2").block().get().getOwnerId());
        }

        @Test
        @DisplayName("should acquire once the holder releases")
        void shouldAcquireAfterRelease() {
            // Given
            lockService.tryAcquire("wf_1", "owner-a", LOCK_DURATION, "transition").block();

            // When
            Mono<Boolean> waiting = lockService.acquireWithWait("wf_1", "owner-b", LOCK_DURATION,
                    Duration.ofSeconds(2), "abort");

            // Then
            StepVerifier.create(waiting)
                    .then(() -> lockService.release("wf_1", "owner-a").block())
                    .expectNext(true)
                    .verifyComplete();
        }

        @Test
        @DisplayName("should release the lock after the action completes or fails")
        void shouldReleaseAfterAction() {
            StepVerifier.create(lockService.executeWithLock("wf_1", "owner-a", LOCK_DURATION, Duration.ofSeconds(1),
                            "transition", Mono.just("done")))
                    .expectNext("done")
                    .verifyComplete();
            assertFalse(lockService.isLocked("wf_1").block());

            StepVerifier.create(lockService.executeWithLock("wf_1", "owner-a", LOCK_DURATION, Duration.ofSeconds(1),
                            "transition", Mono.error(new IllegalStateException("boom"))))
                    .expectError(IllegalStateException.class)
                    .verify();
            assertFalse(lockService.isLocked("wf_1").block());
        }

        @Test
        @DisplayName("should signal WorkflowLockedException when the lock stays taken")
        void shouldFailWhenLocked() {
            // Given
            lockService.tryAcquire("wf_1", "owner-a", LOCK_DURATION, "transition").block();

            // When / Then
            StepVerifier.create(lockService.executeWithLock("wf_1", "owner-b", LOCK_DURATION, Duration.ofMillis(30),
                            "abort", Mono.just("never")))
                    .expectErrorSatisfies(error -> {
                        WorkflowLockedException locked = assertInstanceOf(WorkflowLockedException.class, error);
                        assertTrue(locked.getMessage().contains("wf_1"));
                    })
                    .verify();
        }
    }
}
