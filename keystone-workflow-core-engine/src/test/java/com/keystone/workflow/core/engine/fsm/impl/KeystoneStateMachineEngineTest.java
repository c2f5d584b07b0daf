package com.keystone.workflow.core.engine.fsm.impl;

import com.keystone.workflow.core.engine.config.KeystoneWorkflowEngineConfig;
import com.keystone.workflow.core.exception.fsm.GuardRejectedException;
import com.keystone.workflow.core.exception.fsm.UnknownTransitionException;
import com.keystone.workflow.core.exception.instance.InvalidLifecycleException;
import com.keystone.workflow.integration.enumerations.KeystoneDefinitionKind;
import com.keystone.workflow.integration.enumerations.KeystoneWorkflowStatus;
import com.keystone.workflow.integration.models.definition.fsm.KeystoneHookReference;
import com.keystone.workflow.integration.models.definition.fsm.KeystoneStateConfig;
import com.keystone.workflow.integration.models.definition.fsm.KeystoneTransitionConfig;
import com.keystone.workflow.integration.models.definition.fsm.KeystoneWorkflowDefinition;
import com.keystone.workflow.integration.models.instance.KeystoneStateHistoryEntry;
import com.keystone.workflow.integration.models.instance.KeystoneWorkflowInstance;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link KeystoneStateMachineEngine}.
 * Covers the transition order, guard rejection, terminal states and abort.
 */
class KeystoneStateMachineEngineTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    private KeystoneStateMachineEngine engine;
    private List<String> calls;
    private KeystoneWorkflowDefinition definition;

    @BeforeEach
    void setUp() {
        engine = new KeystoneStateMachineEngine(KeystoneWorkflowEngineConfig.builder()
                .clock(Clock.fixed(NOW, ZoneOffset.UTC))
                .build());
        calls = new CopyOnWriteArrayList<>();

        engine.registerGuard("canSubmit", (context, params) -> {
            calls.add("guard:canSubmit");
            return Mono.just(Boolean.TRUE.equals(context.getData("complete")));
        });
        recordingAction("enterDraft");
        recordingAction("exitDraft");
        recordingAction("notifyReviewer");
        recordingAction("enterReview");
        recordingAction("exitReview");
        recordingAction("archive");

        definition = KeystoneWorkflowDefinition.builder()
                .id("document_review")
                .name("Document Review")
                .version("1.0.0")
                .initialState("draft")
                .state("draft", KeystoneStateConfig.builder()
                        .name("draft")
                        .initial(true)
                        .onEnterAction(KeystoneHookReference.named("enterDraft"))
                        .onExitAction(KeystoneHookReference.named("exitDraft"))
                        .transition("submit", KeystoneTransitionConfig.builder()
                                .target("review")
                                .guard(KeystoneHookReference.named("canSubmit"))
                                .action(KeystoneHookReference.named("notifyReviewer"))
                                .build())
                        .build())
                .state("review", KeystoneStateConfig.builder()
                        .name("review")
                        .onEnterAction(KeystoneHookReference.named("enterReview"))
                        .onExitAction(KeystoneHookReference.named("exitReview"))
                        .transition("approve", KeystoneTransitionConfig.builder()
                                .target("approved")
                                .action(KeystoneHookReference.named("archive"))
                                .build())
                        .transition("reject", KeystoneTransitionConfig.to("rejected"))
                        .transition("escalate", KeystoneTransitionConfig.builder()
                                .target("approved")
                                .guard(KeystoneHookReference.named("isDirector"))
                                .build())
                        .build())
                .state("approved", KeystoneStateConfig.builder().name("approved").finalState(true).build())
                .state("rejected", KeystoneStateConfig.builder().name("rejected").finalState(true).build())
                .build();
    }

    private void recordingAction(String name) {
        engine.registerAction(name, (context, params) -> Mono.fromRunnable(() -> calls.add(name)));
    }

    private KeystoneWorkflowInstance startedInstance(Map<String, Object> data) {
        KeystoneWorkflowInstance instance = engine.createInstance(definition, data, "alice");
        engine.startInstance(instance, definition).block();
        calls.clear();
        return instance;
    }

    // ========================================================================
    // LIFECYCLE TESTS
    // ========================================================================

    @Nested
    @DisplayName("Instance Lifecycle")
    class LifecycleTests {

        @Test
        @DisplayName("should create a pending instance on the initial state without running hooks")
        void shouldCreatePendingInstance() {
            // When
            KeystoneWorkflowInstance instance = engine.createInstance(definition, Map.of("title", "Q1 report"), "alice");

            // Then
            assertTrue(instance.getId().startsWith("wf_"));
            assertEquals("document_review", instance.getWorkflowId());
            assertEquals("1.0.0", instance.getVersion());
            assertEquals(KeystoneDefinitionKind.STATE_MACHINE, instance.getDefinitionKind());
            assertEquals("draft", instance.getCurrentState());
            assertEquals(KeystoneWorkflowStatus.PENDING, instance.getStatus());
            assertEquals("Q1 report", instance.getData().get("title"));
            assertEquals(NOW, instance.getCreatedAt());
            assertTrue(instance.getHistory().isEmpty());
            assertTrue(calls.isEmpty());
        }

        @Test
        @DisplayName("should run initial onEnter actions on start")
        void shouldRunInitialOnEnterOnStart() {
            // Given
            KeystoneWorkflowInstance instance = engine.createInstance(definition, null, "alice");

            // When
            StepVerifier.create(engine.startInstance(instance, definition))
                    .assertNext(started -> {
                        assertEquals(KeystoneWorkflowStatus.RUNNING, started.getStatus());
                        assertEquals(NOW, started.getStartedAt());
                    })
                    .verifyComplete();

            // Then
            assertEquals(List.of("enterDraft"), calls);
        }

        @Test
        @DisplayName("should reject starting an instance twice")
        void shouldRejectSecondStart() {
            // Given
            KeystoneWorkflowInstance instance = startedInstance(null);

            // When / Then
            StepVerifier.create(engine.startInstance(instance, definition))
                    .expectError(InvalidLifecycleException.class)
                    .verify();
            assertTrue(calls.isEmpty());
        }

        @Test
        @DisplayName("should complete immediately when the initial state is final")
        void shouldCompleteWhenInitialStateIsFinal() {
            // Given
            KeystoneWorkflowDefinition single = KeystoneWorkflowDefinition.builder()
                    .id("noop")
                    .name("Noop")
                    .version("1.0.0")
                    .initialState("done")
                    .state("done", KeystoneStateConfig.builder().name("done").initial(true).finalState(true).build())
                    .build();
            KeystoneWorkflowInstance instance = engine.createInstance(single, null, "alice");

            // When
            KeystoneWorkflowInstance started = engine.startInstance(instance, single).block();

            // Then
            assertEquals(KeystoneWorkflowStatus.COMPLETED, started.getStatus());
            assertEquals(NOW, started.getCompletedAt());
        }
    }

    // ========================================================================
    // TRANSITION TESTS
    // ========================================================================

    @Nested
    @DisplayName("Transition Execution")
    class TransitionTests {

        @Test
        @DisplayName("should run guards, onExit, transition actions and onEnter in order")
        void shouldRunHooksInOrder() {
            // Given
            KeystoneWorkflowInstance instance = startedInstance(Map.of("complete", true));

            // When
            engine.executeTransition(instance, definition, "submit", "alice", Map.of("comment", "ready")).block();

            // Then
            assertEquals(List.of("guard:canSubmit", "exitDraft", "notifyReviewer", "enterReview"), calls);
            assertEquals("review", instance.getCurrentState());
            assertEquals(KeystoneWorkflowStatus.RUNNING, instance.getStatus());

            assertEquals(1, instance.getHistory().size());
            KeystoneStateHistoryEntry entry = instance.getHistory().get(0);
            assertEquals("draft", entry.getFromState());
            assertEquals("review", entry.getToState());
            assertEquals("submit", entry.getTransition());
            assertEquals("alice", entry.getTriggeredBy());
            assertEquals(NOW, entry.getTimestamp());
            assertEquals("ready", entry.getData().get("comment"));
        }

        @Test
        @DisplayName("should move state before onEnter actions run")
        void shouldMoveStateBeforeOnEnter() {
            // Given
            engine.registerAction("enterReview", (context, params) -> Mono.fromRunnable(() ->
                    context.setData("enteredIn", context.getInstance().getCurrentState())));
            KeystoneWorkflowInstance instance = startedInstance(Map.of("complete", true));

            // When
            engine.executeTransition(instance, definition, "submit").block();

            // Then
            assertEquals("review", instance.getData().get("enteredIn"));
        }

        @Test
        @DisplayName("should block transition and run no actions when a guard returns false")
        void shouldBlockWhenGuardFails() {
            // Given
            KeystoneWorkflowInstance instance = startedInstance(Map.of("complete", false));

            // When / Then
            StepVerifier.create(engine.executeTransition(instance, definition, "submit"))
                    .expectErrorSatisfies(error -> {
                        GuardRejectedException rejected = assertInstanceOf(GuardRejectedException.class, error);
                        assertEquals("canSubmit", rejected.getGuardName());
                        assertFalse(rejected.isUnresolved());
                    })
                    .verify();

            assertEquals(List.of("guard:canSubmit"), calls);
            assertEquals("draft", instance.getCurrentState());
            assertTrue(instance.getHistory().isEmpty());
        }

        @Test
        @DisplayName("should treat an unregistered guard as failing")
        void shouldFailClosedOnUnregisteredGuard() {
            // Given
            KeystoneWorkflowInstance instance = startedInstance(Map.of("complete", true));
            engine.executeTransition(instance, definition, "submit").block();
            calls.clear();

            // When / Then
            StepVerifier.create(engine.executeTransition(instance, definition, "escalate"))
                    .expectErrorSatisfies(error -> {
                        GuardRejectedException rejected = assertInstanceOf(GuardRejectedException.class, error);
                        assertEquals("isDirector", rejected.getGuardName());
                        assertTrue(rejected.isUnresolved());
                    })
                    .verify();
            assertEquals("review", instance.getCurrentState());
            assertTrue(calls.isEmpty());
        }

        @Test
        @DisplayName("should skip unregistered actions")
        void shouldSkipUnregisteredActions() {
            // Given
            KeystoneWorkflowDefinition withMissingAction = definition.toBuilder()
                    .state("draft", definition.getStates().get("draft").toBuilder()
                            .onExitAction(KeystoneHookReference.named("sendEmail"))
                            .build())
                    .build();
            KeystoneWorkflowInstance instance = engine.createInstance(withMissingAction, Map.of("complete", true), "alice");
            engine.startInstance(instance, withMissingAction).block();

            // When
            engine.executeTransition(instance, withMissingAction, "submit").block();

            // Then
            assertEquals("review", instance.getCurrentState());
        }

        @Test
        @DisplayName("should pass inline reference params to the hook")
        void shouldPassInlineParams() {
            // Given
            engine.registerGuard("minAmount", (context, params) ->
                    Mono.just(((Number) context.getData("amount")).intValue() >= ((Number) params.get("value")).intValue()));
            KeystoneWorkflowDefinition inline = definition.toBuilder()
                    .state("draft", definition.getStates().get("draft").toBuilder()
                            .clearTransitions()
                            .transition("submit", KeystoneTransitionConfig.builder()
                                    .target("review")
                                    .guard(KeystoneHookReference.inline("minAmount", Map.of("value", 100)))
                                    .build())
                            .build())
                    .build();
            KeystoneWorkflowInstance small = engine.createInstance(inline, Map.of("amount", 50), "alice");
            KeystoneWorkflowInstance large = engine.createInstance(inline, Map.of("amount", 150), "alice");
            engine.startInstance(small, inline).block();
            engine.startInstance(large, inline).block();

            // When / Then
            StepVerifier.create(engine.executeTransition(small, inline, "submit"))
                    .expectError(GuardRejectedException.class)
                    .verify();
            StepVerifier.create(engine.executeTransition(large, inline, "submit"))
                    .assertNext(moved -> assertEquals("review", moved.getCurrentState()))
                    .verifyComplete();
        }

        @Test
        @DisplayName("should fail on a transition the current state does not declare")
        void shouldFailOnUnknownTransition() {
            // Given
            KeystoneWorkflowInstance instance = startedInstance(null);

            // When / Then
            StepVerifier.create(engine.executeTransition(instance, definition, "approve"))
                    .expectError(UnknownTransitionException.class)
                    .verify();
            assertEquals("draft", instance.getCurrentState());
        }

        @Test
        @DisplayName("should propagate an action error and keep the source state")
        void shouldPropagateActionError() {
            // Given
            engine.registerAction("notifyReviewer", (context, params) -> Mono.error(new IllegalStateException("mail down")));
            KeystoneWorkflowInstance instance = startedInstance(Map.of("complete", true));

            // When / Then
            StepVerifier.create(engine.executeTransition(instance, definition, "submit"))
                    .expectErrorMessage("mail down")
                    .verify();
            assertEquals("draft", instance.getCurrentState());
            assertTrue(instance.getHistory().isEmpty());
            assertEquals(List.of("guard:canSubmit", "exitDraft"), calls);
        }

        @Test
        @DisplayName("should complete when a final state is reached")
        void shouldCompleteOnFinalState() {
            // Given
            KeystoneWorkflowInstance instance = startedInstance(Map.of("complete", true));
            engine.executeTransition(instance, definition, "submit", "alice", null).block();

            // When
            engine.executeTransition(instance, definition, "approve", "bob", null).block();

            // Then
            assertEquals("approved", instance.getCurrentState());
            assertEquals(KeystoneWorkflowStatus.COMPLETED, instance.getStatus());
            assertEquals("bob", instance.getCompletedBy());
            assertEquals(NOW, instance.getCompletedAt());
            assertEquals(2, instance.getHistory().size());
        }

        @Test
        @DisplayName("should refuse transitions on a terminal instance without touching history")
        void shouldRefuseTransitionsWhenTerminal() {
            // Given
            KeystoneWorkflowInstance instance = startedInstance(Map.of("complete", true));
            engine.executeTransition(instance, definition, "submit").block();
            engine.executeTransition(instance, definition, "reject").block();
            calls.clear();

            // When / Then
            StepVerifier.create(engine.executeTransition(instance, definition, "approve"))
                    .expectErrorSatisfies(error -> {
                        InvalidLifecycleException invalid = assertInstanceOf(InvalidLifecycleException.class, error);
                        assertEquals(KeystoneWorkflowStatus.COMPLETED, invalid.getStatus());
                    })
                    .verify();
            assertEquals(2, instance.getHistory().size());
            assertTrue(calls.isEmpty());
        }

        @Test
        @DisplayName("should refuse transitions on a pending instance")
        void shouldRefuseTransitionsWhenPending() {
            // Given
            KeystoneWorkflowInstance instance = engine.createInstance(definition, Map.of("complete", true), "alice");

            // When / Then
            StepVerifier.create(engine.executeTransition(instance, definition, "submit"))
                    .expectError(InvalidLifecycleException.class)
                    .verify();
        }
    }

    // ========================================================================
    // ABORT TESTS
    // ========================================================================

    @Nested
    @DisplayName("Abort")
    class AbortTests {

        @Test
        @DisplayName("should run onExit of the current state before aborting")
        void shouldRunOnExitBeforeAbort() {
            // Given
            List<KeystoneWorkflowStatus> statusDuringExit = new CopyOnWriteArrayList<>();
            engine.registerAction("exitDraft", (context, params) -> Mono.fromRunnable(() ->
                    statusDuringExit.add(context.getInstance().getStatus())));
            KeystoneWorkflowInstance instance = startedInstance(null);

            // When
            engine.abortInstance(instance, definition, "admin").block();

            // Then
            assertEquals(List.of(KeystoneWorkflowStatus.RUNNING), statusDuringExit);
            assertEquals(KeystoneWorkflowStatus.ABORTED, instance.getStatus());
            assertEquals(NOW, instance.getAbortedAt());
            assertEquals("admin", instance.getCompletedBy());
            assertEquals("draft", instance.getCurrentState());
        }

        @Test
        @DisplayName("should refuse to abort a terminal instance")
        void shouldRefuseAbortWhenTerminal() {
            // Given
            KeystoneWorkflowInstance instance = startedInstance(null);
            engine.abortInstance(instance, definition, "admin").block();

            // When / Then
            StepVerifier.create(engine.abortInstance(instance, definition, "admin"))
                    .expectError(InvalidLifecycleException.class)
                    .verify();
            StepVerifier.create(engine.executeTransition(instance, definition, "submit"))
                    .expectError(InvalidLifecycleException.class)
                    .verify();
        }
    }

    // ========================================================================
    // INTROSPECTION TESTS
    // ========================================================================

    @Nested
    @DisplayName("Introspection")
    class IntrospectionTests {

        @Test
        @DisplayName("should list transitions of the current state in declaration order")
        void shouldListAvailableTransitions() {
            // Given
            KeystoneWorkflowInstance instance = startedInstance(Map.of("complete", true));
            engine.executeTransition(instance, definition, "submit").block();

            // When
            List<String> transitions = engine.getAvailableTransitions(instance, definition);

            // Then
            assertEquals(List.of("approve", "reject", "escalate"), transitions);
        }

        @Test
        @DisplayName("should evaluate guards without running actions")
        void shouldEvaluateGuardsOnly() {
            // Given
            KeystoneWorkflowInstance ready = startedInstance(Map.of("complete", true));
            KeystoneWorkflowInstance notReady = startedInstance(Map.of("complete", false));

            // When / Then
            assertTrue(engine.canExecuteTransition(ready, definition, "submit").block());
            assertFalse(engine.canExecuteTransition(notReady, definition, "submit").block());
            assertFalse(engine.canExecuteTransition(ready, definition, "approve").block());
            assertFalse(calls.contains("exitDraft"));
            assertEquals("draft", ready.getCurrentState());
        }

        @Test
        @DisplayName("should report guards and actions without a registration")
        void shouldFindUnresolvedReferences() {
            // When
            List<String> unresolved = engine.findUnresolvedReferences(definition);

            // Then
            assertEquals(List.of("guard \"isDirector\" in transition \"escalate\" of state \"review\""), unresolved);
        }
    }
}
