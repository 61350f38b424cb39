package com.groundgate.core.engine;

import com.groundgate.core.budget.BudgetSpec;
import com.groundgate.core.events.EventBus;
import com.groundgate.core.events.GroundgateEvent;
import com.groundgate.core.evidence.EvidenceStore;
import com.groundgate.core.metrics.GroundgateMetrics;
import com.groundgate.core.model.AgentMeta;
import com.groundgate.core.model.AgentResult;
import com.groundgate.core.model.Citation;
import com.groundgate.core.model.EvaluationResult;
import com.groundgate.core.model.HistoryEvent;
import com.groundgate.core.model.ProposedStatus;
import com.groundgate.core.model.Task;
import com.groundgate.core.model.TaskStatus;
import com.groundgate.core.retry.RetryManager;
import com.groundgate.core.retry.RetryPolicy;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ExecutionEngineTest {

    private static final String ANSWER = "CD73 is expressed on T cells";

    private EvidenceStore store;
    private String chunkId;
    private Router router;
    private RetryPolicy noWaitPolicy;

    @BeforeEach
    void setUp() {
        store = new EvidenceStore();
        chunkId = store.addChunk("paper-1", "section:Results;page:4", "CD73 is expressed on regulatory T cells.");
        router = mock(Router.class);
        noWaitPolicy = new RetryPolicy(3, Duration.ZERO, Duration.ZERO, false, new Random(), d -> {});
    }

    private ExecutionEngine.Builder engine() {
        return ExecutionEngine.builder()
                .router(router)
                .evidenceStore(store)
                .retryPolicy(noWaitPolicy)
                .retryManager(new RetryManager(3, 10.0));
    }

    private AgentResult grounded() {
        return new AgentResult(ANSWER, List.of(Citation.of(chunkId)), ProposedStatus.SUCCESS, null);
    }

    private static AgentResult uncited() {
        return new AgentResult(ANSWER, List.of(), ProposedStatus.SUCCESS, null);
    }

    private static HistoryEvent complete(Task task) {
        var history = task.history();
        HistoryEvent last = history.get(history.size() - 1);
        assertEquals("complete", last.event());
        return last;
    }

    @SuppressWarnings("unchecked")
    private static List<String> failCodes(HistoryEvent complete) {
        var reasons = (List<Map<String, Object>>) complete.payload().get("fail_reasons");
        return reasons.stream().map(r -> (String) r.get("code")).toList();
    }

    @Nested
    @DisplayName("single subtask")
    class SingleSubtaskTests {

        @Test
        @DisplayName("grounded answer completes on the first attempt")
        void groundedAnswer() {
            when(router.run(any())).thenReturn(grounded());
            var task = Task.generic("t-1", "Where is CD73 expressed?");

            var executed = engine().build().run(task);

            assertEquals(List.of(task), executed);
            assertEquals(TaskStatus.DONE, task.status());
            var payload = complete(task).payload();
            assertEquals("success", payload.get("agent_status"));
            assertEquals(true, payload.get("gate_passed"));
            assertEquals(1, payload.get("attempts"));
            assertEquals(ExecutionEngine.STOP_PASSED, payload.get("stop_reason"));
            assertEquals(List.of(chunkId), payload.get("citations"));
            assertEquals(ANSWER, payload.get("answer"));
        }

        @Test
        @DisplayName("empty answer fails with empty_answer and is never marked verified")
        void emptyAnswer() {
            when(router.run(any())).thenReturn(new AgentResult("", List.of(), ProposedStatus.SUCCESS, null));
            var task = Task.generic("t-1", "q");

            engine().build().run(task);

            assertEquals(TaskStatus.FAILED, task.status());
            var payload = complete(task).payload();
            assertEquals("fail", payload.get("agent_status"));
            assertEquals(List.of("empty_answer"), payload.get("quality_warnings"));
            assertEquals(false, payload.get("verified"));
            assertTrue(failCodes(complete(task)).contains("VERIFY_NOT_RUN"));
            assertEquals(3, payload.get("attempts"));
            verify(router, times(3)).run(task);
        }

        @Test
        @DisplayName("retryable gate failure is retried with a remediation")
        void retriesRetryable() {
            when(router.run(any())).thenReturn(uncited(), grounded());
            var task = Task.generic("t-1", "q");

            engine().build().run(task);

            assertEquals(TaskStatus.DONE, task.status());
            var retry = task.history().stream().filter(e -> e.event().equals("retry")).toList();
            assertEquals(1, retry.size());
            assertEquals(List.of("add_search"), retry.get(0).payload().get("remediation"));
            assertEquals(List.of("CITATION_MISSING"), retry.get(0).payload().get("fail_codes"));
            assertEquals(2, complete(task).payload().get("attempts"));
        }

        @Test
        @DisplayName("PII ends the task without retry")
        void piiIsTerminal() {
            when(router.run(any())).thenReturn(new AgentResult(ANSWER + "; contact lab@example.org",
                    List.of(Citation.of(chunkId)), ProposedStatus.SUCCESS, null));
            var task = Task.generic("t-1", "q");

            engine().build().run(task);

            assertEquals(TaskStatus.FAILED, task.status());
            var complete = complete(task);
            assertEquals(List.of("PII_DETECTED"), failCodes(complete));
            assertEquals("non_retryable:[PII_DETECTED]", complete.payload().get("stop_reason"));
            verify(router, times(1)).run(task);
        }

        @Test
        @DisplayName("cost limit stops further attempts")
        void costLimit() {
            when(router.run(any())).thenReturn(new AgentResult(ANSWER, List.of(), ProposedStatus.SUCCESS,
                    AgentMeta.withCost("researcher", 6.0)));
            var task = Task.generic("t-1", "q");

            var engine = engine().retryManager(new RetryManager(3, 5.0)).build();
            engine.run(task);

            assertEquals(TaskStatus.FAILED, task.status());
            assertEquals("cost_limit_reached", complete(task).payload().get("stop_reason"));
            assertEquals(6.0, engine.retryManager().totalCost(), 1e-9);
        }

        @Test
        @DisplayName("each run starts with an empty retry ledger")
        void ledgerPerRun() {
            when(router.run(any())).thenReturn(new AgentResult(ANSWER, List.of(Citation.of(chunkId)),
                    ProposedStatus.SUCCESS, AgentMeta.withCost("researcher", 2.0)));
            var engine = engine().build();

            engine.run(Task.generic("t-1", "q"));
            engine.run(Task.generic("t-2", "q"));

            assertEquals(2.0, engine.retryManager().totalCost(), 1e-9);
            assertEquals(1, engine.retryManager().attempts().size());
        }

        @Test
        @DisplayName("agent-reported failure with valid output completes as partial")
        void agentReportedFail() {
            when(router.run(any())).thenReturn(new AgentResult(ANSWER, List.of(Citation.of(chunkId)),
                    ProposedStatus.FAIL, null));
            var task = Task.generic("t-1", "q");

            engine().build().run(task);

            assertEquals(TaskStatus.DONE, task.status());
            assertEquals("partial", complete(task).payload().get("agent_status"));
            assertEquals("fail", complete(task).payload().get("proposed_status"));
        }

        @Test
        @DisplayName("a failed task always carries at least one reason")
        void failedCarriesReason() {
            when(router.run(any())).thenReturn(uncited());
            var task = Task.generic("t-1", "q");

            engine().build().run(task);

            assertEquals(TaskStatus.FAILED, task.status());
            assertFalse(failCodes(complete(task)).isEmpty());
            assertEquals("max_attempts_reached", complete(task).payload().get("stop_reason"));
        }

        @Test
        @DisplayName("empty evidence store adds INDEX_MISSING to a failure")
        void indexMissing() {
            store = new EvidenceStore();
            when(router.run(any())).thenReturn(uncited());
            var task = Task.generic("t-1", "q");

            engine().evidenceStore(store).build().run(task);

            assertTrue(failCodes(complete(task)).contains("INDEX_MISSING"));
        }
    }

    @Nested
    @DisplayName("evaluator")
    class EvaluatorTests {

        @Test
        @DisplayName("host evaluator can veto an otherwise passing attempt")
        void veto() {
            when(router.run(any())).thenReturn(grounded());
            Evaluator evaluator = result -> EvaluationResult.failed(List.of("too_short"));
            var task = Task.generic("t-1", "q");

            engine().evaluator(evaluator).build().run(task);

            assertEquals(TaskStatus.FAILED, task.status());
            assertEquals(List.of("too_short"), complete(task).payload().get("evaluation_errors"));
        }

        @Test
        @DisplayName("evaluator receives validated citations")
        void seesValidatedCitations() {
            when(router.run(any())).thenReturn(new AgentResult(ANSWER,
                    List.of(new Citation(chunkId, "forged", "section:Fake", "forged")), ProposedStatus.SUCCESS, null));
            var seen = new ArrayList<AgentResult>();
            Evaluator evaluator = result -> {
                seen.add(result);
                return EvaluationResult.passed();
            };

            engine().evaluator(evaluator).build().run(Task.generic("t-1", "q"));

            assertEquals("paper-1", seen.get(0).citations().get(0).source());
        }

        @Test
        @DisplayName("a bare rejection is reported as evaluator_rejected")
        void bareRejection() {
            when(router.run(any())).thenReturn(grounded());
            var task = Task.generic("t-1", "q");

            engine().evaluator(result -> new EvaluationResult(false, List.of())).build().run(task);

            assertEquals(List.of("evaluator_rejected"), complete(task).payload().get("evaluation_errors"));
        }
    }

    @Nested
    @DisplayName("multiple subtasks")
    class MultipleSubtaskTests {

        @Test
        @DisplayName("subtasks after a failure are blocked and never routed")
        void blocksAfterFailure() {
            var first = Task.generic("s-1", "first");
            var second = Task.generic("s-2", "second");
            var third = Task.generic("s-3", "third");
            when(router.run(first)).thenReturn(new AgentResult("SSN 123-45-6789 " + ANSWER,
                    List.of(Citation.of(chunkId)), ProposedStatus.SUCCESS, null));

            var executed = engine().planner(root -> List.of(first, second, third)).build()
                    .run(Task.generic("root", "q"));

            assertEquals(List.of(first, second, third), executed);
            assertEquals(TaskStatus.FAILED, first.status());
            assertEquals(TaskStatus.BLOCKED, second.status());
            assertEquals(TaskStatus.BLOCKED, third.status());
            assertEquals(Map.of("blocked_by", "s-1"), second.history().get(0).payload());
            verify(router, never()).run(second);
        }

        @Test
        @DisplayName("runAndGetAnswer returns the last subtask's answer")
        void lastAnswer() {
            var first = Task.generic("s-1", "first");
            var second = Task.generic("s-2", "second");
            when(router.run(first)).thenReturn(grounded());
            when(router.run(second)).thenReturn(new AgentResult("CD73 is expressed on regulatory T cells",
                    List.of(Citation.of(chunkId)), ProposedStatus.SUCCESS, null));

            String answer = engine().planner(root -> List.of(first, second)).build()
                    .runAndGetAnswer(Task.generic("root", "q"));

            assertEquals("CD73 is expressed on regulatory T cells", answer);
        }
    }

    @Nested
    @DisplayName("budget")
    class BudgetTests {

        @Test
        @DisplayName("exhausted tool call budget blocks the retry and is reported")
        void toolCallBudget() {
            when(router.run(any())).thenReturn(uncited());
            var task = Task.generic("t-1", "q");
            var engine = engine().budgetSpec(new BudgetSpec(1, 10)).build();

            String answer = engine.runAndGetAnswer(task);

            assertEquals(TaskStatus.FAILED, task.status());
            assertEquals("budget_retry_blocked:tool_call_limit", complete(task).payload().get("stop_reason"));
            assertTrue(failCodes(complete(task)).contains("BUDGET_EXCEEDED"));
            assertTrue(engine.budgetTracker().degraded());
            assertTrue(answer.startsWith(ANSWER));
            assertTrue(answer.contains("**Budget**: 1 tool calls, degraded due to: budget_retry_blocked"));
        }

        @Test
        @DisplayName("every router call counts as a tool call, transport retries included")
        void transportRetriesCount() {
            when(router.run(any()))
                    .thenThrow(new RouterException("timeout"))
                    .thenThrow(new RouterException("timeout"))
                    .thenReturn(uncited());
            var task = Task.generic("t-1", "q");
            var engine = engine().budgetSpec(new BudgetSpec(1, 10)).build();

            engine.run(task);

            verify(router, times(3)).run(task);
            assertEquals(3, engine.budgetTracker().toolCalls());
            assertEquals("budget_retry_blocked:tool_call_limit", complete(task).payload().get("stop_reason"));
        }
    }

    @Nested
    @DisplayName("router failures")
    class RouterFailureTests {

        @Test
        @DisplayName("persistent router failure fails the task and propagates")
        void propagates() {
            when(router.run(any())).thenThrow(new RouterException("connection refused"));
            var task = Task.generic("t-1", "q");

            var e = assertThrows(RouterException.class, () -> engine().build().run(task));

            assertEquals("connection refused", e.getMessage());
            assertEquals(TaskStatus.FAILED, task.status());
            assertEquals(List.of("FETCH_FAIL"), failCodes(complete(task)));
            assertEquals(ExecutionEngine.STOP_ROUTER, complete(task).payload().get("stop_reason"));
            verify(router, times(3)).run(task);
        }

        @Test
        @DisplayName("transient router failure is absorbed")
        void transientFailure() {
            when(router.run(any())).thenThrow(new RouterException("timeout")).thenReturn(grounded());
            var task = Task.generic("t-1", "q");

            engine().build().run(task);

            assertEquals(TaskStatus.DONE, task.status());
            assertEquals(1, complete(task).payload().get("attempts"));
        }
    }

    @Nested
    @DisplayName("aborted attempts")
    class AbortTests {

        @Test
        @DisplayName("interrupted backoff fails the task before the exception escapes")
        void interruptedBackoff() {
            when(router.run(any())).thenReturn(uncited());
            var interrupting = new RetryPolicy(3, Duration.ofMillis(1), Duration.ofMillis(1), false, new Random(),
                    d -> { throw new InterruptedException(); });
            var task = Task.generic("t-1", "q");

            try {
                assertThrows(IllegalStateException.class,
                        () -> engine().retryPolicy(interrupting).build().run(task));
            } finally {
                Thread.interrupted();
            }

            assertEquals(TaskStatus.FAILED, task.status());
            assertEquals(List.of("start", "retry", "complete"),
                    task.history().stream().map(HistoryEvent::event).toList());
            assertEquals(ExecutionEngine.STOP_INTERRUPTED, complete(task).payload().get("stop_reason"));
            assertEquals(1, complete(task).payload().get("attempts"));
        }

        @Test
        @DisplayName("evaluator exception fails the task and propagates")
        void evaluatorThrows() {
            when(router.run(any())).thenReturn(grounded());
            Evaluator broken = result -> { throw new IllegalArgumentException("bad rubric"); };
            var task = Task.generic("t-1", "q");
            var next = Task.generic("t-2", "q");

            assertThrows(IllegalArgumentException.class,
                    () -> engine().evaluator(broken).planner(root -> List.of(task, next)).build()
                            .run(Task.generic("root", "q")));

            assertEquals(TaskStatus.FAILED, task.status());
            assertEquals(ExecutionEngine.STOP_ERROR, complete(task).payload().get("stop_reason"));
            assertEquals(List.of(), complete(task).payload().get("fail_reasons"));
            assertEquals(TaskStatus.PENDING, next.status());
        }
    }

    @Nested
    @DisplayName("events and metrics")
    class ObservabilityTests {

        @Test
        @DisplayName("publishes lifecycle events in order")
        void events() {
            when(router.run(any())).thenReturn(uncited(), grounded());
            var bus = new EventBus();
            var received = new ArrayList<GroundgateEvent>();
            bus.subscribe("t-1", received::add);

            engine().eventBus(bus).build().run(Task.generic("t-1", "q"));

            assertEquals(List.of("run.started", "task.started", "task.retry", "task.completed", "run.completed"),
                    received.stream().map(GroundgateEvent::eventType).toList());
        }

        @Test
        @DisplayName("records task result and gate meters")
        void metrics() {
            when(router.run(any())).thenReturn(grounded());
            var registry = new SimpleMeterRegistry();

            engine().metrics(new GroundgateMetrics(registry)).build().run(Task.generic("t-1", "q"));

            assertEquals(1.0, registry.find("groundgate.tasks.total").tag("status", "DONE").counter().count());
            assertEquals(1.0, registry.find("groundgate.gate.evaluations").tag("result", "passed").counter().count());
            assertEquals(1, registry.find("groundgate.task.attempts").summary().count());
        }
    }
}
