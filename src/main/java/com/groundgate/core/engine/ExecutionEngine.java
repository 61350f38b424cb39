package com.groundgate.core.engine;

import com.groundgate.core.budget.BudgetDecision;
import com.groundgate.core.budget.BudgetPolicy;
import com.groundgate.core.budget.BudgetSpec;
import com.groundgate.core.budget.BudgetTracker;
import com.groundgate.core.citation.CitationValidator;
import com.groundgate.core.events.EventBus;
import com.groundgate.core.events.GroundgateEvent;
import com.groundgate.core.evidence.EvidenceStore;
import com.groundgate.core.logging.MdcContext;
import com.groundgate.core.metrics.GroundgateMetrics;
import com.groundgate.core.model.AgentResult;
import com.groundgate.core.model.Citation;
import com.groundgate.core.model.EvaluationResult;
import com.groundgate.core.model.FailCode;
import com.groundgate.core.model.FailReason;
import com.groundgate.core.model.HistoryEvent;
import com.groundgate.core.model.Remediation;
import com.groundgate.core.model.ResolvedStatus;
import com.groundgate.core.model.RetryDecision;
import com.groundgate.core.model.Task;
import com.groundgate.core.model.TaskStatus;
import com.groundgate.core.model.VerifyResult;
import com.groundgate.core.qualitygate.FailReasonFormatter;
import com.groundgate.core.qualitygate.QualityGateVerifier;
import com.groundgate.core.retry.RetryManager;
import com.groundgate.core.retry.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Plans a root task and runs its subtasks one after another, deciding each subtask's
 * outcome from objective checks rather than from what the agent reports.
 * <p>
 * Per subtask: PENDING → RUNNING, then repeated attempts of
 * Router → {@link StatusResolver} → {@link QualityGateVerifier} → optional {@link Evaluator},
 * bounded by the {@link RetryPolicy}, the {@link RetryManager} cost ledger and the run's
 * {@link BudgetSpec}. The subtask ends DONE or FAILED with a {@code complete} history event.
 * Once a subtask fails, the remaining pending subtasks are BLOCKED.
 * <p>
 * Validation problems are recorded as status and warnings. Only Router failures and
 * programming errors escape as exceptions. One engine serves one run at a time.
 */
public class ExecutionEngine {

    private static final Logger log = LoggerFactory.getLogger(ExecutionEngine.class);

    static final String STOP_PASSED = "passed";
    static final String STOP_BUDGET = "budget_retry_blocked";
    static final String STOP_COST = "cost_limit_reached";
    static final String STOP_ROUTER = "router_failure";
    static final String STOP_INTERRUPTED = "interrupted";
    static final String STOP_ERROR = "engine_error";

    private final Planner planner;
    private final Router router;
    private final EvidenceStore evidenceStore;
    private final StatusResolver statusResolver;
    private final QualityGateVerifier verifier;
    private final RetryPolicy retryPolicy;
    private final RetryManager retryManager;
    private final BudgetSpec budgetSpec;
    private final BudgetPolicy budgetPolicy;
    private final Evaluator evaluator;
    private final EventBus eventBus;
    private final GroundgateMetrics metrics;

    private BudgetTracker tracker = new BudgetTracker();

    private ExecutionEngine(Builder builder) {
        this.planner = Objects.requireNonNull(builder.planner, "planner");
        this.router = Objects.requireNonNull(builder.router, "router");
        this.evidenceStore = Objects.requireNonNull(builder.evidenceStore, "evidenceStore");
        CitationValidator validator = builder.citationValidator != null
                ? builder.citationValidator
                : new CitationValidator(evidenceStore);
        this.statusResolver = new StatusResolver(validator);
        this.verifier = builder.verifier != null ? builder.verifier : new QualityGateVerifier();
        this.retryPolicy = builder.retryPolicy != null ? builder.retryPolicy : new RetryPolicy(1);
        this.retryManager = builder.retryManager != null ? builder.retryManager : new RetryManager(3, 10.0);
        this.budgetSpec = builder.budgetSpec != null ? builder.budgetSpec : BudgetSpec.defaults();
        this.budgetPolicy = new BudgetPolicy();
        this.evaluator = builder.evaluator;
        this.eventBus = builder.eventBus;
        this.metrics = builder.metrics;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Plans {@code root} and executes its subtasks in order.
     *
     * @return the subtasks the planner returned, in order, with final statuses and history
     * @throws RouterException if the Router keeps failing for a subtask
     */
    public List<Task> run(Task root) {
        MdcContext.setRun(root.id());
        try {
            tracker = new BudgetTracker();
            retryManager.reset();
            tracker.log("run_start", Map.of("task_id", root.id()));
            log.info("Starting run {} ({})", root.id(), root.category());
            publish("run.started", root, null, Map.of("category", root.category().name()));

            List<Task> subtasks = planner.plan(root);
            var executed = new ArrayList<Task>();
            Task failed = null;

            for (Task subtask : subtasks) {
                if (failed != null) {
                    block(root, subtask, failed);
                    executed.add(subtask);
                    continue;
                }
                if (subtask.status() != TaskStatus.PENDING) {
                    log.warn("Skipping subtask {}: already {}", subtask.id(), subtask.status());
                    executed.add(subtask);
                    continue;
                }
                executeSubtask(root, subtask);
                executed.add(subtask);
                if (subtask.status() == TaskStatus.FAILED) {
                    failed = subtask;
                }
            }

            tracker.log("run_end", Map.of("task_id", root.id(), "failed", failed != null));
            publish("run.completed", root, null, Map.of(
                    "subtasks", executed.size(),
                    "failed", failed != null ? failed.id() : "",
                    "budget", tracker.toSummary(budgetSpec)));
            return executed;
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Runs {@code root} and returns the final subtask's answer. When the run degraded
     * because of its budget, a short budget note is appended.
     */
    public String runAndGetAnswer(Task root) {
        List<Task> executed = run(root);
        if (executed.isEmpty()) {
            return "";
        }

        Task last = executed.get(executed.size() - 1);
        String answer = "";
        List<HistoryEvent> history = last.history();
        for (int i = history.size() - 1; i >= 0; i--) {
            HistoryEvent event = history.get(i);
            Object value = event.payload().get("answer");
            if ("complete".equals(event.event()) && value != null && !value.toString().isEmpty()) {
                answer = value.toString();
                break;
            }
        }

        if (tracker.degraded()) {
            answer += "\n\n---\n**Budget**: " + tracker.toolCalls() + " tool calls, degraded due to: "
                    + String.join(", ", tracker.degradeReasons());
        }
        return answer;
    }

    /** Budget tracker of the current or most recent run. */
    public BudgetTracker budgetTracker() {
        return tracker;
    }

    public RetryManager retryManager() {
        return retryManager;
    }

    private void executeSubtask(Task root, Task task) {
        MdcContext.setTask(root.id(), task.id());
        task.transitionTo(TaskStatus.RUNNING);
        task.appendHistory("start", Map.of("category", task.category().name(), "priority", task.priority()));
        publish("task.started", root, task, Map.of("category", task.category().name()));
        log.info("Running task {}: {}", task.id(), task.title());

        int attempt = 1;
        boolean inRouter = false;
        try {
            List<String> changes = List.of();
            int previousProblems = Integer.MAX_VALUE;
            AttemptOutcome outcome;
            String stopReason;

            while (true) {
                MdcContext.setAttempt(attempt);
                long started = System.nanoTime();

                inRouter = true;
                AgentResult result = callRouter(task);
                inRouter = false;
                long elapsedMs = (System.nanoTime() - started) / 1_000_000;

                outcome = evaluateAttempt(result);
                int problems = outcome.problemCount();
                boolean improved = attempt > 1 && problems < previousProblems;
                previousProblems = problems;
                retryManager.recordAttempt(attempt, changes, improved, result.meta().cost(), elapsedMs);
                recordAttemptMetrics(outcome, elapsedMs, result.meta().cost());

                if (outcome.evaluation().ok()) {
                    stopReason = STOP_PASSED;
                    break;
                }

                Optional<String> blocked = retryBlockReason(outcome, attempt);
                if (blocked.isPresent()) {
                    stopReason = blocked.get();
                    break;
                }

                List<Remediation> remediations = retryManager.remediationsFor(outcome.verify().failCodes());
                changes = remediations.stream().map(Remediation::action).toList();
                var payload = new LinkedHashMap<String, Object>();
                payload.put("attempt", attempt);
                payload.put("reason", RetryDecision.VALIDATION_FAILED);
                payload.put("agent_status", outcome.resolution().status().wireName());
                payload.put("quality_warnings", outcome.resolution().warnings());
                payload.put("fail_codes", outcome.verify().failCodes().stream().map(Enum::name).toList());
                payload.put("errors", outcome.evaluation().errors());
                payload.put("remediation", changes);
                task.appendHistory("retry", payload);
                publish("task.retry", root, task, payload);
                log.info("Retrying task {} after attempt {}: {} (remediation {})",
                        task.id(), attempt, outcome.evaluation().errors(), changes);

                tracker.recordRetry();
                if (metrics != null) {
                    metrics.recordRetry(RetryDecision.VALIDATION_FAILED);
                }
                retryPolicy.backoff(attempt);
                attempt++;
            }

            finish(root, task, outcome, attempt, stopReason);
        } catch (RuntimeException e) {
            if (task.status() == TaskStatus.RUNNING) {
                failOnInfrastructure(root, task, attempt, e, stopReasonFor(e, inRouter));
            }
            throw e;
        }
        MdcContext.clearTask();
    }

    private static String stopReasonFor(RuntimeException e, boolean inRouter) {
        if (e.getCause() instanceof InterruptedException) {
            return STOP_INTERRUPTED;
        }
        return inRouter ? STOP_ROUTER : STOP_ERROR;
    }

    private AgentResult callRouter(Task task) {
        AgentResult result;
        try {
            result = retryPolicy.execute(() -> {
                tracker.recordToolCall();
                return router.run(task);
            });
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new RouterException("Router failed for task " + task.id() + ": " + e.getMessage(), e);
        }
        if (result == null) {
            throw new RouterException("Router returned no result for task " + task.id());
        }
        return result;
    }

    AttemptOutcome evaluateAttempt(AgentResult result) {
        StatusResolution resolution = statusResolver.resolve(result);
        AgentResult validated = result.withCitations(resolution.validCitations());

        VerifyResult verify = resolution.status() == ResolvedStatus.FAIL
                ? verifier.unverifiedResult()
                : verifier.verify(validated.answer(), resolution.validCitations(),
                        result.meta().claims(), result.meta().evidence());

        EvaluationResult evaluation = objectiveEvaluation(resolution, verify);
        if (evaluator != null) {
            EvaluationResult hosted = evaluator.evaluate(validated);
            if (hosted != null && !hosted.ok() && hosted.errors().isEmpty()) {
                hosted = EvaluationResult.failed(List.of("evaluator_rejected"));
            }
            evaluation = evaluation.and(hosted);
        }
        return new AttemptOutcome(validated, resolution, verify, evaluation);
    }

    private static EvaluationResult objectiveEvaluation(StatusResolution resolution, VerifyResult verify) {
        var errors = new ArrayList<String>();
        if (resolution.status() == ResolvedStatus.FAIL) {
            errors.addAll(resolution.warnings());
        }
        for (FailReason reason : verify.errors()) {
            errors.add(reason.code().name() + ": " + reason.message());
        }
        boolean ok = resolution.status() != ResolvedStatus.FAIL && verify.gatePassed();
        return new EvaluationResult(ok, errors);
    }

    private Optional<String> retryBlockReason(AttemptOutcome outcome, int attempt) {
        RetryDecision decision = retryPolicy.decide(outcome.evaluation(), attempt);
        if (!decision.shouldRetry()) {
            return Optional.of(decision.reason());
        }

        VerifyResult verify = outcome.verify();
        if (verify.verified() && !verify.gatePassed()) {
            Optional<String> blocked = retryManager.blockReason(verify.failCodes(), attempt);
            if (blocked.isPresent()) {
                return blocked;
            }
        } else if (!retryManager.withinCostLimit()) {
            return Optional.of(STOP_COST);
        }

        BudgetDecision budget = budgetPolicy.decide(budgetSpec, tracker);
        if (!budget.allowRetry()) {
            tracker.recordDegrade(STOP_BUDGET);
            log.info("Budget blocked retry: {}", budget.degradeReason());
            return Optional.of(STOP_BUDGET + ":" + budget.degradeReason());
        }
        return Optional.empty();
    }

    private void finish(Task root, Task task, AttemptOutcome outcome, int attempts, String stopReason) {
        boolean ok = outcome.evaluation().ok();
        var failReasons = new ArrayList<>(outcome.verify().failReasons());
        if (stopReason.startsWith(STOP_BUDGET)) {
            failReasons.add(FailReason.error(FailCode.BUDGET_EXCEEDED,
                    "Retry blocked by run budget (" + stopReason.substring(STOP_BUDGET.length() + 1) + ")"));
        }
        if (!ok && evidenceStore.isEmpty()) {
            failReasons.add(FailReason.error(FailCode.INDEX_MISSING, "Evidence store holds no chunks."));
        }

        TaskStatus finalStatus = ok ? TaskStatus.DONE : TaskStatus.FAILED;
        task.transitionTo(finalStatus);

        var payload = new LinkedHashMap<String, Object>();
        payload.put("agent_status", outcome.resolution().status().wireName());
        payload.put("proposed_status", outcome.result().proposedStatus().name().toLowerCase(Locale.ROOT));
        payload.put("quality_warnings", outcome.resolution().warnings());
        payload.put("fail_reasons", failReasons.stream().map(FailReason::toMap).toList());
        payload.put("gate_passed", outcome.verify().gatePassed());
        payload.put("verified", outcome.verify().verified());
        payload.put("metrics", outcome.verify().metrics());
        payload.put("evaluation_errors", outcome.evaluation().errors());
        payload.put("attempts", attempts);
        payload.put("stop_reason", stopReason);
        payload.put("answer", outcome.result().answer() == null ? "" : outcome.result().answer());
        payload.put("citations", outcome.result().citations().stream().map(Citation::chunkId).toList());
        payload.put("retry_cost", retryManager.totalCost());
        task.appendHistory("complete", payload);

        if (ok) {
            log.info("Task {} DONE after {} attempt(s) ({})", task.id(), attempts,
                    outcome.resolution().status());
        } else {
            log.warn("Task {} FAILED after {} attempt(s), stop={}\n{}", task.id(), attempts,
                    stopReason, FailReasonFormatter.format(failReasons));
        }
        publish(ok ? "task.completed" : "task.failed", root, task, Map.of(
                "agent_status", outcome.resolution().status().wireName(),
                "attempts", attempts,
                "stop_reason", stopReason));
        if (metrics != null) {
            metrics.recordTaskResult(finalStatus.name());
            metrics.recordAttemptsPerTask(attempts);
        }
    }

    private void failOnInfrastructure(Task root, Task task, int attempt, RuntimeException e, String stopReason) {
        log.error("Task {} aborted at attempt {} ({}): {}", task.id(), attempt, stopReason, e.getMessage(), e);
        task.transitionTo(TaskStatus.FAILED);

        var payload = new LinkedHashMap<String, Object>();
        payload.put("agent_status", null);
        payload.put("fail_reasons", STOP_ROUTER.equals(stopReason)
                ? List.of(FailReason.error(FailCode.FETCH_FAIL, String.valueOf(e.getMessage())).toMap())
                : List.of());
        payload.put("gate_passed", false);
        payload.put("verified", false);
        payload.put("attempts", attempt);
        payload.put("stop_reason", stopReason);
        payload.put("error", String.valueOf(e.getMessage()));
        task.appendHistory("complete", payload);

        publish("task.failed", root, task, Map.of("stop_reason", stopReason, "attempts", attempt));
        if (metrics != null) {
            metrics.recordTaskResult(TaskStatus.FAILED.name());
        }
        MdcContext.clearTask();
    }

    private void block(Task root, Task task, Task failed) {
        if (task.status() != TaskStatus.PENDING) {
            return;
        }
        task.transitionTo(TaskStatus.BLOCKED);
        task.appendHistory("blocked", Map.of("blocked_by", failed.id()));
        log.info("Task {} BLOCKED by failed task {}", task.id(), failed.id());
        publish("task.blocked", root, task, Map.of("blocked_by", failed.id()));
        if (metrics != null) {
            metrics.recordTaskResult(TaskStatus.BLOCKED.name());
        }
    }

    private void recordAttemptMetrics(AttemptOutcome outcome, long elapsedMs, double cost) {
        if (metrics == null) {
            return;
        }
        metrics.recordAttempt(outcome.resolution().status().wireName(), elapsedMs);
        metrics.recordAttemptCost(cost);
        if (outcome.verify().verified()) {
            metrics.recordGateResult(outcome.verify().gatePassed());
        }
        for (FailReason reason : outcome.verify().failReasons()) {
            metrics.recordFailReason(reason.code().name(), reason.severity().wireName());
        }
        for (String warning : outcome.resolution().warnings()) {
            if (warning.equals(CitationValidator.MISSING_CHUNK_ID)) {
                metrics.recordDroppedCitation("missing_chunk_id");
            } else if (warning.startsWith(CitationValidator.NOT_IN_STORE_PREFIX)) {
                metrics.recordDroppedCitation("not_in_store");
            } else if (warning.startsWith(CitationValidator.NOT_RELEVANT_PREFIX)) {
                metrics.recordDroppedCitation("not_relevant");
            }
        }
    }

    private void publish(String type, Task root, Task task, Map<String, Object> payload) {
        if (eventBus == null) {
            return;
        }
        eventBus.publish(GroundgateEvent.of(type, root.id(), task != null ? task.id() : null, payload));
    }

    /**
     * Assembles an engine. Planner, Router and EvidenceStore are required; the rest
     * default to conservative settings (single attempt, default gate rules).
     */
    public static final class Builder {
        private Planner planner = Planner.identity();
        private Router router;
        private EvidenceStore evidenceStore;
        private CitationValidator citationValidator;
        private QualityGateVerifier verifier;
        private RetryPolicy retryPolicy;
        private RetryManager retryManager;
        private BudgetSpec budgetSpec;
        private Evaluator evaluator;
        private EventBus eventBus;
        private GroundgateMetrics metrics;

        private Builder() {}

        public Builder planner(Planner planner) {
            this.planner = planner;
            return this;
        }

        public Builder router(Router router) {
            this.router = router;
            return this;
        }

        public Builder evidenceStore(EvidenceStore evidenceStore) {
            this.evidenceStore = evidenceStore;
            return this;
        }

        public Builder citationValidator(CitationValidator citationValidator) {
            this.citationValidator = citationValidator;
            return this;
        }

        public Builder verifier(QualityGateVerifier verifier) {
            this.verifier = verifier;
            return this;
        }

        public Builder retryPolicy(RetryPolicy retryPolicy) {
            this.retryPolicy = retryPolicy;
            return this;
        }

        public Builder retryManager(RetryManager retryManager) {
            this.retryManager = retryManager;
            return this;
        }

        public Builder budgetSpec(BudgetSpec budgetSpec) {
            this.budgetSpec = budgetSpec;
            return this;
        }

        public Builder evaluator(Evaluator evaluator) {
            this.evaluator = evaluator;
            return this;
        }

        public Builder eventBus(EventBus eventBus) {
            this.eventBus = eventBus;
            return this;
        }

        public Builder metrics(GroundgateMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        public ExecutionEngine build() {
            return new ExecutionEngine(this);
        }
    }
}
