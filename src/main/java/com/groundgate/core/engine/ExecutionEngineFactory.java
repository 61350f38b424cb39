package com.groundgate.core.engine;

import com.groundgate.core.budget.BudgetSpec;
import com.groundgate.core.citation.CitationValidator;
import com.groundgate.core.config.GroundgateProperties;
import com.groundgate.core.events.EventBus;
import com.groundgate.core.evidence.EvidenceStore;
import com.groundgate.core.metrics.GroundgateMetrics;
import com.groundgate.core.qualitygate.QualityGateVerifier;
import com.groundgate.core.retry.RetryManager;
import com.groundgate.core.retry.RetryPolicy;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Builds one {@link ExecutionEngine} per root task. Engines share the evidence store,
 * validators and retry policy, but each gets its own cost ledger and budget tracker.
 */
@Service
public class ExecutionEngineFactory {

    private final EvidenceStore evidenceStore;
    private final CitationValidator citationValidator;
    private final QualityGateVerifier verifier;
    private final RetryPolicy retryPolicy;
    private final GroundgateProperties properties;
    private final EventBus eventBus;
    private final GroundgateMetrics metrics;

    public ExecutionEngineFactory(EvidenceStore evidenceStore,
                                  CitationValidator citationValidator,
                                  QualityGateVerifier verifier,
                                  RetryPolicy retryPolicy,
                                  GroundgateProperties properties,
                                  @Autowired(required = false) EventBus eventBus,
                                  @Autowired(required = false) GroundgateMetrics metrics) {
        this.evidenceStore = evidenceStore;
        this.citationValidator = citationValidator;
        this.verifier = verifier;
        this.retryPolicy = retryPolicy;
        this.properties = properties;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    public ExecutionEngine create(Planner planner, Router router, Evaluator evaluator) {
        var retry = properties.getRetry();
        var budget = properties.getBudget();
        return ExecutionEngine.builder()
                .planner(planner != null ? planner : Planner.identity())
                .router(router)
                .evidenceStore(evidenceStore)
                .citationValidator(citationValidator)
                .verifier(verifier)
                .retryPolicy(retryPolicy)
                .retryManager(new RetryManager(retry.getMaxAttempts(), retry.getCostLimit()))
                .budgetSpec(new BudgetSpec(budget.getMaxToolCalls(), budget.getMaxRetries()))
                .evaluator(evaluator)
                .eventBus(eventBus)
                .metrics(metrics)
                .build();
    }

    public ExecutionEngine create(Router router) {
        return create(Planner.identity(), router, null);
    }
}
