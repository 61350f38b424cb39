package com.groundgate.integration;

import com.groundgate.core.engine.ExecutionEngineFactory;
import com.groundgate.core.evidence.EvidenceStore;
import com.groundgate.core.events.EventBus;
import com.groundgate.core.events.GroundgateEvent;
import com.groundgate.core.model.AgentResult;
import com.groundgate.core.model.Citation;
import com.groundgate.core.model.ProposedStatus;
import com.groundgate.core.model.Task;
import com.groundgate.core.model.TaskStatus;
import io.micrometer.core.instrument.MeterRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Boots the application context with test properties and runs one task through a
 * factory-built engine.
 */
@SpringBootTest(properties = {
        "groundgate.retry.max-attempts=2",
        "groundgate.retry.base-delay-ms=0",
        "groundgate.retry.max-delay-ms=0"
})
class GroundgateContextTest {

    @Autowired
    private ExecutionEngineFactory engineFactory;

    @Autowired
    private EvidenceStore evidenceStore;

    @Autowired
    private EventBus eventBus;

    @Autowired
    private MeterRegistry meterRegistry;

    @Test
    void factoryBuiltEngineUsesSharedStoreAndReportsEvents() {
        String chunkId = evidenceStore.addChunk("paper-1", "section:Results", "CD73 is expressed on regulatory T cells.");
        var events = new ArrayList<GroundgateEvent>();
        eventBus.subscribe("ctx-1", events::add);

        var engine = engineFactory.create(task -> new AgentResult("CD73 is expressed on T cells",
                List.of(Citation.of(chunkId)), ProposedStatus.SUCCESS, null));
        var task = Task.generic("ctx-1", "Where is CD73 expressed?");
        engine.run(task);

        assertEquals(TaskStatus.DONE, task.status());
        assertFalse(events.isEmpty());
        assertNotNull(meterRegistry.find("groundgate.tasks.total").tag("status", "DONE").counter());
    }

    @Test
    void retryLimitComesFromProperties() {
        var engine = engineFactory.create(task -> new AgentResult("", List.of(), ProposedStatus.SUCCESS, null));
        var task = Task.generic("ctx-2", "q");

        engine.run(task);

        assertEquals(TaskStatus.FAILED, task.status());
        assertEquals(2, task.history().get(task.history().size() - 1).payload().get("attempts"));
    }
}
