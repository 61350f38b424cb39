package com.groundgate.dispatch.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.groundgate.core.citation.CitationValidation;
import com.groundgate.core.citation.CitationValidator;
import com.groundgate.core.evidence.EvidenceStore;
import com.groundgate.core.logging.MdcContext;
import com.groundgate.core.metrics.GroundgateMetrics;
import com.groundgate.core.model.FailReason;
import com.groundgate.core.model.VerifyResult;
import com.groundgate.core.qualitygate.QualityGateVerifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.UUID;
import java.util.concurrent.Callable;

/**
 * CLI command: groundgate verify &lt;bundle.json&gt; [--json] [--run-id ID]
 * <p>
 * Ingests the bundle's chunks into the evidence store, validates the citations against
 * them and runs the quality gate over the answer. Exits 0 when the gate passes,
 * 1 when it fails and 2 when the bundle cannot be read.
 */
@Command(name = "verify", mixinStandardHelpOptions = true,
        description = "Validate citations and run the quality gate over an answer bundle")
@Component
public class VerifyCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(VerifyCommand.class);

    static final int EXIT_PASSED = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_UNREADABLE = 2;

    @Parameters(index = "0", description = "Path to the evidence bundle (JSON)")
    private Path bundlePath;

    @Option(names = "--json", description = "Print the eval summary as JSON")
    private boolean json;

    @Option(names = "--run-id", description = "Run id recorded in the eval summary")
    private String runId;

    private final EvidenceStore evidenceStore;
    private final CitationValidator citationValidator;
    private final QualityGateVerifier verifier;
    private final ObjectMapper objectMapper;
    private final GroundgateMetrics metrics;

    public VerifyCommand(EvidenceStore evidenceStore,
                         CitationValidator citationValidator,
                         QualityGateVerifier verifier,
                         ObjectMapper objectMapper,
                         @Autowired(required = false) GroundgateMetrics metrics) {
        this.evidenceStore = evidenceStore;
        this.citationValidator = citationValidator;
        this.verifier = verifier;
        this.objectMapper = objectMapper;
        this.metrics = metrics;
    }

    @Override
    public Integer call() {
        String id = runId != null && !runId.isBlank() ? runId : "verify-" + UUID.randomUUID();
        MdcContext.setRun(id);
        try {
            EvidenceBundle bundle;
            try {
                bundle = objectMapper.readValue(bundlePath.toFile(), EvidenceBundle.class);
            } catch (IOException e) {
                log.warn("Cannot read bundle {}: {}", bundlePath, e.getMessage());
                ConsoleOutput.error("Cannot read bundle " + bundlePath + ": " + e.getMessage());
                return EXIT_UNREADABLE;
            }

            var chunkIds = new ArrayList<String>();
            for (var chunk : bundle.chunks()) {
                chunkIds.add(evidenceStore.addChunk(chunk.source(), chunk.locator(), chunk.text()));
            }
            var citations = bundle.citations().stream().map(c -> c.toCitation(chunkIds)).toList();

            CitationValidation validation = citationValidator.validate(bundle.answer(), citations);
            VerifyResult result = verifier.verify(bundle.answer(), validation.valid(),
                    bundle.claimList(), bundle.evidenceList());
            log.info("Verified bundle {}: {} chunk(s), {}/{} citation(s) valid, gate {}",
                    bundlePath, chunkIds.size(), validation.valid().size(), citations.size(),
                    result.gatePassed() ? "passed" : "failed");

            if (metrics != null) {
                metrics.recordGateResult(result.gatePassed());
                for (FailReason reason : result.failReasons()) {
                    metrics.recordFailReason(reason.code().name(), reason.severity().wireName());
                }
            }

            if (json) {
                printJson(id, validation, result);
            } else {
                printHuman(validation, result);
            }
            return result.gatePassed() ? EXIT_PASSED : EXIT_FAILED;
        } finally {
            MdcContext.clear();
        }
    }

    private void printJson(String id, CitationValidation validation, VerifyResult result) {
        var summary = new LinkedHashMap<>(result.toEvalSummary(id));
        summary.put("citation_warnings", validation.warnings());
        summary.put("valid_citations", validation.valid().stream().map(c -> c.chunkId()).toList());
        try {
            System.out.println(objectMapper.copy()
                    .enable(SerializationFeature.INDENT_OUTPUT)
                    .writeValueAsString(summary));
        } catch (IOException e) {
            throw new IllegalStateException("Cannot serialize eval summary", e);
        }
    }

    private void printHuman(CitationValidation validation, VerifyResult result) {
        ConsoleOutput.printBanner();
        ConsoleOutput.info(validation.valid().size() + " valid citation(s)");
        validation.warnings().forEach(ConsoleOutput::droppedCitation);
        result.failReasons().forEach(ConsoleOutput::failReason);
        ConsoleOutput.gate(result);
        ConsoleOutput.metrics(result.metrics());
    }
}
