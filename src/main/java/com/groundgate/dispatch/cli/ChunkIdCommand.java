package com.groundgate.dispatch.cli;

import com.groundgate.core.evidence.EvidenceStore;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * CLI command: groundgate chunk-id --source S --locator L --text T
 * <p>
 * Prints the content-derived id the evidence store would assign, so bundles can
 * cite chunks before they are ingested.
 */
@Command(name = "chunk-id", mixinStandardHelpOptions = true,
        description = "Print the chunk id for a source, locator and text")
@Component
public class ChunkIdCommand implements Runnable {

    private final EvidenceStore evidenceStore;

    @Option(names = "--source", required = true, description = "Source document identifier")
    private String source;

    @Option(names = "--locator", defaultValue = "", description = "Locator, e.g. section:Methods;page:4")
    private String locator;

    @Option(names = "--text", required = true, description = "Chunk text")
    private String text;

    public ChunkIdCommand(EvidenceStore evidenceStore) {
        this.evidenceStore = evidenceStore;
    }

    @Override
    public void run() {
        System.out.println(evidenceStore.idFor(source, locator, text));
    }
}
