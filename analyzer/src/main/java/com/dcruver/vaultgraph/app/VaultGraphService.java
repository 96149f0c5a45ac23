package com.dcruver.vaultgraph.app;

import com.dcruver.vaultgraph.config.GraphProperties;
import com.dcruver.vaultgraph.domain.AnalysisResult;
import com.dcruver.vaultgraph.domain.GraphOptions;
import com.dcruver.vaultgraph.domain.NoteEntry;
import com.dcruver.vaultgraph.graph.GraphAnalyzer;
import com.dcruver.vaultgraph.io.NoteLoadOptions;
import com.dcruver.vaultgraph.io.NoteSource;
import com.dcruver.vaultgraph.io.VaultAccessException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * Loads a vault and analyzes it. One call, one fresh result; nothing is cached.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class VaultGraphService {

    private final NoteSource noteSource;
    private final GraphAnalyzer graphAnalyzer;
    private final GraphProperties properties;

    /**
     * Vault to analyze: the explicit path if given, otherwise {@code vault-graph.vault-path}.
     */
    public Path resolveVault(String vault) throws VaultAccessException {
        String candidate = vault != null && !vault.isBlank() ? vault : properties.getVaultPath();
        if (candidate == null || candidate.isBlank()) {
            throw new VaultAccessException("No vault given; pass --vault or set vault-graph.vault-path");
        }
        return Path.of(candidate).toAbsolutePath().normalize();
    }

    public AnalysisResult analyze(String vault, GraphOptions options) throws VaultAccessException {
        Path vaultRoot = resolveVault(vault);

        long started = System.nanoTime();
        List<NoteEntry> notes = noteSource.loadNotes(vaultRoot, NoteLoadOptions.from(options));
        Duration loadTime = Duration.ofNanos(System.nanoTime() - started);
        log.debug("Loaded {} notes from {} in {} ms", notes.size(), vaultRoot, loadTime.toMillis());

        return graphAnalyzer.analyze(notes, options, loadTime);
    }
}
