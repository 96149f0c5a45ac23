package com.dcruver.vaultgraph.io;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;

/**
 * Reads the optional per-vault config file. A vault without one gets an empty config.
 */
@Component
@Slf4j
public class VaultConfigReader {

    static final String CONFIG_DIR = ".vault-graph";
    static final String CONFIG_FILE = "config.json";

    private final ObjectMapper objectMapper = new ObjectMapper();

    public VaultConfig read(Path vaultRoot) throws VaultAccessException {
        Path configFile = vaultRoot.resolve(CONFIG_DIR).resolve(CONFIG_FILE);
        if (!Files.exists(configFile)) {
            return new VaultConfig();
        }
        try {
            VaultConfig config = objectMapper.readValue(configFile.toFile(), VaultConfig.class);
            if (config.getGraphIgnore() == null) {
                config.setGraphIgnore(new ArrayList<>());
            }
            log.debug("Loaded vault config from {} ({} ignore prefixes)", configFile, config.getGraphIgnore().size());
            return config;
        } catch (IOException e) {
            throw new VaultAccessException("Cannot read vault config " + configFile + ": " + e.getMessage(), e);
        }
    }
}
