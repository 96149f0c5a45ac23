package com.dcruver.vaultgraph.io;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Per-vault settings stored in {@code <vault>/.vault-graph/config.json}.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class VaultConfig {
    private List<String> graphIgnore = new ArrayList<>();
}
