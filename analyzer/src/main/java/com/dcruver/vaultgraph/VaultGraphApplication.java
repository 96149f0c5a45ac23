package com.dcruver.vaultgraph;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for the vault graph analyzer.
 *
 * Reads a Markdown vault, builds its wikilink graph and answers questions
 * about link structure, authorities and communities from an interactive shell.
 * Notes are never modified.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
@Slf4j
public class VaultGraphApplication {

    public static void main(String[] args) {
        log.info("Starting vault graph analyzer...");
        SpringApplication.run(VaultGraphApplication.class, args);
    }
}
