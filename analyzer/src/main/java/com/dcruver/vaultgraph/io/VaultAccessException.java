package com.dcruver.vaultgraph.io;

/**
 * The vault could not be read: missing, not a directory, or an I/O failure
 * while walking it.
 */
public class VaultAccessException extends Exception {

    public VaultAccessException(String message) {
        super(message);
    }

    public VaultAccessException(String message, Throwable cause) {
        super(message, cause);
    }
}
