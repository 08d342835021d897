package org.pragmatica.vb6.error;

/**
 * How the parser proceeds after a failure.
 */
public enum RecoveryStrategy {
    /**
     * Stop at the first failure: the rest of the input becomes a single {@code Unknown} node and
     * no further failures are reported.
     */
    NONE,

    /**
     * Record the failure, wrap the offending tokens in an {@code Unknown} node and resume at the
     * next synchronization point (newline or {@code :}), collecting every failure in the file.
     */
    ADVANCED
}
