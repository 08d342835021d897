package org.pragmatica.vb6.error;

/**
 * Classification of parse failures. The code is printed in the header of formatted failures.
 */
public enum FailureKind {
    UNEXPECTED_TOKEN("V0001"),
    MISSING_TOKEN("V0002"),
    MISSING_TERMINATOR("V0003"),
    UNTERMINATED_LITERAL("V0004"),
    NESTING_TOO_DEEP("V0005");

    private final String code;

    FailureKind(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
