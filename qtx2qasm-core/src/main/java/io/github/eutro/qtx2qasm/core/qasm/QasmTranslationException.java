package io.github.eutro.qtx2qasm.core.qasm;

import org.jetbrains.annotations.Nullable;

/**
 * Thrown when a module cannot be expressed in OpenQASM 2.0.
 * <p>
 * This is a limitation of the target format, not a malformed input: the same module
 * may be perfectly valid for other backends.
 */
public class QasmTranslationException extends RuntimeException {
    /**
     * The broad reason a translation failed.
     */
    public enum Kind {
        /**
         * A construct OpenQASM 2.0 has no way to express.
         */
        UNSUPPORTED_CONSTRUCT,
        /**
         * A gate, with its number of controls, that has no OpenQASM mnemonic.
         */
        UNREPRESENTABLE_GATE,
        /**
         * A gate parameter that is not a compile-time literal.
         */
        UNRESOLVABLE_PARAMETER,
        /**
         * A module with no entry point, or more than one.
         */
        MODULE_SHAPE,
    }

    private final Kind kind;
    private final Object location;
    private final String diagnostic;

    /**
     * Construct an exception.
     *
     * @param kind       The kind of failure.
     * @param location   The offending IR element, for reporting.
     * @param diagnostic The human-readable reason.
     */
    public QasmTranslationException(Kind kind, @Nullable Object location, String diagnostic) {
        super(location == null ? diagnostic : diagnostic + ": " + location);
        this.kind = kind;
        this.location = location;
        this.diagnostic = diagnostic;
    }

    public Kind getKind() {
        return kind;
    }

    @Nullable
    public Object getLocation() {
        return location;
    }

    public String getDiagnostic() {
        return diagnostic;
    }
}
