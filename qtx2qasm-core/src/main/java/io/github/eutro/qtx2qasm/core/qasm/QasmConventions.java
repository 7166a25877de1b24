package io.github.eutro.qtx2qasm.core.qasm;

/**
 * Cosmetic choices made when printing OpenQASM: the header, indentation and symbol prefixes.
 * <p>
 * None of these affect the meaning of the output. Start from {@link #builder()}.
 */
public final class QasmConventions {
    /**
     * The default conventions.
     */
    public static final QasmConventions DEFAULT = builder().build();

    public final String compilerName;
    public final String include;
    public final String indent;
    public final String qregPrefix;
    public final String cregPrefix;
    public final String paramPrefix;
    public final String qubitPrefix;

    private QasmConventions(Builder builder) {
        this.compilerName = builder.compilerName;
        this.include = builder.include;
        this.indent = builder.indent;
        this.qregPrefix = builder.qregPrefix;
        this.cregPrefix = builder.cregPrefix;
        this.paramPrefix = builder.paramPrefix;
        this.qubitPrefix = builder.qubitPrefix;
    }

    /**
     * Start a {@link Builder} with the default settings.
     *
     * @return The builder.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Start a {@link Builder} with these settings.
     *
     * @return The builder.
     */
    public Builder toBuilder() {
        return new Builder()
                .setCompilerName(compilerName)
                .setInclude(include)
                .setIndent(indent)
                .setQregPrefix(qregPrefix)
                .setCregPrefix(cregPrefix)
                .setParamPrefix(paramPrefix)
                .setQubitPrefix(qubitPrefix);
    }

    /**
     * A builder for {@link QasmConventions}.
     */
    public static class Builder {
        private String compilerName = "qtx2qasm";
        private String include = "qelib1.inc";
        private String indent = "  ";
        private String qregPrefix = "q";
        private String cregPrefix = "c";
        private String paramPrefix = "param";
        private String qubitPrefix = "q";

        /**
         * Set the compiler name printed in the header comment.
         *
         * @param compilerName The name.
         * @return This, for convenience.
         */
        public Builder setCompilerName(String compilerName) {
            this.compilerName = compilerName;
            return this;
        }

        /**
         * Set the gate library included after the version line.
         *
         * @param include The file name.
         * @return This, for convenience.
         */
        public Builder setInclude(String include) {
            this.include = include;
            return this;
        }

        public Builder setIndent(String indent) {
            this.indent = indent;
            return this;
        }

        public Builder setQregPrefix(String qregPrefix) {
            this.qregPrefix = checkPrefix(qregPrefix);
            return this;
        }

        public Builder setCregPrefix(String cregPrefix) {
            this.cregPrefix = checkPrefix(cregPrefix);
            return this;
        }

        /**
         * Set the prefix of the formal parameter names of gate macros.
         *
         * @param paramPrefix The prefix.
         * @return This, for convenience.
         */
        public Builder setParamPrefix(String paramPrefix) {
            this.paramPrefix = checkPrefix(paramPrefix);
            return this;
        }

        /**
         * Set the prefix of the formal qubit names of gate macros.
         *
         * @param qubitPrefix The prefix.
         * @return This, for convenience.
         */
        public Builder setQubitPrefix(String qubitPrefix) {
            this.qubitPrefix = checkPrefix(qubitPrefix);
            return this;
        }

        private static String checkPrefix(String prefix) {
            if (!prefix.matches("[a-z][A-Za-z0-9_]*")) {
                throw new IllegalArgumentException("not a valid OpenQASM identifier prefix: " + prefix);
            }
            return prefix;
        }

        public QasmConventions build() {
            return new QasmConventions(this);
        }
    }
}
