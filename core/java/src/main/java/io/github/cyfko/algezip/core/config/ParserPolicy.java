package io.github.cyfko.algezip.core.config;

/**
 * Size limits applied by the expression parser.
 * <p>
 * The parser is recursive, so nesting depth is bounded to keep arbitrarily deep input from
 * exhausting the stack. Input that exceeds a limit is rejected with an
 * {@link io.github.cyfko.algezip.core.exception.ExpressionSyntaxException} naming the policy.
 * </p>
 *
 * <h2>Configurable Limits</h2>
 * <ul>
 *   <li><strong>maxExpressionLength</strong>: maximum character length of the trimmed input</li>
 *   <li><strong>maxNestingDepth</strong>: maximum number of simultaneously open brackets</li>
 * </ul>
 *
 * <h2>Preset Configurations</h2>
 * <pre>{@code
 * // Default (interactive use)
 * ParserPolicy policy = ParserPolicy.defaults();
 *
 * // Strict (untrusted input)
 * ParserPolicy policy = ParserPolicy.strict();
 *
 * // Relaxed (generated expressions)
 * ParserPolicy policy = ParserPolicy.relaxed();
 *
 * // Custom
 * ParserPolicy policy = ParserPolicy.builder()
 *     .maxNestingDepth(32)
 *     .build();
 * }</pre>
 *
 * @param policyName          name reported in limit violations
 * @param maxExpressionLength maximum character length of the expression string
 * @param maxNestingDepth     maximum bracket nesting depth
 * @author AlgeZip contributors
 * @since 1.0
 */
public record ParserPolicy(
    String policyName,
    int maxExpressionLength,
    int maxNestingDepth
) {

    /**
     * Deepest nesting any policy may allow. The parser descends recursively once per level.
     */
    public static final int MAX_SUPPORTED_NESTING_DEPTH = 1024;

    /**
     * Canonical constructor with validation.
     *
     * @throws IllegalArgumentException if the name is blank, a limit is not positive or the
     *                                  nesting depth exceeds {@link #MAX_SUPPORTED_NESTING_DEPTH}
     */
    public ParserPolicy {
        if (policyName == null || policyName.isBlank()) {
            throw new IllegalArgumentException("Policy name is required");
        }
        if (maxExpressionLength <= 0) {
            throw new IllegalArgumentException("maxExpressionLength must be positive, got: " + maxExpressionLength);
        }
        if (maxNestingDepth <= 0) {
            throw new IllegalArgumentException("maxNestingDepth must be positive, got: " + maxNestingDepth);
        }
        if (maxNestingDepth > MAX_SUPPORTED_NESTING_DEPTH) {
            throw new IllegalArgumentException("maxNestingDepth must be at most "
                    + MAX_SUPPORTED_NESTING_DEPTH + ", got: " + maxNestingDepth);
        }
    }

    /**
     * Default configuration.
     * <ul>
     *   <li>Max Expression Length: 5000 characters</li>
     *   <li>Max Nesting Depth: 256</li>
     * </ul>
     *
     * @return default configuration
     */
    public static ParserPolicy defaults() {
        return new ParserPolicy(PolicyName.DEFAULT_POLICY.name(), 5000, 256);
    }

    /**
     * Strict configuration for untrusted input.
     * <ul>
     *   <li>Max Expression Length: 1000 characters</li>
     *   <li>Max Nesting Depth: 64</li>
     * </ul>
     *
     * @return strict configuration
     */
    public static ParserPolicy strict() {
        return new ParserPolicy(PolicyName.STRICT_POLICY.name(), 1000, 64);
    }

    /**
     * Relaxed configuration for large machine-generated expressions.
     * <ul>
     *   <li>Max Expression Length: 20000 characters</li>
     *   <li>Max Nesting Depth: 1024</li>
     * </ul>
     *
     * @return relaxed configuration
     */
    public static ParserPolicy relaxed() {
        return new ParserPolicy(PolicyName.RELAXED_POLICY.name(), 20000, 1024);
    }

    /**
     * Creates a builder initialized with the default limits.
     *
     * @return the {@link Builder} instance
     */
    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String _policyName = PolicyName.CUSTOM_POLICY.name();
        private int _maxExpressionLength = 5000;
        private int _maxNestingDepth = 256;

        private Builder() {}

        public ParserPolicy build() {
            return new ParserPolicy(_policyName, _maxExpressionLength, _maxNestingDepth);
        }

        public Builder policyName(String policyName) { this._policyName = policyName; return this; }
        public Builder maxExpressionLength(int maxExpressionLength) { this._maxExpressionLength = maxExpressionLength; return this; }
        public Builder maxNestingDepth(int maxNestingDepth) { this._maxNestingDepth = maxNestingDepth; return this; }
    }

    public enum PolicyName {
        DEFAULT_POLICY,
        STRICT_POLICY,
        RELAXED_POLICY,
        CUSTOM_POLICY
    }
}
