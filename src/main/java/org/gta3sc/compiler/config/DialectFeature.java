package org.gta3sc.compiler.config;

import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/**
 * Independent boolean switches, each gating one language or code generation feature.
 * Any combination is accepted; stages that cannot honour a combination for the active
 * {@link TargetDialect} report it themselves.
 */
public enum DialectFeature {
    /** Emit the script without the multi-segment header. */
    HEADERLESS("headerless"),
    /** Warn about constructs the original compiler tolerated silently. */
    PEDANTIC("pedantic"),
    /** Guess command definitions that are missing from the catalog. */
    GUESSER("guesser"),
    /** Encode float literals as 16-bit fixed point. */
    HALF_FLOAT("half-float"),
    /** Text labels carry a type prefix byte. */
    TEXT_LABEL_PREFIX("text-label-prefix"),
    /** Drop the ANDOR instruction of single-condition IFs. */
    SKIP_SINGLE_IFS("skip-single-ifs"),
    /** Encode 0.0 as a 1-byte integer. */
    OPTIMIZE_ZERO_FLOATS("optimize-zero-floats"),
    /** Track entity types of variables. */
    ENTITY_TRACKING("entity-tracking"),
    /** Check script names passed to SCRIPT_NAME for collisions. */
    SCRIPT_NAME_CHECK("script-name-check"),
    /** Allow SWITCH statements. */
    SWITCH("switch"),
    /** Allow BREAK and CONTINUE statements. */
    BREAK_CONTINUE("break-continue"),
    /** Emit the scope marker before the label on the same line. */
    SCOPE_THEN_LABEL("scope-then-label"),
    /** Allow array variables. */
    ARRAYS("arrays"),
    /** Allow streamed scripts. */
    STREAMED_SCRIPTS("streamed-scripts"),
    /** Allow text label variables. */
    TEXT_LABEL_VARS("text-label-vars"),
    /** Local variables are addressed by offset instead of index. */
    LOCAL_OFFSETS("local-offsets"),
    /** Allow SKIP_CUTSCENE_START blocks. */
    SKIP_CUTSCENE("skip-cutscene"),
    /** Stop after semantic analysis, no code generation. */
    SYNTAX_ONLY("syntax-only"),
    /** Emit the IR2 textual form instead of bytecode. */
    EMIT_IR2("emit-ir2"),
    /** Disassemble with a linear sweep instead of following control flow. */
    LINEAR_SWEEP("linear-sweep"),
    /** Relax the rules about NOT in conditions. */
    RELAX_NOT("relax-not"),
    /** Produce a CLEO script instead of a main script. */
    OUTPUT_CLEO("output-cleo");

    private final String key;

    DialectFeature(String key) {
        this.key = key;
    }

    /**
     * @return The kebab-case key used in configuration files and on the command line.
     */
    public String key() {
        return key;
    }

    /**
     * Finds a feature by its configuration key.
     *
     * @param key The key, e.g. {@code break-continue}.
     * @return The feature, or empty if the key is unknown.
     */
    public static Optional<DialectFeature> fromKey(String key) {
        for (DialectFeature feature : values()) {
            if (feature.key.equalsIgnoreCase(key)) {
                return Optional.of(feature);
            }
        }
        return Optional.empty();
    }

    /**
     * The switches a fresh configuration starts with.
     *
     * @return A new mutable set.
     */
    public static Set<DialectFeature> defaults() {
        return EnumSet.of(ENTITY_TRACKING, SCRIPT_NAME_CHECK);
    }
}
