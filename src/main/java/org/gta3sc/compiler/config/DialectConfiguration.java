package org.gta3sc.compiler.config;

import org.gta3sc.compiler.util.CharSequenceOrder;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Immutable record of target capabilities and compiler switches for one compilation run.
 * <p>
 * It is built once through {@link Builder} and then shared read-only by every translation
 * unit job; no accessor exposes mutable state, so no locking is needed after publication.
 * Absent numeric limits mean "unbounded / not applicable", which is distinct from zero.
 */
public final class DialectConfiguration {

    private final Language language;
    private final TargetDialect target;
    private final Set<DialectFeature> features;
    private final int localVarLimit;
    private final int missionVarBegin;
    private final OptionalInt missionVarLimit;
    private final OptionalInt switchCaseLimit;
    private final OptionalInt arrayElemLimit;
    private final OptionalInt cleo;
    private final int timerIndex;
    // Keys are Strings, but the CharSequence comparator lets lookups use borrowed sequences.
    private final SortedMap<String, String> defines;

    private DialectConfiguration(Builder builder) {
        this.language = builder.language;
        this.target = builder.target;
        this.features = Collections.unmodifiableSet(EnumSet.copyOf(builder.features));
        this.localVarLimit = builder.localVarLimit;
        this.missionVarBegin = builder.missionVarBegin;
        this.missionVarLimit = builder.missionVarLimit;
        this.switchCaseLimit = builder.switchCaseLimit;
        this.arrayElemLimit = builder.arrayElemLimit;
        this.cleo = builder.cleo;
        this.timerIndex = builder.timerIndex;
        TreeMap<String, String> copy = new TreeMap<>(CharSequenceOrder.CASE_SENSITIVE);
        copy.putAll(builder.defines);
        this.defines = Collections.unmodifiableSortedMap(copy);
    }

    /**
     * Creates a builder with the default switches and no target dialect.
     *
     * @return A new builder.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Creates a builder pre-populated with the values of this configuration.
     *
     * @return A new builder.
     */
    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.language = language;
        builder.target = target;
        builder.features.clear();
        builder.features.addAll(features);
        builder.localVarLimit = localVarLimit;
        builder.missionVarBegin = missionVarBegin;
        builder.missionVarLimit = missionVarLimit;
        builder.switchCaseLimit = switchCaseLimit;
        builder.arrayElemLimit = arrayElemLimit;
        builder.cleo = cleo;
        builder.timerIndex = timerIndex;
        builder.defines.putAll(defines);
        return builder;
    }

    public Language language() {
        return language;
    }

    public TargetDialect target() {
        return target;
    }

    /**
     * @param feature The switch to test.
     * @return {@code true} if the switch is on.
     */
    public boolean isEnabled(DialectFeature feature) {
        return features.contains(feature);
    }

    /**
     * @return An unmodifiable view of the enabled switches.
     */
    public Set<DialectFeature> features() {
        return features;
    }

    public int localVarLimit() {
        return localVarLimit;
    }

    public int missionVarBegin() {
        return missionVarBegin;
    }

    public OptionalInt missionVarLimit() {
        return missionVarLimit;
    }

    public OptionalInt switchCaseLimit() {
        return switchCaseLimit;
    }

    public OptionalInt arrayElemLimit() {
        return arrayElemLimit;
    }

    /**
     * @return The opcode space marker of the CLEO plugin target, if any.
     */
    public OptionalInt cleo() {
        return cleo;
    }

    /**
     * @return Index of the first timer local variable.
     */
    public int timerIndex() {
        return timerIndex;
    }

    /**
     * Checks whether a preprocessor symbol of this exact spelling exists.
     *
     * @param symbol The symbol name; any character sequence, compared case-sensitively.
     * @return {@code true} if defined.
     */
    public boolean isDefined(CharSequence symbol) {
        return defines.containsKey(symbol);
    }

    /**
     * @param symbol The symbol name.
     * @return The value the symbol is defined to, or empty if it is not defined.
     */
    public Optional<String> definedValue(CharSequence symbol) {
        return Optional.ofNullable(defines.get(symbol));
    }

    /**
     * @return An unmodifiable view of all preprocessor symbols, ordered by name.
     */
    public Map<String, String> defines() {
        return defines;
    }

    /**
     * Converts the target dialect into the matching constant of an output-stage enumeration.
     * The enumeration must declare {@code LIBERTY}, {@code MIAMI} and {@code SAN_ANDREAS}.
     * <p>
     * Callers must check for syntax-only mode first; asking for a header without a target
     * dialect is a programming error.
     *
     * @param type The enumeration class, e.g. {@link org.gta3sc.compiler.api.ScmVersion}.
     * @param <E>  The enumeration type.
     * @return The constant for the active dialect.
     * @throws IllegalStateException if the target dialect is {@link TargetDialect#NONE}.
     */
    public <E extends Enum<E>> E header(Class<E> type) {
        return switch (target) {
            case NONE -> throw new IllegalStateException(
                    "No header version for target dialect NONE; check for syntax-only mode first.");
            case GTA3 -> Enum.valueOf(type, "LIBERTY");
            case GTAVC -> Enum.valueOf(type, "MIAMI");
            case GTASA -> Enum.valueOf(type, "SAN_ANDREAS");
        };
    }

    @Override
    public String toString() {
        return "DialectConfiguration{language=" + language
                + ", target=" + target
                + ", features=" + features
                + ", localVarLimit=" + localVarLimit
                + ", missionVarBegin=" + missionVarBegin
                + ", missionVarLimit=" + missionVarLimit
                + ", switchCaseLimit=" + switchCaseLimit
                + ", arrayElemLimit=" + arrayElemLimit
                + ", cleo=" + cleo
                + ", timerIndex=" + timerIndex
                + ", defines=" + defines + '}';
    }

    /**
     * Mutable staging area for a {@link DialectConfiguration}. Not thread-safe.
     */
    public static final class Builder {
        private Language language = Language.GTA3SCRIPT;
        private TargetDialect target = TargetDialect.NONE;
        private final Set<DialectFeature> features = DialectFeature.defaults();
        private int localVarLimit;
        private int missionVarBegin;
        private OptionalInt missionVarLimit = OptionalInt.empty();
        private OptionalInt switchCaseLimit = OptionalInt.empty();
        private OptionalInt arrayElemLimit = OptionalInt.empty();
        private OptionalInt cleo = OptionalInt.empty();
        private int timerIndex;
        private final TreeMap<String, String> defines = new TreeMap<>(CharSequenceOrder.CASE_SENSITIVE);

        private Builder() {}

        public Builder language(Language language) {
            this.language = language;
            return this;
        }

        public Builder target(TargetDialect target) {
            this.target = target;
            return this;
        }

        /**
         * Turns a switch on or off.
         *
         * @param feature The switch.
         * @param enabled Its new state.
         * @return This builder.
         */
        public Builder feature(DialectFeature feature, boolean enabled) {
            if (enabled) {
                features.add(feature);
            } else {
                features.remove(feature);
            }
            return this;
        }

        public Builder enable(DialectFeature feature) {
            return feature(feature, true);
        }

        public Builder disable(DialectFeature feature) {
            return feature(feature, false);
        }

        public Builder localVarLimit(int localVarLimit) {
            this.localVarLimit = localVarLimit;
            return this;
        }

        public Builder missionVarBegin(int missionVarBegin) {
            this.missionVarBegin = missionVarBegin;
            return this;
        }

        public Builder missionVarLimit(OptionalInt missionVarLimit) {
            this.missionVarLimit = missionVarLimit;
            return this;
        }

        public Builder switchCaseLimit(OptionalInt switchCaseLimit) {
            this.switchCaseLimit = switchCaseLimit;
            return this;
        }

        public Builder arrayElemLimit(OptionalInt arrayElemLimit) {
            this.arrayElemLimit = arrayElemLimit;
            return this;
        }

        public Builder cleo(OptionalInt cleo) {
            this.cleo = cleo;
            return this;
        }

        public Builder timerIndex(int timerIndex) {
            this.timerIndex = timerIndex;
            return this;
        }

        /**
         * Defines a preprocessor symbol with the value {@code "1"}.
         *
         * @param symbol The symbol name.
         * @return This builder.
         */
        public Builder define(String symbol) {
            return define(symbol, "1");
        }

        /**
         * Defines a preprocessor symbol, replacing any previous value.
         *
         * @param symbol The symbol name.
         * @param value  The value.
         * @return This builder.
         */
        public Builder define(String symbol, String value) {
            defines.put(symbol, value);
            return this;
        }

        /**
         * Removes a preprocessor symbol. Does nothing if it is not defined.
         *
         * @param symbol The symbol name.
         * @return This builder.
         */
        public Builder undefine(CharSequence symbol) {
            defines.remove(symbol);
            return this;
        }

        public boolean isDefined(CharSequence symbol) {
            return defines.containsKey(symbol);
        }

        public TargetDialect target() {
            return target;
        }

        public boolean isEnabled(DialectFeature feature) {
            return features.contains(feature);
        }

        public DialectConfiguration build() {
            return new DialectConfiguration(this);
        }
    }
}
