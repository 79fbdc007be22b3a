package com.e2eq.filter.config;

import io.quarkus.runtime.annotations.StaticInitSafe;
import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import java.util.Optional;
import java.util.Set;

/**
 * Limits and switches for client supplied advanced filters.
 */
@StaticInitSafe
@ConfigMapping(prefix = "quantum.filter")
public interface FilterSecurityConfig {

    /**
     * Maximum nesting of and/or/not groups.
     */
    @WithDefault("5")
    int maxDepth();

    @WithDefault("100")
    int maxArrayLength();

    @WithDefault("200")
    int maxStringLength();

    @WithDefault("50")
    int maxObjectKeys();

    /**
     * Replaces the built in protected field set when present.
     */
    Optional<Set<String>> protectedFields();

    /**
     * Fields whose names end in the identifier suffix but hold plain strings.
     */
    Optional<Set<String>> noObjectIdCastFields();

    @WithDefault("_id")
    String identifierSuffix();

    @WithDefault("10")
    int maxRecursionDepth();

    @WithDefault("64")
    int jsonMaxNestingDepth();

    /**
     * Answer 400 when a structural limit is exceeded instead of running without the filter.
     */
    @WithDefault("true")
    boolean rejectOnFatalViolation();

    /**
     * Answer 400 when any clause is dropped.
     */
    @WithDefault("false")
    boolean rejectOnViolation();

    @WithDefault("quantum-filter")
    String database();
}
