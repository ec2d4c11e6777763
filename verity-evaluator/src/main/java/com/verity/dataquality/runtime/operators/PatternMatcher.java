/*
 * Copyright (c) 2025 Verity Data Quality
 * Licensed under the Apache License, Version 2.0
 */
package com.verity.dataquality.runtime.operators;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Evaluates rule patterns against field values.
 *
 * <p>Compiled patterns, and compilation failures, are cached per pattern text
 * in a bounded Caffeine cache, so a rule's regex is compiled once per run no
 * matter how many records are checked. Matching uses {@link java.util.regex.Matcher#find()}:
 * a pattern that must cover the whole value has to be anchored.
 *
 * <p>Each evaluation runs under a step budget (see {@link BoundedCharSequence}).
 * When the budget is exhausted the outcome is {@link Status#STEP_LIMIT_EXCEEDED}
 * rather than a verdict on the value. The same applies when a repeated group
 * recurses deeper than the thread's stack allows on a long value.
 */
public final class PatternMatcher {
    private static final Logger logger = LoggerFactory.getLogger(PatternMatcher.class);

    public static final long DEFAULT_CACHE_SIZE = 1_000;
    public static final long DEFAULT_STEP_LIMIT = 1_000_000;

    public enum Status {
        MATCHED,
        NOT_MATCHED,
        INVALID_PATTERN,
        STEP_LIMIT_EXCEEDED
    }

    /**
     * @param detail syntax error description for {@link Status#INVALID_PATTERN}, the exhausted
     *               limit for {@link Status#STEP_LIMIT_EXCEEDED}, otherwise empty
     */
    public record Outcome(Status status, String detail) {
    }

    private record CompiledPattern(Pattern pattern, String error) {
    }

    private static final Outcome MATCHED = new Outcome(Status.MATCHED, "");
    private static final Outcome NOT_MATCHED = new Outcome(Status.NOT_MATCHED, "");

    private final Cache<String, CompiledPattern> cache;
    private final long stepLimit;

    public PatternMatcher() {
        this(DEFAULT_CACHE_SIZE, DEFAULT_STEP_LIMIT);
    }

    public PatternMatcher(long maxCacheSize, long stepLimit) {
        if (stepLimit <= 0) {
            throw new IllegalArgumentException("stepLimit must be positive: " + stepLimit);
        }
        this.stepLimit = stepLimit;
        this.cache = Caffeine.newBuilder()
            .maximumSize(maxCacheSize)
            .recordStats()
            .build();
    }

    public Outcome match(String regex, String value) {
        CompiledPattern compiled = cache.get(regex, PatternMatcher::compile);
        if (compiled.pattern() == null) {
            return new Outcome(Status.INVALID_PATTERN, compiled.error());
        }
        try {
            return compiled.pattern().matcher(new BoundedCharSequence(value, stepLimit)).find()
                ? MATCHED
                : NOT_MATCHED;
        } catch (BoundedCharSequence.StepLimitExceededException e) {
            logger.debug("Pattern '{}' gave up on a value of length {}: {}", regex, value.length(), e.getMessage());
            return new Outcome(Status.STEP_LIMIT_EXCEEDED, e.getMessage());
        } catch (StackOverflowError e) {
            // java.util.regex recurses once per repetition of a group or alternation
            logger.warn("Pattern '{}' overflowed the stack on a value of length {}", regex, value.length());
            return new Outcome(Status.STEP_LIMIT_EXCEEDED,
                "Regex evaluation exceeded the recursion depth on a value of length " + value.length());
        }
    }

    public long stepLimit() {
        return stepLimit;
    }

    public CacheStats stats() {
        return cache.stats();
    }

    private static CompiledPattern compile(String regex) {
        try {
            return new CompiledPattern(Pattern.compile(regex), null);
        } catch (PatternSyntaxException e) {
            logger.warn("Invalid regex pattern: {}", regex);
            return new CompiledPattern(null, e.getDescription());
        }
    }
}
