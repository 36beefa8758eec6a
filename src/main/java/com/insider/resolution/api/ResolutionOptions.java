package com.insider.resolution.api;

import java.time.Duration;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * Options for a single resolution: which strategies run, how far the exhaustive scan
 * reaches, time limits, and how affiliations are classified and filtered.
 */
public class ResolutionOptions {

    private static final Duration DEFAULT_DEADLINE = Duration.ofSeconds(60);
    private static final Duration DEFAULT_GRACE_PERIOD = Duration.ofSeconds(2);
    private static final Duration DEFAULT_RECENCY_WINDOW = Duration.ofDays(365);
    private static final int DEFAULT_CONCURRENCY_LIMIT = 8;
    private static final int DEFAULT_MIN_FILINGS = 1;

    private final boolean fallbackOnEmpty;
    private final boolean useIndexedSearch;
    private final Integer entityLimit;
    private final Duration deadline;
    private final Duration gracePeriod;
    private final int concurrencyLimit;
    private final Duration recencyWindow;
    private final Duration formerAfter;
    private final boolean includeFormer;
    private final int minFilings;

    private ResolutionOptions(Builder builder) {
        this.fallbackOnEmpty = builder.fallbackOnEmpty;
        this.useIndexedSearch = builder.useIndexedSearch;
        this.entityLimit = builder.entityLimit;
        this.deadline = builder.deadline;
        this.gracePeriod = builder.gracePeriod;
        this.concurrencyLimit = builder.concurrencyLimit;
        this.recencyWindow = builder.recencyWindow;
        this.formerAfter = builder.formerAfter != null ? builder.formerAfter : builder.recencyWindow;
        this.includeFormer = builder.includeFormer;
        this.minFilings = builder.minFilings;
    }

    /**
     * Whether an empty but successful indexed search still triggers the exhaustive scan.
     */
    public boolean isFallbackOnEmpty() {
        return fallbackOnEmpty;
    }

    public boolean isUseIndexedSearch() {
        return useIndexedSearch;
    }

    /**
     * Top-N entities by size rank for the exhaustive scan; empty means the whole universe.
     */
    public OptionalInt getEntityLimit() {
        return entityLimit != null ? OptionalInt.of(entityLimit) : OptionalInt.empty();
    }

    public Duration getDeadline() {
        return deadline;
    }

    public Duration getGracePeriod() {
        return gracePeriod;
    }

    public int getConcurrencyLimit() {
        return concurrencyLimit;
    }

    public Duration getRecencyWindow() {
        return recencyWindow;
    }

    public Duration getFormerAfter() {
        return formerAfter;
    }

    public boolean isIncludeFormer() {
        return includeFormer;
    }

    public int getMinFilings() {
        return minFilings;
    }

    /**
     * Creates default options.
     */
    public static ResolutionOptions defaults() {
        return builder().build();
    }

    /**
     * Options that report only current affiliations.
     */
    public static ResolutionOptions currentOnly() {
        return builder().includeFormer(false).build();
    }

    public Builder toBuilder() {
        return new Builder()
                .fallbackOnEmpty(fallbackOnEmpty)
                .useIndexedSearch(useIndexedSearch)
                .entityLimit(entityLimit)
                .deadline(deadline)
                .gracePeriod(gracePeriod)
                .concurrencyLimit(concurrencyLimit)
                .recencyWindow(recencyWindow)
                .formerAfter(formerAfter.equals(recencyWindow) ? null : formerAfter)
                .includeFormer(includeFormer)
                .minFilings(minFilings);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private boolean fallbackOnEmpty = true;
        private boolean useIndexedSearch = true;
        private Integer entityLimit;
        private Duration deadline = DEFAULT_DEADLINE;
        private Duration gracePeriod = DEFAULT_GRACE_PERIOD;
        private int concurrencyLimit = DEFAULT_CONCURRENCY_LIMIT;
        private Duration recencyWindow = DEFAULT_RECENCY_WINDOW;
        private Duration formerAfter;
        private boolean includeFormer = true;
        private int minFilings = DEFAULT_MIN_FILINGS;

        public Builder fallbackOnEmpty(boolean fallbackOnEmpty) {
            this.fallbackOnEmpty = fallbackOnEmpty;
            return this;
        }

        public Builder useIndexedSearch(boolean useIndexedSearch) {
            this.useIndexedSearch = useIndexedSearch;
            return this;
        }

        /**
         * Limits the exhaustive scan to the top-N entities; {@code null} scans everything.
         */
        public Builder entityLimit(Integer entityLimit) {
            if (entityLimit != null && entityLimit <= 0) {
                throw new IllegalArgumentException("entityLimit must be positive");
            }
            this.entityLimit = entityLimit;
            return this;
        }

        public Builder deadline(Duration deadline) {
            validatePositive(deadline, "deadline");
            this.deadline = deadline;
            return this;
        }

        public Builder gracePeriod(Duration gracePeriod) {
            if (gracePeriod == null || gracePeriod.isNegative()) {
                throw new IllegalArgumentException("gracePeriod must not be negative");
            }
            this.gracePeriod = gracePeriod;
            return this;
        }

        public Builder concurrencyLimit(int concurrencyLimit) {
            if (concurrencyLimit <= 0) {
                throw new IllegalArgumentException("concurrencyLimit must be positive");
            }
            this.concurrencyLimit = concurrencyLimit;
            return this;
        }

        public Builder recencyWindow(Duration recencyWindow) {
            validatePositive(recencyWindow, "recencyWindow");
            this.recencyWindow = recencyWindow;
            return this;
        }

        /**
         * Age past which an affiliation is former. Defaults to the recency window; a longer
         * value leaves the gap in between as unknown.
         */
        public Builder formerAfter(Duration formerAfter) {
            if (formerAfter != null) {
                validatePositive(formerAfter, "formerAfter");
            }
            this.formerAfter = formerAfter;
            return this;
        }

        public Builder includeFormer(boolean includeFormer) {
            this.includeFormer = includeFormer;
            return this;
        }

        public Builder minFilings(int minFilings) {
            if (minFilings <= 0) {
                throw new IllegalArgumentException("minFilings must be positive");
            }
            this.minFilings = minFilings;
            return this;
        }

        public ResolutionOptions build() {
            if (formerAfter != null && formerAfter.compareTo(recencyWindow) < 0) {
                throw new IllegalArgumentException("formerAfter must be >= recencyWindow");
            }
            return new ResolutionOptions(this);
        }

        private void validatePositive(Duration value, String name) {
            if (value == null || value.isNegative() || value.isZero()) {
                throw new IllegalArgumentException(name + " must be positive");
            }
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ResolutionOptions that)) return false;
        return fallbackOnEmpty == that.fallbackOnEmpty
                && useIndexedSearch == that.useIndexedSearch
                && concurrencyLimit == that.concurrencyLimit
                && includeFormer == that.includeFormer
                && minFilings == that.minFilings
                && Objects.equals(entityLimit, that.entityLimit)
                && deadline.equals(that.deadline)
                && gracePeriod.equals(that.gracePeriod)
                && recencyWindow.equals(that.recencyWindow)
                && formerAfter.equals(that.formerAfter);
    }

    @Override
    public int hashCode() {
        return Objects.hash(fallbackOnEmpty, useIndexedSearch, entityLimit, deadline, gracePeriod,
                concurrencyLimit, recencyWindow, formerAfter, includeFormer, minFilings);
    }

    @Override
    public String toString() {
        return "ResolutionOptions{" +
                "fallbackOnEmpty=" + fallbackOnEmpty +
                ", useIndexedSearch=" + useIndexedSearch +
                ", entityLimit=" + entityLimit +
                ", deadline=" + deadline +
                ", gracePeriod=" + gracePeriod +
                ", concurrencyLimit=" + concurrencyLimit +
                ", recencyWindow=" + recencyWindow +
                ", formerAfter=" + formerAfter +
                ", includeFormer=" + includeFormer +
                ", minFilings=" + minFilings +
                '}';
    }
}
