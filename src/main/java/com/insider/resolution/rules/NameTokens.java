package com.insider.resolution.rules;

import java.util.Collections;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Order-free token view of a name used for scoring: full words and single-letter initials.
 */
public record NameTokens(SortedSet<String> words, SortedSet<String> initials) {

    public NameTokens {
        words = Collections.unmodifiableSortedSet(new TreeSet<>(words));
        initials = Collections.unmodifiableSortedSet(new TreeSet<>(initials));
    }

    public boolean isEmpty() {
        return words.isEmpty();
    }

    /**
     * Both sides carry initials and none of them agree, e.g. "John A Smith" vs "John B Smith".
     */
    public boolean initialsConflictWith(NameTokens other) {
        if (initials.isEmpty() || other.initials.isEmpty()) {
            return false;
        }
        return Collections.disjoint(initials, other.initials);
    }
}
