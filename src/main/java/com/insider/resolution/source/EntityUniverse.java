package com.insider.resolution.source;

import com.insider.resolution.core.model.Entity;

import java.io.IOException;
import java.util.Comparator;
import java.util.List;

/**
 * The finite set of entities the exhaustive scan walks.
 */
public interface EntityUniverse {

    /** Ranked entities first (lower rank is larger), unranked last, then by id. */
    Comparator<Entity> BY_SIZE_RANK = Comparator
            .comparing(Entity::sizeRank, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(Entity::id);

    /**
     * All entities in the universe.
     *
     * @throws IOException if the universe feed cannot be read
     */
    List<Entity> entities() throws IOException;

    /**
     * The {@code n} largest entities by size ranking.
     */
    default List<Entity> top(int n) throws IOException {
        if (n < 0) {
            throw new IllegalArgumentException("n must be >= 0, got " + n);
        }
        return entities().stream().sorted(BY_SIZE_RANK).limit(n).toList();
    }
}
