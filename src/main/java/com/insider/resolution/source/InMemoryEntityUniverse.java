package com.insider.resolution.source;

import com.insider.resolution.core.model.Entity;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Fixed entity universe held in memory. Duplicate ids keep the first entity seen.
 */
public class InMemoryEntityUniverse implements EntityUniverse {

    private final List<Entity> entities;

    public InMemoryEntityUniverse(Collection<Entity> entities) {
        Map<String, Entity> byId = new LinkedHashMap<>();
        for (Entity entity : entities) {
            byId.putIfAbsent(entity.id(), entity);
        }
        this.entities = List.copyOf(byId.values());
    }

    public static InMemoryEntityUniverse of(Entity... entities) {
        return new InMemoryEntityUniverse(List.of(entities));
    }

    @Override
    public List<Entity> entities() {
        return new ArrayList<>(entities);
    }

    public int size() {
        return entities.size();
    }
}
