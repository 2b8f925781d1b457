package org.modulematch.domain;

import java.util.Objects;

/**
 * Base type for domain objects identified by a canonical id.
 *
 * @param <ID> the id type
 */
public abstract class Entity<ID> {
    private final ID id;

    protected Entity(ID id) {
        this.id = Objects.requireNonNull(id, "id must not be null");
    }

    public ID getId() {
        return id;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Entity<?> entity = (Entity<?>) o;
        return id.equals(entity.id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }
}
