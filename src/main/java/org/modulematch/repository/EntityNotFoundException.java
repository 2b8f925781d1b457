package org.modulematch.repository;

/**
 * An internally referenced module id or gene symbol is missing from the provider tables.
 */
public class EntityNotFoundException extends RepositoryException {
    private final String entityType;
    private final String key;

    public EntityNotFoundException(String entityType, Object key) {
        super(entityType + " not found: " + key);
        this.entityType = entityType;
        this.key = String.valueOf(key);
    }

    public String getEntityType() {
        return entityType;
    }

    public String getKey() {
        return key;
    }
}
