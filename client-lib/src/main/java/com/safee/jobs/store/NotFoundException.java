package com.safee.jobs.store;

public abstract class NotFoundException extends JobEngineException {
    private final Object id;

    protected NotFoundException(String entity, Object id) {
        super(entity + " with ID '" + id + "' not found");
        this.id = id;
    }

    public Object getId() {
        return id;
    }
}
