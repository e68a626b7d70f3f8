package com.homestead.household.domain.exception;

public class EntityNotFoundException extends SystemOfRecordException {

    private final String entity;
    private final long id;

    public EntityNotFoundException(String entity, long id) {
        super(entity + " " + id + " not found");
        this.entity = entity;
        this.id = id;
    }

    public String getEntity() {
        return entity;
    }

    public long getId() {
        return id;
    }
}
