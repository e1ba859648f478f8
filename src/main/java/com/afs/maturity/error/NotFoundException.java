package com.afs.maturity.error;

public class NotFoundException extends RuntimeException {
    private final String entity;
    private final String id;

    public NotFoundException(String entity, Object id) {
        super(entity + " " + id + " not found");
        this.entity = entity;
        this.id = String.valueOf(id);
    }

    public String getEntity() {
        return entity;
    }

    public String getId() {
        return id;
    }
}
