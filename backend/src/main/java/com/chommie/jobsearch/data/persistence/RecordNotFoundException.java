package com.chommie.jobsearch.data.persistence;

import com.chommie.jobsearch.data.model.EntityKind;

public class RecordNotFoundException extends RuntimeException {
    private final EntityKind kind;
    private final String id;

    public RecordNotFoundException(EntityKind kind, String id) {
        super(kind.resource() + " record not found: " + id);
        this.kind = kind;
        this.id = id;
    }

    public EntityKind getKind() {
        return kind;
    }

    public String getId() {
        return id;
    }
}
