package com.chommie.jobsearch.data.persistence;

import com.chommie.jobsearch.data.model.EntityKind;

public class DuplicateRecordException extends RuntimeException {
    private final EntityKind kind;

    public DuplicateRecordException(EntityKind kind, Throwable cause) {
        super("Duplicate " + kind.resource() + " record", cause);
        this.kind = kind;
    }

    public EntityKind getKind() {
        return kind;
    }
}
