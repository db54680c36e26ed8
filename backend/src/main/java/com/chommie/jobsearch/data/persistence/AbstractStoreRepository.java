package com.chommie.jobsearch.data.persistence;

import com.chommie.jobsearch.config.JobSearchProperties;
import com.chommie.jobsearch.data.model.EntityKind;
import com.chommie.jobsearch.data.store.DataMethod;
import com.chommie.jobsearch.data.store.DataResult;
import com.chommie.jobsearch.data.store.PermanentDataServiceException;
import com.chommie.jobsearch.data.store.QueryFilter;
import com.chommie.jobsearch.data.store.RequestParams;
import com.chommie.jobsearch.data.store.ResourceSchema;
import com.chommie.jobsearch.data.util.Batches;
import com.chommie.jobsearch.data.validation.EntityValidator;
import com.chommie.jobsearch.data.validation.FieldError;
import com.chommie.jobsearch.data.validation.ValidationException;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * CRUD over one store resource. Writes pass through {@link EntityValidator}; reads of a
 * missing id come back empty rather than failing.
 */
public abstract class AbstractStoreRepository<T> {
    protected final StoreRequestExecutor executor;
    protected final EntityValidator validator;
    protected final JobSearchProperties properties;
    protected final Clock clock;
    private final EntityKind kind;

    protected AbstractStoreRepository(
        EntityKind kind,
        StoreRequestExecutor executor,
        EntityValidator validator,
        JobSearchProperties properties,
        Clock clock
    ) {
        this.kind = kind;
        this.executor = executor;
        this.validator = validator;
        this.properties = properties;
        this.clock = clock;
    }

    protected abstract T mapRow(Map<String, Object> row);

    public EntityKind kind() {
        return kind;
    }

    public T create(Map<String, ?> candidate) {
        Map<String, Object> values = prepareForWrite(validator.validate(kind, candidate));
        Instant now = clock.instant();
        values.put("created_at", now);
        values.put("updated_at", now);
        DataResult result;
        try {
            result = executor.execute(DataMethod.POST, kind.resource(), QueryFilter.builder().body(values).build());
        } catch (PermanentDataServiceException e) {
            if (e.isConflict()) {
                throw new DuplicateRecordException(kind, e);
            }
            throw e;
        }
        return result.firstRow()
            .map(this::mapRow)
            .orElseThrow(() -> new PermanentDataServiceException(kind.resource(), "Store returned no row for insert"));
    }

    public Optional<T> getById(String id) {
        if (id == null || id.isBlank()) {
            return Optional.empty();
        }
        DataResult result = get(QueryFilter.builder().eq("id", id).limit(1).build());
        return result.firstRow().map(this::mapRow);
    }

    public T update(String id, Map<String, ?> patch) {
        if (id == null || id.isBlank()) {
            throw new RecordNotFoundException(kind, id);
        }
        Map<String, Object> values = prepareForWrite(validator.validatePatch(kind, patch));
        values.put("updated_at", clock.instant());
        DataResult result;
        try {
            result = executor.execute(DataMethod.PATCH, kind.resource(), QueryFilter.builder().eq("id", id).body(values).build());
        } catch (PermanentDataServiceException e) {
            if (e.isConflict()) {
                throw new DuplicateRecordException(kind, e);
            }
            throw e;
        }
        return result.firstRow()
            .map(this::mapRow)
            .orElseThrow(() -> new RecordNotFoundException(kind, id));
    }

    public T delete(String id) {
        if (id == null || id.isBlank()) {
            throw new RecordNotFoundException(kind, id);
        }
        DataResult result = executor.execute(DataMethod.DELETE, kind.resource(), QueryFilter.builder().eq("id", id).build());
        return result.firstRow()
            .map(this::mapRow)
            .orElseThrow(() -> new RecordNotFoundException(kind, id));
    }

    /**
     * Equality-filtered listing, newest first. Filter keys must be columns of the resource.
     */
    public List<T> list(Map<String, ?> filters, int limit, int offset) {
        QueryFilter query = QueryFilter.builder();
        List<FieldError> errors = new ArrayList<>();
        if (filters != null) {
            for (Map.Entry<String, ?> entry : filters.entrySet()) {
                if (!ResourceSchema.isKnownColumn(kind.resource(), entry.getKey()) || "password_hash".equals(entry.getKey())) {
                    errors.add(new FieldError(entry.getKey(), "is not a filterable field"));
                    continue;
                }
                if (entry.getValue() == null) {
                    query.isNull(entry.getKey());
                } else {
                    query.eq(entry.getKey(), entry.getValue());
                }
            }
        }
        if (!errors.isEmpty()) {
            throw new ValidationException(errors);
        }
        int safeLimit = Math.max(1, Math.min(limit, properties.getStore().getMaxSearchLimit()));
        RequestParams params = query
            .orderBy("created_at", false)
            .orderBy("id", true)
            .limit(safeLimit)
            .offset(Math.max(0, offset))
            .build();
        return mapRows(get(params));
    }

    /**
     * Resolves many ids with one request per {@code batchCap} ids. Ids that do not resolve are
     * simply absent from the result.
     */
    public List<T> findByIds(Collection<String> ids) {
        if (ids == null || ids.isEmpty()) {
            return List.of();
        }
        List<String> distinct = new ArrayList<>(new LinkedHashSet<>(ids));
        List<T> out = new ArrayList<>(distinct.size());
        for (List<String> chunk : Batches.partition(distinct, properties.getStore().getBatchCap())) {
            out.addAll(mapRows(get(QueryFilter.builder().in("id", chunk).build())));
        }
        return out;
    }

    /**
     * Hook for turning validated fields into stored columns.
     */
    protected Map<String, Object> prepareForWrite(Map<String, Object> validated) {
        return validated;
    }

    protected DataResult get(RequestParams params) {
        return executor.execute(DataMethod.GET, kind.resource(), params);
    }

    protected List<T> mapRows(DataResult result) {
        List<T> out = new ArrayList<>(result.rows().size());
        for (Map<String, Object> row : result.rows()) {
            out.add(mapRow(row));
        }
        return out;
    }
}
