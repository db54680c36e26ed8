package com.chommie.jobsearch.data.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.Reader;
import java.sql.Clob;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

/**
 * Store binding over a relational database. Every value travels as a bound parameter;
 * identifiers are restricted to {@link ResourceSchema}.
 */
@Service
@ConditionalOnProperty(prefix = "jobsearch.store", name = "mode", havingValue = "jdbc", matchIfMissing = true)
public class JdbcDataServiceClient implements DataServiceClient {
    private static final Logger log = LoggerFactory.getLogger(JdbcDataServiceClient.class);

    private final NamedParameterJdbcTemplate jdbc;

    public JdbcDataServiceClient(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    @Override
    public DataResult request(DataMethod method, String resourcePath, RequestParams params) {
        RequestParams safeParams = params == null ? RequestParams.none() : params;
        ResourceSchema.check(method, resourcePath, safeParams);
        try {
            return switch (method) {
                case GET -> select(resourcePath, safeParams);
                case POST -> insert(resourcePath, safeParams);
                case PATCH -> update(resourcePath, safeParams);
                case DELETE -> delete(resourcePath, safeParams);
            };
        } catch (DuplicateKeyException e) {
            throw new PermanentDataServiceException(resourcePath, "Unique constraint violated", true, e);
        } catch (DataIntegrityViolationException e) {
            throw new PermanentDataServiceException(resourcePath, "Constraint violated: " + e.getMostSpecificCause().getMessage(), false, e);
        } catch (TransientDataAccessException | RecoverableDataAccessException | DataAccessResourceFailureException e) {
            log.warn("Transient store failure on {} {}: {}", method, resourcePath, e.getMessage());
            throw new TransientDataServiceException(resourcePath, e.getMessage(), e);
        } catch (DataAccessException e) {
            throw new PermanentDataServiceException(resourcePath, e.getMessage(), false, e);
        }
    }

    private DataResult select(String resource, RequestParams params) {
        MapSqlParameterSource sqlParams = new MapSqlParameterSource();
        String where = whereClause(params, sqlParams);
        StringBuilder sql = new StringBuilder("SELECT * FROM ").append(resource).append(where);
        if (!params.order().isEmpty()) {
            List<String> parts = new ArrayList<>();
            for (SortOrder order : params.order()) {
                parts.add(order.field() + (order.ascending() ? " ASC" : " DESC"));
            }
            sql.append(" ORDER BY ").append(String.join(", ", parts));
        }
        if (params.limit() != null) {
            sql.append(" LIMIT :_limit");
            sqlParams.addValue("_limit", Math.max(0, params.limit()));
        }
        if (params.offset() != null && params.offset() > 0) {
            sql.append(" OFFSET :_offset");
            sqlParams.addValue("_offset", params.offset());
        }
        List<Map<String, Object>> rows = normalizeRows(jdbc.queryForList(sql.toString(), sqlParams));
        Long total = null;
        if (params.countTotal()) {
            Long counted = jdbc.queryForObject("SELECT COUNT(*) FROM " + resource + where, sqlParams, Long.class);
            total = counted == null ? 0L : counted;
        }
        return new DataResult(rows, total);
    }

    private DataResult insert(String resource, RequestParams params) {
        if (params.body().isEmpty()) {
            throw new PermanentDataServiceException(resource, "Insert without values");
        }
        Map<String, Object> values = new LinkedHashMap<>(params.body());
        Object id = values.get("id");
        if (id == null || id.toString().isBlank()) {
            id = UUID.randomUUID().toString();
            values.put("id", id);
        }
        MapSqlParameterSource sqlParams = new MapSqlParameterSource();
        List<String> columns = new ArrayList<>();
        List<String> placeholders = new ArrayList<>();
        for (Map.Entry<String, Object> entry : values.entrySet()) {
            columns.add(entry.getKey());
            placeholders.add(":v_" + entry.getKey());
            sqlParams.addValue("v_" + entry.getKey(), toSqlValue(entry.getValue()));
        }
        jdbc.update(
            "INSERT INTO " + resource + " (" + String.join(", ", columns) + ") VALUES (" + String.join(", ", placeholders) + ")",
            sqlParams
        );
        return selectByIds(resource, List.of(id.toString()));
    }

    private DataResult update(String resource, RequestParams params) {
        if (params.body().isEmpty()) {
            throw new PermanentDataServiceException(resource, "Update without values");
        }
        if (!params.hasFilters()) {
            throw new PermanentDataServiceException(resource, "Refusing unfiltered update");
        }
        List<String> ids = matchingIds(resource, params);
        if (ids.isEmpty()) {
            return DataResult.of(List.of());
        }
        MapSqlParameterSource sqlParams = new MapSqlParameterSource().addValue("_ids", ids);
        List<String> assignments = new ArrayList<>();
        for (Map.Entry<String, Object> entry : params.body().entrySet()) {
            assignments.add(entry.getKey() + " = :v_" + entry.getKey());
            sqlParams.addValue("v_" + entry.getKey(), toSqlValue(entry.getValue()));
        }
        jdbc.update("UPDATE " + resource + " SET " + String.join(", ", assignments) + " WHERE id IN (:_ids)", sqlParams);
        return selectByIds(resource, ids);
    }

    private DataResult delete(String resource, RequestParams params) {
        if (!params.hasFilters()) {
            throw new PermanentDataServiceException(resource, "Refusing unfiltered delete");
        }
        List<String> ids = matchingIds(resource, params);
        if (ids.isEmpty()) {
            return DataResult.of(List.of());
        }
        DataResult existing = selectByIds(resource, ids);
        jdbc.update("DELETE FROM " + resource + " WHERE id IN (:_ids)", new MapSqlParameterSource("_ids", ids));
        return existing;
    }

    private List<String> matchingIds(String resource, RequestParams params) {
        MapSqlParameterSource sqlParams = new MapSqlParameterSource();
        String where = whereClause(params, sqlParams);
        return jdbc.queryForList("SELECT id FROM " + resource + where, sqlParams, String.class);
    }

    private DataResult selectByIds(String resource, List<String> ids) {
        List<Map<String, Object>> rows = jdbc.queryForList(
            "SELECT * FROM " + resource + " WHERE id IN (:_ids)",
            new MapSqlParameterSource("_ids", ids)
        );
        return DataResult.of(normalizeRows(rows));
    }

    private String whereClause(RequestParams params, MapSqlParameterSource sqlParams) {
        List<String> clauses = new ArrayList<>();
        int[] counter = {0};
        for (FilterCondition condition : params.filters()) {
            clauses.add(predicate(condition, sqlParams, counter));
        }
        for (List<FilterCondition> group : params.anyOf()) {
            if (group.isEmpty()) {
                continue;
            }
            List<String> alternatives = new ArrayList<>();
            for (FilterCondition condition : group) {
                alternatives.add(predicate(condition, sqlParams, counter));
            }
            clauses.add("(" + String.join(" OR ", alternatives) + ")");
        }
        if (clauses.isEmpty()) {
            return "";
        }
        return " WHERE " + String.join(" AND ", clauses);
    }

    private String predicate(FilterCondition condition, MapSqlParameterSource sqlParams, int[] counter) {
        String name = "p" + counter[0]++;
        String column = condition.field();
        switch (condition.operator()) {
            case IS_NULL:
                return column + " IS NULL";
            case IN: {
                Collection<?> values = condition.value() instanceof Collection<?> c ? c : List.of(condition.value());
                if (values.isEmpty()) {
                    return "1 = 0";
                }
                sqlParams.addValue(name, values.stream().map(this::toSqlValue).toList());
                return column + " IN (:" + name + ")";
            }
            case ILIKE:
                sqlParams.addValue(name, "%" + escapeLike(String.valueOf(condition.value()).toLowerCase(Locale.ROOT)) + "%");
                return "LOWER(" + column + ") LIKE :" + name + " ESCAPE '\\'";
            default:
                sqlParams.addValue(name, toSqlValue(condition.value()));
                return column + " " + comparison(condition.operator()) + " :" + name;
        }
    }

    private String comparison(FilterOperator operator) {
        return switch (operator) {
            case EQ -> "=";
            case NEQ -> "<>";
            case GT -> ">";
            case GTE -> ">=";
            case LT -> "<";
            case LTE -> "<=";
            default -> throw new IllegalArgumentException("Not a comparison: " + operator);
        };
    }

    private String escapeLike(String value) {
        return value.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
    }

    private Object toSqlValue(Object value) {
        if (value instanceof Instant instant) {
            return Timestamp.from(instant);
        }
        return value;
    }

    private List<Map<String, Object>> normalizeRows(List<Map<String, Object>> rows) {
        List<Map<String, Object>> normalized = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            Map<String, Object> out = new LinkedHashMap<>();
            for (Map.Entry<String, Object> entry : row.entrySet()) {
                out.put(entry.getKey().toLowerCase(Locale.ROOT), normalizeValue(entry.getValue()));
            }
            normalized.add(out);
        }
        return normalized;
    }

    private Object normalizeValue(Object value) {
        if (value instanceof Timestamp timestamp) {
            return timestamp.toInstant();
        }
        if (value instanceof OffsetDateTime offsetDateTime) {
            return offsetDateTime.toInstant();
        }
        if (value instanceof Clob clob) {
            return readClob(clob);
        }
        return value;
    }

    private String readClob(Clob clob) {
        try (Reader reader = clob.getCharacterStream()) {
            StringBuilder out = new StringBuilder();
            char[] buffer = new char[4096];
            int read;
            while ((read = reader.read(buffer)) != -1) {
                out.append(buffer, 0, read);
            }
            return out.toString();
        } catch (SQLException | IOException e) {
            throw new PermanentDataServiceException(null, "Unreadable text column", false, e);
        }
    }
}
