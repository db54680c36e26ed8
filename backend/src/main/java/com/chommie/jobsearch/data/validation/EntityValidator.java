package com.chommie.jobsearch.data.validation;

import com.chommie.jobsearch.config.JobSearchProperties;
import com.chommie.jobsearch.data.model.ApplicationStatus;
import com.chommie.jobsearch.data.model.EntityKind;
import com.chommie.jobsearch.data.model.JobSearchFilters;
import com.chommie.jobsearch.data.model.JobType;
import com.chommie.jobsearch.data.model.SubscriptionPlan;
import org.jsoup.Jsoup;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import java.util.regex.Pattern;

/**
 * Schema checks for data headed to the store. Unknown fields are dropped, camelCase keys
 * are accepted, and free text is reduced to plain text. Holds no state besides limits.
 */
@Component
public class EntityValidator {
    public static final String PASSWORD_FIELD = "password";

    private static final Pattern EMAIL = Pattern.compile("^[A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Za-z]{2,}$");
    private static final Pattern SEARCH_UNSAFE = Pattern.compile("['\";%_\\\\,()*]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final int MAX_SEARCH_TERM_LENGTH = 100;
    private static final int MAX_SALARY = 100_000_000;

    private static final Map<EntityKind, List<FieldRule>> RULES = Map.of(
        EntityKind.JOB, List.of(
            FieldRule.text("title", true, 200),
            FieldRule.text("company", true, 200),
            FieldRule.text("location", false, 200),
            FieldRule.plainText("description", false, 20_000),
            FieldRule.url("url", 2048),
            FieldRule.integer("salary_min", 0, MAX_SALARY),
            FieldRule.integer("salary_max", 0, MAX_SALARY),
            FieldRule.choice("job_type", false, value -> JobType.fromWire(value) == null ? null : JobType.fromWire(value).wireValue(),
                "must be one of full-time, part-time, contract, internship"),
            FieldRule.flag("remote_friendly"),
            FieldRule.flag("is_active"),
            FieldRule.timestamp("expires_at")
        ),
        EntityKind.USER, List.of(
            FieldRule.text("name", true, 100),
            FieldRule.email("email"),
            FieldRule.password(PASSWORD_FIELD),
            FieldRule.choice("subscription_plan", false,
                value -> SubscriptionPlan.fromWire(value) == null ? null : SubscriptionPlan.fromWire(value).wireValue(),
                "must be one of basic, premium, enterprise"),
            FieldRule.timestamp("last_login")
        ),
        EntityKind.APPLICATION, List.of(
            FieldRule.text("user_id", true, 64),
            FieldRule.text("job_id", true, 64),
            FieldRule.plainText("cover_letter", false, 5000),
            FieldRule.choice("status", false,
                value -> ApplicationStatus.fromWire(value) == null ? null : ApplicationStatus.fromWire(value).wireValue(),
                "must be one of pending, reviewed, interview, accepted, rejected"),
            FieldRule.plainText("notes", false, 2000)
        )
    );

    private static final Map<EntityKind, Map<String, Object>> CREATE_DEFAULTS = Map.of(
        EntityKind.JOB, Map.of("job_type", JobType.FULL_TIME.wireValue(), "remote_friendly", false, "is_active", true),
        EntityKind.USER, Map.of("subscription_plan", SubscriptionPlan.BASIC.wireValue()),
        EntityKind.APPLICATION, Map.of("status", ApplicationStatus.PENDING.wireValue())
    );

    private final JobSearchProperties properties;

    public EntityValidator(JobSearchProperties properties) {
        this.properties = properties;
    }

    /**
     * Full validation for a new record: required fields must be present, defaults are filled in.
     */
    public Map<String, Object> validate(EntityKind kind, Map<String, ?> candidate) {
        Map<String, Object> clean = check(kind, candidate, true);
        for (Map.Entry<String, Object> entry : CREATE_DEFAULTS.getOrDefault(kind, Map.of()).entrySet()) {
            clean.putIfAbsent(entry.getKey(), entry.getValue());
        }
        return clean;
    }

    /**
     * Validation for a partial update: only supplied fields are checked.
     */
    public Map<String, Object> validatePatch(EntityKind kind, Map<String, ?> candidate) {
        Map<String, Object> clean = check(kind, candidate, false);
        if (clean.isEmpty()) {
            throw new ValidationException("*", "no updatable fields supplied");
        }
        return clean;
    }

    public JobSearchFilters validateSearch(JobSearchFilters filters) {
        JobSearchFilters source = filters == null
            ? new JobSearchFilters(null, null, null, null, null, false, null, null)
            : filters;
        List<FieldError> errors = new ArrayList<>();
        if (source.salaryMin() != null && source.salaryMin() < 0) {
            errors.add(new FieldError("salaryMin", "must be zero or greater"));
        }
        if (source.salaryMax() != null && source.salaryMax() < 0) {
            errors.add(new FieldError("salaryMax", "must be zero or greater"));
        }
        if (source.salaryMin() != null && source.salaryMax() != null && source.salaryMin() > source.salaryMax()) {
            errors.add(new FieldError("salaryMin", "must not exceed salaryMax"));
        }
        if (!errors.isEmpty()) {
            throw new ValidationException(errors);
        }
        JobSearchProperties.Store store = properties.getStore();
        int limit = source.limit() == null
            ? store.getDefaultSearchLimit()
            : Math.max(1, Math.min(source.limit(), store.getMaxSearchLimit()));
        int offset = source.offset() == null ? 0 : Math.max(0, source.offset());
        return new JobSearchFilters(
            sanitizeSearchTerm(source.query()),
            sanitizeSearchTerm(source.location()),
            source.jobType(),
            source.salaryMin(),
            source.salaryMax(),
            source.remoteOnly(),
            limit,
            offset
        );
    }

    /**
     * Strips characters that carry meaning in pattern or filter syntax. Returns null when
     * nothing searchable is left.
     */
    public String sanitizeSearchTerm(String term) {
        if (term == null) {
            return null;
        }
        String stripped = SEARCH_UNSAFE.matcher(term).replaceAll(" ");
        stripped = WHITESPACE.matcher(stripped).replaceAll(" ").trim();
        if (stripped.isEmpty()) {
            return null;
        }
        if (stripped.length() > MAX_SEARCH_TERM_LENGTH) {
            stripped = stripped.substring(0, MAX_SEARCH_TERM_LENGTH).trim();
        }
        return stripped;
    }

    private Map<String, Object> check(EntityKind kind, Map<String, ?> candidate, boolean requireAll) {
        Map<String, Object> input = normalizeKeys(candidate);
        Map<String, Object> clean = new LinkedHashMap<>();
        List<FieldError> errors = new ArrayList<>();
        for (FieldRule rule : RULES.getOrDefault(kind, List.of())) {
            boolean present = input.containsKey(rule.name());
            Object raw = input.get(rule.name());
            if (!present || isBlank(raw)) {
                if (rule.required() && (requireAll || present)) {
                    errors.add(new FieldError(rule.name(), "is required"));
                } else if (present && !rule.required()) {
                    clean.put(rule.name(), null);
                }
                continue;
            }
            try {
                clean.put(rule.name(), rule.convert(raw));
            } catch (IllegalArgumentException e) {
                errors.add(new FieldError(rule.name(), e.getMessage()));
            }
        }
        if (kind == EntityKind.JOB) {
            Object min = clean.get("salary_min");
            Object max = clean.get("salary_max");
            if (min instanceof Integer minValue && max instanceof Integer maxValue && minValue > maxValue) {
                errors.add(new FieldError("salary_min", "must not exceed salary_max"));
            }
        }
        if (!errors.isEmpty()) {
            throw new ValidationException(errors);
        }
        return clean;
    }

    private Map<String, Object> normalizeKeys(Map<String, ?> candidate) {
        Map<String, Object> out = new LinkedHashMap<>();
        if (candidate == null) {
            return out;
        }
        for (Map.Entry<String, ?> entry : candidate.entrySet()) {
            if (entry.getKey() != null) {
                out.put(toSnakeCase(entry.getKey()), entry.getValue());
            }
        }
        return out;
    }

    static String toSnakeCase(String key) {
        StringBuilder out = new StringBuilder(key.length() + 4);
        for (int i = 0; i < key.length(); i++) {
            char c = key.charAt(i);
            if (Character.isUpperCase(c)) {
                if (i > 0) {
                    out.append('_');
                }
                out.append(Character.toLowerCase(c));
            } else {
                out.append(c);
            }
        }
        return out.toString().trim();
    }

    private static boolean isBlank(Object value) {
        return value == null || (value instanceof String s && s.isBlank());
    }

    private record FieldRule(String name, boolean required, Function<Object, Object> converter) {

        Object convert(Object raw) {
            return converter.apply(raw);
        }

        static FieldRule text(String name, boolean required, int maxLength) {
            return new FieldRule(name, required, raw -> boundedText(raw, maxLength));
        }

        static FieldRule plainText(String name, boolean required, int maxLength) {
            return new FieldRule(name, required, raw -> {
                String value = raw.toString();
                if (value.indexOf('<') >= 0) {
                    value = Jsoup.parse(value).text();
                }
                return boundedText(value, maxLength);
            });
        }

        static FieldRule url(String name, int maxLength) {
            return new FieldRule(name, false, raw -> {
                String value = boundedText(raw, maxLength);
                String lower = value.toLowerCase(Locale.ROOT);
                if (!lower.startsWith("http://") && !lower.startsWith("https://")) {
                    throw new IllegalArgumentException("must be an http(s) URL");
                }
                return value;
            });
        }

        static FieldRule email(String name) {
            return new FieldRule(name, true, raw -> {
                String value = raw.toString().trim().toLowerCase(Locale.ROOT);
                if (value.length() > 254 || !EMAIL.matcher(value).matches()) {
                    throw new IllegalArgumentException("must be a valid email address");
                }
                return value;
            });
        }

        static FieldRule password(String name) {
            return new FieldRule(name, true, raw -> {
                String value = raw.toString();
                if (value.length() < 8) {
                    throw new IllegalArgumentException("must be at least 8 characters");
                }
                if (value.length() > 72) {
                    throw new IllegalArgumentException("must be at most 72 characters");
                }
                return value;
            });
        }

        static FieldRule integer(String name, int min, int max) {
            return new FieldRule(name, false, raw -> {
                long value;
                if (raw instanceof Number number) {
                    if (number.doubleValue() != Math.rint(number.doubleValue())) {
                        throw new IllegalArgumentException("must be a whole number");
                    }
                    value = number.longValue();
                } else {
                    try {
                        value = Long.parseLong(raw.toString().trim());
                    } catch (NumberFormatException e) {
                        throw new IllegalArgumentException("must be a whole number");
                    }
                }
                if (value < min || value > max) {
                    throw new IllegalArgumentException("must be between " + min + " and " + max);
                }
                return (int) value;
            });
        }

        static FieldRule flag(String name) {
            return new FieldRule(name, false, raw -> {
                if (raw instanceof Boolean b) {
                    return b;
                }
                String value = raw.toString().trim().toLowerCase(Locale.ROOT);
                if (value.equals("true")) {
                    return true;
                }
                if (value.equals("false")) {
                    return false;
                }
                throw new IllegalArgumentException("must be true or false");
            });
        }

        static FieldRule timestamp(String name) {
            return new FieldRule(name, false, raw -> {
                if (raw instanceof Instant instant) {
                    return instant;
                }
                String value = raw.toString().trim();
                try {
                    return Instant.parse(value);
                } catch (DateTimeParseException e) {
                    try {
                        return OffsetDateTime.parse(value).toInstant();
                    } catch (DateTimeParseException ignored) {
                        throw new IllegalArgumentException("must be an ISO-8601 timestamp");
                    }
                }
            });
        }

        static FieldRule choice(String name, boolean required, Function<String, String> parser, String message) {
            return new FieldRule(name, required, raw -> {
                String parsed = parser.apply(raw.toString());
                if (parsed == null) {
                    throw new IllegalArgumentException(message);
                }
                return parsed;
            });
        }

        private static String boundedText(Object raw, int maxLength) {
            String value = raw.toString().trim();
            if (value.length() > maxLength) {
                throw new IllegalArgumentException("must be at most " + maxLength + " characters");
            }
            return value;
        }
    }
}
