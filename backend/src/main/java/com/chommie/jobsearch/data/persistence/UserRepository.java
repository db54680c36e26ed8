package com.chommie.jobsearch.data.persistence;

import com.chommie.jobsearch.config.JobSearchProperties;
import com.chommie.jobsearch.data.model.EntityKind;
import com.chommie.jobsearch.data.model.SubscriptionPlan;
import com.chommie.jobsearch.data.model.User;
import com.chommie.jobsearch.data.store.QueryFilter;
import com.chommie.jobsearch.data.util.Rows;
import com.chommie.jobsearch.data.validation.EntityValidator;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Repository;

import java.time.Clock;
import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

@Repository
public class UserRepository extends AbstractStoreRepository<User> {
    private final PasswordEncoder passwordEncoder;

    public UserRepository(
        StoreRequestExecutor executor,
        EntityValidator validator,
        JobSearchProperties properties,
        Clock clock,
        PasswordEncoder passwordEncoder
    ) {
        super(EntityKind.USER, executor, validator, properties, clock);
        this.passwordEncoder = passwordEncoder;
    }

    public Optional<User> findByEmail(String email) {
        if (email == null || email.isBlank()) {
            return Optional.empty();
        }
        return get(QueryFilter.builder()
            .eq("email", email.trim().toLowerCase(Locale.ROOT))
            .limit(1)
            .build())
            .firstRow()
            .map(this::mapRow);
    }

    public User recordLogin(String id, Instant at) {
        return update(id, Map.of("last_login", at));
    }

    /**
     * The plain password never reaches the store; it is replaced by its hash.
     */
    @Override
    protected Map<String, Object> prepareForWrite(Map<String, Object> validated) {
        Object password = validated.remove(EntityValidator.PASSWORD_FIELD);
        if (password != null) {
            validated.put("password_hash", passwordEncoder.encode(password.toString()));
        }
        return validated;
    }

    @Override
    protected User mapRow(Map<String, Object> row) {
        return new User(
            Rows.string(row, "id"),
            Rows.string(row, "name"),
            Rows.string(row, "email"),
            Rows.string(row, "password_hash"),
            SubscriptionPlan.fromWire(Rows.string(row, "subscription_plan")),
            Rows.instant(row, "last_login"),
            Rows.instant(row, "created_at"),
            Rows.instant(row, "updated_at")
        );
    }
}
