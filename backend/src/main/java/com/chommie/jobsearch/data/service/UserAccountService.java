package com.chommie.jobsearch.data.service;

import com.chommie.jobsearch.config.JobSearchProperties;
import com.chommie.jobsearch.data.cache.CacheKeys;
import com.chommie.jobsearch.data.cache.ResultCacheManager;
import com.chommie.jobsearch.data.guard.AttemptGuard;
import com.chommie.jobsearch.data.model.ApplicationStatistics;
import com.chommie.jobsearch.data.model.ApplicationStatus;
import com.chommie.jobsearch.data.model.ApplicationWithJob;
import com.chommie.jobsearch.data.model.AuthenticationResult;
import com.chommie.jobsearch.data.model.EntityKind;
import com.chommie.jobsearch.data.model.ErrorCodes;
import com.chommie.jobsearch.data.model.RegistrationResult;
import com.chommie.jobsearch.data.model.User;
import com.chommie.jobsearch.data.model.UserProfile;
import com.chommie.jobsearch.data.model.UserSummary;
import com.chommie.jobsearch.data.persistence.ApplicationRepository;
import com.chommie.jobsearch.data.persistence.DuplicateRecordException;
import com.chommie.jobsearch.data.persistence.StoreUnavailableException;
import com.chommie.jobsearch.data.persistence.UserRepository;
import com.chommie.jobsearch.data.validation.EntityValidator;
import com.chommie.jobsearch.data.validation.FieldError;
import com.chommie.jobsearch.data.validation.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

@Service
public class UserAccountService {
    private static final Logger log = LoggerFactory.getLogger(UserAccountService.class);
    private static final String USERS = EntityKind.USER.resource();

    private final UserRepository userRepository;
    private final ApplicationRepository applicationRepository;
    private final EntityValidator validator;
    private final PasswordEncoder passwordEncoder;
    private final ResultCacheManager cache;
    private final AttemptGuard loginGuard;
    private final JobSearchProperties properties;
    private final Clock clock;

    public UserAccountService(
        UserRepository userRepository,
        ApplicationRepository applicationRepository,
        EntityValidator validator,
        PasswordEncoder passwordEncoder,
        ResultCacheManager cache,
        @Qualifier("loginGuard") AttemptGuard loginGuard,
        JobSearchProperties properties,
        Clock clock
    ) {
        this.userRepository = userRepository;
        this.applicationRepository = applicationRepository;
        this.validator = validator;
        this.passwordEncoder = passwordEncoder;
        this.cache = cache;
        this.loginGuard = loginGuard;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Validates before touching the store, so malformed input never costs a request.
     */
    public RegistrationResult registerUser(Map<String, ?> data) {
        try {
            validator.validate(EntityKind.USER, data);
        } catch (ValidationException e) {
            return RegistrationResult.failed(ErrorCodes.VALIDATION_FAILED, e.getFieldErrors());
        }
        try {
            User user = userRepository.create(data);
            log.info("Registered user {}", user.id());
            return RegistrationResult.registered(user.id());
        } catch (DuplicateRecordException e) {
            return RegistrationResult.failed(ErrorCodes.EMAIL_TAKEN, List.of(new FieldError("email", "is already registered")));
        } catch (StoreUnavailableException e) {
            return RegistrationResult.failed(ErrorCodes.STORE_UNAVAILABLE, List.of());
        }
    }

    /**
     * Email and password check behind the login guard. Unknown emails and wrong passwords
     * produce the same error and both count as failed attempts. The attempt is reserved on the
     * guard before the password is checked, so concurrent guesses cannot exceed the limit.
     */
    public AuthenticationResult authenticateUser(String email, String password) {
        String actorKey = email == null ? null : email.trim().toLowerCase(Locale.ROOT);
        if (loginGuard.isLocked(actorKey)) {
            return AuthenticationResult.failed(ErrorCodes.ACCOUNT_LOCKED);
        }
        if (actorKey == null || actorKey.isEmpty() || password == null || password.isEmpty()) {
            return AuthenticationResult.failed(ErrorCodes.INVALID_CREDENTIALS);
        }
        if (!loginGuard.reserveAttempt(actorKey)) {
            return AuthenticationResult.failed(ErrorCodes.ACCOUNT_LOCKED);
        }
        Optional<User> user;
        try {
            user = userRepository.findByEmail(actorKey);
        } catch (StoreUnavailableException e) {
            loginGuard.releaseAttempt(actorKey);
            return AuthenticationResult.failed(ErrorCodes.STORE_UNAVAILABLE);
        }
        boolean matches = user.isPresent()
            && user.get().passwordHash() != null
            && passwordEncoder.matches(password, user.get().passwordHash());
        if (!matches) {
            return AuthenticationResult.failed(ErrorCodes.INVALID_CREDENTIALS);
        }
        loginGuard.recordAttempt(actorKey, true);
        User loggedIn = user.get();
        try {
            loggedIn = userRepository.recordLogin(loggedIn.id(), clock.instant());
        } catch (StoreUnavailableException e) {
            log.warn("Could not record login for {}: {}", loggedIn.id(), e.getMessage());
        }
        cache.invalidateByPrefix(EntityKind.USER.cacheNamespace());
        return AuthenticationResult.authenticated(loggedIn.toSummary());
    }

    public Optional<UserSummary> getUser(String userId) {
        if (userId == null || userId.isBlank()) {
            return Optional.empty();
        }
        String key = CacheKeys.key(USERS, CacheKeys.BY_ID, userId);
        Optional<UserSummary> cached = cache.get(key, UserSummary.class);
        if (cached.isPresent()) {
            return cached;
        }
        Optional<UserSummary> user = userRepository.getById(userId).map(User::toSummary);
        user.ifPresent(value -> cache.set(key, value, Duration.ofSeconds(properties.getCache().getEntityTtlSeconds())));
        return user;
    }

    public Optional<UserProfile> getUserProfile(String userId) {
        Optional<UserSummary> user = getUser(userId);
        if (user.isEmpty()) {
            return Optional.empty();
        }
        List<ApplicationWithJob> applications = applicationRepository.getUserApplications(userId);
        return Optional.of(new UserProfile(user.get(), applications, statistics(applications)));
    }

    static ApplicationStatistics statistics(List<ApplicationWithJob> applications) {
        Map<ApplicationStatus, Integer> byStatus = new EnumMap<>(ApplicationStatus.class);
        for (ApplicationStatus status : ApplicationStatus.values()) {
            byStatus.put(status, 0);
        }
        for (ApplicationWithJob entry : applications) {
            ApplicationStatus status = entry.application().status();
            if (status != null) {
                byStatus.merge(status, 1, Integer::sum);
            }
        }
        return new ApplicationStatistics(applications.size(), byStatus);
    }
}
