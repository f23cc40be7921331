package dev.taskgate.service;

import dev.taskgate.config.TokenProperties;
import dev.taskgate.domain.entity.Installation;
import dev.taskgate.domain.valueobject.TokenInfo;
import dev.taskgate.dto.request.CreateInstallationRequest;
import dev.taskgate.exception.DuplicateInstallationException;
import dev.taskgate.exception.InstallationNotFoundException;
import dev.taskgate.exception.TokenRefreshException;
import dev.taskgate.infrastructure.oauth.PlatformTokenRefresher;
import dev.taskgate.infrastructure.oauth.TokenRefresherRegistry;
import dev.taskgate.repository.InstallationRepository;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Owns installations and their provider credentials.
 *
 * <p>Refresh coordination: at most one refresh per installation is in flight inside this
 * process. Callers that find the token expired queue on a per-installation lock; whoever
 * gets it first refreshes, the rest re-read the row and get the new token. Across
 * processes the {@code @Version} column decides: a stale write fails and the loser
 * returns the row the winner committed.
 *
 * <p>{@link #getToken} is not transactional: the upstream call must not hold
 * a database transaction open.
 */
@Service
public class TokenService {
    private static final Logger log = LoggerFactory.getLogger(TokenService.class);

    private final InstallationRepository repository;
    private final TokenRefresherRegistry refreshers;
    private final Clock clock;
    private final Duration refreshSkew;
    private final Retry refreshRetry;
    private final Map<UUID, ReentrantLock> refreshLocks = new ConcurrentHashMap<>();

    public TokenService(InstallationRepository repository, TokenRefresherRegistry refreshers,
                        TokenProperties properties, Clock clock) {
        this.repository = repository;
        this.refreshers = refreshers;
        this.clock = clock;
        this.refreshSkew = properties.refreshSkew();
        // One retry for transient failures; permanent ones surface immediately
        this.refreshRetry = Retry.of("token-refresh", RetryConfig.custom()
                .maxAttempts(2)
                .waitDuration(properties.retryBackoff())
                .retryOnException(e -> e instanceof TokenRefreshException tre && !tre.isPermanent())
                .build());
    }

    /**
     * Returns a non-expired token for the tenant, refreshing it first if needed.
     *
     * @throws InstallationNotFoundException if the tenant has no active installation
     * @throws TokenRefreshException         if the refresh failed; permanent failures also
     *                                       deactivate the installation
     */
    public TokenInfo getToken(String platform, String organizationId) {
        Installation installation = findActive(platform, organizationId);
        if (!isExpired(installation)) return installation.tokenInfo();
        return refreshCoalesced(installation.getId(), installation.getPlatform(), organizationId);
    }

    @Transactional(readOnly = true)
    public String getWebhookSecret(String platform, String organizationId) {
        return findActive(platform, organizationId).getWebhookSecret();
    }

    @Transactional
    public Installation createInstallation(CreateInstallationRequest request) {
        requireText(request.platform(), "platform");
        requireText(request.organizationId(), "organizationId");
        requireText(request.accessToken(), "accessToken");
        requireText(request.webhookSecret(), "webhookSecret");
        String platform = normalizePlatform(request.platform());

        if (repository.existsByPlatformAndOrganizationIdAndActiveTrue(platform, request.organizationId()))
            throw new DuplicateInstallationException(platform, request.organizationId());

        Installation installation = Installation.create(platform, request.organizationId(),
                request.organizationName(),
                new TokenInfo(request.accessToken(), request.refreshToken(), request.tokenExpiresAt(), request.scopes()),
                request.webhookSecret(), request.installedBy(), request.metadata(), clock.instant());
        try {
            installation = repository.saveAndFlush(installation);
        } catch (DataIntegrityViolationException e) {
            // Lost a race against a concurrent create; the partial unique index caught it
            throw new DuplicateInstallationException(platform, request.organizationId());
        }
        log.info("Created {} installation {} for org {}", platform, installation.getId(), request.organizationId());
        return installation;
    }

    @Transactional
    public void deactivateInstallation(UUID installationId) {
        Installation installation = repository.findById(installationId)
                .orElseThrow(() -> new InstallationNotFoundException(installationId));
        if (!installation.isActive()) return;
        installation.deactivate(clock.instant());
        repository.save(installation);
        refreshLocks.remove(installationId);
        log.info("Deactivated {} installation {} for org {}",
                installation.getPlatform(), installationId, installation.getOrganizationId());
    }

    @Transactional(readOnly = true)
    public Installation getInstallation(UUID installationId) {
        return repository.findById(installationId)
                .orElseThrow(() -> new InstallationNotFoundException(installationId));
    }

    @Transactional(readOnly = true)
    public List<Installation> listActiveInstallations(String platform) {
        if (platform == null || platform.isBlank()) return repository.findByActiveTrueOrderByCreatedAtAsc();
        return repository.findByPlatformAndActiveTrueOrderByCreatedAtAsc(normalizePlatform(platform));
    }

    private TokenInfo refreshCoalesced(UUID installationId, String platform, String organizationId) {
        ReentrantLock lock = refreshLocks.computeIfAbsent(installationId, id -> new ReentrantLock());
        lock.lock();
        try {
            Installation current = repository.findById(installationId)
                    .filter(Installation::isActive)
                    .orElseThrow(() -> new InstallationNotFoundException(platform, organizationId));
            if (!isExpired(current)) {
                log.debug("Token for {}/{} already refreshed by a concurrent caller", platform, organizationId);
                return current.tokenInfo();
            }

            PlatformTokenRefresher refresher = refreshers.find(platform)
                    .orElseThrow(() -> new TokenRefreshException("No token refresher for platform " + platform, false));
            TokenInfo fresh;
            try {
                fresh = Retry.decorateSupplier(refreshRetry, () -> refresher.refresh(current)).get();
            } catch (TokenRefreshException e) {
                if (e.isPermanent()) deactivateRevoked(current, e);
                throw e;
            }

            current.applyRefreshedToken(fresh, clock.instant());
            try {
                return repository.save(current).tokenInfo();
            } catch (OptimisticLockingFailureException e) {
                log.info("Token for {}/{} was refreshed elsewhere first; using the stored one", platform, organizationId);
                return repository.findById(installationId)
                        .map(Installation::tokenInfo)
                        .orElseThrow(() -> new InstallationNotFoundException(platform, organizationId));
            }
        } finally {
            lock.unlock();
        }
    }

    private void deactivateRevoked(Installation installation, TokenRefreshException cause) {
        log.warn("Refresh for {}/{} rejected permanently, deactivating installation {}: {}",
                installation.getPlatform(), installation.getOrganizationId(), installation.getId(),
                cause.getMessage());
        installation.deactivate(clock.instant());
        try {
            repository.save(installation);
        } catch (OptimisticLockingFailureException e) {
            log.warn("Installation {} changed concurrently; deactivating the stored row", installation.getId());
            repository.findById(installation.getId()).ifPresent(stored -> {
                stored.deactivate(clock.instant());
                repository.save(stored);
            });
        }
        refreshLocks.remove(installation.getId());
    }

    private Installation findActive(String platform, String organizationId) {
        requireText(platform, "platform");
        return repository.findByPlatformAndOrganizationIdAndActiveTrue(normalizePlatform(platform), organizationId)
                .orElseThrow(() -> new InstallationNotFoundException(platform, organizationId));
    }

    static String normalizePlatform(String platform) {
        return platform.trim().toLowerCase(Locale.ROOT);
    }

    private boolean isExpired(Installation installation) {
        return installation.isTokenExpired(clock.instant().plus(refreshSkew));
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank()) throw new IllegalArgumentException(field + " is required");
    }
}
