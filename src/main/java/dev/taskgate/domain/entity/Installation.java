package dev.taskgate.domain.entity;

import dev.taskgate.domain.valueobject.TokenInfo;
import jakarta.persistence.*;

import java.time.Instant;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * One tenant's credentials for one platform.
 *
 * <p>Design: at most one active row per (platform, organization_id), enforced by a partial
 * unique index; deactivation is a soft flag so a revoked tenant's history is never
 * overwritten. {@code @Version} lets a token refresh commit only if nobody refreshed first.
 */
@Entity
@Table(name = "installations", indexes = {
        @Index(name = "idx_installation_platform_org", columnList = "platform, organization_id")
})
public class Installation {

    @Id
    @Column(columnDefinition = "uuid")
    private UUID id;

    @Column(nullable = false, length = 32)
    private String platform;

    @Column(name = "organization_id", nullable = false)
    private String organizationId;

    @Column(name = "organization_name")
    private String organizationName;

    @Column(name = "access_token", nullable = false, length = 4000)
    private String accessToken;

    @Column(name = "refresh_token", length = 4000)
    private String refreshToken;

    @Column(name = "token_expires_at")
    private Instant tokenExpiresAt;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "installation_scopes", joinColumns = @JoinColumn(name = "installation_id"))
    @Column(name = "scope", nullable = false)
    private Set<String> scopes = new HashSet<>();

    @Column(name = "webhook_secret", nullable = false)
    private String webhookSecret;

    @Column(name = "installed_by")
    private String installedBy;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "installation_metadata", joinColumns = @JoinColumn(name = "installation_id"))
    @MapKeyColumn(name = "meta_key")
    @Column(name = "meta_value", columnDefinition = "text")
    private Map<String, String> metadata = new HashMap<>();

    @Column(name = "is_active", nullable = false)
    private boolean active;

    @Version
    private Long version;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    protected Installation() {
    }

    public static Installation create(String platform, String organizationId, String organizationName,
            TokenInfo token, String webhookSecret, String installedBy,
            Map<String, String> metadata, Instant now) {
        Installation i = new Installation();
        i.id = UUID.randomUUID();
        i.platform = platform;
        i.organizationId = organizationId;
        i.organizationName = organizationName;
        i.accessToken = token.accessToken();
        i.refreshToken = token.refreshToken();
        i.tokenExpiresAt = token.expiresAt();
        i.scopes = new HashSet<>(token.scopes());
        i.webhookSecret = webhookSecret;
        i.installedBy = installedBy;
        i.metadata = metadata == null ? new HashMap<>() : new HashMap<>(metadata);
        i.active = true;
        i.createdAt = now;
        i.updatedAt = now;
        return i;
    }

    public void applyRefreshedToken(TokenInfo token, Instant now) {
        this.accessToken = token.accessToken();
        // Some providers only rotate the access token
        if (token.refreshToken() != null) this.refreshToken = token.refreshToken();
        this.tokenExpiresAt = token.expiresAt();
        if (!token.scopes().isEmpty()) this.scopes = new HashSet<>(token.scopes());
        this.updatedAt = now;
    }

    public void deactivate(Instant now) {
        this.active = false;
        this.updatedAt = now;
    }

    public TokenInfo tokenInfo() {
        return new TokenInfo(accessToken, refreshToken, tokenExpiresAt, scopes);
    }

    public boolean isTokenExpired(Instant now) {
        return tokenExpiresAt != null && !tokenExpiresAt.isAfter(now);
    }

    // Getters
    public UUID getId() {
        return id;
    }

    public String getPlatform() {
        return platform;
    }

    public String getOrganizationId() {
        return organizationId;
    }

    public String getOrganizationName() {
        return organizationName;
    }

    public String getAccessToken() {
        return accessToken;
    }

    public String getRefreshToken() {
        return refreshToken;
    }

    public Instant getTokenExpiresAt() {
        return tokenExpiresAt;
    }

    public Set<String> getScopes() {
        return Set.copyOf(scopes);
    }

    public String getWebhookSecret() {
        return webhookSecret;
    }

    public String getInstalledBy() {
        return installedBy;
    }

    public Map<String, String> getMetadata() {
        return Map.copyOf(metadata);
    }

    public boolean isActive() {
        return active;
    }

    public Long getVersion() {
        return version;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }
}
