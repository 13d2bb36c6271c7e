package com.vcc.traingateway.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "gw")
@Validated
public class GwProperties {

    @NotBlank
    private String upstreamBaseUrl = "https://api.anthropic.com";

    @NotBlank
    private String anthropicVersion = "2023-06-01";

    @NotBlank
    private String bedrockDefaultRegion = "us-east-1";

    @Valid
    private CryptoConfig crypto = new CryptoConfig();
    @Valid
    private OAuthConfig oauth = new OAuthConfig();
    @Valid
    private RoutingConfig routing = new RoutingConfig();
    @Valid
    private AuthConfig auth = new AuthConfig();
    private CacheConfig cache = new CacheConfig();
    private AdminConfig admin = new AdminConfig();
    private ImportConfig importConfig = new ImportConfig();

    // ==================== Getters/Setters ====================

    public String getUpstreamBaseUrl() {
        return upstreamBaseUrl;
    }

    public void setUpstreamBaseUrl(String upstreamBaseUrl) {
        this.upstreamBaseUrl = upstreamBaseUrl;
    }

    public String getAnthropicVersion() {
        return anthropicVersion;
    }

    public void setAnthropicVersion(String anthropicVersion) {
        this.anthropicVersion = anthropicVersion;
    }

    public String getBedrockDefaultRegion() {
        return bedrockDefaultRegion;
    }

    public void setBedrockDefaultRegion(String bedrockDefaultRegion) {
        this.bedrockDefaultRegion = bedrockDefaultRegion;
    }

    public CryptoConfig getCrypto() {
        return crypto;
    }

    public void setCrypto(CryptoConfig crypto) {
        this.crypto = crypto;
    }

    public OAuthConfig getOauth() {
        return oauth;
    }

    public void setOauth(OAuthConfig oauth) {
        this.oauth = oauth;
    }

    public RoutingConfig getRouting() {
        return routing;
    }

    public void setRouting(RoutingConfig routing) {
        this.routing = routing;
    }

    public AuthConfig getAuth() {
        return auth;
    }

    public void setAuth(AuthConfig auth) {
        this.auth = auth;
    }

    public CacheConfig getCache() {
        return cache;
    }

    public void setCache(CacheConfig cache) {
        this.cache = cache;
    }

    public AdminConfig getAdmin() {
        return admin;
    }

    public void setAdmin(AdminConfig admin) {
        this.admin = admin;
    }

    // "import" is a keyword, so the property is bound through these accessors
    public ImportConfig getImport() {
        return importConfig;
    }

    public void setImport(ImportConfig importConfig) {
        this.importConfig = importConfig;
    }

    // ==================== Nested Config Classes ====================

    /**
     * Master key material for credential encryption.
     * The inline key wins over the key file when both are set.
     */
    public static class CryptoConfig {
        // Inline key, raw or base64 (typically injected from CREDENTIAL_ENCRYPTION_KEY)
        private String masterKey;

        // Path to master key file, raw or base64
        private String masterKeyPath = "/etc/gw/master.key";

        @Min(1)
        private int currentKeyVersion = 1;

        // Retired versions still needed for decryption: version -> inline key or "file:<path>"
        private Map<Integer, String> previousKeys = new HashMap<>();

        public String getMasterKey() {
            return masterKey;
        }

        public void setMasterKey(String masterKey) {
            this.masterKey = masterKey;
        }

        public String getMasterKeyPath() {
            return masterKeyPath;
        }

        public void setMasterKeyPath(String masterKeyPath) {
            this.masterKeyPath = masterKeyPath;
        }

        public int getCurrentKeyVersion() {
            return currentKeyVersion;
        }

        public void setCurrentKeyVersion(int currentKeyVersion) {
            this.currentKeyVersion = currentKeyVersion;
        }

        public Map<Integer, String> getPreviousKeys() {
            return previousKeys;
        }

        public void setPreviousKeys(Map<Integer, String> previousKeys) {
            this.previousKeys = previousKeys;
        }
    }

    /**
     * OAuth token endpoint and refresh policy.
     */
    public static class OAuthConfig {
        @NotBlank
        private String tokenUrl = "https://console.anthropic.com/v1/oauth/token";

        @NotBlank
        private String clientId = "9d1c250a-e61b-44d9-88ed-5944d1962f5e";

        private String betaHeader = "oauth-2025-04-20";

        @NotNull
        private Duration timeout = Duration.ofSeconds(10);

        // Lead time before expiry at which a token counts as due for refresh
        @NotNull
        private Duration refreshSkew = Duration.ofSeconds(60);

        private boolean sweepEnabled = false;

        private Duration sweepInterval = Duration.ofMinutes(5);

        public String getTokenUrl() {
            return tokenUrl;
        }

        public void setTokenUrl(String tokenUrl) {
            this.tokenUrl = tokenUrl;
        }

        public String getClientId() {
            return clientId;
        }

        public void setClientId(String clientId) {
            this.clientId = clientId;
        }

        public String getBetaHeader() {
            return betaHeader;
        }

        public void setBetaHeader(String betaHeader) {
            this.betaHeader = betaHeader;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }

        public Duration getRefreshSkew() {
            return refreshSkew;
        }

        public void setRefreshSkew(Duration refreshSkew) {
            this.refreshSkew = refreshSkew;
        }

        public boolean isSweepEnabled() {
            return sweepEnabled;
        }

        public void setSweepEnabled(boolean sweepEnabled) {
            this.sweepEnabled = sweepEnabled;
        }

        public Duration getSweepInterval() {
            return sweepInterval;
        }

        public void setSweepInterval(Duration sweepInterval) {
            this.sweepInterval = sweepInterval;
        }
    }

    /**
     * Tenant to account routing.
     */
    public static class RoutingConfig {
        // Extra candidates tried after a transient refresh failure
        @Min(0)
        private int maxFailoverAttempts = 1;

        // Logical model id -> hosted inference model id, merged over the built-in table
        private Map<String, String> modelOverrides = new HashMap<>();

        public int getMaxFailoverAttempts() {
            return maxFailoverAttempts;
        }

        public void setMaxFailoverAttempts(int maxFailoverAttempts) {
            this.maxFailoverAttempts = maxFailoverAttempts;
        }

        public Map<String, String> getModelOverrides() {
            return modelOverrides;
        }

        public void setModelOverrides(Map<String, String> modelOverrides) {
            this.modelOverrides = modelOverrides;
        }
    }

    /**
     * Client bearer token authentication.
     */
    public static class AuthConfig {
        @NotBlank
        private String realm = "Claude Train Gateway";

        private List<String> protectedPathPrefixes = new ArrayList<>(List.of("/v1/"));

        public String getRealm() {
            return realm;
        }

        public void setRealm(String realm) {
            this.realm = realm;
        }

        public List<String> getProtectedPathPrefixes() {
            return protectedPathPrefixes;
        }

        public void setProtectedPathPrefixes(List<String> protectedPathPrefixes) {
            this.protectedPathPrefixes = protectedPathPrefixes;
        }
    }

    /**
     * Cache configuration for Redis.
     */
    public static class CacheConfig {
        // Redis key prefix
        private String keyPrefix = "gw:";

        // Client key lookup TTL
        private Duration clientKeyTtl = Duration.ofMinutes(5);

        // Lifetime of the marker left by a revocation; never shorter than the lookup TTL
        private Duration revokedMarkerTtl = Duration.ofMinutes(10);

        public String getKeyPrefix() {
            return keyPrefix;
        }

        public void setKeyPrefix(String keyPrefix) {
            this.keyPrefix = keyPrefix;
        }

        public Duration getClientKeyTtl() {
            return clientKeyTtl;
        }

        public void setClientKeyTtl(Duration clientKeyTtl) {
            this.clientKeyTtl = clientKeyTtl;
        }

        public Duration getRevokedMarkerTtl() {
            return revokedMarkerTtl;
        }

        public void setRevokedMarkerTtl(Duration revokedMarkerTtl) {
            this.revokedMarkerTtl = revokedMarkerTtl;
        }
    }

    /**
     * Admin API configuration.
     */
    public static class AdminConfig {
        // Header name for admin API key
        private String apiKeyHeader = "X-Admin-Api-Key";

        // List of valid admin API keys
        private List<String> adminApiKeys = new ArrayList<>();

        public String getApiKeyHeader() {
            return apiKeyHeader;
        }

        public void setApiKeyHeader(String apiKeyHeader) {
            this.apiKeyHeader = apiKeyHeader;
        }

        public List<String> getAdminApiKeys() {
            return adminApiKeys;
        }

        public void setAdminApiKeys(List<String> adminApiKeys) {
            this.adminApiKeys = adminApiKeys;
        }
    }

    /**
     * One-time credential file import.
     */
    public static class ImportConfig {
        // Directory holding <accountName>.credentials.json files; blank disables the import
        private String directory;

        public String getDirectory() {
            return directory;
        }

        public void setDirectory(String directory) {
            this.directory = directory;
        }
    }
}
