package org.stianloader.pyresolve;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.stianloader.pyresolve.logging.LoggingAdapter;
import org.stianloader.pyresolve.marker.Environment;
import org.stianloader.pyresolve.repo.IndexCredentials;
import org.stianloader.pyresolve.repo.RetryPolicy;
import org.stianloader.pyresolve.resolver.CacheScope;

/**
 * Mutable settings of a {@link PythonResolver}. The resolver copies the settings when it is created,
 * later changes to this object have no effect on it.
 */
public final class ResolverSettings {

    @NotNull
    public static final String DEFAULT_INDEX_URL = "https://pypi.org/simple";

    @NotNull
    public static final String ENVIRONMENT_PREFIX = "PYRESOLVE_";

    @NotNull
    private static String require(@NotNull String key, @NotNull String value) {
        String trimmed = value.trim();
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException("Environment variable " + key + " is empty");
        }
        return trimmed;
    }

    private static boolean parseBoolean(@NotNull String key, @NotNull String value) {
        String lower = ResolverSettings.require(key, value).toLowerCase(Locale.ROOT);
        switch (lower) {
        case "1":
        case "true":
        case "yes":
        case "on":
            return true;
        case "0":
        case "false":
        case "no":
        case "off":
            return false;
        default:
            throw new IllegalArgumentException("Environment variable " + key + " is not a boolean: " + value);
        }
    }

    private static long parseLong(@NotNull String key, @NotNull String value) {
        try {
            long parsed = Long.parseLong(ResolverSettings.require(key, value));
            if (parsed < 0) {
                throw new IllegalArgumentException("Environment variable " + key + " may not be negative: " + value);
            }
            return parsed;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Environment variable " + key + " is not a number: " + value, e);
        }
    }

    /**
     * Creates settings from <code>PYRESOLVE_</code> prefixed environment variables, usually {@link System#getenv()}.
     * Variables that are absent keep their default; unknown variables with the prefix are ignored.
     *
     * @param environment The environment variables
     * @return The settings
     * @throws IllegalArgumentException If a known variable has a malformed value
     */
    @NotNull
    public static ResolverSettings fromEnvironment(@NotNull Map<String, String> environment) {
        ResolverSettings settings = new ResolverSettings();
        for (Map.Entry<String, String> entry : environment.entrySet()) {
            String key = entry.getKey();
            if (!key.startsWith(ResolverSettings.ENVIRONMENT_PREFIX)) {
                continue;
            }
            String value = entry.getValue();
            switch (key.substring(ResolverSettings.ENVIRONMENT_PREFIX.length())) {
            case "INDEX_URL": {
                List<String> urls = new ArrayList<>();
                for (String url : ResolverSettings.require(key, value).split(",")) {
                    if (!url.trim().isEmpty()) {
                        urls.add(url.trim());
                    }
                }
                settings.setIndexUrls(urls);
                break;
            }
            case "DEFAULT_PYTHON_VERSION":
                settings.setDefaultPythonVersion(ResolverSettings.require(key, value));
                break;
            case "REQUEST_TIMEOUT_MILLIS":
                settings.setRequestTimeoutMillis((int) Math.min(Integer.MAX_VALUE, ResolverSettings.parseLong(key, value)));
                break;
            case "MAX_ATTEMPTS":
                settings.setMaxAttempts((int) Math.min(Integer.MAX_VALUE, ResolverSettings.parseLong(key, value)));
                break;
            case "ALLOW_PRERELEASES":
                settings.setAllowPrereleases(ResolverSettings.parseBoolean(key, value));
                break;
            case "PREFER_SOURCE":
                settings.setPreferSource(ResolverSettings.parseBoolean(key, value));
                break;
            case "MAX_ROUNDS":
                settings.setMaxRounds((int) Math.min(Integer.MAX_VALUE, ResolverSettings.parseLong(key, value)));
                break;
            case "TIMEOUT_MILLIS":
                settings.setTimeoutMillis(ResolverSettings.parseLong(key, value));
                break;
            case "NETRC":
                settings.setNetrcFile(Paths.get(ResolverSettings.require(key, value)));
                break;
            case "NETRC_LOOKUP":
                settings.setNetrcLookup(ResolverSettings.parseBoolean(key, value));
                break;
            case "CACHE_SCOPE":
                try {
                    settings.setCacheScope(CacheScope.valueOf(ResolverSettings.require(key, value).toUpperCase(Locale.ROOT)));
                } catch (IllegalArgumentException e) {
                    throw new IllegalArgumentException("Environment variable " + key + " is not a cache scope: " + value, e);
                }
                break;
            default:
                LoggingAdapter.getDefaultLogger().debug(ResolverSettings.class, "Ignoring unknown environment variable {}", key);
                break;
            }
        }
        return settings;
    }

    @NotNull
    private List<@NotNull String> indexUrls = new ArrayList<>(Collections.singletonList(ResolverSettings.DEFAULT_INDEX_URL));
    @NotNull
    private final Map<@NotNull String, @NotNull IndexCredentials> credentials = new LinkedHashMap<>();
    @NotNull
    private String defaultPythonVersion = "3.11";
    private int requestTimeoutMillis = 30_000;
    private int maxAttempts = 4;
    private long initialBackoffMillis = 500L;
    private double backoffMultiplier = 2.0D;
    private long maxBackoffMillis = 8_000L;
    private boolean allowPrereleases;
    private boolean preferSource;
    private boolean allowBuildHook = true;
    private int maxRounds = 200_000;
    private long timeoutMillis = 600_000L;
    @NotNull
    private CacheScope cacheScope = CacheScope.RUN;
    private long cacheMaxAgeMillis = 3_600_000L;
    @Nullable
    private Path netrcFile;
    private boolean netrcLookup = true;

    @NotNull
    @Contract(pure = true)
    public ResolverSettings copy() {
        ResolverSettings copy = new ResolverSettings();
        copy.indexUrls = new ArrayList<>(this.indexUrls);
        copy.credentials.putAll(this.credentials);
        copy.defaultPythonVersion = this.defaultPythonVersion;
        copy.requestTimeoutMillis = this.requestTimeoutMillis;
        copy.maxAttempts = this.maxAttempts;
        copy.initialBackoffMillis = this.initialBackoffMillis;
        copy.backoffMultiplier = this.backoffMultiplier;
        copy.maxBackoffMillis = this.maxBackoffMillis;
        copy.allowPrereleases = this.allowPrereleases;
        copy.preferSource = this.preferSource;
        copy.allowBuildHook = this.allowBuildHook;
        copy.maxRounds = this.maxRounds;
        copy.timeoutMillis = this.timeoutMillis;
        copy.cacheScope = this.cacheScope;
        copy.cacheMaxAgeMillis = this.cacheMaxAgeMillis;
        copy.netrcFile = this.netrcFile;
        copy.netrcLookup = this.netrcLookup;
        return copy;
    }

    @NotNull
    @Contract(pure = true)
    public RetryPolicy createRetryPolicy() {
        return new RetryPolicy(this.maxAttempts, this.initialBackoffMillis, this.backoffMultiplier, this.maxBackoffMillis, RetryPolicy.DEFAULT_RETRYABLE);
    }

    @Contract(pure = true)
    public long getCacheMaxAgeMillis() {
        return this.cacheMaxAgeMillis;
    }

    @NotNull
    @Contract(pure = true)
    public CacheScope getCacheScope() {
        return this.cacheScope;
    }

    /**
     * Obtains the credentials explicitly configured for an index. Indexes without explicit credentials may still
     * obtain some from a netrc file, see {@link #getNetrcFile()}.
     *
     * @param indexUrl The URL of the index, exactly as configured
     * @return The credentials, or null if none are configured
     */
    @Nullable
    @Contract(pure = true)
    public IndexCredentials getCredentials(@NotNull String indexUrl) {
        return this.credentials.get(indexUrl);
    }

    /**
     * Obtains the netrc file consulted for the credentials of indexes that have no explicit credentials. If absent,
     * <code>~/.netrc</code> or <code>~/_netrc</code> is used, provided that {@link #isNetrcLookup()} holds.
     *
     * @return The netrc file, null for the default location
     */
    @Nullable
    @Contract(pure = true)
    public Path getNetrcFile() {
        return this.netrcFile;
    }

    /**
     * Obtains the environment used when callers do not pass one: the configured default python version
     * on the operating system the JVM runs on.
     *
     * @return The default environment
     */
    @NotNull
    public Environment getDefaultEnvironment() {
        return Environment.current(this.defaultPythonVersion);
    }

    @NotNull
    @Contract(pure = true)
    public String getDefaultPythonVersion() {
        return this.defaultPythonVersion;
    }

    @NotNull
    @Contract(pure = true)
    public List<@NotNull String> getIndexUrls() {
        return Collections.unmodifiableList(this.indexUrls);
    }

    @Contract(pure = true)
    public int getMaxAttempts() {
        return this.maxAttempts;
    }

    @Contract(pure = true)
    public int getMaxRounds() {
        return this.maxRounds;
    }

    @Contract(pure = true)
    public int getRequestTimeoutMillis() {
        return this.requestTimeoutMillis;
    }

    /**
     * Obtains the wall-clock budget of a single resolution run.
     *
     * @return The budget in milliseconds, 0 for no limit
     */
    @Contract(pure = true)
    public long getTimeoutMillis() {
        return this.timeoutMillis;
    }

    @Contract(pure = true)
    public boolean isAllowBuildHook() {
        return this.allowBuildHook;
    }

    @Contract(pure = true)
    public boolean isAllowPrereleases() {
        return this.allowPrereleases;
    }

    /**
     * Whether <code>~/.netrc</code>, or <code>~/_netrc</code> in its absence, is consulted when no netrc file is
     * configured. Enabled by default.
     *
     * @return True to look up the netrc file of the user
     */
    @Contract(pure = true)
    public boolean isNetrcLookup() {
        return this.netrcLookup;
    }

    @Contract(pure = true)
    public boolean isPreferSource() {
        return this.preferSource;
    }

    @NotNull
    @Contract(mutates = "this", pure = false, value = "_ -> this")
    public ResolverSettings setAllowBuildHook(boolean allowBuildHook) {
        this.allowBuildHook = allowBuildHook;
        return this;
    }

    @NotNull
    @Contract(mutates = "this", pure = false, value = "_ -> this")
    public ResolverSettings setAllowPrereleases(boolean allowPrereleases) {
        this.allowPrereleases = allowPrereleases;
        return this;
    }

    @NotNull
    @Contract(mutates = "this", pure = false, value = "_, _, _ -> this")
    public ResolverSettings setBackoff(long initialBackoffMillis, double backoffMultiplier, long maxBackoffMillis) {
        if (initialBackoffMillis < 0 || maxBackoffMillis < 0 || backoffMultiplier < 1.0D) {
            throw new IllegalArgumentException("Backoff delays may not be negative and the multiplier must be at least 1");
        }
        this.initialBackoffMillis = initialBackoffMillis;
        this.backoffMultiplier = backoffMultiplier;
        this.maxBackoffMillis = maxBackoffMillis;
        return this;
    }

    @NotNull
    @Contract(mutates = "this", pure = false, value = "_ -> this")
    public ResolverSettings setCacheMaxAgeMillis(long cacheMaxAgeMillis) {
        this.cacheMaxAgeMillis = cacheMaxAgeMillis;
        return this;
    }

    @NotNull
    @Contract(mutates = "this", pure = false, value = "null -> fail; !null -> this")
    public ResolverSettings setCacheScope(@NotNull CacheScope cacheScope) {
        this.cacheScope = Objects.requireNonNull(cacheScope, "cacheScope may not be null");
        return this;
    }

    @NotNull
    @Contract(mutates = "this", pure = false, value = "_, _ -> this")
    public ResolverSettings setCredentials(@NotNull String indexUrl, @Nullable IndexCredentials credentials) {
        if (credentials == null) {
            this.credentials.remove(indexUrl);
        } else {
            this.credentials.put(indexUrl, credentials);
        }
        return this;
    }

    @NotNull
    @Contract(mutates = "this", pure = false, value = "_ -> this")
    public ResolverSettings setNetrcFile(@Nullable Path netrcFile) {
        this.netrcFile = netrcFile;
        return this;
    }

    @NotNull
    @Contract(mutates = "this", pure = false, value = "_ -> this")
    public ResolverSettings setNetrcLookup(boolean netrcLookup) {
        this.netrcLookup = netrcLookup;
        return this;
    }

    @NotNull
    @Contract(mutates = "this", pure = false, value = "null -> fail; !null -> this")
    public ResolverSettings setDefaultPythonVersion(@NotNull String defaultPythonVersion) {
        this.defaultPythonVersion = Objects.requireNonNull(defaultPythonVersion, "defaultPythonVersion may not be null");
        return this;
    }

    /**
     * Sets the simple index URLs, in priority order. An empty list means that only indexes added through
     * {@link PythonResolver#addIndex(org.stianloader.pyresolve.repo.PackageIndex)} are used.
     *
     * @param indexUrls The index URLs
     * @return This instance, for chaining
     */
    @NotNull
    @Contract(mutates = "this", pure = false, value = "null -> fail; !null -> this")
    public ResolverSettings setIndexUrls(@NotNull List<@NotNull String> indexUrls) {
        this.indexUrls = new ArrayList<>(indexUrls);
        return this;
    }

    @NotNull
    @Contract(mutates = "this", pure = false, value = "_ -> this")
    public ResolverSettings setMaxAttempts(int maxAttempts) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        this.maxAttempts = maxAttempts;
        return this;
    }

    @NotNull
    @Contract(mutates = "this", pure = false, value = "_ -> this")
    public ResolverSettings setMaxRounds(int maxRounds) {
        if (maxRounds < 1) {
            throw new IllegalArgumentException("maxRounds must be at least 1");
        }
        this.maxRounds = maxRounds;
        return this;
    }

    @NotNull
    @Contract(mutates = "this", pure = false, value = "_ -> this")
    public ResolverSettings setPreferSource(boolean preferSource) {
        this.preferSource = preferSource;
        return this;
    }

    @NotNull
    @Contract(mutates = "this", pure = false, value = "_ -> this")
    public ResolverSettings setRequestTimeoutMillis(int requestTimeoutMillis) {
        this.requestTimeoutMillis = requestTimeoutMillis;
        return this;
    }

    @NotNull
    @Contract(mutates = "this", pure = false, value = "_ -> this")
    public ResolverSettings setTimeoutMillis(long timeoutMillis) {
        if (timeoutMillis < 0) {
            throw new IllegalArgumentException("timeoutMillis may not be negative");
        }
        this.timeoutMillis = timeoutMillis;
        return this;
    }

    @Override
    public String toString() {
        return "ResolverSettings[indexUrls=" + this.indexUrls + ", python=" + this.defaultPythonVersion + ", prereleases=" + this.allowPrereleases
                + ", preferSource=" + this.preferSource + ", maxRounds=" + this.maxRounds + ", timeout=" + this.timeoutMillis + "ms, cache=" + this.cacheScope + "]";
    }
}
