package org.stianloader.pyresolve.resolver;

import java.net.URI;
import java.util.Objects;
import java.util.concurrent.Executor;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.stianloader.pyresolve.ResolverSettings;
import org.stianloader.pyresolve.marker.Environment;
import org.stianloader.pyresolve.metadata.DistributionMetadataExtractor;
import org.stianloader.pyresolve.metadata.SetupCfgMetadataHook;
import org.stianloader.pyresolve.repo.IndexNegotiator;
import org.stianloader.pyresolve.repo.URIPackageIndex;

/**
 * Everything a single resolution run works with. A context is not meant to be shared across runs,
 * only the {@link ResolutionCache} may outlive it.
 */
public final class ResolutionContext {

    /**
     * Identifier of the ad-hoc indexes through which files behind direct URL references are fetched.
     */
    public static final String DIRECT_URL_INDEX_ID = "direct-url";

    /**
     * Creates a context that lists candidates from the indexes known to the negotiator (or from direct URLs)
     * and expands them using their core metadata.
     *
     * @param environment The target environment
     * @param settings The resolver settings
     * @param negotiator The indexes to query
     * @param cache The cache to use
     * @param executor The executor on which I/O is performed
     * @return The context
     */
    @NotNull
    public static ResolutionContext create(@NotNull Environment environment, @NotNull ResolverSettings settings,
            @NotNull IndexNegotiator negotiator, @NotNull ResolutionCache cache, @NotNull Executor executor) {
        IndexCandidateSupplier indexSupplier = new IndexCandidateSupplier(negotiator, cache, environment, settings.isPreferSource(), executor);
        DirectUrlCandidateSupplier directSupplier = new DirectUrlCandidateSupplier(environment, (url) -> {
            return new URIPackageIndex(ResolutionContext.DIRECT_URL_INDEX_ID, URI.create(DirectUrlCandidateSupplier.stripFragment(url)),
                    null, settings.createRetryPolicy(), settings.getRequestTimeoutMillis());
        });
        DistributionMetadataExtractor extractor = new DistributionMetadataExtractor(settings.isAllowBuildHook() ? new SetupCfgMetadataHook() : null);
        MetadataRequirementExpander expander = new MetadataRequirementExpander(extractor, cache, environment, executor);
        return new ResolutionContext(environment, settings, cache, executor, new CompositeCandidateSupplier(indexSupplier, directSupplier), expander);
    }

    @NotNull
    private final Environment environment;
    @NotNull
    private final ResolverSettings settings;
    @NotNull
    private final ResolutionCache cache;
    @NotNull
    private final Executor executor;
    @NotNull
    private final CandidateSupplier supplier;
    @NotNull
    private final RequirementExpander expander;

    public ResolutionContext(@NotNull Environment environment, @NotNull ResolverSettings settings, @NotNull ResolutionCache cache,
            @NotNull Executor executor, @NotNull CandidateSupplier supplier, @NotNull RequirementExpander expander) {
        this.environment = Objects.requireNonNull(environment, "environment may not be null");
        this.settings = Objects.requireNonNull(settings, "settings may not be null");
        this.cache = Objects.requireNonNull(cache, "cache may not be null");
        this.executor = Objects.requireNonNull(executor, "executor may not be null");
        this.supplier = Objects.requireNonNull(supplier, "supplier may not be null");
        this.expander = Objects.requireNonNull(expander, "expander may not be null");
    }

    @NotNull
    @Contract(pure = true)
    public ResolutionCache getCache() {
        return this.cache;
    }

    @NotNull
    @Contract(pure = true)
    public Environment getEnvironment() {
        return this.environment;
    }

    @NotNull
    @Contract(pure = true)
    public Executor getExecutor() {
        return this.executor;
    }

    @NotNull
    @Contract(pure = true)
    public RequirementExpander getExpander() {
        return this.expander;
    }

    @NotNull
    @Contract(pure = true)
    public ResolverSettings getSettings() {
        return this.settings;
    }

    @NotNull
    @Contract(pure = true)
    public CandidateSupplier getSupplier() {
        return this.supplier;
    }
}
