package org.stianloader.pyresolve;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executor;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.stianloader.pyresolve.logging.LoggingAdapter;
import org.stianloader.pyresolve.marker.Environment;
import org.stianloader.pyresolve.metadata.DeclaredDependencies;
import org.stianloader.pyresolve.metadata.LocalProjectReader;
import org.stianloader.pyresolve.repo.IndexCredentials;
import org.stianloader.pyresolve.repo.IndexNegotiator;
import org.stianloader.pyresolve.repo.NetrcFile;
import org.stianloader.pyresolve.repo.PackageIndex;
import org.stianloader.pyresolve.repo.URIPackageIndex;
import org.stianloader.pyresolve.requirement.Requirement;
import org.stianloader.pyresolve.requirement.RequirementParser;
import org.stianloader.pyresolve.requirement.RequirementsDocument;
import org.stianloader.pyresolve.resolver.CacheScope;
import org.stianloader.pyresolve.resolver.ResolutionCache;
import org.stianloader.pyresolve.resolver.ResolutionContext;
import org.stianloader.pyresolve.resolver.ResolutionEngine;
import org.stianloader.pyresolve.resolver.ResolvedGraph;
import org.stianloader.pyresolve.version.SpecifierSet;

/**
 * Entry point of pyresolve: computes the transitive closure of python requirements for a target environment.
 *
 * <p>A resolver is configured once through {@link ResolverSettings} and may then be used for any amount of
 * resolution runs, sequentially or concurrently. Each run blocks the calling thread until the graph is
 * known; network lookups are performed on the executor passed to the run.
 *
 * <pre>{@code
 * PythonResolver resolver = new PythonResolver(new ResolverSettings());
 * ResolvedGraph graph = resolver.resolveSpecifiers(Arrays.asList("requests>=2.28", "rich[jupyter]"),
 *         Environment.fromPythonVersionAndOs("3.11", "linux"), ForkJoinPool.commonPool());
 * }</pre>
 */
public class PythonResolver {

    @NotNull
    private static PackageIndex createIndex(@NotNull String url, @NotNull ResolverSettings settings, @Nullable NetrcFile netrc) {
        URI uri = URI.create(url);
        IndexCredentials credentials = settings.getCredentials(url);
        if (credentials == null && netrc != null && uri.getRawUserInfo() == null) {
            credentials = netrc.getCredentials(uri);
        }
        return new URIPackageIndex(url, uri, credentials, settings.createRetryPolicy(), settings.getRequestTimeoutMillis());
    }

    @Nullable
    private static NetrcFile readNetrc(@NotNull ResolverSettings settings) {
        Path file = settings.getNetrcFile();
        if (file != null) {
            if (!Files.isRegularFile(file)) {
                throw new IllegalArgumentException("Missing netrc file " + file);
            }
            try {
                return NetrcFile.read(file);
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }

        String home = System.getProperty("user.home");
        if (!settings.isNetrcLookup() || home == null) {
            return null;
        }
        file = NetrcFile.locate(Paths.get(home));
        if (file == null) {
            return null;
        }
        try {
            NetrcFile netrc = NetrcFile.read(file);
            LoggingAdapter.getDefaultLogger().debug(PythonResolver.class, "Using netrc file {}", file);
            return netrc;
        } catch (IOException e) {
            LoggingAdapter.getDefaultLogger().warn(PythonResolver.class, "Ignoring unusable netrc file {}", file, e);
            return null;
        }
    }

    @NotNull
    private final ResolverSettings settings;
    @NotNull
    private final List<PackageIndex> configuredIndexes = new ArrayList<>();
    @NotNull
    private final List<PackageIndex> customIndexes = new ArrayList<>();
    @Nullable
    private final NetrcFile netrc;
    @Nullable
    private ResolutionCache pooledCache;

    /**
     * Creates a resolver from a copy of the settings. Indexes without explicit credentials take theirs from the
     * netrc file, if one is configured or found in the home directory.
     *
     * @param settings The settings
     * @throws IllegalArgumentException If the configured netrc file does not exist
     * @throws UncheckedIOException If the configured netrc file cannot be read or parsed
     */
    public PythonResolver(@NotNull ResolverSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings may not be null").copy();
        this.netrc = PythonResolver.readNetrc(this.settings);
        for (String url : this.settings.getIndexUrls()) {
            this.configuredIndexes.add(PythonResolver.createIndex(url, this.settings, this.netrc));
        }
    }

    /**
     * Registers an additional index. Indexes are queried in the order they were added, after the indexes
     * that the settings list.
     *
     * @param index The index
     * @return This instance, for chaining
     * @throws IllegalStateException If an index with the same id is already known
     */
    @NotNull
    @Contract(mutates = "this", pure = false, value = "null -> fail; !null -> this")
    public synchronized PythonResolver addIndex(@NotNull PackageIndex index) {
        Objects.requireNonNull(index, "index may not be null");
        for (PackageIndex known : this.getIndexes()) {
            if (known.getIndexId().equals(index.getIndexId())) {
                throw new IllegalStateException("There is already an index with the id \"" + index.getIndexId() + "\" registered!");
            }
        }
        this.customIndexes.add(index);
        return this;
    }

    @NotNull
    private synchronized ResolutionCache acquireCache() {
        if (this.settings.getCacheScope() == CacheScope.RUN) {
            return new ResolutionCache();
        }
        ResolutionCache cache = this.pooledCache;
        long now = System.currentTimeMillis();
        if (cache == null || cache.isExpired(now, this.settings.getCacheMaxAgeMillis())) {
            if (cache != null) {
                LoggingAdapter.getDefaultLogger().debug(PythonResolver.class, "Discarding resolution cache with {} entries", cache.size());
            }
            cache = new ResolutionCache(now, true);
            this.pooledCache = cache;
        } else {
            cache.evictFailures();
        }
        return cache;
    }

    @NotNull
    @Contract(pure = true)
    public synchronized List<@NotNull PackageIndex> getIndexes() {
        List<PackageIndex> indexes = new ArrayList<>(this.configuredIndexes);
        indexes.addAll(this.customIndexes);
        return Collections.unmodifiableList(indexes);
    }

    @NotNull
    @Contract(pure = true)
    public ResolverSettings getSettings() {
        return this.settings.copy();
    }

    @NotNull
    private IndexNegotiator negotiator(@NotNull List<PackageIndex> indexes) {
        IndexNegotiator negotiator = new IndexNegotiator();
        for (PackageIndex index : indexes) {
            negotiator.addIndex(index);
        }
        return negotiator;
    }

    /**
     * Resolves requirements against the indexes of this resolver.
     *
     * @param roots The root requirements
     * @param environment The target environment
     * @param executor The executor on which network I/O is performed
     * @return The resolved graph
     */
    @NotNull
    public ResolvedGraph resolve(@NotNull Collection<@NotNull Requirement> roots, @NotNull Environment environment, @NotNull Executor executor) {
        return this.resolve(roots, Collections.emptyList(), environment, executor);
    }

    /**
     * Resolves requirements against the indexes of this resolver, with additional version constraints
     * that narrow the versions of projects that are otherwise required.
     *
     * @param roots The root requirements
     * @param constraints The constraints
     * @param environment The target environment
     * @param executor The executor on which network I/O is performed
     * @return The resolved graph
     * @throws org.stianloader.pyresolve.resolver.ResolutionConflictException If the requirements cannot be satisfied
     * @throws org.stianloader.pyresolve.resolver.ResolutionTimedOutException If the run exceeds its budget
     * @throws org.stianloader.pyresolve.repo.IndexUnavailableException If an index cannot be reached
     */
    @NotNull
    public ResolvedGraph resolve(@NotNull Collection<@NotNull Requirement> roots, @NotNull Collection<@NotNull Requirement> constraints,
            @NotNull Environment environment, @NotNull Executor executor) {
        return this.run(roots, constraints, environment, executor, this.negotiator(this.getIndexes()), this.acquireCache());
    }

    /**
     * Resolves a parsed requirements file. The index options of the file apply to this run only:
     * <code>--index-url</code> replaces the indexes listed by the settings and <code>--extra-index-url</code>
     * adds further indexes. Indexes added through {@link #addIndex(PackageIndex)} are always queried.
     *
     * @param document The requirements file
     * @param environment The target environment
     * @param executor The executor on which network I/O is performed
     * @return The resolved graph
     */
    @NotNull
    public ResolvedGraph resolveDocument(@NotNull RequirementsDocument document, @NotNull Environment environment, @NotNull Executor executor) {
        String indexUrl = document.getIndexUrl();
        if (indexUrl == null && document.getExtraIndexUrls().isEmpty()) {
            return this.resolve(document.getRequirements(), document.getConstraints(), environment, executor);
        }

        List<PackageIndex> indexes = new ArrayList<>();
        List<String> urls = new ArrayList<>();
        if (indexUrl == null) {
            urls.addAll(this.settings.getIndexUrls());
        } else {
            urls.add(indexUrl);
        }
        for (String url : document.getExtraIndexUrls()) {
            if (!urls.contains(url)) {
                urls.add(url);
            }
        }
        for (String url : urls) {
            indexes.add(PythonResolver.createIndex(url, this.settings, this.netrc));
        }
        synchronized (this) {
            indexes.addAll(this.customIndexes);
        }
        // Listings depend on the set of indexes, so they may not end up in the pooled cache
        return this.run(document.getRequirements(), document.getConstraints(), environment, executor, this.negotiator(indexes), new ResolutionCache());
    }

    /**
     * Resolves the dependencies that a local project declares, as if it was installed from its directory.
     *
     * @param projectDirectory The project directory holding <code>pyproject.toml</code>, <code>setup.cfg</code> or <code>setup.py</code>
     * @param environment The target environment
     * @param executor The executor on which network I/O is performed
     * @return The resolved graph, which does not contain the project itself
     * @see #resolveProject(Path, Collection, Environment, Executor)
     */
    @NotNull
    public ResolvedGraph resolveProject(@NotNull Path projectDirectory, @NotNull Environment environment, @NotNull Executor executor) {
        return this.resolveProject(projectDirectory, Collections.emptyList(), environment, executor);
    }

    /**
     * Resolves the dependencies that a local project declares, including those of the given extras. The project is
     * read statically, see {@link LocalProjectReader}; it is never built.
     *
     * @param projectDirectory The project directory holding <code>pyproject.toml</code>, <code>setup.cfg</code> or <code>setup.py</code>
     * @param extras The extras of the project to install
     * @param environment The target environment
     * @param executor The executor on which network I/O is performed
     * @return The resolved graph, which does not contain the project itself
     * @throws IncompatibleProjectException If the project does not support the python version of the environment
     * @throws org.stianloader.pyresolve.metadata.MetadataUnavailableException If the project does not declare its dependencies statically
     */
    @NotNull
    public ResolvedGraph resolveProject(@NotNull Path projectDirectory, @NotNull Collection<@NotNull String> extras, @NotNull Environment environment, @NotNull Executor executor) {
        DeclaredDependencies declared = LocalProjectReader.read(projectDirectory);
        SpecifierSet requiresPython = declared.getRequiresPython();
        if (requiresPython != null && !environment.supportsPython(requiresPython)) {
            throw new IncompatibleProjectException(projectDirectory.toString(), requiresPython, environment);
        }
        LoggingAdapter.getDefaultLogger().debug(PythonResolver.class, "Project {} declares {} requirements in {}", projectDirectory, declared.getRequirements().size(), declared.getSource());

        List<Requirement> roots = new ArrayList<>();
        for (Requirement requirement : declared.getRequirements()) {
            // Markers are evaluated here as the engine evaluates root markers without any extra
            if (requirement.isApplicable(environment, extras)) {
                roots.add(requirement.withMarker(null));
            }
        }
        return this.resolve(roots, environment, executor);
    }

    /**
     * Parses and resolves PEP 508 requirement strings. All strings are parsed before any lookup is made.
     *
     * @param specifiers The requirement strings
     * @param environment The target environment
     * @param executor The executor on which network I/O is performed
     * @return The resolved graph
     * @throws org.stianloader.pyresolve.requirement.MalformedRequirementException If a string cannot be parsed
     */
    @NotNull
    public ResolvedGraph resolveSpecifiers(@NotNull Collection<@NotNull String> specifiers, @NotNull Environment environment, @NotNull Executor executor) {
        List<Requirement> roots = new ArrayList<>();
        for (String specifier : specifiers) {
            roots.add(RequirementParser.parse(specifier));
        }
        return this.resolve(roots, environment, executor);
    }

    @NotNull
    private ResolvedGraph run(@NotNull Collection<@NotNull Requirement> roots, @NotNull Collection<@NotNull Requirement> constraints,
            @NotNull Environment environment, @NotNull Executor executor, @NotNull IndexNegotiator negotiator, @NotNull ResolutionCache cache) {
        LoggingAdapter.getDefaultLogger().info(PythonResolver.class, "Resolving {} requirements for {}", roots.size(), environment);
        long start = System.currentTimeMillis();
        ResolutionContext context = ResolutionContext.create(environment, this.settings, negotiator, cache, executor);
        ResolvedGraph graph = new ResolutionEngine(context).resolve(roots, constraints);
        LoggingAdapter.getDefaultLogger().info(PythonResolver.class, "Resolved {} projects in {} ms", graph.size(), System.currentTimeMillis() - start);
        return graph;
    }
}
