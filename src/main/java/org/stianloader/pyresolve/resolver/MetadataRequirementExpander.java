package org.stianloader.pyresolve.resolver;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

import org.jetbrains.annotations.NotNull;
import org.stianloader.pyresolve.internal.AsyncMemoizer;
import org.stianloader.pyresolve.logging.LoggingAdapter;
import org.stianloader.pyresolve.marker.Environment;
import org.stianloader.pyresolve.metadata.CoreMetadata;
import org.stianloader.pyresolve.metadata.MetadataExtractor;
import org.stianloader.pyresolve.requirement.Requirement;
import org.stianloader.pyresolve.version.SpecifierSet;
import org.stianloader.pyresolve.version.VersionSpecifier;

/**
 * Expands candidates into their dependencies using the core metadata of their distributions.
 */
public class MetadataRequirementExpander implements RequirementExpander {
    @NotNull
    private final MetadataExtractor extractor;
    @NotNull
    private final ResolutionCache cache;
    @NotNull
    private final Environment environment;
    @NotNull
    private final Executor executor;
    @NotNull
    private final AsyncMemoizer<Candidate, List<Requirement>> expansions = new AsyncMemoizer<>();

    public MetadataRequirementExpander(@NotNull MetadataExtractor extractor, @NotNull ResolutionCache cache, @NotNull Environment environment, @NotNull Executor executor) {
        this.extractor = extractor;
        this.cache = cache;
        this.environment = environment;
        this.executor = executor;
    }

    @Override
    @NotNull
    public CompletableFuture<List<Requirement>> expand(@NotNull Candidate candidate) {
        return this.expansions.get(candidate, (key) -> {
            return this.cache.getMetadata(key, (base) -> this.extractor.extract(base, this.executor))
                    .thenApply((metadata) -> this.filter(key, metadata));
        });
    }

    @NotNull
    private List<Requirement> filter(@NotNull Candidate candidate, @NotNull CoreMetadata metadata) {
        List<Requirement> requirements = new ArrayList<>();
        if (candidate.getExtras().isEmpty()) {
            for (Requirement requirement : metadata.getRequirements()) {
                if (requirement.isApplicable(this.environment, (String) null)) {
                    requirements.add(requirement);
                }
            }
            return Collections.unmodifiableList(requirements);
        }

        for (String extra : candidate.getExtras()) {
            if (!metadata.getProvidesExtra().contains(extra)) {
                LoggingAdapter.getDefaultLogger().warn(MetadataRequirementExpander.class, "{} {} does not provide the extra '{}'", candidate.getName(), candidate.getVersion(), extra);
            }
        }
        // Tie the extra to the very same version of the plain project
        if (candidate.isDirect()) {
            requirements.add(new Requirement(metadata.getName(), Collections.emptySet(), SpecifierSet.ANY, null, candidate.getLink().getUrl(), null));
        } else {
            SpecifierSet exact = SpecifierSet.of(Collections.singletonList(VersionSpecifier.of(VersionSpecifier.Operator.EQUAL, candidate.getVersion())));
            requirements.add(Requirement.of(metadata.getName(), exact));
        }
        for (Requirement requirement : metadata.getRequirements()) {
            if (requirement.getMarker() != null && requirement.getMarker().referencesExtra()
                    && requirement.isApplicable(this.environment, candidate.getExtras())) {
                requirements.add(requirement);
            }
        }
        return Collections.unmodifiableList(requirements);
    }
}
