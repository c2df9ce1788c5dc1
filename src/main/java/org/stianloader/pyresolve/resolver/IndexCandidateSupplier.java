package org.stianloader.pyresolve.resolver;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.stianloader.pyresolve.internal.AsyncMemoizer;
import org.stianloader.pyresolve.internal.ConcurrencyUtil;
import org.stianloader.pyresolve.logging.LoggingAdapter;
import org.stianloader.pyresolve.marker.Environment;
import org.stianloader.pyresolve.marker.WheelFilename;
import org.stianloader.pyresolve.repo.DistributionLink;
import org.stianloader.pyresolve.repo.IndexAttachedValue;
import org.stianloader.pyresolve.repo.IndexNegotiator;
import org.stianloader.pyresolve.repo.ProjectNotFoundException;
import org.stianloader.pyresolve.repo.SourceDistributionFilename;
import org.stianloader.pyresolve.requirement.Requirement;

/**
 * Lists candidates from the files that the configured indexes list for a project.
 *
 * <p>Candidates are ordered by version (newest first), then wheels before source distributions (or the reverse if
 * source distributions are preferred), then by how well the wheel tags match the environment, then by file name.
 * Only the best file of each version and {@link SourceKind} becomes a candidate.
 */
public class IndexCandidateSupplier implements CandidateSupplier {

    /**
     * Orders candidates, best candidate first.
     *
     * @param preferSource Whether source distributions rank above wheels of the same version
     * @return The comparator
     */
    @NotNull
    public static Comparator<Candidate> candidateOrder(boolean preferSource) {
        Comparator<Candidate> byKind = Comparator.comparing((Candidate candidate) -> candidate.getKind() == SourceKind.WHEEL ? 0 : 1);
        if (preferSource) {
            byKind = byKind.reversed();
        }
        return Comparator.comparing(Candidate::getVersion, Comparator.reverseOrder())
                .thenComparing(byKind)
                .thenComparingInt(Candidate::getTagPriority)
                .thenComparing(Candidate::getFilename);
    }

    @NotNull
    private final IndexNegotiator negotiator;
    @NotNull
    private final ResolutionCache cache;
    @NotNull
    private final Environment environment;
    private final boolean preferSource;
    @NotNull
    private final Executor executor;
    @NotNull
    private final AsyncMemoizer<String, CandidateSequence> sequences = new AsyncMemoizer<>();

    public IndexCandidateSupplier(@NotNull IndexNegotiator negotiator, @NotNull ResolutionCache cache, @NotNull Environment environment, boolean preferSource, @NotNull Executor executor) {
        this.negotiator = negotiator;
        this.cache = cache;
        this.environment = environment;
        this.preferSource = preferSource;
        this.executor = executor;
    }

    @NotNull
    private CandidateSequence buildSequence(@NotNull String name, @NotNull List<IndexAttachedValue<DistributionLink>> links) {
        List<Candidate> candidates = new ArrayList<>();
        for (IndexAttachedValue<DistributionLink> attached : links) {
            Candidate candidate = this.toCandidate(name, attached);
            if (candidate != null) {
                candidates.add(candidate);
            }
        }
        candidates.sort(IndexCandidateSupplier.candidateOrder(this.preferSource));
        // Equal candidates are adjacent after sorting; the first one has the best tag priority
        List<Candidate> distinct = new ArrayList<>();
        for (Candidate candidate : candidates) {
            if (distinct.isEmpty() || !distinct.get(distinct.size() - 1).equals(candidate)) {
                distinct.add(candidate);
            }
        }
        LoggingAdapter.getDefaultLogger().debug(IndexCandidateSupplier.class, "Project '{}' has {} candidate(s) from {} usable file(s) out of {}", name, distinct.size(), candidates.size(), links.size());
        return new CandidateSequence(distinct);
    }

    @Override
    @NotNull
    public CompletableFuture<CandidateSequence> listCandidates(@NotNull String name, @NotNull Collection<@NotNull Requirement> requirements) {
        return this.sequences.get(name, (key) -> {
            return this.cache.getProjectPage(key, (project) -> this.negotiator.getProjectPage(project, this.executor)).handle((links, ex) -> {
                if (ex != null) {
                    Throwable cause = ConcurrencyUtil.unwrap(ex);
                    if (cause instanceof ProjectNotFoundException) {
                        LoggingAdapter.getDefaultLogger().info(IndexCandidateSupplier.class, "Project '{}' is not known to any index", key);
                        return CandidateSequence.EMPTY;
                    }
                    throw ConcurrencyUtil.rethrow(cause);
                }
                return this.buildSequence(key, links);
            });
        });
    }

    @Nullable
    private Candidate toCandidate(@NotNull String name, @NotNull IndexAttachedValue<DistributionLink> attached) {
        DistributionLink link = attached.getValue();
        Candidate candidate;
        if (link.isWheel()) {
            WheelFilename wheel = WheelFilename.tryParse(link.getFilename());
            if (wheel == null || !wheel.getName().equals(name)) {
                LoggingAdapter.getDefaultLogger().debug(IndexCandidateSupplier.class, "Pruning {}: unparseable wheel file name", link.getFilename());
                return null;
            }
            int priority = this.environment.getTagPriority(wheel);
            if (priority < 0) {
                LoggingAdapter.getDefaultLogger().debug(IndexCandidateSupplier.class, "Pruning {}: no tag is supported by {}", link.getFilename(), this.environment);
                return null;
            }
            candidate = new Candidate(name, wheel.getVersion(), link, attached.getIndex(), priority, false);
        } else {
            SourceDistributionFilename sdist = SourceDistributionFilename.tryParse(link.getFilename(), name);
            if (sdist == null) {
                LoggingAdapter.getDefaultLogger().debug(IndexCandidateSupplier.class, "Pruning {}: not a supported distribution file", link.getFilename());
                return null;
            }
            candidate = new Candidate(name, sdist.getVersion(), link, attached.getIndex(), Integer.MAX_VALUE, false);
        }
        if (link.getRequiresPython() != null && !this.environment.supportsPython(link.getRequiresPython())) {
            LoggingAdapter.getDefaultLogger().debug(IndexCandidateSupplier.class, "Pruning {}: requires python {}", link.getFilename(), link.getRequiresPython());
            return null;
        }
        return candidate;
    }
}
