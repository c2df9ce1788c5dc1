package org.stianloader.pyresolve.resolver;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.stianloader.pyresolve.PyResolveException;
import org.stianloader.pyresolve.internal.ConcurrencyUtil;
import org.stianloader.pyresolve.logging.LoggingAdapter;
import org.stianloader.pyresolve.metadata.MetadataUnavailableException;
import org.stianloader.pyresolve.requirement.Requirement;
import org.stianloader.pyresolve.version.SpecifierSet;

/**
 * Backtracking resolver that pins exactly one candidate per identifier such that every requirement
 * that applies to the environment is satisfied.
 *
 * <p>The engine works chronologically: it repeatedly picks the most constrained identifier that is not pinned yet,
 * tries its candidates best first and accepts the first candidate whose dependencies are compatible with the
 * current pins and still leave at least one candidate for every required identifier. If no candidate
 * works, the most recent decision is undone and its candidate excluded. Dependencies that a candidate introduces
 * are merged into the state of the branch that pinned the candidate only, so undoing a decision also undoes
 * its requirements.
 *
 * <p>The engine loop runs on the calling thread. Network lookups are performed by the {@link CandidateSupplier} and
 * {@link RequirementExpander} of the context on its executor; the loop merely waits for them, bounded by the
 * deadline of the run.
 */
public class ResolutionEngine {

    private static final class Decision {
        @NotNull
        private final ResolutionState before;
        @NotNull
        private final String identifier;
        @NotNull
        private final Candidate candidate;

        private Decision(@NotNull ResolutionState before, @NotNull String identifier, @NotNull Candidate candidate) {
            this.before = before;
            this.identifier = identifier;
            this.candidate = candidate;
        }
    }

    /**
     * The mutable bookkeeping of a single {@link ResolutionEngine#resolve(Collection, Collection)} call.
     */
    private final class Run {
        @NotNull
        private final Map<String, SpecifierSet> constraints;
        private final long deadline;
        private int rounds;
        /**
         * Candidates (without extras) whose metadata could not be obtained. Unlike exclusions caused by backtracking
         * these hold for the whole run.
         */
        @NotNull
        private final Set<Candidate> unusable = new HashSet<>();
        /**
         * The conflict to report if the search space is exhausted. This is the most recent point at which an
         * identifier ran out of candidates for a reason other than backtracking.
         */
        @Nullable
        private Conflict failure;

        private Run(@NotNull Map<String, SpecifierSet> constraints) {
            this.constraints = constraints;
            long timeout = ResolutionEngine.this.context.getSettings().getTimeoutMillis();
            this.deadline = timeout <= 0 ? Long.MAX_VALUE : System.currentTimeMillis() + timeout;
        }

        @Nullable
        private Conflict addRequirement(@NotNull ResolutionState state, @NotNull RequirementInformation information) {
            String identifier = information.getRequirement().getIdentifier();
            Criterion criterion = state.getCriterion(identifier);
            criterion = criterion == null ? Criterion.of(information) : criterion.merged(information);
            Candidate pinned = state.getPin(identifier);
            if (pinned != null) {
                if (!this.satisfies(pinned, criterion)) {
                    return new Conflict(identifier, criterion.getInformation());
                }
            } else if (this.findMatches(criterion).isEmpty()) {
                return new Conflict(identifier, criterion.getInformation());
            }
            state.putCriterion(criterion);
            return null;
        }

        private <T> T await(@NotNull CompletableFuture<T> future) {
            try {
                if (this.deadline == Long.MAX_VALUE) {
                    return future.get();
                }
                long remaining = this.deadline - System.currentTimeMillis();
                if (remaining <= 0 && !future.isDone()) {
                    throw this.timedOut();
                }
                return future.get(Math.max(remaining, 0L), TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                throw this.timedOut();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new PyResolveException("Resolution was interrupted", e);
            } catch (ExecutionException e) {
                throw ConcurrencyUtil.rethrow(e);
            } catch (CancellationException e) {
                throw new PyResolveException("A lookup was cancelled while resolving", e);
            }
        }

        @NotNull
        private ResolvedGraph buildGraph(@NotNull ResolutionState state, @NotNull Collection<@NotNull Requirement> roots) {
            Map<String, Candidate> bases = new HashMap<>();
            Map<String, SortedSet<String>> extras = new HashMap<>();
            for (Candidate candidate : state.getPins().values()) {
                bases.putIfAbsent(candidate.getName(), candidate.getBase());
                extras.computeIfAbsent(candidate.getName(), (ignore) -> new TreeSet<>()).addAll(candidate.getExtras());
            }

            Map<String, SortedSet<String>> parents = new HashMap<>();
            Map<String, List<Requirement>> justifications = new HashMap<>();
            for (Criterion criterion : state.getCriteria().values()) {
                if (state.getPin(criterion.getIdentifier()) == null) {
                    continue;
                }
                String name = criterion.getName();
                SortedSet<String> nodeParents = parents.computeIfAbsent(name, (ignore) -> new TreeSet<>());
                List<Requirement> nodeRequirements = justifications.computeIfAbsent(name, (ignore) -> new ArrayList<>());
                for (RequirementInformation info : criterion.getInformation()) {
                    Candidate parent = info.getParent();
                    if (parent != null && parent.getName().equals(name)) {
                        // The dependency of an extra on its own project
                        continue;
                    }
                    if (parent != null) {
                        nodeParents.add(parent.getName());
                    }
                    if (!nodeRequirements.contains(info.getRequirement())) {
                        nodeRequirements.add(info.getRequirement());
                    }
                }
            }

            List<ResolvedGraph.Node> nodes = new ArrayList<>();
            for (Map.Entry<String, Candidate> entry : bases.entrySet()) {
                String name = entry.getKey();
                nodes.add(new ResolvedGraph.Node(entry.getValue(), extras.get(name),
                        parents.getOrDefault(name, new TreeSet<>()), justifications.getOrDefault(name, Collections.emptyList())));
            }
            Set<String> rootNames = new LinkedHashSet<>();
            for (Requirement root : roots) {
                rootNames.add(root.getName());
            }
            return new ResolvedGraph(nodes, rootNames);
        }

        @NotNull
        private List<@NotNull Candidate> findMatches(@NotNull Criterion criterion) {
            List<Requirement> requirements = criterion.getRequirements();
            CandidateSequence sequence = this.await(ResolutionEngine.this.context.getSupplier().listCandidates(criterion.getName(), requirements));

            SpecifierSet specifier = this.constraints.getOrDefault(criterion.getName(), SpecifierSet.ANY);
            Set<String> extras = new TreeSet<>();
            for (Requirement requirement : requirements) {
                specifier = specifier.intersect(requirement.getSpecifier());
                extras.addAll(requirement.getExtras());
            }

            Boolean prereleases = ResolutionEngine.this.context.getSettings().isAllowPrereleases() ? Boolean.TRUE : null;
            boolean exact = criterion.isExact();
            List<Candidate> matches = new ArrayList<>();
            for (Candidate candidate : specifier.filter(sequence, Candidate::getVersion, prereleases)) {
                if (candidate.getLink().isYanked() && !exact) {
                    continue;
                }
                if (!this.matchesUrls(candidate, requirements) || this.unusable.contains(candidate)) {
                    continue;
                }
                candidate = candidate.withExtras(extras);
                if (!criterion.getExcluded().contains(candidate)) {
                    matches.add(candidate);
                }
            }
            return matches;
        }

        private boolean matchesUrls(@NotNull Candidate candidate, @NotNull Collection<@NotNull Requirement> requirements) {
            for (Requirement requirement : requirements) {
                String url = requirement.getUrl();
                if (url != null && (!candidate.isDirect() || !DirectUrlCandidateSupplier.stripFragment(url).equals(candidate.getSourceUrl()))) {
                    return false;
                }
            }
            return true;
        }

        private void prefetch(@NotNull Collection<@NotNull Requirement> requirements) {
            boolean allowPre = ResolutionEngine.this.context.getSettings().isAllowPrereleases();
            for (Requirement requirement : requirements) {
                ResolutionEngine.this.context.getSupplier().listCandidates(requirement.getName(), Collections.singletonList(requirement)).thenAccept((sequence) -> {
                    for (Candidate candidate : sequence) {
                        if (requirement.getSpecifier().contains(candidate.getVersion(), allowPre ? Boolean.TRUE : null)) {
                            ResolutionEngine.this.context.getExpander().expand(candidate);
                            break;
                        }
                    }
                });
            }
        }

        @NotNull
        private ResolvedGraph resolve(@NotNull Collection<@NotNull Requirement> roots) {
            LoggingAdapter logger = LoggingAdapter.getDefaultLogger();
            List<Requirement> applicable = new ArrayList<>();
            for (Requirement root : roots) {
                if (root.isApplicable(ResolutionEngine.this.context.getEnvironment(), (String) null)) {
                    applicable.add(root);
                } else {
                    logger.debug(ResolutionEngine.class, "Ignoring requirement '{}' as its marker does not hold for {}", root, ResolutionEngine.this.context.getEnvironment());
                }
            }

            this.prefetch(applicable);
            ResolutionState state = new ResolutionState();
            for (Requirement root : applicable) {
                Conflict conflict = this.addRequirement(state, new RequirementInformation(root, null));
                if (conflict != null) {
                    throw new ResolutionConflictException(conflict);
                }
            }

            Deque<Decision> trail = new ArrayDeque<>();
            while (true) {
                String identifier = this.selectIdentifier(state);
                if (identifier == null) {
                    break;
                }
                this.tick();
                Criterion criterion = Objects.requireNonNull(state.getCriterion(identifier));
                Candidate chosen = null;
                ResolutionState next = null;
                Conflict rejection = null;
                for (Candidate candidate : this.findMatches(criterion)) {
                    List<Requirement> dependencies;
                    try {
                        dependencies = this.await(ResolutionEngine.this.context.getExpander().expand(candidate));
                    } catch (MetadataUnavailableException e) {
                        logger.debug(ResolutionEngine.class, "Discarding candidate {} for the rest of the run: {}", candidate, e.getMessage());
                        this.unusable.add(candidate.getBase());
                        continue;
                    }
                    this.prefetch(dependencies);

                    ResolutionState attempt = state.copy();
                    attempt.pin(identifier, candidate);
                    Conflict conflict = null;
                    for (Requirement dependency : dependencies) {
                        conflict = this.addRequirement(attempt, new RequirementInformation(dependency, candidate));
                        if (conflict != null) {
                            break;
                        }
                    }
                    if (conflict == null) {
                        chosen = candidate;
                        next = attempt;
                        break;
                    }
                    if (logger.isDebugEnabled(ResolutionEngine.class)) {
                        logger.debug(ResolutionEngine.class, "Rejecting candidate {}: {}", candidate, conflict);
                    }
                    rejection = conflict;
                    this.tick();
                }

                if (chosen != null) {
                    logger.debug(ResolutionEngine.class, "Pinning {}", chosen);
                    trail.push(new Decision(state, identifier, chosen));
                    state = Objects.requireNonNull(next);
                    continue;
                }

                if (rejection != null) {
                    this.failure = rejection;
                } else if (this.failure == null || criterion.getExcluded().isEmpty()) {
                    // No decision on this identifier was undone, so it ran out of candidates on its own
                    this.failure = new Conflict(identifier, criterion.getInformation());
                }
                if (trail.isEmpty()) {
                    throw new ResolutionConflictException(Objects.requireNonNull(this.failure));
                }
                Decision decision = trail.pop();
                logger.debug(ResolutionEngine.class, "No candidate of '{}' works out, undoing {}", identifier, decision.candidate);
                state = decision.before.copy();
                state.exclude(decision.identifier, decision.candidate);
            }

            logger.debug(ResolutionEngine.class, "Resolved {} identifiers after {} rounds", state.getPins().size(), this.rounds);
            return this.buildGraph(state, applicable);
        }

        private boolean satisfies(@NotNull Candidate pinned, @NotNull Criterion criterion) {
            SpecifierSet constraint = this.constraints.get(criterion.getName());
            if (constraint != null && !constraint.contains(pinned.getVersion(), Boolean.TRUE)) {
                return false;
            }
            for (Requirement requirement : criterion.getRequirements()) {
                if (!requirement.getSpecifier().contains(pinned.getVersion(), Boolean.TRUE)) {
                    return false;
                }
            }
            return this.matchesUrls(pinned, criterion.getRequirements());
        }

        @Nullable
        private String selectIdentifier(@NotNull ResolutionState state) {
            String best = null;
            boolean bestExact = false;
            int bestCount = Integer.MAX_VALUE;
            for (Criterion criterion : state.getCriteria().values()) {
                String identifier = criterion.getIdentifier();
                if (state.getPin(identifier) != null) {
                    continue;
                }
                boolean exact = criterion.isExact();
                if (best != null && bestExact && !exact) {
                    continue;
                }
                int count = this.findMatches(criterion).size();
                if (best == null || (exact && !bestExact) || count < bestCount || (count == bestCount && identifier.compareTo(best) < 0)) {
                    best = identifier;
                    bestExact = exact;
                    bestCount = count;
                }
            }
            return best;
        }

        private void tick() {
            int maxRounds = ResolutionEngine.this.context.getSettings().getMaxRounds();
            if (++this.rounds > maxRounds) {
                throw new ResolutionTimedOutException("Exceeded the maximum of " + maxRounds + " resolution rounds", this.rounds - 1);
            }
            if (System.currentTimeMillis() > this.deadline) {
                throw this.timedOut();
            }
        }

        @NotNull
        private ResolutionTimedOutException timedOut() {
            return new ResolutionTimedOutException("Resolution did not finish within " + ResolutionEngine.this.context.getSettings().getTimeoutMillis() + " ms", this.rounds);
        }
    }

    @NotNull
    private final ResolutionContext context;

    public ResolutionEngine(@NotNull ResolutionContext context) {
        this.context = Objects.requireNonNull(context, "context may not be null");
    }

    /**
     * Resolves the given root requirements.
     *
     * @param roots The root requirements, those whose marker does not hold for the environment are ignored
     * @return The resolved graph
     * @throws ResolutionConflictException If the requirements cannot be satisfied
     * @throws ResolutionTimedOutException If the round budget or the wall-clock budget is exhausted
     */
    @NotNull
    public ResolvedGraph resolve(@NotNull Collection<@NotNull Requirement> roots) {
        return this.resolve(roots, Collections.emptyList());
    }

    /**
     * Resolves the given root requirements, narrowing the admitted versions of any required project through the
     * given constraints. Constraints never cause a project to be required on their own.
     *
     * @param roots The root requirements, those whose marker does not hold for the environment are ignored
     * @param constraints Additional version constraints
     * @return The resolved graph
     * @throws ResolutionConflictException If the requirements cannot be satisfied
     * @throws ResolutionTimedOutException If the round budget or the wall-clock budget is exhausted
     * @throws org.stianloader.pyresolve.repo.IndexUnavailableException If an index cannot be reached
     */
    @NotNull
    public ResolvedGraph resolve(@NotNull Collection<@NotNull Requirement> roots, @NotNull Collection<@NotNull Requirement> constraints) {
        Map<String, SpecifierSet> constraintSpecifiers = new HashMap<>();
        for (Requirement constraint : constraints) {
            if (!constraint.isApplicable(this.context.getEnvironment(), (String) null)) {
                continue;
            }
            if (constraint.getUrl() != null) {
                LoggingAdapter.getDefaultLogger().warn(ResolutionEngine.class, "Ignoring constraint '{}': Constraints may not reference URLs", constraint);
                continue;
            }
            constraintSpecifiers.merge(constraint.getName(), constraint.getSpecifier(), SpecifierSet::intersect);
        }

        try {
            return new Run(constraintSpecifiers).resolve(roots);
        } finally {
            ResolutionCache cache = this.context.getCache();
            int cancelled = cache.isShared() ? 0 : cache.cancelPending();
            if (cancelled != 0) {
                LoggingAdapter.getDefaultLogger().debug(ResolutionEngine.class, "Cancelled {} outstanding lookups", cancelled);
            }
        }
    }
}
