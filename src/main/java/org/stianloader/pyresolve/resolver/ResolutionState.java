package org.stianloader.pyresolve.resolver;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * A snapshot of the resolution: the candidate pinned for each identifier and the criteria of all identifiers
 * that are required. Snapshots are only mutated by the resolving thread, and only before they are recorded
 * as a decision.
 */
public final class ResolutionState {
    @NotNull
    private final Map<String, Candidate> pins;
    @NotNull
    private final Map<String, Criterion> criteria;

    ResolutionState() {
        this(new LinkedHashMap<>(), new LinkedHashMap<>());
    }

    private ResolutionState(@NotNull Map<String, Candidate> pins, @NotNull Map<String, Criterion> criteria) {
        this.pins = pins;
        this.criteria = criteria;
    }

    @NotNull
    @Contract(pure = true)
    ResolutionState copy() {
        return new ResolutionState(new LinkedHashMap<>(this.pins), new LinkedHashMap<>(this.criteria));
    }

    void exclude(@NotNull String identifier, @NotNull Candidate candidate) {
        Criterion criterion = this.criteria.get(identifier);
        if (criterion != null) {
            this.criteria.put(identifier, criterion.excluding(candidate));
        }
    }

    @NotNull
    @Contract(pure = true)
    public Map<@NotNull String, @NotNull Criterion> getCriteria() {
        return Collections.unmodifiableMap(this.criteria);
    }

    @Nullable
    @Contract(pure = true)
    public Criterion getCriterion(@NotNull String identifier) {
        return this.criteria.get(identifier);
    }

    @Nullable
    @Contract(pure = true)
    public Candidate getPin(@NotNull String identifier) {
        return this.pins.get(identifier);
    }

    @NotNull
    @Contract(pure = true)
    public Map<@NotNull String, @NotNull Candidate> getPins() {
        return Collections.unmodifiableMap(this.pins);
    }

    void pin(@NotNull String identifier, @NotNull Candidate candidate) {
        this.pins.put(identifier, candidate);
    }

    void putCriterion(@NotNull Criterion criterion) {
        this.criteria.put(criterion.getIdentifier(), criterion);
    }

    @Override
    public String toString() {
        return "ResolutionState[pins=" + this.pins.values() + "]";
    }
}
