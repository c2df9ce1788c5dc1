package org.stianloader.pyresolve.resolver;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.function.Predicate;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

/**
 * The ordered candidates of a project, best candidate first. Sequences are immutable and may be
 * iterated any number of times.
 */
public final class CandidateSequence implements Iterable<Candidate> {

    @NotNull
    public static final CandidateSequence EMPTY = new CandidateSequence(Collections.emptyList());

    @NotNull
    private final List<@NotNull Candidate> candidates;

    public CandidateSequence(@NotNull List<@NotNull Candidate> candidates) {
        this.candidates = Collections.unmodifiableList(new ArrayList<>(candidates));
    }

    @NotNull
    @Contract(pure = true)
    public List<@NotNull Candidate> asList() {
        return this.candidates;
    }

    /**
     * Obtains the candidates that satisfy a predicate, keeping their order.
     *
     * @param predicate The predicate
     * @return The matching candidates
     */
    @NotNull
    @Contract(pure = true)
    public List<@NotNull Candidate> filter(@NotNull Predicate<? super Candidate> predicate) {
        List<Candidate> matches = new ArrayList<>();
        for (Candidate candidate : this.candidates) {
            if (predicate.test(candidate)) {
                matches.add(candidate);
            }
        }
        return matches;
    }

    @Contract(pure = true)
    public boolean isEmpty() {
        return this.candidates.isEmpty();
    }

    @Override
    @NotNull
    public Iterator<@NotNull Candidate> iterator() {
        return this.candidates.iterator();
    }

    @Contract(pure = true)
    public int size() {
        return this.candidates.size();
    }

    @Override
    public String toString() {
        return this.candidates.toString();
    }
}
