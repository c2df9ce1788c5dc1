package org.stianloader.pyresolve.repo;

import java.util.Objects;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

/**
 * A value that is attached to the {@link PackageIndex} it was obtained from. Used to trace
 * from which index a distribution originates so that its files are fetched from the same index.
 *
 * @param <V> The type of the value
 */
public class IndexAttachedValue<V> {
    @NotNull
    private final V value;
    @NotNull
    private final PackageIndex index;

    public IndexAttachedValue(@NotNull PackageIndex index, @NotNull V value) {
        this.index = Objects.requireNonNull(index, "index may not be null.");
        this.value = Objects.requireNonNull(value, "value may not be null.");
    }

    @NotNull
    @Contract(pure = true)
    public PackageIndex getIndex() {
        return this.index;
    }

    @NotNull
    @Contract(pure = true)
    public V getValue() {
        return this.value;
    }

    @Override
    public String toString() {
        return this.value + " (from " + this.index.getIndexId() + ")";
    }
}
