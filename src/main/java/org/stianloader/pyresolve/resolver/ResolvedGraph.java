package org.stianloader.pyresolve.resolver;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.stianloader.pyresolve.PackageNames;
import org.stianloader.pyresolve.requirement.Requirement;
import org.stianloader.pyresolve.version.PythonVersion;

/**
 * The outcome of a successful resolution: exactly one pinned distribution per project, with the dependency
 * edges between the projects. Projects are ordered by name.
 */
public final class ResolvedGraph {

    /**
     * A pinned project.
     */
    public static final class Node {
        @NotNull
        private final Candidate candidate;
        @NotNull
        private final SortedSet<@NotNull String> extras;
        @NotNull
        private final SortedSet<@NotNull String> parents;
        @NotNull
        private final SortedSet<@NotNull String> dependencies = new TreeSet<>();
        @NotNull
        private final List<@NotNull Requirement> requirements;

        Node(@NotNull Candidate candidate, @NotNull SortedSet<@NotNull String> extras, @NotNull SortedSet<@NotNull String> parents, @NotNull List<@NotNull Requirement> requirements) {
            this.candidate = candidate.getBase();
            this.extras = Collections.unmodifiableSortedSet(extras);
            this.parents = Collections.unmodifiableSortedSet(parents);
            this.requirements = Collections.unmodifiableList(new ArrayList<>(requirements));
        }

        @NotNull
        @Contract(pure = true)
        public Candidate getCandidate() {
            return this.candidate;
        }

        /**
         * Obtains the names of the projects this project depends on.
         *
         * @return The dependency names
         */
        @NotNull
        @Contract(pure = true)
        public SortedSet<@NotNull String> getDependencies() {
            return Collections.unmodifiableSortedSet(this.dependencies);
        }

        /**
         * Obtains the extras of this project that some requirement asked for.
         *
         * @return The requested extras
         */
        @NotNull
        @Contract(pure = true)
        public SortedSet<@NotNull String> getExtras() {
            return this.extras;
        }

        @NotNull
        @Contract(pure = true)
        public String getName() {
            return this.candidate.getName();
        }

        /**
         * Obtains the package URL of the pinned distribution, such as <code>pkg:pypi/requests@2.31.0</code>.
         *
         * @return The package URL
         */
        @NotNull
        @Contract(pure = true)
        public String getPackageUrl() {
            return "pkg:pypi/" + this.candidate.getName() + "@" + this.candidate.getVersion();
        }

        @NotNull
        @Contract(pure = true)
        public SortedSet<@NotNull String> getParents() {
            return this.parents;
        }

        /**
         * Obtains the requirements on this project that justify its presence in the graph.
         *
         * @return The requirements
         */
        @NotNull
        @Contract(pure = true)
        public List<@NotNull Requirement> getRequirements() {
            return this.requirements;
        }

        @NotNull
        @Contract(pure = true)
        public String getSourceUrl() {
            return this.candidate.getSourceUrl();
        }

        @NotNull
        @Contract(pure = true)
        public PythonVersion getVersion() {
            return this.candidate.getVersion();
        }

        @Override
        public String toString() {
            return this.getName() + "==" + this.getVersion();
        }
    }

    @NotNull
    private final Map<@NotNull String, @NotNull Node> nodes;
    @NotNull
    private final SortedSet<@NotNull String> roots;

    ResolvedGraph(@NotNull Collection<@NotNull Node> nodes, @NotNull Collection<@NotNull String> roots) {
        List<Node> sorted = new ArrayList<>(nodes);
        sorted.sort((a, b) -> a.getName().compareTo(b.getName()));
        Map<String, Node> byName = new LinkedHashMap<>();
        for (Node node : sorted) {
            byName.put(node.getName(), node);
        }
        for (Node node : sorted) {
            for (String parent : node.parents) {
                Node parentNode = byName.get(parent);
                if (parentNode != null) {
                    parentNode.dependencies.add(node.getName());
                }
            }
        }
        this.nodes = Collections.unmodifiableMap(byName);
        this.roots = Collections.unmodifiableSortedSet(new TreeSet<>(roots));
    }

    @Contract(pure = true)
    public boolean contains(@NotNull String name) {
        return this.nodes.containsKey(PackageNames.normalize(name));
    }

    @NotNull
    @Contract(pure = true)
    public SortedSet<@NotNull String> getDependencies(@NotNull String name) {
        Node node = this.getNode(name);
        return node == null ? Collections.emptySortedSet() : node.getDependencies();
    }

    /**
     * Obtains the node of a project.
     *
     * @param name The project name, normalized or not
     * @return The node, or null if the project is not part of the graph
     */
    @Nullable
    @Contract(pure = true)
    public Node getNode(@NotNull String name) {
        return this.nodes.get(PackageNames.normalize(name));
    }

    @NotNull
    @Contract(pure = true)
    public Collection<@NotNull Node> getNodes() {
        return this.nodes.values();
    }

    @NotNull
    @Contract(pure = true)
    public SortedSet<@NotNull String> getParents(@NotNull String name) {
        Node node = this.getNode(name);
        return node == null ? Collections.emptySortedSet() : node.getParents();
    }

    /**
     * Obtains the names of the projects that were directly requested.
     *
     * @return The root project names
     */
    @NotNull
    @Contract(pure = true)
    public SortedSet<@NotNull String> getRoots() {
        return this.roots;
    }

    @Contract(pure = true)
    public int size() {
        return this.nodes.size();
    }

    @Override
    public String toString() {
        return "ResolvedGraph" + this.nodes.values();
    }
}
