package org.stianloader.pyresolve.test;

import java.io.ByteArrayOutputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.stianloader.pyresolve.PackageNames;
import org.stianloader.pyresolve.repo.DistributionLink;
import org.stianloader.pyresolve.repo.IndexAttachedValue;
import org.stianloader.pyresolve.repo.PackageIndex;
import org.stianloader.pyresolve.repo.ProjectNotFoundException;
import org.stianloader.pyresolve.version.SpecifierSet;

/**
 * A {@link PackageIndex} that serves project pages and files from memory. Wheels registered through
 * {@link #addWheel(String, String, String...)} are served with their core metadata as a separate file.
 */
public class InMemoryPackageIndex implements PackageIndex {

    @NotNull
    public static String metadata(@NotNull String name, @NotNull String version, @NotNull String... requiresDist) {
        StringBuilder builder = new StringBuilder();
        builder.append("Metadata-Version: 2.1\n");
        builder.append("Name: ").append(name).append('\n');
        builder.append("Version: ").append(version).append('\n');
        for (String requirement : requiresDist) {
            builder.append("Requires-Dist: ").append(requirement).append('\n');
            int extra = requirement.indexOf("extra == \"");
            if (extra != -1) {
                int start = extra + "extra == \"".length();
                builder.append("Provides-Extra: ").append(requirement, start, requirement.indexOf('"', start)).append('\n');
            }
        }
        return builder.toString();
    }

    @NotNull
    private final String id;
    @NotNull
    private final Map<String, List<DistributionLink>> projects = new ConcurrentHashMap<>();
    @NotNull
    private final Map<String, Throwable> failures = new ConcurrentHashMap<>();
    @NotNull
    private final Map<String, byte[]> resources = new ConcurrentHashMap<>();
    @NotNull
    private final Set<String> hanging = ConcurrentHashMap.newKeySet();
    @NotNull
    private final List<CompletableFuture<?>> hungRequests = new CopyOnWriteArrayList<>();
    @NotNull
    private final Map<String, AtomicInteger> pageRequestsByProject = new ConcurrentHashMap<>();
    @NotNull
    private final AtomicInteger pageRequests = new AtomicInteger();
    @NotNull
    private final AtomicInteger resourceRequests = new AtomicInteger();

    public InMemoryPackageIndex(@NotNull String id) {
        this.id = id;
    }

    @NotNull
    @Contract(mutates = "this", pure = false, value = "_, _, _ -> this")
    public InMemoryPackageIndex addFile(@NotNull String project, @NotNull String filename, byte @NotNull[] contents) {
        String url = this.getFileUrl(filename);
        this.resources.put(url, contents);
        return this.addLink(project, new DistributionLink(filename, url, Collections.emptyMap(), null, false, null, false));
    }

    @NotNull
    @Contract(mutates = "this", pure = false, value = "_, _ -> this")
    public InMemoryPackageIndex addLink(@NotNull String project, @NotNull DistributionLink link) {
        this.projects.computeIfAbsent(PackageNames.normalize(project), (ignored) -> Collections.synchronizedList(new ArrayList<>())).add(link);
        return this;
    }

    @NotNull
    @Contract(mutates = "this", pure = false, value = "_, _, _ -> this")
    public InMemoryPackageIndex addWheel(@NotNull String name, @NotNull String version, @NotNull String... requiresDist) {
        return this.addWheel(name, version, null, false, requiresDist);
    }

    @NotNull
    @Contract(mutates = "this", pure = false, value = "_, _, _, _, _ -> this")
    public InMemoryPackageIndex addWheel(@NotNull String name, @NotNull String version, @Nullable String requiresPython, boolean yanked, @NotNull String... requiresDist) {
        return this.registerWheel(name, version, "py3-none-any", requiresPython, yanked, requiresDist);
    }

    /**
     * Registers a wheel built for the given compatibility tag, for example <code>cp311-cp311-manylinux_2_17_x86_64</code>.
     */
    @NotNull
    @Contract(mutates = "this", pure = false, value = "_, _, _, _ -> this")
    public InMemoryPackageIndex addTaggedWheel(@NotNull String name, @NotNull String version, @NotNull String tag, @NotNull String... requiresDist) {
        return this.registerWheel(name, version, tag, null, false, requiresDist);
    }

    @NotNull
    private InMemoryPackageIndex registerWheel(@NotNull String name, @NotNull String version, @NotNull String tag, @Nullable String requiresPython, boolean yanked, @NotNull String... requiresDist) {
        String filename = PackageNames.normalize(name).replace('-', '_') + "-" + version + "-" + tag + ".whl";
        String url = this.getFileUrl(filename);
        this.resources.put(url + ".metadata", InMemoryPackageIndex.metadata(name, version, requiresDist).getBytes(StandardCharsets.UTF_8));
        SpecifierSet pythonSpecifier = requiresPython == null ? null : SpecifierSet.parse(requiresPython);
        return this.addLink(name, new DistributionLink(filename, url, Collections.emptyMap(), pythonSpecifier, yanked, null, true));
    }

    /**
     * Makes lookups of the project page of a project never complete. The futures handed out are recorded,
     * see {@link #getHungRequests()}.
     */
    @NotNull
    @Contract(mutates = "this", pure = false, value = "_ -> this")
    public InMemoryPackageIndex hang(@NotNull String project) {
        this.hanging.add(PackageNames.normalize(project));
        return this;
    }

    @NotNull
    public List<CompletableFuture<?>> getHungRequests() {
        return this.hungRequests;
    }

    @NotNull
    @Contract(mutates = "this", pure = false, value = "_, _ -> this")
    public InMemoryPackageIndex failWith(@NotNull String project, @NotNull Throwable failure) {
        this.failures.put(PackageNames.normalize(project), failure);
        return this;
    }

    /**
     * Registers a wheel archive that carries its metadata in <code>.dist-info/METADATA</code> only.
     */
    @NotNull
    @Contract(mutates = "this", pure = false, value = "_, _, _ -> this")
    public InMemoryPackageIndex addWheelArchive(@NotNull String name, @NotNull String version, @NotNull String... requiresDist) {
        String distName = PackageNames.normalize(name).replace('-', '_') + "-" + version;
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (ZipOutputStream zip = new ZipOutputStream(out)) {
            zip.putNextEntry(new ZipEntry(distName + ".dist-info/METADATA"));
            zip.write(InMemoryPackageIndex.metadata(name, version, requiresDist).getBytes(StandardCharsets.UTF_8));
            zip.closeEntry();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return this.addFile(name, distName + "-py3-none-any.whl", out.toByteArray());
    }

    @NotNull
    public String getFileUrl(@NotNull String filename) {
        return "https://" + this.id + ".invalid/files/" + filename;
    }

    @Override
    @NotNull
    public String getIndexId() {
        return this.id;
    }

    public int getPageRequests() {
        return this.pageRequests.get();
    }

    public int getPageRequests(@NotNull String project) {
        AtomicInteger requests = this.pageRequestsByProject.get(PackageNames.normalize(project));
        return requests == null ? 0 : requests.get();
    }

    @Override
    @NotNull
    public String getPlaintextURL() {
        return "https://" + this.id + ".invalid/simple/";
    }

    @Override
    @NotNull
    public CompletableFuture<IndexAttachedValue<List<DistributionLink>>> getProjectPage(@NotNull String normalizedName, @NotNull Executor executor) {
        this.pageRequests.incrementAndGet();
        this.pageRequestsByProject.computeIfAbsent(normalizedName, (ignored) -> new AtomicInteger()).incrementAndGet();
        CompletableFuture<IndexAttachedValue<List<DistributionLink>>> future = new CompletableFuture<>();
        if (this.hanging.contains(normalizedName)) {
            this.hungRequests.add(future);
            return future;
        }
        Throwable failure = this.failures.get(normalizedName);
        List<DistributionLink> links = this.projects.get(normalizedName);
        if (failure != null) {
            future.completeExceptionally(failure);
        } else if (links == null) {
            future.completeExceptionally(new ProjectNotFoundException(normalizedName, this.id));
        } else {
            synchronized (links) {
                future.complete(new IndexAttachedValue<>(this, new ArrayList<>(links)));
            }
        }
        return future;
    }

    @Override
    @NotNull
    public CompletableFuture<byte[]> getResource(@NotNull String url, @NotNull Executor executor) {
        this.resourceRequests.incrementAndGet();
        CompletableFuture<byte[]> future = new CompletableFuture<>();
        int fragment = url.indexOf('#');
        byte[] contents = this.resources.get(fragment == -1 ? url : url.substring(0, fragment));
        if (contents == null) {
            future.completeExceptionally(new FileNotFoundException(url));
        } else {
            future.complete(contents);
        }
        return future;
    }

    public int getResourceRequests() {
        return this.resourceRequests.get();
    }

    @Override
    public String toString() {
        return "InMemoryPackageIndex[" + this.id + "]";
    }
}
