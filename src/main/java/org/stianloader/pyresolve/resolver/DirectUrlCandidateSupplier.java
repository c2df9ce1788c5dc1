package org.stianloader.pyresolve.resolver;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.stianloader.pyresolve.logging.LoggingAdapter;
import org.stianloader.pyresolve.marker.Environment;
import org.stianloader.pyresolve.marker.WheelFilename;
import org.stianloader.pyresolve.repo.DistributionLink;
import org.stianloader.pyresolve.repo.PackageIndex;
import org.stianloader.pyresolve.repo.SourceDistributionFilename;
import org.stianloader.pyresolve.requirement.Requirement;

/**
 * Lists the candidates of direct URL references (<code>name @ https://host/name-1.0-py3-none-any.whl</code>).
 * The version is taken from the file name, so only URLs pointing at wheels or source distribution archives
 * are supported.
 */
public class DirectUrlCandidateSupplier implements CandidateSupplier {

    private static final Set<String> HASH_ALGORITHMS = new HashSet<>(Arrays.asList("md5", "sha1", "sha224", "sha256", "sha384", "sha512"));

    @NotNull
    static String stripFragment(@NotNull String url) {
        int fragment = url.indexOf('#');
        return fragment == -1 ? url : url.substring(0, fragment);
    }

    @NotNull
    private final Environment environment;
    @NotNull
    private final Function<String, PackageIndex> indexFactory;

    /**
     * Creates a supplier.
     *
     * @param environment The target environment
     * @param indexFactory Creates the {@link PackageIndex} through which the file behind an URL is fetched
     */
    public DirectUrlCandidateSupplier(@NotNull Environment environment, @NotNull Function<String, PackageIndex> indexFactory) {
        this.environment = environment;
        this.indexFactory = indexFactory;
    }

    @Override
    @NotNull
    public CompletableFuture<CandidateSequence> listCandidates(@NotNull String name, @NotNull Collection<@NotNull Requirement> requirements) {
        Set<String> urls = new LinkedHashSet<>();
        for (Requirement requirement : requirements) {
            if (requirement.getUrl() != null) {
                urls.add(requirement.getUrl());
            }
        }
        List<Candidate> candidates = new ArrayList<>();
        for (String url : urls) {
            Candidate candidate = this.toCandidate(name, url);
            if (candidate != null) {
                candidates.add(candidate);
            }
        }
        candidates.sort(IndexCandidateSupplier.candidateOrder(false));
        return CompletableFuture.completedFuture(new CandidateSequence(candidates));
    }

    @Nullable
    private Candidate toCandidate(@NotNull String name, @NotNull String url) {
        String location = DirectUrlCandidateSupplier.stripFragment(url);
        int query = location.indexOf('?');
        if (query != -1) {
            location = location.substring(0, query);
        }
        String filename = location.substring(location.lastIndexOf('/') + 1);

        Map<String, String> hashes = new LinkedHashMap<>();
        int fragment = url.indexOf('#');
        if (fragment != -1) {
            for (String part : url.substring(fragment + 1).split("&")) {
                String[] hash = part.split("=", 2);
                if (hash.length == 2 && DirectUrlCandidateSupplier.HASH_ALGORITHMS.contains(hash[0].toLowerCase(Locale.ROOT))) {
                    hashes.put(hash[0].toLowerCase(Locale.ROOT), hash[1]);
                }
            }
        }
        DistributionLink link = new DistributionLink(filename, url, hashes, null, false, null, false);

        if (WheelFilename.isWheel(filename)) {
            WheelFilename wheel = WheelFilename.tryParse(filename);
            if (wheel == null || !wheel.getName().equals(name)) {
                LoggingAdapter.getDefaultLogger().warn(DirectUrlCandidateSupplier.class, "Direct URL {} does not point at a wheel of '{}'", url, name);
                return null;
            }
            int priority = this.environment.getTagPriority(wheel);
            if (priority < 0) {
                LoggingAdapter.getDefaultLogger().warn(DirectUrlCandidateSupplier.class, "Wheel {} is not compatible with {}", filename, this.environment);
                return null;
            }
            return new Candidate(name, wheel.getVersion(), link, this.indexFactory.apply(url), priority, true);
        }
        SourceDistributionFilename sdist = SourceDistributionFilename.tryParse(filename, name);
        if (sdist == null) {
            LoggingAdapter.getDefaultLogger().warn(DirectUrlCandidateSupplier.class, "Unsupported direct URL {} for '{}': only wheel and source archive URLs are supported", url, name);
            return null;
        }
        return new Candidate(name, sdist.getVersion(), link, this.indexFactory.apply(url), Integer.MAX_VALUE, true);
    }
}
