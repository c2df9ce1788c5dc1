package org.stianloader.pyresolve.test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.Test;
import org.stianloader.pyresolve.ResolverSettings;
import org.stianloader.pyresolve.marker.Environment;
import org.stianloader.pyresolve.metadata.DistributionMetadataExtractor;
import org.stianloader.pyresolve.metadata.SetupCfgMetadataHook;
import org.stianloader.pyresolve.repo.DistributionLink;
import org.stianloader.pyresolve.repo.IndexNegotiator;
import org.stianloader.pyresolve.requirement.Requirement;
import org.stianloader.pyresolve.requirement.RequirementParser;
import org.stianloader.pyresolve.resolver.Candidate;
import org.stianloader.pyresolve.resolver.CandidateSupplier;
import org.stianloader.pyresolve.resolver.CompositeCandidateSupplier;
import org.stianloader.pyresolve.resolver.Conflict;
import org.stianloader.pyresolve.resolver.DirectUrlCandidateSupplier;
import org.stianloader.pyresolve.resolver.IndexCandidateSupplier;
import org.stianloader.pyresolve.resolver.MetadataRequirementExpander;
import org.stianloader.pyresolve.resolver.RequirementExpander;
import org.stianloader.pyresolve.resolver.RequirementInformation;
import org.stianloader.pyresolve.resolver.ResolutionCache;
import org.stianloader.pyresolve.resolver.ResolutionConflictException;
import org.stianloader.pyresolve.resolver.ResolutionContext;
import org.stianloader.pyresolve.resolver.ResolutionEngine;
import org.stianloader.pyresolve.resolver.ResolutionTimedOutException;
import org.stianloader.pyresolve.resolver.ResolvedGraph;
import org.stianloader.pyresolve.version.PythonVersion;

public class ResolutionEngineTest {

    private static final Environment LINUX_311 = Environment.fromPythonVersionAndOs("3.11", "linux");

    private static ResolutionContext context(InMemoryPackageIndex index, ResolverSettings settings) {
        return context(index, settings, new ResolutionCache(), Runnable::run);
    }

    private static ResolutionContext context(InMemoryPackageIndex index, ResolverSettings settings, ResolutionCache cache, Executor executor) {
        CandidateSupplier supplier = new CompositeCandidateSupplier(
                new IndexCandidateSupplier(new IndexNegotiator().addIndex(index), cache, LINUX_311, settings.isPreferSource(), executor),
                new DirectUrlCandidateSupplier(LINUX_311, (url) -> index));
        RequirementExpander expander = new MetadataRequirementExpander(new DistributionMetadataExtractor(new SetupCfgMetadataHook()), cache, LINUX_311, executor);
        return new ResolutionContext(LINUX_311, settings, cache, executor, supplier, expander);
    }

    private static List<Requirement> parse(String... requirements) {
        List<Requirement> parsed = new ArrayList<>();
        for (String requirement : requirements) {
            parsed.add(RequirementParser.parse(requirement));
        }
        return parsed;
    }

    private static ResolvedGraph resolve(InMemoryPackageIndex index, String... roots) {
        return resolve(index, new ResolverSettings(), roots);
    }

    private static ResolvedGraph resolve(InMemoryPackageIndex index, ResolverSettings settings, String... roots) {
        return new ResolutionEngine(context(index, settings)).resolve(parse(roots));
    }

    private static DistributionLink bareLink(InMemoryPackageIndex index, String filename) {
        return new DistributionLink(filename, index.getFileUrl(filename), Collections.emptyMap(), null, false, null, false);
    }

    private static List<Requirement> causes(Conflict conflict) {
        List<Requirement> requirements = new ArrayList<>();
        for (RequirementInformation cause : conflict.getCauses()) {
            requirements.add(cause.getRequirement());
        }
        return requirements;
    }

    private static PythonVersion version(ResolvedGraph graph, String name) {
        return graph.getNode(name).getVersion();
    }

    @Test
    public void testNewestMatchingVersion() {
        InMemoryPackageIndex index = new InMemoryPackageIndex("memory")
                .addWheel("pkg-a", "1.0")
                .addWheel("pkg-a", "1.1")
                .addWheel("pkg-a", "2.0");
        ResolvedGraph graph = resolve(index, "pkg-a>=1.0,<2");
        assertEquals(1, graph.size());
        assertEquals(PythonVersion.parse("1.1"), version(graph, "pkg-a"));
        assertEquals(Collections.singleton("pkg-a"), graph.getRoots());
        assertEquals("pkg:pypi/pkg-a@1.1", graph.getNode("PKG_A").getPackageUrl());
    }

    @Test
    public void testTransitiveDependencies() {
        InMemoryPackageIndex index = new InMemoryPackageIndex("memory")
                .addWheel("pkg-a", "1.1", "pkg-b>=2", "pkg-win; sys_platform == \"win32\"")
                .addWheel("pkg-b", "1.0")
                .addWheel("pkg-b", "2.0", "pkg-c")
                .addWheel("pkg-b", "2.1", "pkg-c")
                .addWheel("pkg-c", "0.9")
                .addWheel("pkg-win", "1.0");
        ResolvedGraph graph = resolve(index, "pkg-a");
        assertEquals(3, graph.size());
        assertEquals(PythonVersion.parse("2.1"), version(graph, "pkg-b"));
        assertEquals(Collections.singleton("pkg-a"), graph.getParents("pkg-b"));
        assertEquals(Collections.singleton("pkg-b"), graph.getDependencies("pkg-a"));
        assertEquals(Collections.singleton("pkg-c"), graph.getDependencies("pkg-b"));
        assertEquals(parse("pkg-b>=2"), graph.getNode("pkg-b").getRequirements());
        assertFalse(graph.contains("pkg-win"));
    }

    @Test
    public void testMarkerExcludedRoot() {
        InMemoryPackageIndex index = new InMemoryPackageIndex("memory").addWheel("pkg-a", "1.0").addWheel("pkg-b", "1.0");
        ResolvedGraph graph = resolve(index, "pkg-a; sys_platform == \"win32\"", "pkg-b");
        assertFalse(graph.contains("pkg-a"));
        assertTrue(graph.contains("pkg-b"));
        assertEquals(Collections.singleton("pkg-b"), graph.getRoots());
    }

    @Test
    public void testConflictNamesAllRequirements() {
        InMemoryPackageIndex index = new InMemoryPackageIndex("memory")
                .addWheel("pkg-a", "1.0")
                .addWheel("pkg-a", "1.1")
                .addWheel("pkg-b", "1.0", "pkg-a>=1.1");
        ResolutionConflictException e = assertThrows(ResolutionConflictException.class, () -> resolve(index, "pkg-a==1.0", "pkg-b"));
        Conflict conflict = e.getConflict();
        assertEquals("pkg-a", conflict.getIdentifier());
        assertEquals(2, conflict.getCauses().size());
        assertEquals(RequirementParser.parse("pkg-a==1.0"), conflict.getCauses().get(0).getRequirement());
        assertNull(conflict.getCauses().get(0).getParent());
        assertEquals(RequirementParser.parse("pkg-a>=1.1"), conflict.getCauses().get(1).getRequirement());
        assertEquals("pkg-b", conflict.getCauses().get(1).getParent().getName());
    }

    @Test
    public void testUnknownProject() {
        InMemoryPackageIndex index = new InMemoryPackageIndex("memory").addWheel("pkg-a", "1.0");
        ResolutionConflictException e = assertThrows(ResolutionConflictException.class, () -> resolve(index, "pkg-a", "does-not-exist>=1"));
        assertEquals("does-not-exist", e.getConflict().getIdentifier());
    }

    @Test
    public void testBacktracking() {
        InMemoryPackageIndex index = new InMemoryPackageIndex("memory")
                .addWheel("pkg-a", "1.0")
                .addWheel("pkg-a", "2.0", "pkg-b", "pkg-c")
                .addWheel("pkg-b", "1.0", "pkg-d>=2")
                .addWheel("pkg-c", "1.0", "pkg-d<2")
                .addWheel("pkg-d", "1.0")
                .addWheel("pkg-d", "2.0");
        ResolvedGraph graph = resolve(index, "pkg-a");
        assertEquals(1, graph.size());
        assertEquals(PythonVersion.parse("1.0"), version(graph, "pkg-a"));

        ResolverSettings limited = new ResolverSettings().setMaxRounds(3);
        ResolutionTimedOutException e = assertThrows(ResolutionTimedOutException.class, () -> resolve(index, limited, "pkg-a"));
        assertEquals(3, e.getRounds());
    }

    @Test
    public void testDeterminism() {
        InMemoryPackageIndex index = new InMemoryPackageIndex("memory")
                .addWheel("pkg-a", "1.0", "pkg-c<2", "pkg-b")
                .addWheel("pkg-b", "1.0", "pkg-c")
                .addWheel("pkg-b", "1.5", "pkg-c>=2")
                .addWheel("pkg-c", "1.0")
                .addWheel("pkg-c", "2.0");
        String first = resolve(index, "pkg-a").getNodes().toString();
        for (int i = 0; i < 5; i++) {
            assertEquals(first, resolve(index, "pkg-a").getNodes().toString());
        }
        assertEquals("[pkg-a==1.0, pkg-b==1.0, pkg-c==1.0]", first);
    }

    @Test
    public void testExtras() {
        InMemoryPackageIndex index = new InMemoryPackageIndex("memory")
                .addWheel("pkg-a", "1.0", "pkg-b; extra == \"fast\"")
                .addWheel("pkg-b", "1.0");
        ResolvedGraph plain = resolve(index, "pkg-a");
        assertFalse(plain.contains("pkg-b"));

        ResolvedGraph fast = resolve(index, "pkg-a[fast]");
        assertEquals(2, fast.size());
        assertEquals(Collections.singleton("fast"), fast.getNode("pkg-a").getExtras());
        assertEquals(Collections.singleton("pkg-a"), fast.getParents("pkg-b"));
        assertTrue(fast.getParents("pkg-a").isEmpty());
    }

    @Test
    public void testConstraints() {
        InMemoryPackageIndex index = new InMemoryPackageIndex("memory")
                .addWheel("pkg-a", "1.0")
                .addWheel("pkg-a", "1.1")
                .addWheel("pkg-z", "1.0");
        ResolvedGraph graph = new ResolutionEngine(context(index, new ResolverSettings()))
                .resolve(parse("pkg-a"), parse("pkg-a<1.1", "pkg-z==1.0", "pkg-a; sys_platform == \"win32\""));
        assertEquals(PythonVersion.parse("1.0"), version(graph, "pkg-a"));
        assertFalse(graph.contains("pkg-z"));

        assertThrows(ResolutionConflictException.class, () -> new ResolutionEngine(context(index, new ResolverSettings()))
                .resolve(parse("pkg-a"), parse("pkg-a>2")));
    }

    @Test
    public void testPrunedCandidates() {
        InMemoryPackageIndex index = new InMemoryPackageIndex("memory");
        index.addWheel("pkg-a", "1.0")
                .addWheel("pkg-a", "1.1", null, true)
                .addWheel("pkg-a", "1.2", ">=3.12", false)
                .addWheel("pkg-a", "1.3b1")
                .addLink("pkg-a", new DistributionLink("pkg_a-1.4-py3-none-any.whl", index.getFileUrl("pkg_a-1.4-py3-none-any.whl"),
                        Collections.emptyMap(), null, false, null, false))
                .addLink("pkg-a", new DistributionLink("pkg_a-1.5-cp312-cp312-win_amd64.whl", index.getFileUrl("pkg_a-1.5-cp312-cp312-win_amd64.whl"),
                        Collections.emptyMap(), null, false, null, false));
        // yanked, requires-python, pre-release, missing metadata and incompatible tags
        assertEquals(PythonVersion.parse("1.0"), version(resolve(index, "pkg-a"), "pkg-a"));
        assertEquals(PythonVersion.parse("1.1"), version(resolve(index, "pkg-a==1.1"), "pkg-a"));
        assertEquals(PythonVersion.parse("1.3b1"), version(resolve(index, new ResolverSettings().setAllowPrereleases(true), "pkg-a<1.4"), "pkg-a"));
    }

    @Test
    public void testDirectUrl() {
        InMemoryPackageIndex index = new InMemoryPackageIndex("memory")
                .addWheel("pkg-a", "1.0")
                .addWheelArchive("pkg-e", "3.0", "pkg-a");
        String url = index.getFileUrl("pkg_e-3.0-py3-none-any.whl");
        ResolvedGraph graph = resolve(index, "pkg-e @ " + url + "#sha256=00ff");
        assertEquals(2, graph.size());
        assertEquals(PythonVersion.parse("3.0"), version(graph, "pkg-e"));
        assertEquals(url, graph.getNode("pkg-e").getSourceUrl());
        assertTrue(graph.getNode("pkg-e").getCandidate().isDirect());
        assertEquals(Collections.singleton("pkg-e"), graph.getParents("pkg-a"));

        assertThrows(ResolutionConflictException.class, () -> resolve(index, "pkg-e @ " + url, "pkg-e<3"));
        assertEquals("[pkg-a==1.0, pkg-e==3.0]", graph.getNodes().toString());
    }

    @Test
    public void testSkipsVersionWithUnavailableDependency() {
        InMemoryPackageIndex index = new InMemoryPackageIndex("memory")
                .addWheel("pkg-a", "1.0")
                .addWheel("pkg-a", "1.1")
                .addWheel("pkg-a", "2.0", "pkg-b>=2.0")
                .addWheel("pkg-b", "1.0");
        ResolvedGraph graph = resolve(index, "pkg-a>=1.0");
        assertEquals(PythonVersion.parse("1.1"), version(graph, "pkg-a"));
        assertFalse(graph.contains("pkg-b"));

        InMemoryPackageIndex withoutB = new InMemoryPackageIndex("memory")
                .addWheel("pkg-a", "1.0")
                .addWheel("pkg-a", "1.1")
                .addWheel("pkg-a", "2.0", "pkg-b>=2.0");
        assertEquals(PythonVersion.parse("1.1"), version(resolve(withoutB, "pkg-a>=1.0"), "pkg-a"));
    }

    @Test
    public void testPinOnUndeclaredVersion() {
        InMemoryPackageIndex index = new InMemoryPackageIndex("memory").addWheel("pkg-a", "2.0");
        ResolutionConflictException e = assertThrows(ResolutionConflictException.class, () -> resolve(index, "pkg-a", "pkg-a==1.0"));
        assertEquals("pkg-a", e.getConflict().getIdentifier());
        assertEquals(parse("pkg-a", "pkg-a==1.0"), causes(e.getConflict()));
    }

    @Test
    public void testPythonVersionMarker() {
        InMemoryPackageIndex index = new InMemoryPackageIndex("memory")
                .addWheel("pkg-a", "1.0")
                .addWheel("pkg-b", "1.0", "pkg-a")
                .addWheel("pkg-c", "1.0");
        ResolvedGraph graph = resolve(index, "pkg-a; python_version<'3.8'");
        assertEquals(0, graph.size());
        assertFalse(graph.contains("pkg-a"));
        assertEquals(0, index.getPageRequests());

        ResolvedGraph required = resolve(index, "pkg-a; python_version<'3.8'", "pkg-b");
        assertTrue(required.contains("pkg-a"));
        assertEquals(Collections.singleton("pkg-b"), required.getParents("pkg-a"));
        assertEquals(Collections.singleton("pkg-b"), required.getRoots());
    }

    @Test
    public void testCandidateIdentity() {
        InMemoryPackageIndex index = new InMemoryPackageIndex("memory");
        PythonVersion version = PythonVersion.parse("1.0");
        Candidate generic = new Candidate("pkg-a", version, bareLink(index, "pkg_a-1.0-py3-none-any.whl"), index, 40, false);
        Candidate linux = new Candidate("pkg-a", version, bareLink(index, "pkg_a-1.0-cp311-cp311-manylinux_2_17_x86_64.whl"), index, 0, false);
        assertEquals(generic, linux);
        assertEquals(generic.hashCode(), linux.hashCode());

        assertNotEquals(generic, new Candidate("pkg-a", version, bareLink(index, "pkg_a-1.0.tar.gz"), index, Integer.MAX_VALUE, false));
        assertNotEquals(generic, new Candidate("pkg-a", PythonVersion.parse("1.1"), bareLink(index, "pkg_a-1.1-py3-none-any.whl"), index, 40, false));
        assertNotEquals(generic, new Candidate("pkg-a", version, bareLink(index, "pkg_a-1.0-py3-none-any.whl"), index, 40, true));
        assertNotEquals(generic, generic.withExtras(Collections.singleton("fast")));
        assertEquals(linux.withExtras(Collections.singleton("fast")), generic.withExtras(Collections.singleton("Fast")));
    }

    @Test
    public void testOneCandidatePerVersion() {
        String manylinux = "cp311-cp311-manylinux_2_17_x86_64";
        InMemoryPackageIndex index = new InMemoryPackageIndex("memory")
                .addWheel("pkg-a", "1.0")
                .addWheel("pkg-a", "2.0", "pkg-missing")
                .addTaggedWheel("pkg-a", "2.0", manylinux, "pkg-missing")
                .addWheel("pkg-b", "1.0")
                .addTaggedWheel("pkg-b", "1.0", manylinux);
        ResolvedGraph graph = resolve(index, "pkg-a", "pkg-b");
        assertEquals(PythonVersion.parse("1.0"), version(graph, "pkg-a"));
        assertEquals(index.getFileUrl("pkg_b-1.0-" + manylinux + ".whl"), graph.getNode("pkg-b").getSourceUrl());
        // pkg-a 2.0 is given up after its first wheel, the metadata of each version is fetched once
        assertEquals(3, index.getResourceRequests());
    }

    @Test
    public void testConflictNamesExhaustedProject() {
        InMemoryPackageIndex index = new InMemoryPackageIndex("memory").addWheel("aaa", "1.0");
        index.addLink("pkg-a", bareLink(index, "pkg_a-1.0-py3-none-any.whl"));
        ResolutionConflictException e = assertThrows(ResolutionConflictException.class, () -> resolve(index, "aaa", "pkg-a"));
        assertEquals("pkg-a", e.getConflict().getIdentifier());
        assertEquals(parse("pkg-a"), causes(e.getConflict()));
    }

    @Test
    public void testUnusableCandidateStaysExcluded() {
        InMemoryPackageIndex index = new InMemoryPackageIndex("memory")
                .addWheel("aaa", "1.0")
                .addWheel("aaa", "2.0")
                .addWheel("bbb", "1.0", "aaa<2");
        index.addLink("bbb", bareLink(index, "bbb-2.0-py3-none-any.whl"));

        ResolverSettings settings = new ResolverSettings();
        ResolutionContext plain = context(index, settings);
        Map<String, AtomicInteger> expansions = new ConcurrentHashMap<>();
        RequirementExpander counting = (candidate) -> {
            expansions.computeIfAbsent(candidate.getFilename(), (ignored) -> new AtomicInteger()).incrementAndGet();
            return plain.getExpander().expand(candidate);
        };
        ResolutionContext context = new ResolutionContext(LINUX_311, settings, plain.getCache(), Runnable::run, plain.getSupplier(), counting);

        ResolvedGraph graph = new ResolutionEngine(context).resolve(parse("aaa", "bbb"));
        assertEquals("[aaa==1.0, bbb==1.0]", graph.getNodes().toString());
        // Once ahead of time and once when bbb is first decided; undoing the pin of aaa does not bring it back
        assertEquals(2, expansions.get("bbb-2.0-py3-none-any.whl").get());
    }

    @Test
    public void testWallClockTimeout() {
        InMemoryPackageIndex index = new InMemoryPackageIndex("memory")
                .addWheel("pkg-a", "1.0")
                .hang("pkg-b");
        ResolverSettings settings = new ResolverSettings().setTimeoutMillis(300);
        long start = System.currentTimeMillis();
        assertThrows(ResolutionTimedOutException.class, () -> resolve(index, settings, "pkg-a", "pkg-b"));
        long elapsed = System.currentTimeMillis() - start;
        assertTrue(elapsed >= 250 && elapsed < 10_000, "Elapsed " + elapsed + " ms");

        assertFalse(index.getHungRequests().isEmpty());
        for (CompletableFuture<?> request : index.getHungRequests()) {
            assertTrue(request.isCancelled());
        }
    }

    @Test
    public void testConcurrentRunsShareLookups() throws Exception {
        InMemoryPackageIndex index = new InMemoryPackageIndex("memory")
                .addWheel("pkg-a", "1.0", "pkg-b", "pkg-c")
                .addWheel("pkg-b", "1.0", "pkg-d")
                .addWheel("pkg-c", "1.0", "pkg-d")
                .addWheel("pkg-d", "1.0");
        ResolutionCache cache = new ResolutionCache(System.currentTimeMillis(), true);
        ExecutorService lookups = Executors.newFixedThreadPool(4);
        ExecutorService runners = Executors.newFixedThreadPool(8);
        try {
            List<Future<ResolvedGraph>> runs = new ArrayList<>();
            for (int i = 0; i < 8; i++) {
                runs.add(runners.submit(() -> new ResolutionEngine(context(index, new ResolverSettings(), cache, lookups)).resolve(parse("pkg-a"))));
            }
            for (Future<ResolvedGraph> run : runs) {
                assertEquals("[pkg-a==1.0, pkg-b==1.0, pkg-c==1.0, pkg-d==1.0]", run.get(30, TimeUnit.SECONDS).getNodes().toString());
            }
        } finally {
            runners.shutdownNow();
            lookups.shutdownNow();
        }
        for (String project : Arrays.asList("pkg-a", "pkg-b", "pkg-c", "pkg-d")) {
            assertEquals(1, index.getPageRequests(project), project);
        }
        assertEquals(4, index.getResourceRequests());
    }
}
