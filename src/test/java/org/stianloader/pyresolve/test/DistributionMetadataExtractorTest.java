package org.stianloader.pyresolve.test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

import org.apache.commons.compress.archivers.tar.TarArchiveEntry;
import org.apache.commons.compress.archivers.tar.TarArchiveOutputStream;
import org.apache.commons.compress.compressors.gzip.GzipCompressorOutputStream;
import org.junit.jupiter.api.Test;
import org.stianloader.pyresolve.marker.Environment;
import org.stianloader.pyresolve.metadata.CoreMetadata;
import org.stianloader.pyresolve.metadata.DistributionMetadataExtractor;
import org.stianloader.pyresolve.metadata.MetadataUnavailableException;
import org.stianloader.pyresolve.metadata.SetupCfgMetadataHook;
import org.stianloader.pyresolve.repo.DistributionLink;
import org.stianloader.pyresolve.requirement.Requirement;
import org.stianloader.pyresolve.requirement.RequirementParser;
import org.stianloader.pyresolve.resolver.Candidate;
import org.stianloader.pyresolve.version.PythonVersion;
import org.stianloader.pyresolve.version.SpecifierSet;

public class DistributionMetadataExtractorTest {

    private static final Environment LINUX_38 = Environment.fromPythonVersionAndOs("3.8", "linux");

    private static Candidate candidate(InMemoryPackageIndex index, String name, String version, String filename, boolean coreMetadata) {
        DistributionLink link = new DistributionLink(filename, index.getFileUrl(filename), Collections.emptyMap(), null, false, null, coreMetadata);
        return new Candidate(name, PythonVersion.parse(version), link, index, filename.endsWith(".whl") ? 0 : Integer.MAX_VALUE, false);
    }

    private static CoreMetadata extract(DistributionMetadataExtractor extractor, Candidate candidate) throws Exception {
        return extractor.extract(candidate, Runnable::run).get();
    }

    private static byte[] tarGz(Map<String, String> members) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (TarArchiveOutputStream tar = new TarArchiveOutputStream(new GzipCompressorOutputStream(out))) {
            for (Map.Entry<String, String> member : members.entrySet()) {
                byte[] data = member.getValue().getBytes(StandardCharsets.UTF_8);
                TarArchiveEntry entry = new TarArchiveEntry(member.getKey());
                entry.setSize(data.length);
                tar.putArchiveEntry(entry);
                tar.write(data);
                tar.closeArchiveEntry();
            }
        }
        return out.toByteArray();
    }

    private static byte[] zip(Map<String, String> members) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (ZipOutputStream zip = new ZipOutputStream(out)) {
            for (Map.Entry<String, String> member : members.entrySet()) {
                zip.putNextEntry(new ZipEntry(member.getKey()));
                zip.write(member.getValue().getBytes(StandardCharsets.UTF_8));
                zip.closeEntry();
            }
        }
        return out.toByteArray();
    }

    @Test
    public void testIndexServedMetadata() throws Exception {
        InMemoryPackageIndex index = new InMemoryPackageIndex("memory").addWheel("pkg-a", "1.0", "pkg-b>=1.0", "pkg-c; extra == \"fast\"");
        Candidate candidate = candidate(index, "pkg-a", "1.0", "pkg_a-1.0-py3-none-any.whl", true);

        CoreMetadata metadata = extract(new DistributionMetadataExtractor(), candidate);
        assertEquals("pkg-a", metadata.getName());
        assertEquals(2, metadata.getRequirements().size());
        assertEquals(Collections.singleton("fast"), metadata.getProvidesExtra());
        // Only the metadata file is fetched, never the wheel itself
        assertEquals(1, index.getResourceRequests());
    }

    @Test
    public void testWheelArchive() throws Exception {
        Map<String, String> members = new LinkedHashMap<>();
        members.put("pkg_a/__init__.py", "");
        members.put("pkg_a-1.0.dist-info/METADATA", InMemoryPackageIndex.metadata("pkg_a", "1.0", "pkg-b>=1.0"));
        members.put("pkg_a-1.0.dist-info/WHEEL", "Wheel-Version: 1.0\nRoot-Is-Purelib: true\nTag: py3-none-any\n");
        InMemoryPackageIndex index = new InMemoryPackageIndex("memory").addFile("pkg-a", "pkg_a-1.0-py3-none-any.whl", zip(members));

        // Announced metadata that the index fails to serve falls back to the archive
        Candidate candidate = candidate(index, "pkg-a", "1.0", "pkg_a-1.0-py3-none-any.whl", true);
        CoreMetadata metadata = extract(new DistributionMetadataExtractor(), candidate);
        assertEquals(Collections.singletonList(RequirementParser.parse("pkg-b>=1.0")), metadata.getRequirements());
        assertEquals(2, index.getResourceRequests());
    }

    @Test
    public void testMismatchingWheel() throws Exception {
        Map<String, String> members = Collections.singletonMap("pkg_a-1.0.dist-info/METADATA", InMemoryPackageIndex.metadata("pkg-a", "1.1"));
        InMemoryPackageIndex index = new InMemoryPackageIndex("memory").addFile("pkg-a", "pkg_a-1.0-py3-none-any.whl", zip(members));
        Candidate candidate = candidate(index, "pkg-a", "1.0", "pkg_a-1.0-py3-none-any.whl", false);
        ExecutionException e = assertThrows(ExecutionException.class, () -> extract(new DistributionMetadataExtractor(), candidate));
        assertInstanceOf(MetadataUnavailableException.class, e.getCause());

        Candidate missing = candidate(index, "pkg-a", "2.0", "pkg_a-2.0-py3-none-any.whl", false);
        e = assertThrows(ExecutionException.class, () -> extract(new DistributionMetadataExtractor(), missing));
        assertInstanceOf(MetadataUnavailableException.class, e.getCause());
    }

    @Test
    public void testSourceDistributionPkgInfo() throws Exception {
        Map<String, String> members = new LinkedHashMap<>();
        members.put("pkg_b-2.0/PKG-INFO", "Metadata-Version: 2.2\nName: pkg-b\nVersion: 2.0\nRequires-Dist: pkg-c>=3\n");
        members.put("pkg_b-2.0/setup.py", "from setuptools import setup\nsetup()\n");
        InMemoryPackageIndex index = new InMemoryPackageIndex("memory").addFile("pkg-b", "pkg_b-2.0.tar.gz", tarGz(members));

        CoreMetadata metadata = extract(new DistributionMetadataExtractor(), candidate(index, "pkg-b", "2.0", "pkg_b-2.0.tar.gz", false));
        assertEquals(Collections.singletonList(RequirementParser.parse("pkg-c>=3")), metadata.getRequirements());
    }

    @Test
    public void testSourceDistributionEggInfo() throws Exception {
        Map<String, String> members = new LinkedHashMap<>();
        members.put("pkg_b-2.0/PKG-INFO", "Metadata-Version: 2.1\nName: pkg-b\nVersion: 2.0\nRequires-Python: >=3.7\n");
        members.put("pkg_b-2.0/pkg_b.egg-info/PKG-INFO", "Metadata-Version: 2.1\nName: pkg-b\nVersion: 2.0\n");
        members.put("pkg_b-2.0/pkg_b.egg-info/requires.txt", String.join("\n",
                "requests>=2.0",
                "",
                "[socks]",
                "PySocks>=1.5.6",
                "",
                "[:sys_platform == \"win32\"]",
                "colorama",
                "",
                "[test:python_version < \"3.10\"]",
                "tomli"));
        InMemoryPackageIndex index = new InMemoryPackageIndex("memory").addFile("pkg-b", "pkg_b-2.0.tar.gz", tarGz(members));

        CoreMetadata metadata = extract(new DistributionMetadataExtractor(), candidate(index, "pkg-b", "2.0", "pkg_b-2.0.tar.gz", false));
        List<Requirement> requirements = metadata.getRequirements();
        assertEquals(4, requirements.size());
        assertEquals(new LinkedHashSet<>(Arrays.asList("socks", "test")), metadata.getProvidesExtra());
        assertEquals(SpecifierSet.parse(">=3.7"), metadata.getRequiresPython());

        assertTrue(requirements.get(0).isApplicable(LINUX_38, (String) null));
        assertFalse(requirements.get(1).isApplicable(LINUX_38, (String) null));
        assertTrue(requirements.get(1).isApplicable(LINUX_38, "socks"));
        assertFalse(requirements.get(2).isApplicable(LINUX_38, (String) null));
        assertTrue(requirements.get(2).isApplicable(Environment.fromPythonVersionAndOs("3.8", "windows"), (String) null));
        assertTrue(requirements.get(3).isApplicable(LINUX_38, "test"));
        assertFalse(requirements.get(3).isApplicable(Environment.fromPythonVersionAndOs("3.11", "linux"), "test"));
    }

    @Test
    public void testSourceDistributionPyproject() throws Exception {
        Map<String, String> members = new LinkedHashMap<>();
        members.put("pkg_c-2.0/pyproject.toml", String.join("\n",
                "[build-system]",
                "requires = [\"hatchling\"]",
                "build-backend = \"hatchling.build\"",
                "",
                "[project]",
                "name = \"pkg-c\"",
                "version = \"2.0\"",
                "requires-python = \">=3.8\"",
                "dependencies = [\"requests>=2\", \"tomli; python_version < '3.11'\"]",
                "",
                "[project.optional-dependencies]",
                "cli = [\"click>=8\"]",
                ""));
        InMemoryPackageIndex index = new InMemoryPackageIndex("memory").addFile("pkg-c", "pkg_c-2.0.tar.gz", tarGz(members));

        CoreMetadata metadata = extract(new DistributionMetadataExtractor(), candidate(index, "pkg-c", "2.0", "pkg_c-2.0.tar.gz", false));
        assertEquals(3, metadata.getRequirements().size());
        assertEquals(Collections.singleton("cli"), metadata.getProvidesExtra());
        assertEquals(SpecifierSet.parse(">=3.8"), metadata.getRequiresPython());
        assertTrue(metadata.getRequirements().get(2).isApplicable(LINUX_38, "cli"));
        assertFalse(metadata.getRequirements().get(2).isApplicable(LINUX_38, (String) null));
    }

    @Test
    public void testSourceDistributionSetupCfg() throws Exception {
        Map<String, String> members = new LinkedHashMap<>();
        members.put("pkg_d-0.5/pyproject.toml", "[project]\nname = \"pkg-d\"\ndynamic = [\"version\", \"dependencies\"]\n");
        members.put("pkg_d-0.5/setup.cfg", String.join("\n",
                "[metadata]",
                "name = pkg-d",
                "",
                "[options]",
                "python_requires = >=3.6",
                "install_requires =",
                "    requests>=2.0",
                "    colorama; sys_platform == \"win32\"",
                "",
                "[options.extras_require]",
                "docs = sphinx>=5",
                ""));
        members.put("pkg_d-0.5/setup.py", "from setuptools import setup\nsetup()\n");
        InMemoryPackageIndex index = new InMemoryPackageIndex("memory").addFile("pkg-d", "pkg_d-0.5.tar.gz", tarGz(members));
        Candidate candidate = candidate(index, "pkg-d", "0.5", "pkg_d-0.5.tar.gz", false);

        CoreMetadata metadata = extract(new DistributionMetadataExtractor(new SetupCfgMetadataHook()), candidate);
        assertEquals(3, metadata.getRequirements().size());
        assertEquals(Collections.singleton("docs"), metadata.getProvidesExtra());
        assertEquals(SpecifierSet.parse(">=3.6"), metadata.getRequiresPython());

        ExecutionException e = assertThrows(ExecutionException.class, () -> extract(new DistributionMetadataExtractor(), candidate));
        assertInstanceOf(MetadataUnavailableException.class, e.getCause());
    }
}
