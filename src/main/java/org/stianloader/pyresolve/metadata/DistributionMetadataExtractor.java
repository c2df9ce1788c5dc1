package org.stianloader.pyresolve.metadata;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.stianloader.pyresolve.PackageNames;
import org.stianloader.pyresolve.PyResolveException;
import org.stianloader.pyresolve.internal.ConcurrencyUtil;
import org.stianloader.pyresolve.logging.LoggingAdapter;
import org.stianloader.pyresolve.marker.Marker;
import org.stianloader.pyresolve.marker.UnsupportedMarkerException;
import org.stianloader.pyresolve.repo.IndexUnavailableException;
import org.stianloader.pyresolve.requirement.MalformedRequirementException;
import org.stianloader.pyresolve.requirement.Requirement;
import org.stianloader.pyresolve.requirement.RequirementParser;
import org.stianloader.pyresolve.resolver.Candidate;
import org.stianloader.pyresolve.resolver.SourceKind;
import org.stianloader.pyresolve.version.InvalidVersionException;
import org.stianloader.pyresolve.version.PythonVersion;
import org.stianloader.pyresolve.version.SpecifierSet;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.dataformat.toml.TomlMapper;

/**
 * The default {@link MetadataExtractor}. Sources are tried in this order:
 *
 * <ol>
 * <li>The core metadata file served by the index next to the distribution (PEP 658).</li>
 * <li>For wheels, the <code>*.dist-info/METADATA</code> member.</li>
 * <li>For source distributions, the <code>PKG-INFO</code> file if its metadata version is at least 2.2 and
 * <code>Requires-Dist</code> is not dynamic.</li>
 * <li>The <code>*.egg-info/requires.txt</code> file written by setuptools.</li>
 * <li>The <code>[project]</code> table of <code>pyproject.toml</code>, if its dependencies are not dynamic.</li>
 * <li>The {@link BuildMetadataHook}, if one is installed.</li>
 * </ol>
 */
public class DistributionMetadataExtractor implements MetadataExtractor {

    @NotNull
    private static final TomlMapper TOML_MAPPER = new TomlMapper();

    /**
     * Parses the <code>requires.txt</code> format of setuptools. Requirements before the first section are
     * unconditional; sections are named <code>[extra]</code>, <code>[extra:marker]</code> or <code>[:marker]</code>.
     *
     * @param text The file contents
     * @param extras Receives the names of the extras that are declared
     * @return The requirements, with section conditions folded into their markers
     */
    @NotNull
    static List<@NotNull Requirement> parseRequiresTxt(@NotNull String text, @NotNull List<String> extras) {
        List<Requirement> requirements = new ArrayList<>();
        String extra = null;
        Marker sectionMarker = null;
        for (String line : text.split("\\r?\\n")) {
            String trimmed = line.trim();
            if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                continue;
            }
            if (trimmed.startsWith("[") && trimmed.endsWith("]")) {
                String section = trimmed.substring(1, trimmed.length() - 1).trim();
                int colon = section.indexOf(':');
                extra = colon == -1 ? section : section.substring(0, colon).trim();
                sectionMarker = colon == -1 ? null : Marker.parse(section.substring(colon + 1).trim());
                if (extra.isEmpty()) {
                    extra = null;
                } else {
                    extras.add(extra);
                }
                continue;
            }
            Requirement requirement = RequirementParser.parse(trimmed);
            if (sectionMarker != null) {
                requirement = requirement.withMarker(Marker.and(requirement.getMarker(), sectionMarker));
            }
            if (extra != null) {
                requirement = DistributionMetadataExtractor.withExtraMarker(requirement, extra);
            }
            requirements.add(requirement);
        }
        return requirements;
    }

    /**
     * Restricts a requirement to an extra by adding <code>extra == "name"</code> to its marker.
     *
     * @param requirement The requirement
     * @param extra The name of the extra
     * @return The restricted requirement
     */
    @NotNull
    static Requirement withExtraMarker(@NotNull Requirement requirement, @NotNull String extra) {
        Marker extraMarker = Marker.parse("extra == \"" + PackageNames.normalize(extra) + "\"");
        return requirement.withMarker(Marker.and(requirement.getMarker(), extraMarker));
    }

    @Nullable
    private final BuildMetadataHook buildHook;

    public DistributionMetadataExtractor() {
        this(null);
    }

    /**
     * Creates an extractor.
     *
     * @param buildHook The hook consulted for source distributions without static metadata, null to disable the fallback
     */
    public DistributionMetadataExtractor(@Nullable BuildMetadataHook buildHook) {
        this.buildHook = buildHook;
    }

    @Override
    @NotNull
    public CompletableFuture<CoreMetadata> extract(@NotNull Candidate candidate, @NotNull Executor executor) {
        Candidate base = candidate.getBase();
        String metadataUrl = base.getLink().getMetadataUrl();
        CompletableFuture<CoreMetadata> served;
        if (metadataUrl == null) {
            served = CompletableFuture.completedFuture(null);
        } else {
            CompletableFuture<byte[]> download = base.getIndex().getResource(metadataUrl, executor);
            served = ConcurrencyUtil.propagateCancellation(download.handle((bytes, ex) -> {
                if (ex != null) {
                    Throwable cause = ConcurrencyUtil.unwrap(ex);
                    if (cause instanceof IndexUnavailableException) {
                        throw (IndexUnavailableException) cause;
                    }
                    LoggingAdapter.getDefaultLogger().debug(DistributionMetadataExtractor.class, "Index-served metadata of {} is not available, falling back to the archive: {}", base.getFilename(), cause.toString());
                    return null;
                }
                try {
                    return DistributionMetadataExtractor.verify(base, CoreMetadata.parse(bytes));
                } catch (PyResolveException e) {
                    LoggingAdapter.getDefaultLogger().debug(DistributionMetadataExtractor.class, "Index-served metadata of {} is unusable, falling back to the archive", base.getFilename(), e);
                    return null;
                }
            }), download);
        }

        CompletableFuture<CoreMetadata> result = served.thenCompose((metadata) -> {
            if (metadata != null) {
                return CompletableFuture.completedFuture(metadata);
            }
            return this.extractFromArchive(base, executor);
        });
        return ConcurrencyUtil.propagateCancellation(result, served);
    }

    @NotNull
    private CompletableFuture<CoreMetadata> extractFromArchive(@NotNull Candidate candidate, @NotNull Executor executor) {
        CompletableFuture<byte[]> download = candidate.getIndex().getResource(candidate.getLink().getUrl(), executor);
        CompletableFuture<CoreMetadata> result = download.handleAsync((bytes, ex) -> {
            if (ex != null) {
                Throwable cause = ConcurrencyUtil.unwrap(ex);
                if (cause instanceof FileNotFoundException) {
                    throw new MetadataUnavailableException(candidate.getFilename(), "The distribution file does not exist", cause);
                }
                throw ConcurrencyUtil.rethrow(cause);
            }
            try {
                if (candidate.getKind() == SourceKind.WHEEL) {
                    return DistributionMetadataExtractor.verify(candidate, this.readWheel(candidate, bytes));
                }
                return DistributionMetadataExtractor.verify(candidate, this.readSourceDistribution(candidate, bytes));
            } catch (IOException e) {
                throw new MetadataUnavailableException(candidate.getFilename(), "The archive is unreadable", e);
            } catch (MalformedRequirementException | UnsupportedMarkerException | InvalidVersionException e) {
                throw new MetadataUnavailableException(candidate.getFilename(), "The metadata is malformed", e);
            }
        }, executor);
        return ConcurrencyUtil.propagateCancellation(result, download);
    }

    /**
     * Reads the <code>[project]</code> table of a <code>pyproject.toml</code> file.
     *
     * @param data The file contents
     * @return The declared dependencies, or null if there is no table or its dependencies are dynamic
     * @throws IOException If the file is not valid TOML
     * @throws MalformedRequirementException If a dependency cannot be parsed
     * @throws InvalidVersionException If the version or the python requirement cannot be parsed
     */
    @Nullable
    static DeclaredDependencies readPyprojectToml(byte @NotNull[] data) throws IOException {
        JsonNode project = DistributionMetadataExtractor.TOML_MAPPER.readTree(data).path("project");
        if (!project.isObject()) {
            return null;
        }
        for (JsonNode dynamic : project.path("dynamic")) {
            String field = dynamic.asText().toLowerCase(Locale.ROOT);
            if (field.equals("dependencies") || field.equals("optional-dependencies")) {
                return null;
            }
        }
        List<Requirement> requirements = new ArrayList<>();
        for (JsonNode dependency : project.path("dependencies")) {
            requirements.add(RequirementParser.parse(dependency.asText()));
        }
        List<String> extras = new ArrayList<>();
        for (Iterator<Map.Entry<String, JsonNode>> it = project.path("optional-dependencies").fields(); it.hasNext();) {
            Map.Entry<String, JsonNode> extra = it.next();
            extras.add(extra.getKey());
            for (JsonNode dependency : extra.getValue()) {
                requirements.add(DistributionMetadataExtractor.withExtraMarker(RequirementParser.parse(dependency.asText()), extra.getKey()));
            }
        }
        SpecifierSet requiresPython = null;
        JsonNode requiresPythonNode = project.get("requires-python");
        if (requiresPythonNode != null && requiresPythonNode.isTextual()) {
            requiresPython = SpecifierSet.parse(requiresPythonNode.asText());
        }
        JsonNode nameNode = project.get("name");
        String name = nameNode != null && nameNode.isTextual() ? nameNode.asText() : null;
        // A version listed as dynamic is absent here
        PythonVersion version = project.has("version") ? PythonVersion.parse(project.path("version").asText()) : null;
        return new DeclaredDependencies("pyproject.toml", name, version, requirements, extras, requiresPython);
    }

    @NotNull
    private CoreMetadata readSourceDistribution(@NotNull Candidate candidate, byte @NotNull[] data) throws IOException {
        Map<String, byte[]> members = DistributionArchive.read(candidate.getFilename(), data, (path) -> {
            int depth = DistributionArchive.depth(path);
            if (depth <= 1) {
                return path.endsWith("PKG-INFO") || path.endsWith("pyproject.toml") || path.endsWith("setup.cfg") || path.endsWith("setup.py");
            }
            return depth <= 3 && path.contains(".egg-info/") && (path.endsWith("/requires.txt") || path.endsWith("/PKG-INFO"));
        });

        Map<String, byte[]> projectFiles = new LinkedHashMap<>();
        String eggInfo = null;
        byte[] requiresTxt = null;
        for (Map.Entry<String, byte[]> member : members.entrySet()) {
            String path = member.getKey();
            if (path.contains(".egg-info/")) {
                String directory = path.substring(0, path.lastIndexOf('/'));
                if (eggInfo == null || DistributionArchive.depth(directory) < DistributionArchive.depth(eggInfo)) {
                    eggInfo = directory;
                    requiresTxt = null;
                }
                if (directory.equals(eggInfo) && path.endsWith("/requires.txt")) {
                    requiresTxt = member.getValue();
                }
            } else {
                projectFiles.putIfAbsent(path.substring(path.indexOf('/') + 1), member.getValue());
            }
        }

        CoreMetadata pkgInfo = null;
        byte[] pkgInfoData = projectFiles.get("PKG-INFO");
        if (pkgInfoData != null) {
            try {
                pkgInfo = CoreMetadata.parse(pkgInfoData);
            } catch (PyResolveException e) {
                LoggingAdapter.getDefaultLogger().debug(DistributionMetadataExtractor.class, "Ignoring unusable PKG-INFO of {}", candidate.getFilename(), e);
            }
        }
        if (pkgInfo != null && pkgInfo.isMetadataVersionAtLeast("2.2") && !pkgInfo.getDynamic().contains("requires-dist")) {
            return pkgInfo;
        }

        if (eggInfo != null) {
            List<String> extras = new ArrayList<>();
            List<Requirement> requirements = requiresTxt == null
                    ? new ArrayList<>()
                    : DistributionMetadataExtractor.parseRequiresTxt(new String(requiresTxt, StandardCharsets.UTF_8), extras);
            String name = pkgInfo == null ? candidate.getName() : pkgInfo.getName();
            PythonVersion version = pkgInfo == null ? candidate.getVersion() : pkgInfo.getVersion();
            SpecifierSet requiresPython = pkgInfo == null ? null : pkgInfo.getRequiresPython();
            return new CoreMetadata("2.1", name, version, requirements, extras, requiresPython);
        }

        byte[] pyproject = projectFiles.get("pyproject.toml");
        if (pyproject != null) {
            DeclaredDependencies declared = DistributionMetadataExtractor.readPyprojectToml(pyproject);
            if (declared != null) {
                return declared.toCoreMetadata(candidate.getName(), candidate.getVersion());
            }
        }

        if (this.buildHook != null) {
            CoreMetadata metadata = this.buildHook.buildMetadata(candidate, projectFiles);
            if (metadata != null) {
                return metadata;
            }
        }

        throw new MetadataUnavailableException(candidate.getFilename(), "The source distribution does not declare its dependencies statically");
    }

    @NotNull
    private CoreMetadata readWheel(@NotNull Candidate candidate, byte @NotNull[] data) throws IOException {
        Map<String, byte[]> members = DistributionArchive.read(candidate.getFilename(), data,
                (path) -> DistributionArchive.depth(path) == 1 && path.endsWith(".dist-info/METADATA"));
        byte[] metadata = null;
        for (Map.Entry<String, byte[]> member : members.entrySet()) {
            String directory = member.getKey().substring(0, member.getKey().indexOf('/'));
            String distName = directory.substring(0, directory.length() - ".dist-info".length());
            int dash = distName.indexOf('-');
            if (dash != -1) {
                distName = distName.substring(0, dash);
            }
            if (metadata == null || PackageNames.normalize(distName).equals(candidate.getName())) {
                metadata = member.getValue();
            }
        }
        if (metadata == null) {
            throw new MetadataUnavailableException(candidate.getFilename(), "The wheel lacks a .dist-info/METADATA file");
        }
        return CoreMetadata.parse(metadata);
    }

    @NotNull
    private static CoreMetadata verify(@NotNull Candidate candidate, @NotNull CoreMetadata metadata) {
        if (!PackageNames.normalize(metadata.getName()).equals(candidate.getName())) {
            throw new MetadataUnavailableException(candidate.getFilename(), "The metadata names the project '" + metadata.getName() + "'");
        }
        if (!metadata.getVersion().equals(candidate.getVersion())) {
            throw new MetadataUnavailableException(candidate.getFilename(), "The metadata names the version " + metadata.getVersion());
        }
        return metadata;
    }
}
