package org.stianloader.pyresolve.metadata;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.stianloader.pyresolve.PackageNames;
import org.stianloader.pyresolve.marker.UnsupportedMarkerException;
import org.stianloader.pyresolve.requirement.MalformedRequirementException;
import org.stianloader.pyresolve.requirement.Requirement;
import org.stianloader.pyresolve.requirement.RequirementParser;
import org.stianloader.pyresolve.version.InvalidVersionException;
import org.stianloader.pyresolve.version.PythonVersion;
import org.stianloader.pyresolve.version.SpecifierSet;

/**
 * The core metadata of a distribution, as found in the <code>METADATA</code> file of wheels and the
 * <code>PKG-INFO</code> file of source distributions.
 */
public final class CoreMetadata {

    /**
     * Parses a core metadata document. The format is that of RFC 822 email headers: <code>Key: value</code> lines,
     * where lines starting with whitespace continue the previous value. The first empty line ends the headers;
     * everything after it is the description body.
     *
     * @param bytes The document, UTF-8 encoded
     * @return The parsed metadata
     * @throws MetadataUnavailableException If the name or version header is missing, the version is invalid or
     * a Requires-Dist header cannot be parsed
     */
    @NotNull
    public static CoreMetadata parse(byte @NotNull[] bytes) {
        return CoreMetadata.parse(new String(bytes, StandardCharsets.UTF_8));
    }

    @NotNull
    public static CoreMetadata parse(@NotNull String text) {
        Map<String, List<String>> headers = new LinkedHashMap<>();
        String[] lines = text.split("\\r?\\n", -1);
        String lastKey = null;
        int i = 0;
        for (; i < lines.length; i++) {
            String line = lines[i];
            if (line.isEmpty()) {
                i++;
                break;
            }
            if ((line.charAt(0) == ' ' || line.charAt(0) == '\t') && lastKey != null) {
                List<String> values = headers.get(lastKey);
                int last = values.size() - 1;
                values.set(last, values.get(last) + "\n" + line.trim());
                continue;
            }
            int colon = line.indexOf(':');
            if (colon <= 0) {
                // Not a header line, treat as the start of the body
                break;
            }
            lastKey = line.substring(0, colon).trim().toLowerCase(Locale.ROOT);
            headers.computeIfAbsent(lastKey, (key) -> new ArrayList<>()).add(line.substring(colon + 1).trim());
        }
        StringBuilder body = new StringBuilder();
        for (; i < lines.length; i++) {
            if (body.length() != 0) {
                body.append('\n');
            }
            body.append(lines[i]);
        }

        String name = CoreMetadata.first(headers, "name");
        String version = CoreMetadata.first(headers, "version");
        if (name == null || name.isEmpty() || version == null || version.isEmpty()) {
            throw new MetadataUnavailableException(name == null ? "<unknown>" : name, "Core metadata lacks the Name or Version header");
        }
        PythonVersion parsedVersion;
        try {
            parsedVersion = PythonVersion.parse(version);
        } catch (InvalidVersionException e) {
            throw new MetadataUnavailableException(name, "Invalid version '" + version + "' in core metadata", e);
        }

        List<Requirement> requirements = new ArrayList<>();
        for (String requiresDist : headers.getOrDefault("requires-dist", Collections.emptyList())) {
            try {
                requirements.add(RequirementParser.parse(requiresDist));
            } catch (MalformedRequirementException | UnsupportedMarkerException e) {
                throw new MetadataUnavailableException(name + " " + version, "Unparseable Requires-Dist '" + requiresDist + "'", e);
            }
        }

        SpecifierSet requiresPython = null;
        String requiresPythonText = CoreMetadata.first(headers, "requires-python");
        if (requiresPythonText != null && !requiresPythonText.isEmpty()) {
            try {
                requiresPython = SpecifierSet.parse(requiresPythonText);
            } catch (InvalidVersionException e) {
                requiresPython = null;
            }
        }

        String metadataVersion = CoreMetadata.first(headers, "metadata-version");
        return new CoreMetadata(metadataVersion == null ? "1.0" : metadataVersion, name, parsedVersion, requirements,
                headers.getOrDefault("provides-extra", Collections.emptyList()), requiresPython,
                headers.getOrDefault("dynamic", Collections.emptyList()), headers, body.toString().trim());
    }

    @Nullable
    private static String first(@NotNull Map<String, List<String>> headers, @NotNull String key) {
        List<String> values = headers.get(key);
        if (values == null || values.isEmpty()) {
            return null;
        }
        return values.get(0);
    }

    @NotNull
    private final String metadataVersion;
    @NotNull
    private final String name;
    @NotNull
    private final PythonVersion version;
    @NotNull
    private final List<@NotNull Requirement> requirements;
    @NotNull
    private final Set<@NotNull String> providesExtra;
    @Nullable
    private final SpecifierSet requiresPython;
    @NotNull
    private final Set<@NotNull String> dynamic;
    @NotNull
    private final Map<@NotNull String, @NotNull List<@NotNull String>> headers;
    @NotNull
    private final String description;

    public CoreMetadata(@NotNull String metadataVersion, @NotNull String name, @NotNull PythonVersion version, @NotNull List<@NotNull Requirement> requirements,
            @NotNull Collection<@NotNull String> providesExtra, @Nullable SpecifierSet requiresPython) {
        this(metadataVersion, name, version, requirements, providesExtra, requiresPython, Collections.emptyList(), Collections.emptyMap(), "");
    }

    private CoreMetadata(@NotNull String metadataVersion, @NotNull String name, @NotNull PythonVersion version, @NotNull List<@NotNull Requirement> requirements,
            @NotNull Collection<@NotNull String> providesExtra, @Nullable SpecifierSet requiresPython, @NotNull Collection<@NotNull String> dynamic,
            @NotNull Map<String, List<String>> headers, @NotNull String description) {
        this.metadataVersion = metadataVersion;
        this.name = name;
        this.version = version;
        this.requirements = Collections.unmodifiableList(new ArrayList<>(requirements));
        Set<String> extras = new LinkedHashSet<>();
        for (String extra : providesExtra) {
            extras.add(PackageNames.normalize(extra));
        }
        this.providesExtra = Collections.unmodifiableSet(extras);
        this.requiresPython = requiresPython;
        Set<String> dynamicFields = new LinkedHashSet<>();
        for (String field : dynamic) {
            dynamicFields.add(field.trim().toLowerCase(Locale.ROOT));
        }
        this.dynamic = Collections.unmodifiableSet(dynamicFields);
        this.headers = Collections.unmodifiableMap(headers);
        this.description = description;
    }

    @NotNull
    @Contract(pure = true)
    public String getDescription() {
        return this.description;
    }

    /**
     * Obtains the fields that the source distribution marks as dynamic, lowercased. Dynamic fields of a
     * <code>PKG-INFO</code> may differ in the built wheel.
     *
     * @return The dynamic fields
     */
    @NotNull
    @Contract(pure = true)
    public Set<@NotNull String> getDynamic() {
        return this.dynamic;
    }

    /**
     * Obtains all values of a header.
     *
     * @param key The case-insensitive header name
     * @return The values in document order, empty if the header is absent
     */
    @NotNull
    @Contract(pure = true)
    public List<@NotNull String> getHeader(@NotNull String key) {
        List<String> values = this.headers.get(key.toLowerCase(Locale.ROOT));
        return values == null ? Collections.emptyList() : Collections.unmodifiableList(values);
    }

    @Nullable
    @Contract(pure = true)
    public String getHomePage() {
        return CoreMetadata.first(this.headers, "home-page");
    }

    @Nullable
    @Contract(pure = true)
    public String getLicense() {
        return CoreMetadata.first(this.headers, "license");
    }

    @NotNull
    @Contract(pure = true)
    public String getMetadataVersion() {
        return this.metadataVersion;
    }

    /**
     * Obtains the project name as written in the metadata, not normalized.
     *
     * @return The project name
     */
    @NotNull
    @Contract(pure = true)
    public String getName() {
        return this.name;
    }

    @NotNull
    @Contract(pure = true)
    public Set<@NotNull String> getProvidesExtra() {
        return this.providesExtra;
    }

    /**
     * Obtains the dependencies declared through <code>Requires-Dist</code>, in declaration order.
     * Markers are not evaluated.
     *
     * @return The requirements
     */
    @NotNull
    @Contract(pure = true)
    public List<@NotNull Requirement> getRequirements() {
        return this.requirements;
    }

    @Nullable
    @Contract(pure = true)
    public SpecifierSet getRequiresPython() {
        return this.requiresPython;
    }

    @Nullable
    @Contract(pure = true)
    public String getSummary() {
        return CoreMetadata.first(this.headers, "summary");
    }

    @NotNull
    @Contract(pure = true)
    public PythonVersion getVersion() {
        return this.version;
    }

    /**
     * Checks whether the metadata version is at least the given version. Source distribution metadata
     * is only reliable from metadata version 2.2 onwards.
     *
     * @param minimum The minimum metadata version, e.g. "2.2"
     * @return True if the declared metadata version is at least the minimum
     */
    @Contract(pure = true)
    public boolean isMetadataVersionAtLeast(@NotNull String minimum) {
        PythonVersion declared = PythonVersion.tryParse(this.metadataVersion);
        return declared != null && declared.compareTo(PythonVersion.parse(minimum)) >= 0;
    }

    @Override
    public String toString() {
        return "CoreMetadata[" + this.name + " " + this.version + ", requires=" + this.requirements + "]";
    }
}
