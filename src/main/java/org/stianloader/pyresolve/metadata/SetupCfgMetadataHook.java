package org.stianloader.pyresolve.metadata;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.stianloader.pyresolve.logging.LoggingAdapter;
import org.stianloader.pyresolve.requirement.MalformedRequirementException;
import org.stianloader.pyresolve.requirement.Requirement;
import org.stianloader.pyresolve.requirement.RequirementParser;
import org.stianloader.pyresolve.resolver.Candidate;
import org.stianloader.pyresolve.version.InvalidVersionException;
import org.stianloader.pyresolve.version.SpecifierSet;

/**
 * A {@link BuildMetadataHook} reading the declarative configuration of setuptools from <code>setup.cfg</code>:
 * <code>[options] install_requires</code> and <code>python_requires</code>, as well as
 * <code>[options.extras_require]</code>. Values that point elsewhere (<code>file:</code> or <code>attr:</code>)
 * cannot be interpreted statically and make this hook give up.
 */
public class SetupCfgMetadataHook implements BuildMetadataHook {

    @NotNull
    static Map<String, Map<String, String>> parseIni(@NotNull String text) {
        Map<String, Map<String, String>> sections = new LinkedHashMap<>();
        Map<String, String> section = null;
        String lastKey = null;
        for (String line : text.split("\\r?\\n")) {
            String trimmed = line.trim();
            if (trimmed.isEmpty() || trimmed.startsWith("#") || trimmed.startsWith(";")) {
                continue;
            }
            if (Character.isWhitespace(line.charAt(0)) && section != null && lastKey != null) {
                section.merge(lastKey, trimmed, (a, b) -> a.isEmpty() ? b : a + "\n" + b);
                continue;
            }
            if (trimmed.startsWith("[") && trimmed.endsWith("]")) {
                section = sections.computeIfAbsent(trimmed.substring(1, trimmed.length() - 1).trim().toLowerCase(Locale.ROOT), (key) -> new LinkedHashMap<>());
                lastKey = null;
                continue;
            }
            int separator = SetupCfgMetadataHook.separatorIndex(trimmed);
            if (section == null || separator <= 0) {
                continue;
            }
            lastKey = trimmed.substring(0, separator).trim().toLowerCase(Locale.ROOT).replace('-', '_');
            section.put(lastKey, trimmed.substring(separator + 1).trim());
        }
        return sections;
    }

    private static int separatorIndex(@NotNull String line) {
        int equals = line.indexOf('=');
        int colon = line.indexOf(':');
        if (equals == -1) {
            return colon;
        } else if (colon == -1) {
            return equals;
        }
        return Math.min(equals, colon);
    }

    @Nullable
    private static List<Requirement> parseRequirementList(@NotNull String value, @NotNull String source) {
        String trimmed = value.trim();
        if (trimmed.startsWith("file:") || trimmed.startsWith("attr:")) {
            return null;
        }
        List<Requirement> requirements = new ArrayList<>();
        for (String line : trimmed.split("\n")) {
            String entry = line.trim();
            int comment = entry.indexOf(" #");
            if (comment != -1) {
                entry = entry.substring(0, comment).trim();
            }
            if (entry.isEmpty() || entry.startsWith("#")) {
                continue;
            }
            try {
                requirements.add(RequirementParser.parse(entry));
            } catch (MalformedRequirementException e) {
                LoggingAdapter.getDefaultLogger().debug(SetupCfgMetadataHook.class, "Unparseable requirement '{}' in {}", entry, source, e);
                return null;
            }
        }
        return requirements;
    }

    /**
     * Reads the dependencies declared by a <code>setup.cfg</code> file.
     *
     * @param text The file contents
     * @param source Names the file in log messages
     * @return The declared dependencies, or null if the file does not declare them statically
     */
    @Nullable
    static DeclaredDependencies readSetupCfg(@NotNull String text, @NotNull String source) {
        Map<String, Map<String, String>> ini = SetupCfgMetadataHook.parseIni(text);
        Map<String, String> options = ini.get("options");
        if (options == null || !options.containsKey("install_requires") && !ini.containsKey("options.extras_require")) {
            return null;
        }

        List<Requirement> requirements = new ArrayList<>();
        String installRequires = options.get("install_requires");
        if (installRequires != null) {
            List<Requirement> parsed = SetupCfgMetadataHook.parseRequirementList(installRequires, source);
            if (parsed == null) {
                return null;
            }
            requirements.addAll(parsed);
        }

        List<String> extras = new ArrayList<>();
        Map<String, String> extrasRequire = ini.get("options.extras_require");
        if (extrasRequire != null) {
            for (Map.Entry<String, String> extra : extrasRequire.entrySet()) {
                List<Requirement> parsed = SetupCfgMetadataHook.parseRequirementList(extra.getValue(), source);
                if (parsed == null) {
                    return null;
                }
                extras.add(extra.getKey());
                for (Requirement requirement : parsed) {
                    requirements.add(DistributionMetadataExtractor.withExtraMarker(requirement, extra.getKey()));
                }
            }
        }

        SpecifierSet requiresPython = null;
        String pythonRequires = options.get("python_requires");
        if (pythonRequires != null && !pythonRequires.isEmpty()) {
            try {
                requiresPython = SpecifierSet.parse(pythonRequires);
            } catch (InvalidVersionException e) {
                LoggingAdapter.getDefaultLogger().debug(SetupCfgMetadataHook.class, "Ignoring unparseable python_requires '{}' in {}", pythonRequires, source);
            }
        }

        Map<String, String> metadata = ini.get("metadata");
        String name = metadata == null ? null : metadata.get("name");
        if (name != null && (name.isEmpty() || name.startsWith("attr:") || name.startsWith("file:"))) {
            name = null;
        }
        return new DeclaredDependencies("setup.cfg", name, null, requirements, extras, requiresPython);
    }

    @Override
    @Nullable
    public CoreMetadata buildMetadata(@NotNull Candidate candidate, @NotNull Map<@NotNull String, byte @NotNull[]> projectFiles) {
        byte[] setupCfg = projectFiles.get("setup.cfg");
        if (setupCfg == null) {
            return null;
        }
        DeclaredDependencies declared = SetupCfgMetadataHook.readSetupCfg(new String(setupCfg, StandardCharsets.UTF_8), candidate.getFilename());
        if (declared == null) {
            return null;
        }
        // The file name is authoritative for the name and version of a distribution
        return new CoreMetadata("2.1", candidate.getName(), candidate.getVersion(), declared.getRequirements(), declared.getExtras(), declared.getRequiresPython());
    }
}
