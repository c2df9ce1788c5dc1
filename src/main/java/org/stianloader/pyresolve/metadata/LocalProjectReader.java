package org.stianloader.pyresolve.metadata;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.stianloader.pyresolve.logging.LoggingAdapter;
import org.stianloader.pyresolve.requirement.MalformedRequirementException;
import org.stianloader.pyresolve.requirement.Requirement;
import org.stianloader.pyresolve.requirement.RequirementParser;
import org.stianloader.pyresolve.version.InvalidVersionException;
import org.stianloader.pyresolve.version.SpecifierSet;

/**
 * Reads the dependencies that a project checkout declares, without building or running it. The files are consulted
 * in this order, the first one that declares the dependencies statically wins:
 *
 * <ol>
 * <li>The <code>[project]</code> table of <code>pyproject.toml</code>.</li>
 * <li>The <code>[options]</code> section of <code>setup.cfg</code>.</li>
 * <li>The <code>setup()</code> call of <code>setup.py</code>, provided that <code>install_requires</code> and
 * <code>extras_require</code> are literal lists of strings.</li>
 * </ol>
 */
public final class LocalProjectReader {

    @NotNull
    private static final Pattern SETUP_PY_STRING_ARGUMENT = Pattern.compile("\\b(name|python_requires)\\s*=\\s*(['\"])([^'\"\\n]*)\\2");
    @NotNull
    private static final Pattern SETUP_PY_INSTALL_REQUIRES = Pattern.compile("\\binstall_requires\\s*=\\s*");
    @NotNull
    private static final Pattern SETUP_PY_EXTRAS_REQUIRE = Pattern.compile("\\bextras_require\\s*=\\s*");

    /**
     * Reads the declared dependencies of a project directory.
     *
     * @param projectDirectory The directory holding the build configuration of the project
     * @return The declared dependencies
     * @throws MetadataUnavailableException If the directory cannot be read or no file declares the dependencies statically
     * @throws MalformedRequirementException If a declared dependency cannot be parsed
     */
    @NotNull
    public static DeclaredDependencies read(@NotNull Path projectDirectory) {
        String project = projectDirectory.toString();
        try {
            Path pyproject = projectDirectory.resolve("pyproject.toml");
            if (Files.isRegularFile(pyproject)) {
                DeclaredDependencies declared = DistributionMetadataExtractor.readPyprojectToml(Files.readAllBytes(pyproject));
                if (declared != null) {
                    return declared;
                }
                LoggingAdapter.getDefaultLogger().debug(LocalProjectReader.class, "{} does not declare the dependencies of {} statically", pyproject, project);
            }

            Path setupCfg = projectDirectory.resolve("setup.cfg");
            if (Files.isRegularFile(setupCfg)) {
                DeclaredDependencies declared = SetupCfgMetadataHook.readSetupCfg(new String(Files.readAllBytes(setupCfg), StandardCharsets.UTF_8), setupCfg.toString());
                if (declared != null) {
                    return declared;
                }
                LoggingAdapter.getDefaultLogger().debug(LocalProjectReader.class, "{} does not declare the dependencies of {} statically", setupCfg, project);
            }

            Path setupPy = projectDirectory.resolve("setup.py");
            if (Files.isRegularFile(setupPy)) {
                DeclaredDependencies declared = LocalProjectReader.readSetupPy(new String(Files.readAllBytes(setupPy), StandardCharsets.UTF_8));
                if (declared != null) {
                    return declared;
                }
                LoggingAdapter.getDefaultLogger().debug(LocalProjectReader.class, "{} does not declare the dependencies of {} statically", setupPy, project);
            }
        } catch (IOException e) {
            throw new MetadataUnavailableException(project, "The project files are unreadable", e);
        } catch (InvalidVersionException e) {
            throw new MetadataUnavailableException(project, "The project files are malformed", e);
        }
        throw new MetadataUnavailableException(project, "The project does not declare its dependencies statically");
    }

    /**
     * Reads a python list of string literals, starting at the opening bracket.
     *
     * @param text The source code
     * @param start The index of the opening bracket
     * @param values Receives the string values
     * @return The index after the closing bracket, or -1 if the list is not a literal list of strings
     */
    private static int readStringList(@NotNull String text, int start, @NotNull List<String> values) {
        if (start >= text.length() || (text.charAt(start) != '[' && text.charAt(start) != '(')) {
            return -1;
        }
        char close = text.charAt(start) == '[' ? ']' : ')';
        int i = start + 1;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c == close) {
                return i + 1;
            } else if (Character.isWhitespace(c) || c == ',') {
                i++;
            } else if (c == '#') {
                while (i < text.length() && text.charAt(i) != '\n') {
                    i++;
                }
            } else if (c == '\'' || c == '"') {
                int end = text.indexOf(c, i + 1);
                if (end == -1 || text.substring(i + 1, end).indexOf('\n') != -1) {
                    return -1;
                }
                values.add(text.substring(i + 1, end));
                i = end + 1;
            } else {
                // A variable, a call or a comprehension
                return -1;
            }
        }
        return -1;
    }

    @Nullable
    static DeclaredDependencies readSetupPy(@NotNull String text) {
        List<Requirement> requirements = new ArrayList<>();
        List<String> extras = new ArrayList<>();
        boolean declared = false;

        Matcher installRequires = LocalProjectReader.SETUP_PY_INSTALL_REQUIRES.matcher(text);
        if (installRequires.find()) {
            List<String> values = new ArrayList<>();
            if (LocalProjectReader.readStringList(text, installRequires.end(), values) == -1) {
                return null;
            }
            for (String value : values) {
                requirements.add(RequirementParser.parse(value));
            }
            declared = true;
        }

        Matcher extrasRequire = LocalProjectReader.SETUP_PY_EXTRAS_REQUIRE.matcher(text);
        if (extrasRequire.find()) {
            int i = extrasRequire.end();
            if (i >= text.length() || text.charAt(i) != '{') {
                return null;
            }
            i++;
            while (true) {
                while (i < text.length() && (Character.isWhitespace(text.charAt(i)) || text.charAt(i) == ',')) {
                    i++;
                }
                if (i >= text.length()) {
                    return null;
                } else if (text.charAt(i) == '}') {
                    break;
                }
                char quote = text.charAt(i);
                int end = quote == '\'' || quote == '"' ? text.indexOf(quote, i + 1) : -1;
                if (end == -1) {
                    return null;
                }
                String extra = text.substring(i + 1, end);
                i = end + 1;
                while (i < text.length() && Character.isWhitespace(text.charAt(i))) {
                    i++;
                }
                if (i >= text.length() || text.charAt(i) != ':') {
                    return null;
                }
                i++;
                while (i < text.length() && Character.isWhitespace(text.charAt(i))) {
                    i++;
                }
                List<String> values = new ArrayList<>();
                i = LocalProjectReader.readStringList(text, i, values);
                if (i == -1) {
                    return null;
                }
                extras.add(extra);
                for (String value : values) {
                    requirements.add(DistributionMetadataExtractor.withExtraMarker(RequirementParser.parse(value), extra));
                }
            }
            declared = true;
        }

        if (!declared) {
            return null;
        }

        String name = null;
        SpecifierSet requiresPython = null;
        Matcher arguments = LocalProjectReader.SETUP_PY_STRING_ARGUMENT.matcher(text);
        while (arguments.find()) {
            if (arguments.group(1).equals("name") && name == null) {
                name = arguments.group(3);
            } else if (arguments.group(1).equals("python_requires") && requiresPython == null && !arguments.group(3).isEmpty()) {
                requiresPython = SpecifierSet.parse(arguments.group(3));
            }
        }
        return new DeclaredDependencies("setup.py", name, null, requirements, extras, requiresPython);
    }

    private LocalProjectReader() {
        throw new UnsupportedOperationException();
    }
}
