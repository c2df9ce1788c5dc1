package org.stianloader.pyresolve.requirement;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.stianloader.pyresolve.logging.LoggingAdapter;

/**
 * Reads pip style requirements files.
 *
 * <p>Supported are comments, line continuations, nested requirement files (<code>-r</code>),
 * constraint files (<code>-c</code>) and the <code>--index-url</code> and <code>--extra-index-url</code> options.
 * Editable installs and other installer options are skipped with a warning. Per-requirement options such as
 * <code>--hash</code> are ignored.
 */
public class RequirementsFileReader {

    private static final class State {
        @NotNull
        final List<Requirement> requirements = new ArrayList<>();
        @NotNull
        final List<Requirement> constraints = new ArrayList<>();
        @Nullable
        String indexUrl;
        @NotNull
        final List<String> extraIndexUrls = new ArrayList<>();
        @NotNull
        final Set<Path> visiting = new HashSet<>();
    }

    @NotNull
    private static List<String> logicalLines(@NotNull String content) {
        List<String> lines = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        for (String physical : content.split("\\r?\\n", -1)) {
            String stripped = RequirementsFileReader.stripComment(physical);
            if (stripped.endsWith("\\")) {
                current.append(stripped, 0, stripped.length() - 1).append(' ');
                continue;
            }
            current.append(stripped);
            String line = current.toString().trim();
            current.setLength(0);
            if (!line.isEmpty()) {
                lines.add(line);
            }
        }
        if (current.length() != 0 && !current.toString().trim().isEmpty()) {
            lines.add(current.toString().trim());
        }
        return lines;
    }

    @NotNull
    private static String stripComment(@NotNull String line) {
        for (int i = 0; i < line.length(); i++) {
            if (line.charAt(i) == '#' && (i == 0 || Character.isWhitespace(line.charAt(i - 1)))) {
                return line.substring(0, i);
            }
        }
        return line;
    }

    @NotNull
    private static String stripRequirementOptions(@NotNull String line) {
        int idx = line.indexOf(" --");
        if (idx == -1) {
            return line;
        }
        return line.substring(0, idx).trim();
    }

    @NotNull
    private static String optionValue(@NotNull String line, @NotNull String option) {
        String value = line.substring(option.length());
        if (value.startsWith("=")) {
            value = value.substring(1);
        }
        value = value.trim();
        if (value.isEmpty()) {
            throw new MalformedRequirementException(line, line, "Option " + option + " requires a value");
        }
        return value;
    }

    @Nullable
    private static String matchOption(@NotNull String line, @NotNull String... options) {
        for (String option : options) {
            if (line.equals(option) || line.startsWith(option + " ") || line.startsWith(option + "=") || line.startsWith(option + "\t")) {
                return option;
            }
        }
        return null;
    }

    /**
     * Parses requirements from a string. Relative <code>-r</code> and <code>-c</code> includes are resolved against
     * the given directory; if it is null, includes are rejected.
     *
     * @param content The file contents
     * @param baseDirectory The directory relative to which includes are resolved
     * @return The parsed document
     * @throws IOException If an included file cannot be read
     * @throws MalformedRequirementException If a requirement line is malformed
     */
    @NotNull
    public RequirementsDocument parse(@NotNull String content, @Nullable Path baseDirectory) throws IOException {
        State state = new State();
        this.parseInto(state, content, baseDirectory, false, "<string>");
        return new RequirementsDocument(state.requirements, state.constraints, state.indexUrl, state.extraIndexUrls);
    }

    private void parseInto(@NotNull State state, @NotNull String content, @Nullable Path baseDirectory, boolean constraint, @NotNull String source) throws IOException {
        for (String line : RequirementsFileReader.logicalLines(content)) {
            String option;
            if ((option = RequirementsFileReader.matchOption(line, "-r", "--requirement")) != null) {
                this.include(state, baseDirectory, RequirementsFileReader.optionValue(line, option), constraint, line);
            } else if ((option = RequirementsFileReader.matchOption(line, "-c", "--constraint")) != null) {
                this.include(state, baseDirectory, RequirementsFileReader.optionValue(line, option), true, line);
            } else if ((option = RequirementsFileReader.matchOption(line, "-i", "--index-url")) != null) {
                state.indexUrl = RequirementsFileReader.optionValue(line, option);
            } else if ((option = RequirementsFileReader.matchOption(line, "--extra-index-url")) != null) {
                state.extraIndexUrls.add(RequirementsFileReader.optionValue(line, option));
            } else if ((option = RequirementsFileReader.matchOption(line, "-e", "--editable")) != null) {
                LoggingAdapter.getDefaultLogger().warn(RequirementsFileReader.class, "Skipping editable requirement '{}' in {}", line, source);
            } else if (line.startsWith("-")) {
                LoggingAdapter.getDefaultLogger().warn(RequirementsFileReader.class, "Skipping unsupported option '{}' in {}", line, source);
            } else {
                Requirement requirement = RequirementParser.parse(RequirementsFileReader.stripRequirementOptions(line));
                if (constraint) {
                    state.constraints.add(requirement);
                } else {
                    state.requirements.add(requirement);
                }
            }
        }
    }

    private void include(@NotNull State state, @Nullable Path baseDirectory, @NotNull String target, boolean constraint, @NotNull String line) throws IOException {
        if (baseDirectory == null) {
            throw new MalformedRequirementException(line, target, "Cannot resolve include without a base directory");
        }
        this.read(state, baseDirectory.resolve(target), constraint);
    }

    /**
     * Reads a requirements file and all files it includes.
     *
     * @param file The file to read
     * @return The parsed document
     * @throws IOException If the file or an included file cannot be read
     * @throws MalformedRequirementException If a requirement line is malformed or the includes are cyclic
     */
    @NotNull
    public RequirementsDocument read(@NotNull Path file) throws IOException {
        State state = new State();
        this.read(state, file, false);
        return new RequirementsDocument(state.requirements, state.constraints, state.indexUrl, state.extraIndexUrls);
    }

    private void read(@NotNull State state, @NotNull Path file, boolean constraint) throws IOException {
        Path normalized = file.toAbsolutePath().normalize();
        if (!state.visiting.add(normalized)) {
            throw new MalformedRequirementException(normalized.toString(), normalized.toString(), "Cyclic requirements file include");
        }
        String content = new String(Files.readAllBytes(normalized), StandardCharsets.UTF_8);
        this.parseInto(state, content, normalized.getParent(), constraint, normalized.toString());
        state.visiting.remove(normalized);
    }
}
