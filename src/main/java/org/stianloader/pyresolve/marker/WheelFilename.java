package org.stianloader.pyresolve.marker;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.stianloader.pyresolve.PackageNames;
import org.stianloader.pyresolve.version.PythonVersion;

/**
 * The parsed file name of a wheel: <code>{name}-{version}(-{build})?-{python}-{abi}-{platform}.whl</code>.
 * Each of the tag parts may be a compressed tag set such as <code>py2.py3</code>, which expands into
 * the cartesian product of its components.
 */
public final class WheelFilename {
    @NotNull
    private final String filename;
    @NotNull
    private final String name;
    @NotNull
    private final PythonVersion version;
    @Nullable
    private final String buildTag;
    @NotNull
    private final List<@NotNull WheelTag> tags;

    private WheelFilename(@NotNull String filename, @NotNull String name, @NotNull PythonVersion version, @Nullable String buildTag, @NotNull List<@NotNull WheelTag> tags) {
        this.filename = filename;
        this.name = name;
        this.version = version;
        this.buildTag = buildTag;
        this.tags = tags;
    }

    @Contract(pure = true)
    public static boolean isWheel(@NotNull String filename) {
        return filename.toLowerCase(Locale.ROOT).endsWith(".whl");
    }

    /**
     * Parses a wheel file name.
     *
     * @param filename The file name, without any directories
     * @return The parsed file name, or null if the name is not a well-formed wheel name
     */
    @Nullable
    public static WheelFilename tryParse(@NotNull String filename) {
        if (!WheelFilename.isWheel(filename)) {
            return null;
        }
        String stem = filename.substring(0, filename.length() - 4);
        String[] parts = stem.split("-");
        if (parts.length != 5 && parts.length != 6) {
            return null;
        }
        PythonVersion version = PythonVersion.tryParse(parts[1]);
        if (version == null) {
            return null;
        }
        String buildTag = parts.length == 6 ? parts[2] : null;
        int tagStart = parts.length - 3;
        List<WheelTag> tags = new ArrayList<>();
        for (String interpreter : parts[tagStart].split("\\.")) {
            for (String abi : parts[tagStart + 1].split("\\.")) {
                for (String platform : parts[tagStart + 2].split("\\.")) {
                    tags.add(new WheelTag(interpreter.toLowerCase(Locale.ROOT), abi.toLowerCase(Locale.ROOT), platform.toLowerCase(Locale.ROOT)));
                }
            }
        }
        return new WheelFilename(filename, PackageNames.normalize(parts[0]), version, buildTag, Collections.unmodifiableList(tags));
    }

    @Nullable
    @Contract(pure = true)
    public String getBuildTag() {
        return this.buildTag;
    }

    @NotNull
    @Contract(pure = true)
    public String getFilename() {
        return this.filename;
    }

    /**
     * Obtains the normalized project name encoded in the file name.
     *
     * @return The normalized name
     */
    @NotNull
    @Contract(pure = true)
    public String getName() {
        return this.name;
    }

    @NotNull
    @Contract(pure = true)
    public List<@NotNull WheelTag> getTags() {
        return this.tags;
    }

    @NotNull
    @Contract(pure = true)
    public PythonVersion getVersion() {
        return this.version;
    }

    @Override
    public String toString() {
        return this.filename;
    }
}
