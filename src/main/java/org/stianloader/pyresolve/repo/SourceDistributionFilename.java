package org.stianloader.pyresolve.repo;

import java.util.Locale;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.stianloader.pyresolve.PackageNames;
import org.stianloader.pyresolve.version.PythonVersion;

/**
 * The parsed file name of a source distribution: <code>{name}-{version}{extension}</code>.
 *
 * <p>Legacy source distributions do not escape dashes in the project name, so the split point between the name and
 * the version is ambiguous. If the expected project name is known, the split is chosen so that the name matches it.
 */
public final class SourceDistributionFilename {

    private static final String[] EXTENSIONS = {".tar.gz", ".tgz", ".tar.bz2", ".tbz", ".tar", ".zip"};

    /**
     * Obtains the archive extension of a source distribution file name.
     *
     * @param filename The file name
     * @return The lowercase extension including the leading dot, or null if it is not a supported archive
     */
    @Nullable
    @Contract(pure = true)
    public static String getExtension(@NotNull String filename) {
        String lower = filename.toLowerCase(Locale.ROOT);
        for (String extension : SourceDistributionFilename.EXTENSIONS) {
            if (lower.endsWith(extension)) {
                return extension;
            }
        }
        return null;
    }

    @Nullable
    public static SourceDistributionFilename tryParse(@NotNull String filename, @Nullable String expectedName) {
        String extension = SourceDistributionFilename.getExtension(filename);
        if (extension == null) {
            return null;
        }
        String stem = filename.substring(0, filename.length() - extension.length());
        if (expectedName != null) {
            String normalizedExpected = PackageNames.normalize(expectedName);
            for (int i = stem.indexOf('-'); i != -1; i = stem.indexOf('-', i + 1)) {
                if (PackageNames.normalize(stem.substring(0, i)).equals(normalizedExpected)) {
                    PythonVersion version = PythonVersion.tryParse(stem.substring(i + 1));
                    if (version != null) {
                        return new SourceDistributionFilename(filename, normalizedExpected, version, extension);
                    }
                }
            }
            return null;
        }
        int split = stem.lastIndexOf('-');
        if (split <= 0) {
            return null;
        }
        PythonVersion version = PythonVersion.tryParse(stem.substring(split + 1));
        if (version == null || !PackageNames.isValid(stem.substring(0, split))) {
            return null;
        }
        return new SourceDistributionFilename(filename, PackageNames.normalize(stem.substring(0, split)), version, extension);
    }

    @NotNull
    private final String filename;
    @NotNull
    private final String name;
    @NotNull
    private final PythonVersion version;
    @NotNull
    private final String extension;

    private SourceDistributionFilename(@NotNull String filename, @NotNull String name, @NotNull PythonVersion version, @NotNull String extension) {
        this.filename = filename;
        this.name = name;
        this.version = version;
        this.extension = extension;
    }

    @NotNull
    @Contract(pure = true)
    public String getExtension() {
        return this.extension;
    }

    @NotNull
    @Contract(pure = true)
    public String getFilename() {
        return this.filename;
    }

    @NotNull
    @Contract(pure = true)
    public String getName() {
        return this.name;
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
