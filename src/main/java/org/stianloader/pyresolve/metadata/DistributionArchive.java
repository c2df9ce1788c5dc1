package org.stianloader.pyresolve.metadata;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.function.Predicate;

import org.apache.commons.compress.archivers.ArchiveEntry;
import org.apache.commons.compress.archivers.ArchiveInputStream;
import org.apache.commons.compress.archivers.tar.TarArchiveInputStream;
import org.apache.commons.compress.archivers.zip.ZipArchiveInputStream;
import org.apache.commons.compress.compressors.bzip2.BZip2CompressorInputStream;
import org.apache.commons.compress.compressors.gzip.GzipCompressorInputStream;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Read access to the members of a downloaded distribution archive. Wheels and <code>.zip</code> source
 * distributions are zip files, the other source distributions are (optionally compressed) tar files.
 */
final class DistributionArchive {

    /**
     * Reads the selected members of an archive into memory.
     *
     * @param filename The file name of the archive, used to determine the archive format
     * @param data The archive contents
     * @param filter Selects the member paths to read, paths use '/' separators and have no leading slash
     * @return The selected members by path, in archive order
     * @throws IOException If the archive is corrupt or the format is not supported
     */
    @NotNull
    static Map<@NotNull String, byte @NotNull[]> read(@NotNull String filename, byte @NotNull[] data, @NotNull Predicate<@NotNull String> filter) throws IOException {
        Map<String, byte[]> members = new LinkedHashMap<>();
        try (ArchiveInputStream<?> archive = DistributionArchive.open(filename, new ByteArrayInputStream(data))) {
            ArchiveEntry entry;
            while ((entry = archive.getNextEntry()) != null) {
                if (entry.isDirectory() || !archive.canReadEntryData(entry)) {
                    continue;
                }
                String path = DistributionArchive.normalizePath(entry.getName());
                if (path != null && filter.test(path)) {
                    members.put(path, archive.readAllBytes());
                }
            }
        }
        return Collections.unmodifiableMap(members);
    }

    @NotNull
    private static ArchiveInputStream<?> open(@NotNull String filename, @NotNull InputStream in) throws IOException {
        String lower = filename.toLowerCase(Locale.ROOT);
        if (lower.endsWith(".whl") || lower.endsWith(".zip")) {
            return new ZipArchiveInputStream(in);
        } else if (lower.endsWith(".tar.gz") || lower.endsWith(".tgz")) {
            return new TarArchiveInputStream(new GzipCompressorInputStream(in));
        } else if (lower.endsWith(".tar.bz2") || lower.endsWith(".tbz")) {
            return new TarArchiveInputStream(new BZip2CompressorInputStream(in));
        } else if (lower.endsWith(".tar")) {
            return new TarArchiveInputStream(in);
        }
        throw new IOException("Unsupported archive format: " + filename);
    }

    @Nullable
    @Contract(pure = true)
    private static String normalizePath(@NotNull String name) {
        String path = name.replace('\\', '/');
        while (path.startsWith("./")) {
            path = path.substring(2);
        }
        while (path.startsWith("/")) {
            path = path.substring(1);
        }
        return path.isEmpty() ? null : path;
    }

    @Contract(pure = true)
    static int depth(@NotNull String path) {
        int depth = 0;
        for (int i = 0; i < path.length(); i++) {
            if (path.charAt(i) == '/') {
                depth++;
            }
        }
        return depth;
    }

    private DistributionArchive() {
        throw new UnsupportedOperationException();
    }
}
