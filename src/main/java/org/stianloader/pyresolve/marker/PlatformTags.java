package org.stianloader.pyresolve.marker;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import org.jetbrains.annotations.NotNull;

/**
 * Platform tag lists of the named environments, most specific first.
 */
final class PlatformTags {

    private static final int MANYLINUX_NEWEST_GLIBC_MINOR = 35;
    private static final int MANYLINUX_OLDEST_GLIBC_MINOR = 5;

    @NotNull
    static List<@NotNull String> linux(@NotNull String machine) {
        List<String> tags = new ArrayList<>();
        String arch = machine.toLowerCase(Locale.ROOT);
        for (int glibcMinor = PlatformTags.MANYLINUX_NEWEST_GLIBC_MINOR; glibcMinor >= PlatformTags.MANYLINUX_OLDEST_GLIBC_MINOR; glibcMinor--) {
            tags.add("manylinux_2_" + glibcMinor + "_" + arch);
            // Legacy aliases (PEP 599, PEP 571, PEP 513)
            if (glibcMinor == 17) {
                tags.add("manylinux2014_" + arch);
            } else if (glibcMinor == 12) {
                tags.add("manylinux2010_" + arch);
            } else if (glibcMinor == 5) {
                tags.add("manylinux1_" + arch);
            }
        }
        tags.add("linux_" + arch);
        return tags;
    }

    @NotNull
    static List<@NotNull String> macos(@NotNull String machine) {
        List<String> tags = new ArrayList<>();
        String[] formats;
        if (machine.equals("arm64")) {
            formats = new String[] {"arm64", "universal2"};
        } else {
            formats = new String[] {"x86_64", "intel", "fat64", "fat32", "universal2", "universal"};
        }
        for (int major = 14; major >= 11; major--) {
            for (String format : formats) {
                tags.add("macosx_" + major + "_0_" + format);
            }
        }
        if (!machine.equals("arm64")) {
            for (int minor = 16; minor >= 4; minor--) {
                for (String format : formats) {
                    tags.add("macosx_10_" + minor + "_" + format);
                }
            }
        }
        return tags;
    }

    @NotNull
    static List<@NotNull String> windows(@NotNull String machine) {
        List<String> tags = new ArrayList<>();
        if (machine.equalsIgnoreCase("AMD64") || machine.equalsIgnoreCase("x86_64")) {
            tags.add("win_amd64");
        } else if (machine.equalsIgnoreCase("ARM64")) {
            tags.add("win_arm64");
        } else {
            tags.add("win32");
        }
        return tags;
    }

    private PlatformTags() {
        throw new UnsupportedOperationException();
    }
}
