package org.stianloader.pyresolve.version;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * A version as defined by PEP 440, the version scheme used by Python packages.
 *
 * <p>Instances are immutable and totally ordered. Equality follows the ordering, that is "1.0" and "1.0.0"
 * are equal, just as "1.0a1" and "1.0alpha1" are. {@link #toString()} yields the normalized form of the version
 * while {@link #getOriginText()} retains the text the version was parsed from (required for arbitrary
 * equality specifiers and for lookups that care about the exact spelling).
 */
public final class PythonVersion implements Comparable<PythonVersion> {

    private static final Pattern VERSION_PATTERN = Pattern.compile(
            "^\\s*v?"
            + "(?:(?<epoch>[0-9]+)!)?"
            + "(?<release>[0-9]+(?:\\.[0-9]+)*)"
            + "(?<pre>[-_.]?(?<prel>alpha|a|beta|b|preview|pre|c|rc)[-_.]?(?<pren>[0-9]+)?)?"
            + "(?<post>(?:-(?<postn1>[0-9]+))|(?:[-_.]?(?<postl>post|rev|r)[-_.]?(?<postn2>[0-9]+)?))?"
            + "(?<dev>[-_.]?(?<devl>dev)[-_.]?(?<devn>[0-9]+)?)?"
            + "(?:\\+(?<local>[a-z0-9]+(?:[-_.][a-z0-9]+)*))?"
            + "\\s*$", Pattern.CASE_INSENSITIVE);

    private final int epoch;
    private final long @NotNull[] release;
    @Nullable
    private final String preLabel;
    private final long preNumber;
    private final long postNumber;
    private final long devNumber;
    @Nullable
    private final String local;
    @NotNull
    private final String originText;
    private final int hash;

    private PythonVersion(int epoch, long @NotNull[] release, @Nullable String preLabel, long preNumber, long postNumber, long devNumber, @Nullable String local, @NotNull String originText) {
        this.epoch = epoch;
        this.release = release;
        this.preLabel = preLabel;
        this.preNumber = preNumber;
        this.postNumber = postNumber;
        this.devNumber = devNumber;
        this.local = local;
        this.originText = originText;
        int significant = release.length;
        while (significant > 1 && release[significant - 1] == 0) {
            significant--;
        }
        this.hash = Objects.hash(epoch, Arrays.hashCode(Arrays.copyOf(release, significant)), preLabel, preNumber, postNumber, devNumber, local);
    }

    /**
     * Parses a PEP 440 version string, accepting all the alternative spellings permitted
     * by the normalization rules of PEP 440.
     *
     * @param text The version string to parse
     * @return The parsed version
     * @throws InvalidVersionException If the string is not a valid PEP 440 version
     */
    @NotNull
    public static PythonVersion parse(@NotNull String text) {
        Matcher matcher = PythonVersion.VERSION_PATTERN.matcher(text);
        if (!matcher.matches()) {
            throw new InvalidVersionException(text, "Not a valid PEP 440 version");
        }
        try {
            int epoch = matcher.group("epoch") == null ? 0 : Integer.parseInt(matcher.group("epoch"));
            String[] releaseParts = matcher.group("release").split("\\.");
            long[] release = new long[releaseParts.length];
            for (int i = 0; i < releaseParts.length; i++) {
                release[i] = Long.parseLong(releaseParts[i]);
            }

            String preLabel = null;
            long preNumber = 0;
            if (matcher.group("pre") != null) {
                preLabel = PythonVersion.normalizePreLabel(matcher.group("prel"));
                String n = matcher.group("pren");
                preNumber = n == null ? 0 : Long.parseLong(n);
            }

            long postNumber = -1;
            if (matcher.group("post") != null) {
                String n = matcher.group("postn1");
                if (n == null) {
                    n = matcher.group("postn2");
                }
                postNumber = n == null ? 0 : Long.parseLong(n);
            }

            long devNumber = -1;
            if (matcher.group("dev") != null) {
                String n = matcher.group("devn");
                devNumber = n == null ? 0 : Long.parseLong(n);
            }

            String local = matcher.group("local");
            if (local != null) {
                local = local.toLowerCase(Locale.ROOT).replace('-', '.').replace('_', '.');
            }

            return new PythonVersion(epoch, release, preLabel, preNumber, postNumber, devNumber, local, text.trim());
        } catch (NumberFormatException e) {
            throw new InvalidVersionException(text, "Version component out of range");
        }
    }

    /**
     * Parses a version string, returning null instead of throwing if the string is not a valid PEP 440 version.
     * Intended for lenient contexts such as parsing the file names listed by an index.
     *
     * @param text The version string
     * @return The parsed version or null
     */
    @Nullable
    public static PythonVersion tryParse(@Nullable String text) {
        if (text == null) {
            return null;
        }
        try {
            return PythonVersion.parse(text);
        } catch (InvalidVersionException e) {
            return null;
        }
    }

    @NotNull
    private static String normalizePreLabel(@NotNull String label) {
        switch (label.toLowerCase(Locale.ROOT)) {
        case "a":
        case "alpha":
            return "a";
        case "b":
        case "beta":
            return "b";
        default:
            // c, pre, preview, rc
            return "rc";
        }
    }

    private static int compareLocal(@Nullable String a, @Nullable String b) {
        if (a == null) {
            return b == null ? 0 : -1;
        } else if (b == null) {
            return 1;
        }
        String[] partsA = a.split("\\.");
        String[] partsB = b.split("\\.");
        int length = Math.min(partsA.length, partsB.length);
        for (int i = 0; i < length; i++) {
            String pa = partsA[i];
            String pb = partsB[i];
            boolean numericA = PythonVersion.isNumeric(pa);
            boolean numericB = PythonVersion.isNumeric(pb);
            int cmp;
            if (numericA && numericB) {
                cmp = new BigInteger(pa).compareTo(new BigInteger(pb));
            } else if (numericA) {
                // Numeric segments sort after alphanumeric ones
                cmp = 1;
            } else if (numericB) {
                cmp = -1;
            } else {
                cmp = pa.compareTo(pb);
            }
            if (cmp != 0) {
                return cmp;
            }
        }
        return Integer.compare(partsA.length, partsB.length);
    }

    private static boolean isNumeric(@NotNull String s) {
        for (int i = 0; i < s.length(); i++) {
            if (!Character.isDigit(s.charAt(i))) {
                return false;
            }
        }
        return !s.isEmpty();
    }

    private static int preLabelRank(@NotNull String label) {
        switch (label) {
        case "a":
            return 0;
        case "b":
            return 1;
        default:
            return 2;
        }
    }

    @Override
    public int compareTo(@NotNull PythonVersion other) {
        int cmp = Integer.compare(this.epoch, other.epoch);
        if (cmp != 0) {
            return cmp;
        }
        int length = Math.max(this.release.length, other.release.length);
        for (int i = 0; i < length; i++) {
            long a = i < this.release.length ? this.release[i] : 0;
            long b = i < other.release.length ? other.release[i] : 0;
            if (a != b) {
                return Long.compare(a, b);
            }
        }

        // Pre-release slot. A bare dev release ("1.0.dev0") sorts before any pre-release of the same release.
        cmp = Integer.compare(this.preSlotRank(), other.preSlotRank());
        if (cmp != 0) {
            return cmp;
        }
        if (this.preLabel != null) {
            String otherLabel = Objects.requireNonNull(other.preLabel);
            cmp = Integer.compare(PythonVersion.preLabelRank(this.preLabel), PythonVersion.preLabelRank(otherLabel));
            if (cmp != 0) {
                return cmp;
            }
            cmp = Long.compare(this.preNumber, other.preNumber);
            if (cmp != 0) {
                return cmp;
            }
        }

        // Post-release: absent (-1) sorts first
        cmp = Long.compare(this.postNumber, other.postNumber);
        if (cmp != 0) {
            return cmp;
        }

        // Dev-release: absent sorts last
        cmp = Long.compare(this.devNumber < 0 ? Long.MAX_VALUE : this.devNumber, other.devNumber < 0 ? Long.MAX_VALUE : other.devNumber);
        if (cmp != 0) {
            return cmp;
        }
        return PythonVersion.compareLocal(this.local, other.local);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj instanceof PythonVersion) {
            return this.compareTo((PythonVersion) obj) == 0;
        }
        return false;
    }

    /**
     * Obtains the version consisting only of the epoch and the release segment, i.e. "1.0" for "1.0rc1.post2+local".
     *
     * @return The base version
     */
    @NotNull
    @Contract(pure = true)
    public PythonVersion getBaseVersion() {
        if (this.preLabel == null && this.postNumber < 0 && this.devNumber < 0 && this.local == null) {
            return this;
        }
        StringBuilder builder = new StringBuilder();
        this.appendBase(builder);
        return new PythonVersion(this.epoch, this.release, null, 0, -1, -1, null, builder.toString());
    }

    @Contract(pure = true)
    public int getEpoch() {
        return this.epoch;
    }

    @Nullable
    @Contract(pure = true)
    public String getLocal() {
        return this.local;
    }

    @NotNull
    @Contract(pure = true)
    public String getOriginText() {
        return this.originText;
    }

    /**
     * Obtains this version without the local version label.
     *
     * @return The public version
     */
    @NotNull
    @Contract(pure = true)
    public PythonVersion getPublic() {
        if (this.local == null) {
            return this;
        }
        String text = this.toString();
        return new PythonVersion(this.epoch, this.release, this.preLabel, this.preNumber, this.postNumber, this.devNumber, null, text.substring(0, text.indexOf('+')));
    }

    /**
     * Obtains the components of the release segment, as written (trailing zeros are retained).
     *
     * @return The release segment
     */
    @NotNull
    @Contract(pure = true)
    public List<@NotNull Long> getRelease() {
        List<Long> list = new ArrayList<>(this.release.length);
        for (long l : this.release) {
            list.add(l);
        }
        return Collections.unmodifiableList(list);
    }

    @Override
    public int hashCode() {
        return this.hash;
    }

    @Contract(pure = true)
    public boolean isDevrelease() {
        return this.devNumber >= 0;
    }

    @Contract(pure = true)
    public boolean isNewerThan(@NotNull PythonVersion other) {
        return this.compareTo(other) > 0;
    }

    @Contract(pure = true)
    public boolean isPostrelease() {
        return this.postNumber >= 0;
    }

    /**
     * Whether this version is a pre-release. Development releases count as pre-releases.
     *
     * @return True for pre-releases and development releases
     */
    @Contract(pure = true)
    public boolean isPrerelease() {
        return this.preLabel != null || this.devNumber >= 0;
    }

    private int preSlotRank() {
        if (this.preLabel == null && this.postNumber < 0 && this.devNumber >= 0) {
            return 0;
        } else if (this.preLabel != null) {
            return 1;
        } else {
            return 2;
        }
    }

    private void appendBase(@NotNull StringBuilder builder) {
        if (this.epoch != 0) {
            builder.append(this.epoch).append('!');
        }
        for (int i = 0; i < this.release.length; i++) {
            if (i != 0) {
                builder.append('.');
            }
            builder.append(this.release[i]);
        }
    }

    @Override
    @NotNull
    public String toString() {
        StringBuilder builder = new StringBuilder();
        this.appendBase(builder);
        if (this.preLabel != null) {
            builder.append(this.preLabel).append(this.preNumber);
        }
        if (this.postNumber >= 0) {
            builder.append(".post").append(this.postNumber);
        }
        if (this.devNumber >= 0) {
            builder.append(".dev").append(this.devNumber);
        }
        if (this.local != null) {
            builder.append('+').append(this.local);
        }
        return builder.toString();
    }
}
