package org.stianloader.pyresolve.version;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * A single PEP 440 version clause such as <code>&gt;=1.0</code>, <code>==2.*</code> or <code>~=1.4.2</code>.
 */
public final class VersionSpecifier {

    public enum Operator {
        ARBITRARY_EQUAL("==="),
        COMPATIBLE("~="),
        EQUAL("=="),
        GREATER(">"),
        GREATER_OR_EQUAL(">="),
        LESS("<"),
        LESS_OR_EQUAL("<="),
        NOT_EQUAL("!=");

        // Longest symbols first so that "===" is not mistaken for "==" and "<=" not for "<"
        private static final Operator[] PARSE_ORDER = {ARBITRARY_EQUAL, COMPATIBLE, EQUAL, NOT_EQUAL, LESS_OR_EQUAL, GREATER_OR_EQUAL, LESS, GREATER};

        @NotNull
        private final String symbol;

        Operator(@NotNull String symbol) {
            this.symbol = symbol;
        }

        @NotNull
        @Contract(pure = true)
        public String getSymbol() {
            return this.symbol;
        }
    }

    @NotNull
    private final Operator operator;
    @NotNull
    private final String versionText;
    @Nullable
    private final PythonVersion version;
    private final boolean wildcard;

    private VersionSpecifier(@NotNull Operator operator, @NotNull String versionText, @Nullable PythonVersion version, boolean wildcard) {
        this.operator = operator;
        this.versionText = versionText;
        this.version = version;
        this.wildcard = wildcard;
    }

    @NotNull
    public static VersionSpecifier of(@NotNull Operator operator, @NotNull PythonVersion version) {
        return new VersionSpecifier(operator, version.toString(), version, false);
    }

    /**
     * Parses a single specifier clause.
     *
     * @param text The clause, e.g. "&gt;= 1.0"
     * @return The parsed specifier
     * @throws InvalidVersionException If the clause has no known operator or an invalid version
     */
    @NotNull
    public static VersionSpecifier parse(@NotNull String text) {
        String trimmed = text.trim();
        Operator operator = null;
        for (Operator op : Operator.PARSE_ORDER) {
            if (trimmed.startsWith(op.symbol)) {
                operator = op;
                break;
            }
        }
        if (operator == null) {
            throw new InvalidVersionException(text, "Version specifier lacks a comparison operator");
        }
        String versionText = trimmed.substring(operator.symbol.length()).trim();
        if (versionText.isEmpty()) {
            throw new InvalidVersionException(text, "Version specifier lacks a version");
        }
        if (operator == Operator.ARBITRARY_EQUAL) {
            return new VersionSpecifier(operator, versionText, PythonVersion.tryParse(versionText), false);
        }
        boolean wildcard = versionText.endsWith(".*");
        if (wildcard && operator != Operator.EQUAL && operator != Operator.NOT_EQUAL) {
            throw new InvalidVersionException(text, "Prefix matching is only allowed for == and !=");
        }
        PythonVersion version = PythonVersion.parse(wildcard ? versionText.substring(0, versionText.length() - 2) : versionText);
        if (wildcard && version.getLocal() != null) {
            throw new InvalidVersionException(text, "Prefix matching may not be combined with a local version label");
        }
        if (operator == Operator.COMPATIBLE) {
            if (version.getRelease().size() < 2) {
                throw new InvalidVersionException(text, "Compatible release clauses require at least two release segments");
            }
            if (version.getLocal() != null) {
                throw new InvalidVersionException(text, "Compatible release clauses may not use local version labels");
            }
        }
        return new VersionSpecifier(operator, versionText, version, wildcard);
    }

    private static boolean prefixMatches(@NotNull PythonVersion prefix, @NotNull PythonVersion candidate) {
        if (prefix.getEpoch() != candidate.getEpoch()) {
            return false;
        }
        PythonVersion publicCandidate = candidate.getPublic();
        if (prefix.isPrerelease() || prefix.isPostrelease()) {
            // Rare form such as "==1.0rc1.*": compare the normalized string forms
            String prefixText = prefix.toString();
            String candidateText = publicCandidate.toString();
            return candidateText.equals(prefixText) || candidateText.startsWith(prefixText + '.');
        }
        List<Long> prefixRelease = prefix.getRelease();
        List<Long> candidateRelease = candidate.getRelease();
        for (int i = 0; i < prefixRelease.size(); i++) {
            long c = i < candidateRelease.size() ? candidateRelease.get(i) : 0;
            if (c != prefixRelease.get(i)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Checks whether the given version satisfies this clause. Pre-release filtering is not performed here,
     * see {@link SpecifierSet#contains(PythonVersion, Boolean)} for that.
     *
     * @param candidate The version to test
     * @return True if the version satisfies this clause
     */
    @Contract(pure = true)
    public boolean contains(@NotNull PythonVersion candidate) {
        if (this.operator == Operator.ARBITRARY_EQUAL) {
            return candidate.getOriginText().equalsIgnoreCase(this.versionText) || candidate.toString().equalsIgnoreCase(this.versionText);
        }
        PythonVersion spec = Objects.requireNonNull(this.version);
        switch (this.operator) {
        case EQUAL:
            return this.equalTo(spec, candidate);
        case NOT_EQUAL:
            return !this.equalTo(spec, candidate);
        case LESS_OR_EQUAL:
            return candidate.getPublic().compareTo(spec) <= 0;
        case GREATER_OR_EQUAL:
            return candidate.getPublic().compareTo(spec) >= 0;
        case LESS:
            if (candidate.compareTo(spec) >= 0) {
                return false;
            }
            // "<V" does not admit pre-releases of V itself unless V is a pre-release
            return spec.isPrerelease() || !candidate.isPrerelease() || !candidate.getBaseVersion().equals(spec.getBaseVersion());
        case GREATER:
            if (candidate.compareTo(spec) <= 0) {
                return false;
            }
            // ">V" does not admit post-releases or local versions of V itself unless V is a post-release
            if (!spec.isPostrelease() && candidate.isPostrelease() && candidate.getBaseVersion().equals(spec.getBaseVersion())) {
                return false;
            }
            return candidate.getLocal() == null || !candidate.getBaseVersion().equals(spec.getBaseVersion());
        case COMPATIBLE:
            if (candidate.getPublic().compareTo(spec) < 0) {
                return false;
            }
            List<Long> release = spec.getRelease();
            StringBuilder prefix = new StringBuilder();
            if (spec.getEpoch() != 0) {
                prefix.append(spec.getEpoch()).append('!');
            }
            for (int i = 0; i < release.size() - 1; i++) {
                if (i != 0) {
                    prefix.append('.');
                }
                prefix.append(release.get(i));
            }
            return VersionSpecifier.prefixMatches(PythonVersion.parse(prefix.toString()), candidate);
        default:
            throw new IllegalStateException("Unhandled operator: " + this.operator);
        }
    }

    private boolean equalTo(@NotNull PythonVersion spec, @NotNull PythonVersion candidate) {
        if (this.wildcard) {
            return VersionSpecifier.prefixMatches(spec, candidate);
        }
        if (spec.getLocal() != null) {
            return spec.equals(candidate);
        }
        return spec.equals(candidate.getPublic());
    }

    @Override
    public boolean equals(Object obj) {
        if (obj instanceof VersionSpecifier) {
            VersionSpecifier other = (VersionSpecifier) obj;
            return other.operator == this.operator
                    && other.wildcard == this.wildcard
                    && Objects.equals(other.version, this.version)
                    && (this.version != null || other.versionText.equalsIgnoreCase(this.versionText));
        }
        return false;
    }

    @NotNull
    @Contract(pure = true)
    public Operator getOperator() {
        return this.operator;
    }

    /**
     * Obtains the version of this clause, without the wildcard suffix.
     * May be null for arbitrary equality clauses whose operand is not a PEP 440 version.
     *
     * @return The version
     */
    @Nullable
    @Contract(pure = true)
    public PythonVersion getVersion() {
        return this.version;
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.operator, this.wildcard, this.version == null ? this.versionText.toLowerCase(Locale.ROOT) : this.version);
    }

    /**
     * Whether the clause pins exactly one version (<code>==</code> without wildcard or <code>===</code>).
     *
     * @return True for exact pins
     */
    @Contract(pure = true)
    public boolean isExact() {
        return (this.operator == Operator.EQUAL && !this.wildcard) || this.operator == Operator.ARBITRARY_EQUAL;
    }

    /**
     * Whether this clause explicitly mentions a pre-release in an inclusive manner, which implicitly
     * opts into pre-releases as per PEP 440.
     *
     * @return True if pre-releases should be admitted because of this clause
     */
    @Contract(pure = true)
    public boolean isPrereleaseOptIn() {
        PythonVersion v = this.version;
        if (v == null || !v.isPrerelease()) {
            return false;
        }
        switch (this.operator) {
        case EQUAL:
        case GREATER_OR_EQUAL:
        case LESS_OR_EQUAL:
        case COMPATIBLE:
        case ARBITRARY_EQUAL:
            return true;
        default:
            return false;
        }
    }

    @Override
    @NotNull
    public String toString() {
        return this.operator.symbol + (this.version == null ? this.versionText : (this.version + (this.wildcard ? ".*" : "")));
    }
}
