package org.stianloader.pyresolve.marker;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.stianloader.pyresolve.PackageNames;
import org.stianloader.pyresolve.version.InvalidVersionException;
import org.stianloader.pyresolve.version.PythonVersion;
import org.stianloader.pyresolve.version.VersionSpecifier;

/**
 * A parsed PEP 508 environment marker, such as <code>python_version &lt; "3.8" and sys_platform == "win32"</code>.
 *
 * <p>Markers are immutable trees of boolean operations over comparisons. Evaluation short-circuits.
 * Variables that PEP 508 does not define are rejected when parsing with an {@link UnsupportedMarkerException}.
 */
public abstract class Marker {

    /**
     * Either side of a comparison: a variable or a quoted string literal.
     */
    static final class Operand {
        @NotNull
        final String text;
        final boolean variable;

        Operand(@NotNull String text, boolean variable) {
            this.text = text;
            this.variable = variable;
        }

        @NotNull
        String resolve(@NotNull Environment environment, @Nullable String extra) {
            if (this.variable) {
                return environment.getMarkerValue(this.text, extra);
            }
            return this.text;
        }

        @Override
        public boolean equals(Object obj) {
            return obj instanceof Operand && ((Operand) obj).variable == this.variable && ((Operand) obj).text.equals(this.text);
        }

        @Override
        public int hashCode() {
            return Objects.hash(this.text, this.variable);
        }

        @Override
        public String toString() {
            if (this.variable) {
                return this.text;
            }
            return this.text.indexOf('"') == -1 ? '"' + this.text + '"' : '\'' + this.text + '\'';
        }
    }

    static final class Comparison extends Marker {
        @NotNull
        final Operand lhs;
        @NotNull
        final String operator;
        @NotNull
        final Operand rhs;

        Comparison(@NotNull Operand lhs, @NotNull String operator, @NotNull Operand rhs) {
            this.lhs = lhs;
            this.operator = operator;
            this.rhs = rhs;
        }

        @Override
        public boolean evaluate(@NotNull Environment environment, @Nullable String extra) {
            String left = this.lhs.resolve(environment, extra);
            String right = this.rhs.resolve(environment, extra);
            if ((this.lhs.variable && this.lhs.text.equals("extra")) || (this.rhs.variable && this.rhs.text.equals("extra"))) {
                // Extra names are compared in their normalized form
                left = PackageNames.normalize(left);
                right = PackageNames.normalize(right);
            }
            switch (this.operator) {
            case "in":
                return right.contains(left);
            case "not in":
                return !right.contains(left);
            default:
                break;
            }

            PythonVersion leftVersion = PythonVersion.tryParse(left);
            if (leftVersion != null) {
                try {
                    return VersionSpecifier.parse(this.operator + right).contains(leftVersion);
                } catch (InvalidVersionException ignored) {
                    // Not a version comparison after all, compare as strings
                }
            }

            int cmp = left.compareTo(right);
            switch (this.operator) {
            case "==":
            case "===":
                return cmp == 0;
            case "!=":
                return cmp != 0;
            case "<":
                return cmp < 0;
            case "<=":
                return cmp <= 0;
            case ">":
                return cmp > 0;
            case ">=":
                return cmp >= 0;
            default:
                // "~=" on something that is not a version is undefined
                return false;
            }
        }

        @Override
        public boolean equals(Object obj) {
            if (obj instanceof Comparison) {
                Comparison other = (Comparison) obj;
                return other.lhs.equals(this.lhs) && other.operator.equals(this.operator) && other.rhs.equals(this.rhs);
            }
            return false;
        }

        @Override
        public int hashCode() {
            return Objects.hash(this.lhs, this.operator, this.rhs);
        }

        @Override
        public boolean referencesExtra() {
            return (this.lhs.variable && this.lhs.text.equals("extra")) || (this.rhs.variable && this.rhs.text.equals("extra"));
        }

        @Override
        public String toString() {
            return this.lhs + " " + this.operator + " " + this.rhs;
        }
    }

    static final class Junction extends Marker {
        final boolean conjunction;
        @NotNull
        final List<@NotNull Marker> children;

        Junction(boolean conjunction, @NotNull List<@NotNull Marker> children) {
            this.conjunction = conjunction;
            this.children = Collections.unmodifiableList(new ArrayList<>(children));
        }

        @Override
        public boolean equals(Object obj) {
            if (obj instanceof Junction) {
                Junction other = (Junction) obj;
                return other.conjunction == this.conjunction && other.children.equals(this.children);
            }
            return false;
        }

        @Override
        public boolean evaluate(@NotNull Environment environment, @Nullable String extra) {
            for (Marker child : this.children) {
                boolean result = child.evaluate(environment, extra);
                if (this.conjunction && !result) {
                    return false;
                } else if (!this.conjunction && result) {
                    return true;
                }
            }
            return this.conjunction;
        }

        @Override
        public int hashCode() {
            return Objects.hash(this.conjunction, this.children);
        }

        @Override
        public boolean referencesExtra() {
            for (Marker child : this.children) {
                if (child.referencesExtra()) {
                    return true;
                }
            }
            return false;
        }

        @Override
        public String toString() {
            StringBuilder builder = new StringBuilder();
            for (Marker child : this.children) {
                if (builder.length() != 0) {
                    builder.append(this.conjunction ? " and " : " or ");
                }
                if (child instanceof Junction && ((Junction) child).conjunction != this.conjunction) {
                    builder.append('(').append(child).append(')');
                } else {
                    builder.append(child);
                }
            }
            return builder.toString();
        }
    }

    Marker() {
    }

    /**
     * Parses a marker expression.
     *
     * @param text The marker expression, without the leading ";"
     * @return The parsed marker
     * @throws UnsupportedMarkerException If an unknown variable is used
     * @throws org.stianloader.pyresolve.requirement.MalformedRequirementException If the expression is malformed
     */
    @NotNull
    public static Marker parse(@NotNull String text) {
        return new MarkerParser(text).parse();
    }

    /**
     * Combines two markers, either of which may be null, with a logical "and".
     *
     * @param a The first marker
     * @param b The second marker
     * @return The conjunction, or null if both markers are null
     */
    @Nullable
    @Contract(pure = true, value = "null, null -> null; !null, _ -> !null; _, !null -> !null")
    public static Marker and(@Nullable Marker a, @Nullable Marker b) {
        if (a == null) {
            return b;
        } else if (b == null) {
            return a;
        }
        List<Marker> children = new ArrayList<>();
        for (Marker m : new Marker[] {a, b}) {
            if (m instanceof Junction && ((Junction) m).conjunction) {
                children.addAll(((Junction) m).children);
            } else {
                children.add(m);
            }
        }
        return new Junction(true, children);
    }

    /**
     * Evaluates the marker against the environment for a set of requested extras. If no extras are requested,
     * the marker is evaluated once with an empty "extra" variable. Otherwise the marker holds if it holds
     * for any of the requested extras.
     *
     * @param environment The environment
     * @param extras The requested extras
     * @return The evaluation result
     */
    public boolean evaluate(@NotNull Environment environment, @NotNull Collection<@NotNull String> extras) {
        if (extras.isEmpty()) {
            return this.evaluate(environment, (String) null);
        }
        for (String extra : extras) {
            if (this.evaluate(environment, extra)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Evaluates the marker against the environment.
     *
     * @param environment The environment
     * @param extra The value of the "extra" variable, null for none
     * @return The evaluation result
     */
    public abstract boolean evaluate(@NotNull Environment environment, @Nullable String extra);

    /**
     * Whether the marker is gated on the "extra" variable anywhere.
     *
     * @return True if "extra" is referenced
     */
    public abstract boolean referencesExtra();
}
