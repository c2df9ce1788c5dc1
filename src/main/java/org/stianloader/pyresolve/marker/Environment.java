package org.stianloader.pyresolve.marker;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.stianloader.pyresolve.PackageNames;
import org.stianloader.pyresolve.version.PythonVersion;
import org.stianloader.pyresolve.version.SpecifierSet;

/**
 * The target a resolution is performed for: a Python interpreter version and implementation running on a
 * given platform. An environment provides the values of the PEP 508 marker variables and decides which wheels
 * are installable.
 *
 * <p>Environments are immutable and are never changed during a resolution run. As pyresolve never executes
 * Python, the environment is not probed but described - either field by field through {@link #builder()} or
 * through one of the named contexts such as {@link #fromPythonVersionAndOs(String, String)}.
 */
public final class Environment {

    public static final class Builder {
        @NotNull
        private String pythonVersion = "3.11";
        @Nullable
        private String pythonFullVersion;
        @NotNull
        private String implementationName = "cpython";
        @Nullable
        private String abi;
        @NotNull
        private List<@NotNull String> platforms = new ArrayList<>();
        @NotNull
        private String osName = "posix";
        @NotNull
        private String sysPlatform = "linux";
        @NotNull
        private String platformSystem = "Linux";
        @NotNull
        private String platformMachine = "x86_64";
        @NotNull
        private String platformRelease = "";
        @NotNull
        private String platformVersion = "";

        private Builder() {
        }

        @NotNull
        public Builder abi(@NotNull String abi) {
            this.abi = abi;
            return this;
        }

        @NotNull
        public Environment build() {
            String[] parts = this.pythonVersion.split("\\.");
            if (parts.length != 2) {
                throw new IllegalArgumentException("The python version must consist of exactly a major and a minor component, got: " + this.pythonVersion);
            }
            int major;
            int minor;
            try {
                major = Integer.parseInt(parts[0]);
                minor = Integer.parseInt(parts[1]);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid python version: " + this.pythonVersion, e);
            }
            String fullVersion = this.pythonFullVersion == null ? this.pythonVersion + ".0" : this.pythonFullVersion;
            PythonVersion.parse(fullVersion);
            String interpreterPrefix = Environment.interpreterPrefix(this.implementationName);
            String abi = this.abi;
            if (abi == null) {
                abi = interpreterPrefix + major + minor;
            }
            List<String> platforms = new ArrayList<>(this.platforms);
            if (platforms.isEmpty()) {
                platforms.add("any");
            }
            return new Environment(major, minor, fullVersion, this.implementationName.toLowerCase(Locale.ROOT), abi, platforms, this.osName,
                    this.sysPlatform, this.platformSystem, this.platformMachine, this.platformRelease, this.platformVersion);
        }

        @NotNull
        public Builder implementationName(@NotNull String implementationName) {
            this.implementationName = implementationName;
            return this;
        }

        @NotNull
        public Builder osName(@NotNull String osName) {
            this.osName = osName;
            return this;
        }

        @NotNull
        public Builder platformMachine(@NotNull String platformMachine) {
            this.platformMachine = platformMachine;
            return this;
        }

        @NotNull
        public Builder platformRelease(@NotNull String platformRelease) {
            this.platformRelease = platformRelease;
            return this;
        }

        /**
         * Sets the platform tags in order of preference. Wheels whose platform tag is not in this list
         * (and that are not platform independent) are considered incompatible.
         *
         * @param platforms The platform tags
         * @return This builder
         */
        @NotNull
        public Builder platforms(@NotNull List<@NotNull String> platforms) {
            this.platforms = new ArrayList<>(platforms);
            return this;
        }

        @NotNull
        public Builder platformSystem(@NotNull String platformSystem) {
            this.platformSystem = platformSystem;
            return this;
        }

        @NotNull
        public Builder platformVersion(@NotNull String platformVersion) {
            this.platformVersion = platformVersion;
            return this;
        }

        @NotNull
        public Builder pythonFullVersion(@NotNull String pythonFullVersion) {
            this.pythonFullVersion = pythonFullVersion;
            return this;
        }

        /**
         * Sets the "major.minor" python version, e.g. "3.11".
         *
         * @param pythonVersion The version
         * @return This builder
         */
        @NotNull
        public Builder pythonVersion(@NotNull String pythonVersion) {
            this.pythonVersion = pythonVersion;
            return this;
        }

        @NotNull
        public Builder sysPlatform(@NotNull String sysPlatform) {
            this.sysPlatform = sysPlatform;
            return this;
        }
    }

    /**
     * The python versions that can be selected through the named contexts, in "major.minor" form.
     */
    @NotNull
    public static final List<@NotNull String> KNOWN_PYTHON_VERSIONS = Collections.unmodifiableList(Arrays.asList(
            "2.7", "3.6", "3.7", "3.8", "3.9", "3.10", "3.11", "3.12", "3.13"));

    /**
     * The operating systems that can be selected through the named contexts.
     */
    @NotNull
    public static final List<@NotNull String> KNOWN_OPERATING_SYSTEMS = Collections.unmodifiableList(Arrays.asList("linux", "macos", "windows"));

    private final int major;
    private final int minor;
    @NotNull
    private final String pythonFullVersion;
    @NotNull
    private final String implementationName;
    @NotNull
    private final String abi;
    @NotNull
    private final List<@NotNull String> platforms;
    @NotNull
    private final String osName;
    @NotNull
    private final String sysPlatform;
    @NotNull
    private final String platformSystem;
    @NotNull
    private final String platformMachine;
    @NotNull
    private final String platformRelease;
    @NotNull
    private final String platformVersion;
    @NotNull
    private final List<@NotNull WheelTag> supportedTags;
    @NotNull
    private final Map<WheelTag, Integer> tagPriorities;

    private Environment(int major, int minor, @NotNull String pythonFullVersion, @NotNull String implementationName, @NotNull String abi,
            @NotNull List<@NotNull String> platforms, @NotNull String osName, @NotNull String sysPlatform, @NotNull String platformSystem,
            @NotNull String platformMachine, @NotNull String platformRelease, @NotNull String platformVersion) {
        this.major = major;
        this.minor = minor;
        this.pythonFullVersion = pythonFullVersion;
        this.implementationName = implementationName;
        this.abi = abi;
        this.platforms = Collections.unmodifiableList(platforms);
        this.osName = osName;
        this.sysPlatform = sysPlatform;
        this.platformSystem = platformSystem;
        this.platformMachine = platformMachine;
        this.platformRelease = platformRelease;
        this.platformVersion = platformVersion;
        this.supportedTags = Collections.unmodifiableList(this.computeSupportedTags());
        Map<WheelTag, Integer> priorities = new HashMap<>();
        for (int i = 0; i < this.supportedTags.size(); i++) {
            priorities.putIfAbsent(this.supportedTags.get(i), i);
        }
        this.tagPriorities = priorities;
    }

    @NotNull
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Creates an environment for the given python version on the operating system the JVM is running on.
     *
     * @param pythonVersion The python version, in "3.11" or "311" form
     * @return The environment
     */
    @NotNull
    public static Environment current(@NotNull String pythonVersion) {
        String os = System.getProperty("os.name", "linux").toLowerCase(Locale.ROOT);
        if (os.contains("win")) {
            os = "windows";
        } else if (os.contains("mac") || os.contains("darwin")) {
            os = "macos";
        } else {
            os = "linux";
        }
        return Environment.fromPythonVersionAndOs(pythonVersion, os);
    }

    /**
     * Creates an environment for a CPython interpreter of the given version running on a 64-bit x86 machine
     * with the given operating system.
     *
     * @param pythonVersion The python version, in "3.11" or "311" form
     * @param operatingSystem One of "linux", "macos" or "windows"
     * @return The environment
     * @throws IllegalArgumentException If the python version or the operating system is not known
     */
    @NotNull
    public static Environment fromPythonVersionAndOs(@NotNull String pythonVersion, @NotNull String operatingSystem) {
        String version = Environment.normalizePythonVersion(pythonVersion);
        if (!Environment.KNOWN_PYTHON_VERSIONS.contains(version)) {
            throw new IllegalArgumentException("Invalid python version: " + pythonVersion + ". Must be one of: " + String.join(", ", Environment.KNOWN_PYTHON_VERSIONS));
        }
        Builder builder = Environment.builder().pythonVersion(version);
        switch (operatingSystem.toLowerCase(Locale.ROOT)) {
        case "linux":
            return builder.osName("posix").sysPlatform("linux").platformSystem("Linux").platformMachine("x86_64")
                    .platforms(PlatformTags.linux("x86_64")).build();
        case "mac":
        case "macos":
            return builder.osName("posix").sysPlatform("darwin").platformSystem("Darwin").platformMachine("x86_64")
                    .platforms(PlatformTags.macos("x86_64")).build();
        case "windows":
            return builder.osName("nt").sysPlatform("win32").platformSystem("Windows").platformMachine("AMD64")
                    .platforms(PlatformTags.windows("AMD64")).build();
        default:
            throw new IllegalArgumentException("Invalid operating system: " + operatingSystem + ". Must be one of: " + String.join(", ", Environment.KNOWN_OPERATING_SYSTEMS));
        }
    }

    @NotNull
    private static String interpreterPrefix(@NotNull String implementationName) {
        switch (implementationName.toLowerCase(Locale.ROOT)) {
        case "cpython":
            return "cp";
        case "pypy":
            return "pp";
        case "ironpython":
            return "ip";
        case "jython":
            return "jy";
        default:
            return implementationName.toLowerCase(Locale.ROOT);
        }
    }

    /**
     * Converts "311", "3.11" or "3.11.4" into the "3.11" form.
     */
    @NotNull
    static String normalizePythonVersion(@NotNull String pythonVersion) {
        String version = pythonVersion.trim();
        if (version.indexOf('.') == -1) {
            if (version.length() < 2) {
                throw new IllegalArgumentException("Invalid python version: " + pythonVersion);
            }
            return version.charAt(0) + "." + version.substring(1);
        }
        String[] parts = version.split("\\.");
        return parts[0] + '.' + parts[1];
    }

    @NotNull
    private List<@NotNull WheelTag> computeSupportedTags() {
        Set<WheelTag> tags = new LinkedHashSet<>();
        String interpreter = Environment.interpreterPrefix(this.implementationName) + this.major + this.minor;
        boolean cpython = this.implementationName.equals("cpython");

        for (String platform : this.platforms) {
            tags.add(new WheelTag(interpreter, this.abi, platform));
        }
        if (cpython && this.major == 3 && this.minor >= 2) {
            for (String platform : this.platforms) {
                tags.add(new WheelTag(interpreter, "abi3", platform));
            }
        }
        for (String platform : this.platforms) {
            tags.add(new WheelTag(interpreter, "none", platform));
        }
        if (cpython && this.major == 3) {
            // The stable ABI is forward compatible
            for (int olderMinor = this.minor - 1; olderMinor >= 2; olderMinor--) {
                for (String platform : this.platforms) {
                    tags.add(new WheelTag("cp3" + olderMinor, "abi3", platform));
                }
            }
        }

        List<String> genericInterpreters = new ArrayList<>();
        genericInterpreters.add("py" + this.major + this.minor);
        genericInterpreters.add("py" + this.major);
        for (int olderMinor = this.minor - 1; olderMinor >= 0; olderMinor--) {
            genericInterpreters.add("py" + this.major + olderMinor);
        }
        for (String generic : genericInterpreters) {
            for (String platform : this.platforms) {
                tags.add(new WheelTag(generic, "none", platform));
            }
        }
        tags.add(new WheelTag(interpreter, "none", "any"));
        for (String generic : genericInterpreters) {
            tags.add(new WheelTag(generic, "none", "any"));
        }
        return new ArrayList<>(tags);
    }

    @NotNull
    @Contract(pure = true)
    public String getAbi() {
        return this.abi;
    }

    @NotNull
    @Contract(pure = true)
    public String getImplementationName() {
        return this.implementationName;
    }

    /**
     * Obtains the value of a PEP 508 marker variable.
     *
     * @param variable The name of the variable, including legacy dotted aliases such as "sys.platform"
     * @param extra The value of the "extra" variable, or null if no extra is being evaluated
     * @return The value of the variable
     * @throws UnsupportedMarkerException If the variable is not known
     */
    @NotNull
    public String getMarkerValue(@NotNull String variable, @Nullable String extra) {
        switch (variable) {
        case "os_name":
        case "os.name":
            return this.osName;
        case "sys_platform":
        case "sys.platform":
            return this.sysPlatform;
        case "platform_machine":
        case "platform.machine":
            return this.platformMachine;
        case "platform_python_implementation":
        case "platform.python_implementation":
        case "python_implementation":
            return this.getPlatformPythonImplementation();
        case "platform_release":
            return this.platformRelease;
        case "platform_system":
            return this.platformSystem;
        case "platform_version":
        case "platform.version":
            return this.platformVersion;
        case "python_version":
            return this.getPythonVersion();
        case "python_full_version":
        case "implementation_version":
            return this.pythonFullVersion;
        case "implementation_name":
            return this.implementationName;
        case "extra":
            return extra == null ? "" : PackageNames.normalize(extra);
        default:
            throw new UnsupportedMarkerException(variable, variable);
        }
    }

    @NotNull
    @Contract(pure = true)
    public String getOsName() {
        return this.osName;
    }

    @NotNull
    private String getPlatformPythonImplementation() {
        switch (this.implementationName) {
        case "cpython":
            return "CPython";
        case "pypy":
            return "PyPy";
        case "ironpython":
            return "IronPython";
        case "jython":
            return "Jython";
        default:
            return this.implementationName;
        }
    }

    @NotNull
    @Contract(pure = true)
    public List<@NotNull String> getPlatforms() {
        return this.platforms;
    }

    @NotNull
    @Contract(pure = true)
    public String getPythonFullVersion() {
        return this.pythonFullVersion;
    }

    /**
     * Obtains the "major.minor" version of the interpreter, the value of the "python_version" marker.
     *
     * @return The python version
     */
    @NotNull
    @Contract(pure = true)
    public String getPythonVersion() {
        return this.major + "." + this.minor;
    }

    /**
     * Obtains all tag triples of installable wheels, most preferred first.
     *
     * @return The supported tags
     */
    @NotNull
    @Contract(pure = true)
    public List<@NotNull WheelTag> getSupportedTags() {
        return this.supportedTags;
    }

    @NotNull
    @Contract(pure = true)
    public String getSysPlatform() {
        return this.sysPlatform;
    }

    /**
     * Evaluates a marker expression against this environment, with no extra requested.
     *
     * @param marker The marker expression, without the leading ";"
     * @return True if the marker holds
     * @throws UnsupportedMarkerException If the expression uses an unknown variable
     * @throws org.stianloader.pyresolve.requirement.MalformedRequirementException If the expression is malformed
     */
    @Contract(pure = true)
    public boolean evaluate(@NotNull String marker) {
        return Marker.parse(marker).evaluate(this, (String) null);
    }

    /**
     * Obtains the rank of the most preferred tag of the wheel among the {@link #getSupportedTags() supported tags}.
     * Lower is better.
     *
     * @param wheel The wheel
     * @return The rank, or -1 if the wheel is not compatible
     */
    @Contract(pure = true)
    public int getTagPriority(@NotNull WheelFilename wheel) {
        int best = -1;
        for (WheelTag tag : wheel.getTags()) {
            Integer priority = this.tagPriorities.get(tag);
            if (priority != null && (best == -1 || priority < best)) {
                best = priority;
            }
        }
        return best;
    }

    @Contract(pure = true)
    public boolean isCompatible(@NotNull WheelFilename wheel) {
        return this.getTagPriority(wheel) != -1;
    }

    /**
     * Checks a "Requires-Python" constraint against the full interpreter version.
     * Pre-releases are always admitted, mirroring how installers treat this field.
     *
     * @param requiresPython The constraint
     * @return True if the interpreter satisfies the constraint
     */
    @Contract(pure = true)
    public boolean supportsPython(@NotNull SpecifierSet requiresPython) {
        return requiresPython.contains(PythonVersion.parse(this.pythonFullVersion), Boolean.TRUE);
    }

    @Override
    public boolean equals(Object obj) {
        if (obj instanceof Environment) {
            Environment other = (Environment) obj;
            return other.major == this.major && other.minor == this.minor
                    && other.pythonFullVersion.equals(this.pythonFullVersion)
                    && other.implementationName.equals(this.implementationName)
                    && other.abi.equals(this.abi)
                    && other.platforms.equals(this.platforms)
                    && other.osName.equals(this.osName)
                    && other.sysPlatform.equals(this.sysPlatform)
                    && other.platformSystem.equals(this.platformSystem)
                    && other.platformMachine.equals(this.platformMachine)
                    && other.platformRelease.equals(this.platformRelease)
                    && other.platformVersion.equals(this.platformVersion);
        }
        return false;
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.major, this.minor, this.pythonFullVersion, this.implementationName, this.abi, this.platforms, this.sysPlatform);
    }

    @Override
    @NotNull
    public String toString() {
        return "Environment[python=" + this.pythonFullVersion + " implementation=" + this.implementationName + " abi=" + this.abi
                + " sys_platform=" + this.sysPlatform + " machine=" + this.platformMachine + " platforms=" + this.platforms.size() + "]";
    }
}
