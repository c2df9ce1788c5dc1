package org.stianloader.pyresolve.repo;

import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * The login table of a <code>.netrc</code> file, as read by curl, pip and requests. Each <code>machine</code>
 * entry supplies the basic credentials of the indexes on that host, the <code>default</code> entry those of any
 * other host. Macro definitions and accounts are skipped.
 */
public final class NetrcFile {

    private static final class Login {
        @NotNull
        private String login = "";
        @NotNull
        private String password = "";
    }

    /**
     * Finds the netrc file of a user: <code>.netrc</code> in the home directory, or <code>_netrc</code>
     * where the former does not exist.
     *
     * @param home The home directory of the user
     * @return The file, or null if the user has none
     */
    @Nullable
    public static Path locate(@NotNull Path home) {
        Path netrc = home.resolve(".netrc");
        if (Files.isRegularFile(netrc)) {
            return netrc;
        }
        netrc = home.resolve("_netrc");
        if (Files.isRegularFile(netrc)) {
            return netrc;
        }
        return null;
    }

    /**
     * Parses the contents of a netrc file.
     *
     * @param text The file contents
     * @return The parsed file
     * @throws IllegalArgumentException If the file contains an unknown token or a keyword is missing its value
     */
    @NotNull
    public static NetrcFile parse(@NotNull String text) {
        List<String> tokens = NetrcFile.tokenize(text);
        Map<String, Login> machines = new LinkedHashMap<>();
        Login fallback = null;
        Login current = null;
        for (int i = 0; i < tokens.size(); i++) {
            String token = tokens.get(i);
            switch (token) {
            case "machine":
                current = new Login();
                machines.put(NetrcFile.value(tokens, ++i, token).toLowerCase(Locale.ROOT), current);
                break;
            case "default":
                current = new Login();
                fallback = current;
                break;
            case "login":
                NetrcFile.entry(current, token).login = NetrcFile.value(tokens, ++i, token);
                break;
            case "password":
                NetrcFile.entry(current, token).password = NetrcFile.value(tokens, ++i, token);
                break;
            case "account":
                NetrcFile.value(tokens, ++i, token);
                break;
            default:
                throw new IllegalArgumentException("Unexpected token '" + token + "' in netrc file");
            }
        }

        Map<String, IndexCredentials> credentials = new LinkedHashMap<>();
        for (Map.Entry<String, Login> machine : machines.entrySet()) {
            credentials.put(machine.getKey(), IndexCredentials.basic(machine.getValue().login, machine.getValue().password));
        }
        return new NetrcFile(credentials, fallback == null ? null : IndexCredentials.basic(fallback.login, fallback.password));
    }

    @NotNull
    public static NetrcFile read(@NotNull Path file) throws IOException {
        try {
            return NetrcFile.parse(new String(Files.readAllBytes(file), StandardCharsets.UTF_8));
        } catch (IllegalArgumentException e) {
            throw new IOException("Malformed netrc file " + file + ": " + e.getMessage(), e);
        }
    }

    @NotNull
    private static Login entry(@Nullable Login current, @NotNull String keyword) {
        if (current == null) {
            throw new IllegalArgumentException("'" + keyword + "' outside of a machine or default entry");
        }
        return current;
    }

    @NotNull
    private static List<String> tokenize(@NotNull String text) {
        List<String> tokens = new ArrayList<>();
        boolean macro = false;
        for (String line : text.split("\\r?\\n")) {
            if (macro) {
                // A macro body ends at the first empty line
                macro = !line.trim().isEmpty();
                continue;
            }
            if (line.trim().startsWith("#")) {
                continue;
            }
            int i = 0;
            while (i < line.length()) {
                char c = line.charAt(i);
                if (Character.isWhitespace(c)) {
                    i++;
                    continue;
                }
                StringBuilder token = new StringBuilder();
                if (c == '"') {
                    i++;
                    while (i < line.length() && line.charAt(i) != '"') {
                        if (line.charAt(i) == '\\' && i + 1 < line.length()) {
                            i++;
                        }
                        token.append(line.charAt(i++));
                    }
                    i++;
                } else {
                    while (i < line.length() && !Character.isWhitespace(line.charAt(i))) {
                        token.append(line.charAt(i++));
                    }
                }
                if (token.toString().equals("macdef")) {
                    macro = true;
                    break;
                }
                tokens.add(token.toString());
            }
        }
        return tokens;
    }

    @NotNull
    private static String value(@NotNull List<String> tokens, int index, @NotNull String keyword) {
        if (index >= tokens.size()) {
            throw new IllegalArgumentException("Missing value after '" + keyword + "'");
        }
        return tokens.get(index);
    }

    @Nullable
    private final IndexCredentials fallback;
    @NotNull
    private final Map<@NotNull String, @NotNull IndexCredentials> machines;

    private NetrcFile(@NotNull Map<@NotNull String, @NotNull IndexCredentials> machines, @Nullable IndexCredentials fallback) {
        this.machines = Collections.unmodifiableMap(machines);
        this.fallback = fallback;
    }

    /**
     * Obtains the credentials of a host. A <code>machine</code> entry naming the host and port takes precedence
     * over one naming the host alone, which in turn takes precedence over the <code>default</code> entry.
     *
     * @param url An URL on the host
     * @return The credentials, or null if neither a machine entry nor a default entry applies
     */
    @Nullable
    @Contract(pure = true)
    public IndexCredentials getCredentials(@NotNull URI url) {
        String host = url.getHost();
        if (host == null) {
            return null;
        }
        host = host.toLowerCase(Locale.ROOT);
        IndexCredentials credentials = null;
        if (url.getPort() != -1) {
            credentials = this.machines.get(host + ":" + url.getPort());
        }
        if (credentials == null) {
            credentials = this.machines.get(host);
        }
        return credentials == null ? this.fallback : credentials;
    }

    @NotNull
    @Contract(pure = true)
    public Map<@NotNull String, @NotNull IndexCredentials> getMachines() {
        return this.machines;
    }

    @Override
    public String toString() {
        return "NetrcFile[" + this.machines.keySet() + (this.fallback == null ? "" : ", default") + "]";
    }
}
