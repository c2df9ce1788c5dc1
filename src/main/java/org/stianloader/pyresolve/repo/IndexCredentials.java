package org.stianloader.pyresolve.repo;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Objects;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

/**
 * Credentials that are sent to an index as the <code>Authorization</code> header.
 */
public final class IndexCredentials {

    @NotNull
    public static IndexCredentials basic(@NotNull String username, @NotNull String password) {
        String token = Base64.getEncoder().encodeToString((username + ":" + password).getBytes(StandardCharsets.UTF_8));
        return new IndexCredentials("Basic " + token, username);
    }

    @NotNull
    public static IndexCredentials bearer(@NotNull String token) {
        return new IndexCredentials("Bearer " + Objects.requireNonNull(token, "token may not be null"), "<token>");
    }

    @NotNull
    private final String header;
    @NotNull
    private final String principal;

    private IndexCredentials(@NotNull String header, @NotNull String principal) {
        this.header = header;
        this.principal = principal;
    }

    @NotNull
    @Contract(pure = true)
    public String getAuthorizationHeader() {
        return this.header;
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof IndexCredentials && ((IndexCredentials) obj).header.equals(this.header);
    }

    @Override
    public int hashCode() {
        return this.header.hashCode();
    }

    @Override
    public String toString() {
        // Never leak the secret into logs
        return "IndexCredentials[" + this.principal + "]";
    }
}
