package org.stianloader.pyresolve.test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.jetbrains.annotations.NotNull;
import org.junit.jupiter.api.Test;
import org.stianloader.pyresolve.version.InvalidVersionException;
import org.stianloader.pyresolve.version.PythonVersion;

public class PythonVersionTest {

    private boolean isNewer(@NotNull String newer, @NotNull String older) {
        return PythonVersion.parse(newer).isNewerThan(PythonVersion.parse(older));
    }

    @Test
    public void testNormalization() {
        assertEquals("1.0a1", PythonVersion.parse("1.0alpha1").toString());
        assertEquals("1.0b2", PythonVersion.parse("1.0-beta.2").toString());
        assertEquals("1.0rc1", PythonVersion.parse("1.0c1").toString());
        assertEquals("1.0rc0", PythonVersion.parse("1.0preview").toString());
        assertEquals("1.0.post2", PythonVersion.parse("1.0-2").toString());
        assertEquals("1.0.post0", PythonVersion.parse("1.0.rev").toString());
        assertEquals("1.0.dev0", PythonVersion.parse("1.0-dev").toString());
        assertEquals("1.0+ubuntu.1", PythonVersion.parse("1.0+Ubuntu-1").toString());
        assertEquals("2!1.0", PythonVersion.parse("v2!1.0").toString());
        assertEquals("1.0", PythonVersion.parse("  1.0 ").toString());
    }

    @Test
    public void testTrailingZerosAreInsignificant() {
        assertEquals(PythonVersion.parse("1.0"), PythonVersion.parse("1.0.0"));
        assertEquals(PythonVersion.parse("1"), PythonVersion.parse("1.0.0.0"));
        assertEquals(PythonVersion.parse("1.0").hashCode(), PythonVersion.parse("1.0.0").hashCode());
    }

    @Test
    public void testOrdering() {
        assertTrue(isNewer("1.0", "1.0rc1"));
        assertTrue(isNewer("1.0rc1", "1.0b1"));
        assertTrue(isNewer("1.0b1", "1.0a1"));
        assertTrue(isNewer("1.0a1", "1.0.dev0"));
        assertTrue(isNewer("1.0a1", "1.0a1.dev1"));
        assertTrue(isNewer("1.0.post1", "1.0"));
        assertTrue(isNewer("1.0.post1", "1.0.post1.dev0"));
        assertTrue(isNewer("1.0.post1.dev0", "1.0"));
        assertTrue(isNewer("1.0+local", "1.0"));
        assertTrue(isNewer("1.0+abc.5", "1.0+abc.4"));
        assertTrue(isNewer("1.0+5", "1.0+abc"));
        assertTrue(isNewer("1!0.1", "2.0"));
        assertTrue(isNewer("1.10", "1.9"));
        assertFalse(isNewer("1.0", "1.0.0"));
    }

    @Test
    public void testSorting() {
        List<PythonVersion> versions = new ArrayList<>();
        for (String v : Arrays.asList("1.1", "1.0.post1", "1.0", "1.0rc1", "1.0a2", "1.0.dev3", "0.9")) {
            versions.add(PythonVersion.parse(v));
        }
        List<PythonVersion> shuffled = new ArrayList<>(versions);
        Collections.reverse(shuffled);
        Collections.swap(shuffled, 1, 4);
        Collections.sort(shuffled, Collections.reverseOrder());
        assertEquals(versions, shuffled);
    }

    @Test
    public void testReleaseKinds() {
        assertTrue(PythonVersion.parse("1.0a1").isPrerelease());
        assertTrue(PythonVersion.parse("1.0.dev1").isPrerelease());
        assertTrue(PythonVersion.parse("1.0.dev1").isDevrelease());
        assertFalse(PythonVersion.parse("1.0.post1").isPrerelease());
        assertTrue(PythonVersion.parse("1.0.post1").isPostrelease());
        assertEquals("ubuntu", PythonVersion.parse("1.0+ubuntu").getLocal());
        assertEquals(PythonVersion.parse("1.0"), PythonVersion.parse("1.0+ubuntu").getPublic());
        assertEquals(Arrays.asList(1L, 2L, 0L), PythonVersion.parse("1.2.0").getRelease());
    }

    @Test
    public void testInvalidVersions() {
        assertThrows(InvalidVersionException.class, () -> PythonVersion.parse("french toast"));
        assertThrows(InvalidVersionException.class, () -> PythonVersion.parse("1.0+"));
        assertThrows(InvalidVersionException.class, () -> PythonVersion.parse(""));
        assertNull(PythonVersion.tryParse("1.0-foo"));
        assertNull(PythonVersion.tryParse(null));
    }
}
