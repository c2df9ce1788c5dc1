package org.stianloader.pyresolve.test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import java.util.TreeSet;

import org.junit.jupiter.api.Test;
import org.stianloader.pyresolve.marker.Environment;
import org.stianloader.pyresolve.requirement.MalformedRequirementException;
import org.stianloader.pyresolve.requirement.Requirement;
import org.stianloader.pyresolve.requirement.RequirementParser;
import org.stianloader.pyresolve.version.SpecifierSet;

public class RequirementParserTest {

    @Test
    public void testPlainNames() {
        Requirement requirement = RequirementParser.parse("  Django_REST.framework ");
        assertEquals("django-rest-framework", requirement.getName());
        assertEquals("Django_REST.framework", requirement.getDisplayName());
        assertEquals(SpecifierSet.ANY, requirement.getSpecifier());
        assertTrue(requirement.getExtras().isEmpty());
        assertNull(requirement.getMarker());
        assertNull(requirement.getUrl());
        assertEquals("django-rest-framework", requirement.getIdentifier());
    }

    @Test
    public void testSpecifiersAndExtras() {
        Requirement requirement = RequirementParser.parse("requests [Socks, security] >=2.8.1, ==2.8.*");
        assertEquals("requests", requirement.getName());
        assertEquals(new TreeSet<>(Arrays.asList("security", "socks")), requirement.getExtras());
        assertEquals(SpecifierSet.parse(">=2.8.1,==2.8.*"), requirement.getSpecifier());
        assertEquals("requests[security,socks]", requirement.getIdentifier());

        Requirement parenthesized = RequirementParser.parse("name (>=1.0, <2)");
        assertEquals(SpecifierSet.parse(">=1.0,<2"), parenthesized.getSpecifier());
        assertEquals(RequirementParser.parse("name>=1.0,<2"), parenthesized);
        assertTrue(RequirementParser.parse("name[]").getExtras().isEmpty());
    }

    @Test
    public void testMarkers() {
        Requirement requirement = RequirementParser.parse("pywin32>=1.0; sys_platform == 'win32'");
        assertNotNull(requirement.getMarker());
        assertFalse(requirement.isApplicable(Environment.fromPythonVersionAndOs("3.11", "linux"), (String) null));
        assertTrue(requirement.isApplicable(Environment.fromPythonVersionAndOs("3.11", "windows"), (String) null));

        Requirement noSpecifier = RequirementParser.parse("importlib-metadata;python_version<\"3.8\"");
        assertEquals(SpecifierSet.ANY, noSpecifier.getSpecifier());
        assertTrue(noSpecifier.isApplicable(Environment.fromPythonVersionAndOs("3.7", "linux"), (String) null));
        assertFalse(noSpecifier.isApplicable(Environment.fromPythonVersionAndOs("3.8", "linux"), (String) null));
    }

    @Test
    public void testDirectUrls() {
        Requirement requirement = RequirementParser.parse("pip @ https://github.com/pypa/pip/archive/22.0.2.zip ; python_version >= '3.7'");
        assertEquals("pip", requirement.getName());
        assertEquals("https://github.com/pypa/pip/archive/22.0.2.zip", requirement.getUrl());
        assertNotNull(requirement.getMarker());

        Requirement withHash = RequirementParser.parse("foo[bar]@ file:///tmp/foo-1.0-py3-none-any.whl#sha256=abcdef");
        assertEquals("file:///tmp/foo-1.0-py3-none-any.whl#sha256=abcdef", withHash.getUrl());
        assertEquals("foo[bar]", withHash.getIdentifier());
    }

    @Test
    public void testDerivedRequirements() {
        Requirement requirement = RequirementParser.parse("Requests[socks]>=2; os_name == 'nt'");
        Requirement plain = requirement.withoutExtras();
        assertEquals("requests", plain.getIdentifier());
        assertEquals(requirement.getSpecifier(), plain.getSpecifier());
        assertEquals(requirement.getMarker(), plain.getMarker());
        assertNull(requirement.withMarker(null).getMarker());
        assertEquals("Requests[socks]>=2", requirement.withMarker(null).getText());
        assertEquals(SpecifierSet.parse("==2.1"), requirement.withSpecifier(SpecifierSet.parse("==2.1")).getSpecifier());
        assertEquals(Requirement.of("requests", SpecifierSet.parse(">=2")), RequirementParser.parse("requests >= 2"));
    }

    @Test
    public void testMalformedRequirements() {
        assertThrows(MalformedRequirementException.class, () -> RequirementParser.parse(""));
        assertThrows(MalformedRequirementException.class, () -> RequirementParser.parse(">=1.0"));
        assertThrows(MalformedRequirementException.class, () -> RequirementParser.parse("-foo"));
        assertThrows(MalformedRequirementException.class, () -> RequirementParser.parse("foo[bar"));
        assertThrows(MalformedRequirementException.class, () -> RequirementParser.parse("foo[b@r]"));
        assertThrows(MalformedRequirementException.class, () -> RequirementParser.parse("foo (>=1.0"));
        assertThrows(MalformedRequirementException.class, () -> RequirementParser.parse("foo >=1.0.x"));
        assertThrows(MalformedRequirementException.class, () -> RequirementParser.parse("foo @ not-a-url"));
        assertThrows(MalformedRequirementException.class, () -> RequirementParser.parse("foo (>=1.0) bar"));
        assertThrows(MalformedRequirementException.class, () -> RequirementParser.parse("foo>=1.0;"));
        assertThrows(MalformedRequirementException.class, () -> RequirementParser.parse("foo>=1.0; python_version <"));

        MalformedRequirementException e = assertThrows(MalformedRequirementException.class, () -> RequirementParser.parse("foo >=1.0.x"));
        assertEquals("foo >=1.0.x", e.getInput());
        assertNull(RequirementParser.tryParse("foo >=1.0.x"));
        assertNotNull(RequirementParser.tryParse("foo >=1.0"));
    }
}
