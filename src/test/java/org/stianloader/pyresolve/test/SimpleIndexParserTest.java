package org.stianloader.pyresolve.test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.stianloader.pyresolve.repo.DistributionLink;
import org.stianloader.pyresolve.repo.SimpleIndexParser;
import org.stianloader.pyresolve.version.SpecifierSet;

public class SimpleIndexParserTest {

    private static final URI PAGE = URI.create("https://pypi.example.com/simple/pkg-a/");

    @Test
    public void testHtmlPage() throws IOException {
        String html = "<!DOCTYPE html><html><body><h1>Links for pkg-a</h1>\n"
                + "<a href=\"../../packages/pkg_a-1.0-py3-none-any.whl#sha256=00ff\" data-requires-python=\"&gt;=3.8\">pkg_a-1.0-py3-none-any.whl</a><br/>\n"
                + "<a href=\"https://files.example.com/pkg_a-1.1.tar.gz\" data-yanked=\"broken build\">pkg_a-1.1.tar.gz</a><br/>\n"
                + "<a href=\"/packages/pkg_a-1.2-py3-none-any.whl\" data-dist-info-metadata=\"sha256=abcd\" data-requires-python=\"&gt;=3.8.*\">pkg_a-1.2-py3-none-any.whl</a>\n"
                + "<a href=\"/packages/pkg_a-1.3-py3-none-any.whl\" data-core-metadata=\"true\" data-yanked>pkg_a-1.3-py3-none-any.whl</a>\n"
                + "</body></html>";
        List<DistributionLink> links = SimpleIndexParser.parse(html.getBytes(StandardCharsets.UTF_8), "text/html; charset=utf-8", PAGE);
        assertEquals(4, links.size());

        DistributionLink wheel = links.get(0);
        assertEquals("pkg_a-1.0-py3-none-any.whl", wheel.getFilename());
        assertEquals("https://pypi.example.com/packages/pkg_a-1.0-py3-none-any.whl#sha256=00ff", wheel.getUrl());
        assertEquals(Collections.singletonMap("sha256", "00ff"), wheel.getHashes());
        assertEquals(SpecifierSet.parse(">=3.8"), wheel.getRequiresPython());
        assertTrue(wheel.isWheel());
        assertFalse(wheel.isYanked());
        assertFalse(wheel.hasCoreMetadata());
        assertNull(wheel.getMetadataUrl());

        DistributionLink sdist = links.get(1);
        assertTrue(sdist.isYanked());
        assertEquals("broken build", sdist.getYankedReason());
        assertFalse(sdist.isWheel());

        DistributionLink withMetadata = links.get(2);
        assertTrue(withMetadata.hasCoreMetadata());
        assertEquals("https://pypi.example.com/packages/pkg_a-1.2-py3-none-any.whl.metadata", withMetadata.getMetadataUrl());
        assertNull(withMetadata.getRequiresPython());

        DistributionLink yankedWithoutReason = links.get(3);
        assertTrue(yankedWithoutReason.isYanked());
        assertNull(yankedWithoutReason.getYankedReason());
        assertTrue(yankedWithoutReason.hasCoreMetadata());
    }

    @Test
    public void testJsonPage() throws IOException {
        String json = "{\"meta\": {\"api-version\": \"1.1\"}, \"name\": \"pkg-a\", \"files\": ["
                + "{\"filename\": \"pkg_a-1.0.tar.gz\", \"url\": \"https://files.example.com/pkg_a-1.0.tar.gz\", \"hashes\": {\"SHA256\": \"beef\"}, \"requires-python\": \">=3.7\", \"yanked\": false},"
                + "{\"filename\": \"pkg_a-1.1-py3-none-any.whl\", \"url\": \"../../files/pkg_a-1.1-py3-none-any.whl\", \"hashes\": {}, \"core-metadata\": {\"sha256\": \"cafe\"}, \"yanked\": \"security issue\"},"
                + "{\"filename\": \"pkg_a-1.2-py3-none-any.whl\", \"url\": \"https://files.example.com/pkg_a-1.2-py3-none-any.whl\", \"hashes\": {}, \"dist-info-metadata\": true, \"yanked\": true},"
                + "{\"url\": \"https://files.example.com/incomplete\"}"
                + "]}";
        List<DistributionLink> links = SimpleIndexParser.parse(json.getBytes(StandardCharsets.UTF_8), SimpleIndexParser.JSON_CONTENT_TYPE, PAGE);
        assertEquals(3, links.size());

        assertEquals(Collections.singletonMap("sha256", "beef"), links.get(0).getHashes());
        assertEquals(SpecifierSet.parse(">=3.7"), links.get(0).getRequiresPython());
        assertFalse(links.get(0).isYanked());

        assertEquals("https://pypi.example.com/files/pkg_a-1.1-py3-none-any.whl", links.get(1).getUrl());
        assertTrue(links.get(1).hasCoreMetadata());
        assertTrue(links.get(1).isYanked());
        assertEquals("security issue", links.get(1).getYankedReason());

        assertTrue(links.get(2).hasCoreMetadata());
        assertTrue(links.get(2).isYanked());
        assertNull(links.get(2).getYankedReason());
    }

    @Test
    public void testContentTypeDetection() {
        assertTrue(SimpleIndexParser.isJson("application/vnd.pypi.simple.v1+json"));
        assertTrue(SimpleIndexParser.isJson("application/json; charset=utf-8"));
        assertFalse(SimpleIndexParser.isJson("application/vnd.pypi.simple.v1+html"));
        assertFalse(SimpleIndexParser.isJson(null));
    }

    @Test
    public void testMalformedJson() {
        assertThrows(IOException.class, () -> SimpleIndexParser.parseJson("[]".getBytes(StandardCharsets.UTF_8), PAGE));
        assertThrows(IOException.class, () -> SimpleIndexParser.parseJson("{\"name\": \"pkg-a\"}".getBytes(StandardCharsets.UTF_8), PAGE));
        assertThrows(IOException.class, () -> SimpleIndexParser.parseJson("{\"files\": [".getBytes(StandardCharsets.UTF_8), PAGE));
    }
}
