package org.stianloader.pyresolve.repo;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.stianloader.pyresolve.logging.LoggingAdapter;
import org.stianloader.pyresolve.version.InvalidVersionException;
import org.stianloader.pyresolve.version.SpecifierSet;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Parser for project pages of the simple repository API, in both the PEP 691 JSON and the PEP 503 HTML flavour.
 */
public final class SimpleIndexParser {

    @NotNull
    public static final String JSON_CONTENT_TYPE = "application/vnd.pypi.simple.v1+json";

    @NotNull
    public static final String ACCEPT_HEADER = SimpleIndexParser.JSON_CONTENT_TYPE + ", application/vnd.pypi.simple.v1+html;q=0.2, text/html;q=0.1";

    @NotNull
    private static final ObjectMapper MAPPER = new ObjectMapper();

    /**
     * Checks whether a response with the given content type should be parsed as JSON.
     *
     * @param contentType The value of the Content-Type header, may be null
     * @return True for the PEP 691 JSON content type
     */
    public static boolean isJson(@Nullable String contentType) {
        if (contentType == null) {
            return false;
        }
        String lower = contentType.toLowerCase(Locale.ROOT);
        return lower.startsWith(SimpleIndexParser.JSON_CONTENT_TYPE) || lower.startsWith("application/json");
    }

    /**
     * Parses a project page, choosing the format by the content type.
     *
     * @param body The response body
     * @param contentType The value of the Content-Type header, may be null
     * @param pageUrl The URL the page was served from, used to resolve relative links
     * @return The listed files, in page order
     * @throws IOException If a JSON page is malformed
     */
    @NotNull
    public static List<@NotNull DistributionLink> parse(byte @NotNull[] body, @Nullable String contentType, @NotNull URI pageUrl) throws IOException {
        if (SimpleIndexParser.isJson(contentType)) {
            return SimpleIndexParser.parseJson(body, pageUrl);
        }
        return SimpleIndexParser.parseHtml(new String(body, StandardCharsets.UTF_8), pageUrl);
    }

    @NotNull
    public static List<@NotNull DistributionLink> parseHtml(@NotNull String html, @NotNull URI pageUrl) {
        Document document = Jsoup.parse(html, pageUrl.toString());
        List<DistributionLink> links = new ArrayList<>();
        for (Element anchor : document.select("a[href]")) {
            String href = anchor.absUrl("href");
            if (href.isEmpty()) {
                href = SimpleIndexParser.resolve(pageUrl, anchor.attr("href"));
            }
            if (href == null) {
                continue;
            }
            String filename = anchor.text().trim();
            if (filename.isEmpty()) {
                filename = SimpleIndexParser.lastPathSegment(href);
            }

            Map<String, String> hashes = new LinkedHashMap<>();
            int fragment = href.indexOf('#');
            if (fragment != -1) {
                String[] hash = href.substring(fragment + 1).split("=", 2);
                if (hash.length == 2) {
                    hashes.put(hash[0].toLowerCase(Locale.ROOT), hash[1]);
                }
            }

            SpecifierSet requiresPython = null;
            if (anchor.hasAttr("data-requires-python")) {
                requiresPython = SimpleIndexParser.parseRequiresPython(anchor.attr("data-requires-python"), filename);
            }

            boolean yanked = anchor.hasAttr("data-yanked");
            String yankedReason = yanked && !anchor.attr("data-yanked").isEmpty() ? anchor.attr("data-yanked") : null;
            String metadataAttribute = anchor.hasAttr("data-core-metadata") ? anchor.attr("data-core-metadata") : anchor.hasAttr("data-dist-info-metadata") ? anchor.attr("data-dist-info-metadata") : null;
            boolean coreMetadata = metadataAttribute != null && !metadataAttribute.equalsIgnoreCase("false");

            links.add(new DistributionLink(filename, href, hashes, requiresPython, yanked, yankedReason, coreMetadata));
        }
        return links;
    }

    @NotNull
    public static List<@NotNull DistributionLink> parseJson(byte @NotNull[] body, @NotNull URI pageUrl) throws IOException {
        JsonNode root = SimpleIndexParser.MAPPER.readTree(body);
        if (root == null || !root.isObject()) {
            throw new IOException("Simple index page at " + pageUrl + " is not a JSON object");
        }
        JsonNode files = root.path("files");
        if (!files.isArray()) {
            throw new IOException("Simple index page at " + pageUrl + " lacks the 'files' array");
        }
        List<DistributionLink> links = new ArrayList<>();
        for (JsonNode file : files) {
            String filename = file.path("filename").asText(null);
            String url = SimpleIndexParser.resolve(pageUrl, file.path("url").asText(""));
            if (filename == null || url == null) {
                LoggingAdapter.getDefaultLogger().debug(SimpleIndexParser.class, "Skipping incomplete file entry on {}: {}", pageUrl, file);
                continue;
            }

            Map<String, String> hashes = new LinkedHashMap<>();
            for (Iterator<Map.Entry<String, JsonNode>> it = file.path("hashes").fields(); it.hasNext();) {
                Map.Entry<String, JsonNode> entry = it.next();
                hashes.put(entry.getKey().toLowerCase(Locale.ROOT), entry.getValue().asText());
            }

            SpecifierSet requiresPython = null;
            JsonNode requiresPythonNode = file.get("requires-python");
            if (requiresPythonNode != null && requiresPythonNode.isTextual()) {
                requiresPython = SimpleIndexParser.parseRequiresPython(requiresPythonNode.asText(), filename);
            }

            JsonNode yankedNode = file.path("yanked");
            boolean yanked = yankedNode.isTextual() || yankedNode.asBoolean(false);
            String yankedReason = yankedNode.isTextual() && !yankedNode.asText().isEmpty() ? yankedNode.asText() : null;

            JsonNode metadataNode = file.has("core-metadata") ? file.get("core-metadata") : file.path("dist-info-metadata");
            boolean coreMetadata = metadataNode.isObject() || metadataNode.asBoolean(false);

            links.add(new DistributionLink(filename, url, hashes, requiresPython, yanked, yankedReason, coreMetadata));
        }
        return Collections.unmodifiableList(links);
    }

    @Nullable
    private static SpecifierSet parseRequiresPython(@NotNull String text, @NotNull String filename) {
        try {
            return SpecifierSet.parse(text);
        } catch (InvalidVersionException e) {
            // Installers ignore invalid Requires-Python values
            LoggingAdapter.getDefaultLogger().debug(SimpleIndexParser.class, "Ignoring invalid requires-python '{}' of {}", text, filename);
            return null;
        }
    }

    @NotNull
    private static String lastPathSegment(@NotNull String url) {
        String path = url;
        int cut = path.indexOf('#');
        if (cut != -1) {
            path = path.substring(0, cut);
        }
        cut = path.indexOf('?');
        if (cut != -1) {
            path = path.substring(0, cut);
        }
        return path.substring(path.lastIndexOf('/') + 1);
    }

    @Nullable
    private static String resolve(@NotNull URI base, @NotNull String reference) {
        if (reference.isEmpty()) {
            return null;
        }
        try {
            return base.resolve(new URI(reference)).toString();
        } catch (URISyntaxException e) {
            LoggingAdapter.getDefaultLogger().debug(SimpleIndexParser.class, "Skipping malformed link '{}' on {}", reference, base, e);
            return null;
        }
    }

    private SimpleIndexParser() {
        throw new UnsupportedOperationException();
    }
}
