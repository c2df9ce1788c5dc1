package org.stianloader.pyresolve.requirement;

import java.util.ArrayList;
import java.util.List;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.stianloader.pyresolve.PackageNames;
import org.stianloader.pyresolve.marker.Marker;
import org.stianloader.pyresolve.version.InvalidVersionException;
import org.stianloader.pyresolve.version.SpecifierSet;

/**
 * Parser for single PEP 508 requirement lines.
 *
 * <pre>
 * name ('[' extras ']')? (('(' specifiers ')') | specifiers | '@' url)? (';' marker)?
 * </pre>
 */
public final class RequirementParser {

    @NotNull
    private static MalformedRequirementException error(@NotNull String text, int pos, @NotNull String message) {
        int start = Math.min(pos, text.length());
        return new MalformedRequirementException(text, text.substring(start, Math.min(text.length(), start + 16)), message);
    }

    private static boolean isNameChar(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9') || c == '-' || c == '_' || c == '.';
    }

    /**
     * Parses a requirement line. Surrounding whitespace is ignored, comments are not.
     *
     * @param line The requirement text
     * @return The parsed requirement
     * @throws MalformedRequirementException If the text is not a valid requirement
     */
    @NotNull
    public static Requirement parse(@NotNull String line) {
        String text = line.trim();
        if (text.isEmpty()) {
            throw new MalformedRequirementException(line, "", "Empty requirement");
        }
        int pos = 0;
        int length = text.length();

        while (pos < length && RequirementParser.isNameChar(text.charAt(pos))) {
            pos++;
        }
        String name = text.substring(0, pos);
        if (!PackageNames.isValid(name)) {
            throw RequirementParser.error(text, 0, "Invalid project name");
        }
        pos = RequirementParser.skipWhitespace(text, pos);

        List<String> extras = new ArrayList<>();
        if (pos < length && text.charAt(pos) == '[') {
            int close = text.indexOf(']', pos);
            if (close == -1) {
                throw RequirementParser.error(text, pos, "Unterminated extras list");
            }
            String extrasText = text.substring(pos + 1, close).trim();
            if (!extrasText.isEmpty()) {
                for (String extra : extrasText.split(",")) {
                    String trimmed = extra.trim();
                    if (!PackageNames.isValid(trimmed)) {
                        throw RequirementParser.error(text, text.indexOf(extra, pos), "Invalid extra name");
                    }
                    extras.add(trimmed);
                }
            }
            pos = RequirementParser.skipWhitespace(text, close + 1);
        }

        String url = null;
        SpecifierSet specifier = SpecifierSet.ANY;
        if (pos < length && text.charAt(pos) == '@') {
            pos = RequirementParser.skipWhitespace(text, pos + 1);
            int start = pos;
            while (pos < length && !Character.isWhitespace(text.charAt(pos))) {
                pos++;
            }
            url = text.substring(start, pos);
            if (url.isEmpty() || url.indexOf(':') == -1) {
                throw RequirementParser.error(text, start, "Invalid direct URL");
            }
            // A marker after an URL must be separated by whitespace, otherwise the ';' is part of the URL
            pos = RequirementParser.skipWhitespace(text, pos);
        } else if (pos < length && text.charAt(pos) != ';') {
            boolean parenthesized = text.charAt(pos) == '(';
            int start = parenthesized ? pos + 1 : pos;
            int end;
            if (parenthesized) {
                end = text.indexOf(')', start);
                if (end == -1) {
                    throw RequirementParser.error(text, pos, "Unterminated version specifier");
                }
            } else {
                end = text.indexOf(';', start);
                if (end == -1) {
                    end = length;
                }
            }
            String specifierText = text.substring(start, end).trim();
            try {
                specifier = SpecifierSet.parse(specifierText);
            } catch (InvalidVersionException e) {
                MalformedRequirementException ex = RequirementParser.error(text, start, "Invalid version specifier");
                ex.initCause(e);
                throw ex;
            }
            pos = RequirementParser.skipWhitespace(text, parenthesized ? end + 1 : end);
        }

        Marker marker = null;
        if (pos < length) {
            if (text.charAt(pos) != ';') {
                throw RequirementParser.error(text, pos, "Unexpected text after requirement");
            }
            String markerText = text.substring(pos + 1).trim();
            if (markerText.isEmpty()) {
                throw RequirementParser.error(text, pos, "Empty marker");
            }
            marker = Marker.parse(markerText);
        }

        return new Requirement(name, extras, specifier, marker, url, text);
    }

    /**
     * Parses a requirement line, returning null instead of throwing if the line is malformed.
     *
     * @param line The requirement text
     * @return The requirement, or null
     */
    @Nullable
    public static Requirement tryParse(@NotNull String line) {
        try {
            return RequirementParser.parse(line);
        } catch (MalformedRequirementException e) {
            return null;
        }
    }

    private static int skipWhitespace(@NotNull String text, int pos) {
        while (pos < text.length() && Character.isWhitespace(text.charAt(pos))) {
            pos++;
        }
        return pos;
    }

    private RequirementParser() {
        throw new UnsupportedOperationException();
    }
}
