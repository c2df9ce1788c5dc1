package org.stianloader.pyresolve.marker;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.jetbrains.annotations.NotNull;
import org.stianloader.pyresolve.requirement.MalformedRequirementException;

/**
 * Recursive descent parser for the marker grammar of PEP 508:
 *
 * <pre>
 * marker_or   = marker_and ('or' marker_and)*
 * marker_and  = marker_expr ('and' marker_expr)*
 * marker_expr = marker_var marker_op marker_var | '(' marker_or ')'
 * </pre>
 */
final class MarkerParser {

    private static final Set<String> VARIABLES = new HashSet<>(Arrays.asList(
            "os_name", "sys_platform", "platform_machine", "platform_python_implementation", "platform_release",
            "platform_system", "platform_version", "python_version", "python_full_version", "implementation_name",
            "implementation_version", "extra",
            // Legacy names still found in old metadata
            "os.name", "sys.platform", "platform.version", "platform.machine", "platform.python_implementation", "python_implementation"));

    private static final String[] OPERATORS = {"===", "==", "!=", "<=", ">=", "~=", "<", ">"};

    @NotNull
    private final String text;
    private int pos;

    MarkerParser(@NotNull String text) {
        this.text = text;
    }

    @NotNull
    private MalformedRequirementException error(@NotNull String message) {
        int end = Math.min(this.text.length(), this.pos + 16);
        return new MalformedRequirementException(this.text, this.text.substring(Math.min(this.pos, this.text.length()), end), message);
    }

    private boolean acceptKeyword(@NotNull String keyword) {
        this.skipWhitespace();
        if (!this.text.startsWith(keyword, this.pos)) {
            return false;
        }
        int end = this.pos + keyword.length();
        if (end < this.text.length() && MarkerParser.isIdentifierPart(this.text.charAt(end))) {
            return false;
        }
        this.pos = end;
        return true;
    }

    private static boolean isIdentifierPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '.';
    }

    @NotNull
    Marker parse() {
        Marker marker = this.parseOr();
        this.skipWhitespace();
        if (this.pos != this.text.length()) {
            throw this.error("Unexpected trailing text in marker");
        }
        return marker;
    }

    @NotNull
    private Marker parseAnd() {
        List<Marker> children = new ArrayList<>();
        children.add(this.parseExpression());
        while (this.acceptKeyword("and")) {
            children.add(this.parseExpression());
        }
        return children.size() == 1 ? children.get(0) : new Marker.Junction(true, children);
    }

    @NotNull
    private Marker parseExpression() {
        this.skipWhitespace();
        if (this.pos < this.text.length() && this.text.charAt(this.pos) == '(') {
            this.pos++;
            Marker inner = this.parseOr();
            this.skipWhitespace();
            if (this.pos >= this.text.length() || this.text.charAt(this.pos) != ')') {
                throw this.error("Expected closing parenthesis in marker");
            }
            this.pos++;
            return inner;
        }
        Marker.Operand lhs = this.parseOperand();
        String operator = this.parseOperator();
        Marker.Operand rhs = this.parseOperand();
        return new Marker.Comparison(lhs, operator, rhs);
    }

    @NotNull
    private Marker.Operand parseOperand() {
        this.skipWhitespace();
        if (this.pos >= this.text.length()) {
            throw this.error("Expected a marker variable or a quoted string");
        }
        char c = this.text.charAt(this.pos);
        if (c == '\'' || c == '"') {
            int end = this.text.indexOf(c, this.pos + 1);
            if (end == -1) {
                throw this.error("Unterminated string in marker");
            }
            String literal = this.text.substring(this.pos + 1, end);
            this.pos = end + 1;
            return new Marker.Operand(literal, false);
        }
        int start = this.pos;
        while (this.pos < this.text.length() && MarkerParser.isIdentifierPart(this.text.charAt(this.pos))) {
            this.pos++;
        }
        if (start == this.pos) {
            throw this.error("Expected a marker variable or a quoted string");
        }
        String variable = this.text.substring(start, this.pos);
        if (!MarkerParser.VARIABLES.contains(variable)) {
            throw new UnsupportedMarkerException(variable, this.text);
        }
        return new Marker.Operand(variable, true);
    }

    @NotNull
    private String parseOperator() {
        this.skipWhitespace();
        for (String operator : MarkerParser.OPERATORS) {
            if (this.text.startsWith(operator, this.pos)) {
                this.pos += operator.length();
                return operator;
            }
        }
        if (this.acceptKeyword("in")) {
            return "in";
        }
        int start = this.pos;
        if (this.acceptKeyword("not")) {
            if (this.acceptKeyword("in")) {
                return "not in";
            }
            this.pos = start;
        }
        throw this.error("Expected a marker operator");
    }

    @NotNull
    private Marker parseOr() {
        List<Marker> children = new ArrayList<>();
        children.add(this.parseAnd());
        while (this.acceptKeyword("or")) {
            children.add(this.parseAnd());
        }
        return children.size() == 1 ? children.get(0) : new Marker.Junction(false, children);
    }

    private void skipWhitespace() {
        while (this.pos < this.text.length() && Character.isWhitespace(this.text.charAt(this.pos))) {
            this.pos++;
        }
    }
}
