package com.finopsguard.parser.terraform;

import com.finopsguard.parser.ParseException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads the block structure of Terraform configuration text.
 *
 * This is not an HCL evaluator. It understands blocks, attributes, quoted
 * strings, heredocs, object and tuple literals and comments; every other
 * expression is kept verbatim as an {@link HclExpression}. Braces inside
 * strings and comments do not count towards block nesting.
 *
 * A block left open at end of input raises {@link ParseException} naming
 * the resource being read; a stray closing brace names the block before it.
 */
public class HclReader {

    private final String text;
    private int pos;

    public HclReader(String text) {
        this.text = text;
    }

    public List<HclBlock> readBlocks() {
        pos = 0;
        List<HclBlock> blocks = new ArrayList<>();
        Map<String, Object> topLevelAttributes = new LinkedHashMap<>();
        readBody(blocks, topLevelAttributes, null, true);
        return blocks;
    }

    private void readBody(List<HclBlock> blocks, Map<String, Object> attributes, String context, boolean topLevel) {
        while (true) {
            skipWhitespaceAndComments(true);
            if (pos >= text.length()) {
                if (!topLevel) {
                    throw new ParseException("Unbalanced braces: block is not closed", context);
                }
                return;
            }
            char c = text.charAt(pos);
            if (c == '}') {
                if (topLevel) {
                    throw new ParseException("Unexpected '}' at offset " + pos, lastBlockContext(blocks));
                }
                pos++;
                return;
            }
            if (!isIdentifierStart(c) && c != '"') {
                // Stray token; skip to the next line rather than fail on syntax we do not model.
                skipLine();
                continue;
            }
            String identifier = c == '"' ? readQuotedString(context) : readIdentifier();
            skipWhitespaceAndComments(false);
            if (pos < text.length() && (text.charAt(pos) == '=' || text.charAt(pos) == ':')
                    && !text.startsWith("==", pos)) {
                pos++;
                attributes.put(identifier, readValue(context, false));
            } else {
                blocks.add(readBlock(identifier, context));
            }
        }
    }

    private HclBlock readBlock(String type, String outerContext) {
        List<String> labels = new ArrayList<>();
        while (true) {
            skipWhitespaceAndComments(true);
            if (pos >= text.length()) {
                throw new ParseException("Unexpected end of input after block type '" + type + "'",
                        outerContext != null ? outerContext : type);
            }
            char c = text.charAt(pos);
            if (c == '{') {
                pos++;
                break;
            }
            if (c == '"') {
                labels.add(readQuotedString(outerContext));
            } else if (isIdentifierStart(c)) {
                labels.add(readIdentifier());
            } else {
                throw new ParseException("Unexpected character '" + c + "' in block header", outerContext);
            }
        }
        String context = outerContext != null ? outerContext : blockContext(type, labels);
        Map<String, Object> attributes = new LinkedHashMap<>();
        List<HclBlock> nested = new ArrayList<>();
        readBody(nested, attributes, context, false);
        return new HclBlock(type, List.copyOf(labels), attributes, nested);
    }

    /**
     * Context of the block read just before a stray closing brace, or null at the start of input.
     */
    private static String lastBlockContext(List<HclBlock> blocks) {
        if (blocks.isEmpty()) {
            return null;
        }
        HclBlock last = blocks.get(blocks.size() - 1);
        return blockContext(last.type(), last.labels());
    }

    private static String blockContext(String type, List<String> labels) {
        if ("resource".equals(type) && labels.size() >= 2) {
            return labels.get(0) + "." + labels.get(1);
        }
        return labels.isEmpty() ? type : type + "." + String.join(".", labels);
    }

    /**
     * Reads one attribute value. Inside collections the value also ends at
     * a comma or the closing bracket.
     */
    private Object readValue(String context, boolean inCollection) {
        skipWhitespaceAndComments(false);
        if (pos >= text.length()) {
            throw new ParseException("Missing attribute value", context);
        }
        char c = text.charAt(pos);
        int start = pos;
        if (c == '"') {
            String s = readQuotedString(context);
            if (!continuesExpression()) {
                return s;
            }
            pos = start;
            return new HclExpression(readExpression(context, inCollection).trim());
        }
        if (c == '{') {
            pos++;
            Map<String, Object> object = readObject(context);
            if (object != null) {
                return object;
            }
            // for-expression or computed keys: keep the whole literal as an expression
            pos = start;
            return new HclExpression(readExpression(context, inCollection).trim());
        }
        if (c == '[') {
            pos++;
            return readTuple(context);
        }
        if (text.startsWith("<<", pos)) {
            return readHeredoc(context);
        }
        return literalOrExpression(readExpression(context, inCollection).trim());
    }

    /**
     * True when an operator follows a string literal, making it part of a larger expression.
     */
    private boolean continuesExpression() {
        int p = pos;
        while (p < text.length() && (text.charAt(p) == ' ' || text.charAt(p) == '\t')) {
            p++;
        }
        if (p >= text.length() || text.startsWith("//", p)) {
            return false;
        }
        return "?:=!<>&|+-*/%.[".indexOf(text.charAt(p)) >= 0;
    }

    /**
     * True when the text at {@code p} (after whitespace) begins a new
     * {@code name = value} attribute on the same line.
     */
    private boolean startsNewAttribute(int p) {
        while (p < text.length() && (text.charAt(p) == ' ' || text.charAt(p) == '\t')) {
            p++;
        }
        if (p >= text.length() || !isIdentifierStart(text.charAt(p))) {
            return false;
        }
        while (p < text.length() && isIdentifierPart(text.charAt(p))) {
            p++;
        }
        while (p < text.length() && (text.charAt(p) == ' ' || text.charAt(p) == '\t')) {
            p++;
        }
        return p + 1 < text.length() && text.charAt(p) == '='
                && text.charAt(p + 1) != '=' && text.charAt(p + 1) != '>';
    }

    /**
     * Reads an object literal, or returns null when its keys are not plain
     * names (for-expressions, computed keys).
     */
    private Map<String, Object> readObject(String context) {
        Map<String, Object> map = new LinkedHashMap<>();
        while (true) {
            skipSeparators();
            if (pos >= text.length()) {
                throw new ParseException("Unbalanced braces: object is not closed", context);
            }
            char c = text.charAt(pos);
            if (c == '}') {
                pos++;
                return map;
            }
            String key;
            if (c == '"') {
                key = readQuotedString(context);
            } else if (isIdentifierStart(c)) {
                key = readIdentifier();
            } else {
                return null;
            }
            skipWhitespaceAndComments(false);
            if (pos + 1 < text.length() && (text.charAt(pos) == '=' || text.charAt(pos) == ':')
                    && text.charAt(pos + 1) != '>') {
                pos++;
                map.put(key, readValue(context, true));
            } else {
                return null;
            }
        }
    }

    private List<Object> readTuple(String context) {
        List<Object> list = new ArrayList<>();
        while (true) {
            skipSeparators();
            if (pos >= text.length()) {
                throw new ParseException("Unbalanced brackets: list is not closed", context);
            }
            if (text.charAt(pos) == ']') {
                pos++;
                return list;
            }
            list.add(readValue(context, true));
        }
    }

    private String readHeredoc(String context) {
        pos += 2;
        if (pos < text.length() && text.charAt(pos) == '-') {
            pos++;
        }
        int lineEnd = text.indexOf('\n', pos);
        if (lineEnd < 0) {
            throw new ParseException("Heredoc is not terminated", context);
        }
        String marker = text.substring(pos, lineEnd).trim();
        pos = lineEnd + 1;
        StringBuilder body = new StringBuilder();
        while (pos < text.length()) {
            int end = text.indexOf('\n', pos);
            String line = end < 0 ? text.substring(pos) : text.substring(pos, end);
            pos = end < 0 ? text.length() : end + 1;
            if (line.trim().equals(marker)) {
                return body.toString();
            }
            body.append(line).append('\n');
        }
        throw new ParseException("Heredoc '" + marker + "' is not terminated", context);
    }

    /**
     * Raw expression text up to the end of the line, keeping nested brackets
     * and strings intact.
     */
    private String readExpression(String context, boolean inCollection) {
        int start = pos;
        int depth = 0;
        while (pos < text.length()) {
            char c = text.charAt(pos);
            if (c == '"') {
                readQuotedString(context);
                continue;
            }
            if (c == '(' || c == '[' || c == '{') {
                depth++;
            } else if (c == ')' || c == ']' || c == '}') {
                if (depth == 0) {
                    if (inCollection) {
                        break;
                    }
                    if (c == '}') {
                        // closing brace of the enclosing block on the same line
                        break;
                    }
                } else {
                    depth--;
                }
            } else if (depth == 0 && (c == '\n' || c == '#' || text.startsWith("//", pos))) {
                break;
            } else if (depth == 0 && inCollection && c == ',') {
                break;
            } else if (depth == 0 && (c == ' ' || c == '\t') && startsNewAttribute(pos)) {
                break;
            }
            pos++;
        }
        if (depth > 0) {
            throw new ParseException("Unbalanced brackets in expression", context);
        }
        return text.substring(start, pos);
    }

    private static Object literalOrExpression(String raw) {
        if (raw.equals("true") || raw.equals("false")) {
            return Boolean.parseBoolean(raw);
        }
        if (raw.equals("null")) {
            return new HclExpression(raw);
        }
        if (raw.matches("-?\\d+")) {
            try {
                return Long.parseLong(raw);
            } catch (NumberFormatException e) {
                return new HclExpression(raw);
            }
        }
        if (raw.matches("-?\\d+\\.\\d+")) {
            return Double.parseDouble(raw);
        }
        return new HclExpression(raw);
    }

    private String readQuotedString(String context) {
        int start = pos;
        pos++;
        StringBuilder sb = new StringBuilder();
        int interpolationDepth = 0;
        while (pos < text.length()) {
            char c = text.charAt(pos);
            if (c == '\\' && pos + 1 < text.length()) {
                char next = text.charAt(pos + 1);
                sb.append(switch (next) {
                    case 'n' -> '\n';
                    case 't' -> '\t';
                    default -> next;
                });
                pos += 2;
                continue;
            }
            if (c == '$' && pos + 1 < text.length() && text.charAt(pos + 1) == '{') {
                interpolationDepth++;
                sb.append("${");
                pos += 2;
                continue;
            }
            if (interpolationDepth > 0 && c == '}') {
                interpolationDepth--;
            } else if (interpolationDepth == 0 && c == '"') {
                pos++;
                return sb.toString();
            } else if (c == '\n' && interpolationDepth == 0) {
                break;
            }
            sb.append(c);
            pos++;
        }
        throw new ParseException("Unterminated string starting at offset " + start, context);
    }

    private String readIdentifier() {
        int start = pos;
        while (pos < text.length() && isIdentifierPart(text.charAt(pos))) {
            pos++;
        }
        return text.substring(start, pos);
    }

    private void skipSeparators() {
        while (true) {
            skipWhitespaceAndComments(true);
            if (pos < text.length() && text.charAt(pos) == ',') {
                pos++;
            } else {
                return;
            }
        }
    }

    private void skipWhitespaceAndComments(boolean newlines) {
        while (pos < text.length()) {
            char c = text.charAt(pos);
            if (c == ' ' || c == '\t' || c == '\r' || (newlines && c == '\n')) {
                pos++;
            } else if (newlines && (c == '#' || text.startsWith("//", pos))) {
                skipLine();
            } else if (text.startsWith("/*", pos)) {
                int end = text.indexOf("*/", pos + 2);
                pos = end < 0 ? text.length() : end + 2;
            } else {
                return;
            }
        }
    }

    private void skipLine() {
        int end = text.indexOf('\n', pos);
        pos = end < 0 ? text.length() : end + 1;
    }

    private static boolean isIdentifierStart(char c) {
        return Character.isLetter(c) || c == '_';
    }

    private static boolean isIdentifierPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '-' || c == '.';
    }
}
