package com.finopsguard.policy.dsl;

import com.finopsguard.policy.Policy;
import com.finopsguard.policy.ViolationMode;
import com.finopsguard.policy.expression.PolicyExpressionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Parses policy definitions written in the policy DSL.
 *
 * <pre>
 * policy "No GPU in dev" {
 *   on_violation = "block"
 *   rule = "resource.type == 'aws_gpu_instance' and environment == 'dev'"
 * }
 *
 * policy "team budget" { budget = 500 }
 * </pre>
 *
 * Attributes are {@code id}, {@code description}, {@code budget},
 * {@code on_violation}, {@code enabled} and {@code rule}; {@code :} may be
 * used instead of {@code =}. The id defaults to the name in snake case and
 * violations default to advisory. {@code #} and {@code //} start comments.
 */
@Component
@Slf4j
public class PolicyDslParser {

    private static final Set<String> ATTRIBUTES =
            Set.of("id", "description", "budget", "on_violation", "enabled", "rule");

    /**
     * @throws PolicyExpressionException if the text is not valid DSL or a rule does not parse
     */
    public List<Policy> parse(String text) {
        if (text == null || text.isBlank()) {
            throw new PolicyExpressionException("Policy DSL must not be blank");
        }
        Cursor cursor = new Cursor(tokenize(text));
        List<Policy> policies = new ArrayList<>();
        Set<String> ids = new LinkedHashSet<>();
        while (!cursor.atEnd()) {
            Policy policy = parsePolicy(cursor);
            if (!ids.add(policy.getId())) {
                throw new PolicyExpressionException("Duplicate policy id in DSL: " + policy.getId());
            }
            policies.add(policy);
        }
        log.debug("Parsed {} policies from DSL", policies.size());
        return policies;
    }

    /**
     * Parses text that must contain exactly one policy.
     */
    public Policy parseSingle(String text) {
        List<Policy> policies = parse(text);
        if (policies.size() != 1) {
            throw new PolicyExpressionException("Expected exactly one policy but found " + policies.size());
        }
        return policies.get(0);
    }

    private Policy parsePolicy(Cursor cursor) {
        Token keyword = cursor.next();
        if (keyword.type() != TokenType.WORD || !keyword.text().equals("policy")) {
            throw new PolicyExpressionException("Expected 'policy' but found '" + keyword.text() + "'");
        }
        Token name = cursor.expect(TokenType.STRING, "policy name");
        cursor.expect(TokenType.LBRACE, "'{'");

        Policy.PolicyBuilder builder = Policy.builder().name(name.text()).id(toId(name.text()));
        Set<String> seen = new LinkedHashSet<>();
        while (cursor.peek().type() != TokenType.RBRACE) {
            Token key = cursor.expect(TokenType.WORD, "attribute name");
            String attribute = key.text().toLowerCase(Locale.ROOT);
            if (!ATTRIBUTES.contains(attribute)) {
                throw new PolicyExpressionException("Unknown policy attribute '" + key.text() + "' in '" + name.text() + "'");
            }
            if (!seen.add(attribute)) {
                throw new PolicyExpressionException("Duplicate attribute '" + attribute + "' in '" + name.text() + "'");
            }
            cursor.expect(TokenType.ASSIGN, "'=' after " + attribute);
            apply(builder, attribute, cursor.next(), name.text());
            if (cursor.peek().type() == TokenType.SEPARATOR) {
                cursor.next();
            }
        }
        cursor.expect(TokenType.RBRACE, "'}'");

        Policy policy = builder.build();
        policy.validate();
        return policy;
    }

    private static void apply(Policy.PolicyBuilder builder, String attribute, Token value, String policyName) {
        switch (attribute) {
            case "id" -> builder.id(scalar(value, attribute));
            case "description" -> builder.description(scalar(value, attribute));
            case "budget" -> builder.budget(number(value, policyName));
            case "on_violation" -> builder.onViolation(violationMode(value, policyName));
            case "enabled" -> builder.enabled(Boolean.parseBoolean(scalar(value, attribute)));
            case "rule" -> builder.expression(RuleExpressionParser.parse(scalar(value, attribute)));
            default -> throw new PolicyExpressionException("Unknown policy attribute '" + attribute + "'");
        }
    }

    private static String scalar(Token value, String attribute) {
        if (value.type() != TokenType.STRING && value.type() != TokenType.WORD && value.type() != TokenType.NUMBER) {
            throw new PolicyExpressionException("Expected a value for '" + attribute + "' but found '" + value.text() + "'");
        }
        return value.text();
    }

    private static double number(Token value, String policyName) {
        try {
            return Double.parseDouble(scalar(value, "budget"));
        } catch (NumberFormatException e) {
            throw new PolicyExpressionException("Budget of '" + policyName + "' is not a number: " + value.text(), e);
        }
    }

    private static ViolationMode violationMode(Token value, String policyName) {
        try {
            return ViolationMode.fromValue(scalar(value, "on_violation"));
        } catch (IllegalArgumentException e) {
            throw new PolicyExpressionException("Invalid on_violation in '" + policyName + "': " + value.text(), e);
        }
    }

    static String toId(String name) {
        String id = name.trim().toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", "_").replaceAll("^_+|_+$", "");
        return id.isEmpty() ? "unnamed_policy" : id;
    }

    enum TokenType {
        WORD, STRING, NUMBER, LBRACE, RBRACE, ASSIGN, SEPARATOR, EOF
    }

    record Token(TokenType type, String text) {}

    static List<Token> tokenize(String text) {
        List<Token> tokens = new ArrayList<>();
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (Character.isWhitespace(c)) {
                i++;
            } else if (c == '#' || text.startsWith("//", i)) {
                while (i < text.length() && text.charAt(i) != '\n') {
                    i++;
                }
            } else if (c == '{') {
                tokens.add(new Token(TokenType.LBRACE, "{"));
                i++;
            } else if (c == '}') {
                tokens.add(new Token(TokenType.RBRACE, "}"));
                i++;
            } else if (c == '=' || c == ':') {
                tokens.add(new Token(TokenType.ASSIGN, String.valueOf(c)));
                i++;
            } else if (c == ',' || c == ';') {
                tokens.add(new Token(TokenType.SEPARATOR, String.valueOf(c)));
                i++;
            } else if (c == '"' || c == '\'') {
                StringBuilder value = new StringBuilder();
                i = RuleExpressionParser.readQuoted(text, i, value);
                tokens.add(new Token(TokenType.STRING, value.toString()));
            } else if (Character.isDigit(c) || c == '-' || c == '.') {
                int start = i++;
                while (i < text.length() && (Character.isDigit(text.charAt(i)) || text.charAt(i) == '.')) {
                    i++;
                }
                tokens.add(new Token(TokenType.NUMBER, text.substring(start, i)));
            } else if (Character.isLetter(c) || c == '_') {
                int start = i;
                while (i < text.length() && (Character.isLetterOrDigit(text.charAt(i)) || text.charAt(i) == '_')) {
                    i++;
                }
                tokens.add(new Token(TokenType.WORD, text.substring(start, i)));
            } else {
                throw new PolicyExpressionException("Unexpected character '" + c + "' in policy DSL");
            }
        }
        tokens.add(new Token(TokenType.EOF, "<end>"));
        return tokens;
    }

    private static final class Cursor {

        private final List<Token> tokens;
        private int position;

        Cursor(List<Token> tokens) {
            this.tokens = tokens;
        }

        Token peek() {
            return tokens.get(position);
        }

        Token next() {
            Token token = tokens.get(position);
            if (token.type() != TokenType.EOF) {
                position++;
            }
            return token;
        }

        Token expect(TokenType type, String description) {
            Token token = next();
            if (token.type() != type) {
                throw new PolicyExpressionException("Expected " + description + " but found '" + token.text() + "'");
            }
            return token;
        }

        boolean atEnd() {
            return peek().type() == TokenType.EOF;
        }
    }
}
