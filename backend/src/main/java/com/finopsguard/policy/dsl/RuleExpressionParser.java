package com.finopsguard.policy.dsl;

import com.finopsguard.policy.expression.And;
import com.finopsguard.policy.expression.Expression;
import com.finopsguard.policy.expression.Operator;
import com.finopsguard.policy.expression.Or;
import com.finopsguard.policy.expression.PolicyExpressionException;
import com.finopsguard.policy.expression.Rule;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Recursive-descent parser for rule text.
 *
 * <pre>
 * expression := orExpr
 * orExpr     := andExpr (("or" | "||") andExpr)*
 * andExpr    := primary (("and" | "&amp;&amp;") primary)*
 * primary    := "(" expression ")" | field operator value
 * value      := string | number | true | false | word | "[" value ("," value)* "]"
 * </pre>
 *
 * {@code and} binds tighter than {@code or}. Chains of the same connective
 * are flattened into one node.
 */
public final class RuleExpressionParser {

    private static final Set<String> WORD_OPERATORS = Set.of("in", "contains", "starts_with", "ends_with");

    private final List<Token> tokens;
    private int position;

    private RuleExpressionParser(List<Token> tokens) {
        this.tokens = tokens;
    }

    /**
     * @throws PolicyExpressionException if the text is not a valid rule
     */
    public static Expression parse(String text) {
        if (text == null || text.isBlank()) {
            throw new PolicyExpressionException("Rule text must not be blank");
        }
        RuleExpressionParser parser = new RuleExpressionParser(tokenize(text));
        Expression expression = parser.parseOr();
        if (!parser.atEnd()) {
            throw new PolicyExpressionException("Unexpected '" + parser.peek().text() + "' in rule: " + text);
        }
        return expression;
    }

    private Expression parseOr() {
        List<Expression> children = new ArrayList<>();
        children.add(parseAnd());
        while (matchConnective("or", "||")) {
            children.add(parseAnd());
        }
        return children.size() == 1 ? children.get(0) : new Or(children);
    }

    private Expression parseAnd() {
        List<Expression> children = new ArrayList<>();
        children.add(parsePrimary());
        while (matchConnective("and", "&&")) {
            children.add(parsePrimary());
        }
        return children.size() == 1 ? children.get(0) : new And(children);
    }

    private Expression parsePrimary() {
        if (peekIs(TokenType.LPAREN)) {
            advance();
            Expression inner = parseOr();
            expect(TokenType.RPAREN, "')'");
            return inner;
        }
        Token field = expect(TokenType.WORD, "field name");
        Operator operator = parseOperator();
        return new Rule(field.text(), operator, parseValue());
    }

    private Operator parseOperator() {
        Token token = peek();
        if (token.type() == TokenType.OPERATOR
                || token.type() == TokenType.WORD && WORD_OPERATORS.contains(token.text().toLowerCase(Locale.ROOT))) {
            advance();
            return Operator.fromSymbol(token.text());
        }
        throw new PolicyExpressionException("Expected operator but found '" + token.text() + "'");
    }

    private Object parseValue() {
        Token token = advance();
        return switch (token.type()) {
            case STRING -> token.text();
            case NUMBER -> parseNumber(token.text());
            case WORD -> switch (token.text().toLowerCase(Locale.ROOT)) {
                case "true" -> Boolean.TRUE;
                case "false" -> Boolean.FALSE;
                default -> token.text();
            };
            case LBRACKET -> parseList();
            default -> throw new PolicyExpressionException("Expected value but found '" + token.text() + "'");
        };
    }

    private List<Object> parseList() {
        List<Object> values = new ArrayList<>();
        if (peekIs(TokenType.RBRACKET)) {
            advance();
            return values;
        }
        values.add(parseValue());
        while (peekIs(TokenType.COMMA)) {
            advance();
            values.add(parseValue());
        }
        expect(TokenType.RBRACKET, "']'");
        return values;
    }

    private static Number parseNumber(String text) {
        try {
            if (text.contains(".") || text.contains("e") || text.contains("E")) {
                return Double.parseDouble(text);
            }
            return Long.parseLong(text);
        } catch (NumberFormatException e) {
            throw new PolicyExpressionException("Invalid number: " + text, e);
        }
    }

    private boolean matchConnective(String word, String symbol) {
        Token token = peek();
        boolean matches = token.type() == TokenType.WORD && token.text().equalsIgnoreCase(word)
                || token.type() == TokenType.CONNECTIVE && token.text().equals(symbol);
        if (matches) {
            advance();
        }
        return matches;
    }

    private Token expect(TokenType type, String description) {
        Token token = advance();
        if (token.type() != type) {
            throw new PolicyExpressionException("Expected " + description + " but found '" + token.text() + "'");
        }
        return token;
    }

    private boolean peekIs(TokenType type) {
        return peek().type() == type;
    }

    private Token peek() {
        return tokens.get(position);
    }

    private Token advance() {
        Token token = tokens.get(position);
        if (token.type() != TokenType.EOF) {
            position++;
        }
        return token;
    }

    private boolean atEnd() {
        return peek().type() == TokenType.EOF;
    }

    enum TokenType {
        WORD, STRING, NUMBER, OPERATOR, CONNECTIVE, LPAREN, RPAREN, LBRACKET, RBRACKET, COMMA, EOF
    }

    record Token(TokenType type, String text) {}

    static List<Token> tokenize(String text) {
        List<Token> tokens = new ArrayList<>();
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (Character.isWhitespace(c)) {
                i++;
            } else if (c == '(' || c == ')' || c == '[' || c == ']' || c == ',') {
                tokens.add(new Token(punctuation(c), String.valueOf(c)));
                i++;
            } else if (c == '"' || c == '\'') {
                StringBuilder value = new StringBuilder();
                int end = readQuoted(text, i, value);
                tokens.add(new Token(TokenType.STRING, value.toString()));
                i = end;
            } else if (text.startsWith("&&", i) || text.startsWith("||", i)) {
                tokens.add(new Token(TokenType.CONNECTIVE, text.substring(i, i + 2)));
                i += 2;
            } else if (c == '=' || c == '!' || c == '<' || c == '>') {
                int length = i + 1 < text.length() && text.charAt(i + 1) == '=' ? 2 : 1;
                String symbol = text.substring(i, i + length);
                if (symbol.equals("!")) {
                    throw new PolicyExpressionException("Unexpected '!' at position " + i);
                }
                tokens.add(new Token(TokenType.OPERATOR, symbol.equals("=") ? "==" : symbol));
                i += length;
            } else if (Character.isDigit(c) || c == '-' && i + 1 < text.length() && Character.isDigit(text.charAt(i + 1))) {
                int start = i++;
                while (i < text.length() && (Character.isDigit(text.charAt(i)) || ".eE".indexOf(text.charAt(i)) >= 0)) {
                    i++;
                }
                tokens.add(new Token(TokenType.NUMBER, text.substring(start, i)));
            } else if (Character.isLetter(c) || c == '_') {
                int start = i;
                while (i < text.length() && isWordChar(text.charAt(i))) {
                    i++;
                }
                tokens.add(new Token(TokenType.WORD, text.substring(start, i)));
            } else {
                throw new PolicyExpressionException("Unexpected character '" + c + "' at position " + i);
            }
        }
        tokens.add(new Token(TokenType.EOF, "<end>"));
        return tokens;
    }

    private static boolean isWordChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '.' || c == '-' || c == '/' || c == ':';
    }

    private static TokenType punctuation(char c) {
        return switch (c) {
            case '(' -> TokenType.LPAREN;
            case ')' -> TokenType.RPAREN;
            case '[' -> TokenType.LBRACKET;
            case ']' -> TokenType.RBRACKET;
            default -> TokenType.COMMA;
        };
    }

    /**
     * Reads a quoted string starting at {@code start} into {@code out}.
     *
     * @return index just past the closing quote
     */
    static int readQuoted(String text, int start, StringBuilder out) {
        char quote = text.charAt(start);
        int i = start + 1;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c == '\\' && i + 1 < text.length()) {
                out.append(text.charAt(i + 1));
                i += 2;
            } else if (c == quote) {
                return i + 1;
            } else {
                out.append(c);
                i++;
            }
        }
        throw new PolicyExpressionException("Unterminated string starting at position " + start);
    }
}
