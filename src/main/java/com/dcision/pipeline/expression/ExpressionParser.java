package com.dcision.pipeline.expression;

import java.util.ArrayList;
import java.util.List;

/**
 * Recursive-descent parser for the restricted algebraic grammar used in constraints and
 * objectives:
 *
 * <pre>
 * relation := expr op expr          op: &lt;= &gt;= = &lt; &gt;
 * expr     := term (("+" | "-") term)*
 * term     := unary (("*" | "/") unary)*
 * unary    := ("+" | "-") unary | primary
 * primary  := NUMBER | IDENTIFIER | "(" expr ")"
 * </pre>
 *
 * A number directly followed by an identifier or a parenthesis is read as a product
 * ({@code 45x1} is {@code 45*x1}). Unicode operators are normalized before lexing.
 * Instances are not thread-safe; use the static entry points.
 */
public final class ExpressionParser {

    private enum TokenType { NUMBER, IDENTIFIER, PLUS, MINUS, STAR, SLASH, LPAREN, RPAREN, RELATION, END }

    private static final class Token {
        final TokenType type;
        final String text;
        final int position;

        Token(TokenType type, String text, int position) {
            this.type = type;
            this.text = text;
            this.position = position;
        }
    }

    private final String source;
    private final List<Token> tokens;
    private int index;

    private ExpressionParser(String source) {
        this.source = source;
        this.tokens = tokenize(source);
    }

    public static Relation parseRelation(String text) {
        ExpressionParser parser = new ExpressionParser(normalize(text));
        Expression left = parser.expression();
        Token op = parser.expect(TokenType.RELATION, "comparison operator");
        Expression right = parser.expression();
        parser.expect(TokenType.END, "end of expression");
        return new Relation(left, toOperator(op.text), right);
    }

    public static Expression parseExpression(String text) {
        ExpressionParser parser = new ExpressionParser(normalize(text));
        Expression expression = parser.expression();
        parser.expect(TokenType.END, "end of expression");
        return expression;
    }

    static String normalize(String text) {
        if (text == null || text.isBlank()) {
            throw new ExpressionException("empty expression");
        }
        return text.replace("≤", "<=")
                .replace("≥", ">=")
                .replace("−", "-")
                .replace("×", "*")
                .replace("·", "*")
                .replace("==", "=")
                .trim();
    }

    private Expression expression() {
        Expression result = term();
        while (peek().type == TokenType.PLUS || peek().type == TokenType.MINUS) {
            BinaryOp.Operator op = next().type == TokenType.PLUS ? BinaryOp.Operator.ADD : BinaryOp.Operator.SUBTRACT;
            result = new BinaryOp(op, result, term());
        }
        return result;
    }

    private Expression term() {
        Expression result = unary();
        while (true) {
            TokenType type = peek().type;
            if (type == TokenType.STAR || type == TokenType.SLASH) {
                next();
                BinaryOp.Operator op = type == TokenType.STAR ? BinaryOp.Operator.MULTIPLY : BinaryOp.Operator.DIVIDE;
                result = new BinaryOp(op, result, unary());
            } else if (result instanceof NumberLiteral
                    && (type == TokenType.IDENTIFIER || type == TokenType.LPAREN)) {
                result = new BinaryOp(BinaryOp.Operator.MULTIPLY, result, unary());
            } else {
                return result;
            }
        }
    }

    private Expression unary() {
        TokenType type = peek().type;
        if (type == TokenType.MINUS) {
            next();
            return new Negation(unary());
        }
        if (type == TokenType.PLUS) {
            next();
            return unary();
        }
        return primary();
    }

    private Expression primary() {
        Token token = next();
        switch (token.type) {
            case NUMBER -> {
                return new NumberLiteral(Double.parseDouble(token.text));
            }
            case IDENTIFIER -> {
                return new VariableRef(token.text);
            }
            case LPAREN -> {
                Expression inner = expression();
                expect(TokenType.RPAREN, "')'");
                return inner;
            }
            default -> throw error(token, "number, identifier or '('");
        }
    }

    private Token peek() {
        return tokens.get(index);
    }

    private Token next() {
        Token token = tokens.get(index);
        if (token.type != TokenType.END) {
            index++;
        }
        return token;
    }

    private Token expect(TokenType type, String description) {
        Token token = next();
        if (token.type != type) {
            throw error(token, description);
        }
        return token;
    }

    private ExpressionException error(Token token, String expected) {
        String found = token.type == TokenType.END ? "end of input" : "'" + token.text + "'";
        return new ExpressionException("expected " + expected + " but found " + found
                + " at position " + token.position + " in \"" + source + "\"");
    }

    private static RelationOperator toOperator(String symbol) {
        return switch (symbol) {
            case "<=" -> RelationOperator.LESS_OR_EQUAL;
            case ">=" -> RelationOperator.GREATER_OR_EQUAL;
            case "=" -> RelationOperator.EQUAL;
            case "<" -> RelationOperator.LESS;
            case ">" -> RelationOperator.GREATER;
            default -> throw new ExpressionException("unknown comparison operator '" + symbol + "'");
        };
    }

    private static List<Token> tokenize(String s) {
        List<Token> out = new ArrayList<>();
        int i = 0;
        while (i < s.length()) {
            char c = s.charAt(i);
            if (Character.isWhitespace(c)) {
                i++;
            } else if (Character.isDigit(c) || (c == '.' && i + 1 < s.length() && Character.isDigit(s.charAt(i + 1)))) {
                int start = i;
                while (i < s.length() && (Character.isDigit(s.charAt(i)) || s.charAt(i) == '.')) {
                    i++;
                }
                if (i < s.length() && (s.charAt(i) == 'e' || s.charAt(i) == 'E')) {
                    int exp = i + 1;
                    if (exp < s.length() && (s.charAt(exp) == '+' || s.charAt(exp) == '-')) {
                        exp++;
                    }
                    if (exp < s.length() && Character.isDigit(s.charAt(exp))) {
                        i = exp;
                        while (i < s.length() && Character.isDigit(s.charAt(i))) {
                            i++;
                        }
                    }
                }
                String number = s.substring(start, i);
                if (number.indexOf('.') != number.lastIndexOf('.')) {
                    throw new ExpressionException("malformed number '" + number + "' at position " + start);
                }
                if (!Double.isFinite(Double.parseDouble(number))) {
                    throw new ExpressionException("number '" + number + "' at position " + start + " is out of range");
                }
                out.add(new Token(TokenType.NUMBER, number, start));
            } else if (Character.isLetter(c) || c == '_') {
                int start = i;
                while (i < s.length() && (Character.isLetterOrDigit(s.charAt(i)) || s.charAt(i) == '_')) {
                    i++;
                }
                out.add(new Token(TokenType.IDENTIFIER, s.substring(start, i), start));
            } else if (c == '<' || c == '>') {
                boolean withEquals = i + 1 < s.length() && s.charAt(i + 1) == '=';
                out.add(new Token(TokenType.RELATION, withEquals ? c + "=" : String.valueOf(c), i));
                i += withEquals ? 2 : 1;
            } else {
                TokenType type = switch (c) {
                    case '+' -> TokenType.PLUS;
                    case '-' -> TokenType.MINUS;
                    case '*' -> TokenType.STAR;
                    case '/' -> TokenType.SLASH;
                    case '(' -> TokenType.LPAREN;
                    case ')' -> TokenType.RPAREN;
                    case '=' -> TokenType.RELATION;
                    default -> throw new ExpressionException("unexpected character '" + c + "' at position " + i);
                };
                out.add(new Token(type, String.valueOf(c), i));
                i++;
            }
        }
        out.add(new Token(TokenType.END, "", s.length()));
        return out;
    }
}
