package com.gate.exception;

/**
 * Exception thrown when a raw condition expression cannot be parsed.
 * <p>
 * Parse errors are never recovered internally. Callers decide whether to keep the
 * input as an opaque literal, abort compilation, or report it to the workflow author.
 */
public class ExpressionParseException extends GateException {

    private final ParseErrorKind kind;
    private final String token;
    private final int position;
    private final String input;

    public ExpressionParseException(ParseErrorKind kind, String message, String token, int position, String input) {
        super(message);
        this.kind = kind;
        this.token = token;
        this.position = position;
        this.input = input;
    }

    public static ExpressionParseException emptyExpression(String input) {
        return new ExpressionParseException(ParseErrorKind.EMPTY_EXPRESSION,
                "empty expression", "", -1, input);
    }

    public static ExpressionParseException unexpectedToken(String token, int position, String input) {
        return new ExpressionParseException(ParseErrorKind.UNEXPECTED_TOKEN,
                "unexpected token '" + token + "' at position " + position, token, position, input);
    }

    public static ExpressionParseException missingClosingParen(String token, int position, String input) {
        return new ExpressionParseException(ParseErrorKind.MISSING_CLOSING_PAREN,
                "expected ')' at position " + position, token, position, input);
    }

    public static ExpressionParseException emptyLiteral(int position, String input) {
        return new ExpressionParseException(ParseErrorKind.EMPTY_LITERAL,
                "unexpected empty literal at position " + position, "", position, input);
    }

    public ParseErrorKind getKind() {
        return kind;
    }

    /**
     * Text of the offending token, empty when the error is not tied to a token.
     */
    public String getToken() {
        return token;
    }

    /**
     * Character offset of the offending token, or -1.
     */
    public int getPosition() {
        return position;
    }

    public String getInput() {
        return input;
    }
}
