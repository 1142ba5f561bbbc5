package org.contractexpr.compiler.frontend.lexer;

import org.contractexpr.compiler.api.CompilerErrorCode;
import org.contractexpr.compiler.diagnostics.DiagnosticsEngine;
import org.contractexpr.compiler.internal.i18n.Messages;

import java.util.ArrayList;
import java.util.List;

/**
 * The Lexer (also known as Tokenizer or Scanner) is responsible for converting
 * a sequence of characters (source code) into a sequence of tokens.
 * <p>
 * Whitespace and comments ({@code //}, {@code /* *}{@code /}) are skipped. Keywords are
 * not distinguished from identifiers here; the parsers classify them by lookahead.
 */
public class Lexer {

    /** Operators ordered longest first so that the first prefix match wins. */
    private static final String[] OPERATORS = {
            ">>>=",
            "<<=", ">>=", ">>>",
            "==", "!=", "<=", ">=", "&&", "||", "++", "--", "+=", "-=", "*=", "/=", "%=",
            "&=", "|=", "^=", "~=", "<<", ">>", "=>", "..",
            "!", "<", ">", "+", "-", "*", "/", "%", "&", "|", "^", "~", "=", "?", ":", ".", "$", "@"
    };

    private final String source;
    private final DiagnosticsEngine diagnostics;
    private final List<Token> tokens = new ArrayList<>();
    private final String logicalFileName;
    private int start = 0;
    private int startColumn = 1;
    private int current = 0;
    private int line = 1;
    private int column = 1;

    /**
     * Creates a new Lexer.
     * @param source The source code as a single string.
     * @param diagnostics The engine for reporting errors.
     */
    public Lexer(String source, DiagnosticsEngine diagnostics) {
        this(source, diagnostics, "<memory>");
    }

    /**
     * Creates a new Lexer with an explicit logical file name.
     * @param source The source code as a single string.
     * @param diagnostics The engine for reporting errors.
     * @param logicalFileName The name of the file being lexed, for error reporting.
     */
    public Lexer(String source, DiagnosticsEngine diagnostics, String logicalFileName) {
        this.source = source;
        this.diagnostics = diagnostics;
        this.logicalFileName = logicalFileName;
    }

    /**
     * Performs the tokenization of the entire source code.
     * @return A list of the recognized tokens, always terminated by {@link TokenType#END_OF_FILE}.
     */
    public List<Token> scanTokens() {
        while (!isAtEnd()) {
            start = current;
            startColumn = column;
            scanToken();
        }
        tokens.add(new Token(TokenType.END_OF_FILE, "", null, line, column, logicalFileName));
        return tokens;
    }

    private void scanToken() {
        char c = advance();
        switch (c) {
            case '(': addToken(TokenType.LEFT_PAREN); break;
            case ')': addToken(TokenType.RIGHT_PAREN); break;
            case '{': addToken(TokenType.LEFT_BRACE); break;
            case '}': addToken(TokenType.RIGHT_BRACE); break;
            case '[': addToken(TokenType.LEFT_BRACKET); break;
            case ']': addToken(TokenType.RIGHT_BRACKET); break;
            case ',': addToken(TokenType.COMMA); break;
            case ';': addToken(TokenType.SEMICOLON); break;
            case '"': string(); break;
            case '\'': character(); break;
            case ' ', '\r', '\t':
                break;
            case '\n':
                newLine();
                break;
            case '/':
                if (peek() == '/') {
                    // A line comment goes until the end of the line.
                    while (peek() != '\n' && !isAtEnd()) advance();
                } else if (peek() == '*') {
                    blockComment();
                } else {
                    operator();
                }
                break;
            default:
                if (isDigit(c)) {
                    number();
                } else if (isAlpha(c)) {
                    identifier();
                } else if (isOperatorStart(c)) {
                    operator();
                } else {
                    diagnostics.reportError(CompilerErrorCode.UNEXPECTED_CHARACTER,
                            Messages.get("lexer.unexpectedCharacter", String.valueOf(c)),
                            logicalFileName, line, startColumn);
                }
                break;
        }
    }

    private void identifier() {
        while (isAlphaNumeric(peek())) advance();
        addToken(TokenType.IDENTIFIER);
    }

    private void operator() {
        for (String op : OPERATORS) {
            if (source.startsWith(op, start)) {
                // The first character was already consumed by scanToken.
                for (int i = 1; i < op.length(); i++) advance();
                addToken(TokenType.OPERATOR);
                return;
            }
        }
        diagnostics.reportError(CompilerErrorCode.UNEXPECTED_CHARACTER,
                Messages.get("lexer.unexpectedCharacter", String.valueOf(source.charAt(start))),
                logicalFileName, line, startColumn);
    }

    private void number() {
        boolean floating = false;
        if (previous() == '0' && (peek() == 'x' || peek() == 'X' || peek() == 'b' || peek() == 'B')) {
            advance(); // consume 'x' or 'b'
            while (isHexDigit(peek()) || peek() == '_') advance();
        } else {
            while (isDigit(peek()) || peek() == '_') advance();
            if (peek() == '.' && isDigit(peekNext())) {
                floating = true;
                advance(); // consume the '.'
                while (isDigit(peek()) || peek() == '_') advance();
            }
        }
        // Type suffixes such as 10L, 10u or 1.5f are kept in the text.
        while (peek() == 'L' || peek() == 'u' || peek() == 'U' || peek() == 'f' || peek() == 'F') advance();

        String numberString = source.substring(start, current);
        try {
            Object value = floating ? (Object) parseDouble(numberString) : (Object) parseLong(numberString);
            addToken(TokenType.NUMBER, value);
        } catch (NumberFormatException e) {
            diagnostics.reportError(CompilerErrorCode.UNEXPECTED_CHARACTER,
                    Messages.get("lexer.invalidNumber", numberString), logicalFileName, line, startColumn);
        }
    }

    private long parseLong(String token) {
        String s = stripSuffix(token).replace("_", "");
        int radix = 10;
        if (s.startsWith("0b") || s.startsWith("0B")) {
            radix = 2;
            s = s.substring(2);
        } else if (s.startsWith("0x") || s.startsWith("0X")) {
            radix = 16;
            s = s.substring(2);
        }
        if (s.isEmpty()) throw new NumberFormatException("Empty numeric literal");
        return Long.parseUnsignedLong(s, radix);
    }

    private double parseDouble(String token) {
        return Double.parseDouble(stripSuffix(token).replace("_", ""));
    }

    private static String stripSuffix(String token) {
        // F is a hex digit, so hex literals only lose integer suffixes.
        String suffixes = token.startsWith("0x") || token.startsWith("0X") ? "LuU" : "LuUfF";
        int end = token.length();
        while (end > 0 && suffixes.indexOf(token.charAt(end - 1)) >= 0) end--;
        return token.substring(0, end);
    }

    private void string() {
        while (peek() != '"' && !isAtEnd()) {
            if (peek() == '\\' && peekNext() != '\0') {
                advance();
                if (peek() == '\n') {
                    // Escaped line break inside the string.
                    advance();
                    newLine();
                    continue;
                }
            } else if (peek() == '\n') {
                advance();
                newLine();
                continue;
            }
            advance();
        }

        if (isAtEnd()) {
            diagnostics.reportError(CompilerErrorCode.UNTERMINATED_STRING,
                    Messages.get("lexer.unterminatedString"), logicalFileName, line, startColumn);
            return;
        }

        // The closing "
        advance();

        // The text of the token is the string *with* quotes, the value is the raw content.
        String value = source.substring(start + 1, current - 1);
        addToken(TokenType.STRING, value, source.substring(start, current));
    }

    private void character() {
        if (peek() == '\\') advance();
        if (!isAtEnd()) advance();
        if (peek() != '\'') {
            diagnostics.reportError(CompilerErrorCode.UNTERMINATED_STRING,
                    Messages.get("lexer.unterminatedCharacter"), logicalFileName, line, startColumn);
            return;
        }
        advance();
        addToken(TokenType.CHARACTER, source.substring(start + 1, current - 1), source.substring(start, current));
    }

    private void blockComment() {
        advance(); // consume '*'
        while (!isAtEnd() && !(peek() == '*' && peekNext() == '/')) {
            if (advance() == '\n') {
                line++;
                column = 1;
            }
        }
        if (isAtEnd()) {
            diagnostics.reportError(CompilerErrorCode.UNTERMINATED_COMMENT,
                    Messages.get("lexer.unterminatedComment"), logicalFileName, line, startColumn);
            return;
        }
        advance();
        advance();
    }

    private void newLine() {
        line++;
        column = 1;
    }

    private char advance() {
        column++;
        return source.charAt(current++);
    }

    private void addToken(TokenType type) {
        addToken(type, null);
    }

    private void addToken(TokenType type, Object literal) {
        String text = source.substring(start, current);
        addToken(type, literal, text);
    }

    private void addToken(TokenType type, Object literal, String text) {
        tokens.add(new Token(type, text, literal, tokenLine(), startColumn, logicalFileName));
    }

    // Multi-line strings and comments report the line they started on.
    private int tokenLine() {
        int newlines = 0;
        for (int i = start; i < current; i++) {
            if (source.charAt(i) == '\n') newlines++;
        }
        return line - newlines;
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char peek() {
        if (isAtEnd()) return '\0';
        return source.charAt(current);
    }

    private char peekNext() {
        if (current + 1 >= source.length()) return '\0';
        return source.charAt(current + 1);
    }

    private boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private boolean isHexDigit(char c) {
        return isDigit(c) || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
    }

    private boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') ||
                (c >= 'A' && c <= 'Z') ||
                c == '_';
    }

    private boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c);
    }

    private boolean isOperatorStart(char c) {
        return "!<>+-*/%&|^~=?:.$@".indexOf(c) >= 0;
    }

    private char previous() {
        return source.charAt(current - 1);
    }
}
