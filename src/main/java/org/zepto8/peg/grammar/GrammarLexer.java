package org.zepto8.peg.grammar;

import org.zepto8.peg.text.SourceLocation;
import org.zepto8.peg.text.SourceSpan;

import java.util.ArrayList;
import java.util.List;

/**
 * Lexer for PEG grammar syntax.
 */
public final class GrammarLexer {
    private static final int MAX_INPUT_SIZE = 1_000_000;
    private static final int DEFAULT_TOKEN_CAPACITY = 32;

    private final String input;
    private int pos;
    private int line;
    private int column;

    private GrammarLexer(String input) {
        this.input = input;
        this.pos = 0;
        this.line = 1;
        this.column = 1;
    }

    public static List<GrammarToken> tokenize(String input) {
        if (input.length() > MAX_INPUT_SIZE) {
            throw new IllegalArgumentException(
            "Grammar input exceeds maximum size of " + MAX_INPUT_SIZE + " characters");
        }
        return new GrammarLexer(input).tokenizeAll();
    }

    private List<GrammarToken> tokenizeAll() {
        var tokens = new ArrayList<GrammarToken>();
        while (!isAtEnd()) {
            skipWhitespaceAndComments();
            if (!isAtEnd()) {
                tokens.add(nextToken());
            }
        }
        tokens.add(new GrammarToken.Eof(SourceSpan.at(currentLocation())));
        return tokens;
    }

    private GrammarToken nextToken() {
        var start = currentLocation();
        char c = peek();
        if (isIdentifierStart(c)) {
            return scanIdentifier(start);
        }
        if (c == '\'' || c == '"') {
            return scanStringLiteral(start);
        }
        if (c == '[') {
            return scanCharClass(start);
        }
        if (isDigit(c)) {
            return scanNumber(start);
        }
        return scanOperator(start);
    }

    private GrammarToken scanIdentifier(SourceLocation start) {
        var sb = new StringBuilder(DEFAULT_TOKEN_CAPACITY);
        while (!isAtEnd() && isIdentifierPart(peek())) {
            sb.append(advance());
        }
        return new GrammarToken.Identifier(span(start), sb.toString());
    }

    private GrammarToken scanStringLiteral(SourceLocation start) {
        char quote = advance();
        var sb = new StringBuilder(DEFAULT_TOKEN_CAPACITY);
        while (!isAtEnd() && peek() != quote) {
            if (peek() == '\\' && pos + 1 < input.length()) {
                advance();
                sb.append(scanEscapeSequence());
            } else {
                sb.append(advance());
            }
        }
        if (isAtEnd()) {
            return new GrammarToken.Error(span(start), "Unterminated string literal");
        }
        advance();
        boolean caseInsensitive = isCaseInsensitiveSuffix();
        if (caseInsensitive) {
            advance();
        }
        return new GrammarToken.StringLiteral(span(start), sb.toString(), caseInsensitive);
    }

    private GrammarToken scanCharClass(SourceLocation start) {
        advance();
        boolean negated = false;
        if (!isAtEnd() && peek() == '^') {
            negated = true;
            advance();
        }
        // Escapes are kept verbatim; the engine decodes them when matching
        var sb = new StringBuilder(DEFAULT_TOKEN_CAPACITY);
        while (!isAtEnd() && peek() != ']') {
            if (peek() == '\\' && pos + 1 < input.length()) {
                sb.append(advance());
                sb.append(advance());
            } else {
                sb.append(advance());
            }
        }
        if (isAtEnd()) {
            return new GrammarToken.Error(span(start), "Unterminated character class");
        }
        advance();
        boolean caseInsensitive = isCaseInsensitiveSuffix();
        if (caseInsensitive) {
            advance();
        }
        return new GrammarToken.CharClassLiteral(span(start), sb.toString(), negated, caseInsensitive);
    }

    // 'abc'i but not 'abc' identifier
    private boolean isCaseInsensitiveSuffix() {
        return !isAtEnd() && peek() == 'i'
               && (pos + 1 >= input.length() || !isIdentifierPart(input.charAt(pos + 1)));
    }

    private GrammarToken scanNumber(SourceLocation start) {
        var sb = new StringBuilder(DEFAULT_TOKEN_CAPACITY);
        while (!isAtEnd() && isDigit(peek())) {
            sb.append(advance());
        }
        return new GrammarToken.Number(span(start), Integer.parseInt(sb.toString()));
    }

    private GrammarToken scanOperator(SourceLocation start) {
        char c = advance();
        switch (c) {
            case '<':
                if (!isAtEnd() && peek() == '-') {
                    advance();
                    return new GrammarToken.LeftArrow(span(start));
                }
                return new GrammarToken.LAngle(span(start));
            case '←':
                return new GrammarToken.LeftArrow(span(start));
            case '/':
                return new GrammarToken.Slash(span(start));
            case '&':
                return new GrammarToken.Ampersand(span(start));
            case '!':
                return new GrammarToken.Exclamation(span(start));
            case '?':
                return new GrammarToken.Question(span(start));
            case '*':
                return new GrammarToken.Star(span(start));
            case '+':
                return new GrammarToken.Plus(span(start));
            case '.':
                return new GrammarToken.Dot(span(start));
            case '↑':
            case '^':
                return new GrammarToken.Cut(span(start));
            case '(':
                return new GrammarToken.LParen(span(start));
            case ')':
                return new GrammarToken.RParen(span(start));
            case '>':
                return new GrammarToken.RAngle(span(start));
            case '{':
                return new GrammarToken.LBrace(span(start));
            case '}':
                return new GrammarToken.RBrace(span(start));
            case ',':
                return new GrammarToken.Comma(span(start));
            case '$':
                return new GrammarToken.Dollar(span(start));
            default:
                return new GrammarToken.Error(span(start), "Unexpected character: " + c);
        }
    }

    private char scanEscapeSequence() {
        char c = advance();
        switch (c) {
            case 'n':
                return '\n';
            case 'r':
                return '\r';
            case 't':
                return '\t';
            case '0':
                return '\0';
            case 'x':
                return scanHexEscape(2, c);
            case 'u':
                return scanHexEscape(4, c);
            default:
                return c;
        }
    }

    private char scanHexEscape(int digits, char fallback) {
        if (pos + digits > input.length()) {
            return fallback;
        }
        var hex = input.substring(pos, pos + digits);
        try {
            var value = Integer.parseInt(hex, 16);
            pos += digits;
            column += digits;
            return (char) value;
        } catch (NumberFormatException e) {
            return fallback;
        }
    }

    private void skipWhitespaceAndComments() {
        while (!isAtEnd()) {
            char c = peek();
            if (c == ' ' || c == '\t' || c == '\r' || c == '\n') {
                advance();
            } else if (c == '#') {
                while (!isAtEnd() && peek() != '\n') {
                    advance();
                }
            } else {
                break;
            }
        }
    }

    private boolean isAtEnd() {
        return pos >= input.length();
    }

    private char peek() {
        return input.charAt(pos);
    }

    private char advance() {
        char c = input.charAt(pos++);
        if (c == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        return c;
    }

    private SourceLocation currentLocation() {
        return SourceLocation.at(line, column, pos);
    }

    private SourceSpan span(SourceLocation start) {
        return SourceSpan.of(start, currentLocation());
    }

    private boolean isIdentifierStart(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    private boolean isIdentifierPart(char c) {
        return isIdentifierStart(c) || isDigit(c);
    }

    private boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }
}
