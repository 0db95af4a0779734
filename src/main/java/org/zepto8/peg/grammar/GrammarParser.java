package org.zepto8.peg.grammar;

import org.zepto8.peg.error.GrammarException;
import org.zepto8.peg.error.ParseError;
import org.zepto8.peg.text.SourceLocation;
import org.zepto8.peg.text.SourceSpan;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;

/**
 * Parser for PEG grammar syntax.
 * Converts grammar text into Grammar object.
 */
public final class GrammarParser {

    private final String text;
    private final List<GrammarToken> tokens;
    private int pos;

    private GrammarParser(String text, List<GrammarToken> tokens) {
        this.text = text;
        this.tokens = tokens;
        this.pos = 0;
    }

    /**
     * Parse grammar text into Grammar object.
     *
     * @throws GrammarException if the text is not a well-formed grammar
     */
    public static Grammar parse(String grammarText) {
        var tokens = GrammarLexer.tokenize(grammarText);
        for (var token : tokens) {
            if (token instanceof GrammarToken.Error error) {
                throw new GrammarException(new ParseError.SemanticError(error.span()
                                                                             .start(),
                                                                        error.message()));
            }
        }
        return new GrammarParser(grammarText, tokens).parseGrammar();
    }

    private Grammar parseGrammar() {
        var rules = new ArrayList<Rule>();
        while (!isAtEnd()) {
            if (!(peek() instanceof GrammarToken.Identifier)) {
                throw unexpected("rule definition");
            }
            rules.add(parseRule());
        }
        return new Grammar(rules);
    }

    private Rule parseRule() {
        var start = peek().span()
                          .start();
        var id = (GrammarToken.Identifier) peek();
        advance();
        expect(GrammarToken.LeftArrow.class, "'<-'");
        var expression = parseExpression();
        var span = SourceSpan.of(start, currentLocation());
        return new Rule(span, id.name(), expression);
    }

    private Expression parseExpression() {
        return parseChoice();
    }

    private Expression parseChoice() {
        var start = currentLocation();
        var alternatives = new ArrayList<Expression>();
        alternatives.add(parseSequence());
        while (peek() instanceof GrammarToken.Slash) {
            advance();
            alternatives.add(parseSequence());
        }
        if (alternatives.size() == 1) {
            return alternatives.get(0);
        }
        return new Expression.Choice(SourceSpan.of(start, currentLocation()), alternatives);
    }

    private Expression parseSequence() {
        var start = currentLocation();
        var elements = new ArrayList<Expression>();
        while (isSequenceElement()) {
            elements.add(parsePrefix());
        }
        if (elements.isEmpty()) {
            throw unexpected("expression");
        }
        if (elements.size() == 1) {
            return elements.get(0);
        }
        return new Expression.Sequence(SourceSpan.of(start, currentLocation()), elements);
    }

    private boolean isSequenceElement() {
        var token = peek();
        // Identifier followed by <- starts the next rule
        if (token instanceof GrammarToken.Identifier) {
            return !isRuleDefinitionStart();
        }
        return token instanceof GrammarToken.StringLiteral
               || token instanceof GrammarToken.CharClassLiteral
               || token instanceof GrammarToken.Dot
               || token instanceof GrammarToken.LParen
               || token instanceof GrammarToken.Ampersand
               || token instanceof GrammarToken.Exclamation
               || token instanceof GrammarToken.Dollar
               || token instanceof GrammarToken.Cut;
    }

    private boolean isRuleDefinitionStart() {
        return pos + 1 < tokens.size() && tokens.get(pos + 1) instanceof GrammarToken.LeftArrow;
    }

    private Expression parsePrefix() {
        var start = currentLocation();
        if (peek() instanceof GrammarToken.Ampersand) {
            advance();
            var inner = parseSuffix();
            return new Expression.And(SourceSpan.of(start, currentLocation()), inner);
        }
        if (peek() instanceof GrammarToken.Exclamation) {
            advance();
            var inner = parseSuffix();
            return new Expression.Not(SourceSpan.of(start, currentLocation()), inner);
        }
        return parseSuffix();
    }

    private Expression parseSuffix() {
        var start = currentLocation();
        var expr = parsePrimary();
        while (true) {
            if (peek() instanceof GrammarToken.Star) {
                advance();
                expr = new Expression.ZeroOrMore(SourceSpan.of(start, currentLocation()), expr);
            } else if (peek() instanceof GrammarToken.Plus) {
                advance();
                expr = new Expression.OneOrMore(SourceSpan.of(start, currentLocation()), expr);
            } else if (peek() instanceof GrammarToken.Question) {
                advance();
                expr = new Expression.Optional(SourceSpan.of(start, currentLocation()), expr);
            } else if (peek() instanceof GrammarToken.LBrace) {
                expr = parseRepetition(start, expr);
            } else {
                return expr;
            }
        }
    }

    private Expression parseRepetition(SourceLocation start, Expression expr) {
        advance();
        if (!(peek() instanceof GrammarToken.Number min)) {
            throw unexpected("number");
        }
        advance();
        OptionalInt max;
        if (peek() instanceof GrammarToken.Comma) {
            advance();
            if (peek() instanceof GrammarToken.Number maxNum) {
                advance();
                max = OptionalInt.of(maxNum.value());
            } else {
                max = OptionalInt.empty();
            }
        } else {
            max = OptionalInt.of(min.value());
        }
        expect(GrammarToken.RBrace.class, "'}'");
        if (max.isPresent() && max.getAsInt() < min.value()) {
            throw new GrammarException(new ParseError.SemanticError(start,
                                                                    "Repetition maximum is below minimum"));
        }
        return new Expression.Repetition(SourceSpan.of(start, currentLocation()), expr, min.value(), max);
    }

    private Expression parsePrimary() {
        var token = peek();
        var start = token.span()
                         .start();
        if (token instanceof GrammarToken.Identifier id) {
            advance();
            return new Expression.Reference(token.span(), id.name());
        }
        if (token instanceof GrammarToken.StringLiteral str) {
            advance();
            return new Expression.Literal(token.span(), str.value(), str.caseInsensitive());
        }
        if (token instanceof GrammarToken.CharClassLiteral cc) {
            advance();
            return new Expression.CharClass(token.span(), cc.pattern(), cc.negated(), cc.caseInsensitive());
        }
        if (token instanceof GrammarToken.Dot) {
            advance();
            return new Expression.Any(token.span());
        }
        if (token instanceof GrammarToken.Cut) {
            advance();
            return new Expression.Cut(token.span());
        }
        if (token instanceof GrammarToken.LParen) {
            advance();
            var inner = parseExpression();
            expect(GrammarToken.RParen.class, "')'");
            return new Expression.Group(SourceSpan.of(start, currentLocation()), inner);
        }
        if (token instanceof GrammarToken.Dollar) {
            return parseCaptureOrBackReference(start);
        }
        throw unexpected("expression");
    }

    // $name< e > or $name
    private Expression parseCaptureOrBackReference(SourceLocation start) {
        advance();
        if (!(peek() instanceof GrammarToken.Identifier nameId)) {
            throw unexpected("capture name");
        }
        advance();
        if (peek() instanceof GrammarToken.LAngle) {
            advance();
            var inner = parseExpression();
            expect(GrammarToken.RAngle.class, "'>'");
            return new Expression.Capture(SourceSpan.of(start, currentLocation()), nameId.name(), inner);
        }
        return new Expression.BackReference(SourceSpan.of(start, currentLocation()), nameId.name());
    }

    private boolean isAtEnd() {
        return peek() instanceof GrammarToken.Eof;
    }

    private GrammarToken peek() {
        return tokens.get(pos);
    }

    private void advance() {
        if (!isAtEnd()) {
            pos++;
        }
    }

    private void expect(Class<? extends GrammarToken> tokenClass, String description) {
        if (!tokenClass.isInstance(peek())) {
            throw unexpected(description);
        }
        advance();
    }

    private GrammarException unexpected(String expected) {
        var token = peek();
        return new GrammarException(new ParseError.UnexpectedInput(token.span()
                                                                        .start(),
                                                                   tokenDescription(token),
                                                                   expected));
    }

    private SourceLocation currentLocation() {
        return peek().span()
                     .start();
    }

    private String tokenDescription(GrammarToken token) {
        if (token instanceof GrammarToken.Identifier id) {
            return "identifier '" + id.name() + "'";
        }
        if (token instanceof GrammarToken.StringLiteral) {
            return "string literal";
        }
        if (token instanceof GrammarToken.CharClassLiteral) {
            return "character class";
        }
        if (token instanceof GrammarToken.Number n) {
            return "number " + n.value();
        }
        if (token instanceof GrammarToken.Eof) {
            return "end of input";
        }
        if (token instanceof GrammarToken.LeftArrow) {
            return "'<-'";
        }
        if (token instanceof GrammarToken.Cut) {
            return "'^'";
        }
        return "'" + token.span()
                          .extract(text) + "'";
    }
}
