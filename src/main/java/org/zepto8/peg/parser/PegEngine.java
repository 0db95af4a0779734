package org.zepto8.peg.parser;

import org.zepto8.peg.action.RuleObserver;
import org.zepto8.peg.error.ParseError;
import org.zepto8.peg.error.ParseException;
import org.zepto8.peg.grammar.Expression;
import org.zepto8.peg.grammar.Grammar;
import org.zepto8.peg.grammar.Rule;
import org.zepto8.peg.text.SourceLocation;
import org.zepto8.peg.text.SourceSpan;

import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * PEG parsing engine - interprets a Grammar to recognize input text.
 */
public final class PegEngine implements Parser {
    private static final int FRAGMENT_LENGTH = 20;

    private final Grammar grammar;
    private final ParserConfig config;
    private final Map<String, Rule> rules;
    // Results of these rules depend on capture state, so they are never memoized
    private final Set<String> captureSensitiveRules;

    private PegEngine(Grammar grammar, ParserConfig config) {
        this.grammar = grammar;
        this.config = config;
        this.rules = grammar.ruleMap();
        this.captureSensitiveRules = new HashSet<>();
        for (var rule : grammar.rules()) {
            if (usesCaptures(rule.expression())) {
                captureSensitiveRules.add(rule.name());
            }
        }
    }

    public static PegEngine create(Grammar grammar, ParserConfig config) {
        return new PegEngine(grammar.validate(), config);
    }

    @Override
    public SourceSpan parse(String input) throws ParseException {
        var startRule = grammar.startRule()
                               .orElseThrow();
        return parse(input, startRule.name());
    }

    @Override
    public SourceSpan parse(String input, String startRule) throws ParseException {
        return parse(input, startRule, Map.of());
    }

    @Override
    public SourceSpan parse(String input, String startRule, Map<String, RuleObserver> observers) throws ParseException {
        var rule = rules.get(startRule);
        if (rule == null) {
            throw new IllegalArgumentException("Unknown rule: " + startRule);
        }
        for (var observed : observers.keySet()) {
            if (!rules.containsKey(observed)) {
                throw new IllegalArgumentException("Cannot observe unknown rule: " + observed);
            }
        }

        var ctx = ParsingContext.create(input, config, observers);
        var result = parseRule(ctx, rule);

        if (result instanceof ParseResult.CutFailure cut) {
            throw syntaxError(ctx, cut.location(), cut.expected());
        }
        if (result instanceof ParseResult.Failure failure) {
            throw syntaxError(ctx, failure.location(), failure.expected());
        }
        if (!ctx.isAtEnd()) {
            ctx.updateFurthest("end of input");
            throw syntaxError(ctx, ctx.location(), "end of input");
        }
        return SourceSpan.of(SourceLocation.START, ctx.location());
    }

    /**
     * Report at the furthest position the parser reached, which is where the input
     * stopped making sense in all alternatives tried.
     */
    private ParseException syntaxError(ParsingContext ctx, SourceLocation failedAt, String expected) {
        var location = ctx.furthestLocation();
        var expectedText = ctx.furthestExpected();
        if (failedAt.offset() > location.offset() || expectedText.isEmpty()) {
            location = failedAt;
            expectedText = expected;
        }
        if (location.offset() >= ctx.input()
                                    .length()) {
            return new ParseException(new ParseError.UnexpectedEof(location, expectedText));
        }
        var found = ctx.fragmentAt(location.offset(), FRAGMENT_LENGTH);
        return new ParseException(new ParseError.UnexpectedInput(location,
                                                                 found.isEmpty()
                                                                 ? "end of line"
                                                                 : found,
                                                                 expectedText));
    }

    // === Rules ===

    private ParseResult parseRule(ParsingContext ctx, Rule rule) {
        var startLoc = ctx.location();
        boolean memoize = ctx.isPackratEnabled() && !captureSensitiveRules.contains(rule.name());

        if (memoize) {
            var cached = ctx.recallAt(rule.name(), startLoc.offset());
            if (cached.isPresent()) {
                var result = cached.get();
                if (result instanceof ParseResult.Success success) {
                    ctx.restoreLocation(success.endLocation());
                }
                return result;
            }
        }

        int firstMatch = ctx.matchCount();
        var result = parseExpression(ctx, rule.expression());

        if (result.isSuccess()) {
            if (ctx.isObserved(rule.name())) {
                ctx.notifyMatch(rule.name(), startLoc);
            }
            result = ParseResult.Success.at(ctx.location());
        } else {
            ctx.restoreLocation(startLoc);
        }
        // A cut failure ends the parse, nothing would read it back
        if (memoize && !(result instanceof ParseResult.CutFailure)) {
            ctx.memoizeAt(rule.name(), startLoc.offset(), result, firstMatch);
        }
        return result;
    }

    private ParseResult parseExpression(ParsingContext ctx, Expression expr) {
        if (expr instanceof Expression.Literal lit) {
            return parseLiteral(ctx, lit);
        }
        if (expr instanceof Expression.CharClass cc) {
            return parseCharClass(ctx, cc);
        }
        if (expr instanceof Expression.Any) {
            return parseAny(ctx);
        }
        if (expr instanceof Expression.Reference ref) {
            return parseRule(ctx, rules.get(ref.ruleName()));
        }
        if (expr instanceof Expression.Sequence seq) {
            return parseSequence(ctx, seq);
        }
        if (expr instanceof Expression.Choice choice) {
            return parseChoice(ctx, choice);
        }
        if (expr instanceof Expression.ZeroOrMore zom) {
            return parseRepeated(ctx, zom.expression(), 0, Integer.MAX_VALUE);
        }
        if (expr instanceof Expression.OneOrMore oom) {
            return parseRepeated(ctx, oom.expression(), 1, Integer.MAX_VALUE);
        }
        if (expr instanceof Expression.Optional opt) {
            return parseRepeated(ctx, opt.expression(), 0, 1);
        }
        if (expr instanceof Expression.Repetition rep) {
            return parseRepeated(ctx, rep.expression(), rep.min(), rep.max()
                                                                      .orElse(Integer.MAX_VALUE));
        }
        if (expr instanceof Expression.And and) {
            return parseAnd(ctx, and);
        }
        if (expr instanceof Expression.Not not) {
            return parseNot(ctx, not);
        }
        if (expr instanceof Expression.Capture cap) {
            return parseCapture(ctx, cap);
        }
        if (expr instanceof Expression.BackReference br) {
            return parseBackReference(ctx, br);
        }
        if (expr instanceof Expression.Cut) {
            // Only meaningful inside a sequence; on its own it matches nothing
            return ParseResult.Success.at(ctx.location());
        }
        if (expr instanceof Expression.Group grp) {
            return parseExpression(ctx, grp.expression());
        }
        throw new IllegalStateException("Unsupported expression: " + expr);
    }

    // === Terminal Parsers ===

    private ParseResult parseLiteral(ParsingContext ctx, Expression.Literal lit) {
        var text = lit.text();
        if (!matchesText(ctx, text, lit.caseInsensitive())) {
            var expected = "'" + text + "'";
            ctx.updateFurthest(expected);
            return ParseResult.Failure.at(ctx.location(), expected);
        }
        for (int i = 0; i < text.length(); i++) {
            ctx.advance();
        }
        return ParseResult.Success.at(ctx.location());
    }

    private boolean matchesText(ParsingContext ctx, String text, boolean caseInsensitive) {
        if (ctx.remaining() < text.length()) {
            return false;
        }
        for (int i = 0; i < text.length(); i++) {
            char expected = text.charAt(i);
            char actual = ctx.peek(i);
            if (caseInsensitive
                ? Character.toLowerCase(expected) != Character.toLowerCase(actual)
                : expected != actual) {
                return false;
            }
        }
        return true;
    }

    private ParseResult parseCharClass(ParsingContext ctx, Expression.CharClass cc) {
        var expected = "[" + (cc.negated() ? "^" : "") + cc.pattern() + "]";
        if (ctx.isAtEnd()) {
            ctx.updateFurthest(expected);
            return ParseResult.Failure.at(ctx.location(), expected);
        }
        boolean matches = matchesCharClass(ctx.peek(), cc.pattern(), cc.caseInsensitive());
        if (cc.negated()) {
            matches = !matches;
        }
        if (!matches) {
            ctx.updateFurthest(expected);
            return ParseResult.Failure.at(ctx.location(), expected);
        }
        ctx.advance();
        return ParseResult.Success.at(ctx.location());
    }

    private boolean matchesCharClass(char c, String pattern, boolean caseInsensitive) {
        char testChar = caseInsensitive ? Character.toLowerCase(c) : c;
        int i = 0;
        while (i < pattern.length()) {
            char start = pattern.charAt(i);
            int consumed = 1;
            if (start == '\\' && i + 1 < pattern.length()) {
                consumed = escapeLength(pattern, i);
                start = decodeEscape(pattern, i, consumed);
            }
            // Range a-z, where either end may be escaped
            if (i + consumed + 1 < pattern.length() && pattern.charAt(i + consumed) == '-') {
                int endIndex = i + consumed + 1;
                char end = pattern.charAt(endIndex);
                int endConsumed = 1;
                if (end == '\\' && endIndex + 1 < pattern.length()) {
                    endConsumed = escapeLength(pattern, endIndex);
                    end = decodeEscape(pattern, endIndex, endConsumed);
                }
                if (caseInsensitive) {
                    start = Character.toLowerCase(start);
                    end = Character.toLowerCase(end);
                }
                if (testChar >= start && testChar <= end) {
                    return true;
                }
                i = endIndex + endConsumed;
                continue;
            }
            if (caseInsensitive) {
                start = Character.toLowerCase(start);
            }
            if (testChar == start) {
                return true;
            }
            i += consumed;
        }
        return false;
    }

    private int escapeLength(String pattern, int i) {
        char escaped = pattern.charAt(i + 1);
        if (escaped == 'x' && i + 4 <= pattern.length() && isHex(pattern, i + 2, 2)) {
            return 4;
        }
        if (escaped == 'u' && i + 6 <= pattern.length() && isHex(pattern, i + 2, 4)) {
            return 6;
        }
        return 2;
    }

    private char decodeEscape(String pattern, int i, int length) {
        char escaped = pattern.charAt(i + 1);
        if (length > 2) {
            return (char) Integer.parseInt(pattern.substring(i + 2, i + length), 16);
        }
        switch (escaped) {
            case 'n':
                return '\n';
            case 'r':
                return '\r';
            case 't':
                return '\t';
            case '0':
                return '\0';
            default:
                return escaped;
        }
    }

    private boolean isHex(String text, int from, int count) {
        for (int i = from; i < from + count; i++) {
            if (Character.digit(text.charAt(i), 16) < 0) {
                return false;
            }
        }
        return true;
    }

    private ParseResult parseAny(ParsingContext ctx) {
        if (ctx.isAtEnd()) {
            ctx.updateFurthest("any character");
            return ParseResult.Failure.at(ctx.location(), "any character");
        }
        ctx.advance();
        return ParseResult.Success.at(ctx.location());
    }

    // === Combinator Parsers ===

    private ParseResult parseSequence(ParsingContext ctx, Expression.Sequence seq) {
        var startLoc = ctx.location();
        boolean committed = false;
        for (var element : seq.elements()) {
            if (element instanceof Expression.Cut) {
                committed = true;
                continue;
            }
            var result = parseExpression(ctx, element);
            if (result instanceof ParseResult.CutFailure) {
                ctx.restoreLocation(startLoc);
                return result;
            }
            if (result instanceof ParseResult.Failure failure) {
                ctx.restoreLocation(startLoc);
                return committed
                       ? ParseResult.CutFailure.at(failure.location(), failure.expected())
                       : failure;
            }
        }
        return ParseResult.Success.at(ctx.location());
    }

    private ParseResult parseChoice(ParsingContext ctx, Expression.Choice choice) {
        var startLoc = ctx.location();
        ParseResult lastFailure = null;
        for (var alt : choice.alternatives()) {
            var result = parseExpression(ctx, alt);
            if (result.isSuccess() || result instanceof ParseResult.CutFailure) {
                return result;
            }
            lastFailure = result;
            ctx.restoreLocation(startLoc);
        }
        return lastFailure != null
               ? lastFailure
               : ParseResult.Failure.at(startLoc, "one of alternatives");
    }

    /**
     * Shared loop for *, +, ? and {n,m}.
     */
    private ParseResult parseRepeated(ParsingContext ctx, Expression expr, int min, int max) {
        var startLoc = ctx.location();
        int count = 0;
        while (count < max) {
            var beforeLoc = ctx.location();
            var result = parseExpression(ctx, expr);
            if (result instanceof ParseResult.CutFailure) {
                ctx.restoreLocation(startLoc);
                return result;
            }
            if (result.isFailure()) {
                ctx.restoreLocation(beforeLoc);
                if (count < min) {
                    ctx.restoreLocation(startLoc);
                    return result;
                }
                break;
            }
            count++;
            // An iteration that consumed nothing would repeat forever
            if (ctx.pos() == beforeLoc.offset()) {
                break;
            }
        }
        if (count < min) {
            ctx.restoreLocation(startLoc);
            return ParseResult.Failure.at(ctx.location(), "at least " + min + " repetitions");
        }
        return ParseResult.Success.at(ctx.location());
    }

    // === Predicate Parsers ===

    private ParseResult parseAnd(ParsingContext ctx, Expression.And and) {
        var startLoc = ctx.location();
        var result = parseExpression(ctx, and.expression());
        ctx.restoreLocation(startLoc);
        return result.isSuccess()
               ? ParseResult.Success.at(startLoc)
               : result;
    }

    private ParseResult parseNot(ParsingContext ctx, Expression.Not not) {
        var startLoc = ctx.location();
        ctx.enterPredicate();
        ParseResult result;
        try {
            result = parseExpression(ctx, not.expression());
        } finally {
            ctx.exitPredicate();
        }
        ctx.restoreLocation(startLoc);
        if (result instanceof ParseResult.CutFailure) {
            return result;
        }
        if (result.isSuccess()) {
            if (not.expression() instanceof Expression.Any) {
                ctx.updateFurthest("end of input");
                return ParseResult.Failure.at(startLoc, "end of input");
            }
            return ParseResult.Failure.at(startLoc, "not " + describeExpression(not.expression()));
        }
        return ParseResult.Success.at(startLoc);
    }

    // === Captures ===

    private ParseResult parseCapture(ParsingContext ctx, Expression.Capture cap) {
        var startPos = ctx.pos();
        var result = parseExpression(ctx, cap.expression());
        if (result.isSuccess()) {
            ctx.setCapture(cap.name(), ctx.substring(startPos, ctx.pos()));
        }
        return result;
    }

    private ParseResult parseBackReference(ParsingContext ctx, Expression.BackReference br) {
        var captured = ctx.getCapture(br.name());
        if (captured.isEmpty()) {
            return ParseResult.Failure.at(ctx.location(), "capture '" + br.name() + "'");
        }
        var text = captured.get();
        if (!matchesText(ctx, text, false)) {
            ctx.updateFurthest("'" + text + "'");
            return ParseResult.Failure.at(ctx.location(), "'" + text + "'");
        }
        for (int i = 0; i < text.length(); i++) {
            ctx.advance();
        }
        return ParseResult.Success.at(ctx.location());
    }

    // === Helpers ===

    private boolean usesCaptures(Expression expr) {
        if (expr instanceof Expression.Capture || expr instanceof Expression.BackReference) {
            return true;
        }
        return expr.children()
                   .stream()
                   .anyMatch(this::usesCaptures);
    }

    private String describeExpression(Expression expr) {
        if (expr instanceof Expression.Literal lit) {
            return "'" + lit.text() + "'";
        }
        if (expr instanceof Expression.CharClass cc) {
            return "[" + cc.pattern() + "]";
        }
        if (expr instanceof Expression.Reference ref) {
            return ref.ruleName();
        }
        if (expr instanceof Expression.Group grp) {
            return describeExpression(grp.expression());
        }
        return "expression";
    }
}
