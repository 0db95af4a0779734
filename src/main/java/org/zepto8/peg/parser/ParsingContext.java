package org.zepto8.peg.parser;

import org.zepto8.peg.action.RuleMatch;
import org.zepto8.peg.action.RuleObserver;
import org.zepto8.peg.text.SourceLocation;
import org.zepto8.peg.text.SourceSpan;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Mutable parsing context that tracks state during one parse.
 */
public final class ParsingContext {

    /**
     * Memoized rule result together with the observer events fired while computing it.
     */
    public record Memo(ParseResult result, List<RuleMatch> matches) {}

    private final String input;
    private final Map<String, RuleObserver> observers;
    private final Map<Long, Memo> packratCache;
    private final Map<String, Integer> ruleIds;
    private final Map<String, String> captures;
    // Events in firing order; only kept when they may need replaying from the cache
    private final List<RuleMatch> matchLog;

    private int pos;
    private int line;
    private int column;
    private int furthestPos;
    private int furthestLine;
    private int furthestColumn;
    private String furthestExpected;
    private int predicateDepth;

    private ParsingContext(String input, ParserConfig config, Map<String, RuleObserver> observers) {
        this.input = input;
        this.observers = observers;
        this.packratCache = config.packratEnabled() ? new HashMap<>() : null;
        this.ruleIds = config.packratEnabled() ? new HashMap<>() : null;
        this.captures = new HashMap<>();
        this.matchLog = config.packratEnabled() && !observers.isEmpty() ? new ArrayList<>() : null;
        this.pos = 0;
        this.line = 1;
        this.column = 1;
        this.furthestPos = 0;
        this.furthestLine = 1;
        this.furthestColumn = 1;
        this.furthestExpected = "";
    }

    public static ParsingContext create(String input, ParserConfig config) {
        return new ParsingContext(input, config, Map.of());
    }

    public static ParsingContext create(String input, ParserConfig config, Map<String, RuleObserver> observers) {
        return new ParsingContext(input, config, Map.copyOf(observers));
    }

    // === Position Management ===

    public int pos() {
        return pos;
    }

    public SourceLocation location() {
        return SourceLocation.at(line, column, pos);
    }

    public void restoreLocation(SourceLocation loc) {
        this.pos = loc.offset();
        this.line = loc.line();
        this.column = loc.column();
    }

    public boolean isAtEnd() {
        return pos >= input.length();
    }

    public int remaining() {
        return input.length() - pos;
    }

    // === Character Access ===

    public char peek() {
        return input.charAt(pos);
    }

    public char peek(int offset) {
        return input.charAt(pos + offset);
    }

    public char advance() {
        char c = input.charAt(pos++);
        if (c == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        return c;
    }

    public String substring(int start, int end) {
        return input.substring(start, end);
    }

    // === Error Tracking ===

    /**
     * Record an expectation that failed at the current position. Ignored inside predicates,
     * where failing is part of normal operation.
     */
    public void updateFurthest(String expected) {
        if (predicateDepth > 0) {
            return;
        }
        if (pos > furthestPos) {
            furthestPos = pos;
            furthestLine = line;
            furthestColumn = column;
            furthestExpected = expected;
        } else if (pos == furthestPos && !furthestExpected.contains(expected)) {
            furthestExpected = furthestExpected.isEmpty()
                ? expected
                : furthestExpected + " or " + expected;
        }
    }

    public void enterPredicate() {
        predicateDepth++;
    }

    public void exitPredicate() {
        predicateDepth--;
    }

    public SourceLocation furthestLocation() {
        return SourceLocation.at(furthestLine, furthestColumn, furthestPos);
    }

    public String furthestExpected() {
        return furthestExpected;
    }

    /**
     * Up to {@code maxLength} characters of the line starting at the given offset.
     */
    public String fragmentAt(int offset, int maxLength) {
        int end = offset;
        while (end < input.length() && end - offset < maxLength && input.charAt(end) != '\n'
               && input.charAt(end) != '\r') {
            end++;
        }
        return input.substring(offset, end);
    }

    // === Captures (for back-references) ===

    public void setCapture(String name, String value) {
        captures.put(name, value);
    }

    public Optional<String> getCapture(String name) {
        return Optional.ofNullable(captures.get(name));
    }

    // === Observers ===

    public boolean isObserved(String ruleName) {
        return observers.containsKey(ruleName);
    }

    /**
     * Report a successful match of an observed rule spanning from {@code start} to the current position.
     */
    public void notifyMatch(String ruleName, SourceLocation start) {
        var span = SourceSpan.of(start, location());
        var match = new RuleMatch(ruleName, span, span.extract(input));
        if (matchLog != null) {
            matchLog.add(match);
        }
        observers.get(ruleName)
                 .onMatch(match);
    }

    /**
     * Number of events fired so far; marks where a rule invocation's own events begin.
     */
    public int matchCount() {
        return matchLog == null
               ? 0
               : matchLog.size();
    }

    // === Packrat Cache ===

    public boolean isPackratEnabled() {
        return packratCache != null;
    }

    /**
     * Look up a memoized result; on a hit the events recorded with it are fired again.
     */
    public Optional<ParseResult> recallAt(String ruleName, int position) {
        if (packratCache == null) {
            return Optional.empty();
        }
        var memo = packratCache.get(packratKey(ruleName, position));
        if (memo == null) {
            return Optional.empty();
        }
        for (var match : memo.matches()) {
            if (matchLog != null) {
                matchLog.add(match);
            }
            observers.get(match.rule())
                     .onMatch(match);
        }
        return Optional.of(memo.result());
    }

    /**
     * Memoize a result together with the events fired since {@code firstMatch}.
     */
    public void memoizeAt(String ruleName, int position, ParseResult result, int firstMatch) {
        if (packratCache == null) {
            return;
        }
        var matches = matchLog == null || matchLog.size() == firstMatch
                      ? List.<RuleMatch>of()
                      : List.copyOf(matchLog.subList(firstMatch, matchLog.size()));
        packratCache.put(packratKey(ruleName, position), new Memo(result, matches));
    }

    public int cacheSize() {
        return packratCache == null
               ? 0
               : packratCache.size();
    }

    private long packratKey(String ruleName, int position) {
        int ruleId = ruleIds.computeIfAbsent(ruleName, k -> ruleIds.size());
        return ((long) ruleId << 32) | (position & 0xFFFFFFFFL);
    }

    // === Accessors ===

    public String input() {
        return input;
    }
}
