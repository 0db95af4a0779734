package org.zepto8.peg.parser;

import org.junit.jupiter.api.Test;
import org.zepto8.peg.action.RuleMatch;
import org.zepto8.peg.action.RuleObserver;
import org.zepto8.peg.text.SourceLocation;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ParsingContextTest {

    @Test
    void advance_tracksLineAndColumn() {
        var ctx = ParsingContext.create("ab\ncd", ParserConfig.DEFAULT);

        ctx.advance();
        assertEquals(SourceLocation.at(1, 2, 1), ctx.location());
        ctx.advance();
        ctx.advance();
        assertEquals(SourceLocation.at(2, 1, 3), ctx.location());
        assertEquals('c', ctx.peek());
        assertEquals(2, ctx.remaining());
    }

    @Test
    void restoreLocation_rewindsPosition() {
        var ctx = ParsingContext.create("ab\ncd", ParserConfig.DEFAULT);
        var start = ctx.location();
        ctx.advance();
        ctx.advance();
        ctx.advance();

        ctx.restoreLocation(start);

        assertEquals(0, ctx.pos());
        assertEquals(SourceLocation.START, ctx.location());
    }

    @Test
    void updateFurthest_keepsFurthestPosition() {
        var ctx = ParsingContext.create("abc", ParserConfig.DEFAULT);
        ctx.advance();
        ctx.advance();
        ctx.updateFurthest("'x'");
        ctx.restoreLocation(SourceLocation.START);

        ctx.updateFurthest("'y'");

        assertEquals(2, ctx.furthestLocation().offset());
        assertEquals("'x'", ctx.furthestExpected());
    }

    @Test
    void updateFurthest_samePosition_mergesExpectations() {
        var ctx = ParsingContext.create("abc", ParserConfig.DEFAULT);
        ctx.advance();

        ctx.updateFurthest("'x'");
        ctx.updateFurthest("'y'");
        ctx.updateFurthest("'x'");

        assertEquals("'x' or 'y'", ctx.furthestExpected());
    }

    @Test
    void updateFurthest_insidePredicate_isIgnored() {
        var ctx = ParsingContext.create("abc", ParserConfig.DEFAULT);
        ctx.advance();
        ctx.enterPredicate();

        ctx.updateFurthest("'x'");
        ctx.exitPredicate();

        assertEquals(0, ctx.furthestLocation().offset());
        assertEquals("", ctx.furthestExpected());
    }

    @Test
    void fragmentAt_stopsAtLineEndAndLimit() {
        var ctx = ParsingContext.create("local x = = 1\nprint(x)", ParserConfig.DEFAULT);

        assertEquals("= 1", ctx.fragmentAt(10, 20));
        assertEquals("local", ctx.fragmentAt(0, 5));
        assertEquals("", ctx.fragmentAt(13, 20));
    }

    @Test
    void captures_storeLatestValue() {
        var ctx = ParsingContext.create("", ParserConfig.DEFAULT);

        assertTrue(ctx.getCapture("level").isEmpty());
        ctx.setCapture("level", "=");
        ctx.setCapture("level", "==");

        assertEquals("==", ctx.getCapture("level").orElseThrow());
    }

    @Test
    void notifyMatch_reportsSpanAndText() {
        var seen = new ArrayList<RuleMatch>();
        Map<String, RuleObserver> observers = Map.of("Word", seen::add);
        var ctx = ParsingContext.create("ab cd", ParserConfig.DEFAULT, observers);
        ctx.advance();
        ctx.advance();
        ctx.advance();
        var start = ctx.location();
        ctx.advance();
        ctx.advance();

        ctx.notifyMatch("Word", start);

        assertEquals(1, seen.size());
        assertEquals("cd", seen.get(0).text());
        assertEquals(3, seen.get(0).offset());
        assertEquals(3, seen.get(0).columnInLine());
        assertEquals(2, seen.get(0).length());
        assertTrue(ctx.isObserved("Word"));
        assertFalse(ctx.isObserved("Other"));
    }

    @Test
    void recallAt_replaysMemoizedEvents() {
        var seen = new ArrayList<RuleMatch>();
        Map<String, RuleObserver> observers = Map.of("Word", seen::add);
        var ctx = ParsingContext.create("abc", ParserConfig.DEFAULT, observers);
        int firstMatch = ctx.matchCount();
        ctx.advance();
        ctx.advance();
        ctx.notifyMatch("Word", SourceLocation.START);
        ctx.memoizeAt("Word", 0, ParseResult.Success.at(ctx.location()), firstMatch);

        var cached = ctx.recallAt("Word", 0);

        assertTrue(cached.isPresent());
        assertTrue(cached.get().isSuccess());
        assertEquals(List.of(seen.get(0), seen.get(0)), seen);
        assertEquals(1, ctx.cacheSize());
    }

    @Test
    void recallAt_unknownEntry_isEmpty() {
        var ctx = ParsingContext.create("abc", ParserConfig.DEFAULT);

        assertTrue(ctx.recallAt("Word", 0).isEmpty());
    }

    @Test
    void packratDisabled_neverCaches() {
        var ctx = ParsingContext.create("abc", ParserConfig.NO_PACKRAT);

        ctx.memoizeAt("Word", 0, ParseResult.Success.at(SourceLocation.START), 0);

        assertFalse(ctx.isPackratEnabled());
        assertTrue(ctx.recallAt("Word", 0).isEmpty());
        assertEquals(0, ctx.cacheSize());
    }
}
