package org.zepto8.peg;

import org.junit.jupiter.api.Test;
import org.zepto8.peg.error.GrammarException;
import org.zepto8.peg.error.ParseError;
import org.zepto8.peg.error.ParseException;

import static org.junit.jupiter.api.Assertions.*;

class PegParserTest {

    @Test
    void parse_simpleLiteral_succeeds() throws ParseException {
        var parser = PegParser.fromGrammar("Root <- 'hello'");
        var span = parser.parse("hello");

        assertEquals(0, span.start().offset());
        assertEquals(5, span.end().offset());
    }

    @Test
    void parse_simpleLiteral_failsOnMismatch() {
        var parser = PegParser.fromGrammar("Root <- 'hello'");

        assertThrows(ParseException.class, () -> parser.parse("world"));
    }

    @Test
    void parse_characterClass_matchesRange() {
        var parser = PegParser.fromGrammar("Digit <- [0-9]");

        assertTrue(parser.matches("5"));
        assertTrue(parser.matches("0"));
        assertTrue(parser.matches("9"));
        assertFalse(parser.matches("a"));
    }

    @Test
    void parse_negatedCharClass_matchesComplement() {
        var parser = PegParser.fromGrammar("NonDigit <- [^0-9]");

        assertTrue(parser.matches("a"));
        assertTrue(parser.matches("Z"));
        assertFalse(parser.matches("5"));
    }

    @Test
    void parse_charClassEscapes_matchControlCharacters() {
        var parser = PegParser.fromGrammar("Space <- [ \\t\\r\\n\\x0B]+");

        assertTrue(parser.matches(" \t\r\n\u000B"));
        assertFalse(parser.matches("x"));
    }

    @Test
    void parse_escapedDashInClass_isLiteral() {
        var parser = PegParser.fromGrammar("Sign <- [+\\-]");

        assertTrue(parser.matches("+"));
        assertTrue(parser.matches("-"));
        assertFalse(parser.matches(","));
    }

    @Test
    void parse_anyChar_matchesSingle() {
        var parser = PegParser.fromGrammar("Any <- .");

        assertTrue(parser.matches("a"));
        assertTrue(parser.matches("1"));
        assertFalse(parser.matches(""));
    }

    @Test
    void parse_sequence_matchesAll() {
        var parser = PegParser.fromGrammar("ABC <- 'a' 'b' 'c'");

        assertTrue(parser.matches("abc"));
        assertFalse(parser.matches("ab"));
        assertFalse(parser.matches("abd"));
    }

    @Test
    void parse_choice_matchesFirst() {
        var parser = PegParser.fromGrammar("Choice <- 'a' / 'b' / 'c'");

        assertTrue(parser.matches("a"));
        assertTrue(parser.matches("b"));
        assertTrue(parser.matches("c"));
        assertFalse(parser.matches("d"));
    }

    @Test
    void parse_orderedChoice_doesNotRetryLongerAlternative() {
        var parser = PegParser.fromGrammar("Root <- ('a' / 'ab') 'c'");

        assertTrue(parser.matches("ac"));
        assertFalse(parser.matches("abc"));
    }

    @Test
    void parse_zeroOrMore_matchesNone() {
        var parser = PegParser.fromGrammar("Stars <- 'a'*");

        assertTrue(parser.matches(""));
        assertTrue(parser.matches("a"));
        assertTrue(parser.matches("aaaa"));
    }

    @Test
    void parse_oneOrMore_requiresOne() {
        var parser = PegParser.fromGrammar("Pluses <- 'a'+");

        assertFalse(parser.matches(""));
        assertTrue(parser.matches("aaa"));
    }

    @Test
    void parse_optional_matchesZeroOrOne() {
        var parser = PegParser.fromGrammar("Opt <- 'a'? 'b'");

        assertTrue(parser.matches("b"));
        assertTrue(parser.matches("ab"));
        assertFalse(parser.matches("aab"));
    }

    @Test
    void parse_boundedRepetition_enforcesLimits() {
        var parser = PegParser.fromGrammar("Byte <- [0-9]{1,3}");

        assertTrue(parser.matches("1"));
        assertTrue(parser.matches("123"));
        assertFalse(parser.matches(""));
        assertFalse(parser.matches("1234"));
    }

    @Test
    void parse_exactRepetition_requiresCount() {
        var parser = PegParser.fromGrammar("Hex <- [0-9a-f]{2}");

        assertTrue(parser.matches("ff"));
        assertFalse(parser.matches("f"));
        assertFalse(parser.matches("fff"));
    }

    @Test
    void parse_andPredicate_doesNotConsume() {
        var parser = PegParser.fromGrammar("Root <- &'a' [a-z]+");

        assertTrue(parser.matches("abc"));
        assertFalse(parser.matches("bcd"));
    }

    @Test
    void parse_notPredicate_excludesMatch() {
        var parser = PegParser.fromGrammar("""
            Name <- !Keyword [a-z]+
            Keyword <- 'end' ![a-z]
            """);

        assertTrue(parser.matches("ending"));
        assertTrue(parser.matches("foo"));
        assertFalse(parser.matches("end"));
    }

    @Test
    void parse_caseInsensitiveLiteral_ignoresCase() {
        var parser = PegParser.fromGrammar("Hex <- '0x'i [0-9a-f]i+");

        assertTrue(parser.matches("0xFF"));
        assertTrue(parser.matches("0Xab"));
        assertFalse(parser.matches("0yff"));
    }

    @Test
    void parse_backReference_matchesCapturedText() {
        var parser = PegParser.fromGrammar("""
            Bracket <- '[' $level<'='*> '[' (!Close .)* Close
            Close <- ']' $level ']'
            """);

        assertTrue(parser.matches("[[text]]"));
        assertTrue(parser.matches("[==[a]]b]=]c]==]"));
        assertFalse(parser.matches("[=[text]]"));
    }

    @Test
    void parse_ruleReference_followsRecursion() {
        var parser = PegParser.fromGrammar("""
            Parens <- '(' Parens? ')'
            """);

        assertTrue(parser.matches("((()))"));
        assertFalse(parser.matches("(()"));
    }

    @Test
    void parse_startRule_usesNamedRule() throws ParseException {
        var parser = PegParser.fromGrammar("""
            Word <- [a-z]+
            Number <- [0-9]+
            """);

        assertEquals(3, parser.parse("123", "Number").end().offset());
        assertThrows(ParseException.class, () -> parser.parse("123"));
    }

    @Test
    void parse_unknownStartRule_throwsIllegalArgument() {
        var parser = PegParser.fromGrammar("Root <- 'a'");

        assertThrows(IllegalArgumentException.class, () -> parser.parse("a", "Missing"));
    }

    @Test
    void parse_trailingInput_reportsEndOfInputExpected() {
        var parser = PegParser.fromGrammar("Root <- 'a'");

        var exception = assertThrows(ParseException.class, () -> parser.parse("ab"));
        var error = assertInstanceOf(ParseError.UnexpectedInput.class, exception.error());
        assertEquals("b", error.found());
        assertEquals("end of input", error.expected());
        assertEquals(2, error.location().column());
    }

    @Test
    void parse_truncatedInput_reportsUnexpectedEof() {
        var parser = PegParser.fromGrammar("Root <- 'a' 'b'");

        var exception = assertThrows(ParseException.class, () -> parser.parse("a"));
        var error = assertInstanceOf(ParseError.UnexpectedEof.class, exception.error());
        assertEquals("'b'", error.expected());
        assertEquals(1, error.location().offset());
    }

    @Test
    void parse_error_reportsFurthestFailure() {
        var parser = PegParser.fromGrammar("""
            List <- Item (',' Item)*
            Item <- [a-z]+
            """);

        var exception = assertThrows(ParseException.class, () -> parser.parse("abc,de,9"));
        assertEquals(7, exception.location().offset());
        assertTrue(exception.getMessage().contains("'9'"));
    }

    @Test
    void parse_errorOnLaterLine_reportsLineAndColumn() {
        var parser = PegParser.fromGrammar("""
            Lines <- Line ('\\n' Line)*
            Line <- [a-z]*
            """);

        var exception = assertThrows(ParseException.class, () -> parser.parse("ab\ncd\nx1"));
        assertEquals(3, exception.location().line());
        assertEquals(2, exception.location().column());
    }

    @Test
    void fromGrammar_undefinedReference_throwsGrammarException() {
        var exception = assertThrows(GrammarException.class, () -> PegParser.fromGrammar("Root <- Missing"));

        assertTrue(exception.getMessage().contains("Missing"));
    }

    @Test
    void fromGrammar_leftRecursion_throwsGrammarException() {
        assertThrows(GrammarException.class, () -> PegParser.fromGrammar("Expr <- Expr '+' 'n' / 'n'"));
    }

    @Test
    void builder_withoutPackrat_parsesSameLanguage() {
        var grammar = """
            Sum <- Term ('+' Term)*
            Term <- [0-9]+ / '(' Sum ')'
            """;
        var memoizing = PegParser.builder(grammar).packrat(true).build();
        var plain = PegParser.builder(grammar).packrat(false).build();

        for (var input : new String[]{"1+2", "(1+(2+3))+4", "1+", "(1"}) {
            assertEquals(memoizing.matches(input), plain.matches(input), input);
        }
    }
}
