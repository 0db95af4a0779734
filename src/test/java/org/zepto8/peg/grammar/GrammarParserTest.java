package org.zepto8.peg.grammar;

import org.junit.jupiter.api.Test;
import org.zepto8.peg.error.GrammarException;

import static org.junit.jupiter.api.Assertions.*;

class GrammarParserTest {

    @Test
    void parse_singleRule_namesStartRule() {
        var grammar = GrammarParser.parse("Number <- [0-9]+");

        assertEquals(1, grammar.rules().size());
        assertEquals("Number", grammar.startRule().orElseThrow().name());
    }

    @Test
    void parse_multipleRules_keepsOrder() {
        var grammar = GrammarParser.parse("""
            Sum <- Term ('+' Term)*
            Term <- [0-9]+
            """);

        assertEquals(2, grammar.rules().size());
        assertEquals("Sum", grammar.rules().get(0).name());
        assertEquals("Term", grammar.rules().get(1).name());
    }

    @Test
    void parse_choice_buildsChoiceExpression() {
        var rule = GrammarParser.parse("Root <- 'a' / 'b' / 'c'").rules().get(0);

        var choice = assertInstanceOf(Expression.Choice.class, rule.expression());
        assertEquals(3, choice.alternatives().size());
    }

    @Test
    void parse_sequenceWithCut_keepsCutAsElement() {
        var rule = GrammarParser.parse("Root <- 'a' ^ 'b'").rules().get(0);

        var sequence = assertInstanceOf(Expression.Sequence.class, rule.expression());
        assertEquals(3, sequence.elements().size());
        assertInstanceOf(Expression.Cut.class, sequence.elements().get(1));
    }

    @Test
    void parse_suffixOperators_buildRepetitions() {
        var grammar = GrammarParser.parse("""
            Star <- 'a'*
            Plus <- 'a'+
            Opt <- 'a'?
            """);

        assertInstanceOf(Expression.ZeroOrMore.class, grammar.rule("Star").orElseThrow().expression());
        assertInstanceOf(Expression.OneOrMore.class, grammar.rule("Plus").orElseThrow().expression());
        assertInstanceOf(Expression.Optional.class, grammar.rule("Opt").orElseThrow().expression());
    }

    @Test
    void parse_boundedRepetition_readsLimits() {
        var grammar = GrammarParser.parse("""
            Range <- [0-9]{1,3}
            Exact <- [0-9]{2}
            Open <- [0-9]{2,}
            """);

        var range = (Expression.Repetition) grammar.rule("Range").orElseThrow().expression();
        assertEquals(1, range.min());
        assertEquals(3, range.max().getAsInt());

        var exact = (Expression.Repetition) grammar.rule("Exact").orElseThrow().expression();
        assertEquals(2, exact.min());
        assertEquals(2, exact.max().getAsInt());

        var open = (Expression.Repetition) grammar.rule("Open").orElseThrow().expression();
        assertEquals(2, open.min());
        assertTrue(open.max().isEmpty());
    }

    @Test
    void parse_predicates_buildAndNot() {
        var grammar = GrammarParser.parse("""
            Ahead <- &'a' .
            Except <- !'a' .
            """);

        var ahead = (Expression.Sequence) grammar.rule("Ahead").orElseThrow().expression();
        assertInstanceOf(Expression.And.class, ahead.elements().get(0));
        var except = (Expression.Sequence) grammar.rule("Except").orElseThrow().expression();
        assertInstanceOf(Expression.Not.class, except.elements().get(0));
    }

    @Test
    void parse_captureAndBackReference_readNames() {
        var grammar = GrammarParser.parse("Tag <- $name<[a-z]+> '-' $name");

        var sequence = (Expression.Sequence) grammar.rules().get(0).expression();
        var capture = assertInstanceOf(Expression.Capture.class, sequence.elements().get(0));
        assertEquals("name", capture.name());
        var backReference = assertInstanceOf(Expression.BackReference.class, sequence.elements().get(2));
        assertEquals("name", backReference.name());
    }

    @Test
    void parse_caseInsensitiveSuffix_setsFlag() {
        var grammar = GrammarParser.parse("""
            Word <- 'select'i
            Letter <- [a-z]i
            """);

        var literal = (Expression.Literal) grammar.rule("Word").orElseThrow().expression();
        assertTrue(literal.caseInsensitive());
        assertEquals("select", literal.text());
        var letter = (Expression.CharClass) grammar.rule("Letter").orElseThrow().expression();
        assertTrue(letter.caseInsensitive());
    }

    @Test
    void parse_referenceStartingWithI_isNotCaseInsensitiveSuffix() {
        var grammar = GrammarParser.parse("""
            Root <- 'a'item
            item <- 'b'
            """);

        var sequence = (Expression.Sequence) grammar.rules().get(0).expression();
        var literal = (Expression.Literal) sequence.elements().get(0);
        assertFalse(literal.caseInsensitive());
        assertInstanceOf(Expression.Reference.class, sequence.elements().get(1));
    }

    @Test
    void parse_negatedCharClass_keepsPatternVerbatim() {
        var grammar = GrammarParser.parse("Rest <- [^\\r\\n]");

        var charClass = (Expression.CharClass) grammar.rules().get(0).expression();
        assertTrue(charClass.negated());
        assertEquals("\\r\\n", charClass.pattern());
    }

    @Test
    void parse_stringEscapes_areDecoded() {
        var grammar = GrammarParser.parse("Newline <- '\\r\\n'");

        var literal = (Expression.Literal) grammar.rules().get(0).expression();
        assertEquals("\r\n", literal.text());
    }

    @Test
    void parse_comments_areIgnored() {
        var grammar = GrammarParser.parse("""
            # leading comment
            Root <- 'a' # trailing comment
            # between rules
            Other <- 'b'
            """);

        assertEquals(2, grammar.rules().size());
    }

    @Test
    void parse_missingArrow_throwsGrammarException() {
        assertThrows(GrammarException.class, () -> GrammarParser.parse("Root 'a'"));
    }

    @Test
    void parse_unterminatedLiteral_throwsGrammarException() {
        var exception = assertThrows(GrammarException.class, () -> GrammarParser.parse("Root <- 'abc"));

        assertTrue(exception.getMessage().contains("Unterminated"));
    }

    @Test
    void parse_unbalancedParenthesis_throwsGrammarException() {
        assertThrows(GrammarException.class, () -> GrammarParser.parse("Root <- ('a' 'b'"));
    }

    @Test
    void parse_invertedRepetitionBounds_throwsGrammarException() {
        assertThrows(GrammarException.class, () -> GrammarParser.parse("Root <- 'a'{3,1}"));
    }
}
