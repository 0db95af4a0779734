package org.zepto8.peg.parser;

import org.zepto8.peg.action.RuleObserver;
import org.zepto8.peg.error.ParseException;
import org.zepto8.peg.text.SourceSpan;

import java.util.Map;

/**
 * Recognizer for a grammar. Every parse must consume the whole input.
 */
public interface Parser {

    /**
     * Recognize input starting from the grammar's first rule.
     *
     * @return span covering the whole input
     */
    SourceSpan parse(String input) throws ParseException;

    /**
     * Recognize input starting from the named rule.
     */
    SourceSpan parse(String input, String startRule) throws ParseException;

    /**
     * Recognize input, reporting every successful match of the observed rules.
     *
     * @param observers observer per rule name; every name must be defined in the grammar
     */
    SourceSpan parse(String input, String startRule, Map<String, RuleObserver> observers) throws ParseException;

    /**
     * Whether the whole input is recognized from the grammar's first rule.
     */
    default boolean matches(String input) {
        try {
            parse(input);
            return true;
        } catch (ParseException e) {
            return false;
        }
    }
}
