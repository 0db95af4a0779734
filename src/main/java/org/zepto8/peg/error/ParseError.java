package org.zepto8.peg.error;

import org.zepto8.peg.text.SourceLocation;

import java.util.List;

/**
 * Parse error with location and context information.
 */
public sealed interface ParseError {
    SourceLocation location();

    String message();

    /**
     * Unexpected input error.
     */
    record UnexpectedInput(
    SourceLocation location,
    String found,
    String expected) implements ParseError {
        @Override
        public String message() {
            return "Unexpected '" + found + "' at " + location + ", expected " + expected;
        }
    }

    /**
     * Unexpected end of input.
     */
    record UnexpectedEof(
    SourceLocation location,
    String expected) implements ParseError {
        @Override
        public String message() {
            return "Unexpected end of input at " + location + ", expected " + expected;
        }
    }

    /**
     * Structural problem in grammar text or in a request made against a grammar.
     */
    record SemanticError(
    SourceLocation location,
    String reason) implements ParseError {
        @Override
        public String message() {
            return reason + " at " + location;
        }
    }

    /**
     * A rule can reach itself without consuming input.
     */
    record LeftRecursion(
    SourceLocation location,
    List<String> cycle) implements ParseError {
        public LeftRecursion {
            cycle = List.copyOf(cycle);
        }

        @Override
        public String message() {
            return "Left recursion " + String.join(" -> ", cycle) + " at " + location;
        }
    }

    /**
     * A repetition whose body can succeed without consuming input would loop forever.
     */
    record EmptyRepetition(
    SourceLocation location,
    String rule) implements ParseError {
        @Override
        public String message() {
            return "Repetition of an expression that can match empty input in rule '" + rule + "' at " + location;
        }
    }
}
