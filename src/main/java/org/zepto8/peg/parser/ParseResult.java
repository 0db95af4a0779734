package org.zepto8.peg.parser;

import org.zepto8.peg.text.SourceLocation;

/**
 * Result of parsing an expression.
 */
public sealed interface ParseResult {

    boolean isSuccess();

    default boolean isFailure() {
        return !isSuccess();
    }

    /**
     * Successful match ending at the given location. Predicates end where they started.
     */
    record Success(SourceLocation endLocation) implements ParseResult {
        @Override
        public boolean isSuccess() {
            return true;
        }

        public static Success at(SourceLocation endLocation) {
            return new Success(endLocation);
        }
    }

    /**
     * No match at the current position; enclosing choices may try other alternatives.
     */
    record Failure(SourceLocation location, String expected) implements ParseResult {
        @Override
        public boolean isSuccess() {
            return false;
        }

        public static Failure at(SourceLocation location, String expected) {
            return new Failure(location, expected);
        }
    }

    /**
     * Failure after a commit point ({@code ^}). Propagates through every enclosing
     * construct and ends the parse.
     */
    record CutFailure(SourceLocation location, String expected) implements ParseResult {
        @Override
        public boolean isSuccess() {
            return false;
        }

        public static CutFailure at(SourceLocation location, String expected) {
            return new CutFailure(location, expected);
        }
    }
}
