package org.zepto8.peg.error;

/**
 * A defect in a grammar: malformed grammar text, undefined rules, or constructions that
 * would make parsing non-terminating. Not related to any particular input.
 */
public final class GrammarException extends IllegalStateException {
    private final ParseError error;

    public GrammarException(ParseError error) {
        super(error.message());
        this.error = error;
    }

    public ParseError error() {
        return error;
    }
}
