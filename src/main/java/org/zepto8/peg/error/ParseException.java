package org.zepto8.peg.error;

import org.zepto8.peg.text.SourceLocation;
import org.zepto8.peg.text.SourceSpan;

/**
 * Input text does not conform to the grammar.
 */
public final class ParseException extends Exception {
    private final ParseError error;

    public ParseException(ParseError error) {
        super(error.message());
        this.error = error;
    }

    public ParseError error() {
        return error;
    }

    public SourceLocation location() {
        return error.location();
    }

    /**
     * Render this error as a diagnostic pointing at the failure location.
     */
    public Diagnostic diagnostic() {
        var diagnostic = Diagnostic.error("syntax error", SourceSpan.at(error.location()));
        if (error instanceof ParseError.UnexpectedInput unexpected) {
            return diagnostic.withLabel("found '" + unexpected.found() + "'")
                             .withHelp("expected " + unexpected.expected());
        }
        if (error instanceof ParseError.UnexpectedEof eof) {
            return diagnostic.withLabel("found end of input")
                             .withHelp("expected " + eof.expected());
        }
        return diagnostic.withLabel(error.message());
    }
}
