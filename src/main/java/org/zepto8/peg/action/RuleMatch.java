package org.zepto8.peg.action;

import org.zepto8.peg.text.SourceSpan;

/**
 * A successful rule match reported to a {@link RuleObserver}.
 *
 * @param rule name of the matched rule
 * @param span matched region
 * @param text matched text
 */
public record RuleMatch(String rule, SourceSpan span, String text) {

    /**
     * 1-based line of the match start.
     */
    public int line() {
        return span.start()
                   .line();
    }

    /**
     * 0-based offset of the match start within its line.
     */
    public int columnInLine() {
        return span.start()
                   .columnInLine();
    }

    /**
     * Absolute 0-based offset of the match start.
     */
    public int offset() {
        return span.start()
                   .offset();
    }

    public int length() {
        return span.length();
    }
}
