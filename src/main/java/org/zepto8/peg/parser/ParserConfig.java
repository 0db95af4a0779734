package org.zepto8.peg.parser;

/**
 * Parser configuration options.
 *
 * @param packratEnabled memoize rule results per input position
 */
public record ParserConfig(boolean packratEnabled) {
    public static final ParserConfig DEFAULT = new ParserConfig(true);

    public static final ParserConfig NO_PACKRAT = new ParserConfig(false);
}
