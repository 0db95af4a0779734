package org.zepto8.peg;

import org.zepto8.peg.grammar.Grammar;
import org.zepto8.peg.grammar.GrammarAnalyzer;
import org.zepto8.peg.grammar.GrammarParser;
import org.zepto8.peg.parser.Parser;
import org.zepto8.peg.parser.ParserConfig;
import org.zepto8.peg.parser.PegEngine;

/**
 * Entry point for creating PEG parsers.
 *
 * <p>Example usage:
 * <pre>{@code
 * var parser = PegParser.fromGrammar("""
 *     List   <- Item (',' ^ Item)*
 *     Item   <- [a-z]+
 *     """);
 *
 * parser.parse("a,b,c");
 * }</pre>
 *
 * <p>Every factory validates the grammar and runs the structural self-check, throwing
 * {@link org.zepto8.peg.error.GrammarException} on a defect.
 */
public final class PegParser {
    private PegParser() {}

    /**
     * Create a parser from grammar text.
     */
    public static Parser fromGrammar(String grammarText) {
        return fromGrammar(grammarText, ParserConfig.DEFAULT);
    }

    /**
     * Create a parser from grammar text with custom configuration.
     */
    public static Parser fromGrammar(String grammarText, ParserConfig config) {
        return fromGrammar(GrammarParser.parse(grammarText), config);
    }

    /**
     * Create a parser from a pre-parsed grammar.
     */
    public static Parser fromGrammar(Grammar grammar) {
        return fromGrammar(grammar, ParserConfig.DEFAULT);
    }

    /**
     * Create a parser from a pre-parsed grammar with custom configuration.
     */
    public static Parser fromGrammar(Grammar grammar, ParserConfig config) {
        return PegEngine.create(GrammarAnalyzer.of(grammar)
                                               .check(),
                                config);
    }

    /**
     * Create a builder for more complex parser configuration.
     */
    public static Builder builder(String grammarText) {
        return new Builder(grammarText);
    }

    public static final class Builder {
        private final String grammarText;
        private boolean packratEnabled = true;

        private Builder(String grammarText) {
            this.grammarText = grammarText;
        }

        public Builder packrat(boolean enabled) {
            this.packratEnabled = enabled;
            return this;
        }

        public Parser build() {
            return fromGrammar(grammarText, new ParserConfig(packratEnabled));
        }
    }
}
