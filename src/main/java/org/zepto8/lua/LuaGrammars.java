package org.zepto8.lua;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.zepto8.peg.error.GrammarException;
import org.zepto8.peg.error.ParseException;
import org.zepto8.peg.grammar.Grammar;
import org.zepto8.peg.grammar.GrammarAnalyzer;
import org.zepto8.peg.grammar.GrammarParser;
import org.zepto8.peg.parser.Parser;
import org.zepto8.peg.parser.ParserConfig;
import org.zepto8.peg.parser.PegEngine;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/**
 * The Lua 5.3 and PICO-8 grammars, loaded from classpath resources and self-checked once.
 */
public final class LuaGrammars {
    private static final Logger log = LoggerFactory.getLogger(LuaGrammars.class);

    public static final String CHUNK = "Chunk";
    public static final String NOT_EQUAL_OPERATOR = "NotEqualOperator";
    public static final String REASSIGNMENT = "Reassignment";
    public static final String SHORT_IF_STATEMENT = "ShortIfStatement";

    static final String LUA53_RESOURCE = "lua53.peg";
    static final String PICO8_RESOURCE = "pico8.peg";

    private LuaGrammars() {}

    // Initialization-on-demand holder: grammars are built on first use only
    private static final class Holder {
        static final Grammar STANDARD = load(LUA53_RESOURCE);
        static final Grammar PICO8 = checked(STANDARD.extendWith(GrammarParser.parse(read(PICO8_RESOURCE))));

        private static Grammar load(String resource) {
            return checked(GrammarParser.parse(read(resource)));
        }

        private static Grammar checked(Grammar grammar) {
            log.info("Checking grammar");
            return GrammarAnalyzer.of(grammar)
                                  .check();
        }
    }

    /**
     * Standard Lua 5.3 grammar.
     *
     * @throws GrammarException if the bundled grammar is defective
     */
    public static Grammar standard() {
        return Holder.STANDARD;
    }

    /**
     * Lua 5.3 grammar extended with the PICO-8 dialect rules.
     *
     * @throws GrammarException if the bundled grammar is defective
     */
    public static Grammar pico8() {
        return Holder.PICO8;
    }

    public static Grammar grammar(LuaDialect dialect) {
        return dialect == LuaDialect.PICO8
               ? pico8()
               : standard();
    }

    /**
     * Parser for a dialect. Grammars are already checked, so no further analysis runs here.
     */
    public static Parser parser(LuaDialect dialect, ParserConfig config) {
        return PegEngine.create(grammar(dialect), config);
    }

    /**
     * Check that a whole source text is syntactically valid.
     *
     * @throws ParseException locating the first syntax error
     */
    public static void check(String source, LuaDialect dialect) throws ParseException {
        parser(dialect, ParserConfig.DEFAULT).parse(source, CHUNK);
    }

    private static String read(String resource) {
        try (InputStream in = LuaGrammars.class.getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalStateException("Missing grammar resource: " + resource);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read grammar resource: " + resource, e);
        }
    }
}
