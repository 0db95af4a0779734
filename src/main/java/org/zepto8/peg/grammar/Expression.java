package org.zepto8.peg.grammar;

import org.zepto8.peg.text.SourceSpan;

import java.util.List;
import java.util.OptionalInt;

/**
 * PEG expression types - the building blocks of grammar rules.
 */
public sealed interface Expression {

    /**
     * Source location of this expression in the grammar text.
     */
    SourceSpan span();

    // === Terminals ===

    /**
     * Literal string match: 'text', "text" or 'text'i
     */
    record Literal(SourceSpan span, String text, boolean caseInsensitive) implements Expression {}

    /**
     * Character class: [a-z], [^a-z]
     */
    record CharClass(SourceSpan span, String pattern, boolean negated, boolean caseInsensitive) implements Expression {}

    /**
     * Any character: .
     */
    record Any(SourceSpan span) implements Expression {}

    /**
     * Rule reference: RuleName
     */
    record Reference(SourceSpan span, String ruleName) implements Expression {}

    // === Combinators ===

    record Sequence(SourceSpan span, List<Expression> elements) implements Expression {}

    /**
     * Ordered choice: the first alternative that succeeds wins.
     */
    record Choice(SourceSpan span, List<Expression> alternatives) implements Expression {}

    // === Repetition ===

    record ZeroOrMore(SourceSpan span, Expression expression) implements Expression {}

    record OneOrMore(SourceSpan span, Expression expression) implements Expression {}

    record Optional(SourceSpan span, Expression expression) implements Expression {}

    /**
     * Bounded repetition: e{n}, e{n,}, e{n,m}. An empty max means unbounded.
     */
    record Repetition(SourceSpan span, Expression expression, int min, OptionalInt max) implements Expression {}

    // === Predicates ===

    /**
     * Positive lookahead: &e
     */
    record And(SourceSpan span, Expression expression) implements Expression {}

    /**
     * Negative lookahead: !e
     */
    record Not(SourceSpan span, Expression expression) implements Expression {}

    // === Special ===

    /**
     * Named capture: $name< e >
     */
    record Capture(SourceSpan span, String name, Expression expression) implements Expression {}

    /**
     * Back-reference to the last text captured under the name: $name
     */
    record BackReference(SourceSpan span, String name) implements Expression {}

    /**
     * Commit point: ^ or ↑. Once passed, failure of the rest of the enclosing sequence is fatal.
     */
    record Cut(SourceSpan span) implements Expression {}

    /**
     * Grouping: ( e )
     */
    record Group(SourceSpan span, Expression expression) implements Expression {}

    /**
     * Direct sub-expressions, in evaluation order.
     */
    default List<Expression> children() {
        if (this instanceof Sequence seq) {
            return seq.elements();
        }
        if (this instanceof Choice choice) {
            return choice.alternatives();
        }
        if (this instanceof ZeroOrMore zom) {
            return List.of(zom.expression());
        }
        if (this instanceof OneOrMore oom) {
            return List.of(oom.expression());
        }
        if (this instanceof Optional opt) {
            return List.of(opt.expression());
        }
        if (this instanceof Repetition rep) {
            return List.of(rep.expression());
        }
        if (this instanceof And and) {
            return List.of(and.expression());
        }
        if (this instanceof Not not) {
            return List.of(not.expression());
        }
        if (this instanceof Capture cap) {
            return List.of(cap.expression());
        }
        if (this instanceof Group grp) {
            return List.of(grp.expression());
        }
        return List.of();
    }
}
