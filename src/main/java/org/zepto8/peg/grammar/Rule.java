package org.zepto8.peg.grammar;

import org.zepto8.peg.text.SourceSpan;

/**
 * A grammar rule: Name <- Expression
 */
public record Rule(SourceSpan span, String name, Expression expression) {}
