package org.zepto8.peg.grammar;

import org.zepto8.peg.error.GrammarException;
import org.zepto8.peg.error.ParseError;
import org.zepto8.peg.text.SourceLocation;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * A complete PEG grammar - ordered collection of rules. The first rule is the start rule.
 */
public record Grammar(List<Rule> rules) {

    public Grammar {
        rules = List.copyOf(rules);
    }

    public Optional<Rule> rule(String name) {
        return rules.stream()
                    .filter(r -> r.name()
                                  .equals(name))
                    .findFirst();
    }

    public Optional<Rule> startRule() {
        return rules.isEmpty()
               ? Optional.empty()
               : Optional.of(rules.get(0));
    }

    /**
     * Build a lookup map for efficient rule access. Later definitions of a name win.
     */
    public Map<String, Rule> ruleMap() {
        return rules.stream()
                    .collect(Collectors.toMap(Rule::name, r -> r, (first, second) -> second, LinkedHashMap::new));
    }

    /**
     * Overlay another grammar: its rules replace same-named rules in place, new ones are appended.
     */
    public Grammar extendWith(Grammar extension) {
        var merged = new LinkedHashMap<String, Rule>(ruleMap());
        for (var rule : extension.rules()) {
            merged.put(rule.name(), rule);
        }
        return new Grammar(new ArrayList<>(merged.values()));
    }

    /**
     * Check that the grammar has rules and that every reference names a defined rule.
     *
     * @throws GrammarException on the first problem found
     */
    public Grammar validate() {
        if (rules.isEmpty()) {
            throw new GrammarException(new ParseError.SemanticError(SourceLocation.START, "Grammar defines no rules"));
        }
        var ruleNames = rules.stream()
                             .map(Rule::name)
                             .collect(Collectors.toSet());
        for (var rule : rules) {
            findUndefinedReference(rule.expression(), ruleNames)
                .ifPresent(ref -> {
                    throw new GrammarException(new ParseError.SemanticError(ref.span()
                                                                               .start(),
                                                                            "Undefined rule reference: '" + ref.ruleName() + "'"));
                });
        }
        return this;
    }

    private Optional<Expression.Reference> findUndefinedReference(Expression expr, Set<String> ruleNames) {
        if (expr instanceof Expression.Reference ref) {
            return ruleNames.contains(ref.ruleName())
                   ? Optional.empty()
                   : Optional.of(ref);
        }
        return expr.children()
                   .stream()
                   .map(child -> findUndefinedReference(child, ruleNames))
                   .flatMap(Optional::stream)
                   .findFirst();
    }
}
