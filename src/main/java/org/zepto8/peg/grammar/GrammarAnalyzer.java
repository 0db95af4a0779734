package org.zepto8.peg.grammar;

import org.zepto8.peg.error.GrammarException;
import org.zepto8.peg.error.ParseError;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Structural self-check of a grammar, independent of any input.
 *
 * <p>Rejects the two constructions that make a PEG interpreter loop forever:
 * a rule that can reach itself without consuming input (left recursion), and an
 * unbounded repetition whose body can succeed without consuming input.
 */
public final class GrammarAnalyzer {
    private final Grammar grammar;
    private final Map<String, Rule> rules;
    private final Set<String> nullable = new HashSet<>();

    private GrammarAnalyzer(Grammar grammar) {
        this.grammar = grammar;
        this.rules = grammar.ruleMap();
        computeNullable();
    }

    public static GrammarAnalyzer of(Grammar grammar) {
        return new GrammarAnalyzer(grammar.validate());
    }

    /**
     * Run all checks.
     *
     * @throws GrammarException describing the first defect found
     */
    public Grammar check() {
        for (var rule : grammar.rules()) {
            checkRepetitions(rule, rule.expression());
        }
        checkLeftRecursion();
        return grammar;
    }

    /**
     * Names of the rules that can succeed without consuming input.
     */
    public Set<String> nullableRules() {
        return Set.copyOf(nullable);
    }

    public boolean isNullable(Expression expr) {
        if (expr instanceof Expression.Literal lit) {
            return lit.text()
                      .isEmpty();
        }
        if (expr instanceof Expression.CharClass || expr instanceof Expression.Any) {
            return false;
        }
        if (expr instanceof Expression.Reference ref) {
            return nullable.contains(ref.ruleName());
        }
        if (expr instanceof Expression.Sequence seq) {
            return seq.elements()
                      .stream()
                      .allMatch(this::isNullable);
        }
        if (expr instanceof Expression.Choice choice) {
            return choice.alternatives()
                         .stream()
                         .anyMatch(this::isNullable);
        }
        if (expr instanceof Expression.OneOrMore oom) {
            return isNullable(oom.expression());
        }
        if (expr instanceof Expression.Repetition rep) {
            return rep.min() == 0 || isNullable(rep.expression());
        }
        if (expr instanceof Expression.Capture cap) {
            return isNullable(cap.expression());
        }
        if (expr instanceof Expression.Group grp) {
            return isNullable(grp.expression());
        }
        // ZeroOrMore, Optional, predicates, cut and back-references may all match nothing
        return true;
    }

    private void computeNullable() {
        boolean changed = true;
        while (changed) {
            changed = false;
            for (var rule : grammar.rules()) {
                if (!nullable.contains(rule.name()) && isNullable(rule.expression())) {
                    nullable.add(rule.name());
                    changed = true;
                }
            }
        }
    }

    private void checkRepetitions(Rule rule, Expression expr) {
        Expression body = null;
        if (expr instanceof Expression.ZeroOrMore zom) {
            body = zom.expression();
        } else if (expr instanceof Expression.OneOrMore oom) {
            body = oom.expression();
        } else if (expr instanceof Expression.Repetition rep && rep.max()
                                                                   .isEmpty()) {
            body = rep.expression();
        }
        if (body != null && isNullable(body)) {
            throw new GrammarException(new ParseError.EmptyRepetition(expr.span()
                                                                          .start(),
                                                                      rule.name()));
        }
        for (var child : expr.children()) {
            checkRepetitions(rule, child);
        }
    }

    // === Left recursion ===

    private void checkLeftRecursion() {
        var leftCalls = new HashMap<String, Set<String>>();
        for (var rule : grammar.rules()) {
            var calls = new LinkedHashSet<String>();
            collectLeftCalls(rule.expression(), calls);
            leftCalls.put(rule.name(), calls);
        }
        var finished = new HashSet<String>();
        for (var rule : grammar.rules()) {
            findCycle(rule.name(), leftCalls, new ArrayList<>(), finished);
        }
    }

    private void findCycle(String name, Map<String, Set<String>> leftCalls, List<String> path, Set<String> finished) {
        if (finished.contains(name)) {
            return;
        }
        int index = path.indexOf(name);
        if (index >= 0) {
            var cycle = new ArrayList<>(path.subList(index, path.size()));
            cycle.add(name);
            throw new GrammarException(new ParseError.LeftRecursion(rules.get(name)
                                                                         .span()
                                                                         .start(),
                                                                    cycle));
        }
        path.add(name);
        for (var callee : leftCalls.getOrDefault(name, Set.of())) {
            findCycle(callee, leftCalls, path, finished);
        }
        path.remove(path.size() - 1);
        finished.add(name);
    }

    /**
     * Rules that may be entered at the position where the expression starts.
     */
    private void collectLeftCalls(Expression expr, Set<String> calls) {
        if (expr instanceof Expression.Reference ref) {
            calls.add(ref.ruleName());
            return;
        }
        if (expr instanceof Expression.Sequence seq) {
            for (var element : seq.elements()) {
                collectLeftCalls(element, calls);
                if (!isNullable(element)) {
                    return;
                }
            }
            return;
        }
        for (var child : expr.children()) {
            collectLeftCalls(child, calls);
        }
    }
}
