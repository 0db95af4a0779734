package org.zepto8.peg.action;

/**
 * Callback invoked each time the rule it is registered for succeeds.
 *
 * <p>Observers also fire inside alternatives that the parser later abandons,
 * so anything recorded here must tolerate backtracking.
 */
@FunctionalInterface
public interface RuleObserver {
    void onMatch(RuleMatch match);
}
