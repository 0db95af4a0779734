package org.zepto8.fixer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.zepto8.lua.LuaGrammars;
import org.zepto8.peg.action.RuleMatch;
import org.zepto8.peg.action.RuleObserver;
import org.zepto8.peg.error.Diagnostic;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Facts collected while the analysis parse runs.
 *
 * <p>Observers fire on every successful rule match, including matches inside alternatives
 * that are later abandoned. Each collection absorbs that differently:
 * <ul>
 *     <li>{@code !=} offsets are kept ordered; a new offset discards every recorded offset at
 *     or after it, since those can only come from input the parser is now re-reading.</li>
 *     <li>Compound assignments and single-line ifs are de-duplicated by location.</li>
 * </ul>
 */
public final class AnalysisContext {
    private static final Logger log = LoggerFactory.getLogger(AnalysisContext.class);

    private static final String SHORT_IF_MESSAGE = "unsupported single-line if";

    private final List<Integer> notEqualOffsets = new ArrayList<>();
    private final Set<Reassignment> reassignments = new LinkedHashSet<>();
    private final Set<Diagnostic> diagnostics = new LinkedHashSet<>();

    /**
     * Observers to register with the PICO-8 parser, keyed by rule name.
     */
    public Map<String, RuleObserver> observers() {
        return Map.of(LuaGrammars.NOT_EQUAL_OPERATOR, this::onNotEqual,
                      LuaGrammars.REASSIGNMENT, this::onReassignment,
                      LuaGrammars.SHORT_IF_STATEMENT, this::onShortIf);
    }

    void onNotEqual(RuleMatch match) {
        int offset = match.offset();
        while (!notEqualOffsets.isEmpty() && notEqualOffsets.get(notEqualOffsets.size() - 1) >= offset) {
            notEqualOffsets.remove(notEqualOffsets.size() - 1);
        }
        notEqualOffsets.add(offset);
    }

    void onReassignment(RuleMatch match) {
        var reassignment = new Reassignment(match.line(), match.columnInLine(), match.length());
        if (reassignments.add(reassignment)) {
            log.info("Reassignment at {}:{} byte {}: {}",
                     match.line(), match.columnInLine(), match.offset(), match.text());
        }
    }

    void onShortIf(RuleMatch match) {
        var diagnostic = Diagnostic.warning(SHORT_IF_MESSAGE, match.span())
                                   .withLabel("left unchanged")
                                   .withHelp("rewrite as 'if (...) then ... end'");
        if (diagnostics.add(diagnostic)) {
            log.warn("Unsupported short if at {}: {}", match.span().start(), match.text());
        }
    }

    public void clear() {
        notEqualOffsets.clear();
        reassignments.clear();
        diagnostics.clear();
    }

    /**
     * Offsets of the {@code !=} operators in the accepted parse, ascending.
     */
    public List<Integer> notEqualOffsets() {
        return List.copyOf(notEqualOffsets);
    }

    /**
     * Compound assignments in the order they were first recognized.
     */
    public List<Reassignment> reassignments() {
        return List.copyOf(reassignments);
    }

    public List<Diagnostic> diagnostics() {
        return List.copyOf(diagnostics);
    }
}
