package org.zepto8.fixer;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Lowers compound assignments: {@code a += b} becomes {@code a = a + (b)}.
 *
 * <p>The target is copied verbatim before the {@code =} and again, with comments dropped and
 * newlines flattened, after it, so the statement keeps its line count. Statements are
 * rewritten from the end of the text backwards; an enclosing statement still pending grows
 * by whatever a nested rewrite added.
 */
final class CompoundAssignmentRewriter {
    private static final String OPERATORS = "+-*/%";

    private CompoundAssignmentRewriter() {}

    static String apply(String code, List<Reassignment> reassignments) {
        if (reassignments.isEmpty()) {
            return code;
        }
        var lineStarts = lineStarts(code);
        var pending = new ArrayList<Region>();
        for (var reassignment : reassignments) {
            if (reassignment.line() < 1 || reassignment.line() > lineStarts.size()) {
                throw new IllegalStateException("Reassignment outside of code: " + reassignment);
            }
            int start = lineStarts.get(reassignment.line() - 1) + reassignment.column();
            pending.add(new Region(start, start + reassignment.length()));
        }
        pending.sort(Comparator.comparingInt((Region region) -> region.start).reversed());

        var sb = new StringBuilder(code);
        for (int i = 0; i < pending.size(); i++) {
            var region = pending.get(i);
            int delta = rewrite(sb, region);
            for (int j = i + 1; j < pending.size(); j++) {
                var outer = pending.get(j);
                if (outer.start <= region.start && outer.end >= region.end) {
                    outer.end += delta;
                }
            }
        }
        return sb.toString();
    }

    private static int rewrite(StringBuilder sb, Region region) {
        if (region.end > sb.length()) {
            throw new IllegalStateException("Reassignment outside of code at offset " + region.start);
        }
        int assign = findOperator(sb, region.start, region.end);
        if (assign < 0) {
            throw new IllegalStateException("No compound assignment operator in '"
                                            + sb.substring(region.start, region.end) + "'");
        }
        char operator = sb.charAt(assign - 1);
        var target = sb.substring(region.start, assign - 1);
        var value = sb.substring(assign + 1, region.end);
        var replacement = target + "=" + inlined(target) + operator + "(" + value + ")";
        sb.replace(region.start, region.end, replacement);
        return replacement.length() - (region.end - region.start);
    }

    /**
     * Index of the {@code =} of the first compound operator in the region, skipping strings
     * and comments inside the target, or -1.
     */
    static int findOperator(CharSequence text, int start, int end) {
        int i = start;
        while (i < end) {
            char c = text.charAt(i);
            if (c == '"' || c == '\'') {
                i = skipShortString(text, i, end);
            } else if (c == '[' && longBracketLevel(text, i, end) >= 0) {
                i = skipLongBracket(text, i, end);
            } else if (isCommentStart(text, i, end)) {
                i = skipComment(text, i, end);
            } else if (c == '=' && i > start && OPERATORS.indexOf(text.charAt(i - 1)) >= 0) {
                return i;
            } else {
                i++;
            }
        }
        return -1;
    }

    /**
     * Single-line copy of an assignment target with its comments dropped.
     */
    static String inlined(String target) {
        var sb = new StringBuilder(target.length());
        int end = target.length();
        int i = 0;
        while (i < end) {
            char c = target.charAt(i);
            int next;
            if (c == '"' || c == '\'') {
                next = skipShortString(target, i, end);
                sb.append(target, i, next);
            } else if (c == '[' && longBracketLevel(target, i, end) >= 0) {
                next = skipLongBracket(target, i, end);
                sb.append(target, i, next);
            } else if (isCommentStart(target, i, end)) {
                next = skipComment(target, i, end);
                sb.append(' ');
            } else {
                next = i + 1;
                sb.append(c);
            }
            i = next;
        }
        for (int k = 0; k < sb.length(); k++) {
            if (sb.charAt(k) == '\n' || sb.charAt(k) == '\r') {
                sb.setCharAt(k, ' ');
            }
        }
        return sb.toString();
    }

    private static boolean isCommentStart(CharSequence text, int i, int end) {
        return i + 1 < end && text.charAt(i) == '-' && text.charAt(i + 1) == '-';
    }

    private static int skipShortString(CharSequence text, int i, int end) {
        char quote = text.charAt(i);
        int j = i + 1;
        while (j < end) {
            char c = text.charAt(j);
            if (c == '\\') {
                j += 2;
            } else if (c == quote) {
                return j + 1;
            } else {
                j++;
            }
        }
        return end;
    }

    /**
     * Level of the opening long bracket at {@code i} ({@code [[} is 0, {@code [=[} is 1), or -1.
     */
    private static int longBracketLevel(CharSequence text, int i, int end) {
        int j = i + 1;
        while (j < end && text.charAt(j) == '=') {
            j++;
        }
        return j < end && text.charAt(j) == '[' ? j - i - 1 : -1;
    }

    private static int skipLongBracket(CharSequence text, int i, int end) {
        int level = longBracketLevel(text, i, end);
        var close = "]" + "=".repeat(level) + "]";
        int j = i + level + 2;
        while (j + close.length() <= end) {
            if (text.charAt(j) == ']' && close.contentEquals(text.subSequence(j, j + close.length()))) {
                return j + close.length();
            }
            j++;
        }
        return end;
    }

    private static int skipComment(CharSequence text, int i, int end) {
        int j = i + 2;
        if (j < end && text.charAt(j) == '[' && longBracketLevel(text, j, end) >= 0) {
            return skipLongBracket(text, j, end);
        }
        while (j < end && text.charAt(j) != '\n') {
            j++;
        }
        return j;
    }

    private static List<Integer> lineStarts(String code) {
        var starts = new ArrayList<Integer>();
        starts.add(0);
        for (int i = 0; i < code.length(); i++) {
            if (code.charAt(i) == '\n') {
                starts.add(i + 1);
            }
        }
        return starts;
    }

    private static final class Region {
        private final int start;
        private int end;

        private Region(int start, int end) {
            this.start = start;
            this.end = end;
        }
    }
}
