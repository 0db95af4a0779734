package org.zepto8.peg.error;

import org.zepto8.peg.text.SourceLocation;
import org.zepto8.peg.text.SourceSpan;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Diagnostic message with Rust-style rendering.
 *
 * <p>Example output:
 * <pre>
 * warning: unsupported single-line if
 *   --> cart.lua:3:5
 *    |
 *  3 |     if (x>5) print(x)
 *    |     ^^^^^^^^^^^^^^^^^ left unchanged
 *    |
 *    = help: rewrite as 'if (...) then ... end'
 * </pre>
 *
 * @param severity Severity level
 * @param message  Primary message
 * @param span     Source span the diagnostic refers to
 * @param labels   Labeled spans, drawn under the source line
 * @param notes    Trailing notes
 */
public record Diagnostic(
    Severity severity,
    String message,
    SourceSpan span,
    List<Label> labels,
    List<String> notes
) {
    public enum Severity {
        ERROR("error"),
        WARNING("warning");

        private final String display;

        Severity(String display) {
            this.display = display;
        }

        public String display() {
            return display;
        }
    }

    /**
     * A labeled span; primary labels are underlined with {@code ^}, others with {@code -}.
     */
    public record Label(SourceSpan span, String message, boolean primary) {
        public static Label primary(SourceSpan span, String message) {
            return new Label(span, message, true);
        }
    }

    public static Diagnostic error(String message, SourceSpan span) {
        return new Diagnostic(Severity.ERROR, message, span, List.of(), List.of());
    }

    public static Diagnostic warning(String message, SourceSpan span) {
        return new Diagnostic(Severity.WARNING, message, span, List.of(), List.of());
    }

    public SourceLocation location() {
        return span.start();
    }

    public Diagnostic withLabel(String message) {
        var newLabels = new ArrayList<>(labels);
        newLabels.add(Label.primary(span, message));
        return new Diagnostic(severity, this.message, span, List.copyOf(newLabels), notes);
    }

    public Diagnostic withNote(String note) {
        var newNotes = new ArrayList<>(notes);
        newNotes.add(note);
        return new Diagnostic(severity, message, span, labels, List.copyOf(newNotes));
    }

    public Diagnostic withHelp(String help) {
        return withNote("help: " + help);
    }

    /**
     * Render this diagnostic against the source it was produced from.
     *
     * @param source   the source text
     * @param filename name shown after the arrow, or {@code null}
     */
    public String format(String source, String filename) {
        var sb = new StringBuilder();
        var lines = source.split("\n", -1);

        sb.append(severity.display()).append(": ").append(message).append("\n");

        var loc = span.start();
        sb.append("  --> ");
        if (filename != null) {
            sb.append(filename).append(":");
        }
        sb.append(loc.line()).append(":").append(loc.column()).append("\n");

        int minLine = span.start().line();
        int maxLine = span.end().line();
        int gutterWidth = String.valueOf(maxLine).length();

        sb.append(" ".repeat(gutterWidth + 1)).append("|\n");
        for (int lineNum = minLine; lineNum <= maxLine; lineNum++) {
            if (lineNum < 1 || lineNum > lines.length) {
                continue;
            }
            var lineContent = lines[lineNum - 1];
            sb.append(String.format("%" + gutterWidth + "d", lineNum))
              .append(" | ")
              .append(lineContent)
              .append("\n");
            var lineLabels = labelsOnLine(lineNum);
            if (!lineLabels.isEmpty()) {
                sb.append(" ".repeat(gutterWidth))
                  .append(" | ")
                  .append(underlines(lineNum, lineContent, lineLabels))
                  .append("\n");
            }
        }
        sb.append(" ".repeat(gutterWidth + 1)).append("|\n");

        for (var note : notes) {
            sb.append(" ".repeat(gutterWidth + 1)).append("= ").append(note).append("\n");
        }
        return sb.toString();
    }

    /**
     * Single-line form, e.g. {@code cart.lua:3:5: warning: unsupported single-line if}.
     */
    public String formatSimple(String filename) {
        var loc = span.start();
        return String.format("%s:%d:%d: %s: %s",
            filename, loc.line(), loc.column(), severity.display(), message);
    }

    private List<Label> labelsOnLine(int lineNum) {
        var result = new ArrayList<Label>();
        if (labels.isEmpty() && span.start().line() <= lineNum && span.end().line() >= lineNum) {
            result.add(Label.primary(span, ""));
        }
        for (var label : labels) {
            if (label.span().start().line() <= lineNum && label.span().end().line() >= lineNum) {
                result.add(label);
            }
        }
        return result;
    }

    private String underlines(int lineNum, String lineContent, List<Label> lineLabels) {
        var sb = new StringBuilder();
        int currentCol = 1;
        var sorted = lineLabels.stream()
            .sorted(Comparator.comparingInt((Label label) -> label.span().start().column()))
            .toList();
        for (var label : sorted) {
            int startCol = label.span().start().line() == lineNum ? label.span().start().column() : 1;
            int endCol = label.span().end().line() == lineNum
                ? label.span().end().column()
                : lineContent.length() + 1;
            while (currentCol < startCol) {
                sb.append(' ');
                currentCol++;
            }
            int underlineLen = Math.max(1, endCol - startCol);
            sb.append(String.valueOf(label.primary() ? '^' : '-').repeat(underlineLen));
            currentCol += underlineLen;
            if (!label.message().isEmpty()) {
                sb.append(' ').append(label.message());
            }
        }
        return sb.toString();
    }
}
