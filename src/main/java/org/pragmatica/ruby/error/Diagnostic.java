package org.pragmatica.ruby.error;

import org.pragmatica.ruby.tree.Position;

import java.util.ArrayList;
import java.util.List;

/**
 * Rust-style rendering of a parse error against the source it came from.
 *
 * <p>Example output:
 * <pre>
 * error: unexpected input
 *   --> source:2:7
 *   |
 * 2 |   x = ) + 1
 *   |       ^ found ')'
 *   |
 *   = help: expected identifier or number
 * </pre>
 *
 * @param message  primary message
 * @param location where the error occurred
 * @param label    text printed next to the caret
 * @param notes    additional notes or suggestions
 */
public record Diagnostic(
    String message,
    Position location,
    String label,
    List<String> notes
) {
    public Diagnostic {
        notes = List.copyOf(notes);
    }

    public static Diagnostic error(String message, Position location) {
        return new Diagnostic(message, location, "", List.of());
    }

    public static Diagnostic of(ParseError error) {
        if (error instanceof ParseError.UnexpectedInput input) {
            return error("unexpected input", input.location())
                .withLabel("found '" + input.found() + "'")
                .withHelp("expected " + input.expected());
        }
        return error("unexpected end of input", error.location())
            .withLabel("found EOF")
            .withHelp("expected " + error.expected());
    }

    public Diagnostic withLabel(String newLabel) {
        return new Diagnostic(message, location, newLabel, notes);
    }

    public Diagnostic withNote(String note) {
        var newNotes = new ArrayList<>(notes);
        newNotes.add(note);
        return new Diagnostic(message, location, label, newNotes);
    }

    public Diagnostic withHelp(String help) {
        return withNote("help: " + help);
    }

    public String format(String source) {
        return format(source, "input");
    }

    /**
     * Format this diagnostic with the offending source line and a caret under the location.
     *
     * @param source   the source text
     * @param filename name shown in the location line
     */
    public String format(String source, String filename) {
        var sb = new StringBuilder();
        var lines = source.split("\n", -1);
        var lineNumber = location.line() + 1;
        var column = Math.max(0, location.column());
        var gutterWidth = String.valueOf(lineNumber).length();
        var gutter = " ".repeat(gutterWidth + 1);

        sb.append("error: ").append(message).append("\n");
        sb.append("  --> ").append(filename).append(":").append(location.display()).append("\n");
        sb.append(gutter).append("|\n");

        if (location.line() < lines.length) {
            var content = lines[location.line()];
            sb.append(lineNumber).append(" | ").append(content).append("\n");
            sb.append(gutter).append("| ").append(" ".repeat(column)).append('^');
            if (!label.isEmpty()) {
                sb.append(' ').append(label);
            }
            sb.append("\n");
        }

        sb.append(gutter).append("|\n");
        for (var note : notes) {
            sb.append(gutter).append("= ").append(note).append("\n");
        }
        return sb.toString();
    }

    /**
     * Simple single-line format for quick display.
     */
    public String formatSimple() {
        return "input:" + location.display() + ": error: " + message;
    }
}
