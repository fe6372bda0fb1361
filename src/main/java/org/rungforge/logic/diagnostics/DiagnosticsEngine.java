package org.rungforge.logic.diagnostics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Collects the text a tokenizer pass skipped.
 * <p>
 * The tokenizer is lenient: instead of failing on malformed instruction spans it drops them
 * and reports what it dropped here, so callers can surface the loss.
 */
public class DiagnosticsEngine {

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    /**
     * Reports skipped text.
     *
     * @param kind   Why the text was skipped.
     * @param text   The skipped text.
     * @param offset The character offset of the text.
     */
    public void report(Diagnostic.Kind kind, String text, int offset) {
        diagnostics.add(new Diagnostic(kind, text, offset));
    }

    /**
     * @return {@code true} if any text was skipped.
     */
    public boolean hasWarnings() {
        return !diagnostics.isEmpty();
    }

    /**
     * @param kind A diagnostic kind.
     * @param offset A character offset.
     * @return {@code true} if a diagnostic of the kind was reported at or before the offset.
     */
    public boolean hasReportedBefore(Diagnostic.Kind kind, int offset) {
        return diagnostics.stream().anyMatch(d -> d.kind() == kind && d.offset() <= offset);
    }

    /**
     * Returns an unmodifiable list of all collected diagnostics.
     *
     * @return An unmodifiable list of diagnostics.
     */
    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    /**
     * @return All diagnostics, one per line.
     */
    public String summary() {
        return diagnostics.stream()
                .map(Diagnostic::toString)
                .collect(Collectors.joining("\n"));
    }
}
