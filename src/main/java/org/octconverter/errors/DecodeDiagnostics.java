package org.octconverter.errors;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.octconverter.model.DecodeWarning;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Collects the non-fatal problems found while decoding one file.
 * <p>
 * Every reported warning is also logged at WARN together with the file it belongs to.
 * Readers keep one instance for file-level problems (directory records, chains) and one per
 * produced entity; {@link #merge(DecodeDiagnostics)} combines them when the entity is built.
 * <p>
 * <strong>Thread Safety:</strong> Not thread-safe. Owned by a single decode pass.
 */
public class DecodeDiagnostics {

    private static final Logger LOG = LoggerFactory.getLogger(DecodeDiagnostics.class);

    private final String source;
    private final List<DecodeWarning> warnings = new ArrayList<>();

    /**
     * @param source name of the decoded file, used in log output.
     */
    public DecodeDiagnostics(String source) {
        this.source = source;
    }

    /**
     * Records a contained failure as a warning.
     *
     * @param e the failure that was caught at a record, chunk or field boundary.
     */
    public void report(DecodeException e) {
        add(e.toWarning());
    }

    /**
     * Records a contained failure, attributing it to {@code tag} when it names no record itself.
     */
    public void report(DecodeException e, String tag) {
        add(e.toWarning(tag));
    }

    /**
     * Records a warning that did not originate from an exception.
     *
     * @param kind    the problem category.
     * @param message human-readable description.
     * @param offset  absolute offset, or -1 when unknown.
     * @param tag     record tag, or {@code null}.
     */
    public void warn(ErrorKind kind, String message, long offset, String tag) {
        add(new DecodeWarning(kind, message, offset, tag));
    }

    /**
     * Appends all warnings of another collector without logging them again.
     *
     * @param other the collector to copy from.
     */
    public void merge(DecodeDiagnostics other) {
        warnings.addAll(other.warnings);
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }

    /**
     * @return an immutable copy of the warnings collected so far.
     */
    public List<DecodeWarning> warnings() {
        return Collections.unmodifiableList(new ArrayList<>(warnings));
    }

    /**
     * Creates an empty collector for an entity of the same file.
     *
     * @return a new collector sharing the source name.
     */
    public DecodeDiagnostics fork() {
        return new DecodeDiagnostics(source);
    }

    public String source() {
        return source;
    }

    private void add(DecodeWarning warning) {
        warnings.add(warning);
        LOG.warn("{}: {}", source, warning);
    }
}
