package org.janelia.astrometry.service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.janelia.astrometry.AstrometryException;

/**
 * The image could not be aligned with a reference star field.
 * Carries hints that help the caller fix the solver input.
 */
public class AlignmentFailedException
        extends AstrometryException {

    private final List<String> diagnostics;

    public AlignmentFailedException(final String message) {
        this(message, Collections.emptyList(), null);
    }

    public AlignmentFailedException(final String message,
                                    final List<String> diagnostics,
                                    final Throwable cause) {
        super(message, cause);
        this.diagnostics = Collections.unmodifiableList(new ArrayList<>(diagnostics));
    }

    public List<String> getDiagnostics() {
        return diagnostics;
    }
}
