package com.columnlineage.lineage;

import com.columnlineage.exception.LineageException;
import com.columnlineage.exception.UnsupportedOperatorException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of one extraction: a {@link Lineage} or the error that stopped it.
 *
 * <p>A successful result may carry warnings for operators that were handled by
 * the positional fallback.
 */
public final class LineageResult {

    private final Lineage lineage;
    private final LineageException error;
    private final List<UnsupportedOperatorException> warnings;

    private LineageResult(Lineage lineage, LineageException error, List<UnsupportedOperatorException> warnings) {
        this.lineage = lineage;
        this.error = error;
        this.warnings = Collections.unmodifiableList(new ArrayList<>(warnings));
    }

    public static LineageResult success(Lineage lineage, List<UnsupportedOperatorException> warnings) {
        return new LineageResult(
            Objects.requireNonNull(lineage, "lineage must not be null"),
            null,
            Objects.requireNonNull(warnings, "warnings must not be null"));
    }

    public static LineageResult success(Lineage lineage) {
        return success(lineage, Collections.emptyList());
    }

    public static LineageResult failure(LineageException error) {
        return new LineageResult(null, Objects.requireNonNull(error, "error must not be null"), Collections.emptyList());
    }

    public boolean isSuccess() {
        return lineage != null;
    }

    public Optional<Lineage> lineage() {
        return Optional.ofNullable(lineage);
    }

    public Optional<LineageException> error() {
        return Optional.ofNullable(error);
    }

    public List<UnsupportedOperatorException> warnings() {
        return warnings;
    }

    /**
     * Returns the lineage or throws the error.
     *
     * @return the lineage
     * @throws LineageException if extraction failed
     */
    public Lineage getOrThrow() {
        if (error != null) {
            throw error;
        }
        return lineage;
    }

    @Override
    public String toString() {
        return isSuccess()
            ? "LineageResult.success(" + lineage + ", warnings=" + warnings.size() + ")"
            : "LineageResult.failure(" + error.getMessage() + ")";
    }
}
