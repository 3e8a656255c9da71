package io.reqbind.core.engine;

import io.reqbind.core.model.TypedRecord;
import io.reqbind.core.model.ValidationError;
import java.util.List;

/**
 * Result of the extraction stage: the assembled record plus every presence or coercion error.
 * When {@link #failed()} the record still holds zero values for the failed fields and must not be
 * validated.
 */
public record Extraction(TypedRecord record, List<ValidationError> errors) {

    public Extraction {
        errors = List.copyOf(errors);
    }

    public boolean failed() {
        return !errors.isEmpty();
    }
}
