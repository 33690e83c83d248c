package com.specgate.core.fix;

import com.specgate.core.model.ValidationError;

import java.util.List;

/**
 * Outcome of one {@link AutoFixer} run. The fixer never re-validates; callers
 * re-run validation to confirm the fixes.
 *
 * @param filesModified    files whose content changed and was written
 * @param errorsFixed      errors a text insertion was applied for
 * @param alreadySatisfied fixable errors whose target content was already present
 * @param unfixableErrors  errors left for a human or an assistant to resolve
 * @param details          one line per applied fix
 */
public record FixResult(
    int filesModified,
    int errorsFixed,
    int alreadySatisfied,
    List<ValidationError> unfixableErrors,
    List<String> details
) {

    public FixResult {
        unfixableErrors = List.copyOf(unfixableErrors);
        details = List.copyOf(details);
    }

    public boolean changedAnything() {
        return filesModified > 0;
    }
}
