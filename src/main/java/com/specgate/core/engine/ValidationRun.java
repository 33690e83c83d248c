package com.specgate.core.engine;

import com.specgate.core.fix.FixResult;
import com.specgate.core.model.ValidationMode;
import com.specgate.core.model.ValidationReport;
import com.specgate.core.model.ValidationResult;
import com.specgate.core.state.StalenessReport;

/**
 * Everything one engine run produced.
 *
 * @param result    final findings, after re-validation when fixes were applied
 * @param report    external error report built from {@code result}
 * @param staleness staleness of tracked files before checksums were refreshed; null
 *                  when the state record could not be loaded
 * @param fix       auto-fix outcome, or null when fixing was not requested
 * @param mode      mode validity was judged in
 */
public record ValidationRun(
    ValidationResult result,
    ValidationReport report,
    StalenessReport staleness,
    FixResult fix,
    ValidationMode mode
) {

    public boolean isValid() {
        return report.valid();
    }
}
