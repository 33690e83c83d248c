package com.specgate.core.state;

import java.util.List;

/**
 * Tracked files partitioned by checksum state. Names are relative to the
 * instance directory.
 *
 * @param staleFiles       recorded checksum differs from current content
 * @param missingChecksums no checksum recorded yet
 * @param upToDate         recorded checksum matches current content
 */
public record StalenessReport(
    List<String> staleFiles,
    List<String> missingChecksums,
    List<String> upToDate
) {

    public StalenessReport {
        staleFiles = List.copyOf(staleFiles);
        missingChecksums = List.copyOf(missingChecksums);
        upToDate = List.copyOf(upToDate);
    }

    public boolean hasStale() {
        return !staleFiles.isEmpty();
    }

    /** Every tracked file has a recorded checksum. */
    public boolean isComplete() {
        return missingChecksums.isEmpty();
    }

    public boolean isFresh() {
        return !hasStale() && isComplete();
    }

    public int totalFiles() {
        return staleFiles.size() + missingChecksums.size() + upToDate.size();
    }
}
