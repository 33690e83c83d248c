package com.specgate.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Specgate-specific MDC keys for structured logging.
 */
public final class MdcContext {

    public static final String INSTANCE_ID = "instanceId";
    public static final String STEP = "step";
    public static final String FILE = "file";

    private MdcContext() {}

    public static void setStep(String instanceId, String step) {
        MDC.put(INSTANCE_ID, instanceId);
        MDC.put(STEP, step);
    }

    public static void setFile(String file) {
        MDC.put(FILE, file);
    }

    public static void clearFile() {
        MDC.remove(FILE);
    }

    public static void clear() {
        MDC.remove(INSTANCE_ID);
        MDC.remove(STEP);
        MDC.remove(FILE);
    }
}
