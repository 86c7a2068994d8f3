package com.comsect1.core.logging;

import com.comsect1.core.model.Binding;
import org.slf4j.MDC;

import java.nio.file.Path;
import java.util.Map;

/**
 * Utility for managing gate-specific MDC keys for structured logging.
 */
public final class GateMdc {

    private GateMdc() {}

    public static void setRun(Binding binding, Path root) {
        MDC.put("binding", binding.label());
        MDC.put("gateRoot", root.toString());
    }

    public static void setFile(Path file) {
        MDC.put("file", file.toString());
    }

    public static void clearFile() {
        MDC.remove("file");
    }

    /** Copy of the calling thread's MDC, for handing the run context to worker threads. */
    public static Map<String, String> capture() {
        return MDC.getCopyOfContextMap();
    }

    /** Replaces the calling thread's MDC with a copy taken by {@link #capture()}. */
    public static void restore(Map<String, String> context) {
        if (context == null) {
            MDC.clear();
        } else {
            MDC.setContextMap(context);
        }
    }

    public static void clear() {
        MDC.remove("binding");
        MDC.remove("gateRoot");
        MDC.remove("file");
    }
}
