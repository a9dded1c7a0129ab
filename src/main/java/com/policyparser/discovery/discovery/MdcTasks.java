package com.policyparser.discovery.discovery;

import org.slf4j.MDC;

import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Carries the submitting thread's MDC into pooled worker threads.
 */
final class MdcTasks {

    private MdcTasks() {
    }

    static <T> Callable<T> wrap(Callable<T> task) {
        Map<String, String> parentMdc = MDC.getCopyOfContextMap();
        return () -> {
            if (parentMdc != null) {
                MDC.setContextMap(parentMdc);
            }
            try {
                return task.call();
            } finally {
                MDC.clear();
            }
        };
    }
}
