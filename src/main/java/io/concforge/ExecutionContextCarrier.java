package io.concforge;

import io.concforge.internal.otel.OpenTelemetryBridge;

import java.util.Map;

/**
 * Caller-side context captured once per evaluation and replayed around every leaf.
 */
final class ExecutionContextCarrier {

    private final Map<String, Object> bindings;
    private final Object otelParentContext;

    private ExecutionContextCarrier(Map<String, Object> bindings, Object otelParentContext) {
        this.bindings = bindings;
        this.otelParentContext = otelParentContext;
    }

    static ExecutionContextCarrier capture() {
        return new ExecutionContextCarrier(Context.capture(), OpenTelemetryBridge.currentContext());
    }

    /**
     * Runs {@code body} with the captured bindings and OpenTelemetry context installed.
     */
    void run(Runnable body) {
        Map<String, Object> previous = Context.install(bindings);
        Object scope = OpenTelemetryBridge.makeCurrent(otelParentContext);
        try {
            body.run();
        } finally {
            OpenTelemetryBridge.closeScope(scope);
            Context.install(previous);
        }
    }
}
