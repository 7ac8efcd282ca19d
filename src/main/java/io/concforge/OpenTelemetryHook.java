package io.concforge;

import io.concforge.internal.otel.OpenTelemetryBridge;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Opens one OpenTelemetry span per leaf task.
 *
 * <p>Create via {@link #create(String)} and register with {@link ConcRuntime#withHook(TaskHook)},
 * or use {@link ConcRuntime#withOpenTelemetry()}. The span is current on the leaf's thread while
 * the leaf runs.
 */
public final class OpenTelemetryHook implements TaskHook {

    private final String instrumentationName;
    private final Object tracer;
    private final Map<TaskInfo, OpenSpan> spans;

    private OpenTelemetryHook(String instrumentationName, Object tracer) {
        this.instrumentationName = instrumentationName;
        this.tracer = tracer;
        this.spans = new ConcurrentHashMap<TaskInfo, OpenSpan>();
    }

    /**
     * Creates a hook using the global OpenTelemetry tracer for {@code instrumentationName}.
     *
     * @throws IllegalStateException if {@code io.opentelemetry:opentelemetry-api} is not on the classpath
     */
    public static OpenTelemetryHook create(String instrumentationName) {
        Objects.requireNonNull(instrumentationName, "instrumentationName");
        if (instrumentationName.trim().isEmpty()) {
            throw new IllegalArgumentException("instrumentationName must not be blank");
        }
        if (!OpenTelemetryBridge.isAvailable()) {
            throw new IllegalStateException(
                "OpenTelemetry API not found. Add dependency: io.opentelemetry:opentelemetry-api"
            );
        }
        Object tracer = OpenTelemetryBridge.createTracer(instrumentationName);
        if (tracer == null) {
            throw new IllegalStateException("Failed to create OpenTelemetry tracer");
        }
        return new OpenTelemetryHook(instrumentationName, tracer);
    }

    public String instrumentationName() {
        return instrumentationName;
    }

    /** Spans started and not yet ended. */
    int openSpans() {
        return spans.size();
    }

    @Override
    public void onStart(TaskInfo info) {
        Object span = OpenTelemetryBridge.startSpan(tracer, "concforge.leaf " + info.name(), info);
        if (span == null) {
            return;
        }
        spans.put(info, new OpenSpan(span, OpenTelemetryBridge.makeCurrent(span)));
    }

    @Override
    public void onSuccess(TaskInfo info, Duration duration) {
        end(info, duration, null, false);
    }

    @Override
    public void onFailure(TaskInfo info, Throwable error, Duration duration) {
        end(info, duration, error, false);
    }

    @Override
    public void onCancel(TaskInfo info, Duration duration) {
        end(info, duration, null, true);
    }

    private void end(TaskInfo info, Duration duration, Throwable error, boolean cancelled) {
        OpenSpan open = spans.remove(info);
        if (open == null) {
            return;
        }
        try {
            OpenTelemetryBridge.endSpan(open.span, duration.toMillis(), error, cancelled);
        } finally {
            OpenTelemetryBridge.closeScope(open.scope);
        }
    }

    private static final class OpenSpan {
        private final Object span;
        private final Object scope;

        private OpenSpan(Object span, Object scope) {
            this.span = span;
            this.scope = scope;
        }
    }
}
