package io.concforge.internal.otel;

import io.concforge.TaskInfo;

import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;

/**
 * Reflection bridge for the OpenTelemetry API.
 *
 * <p>Keeps concforge-core free of a hard OpenTelemetry dependency. Every call degrades to a
 * no-op (returning {@code null}) when the API is absent or a reflective call fails.
 */
public final class OpenTelemetryBridge {

    private static final Class<?> CONTEXT = load("io.opentelemetry.context.Context");
    private static final Class<?> GLOBAL = load("io.opentelemetry.api.GlobalOpenTelemetry");
    private static final Class<?> STATUS_CODE = load("io.opentelemetry.api.trace.StatusCode");
    private static final Class<?>[] NO_TYPES = new Class<?>[0];
    private static final Object[] NO_ARGS = new Object[0];

    private OpenTelemetryBridge() {
    }

    public static boolean isAvailable() {
        return CONTEXT != null && GLOBAL != null;
    }

    public static Object currentContext() {
        if (CONTEXT == null) {
            return null;
        }
        return call(CONTEXT, null, "current", NO_TYPES, NO_ARGS);
    }

    /**
     * Makes {@code contextOrSpan} current; returns the scope to close, or {@code null}.
     */
    public static Object makeCurrent(Object contextOrSpan) {
        if (contextOrSpan == null) {
            return null;
        }
        return call(contextOrSpan.getClass(), contextOrSpan, "makeCurrent", NO_TYPES, NO_ARGS);
    }

    public static void closeScope(Object scope) {
        if (scope != null) {
            call(scope.getClass(), scope, "close", NO_TYPES, NO_ARGS);
        }
    }

    public static Object createTracer(String instrumentationName) {
        if (GLOBAL == null) {
            return null;
        }
        return call(GLOBAL, null, "getTracer", new Class<?>[]{String.class}, new Object[]{instrumentationName});
    }

    public static Object startSpan(Object tracer, String spanName, TaskInfo info) {
        if (tracer == null) {
            return null;
        }
        Object builder = call(tracer.getClass(), tracer, "spanBuilder",
            new Class<?>[]{String.class}, new Object[]{spanName});
        if (builder == null) {
            return null;
        }
        setLong(builder, "concforge.run_id", info.runId());
        setLong(builder, "concforge.task_id", info.taskId());
        setString(builder, "concforge.leaf", info.name());
        setString(builder, "concforge.scheduler", info.schedulerName());
        return call(builder.getClass(), builder, "startSpan", NO_TYPES, NO_ARGS);
    }

    public static void endSpan(Object span, long durationMillis, Throwable error, boolean cancelled) {
        if (span == null) {
            return;
        }
        setLong(span, "concforge.duration_ms", durationMillis);
        if (cancelled) {
            call(span.getClass(), span, "setAttribute",
                new Class<?>[]{String.class, boolean.class}, new Object[]{"concforge.cancelled", Boolean.TRUE});
        }
        if (error != null) {
            call(span.getClass(), span, "recordException", new Class<?>[]{Throwable.class}, new Object[]{error});
            markError(span);
        }
        call(span.getClass(), span, "end", NO_TYPES, NO_ARGS);
    }

    private static void markError(Object span) {
        if (STATUS_CODE == null || !STATUS_CODE.isEnum()) {
            return;
        }
        for (Object constant : STATUS_CODE.getEnumConstants()) {
            if ("ERROR".equals(((Enum<?>) constant).name())) {
                call(span.getClass(), span, "setStatus", new Class<?>[]{STATUS_CODE}, new Object[]{constant});
                return;
            }
        }
    }

    private static void setLong(Object target, String key, long value) {
        call(target.getClass(), target, "setAttribute",
            new Class<?>[]{String.class, long.class}, new Object[]{key, Long.valueOf(value)});
    }

    private static void setString(Object target, String key, String value) {
        call(target.getClass(), target, "setAttribute",
            new Class<?>[]{String.class, String.class}, new Object[]{key, value});
    }

    private static Class<?> load(String className) {
        try {
            return Class.forName(className);
        } catch (ClassNotFoundException | LinkageError e) {
            return null;
        }
    }

    private static Object call(Class<?> type, Object target, String methodName, Class<?>[] argTypes, Object[] args) {
        try {
            return publicMethod(type, methodName, argTypes).invoke(target, args);
        } catch (ReflectiveOperationException | RuntimeException e) {
            return null;
        }
    }

    /**
     * Looks the method up on the public API type rather than the implementation class, which is
     * usually package-private and would reject reflective access.
     */
    private static Method publicMethod(Class<?> type, String methodName, Class<?>[] argTypes)
        throws NoSuchMethodException {
        Method method = type.getMethod(methodName, argTypes);
        if (Modifier.isPublic(method.getDeclaringClass().getModifiers())) {
            return method;
        }
        Deque<Class<?>> pending = new ArrayDeque<Class<?>>();
        pending.add(type);
        while (!pending.isEmpty()) {
            Class<?> candidate = pending.poll();
            if (Modifier.isPublic(candidate.getModifiers())) {
                for (Method declared : candidate.getMethods()) {
                    if (declared.getName().equals(methodName)
                        && Arrays.equals(declared.getParameterTypes(), argTypes)
                        && Modifier.isPublic(declared.getDeclaringClass().getModifiers())) {
                        return declared;
                    }
                }
            }
            pending.addAll(Arrays.asList(candidate.getInterfaces()));
            if (candidate.getSuperclass() != null) {
                pending.add(candidate.getSuperclass());
            }
        }
        return method;
    }
}
