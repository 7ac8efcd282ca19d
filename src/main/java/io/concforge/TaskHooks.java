package io.concforge;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Combinators for {@link TaskHook}.
 */
public final class TaskHooks {

    private TaskHooks() {
    }

    /**
     * Chains hooks in order. Every hook sees every event even if an earlier one throws;
     * the first exception is rethrown afterwards with the others suppressed.
     */
    public static TaskHook compose(TaskHook first, TaskHook... rest) {
        Objects.requireNonNull(first, "first");
        Objects.requireNonNull(rest, "rest");
        List<TaskHook> all = new ArrayList<TaskHook>(rest.length + 1);
        all.add(first);
        all.addAll(Arrays.asList(rest));
        for (TaskHook hook : all) {
            Objects.requireNonNull(hook, "hook");
        }
        return new CompositeHook(Collections.unmodifiableList(all));
    }

    private interface Dispatch {
        void to(TaskHook hook);
    }

    private static final class CompositeHook implements TaskHook {

        private final List<TaskHook> hooks;

        private CompositeHook(List<TaskHook> hooks) {
            this.hooks = hooks;
        }

        @Override
        public void onStart(final TaskInfo info) {
            dispatch(new Dispatch() {
                @Override
                public void to(TaskHook hook) {
                    hook.onStart(info);
                }
            });
        }

        @Override
        public void onSuccess(final TaskInfo info, final Duration duration) {
            dispatch(new Dispatch() {
                @Override
                public void to(TaskHook hook) {
                    hook.onSuccess(info, duration);
                }
            });
        }

        @Override
        public void onFailure(final TaskInfo info, final Throwable error, final Duration duration) {
            dispatch(new Dispatch() {
                @Override
                public void to(TaskHook hook) {
                    hook.onFailure(info, error, duration);
                }
            });
        }

        @Override
        public void onCancel(final TaskInfo info, final Duration duration) {
            dispatch(new Dispatch() {
                @Override
                public void to(TaskHook hook) {
                    hook.onCancel(info, duration);
                }
            });
        }

        private void dispatch(Dispatch dispatch) {
            RuntimeException primary = null;
            for (TaskHook hook : hooks) {
                try {
                    dispatch.to(hook);
                } catch (RuntimeException e) {
                    if (primary == null) {
                        primary = e;
                    } else {
                        primary.addSuppressed(e);
                    }
                }
            }
            if (primary != null) {
                throw primary;
            }
        }
    }
}
