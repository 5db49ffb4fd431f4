package com.mamacare.appointments.view;

import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Snapshot, apply-optimistic, commit-or-revert.
 *
 * <p>The snapshot is taken before the optimistic change is applied. If the authoritative action
 * throws, the snapshot is handed to {@code revert} and the exception is rethrown; otherwise the
 * action's result is handed to {@code commit}.
 */
public final class OptimisticUpdate<S, R> {

    private final Supplier<S> snapshot;
    private final Runnable optimistic;
    private final Consumer<R> commit;
    private final Consumer<S> revert;

    private OptimisticUpdate(Supplier<S> snapshot, Runnable optimistic, Consumer<R> commit, Consumer<S> revert) {
        this.snapshot = snapshot;
        this.optimistic = optimistic;
        this.commit = commit;
        this.revert = revert;
    }

    public static <S, R> OptimisticUpdate<S, R> of(
            Supplier<S> snapshot, Runnable optimistic, Consumer<R> commit, Consumer<S> revert) {
        return new OptimisticUpdate<>(snapshot, optimistic, commit, revert);
    }

    public R run(Supplier<R> action) {
        S saved = snapshot.get();
        optimistic.run();
        R result;
        try {
            result = action.get();
        } catch (RuntimeException e) {
            revert.accept(saved);
            throw e;
        }
        commit.accept(result);
        return result;
    }
}
