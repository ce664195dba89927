package com.onthegomap.tilestash.fetch;

import com.onthegomap.tilestash.util.Exceptions;
import com.onthegomap.tilestash.util.Try;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Predicate;

/**
 * Combines independent tasks into one future that completes with the first result accepted by a predicate, cancelling
 * the rest, or with no winner once every task settled.
 * <p>
 * Every outcome that settled before the combined future completed is kept for diagnostics.
 */
public class FirstSuccess {

  private FirstSuccess() {}

  /**
   * @param winner   the first accepted value, if any
   * @param outcomes values and failures of the tasks that settled before completion, in settle order
   */
  public record Result<T>(Optional<T> winner, List<Try<T>> outcomes) {}

  public static <T> CompletableFuture<Result<T>> of(List<CompletableFuture<T>> tasks, Predicate<? super T> accept) {
    CompletableFuture<Result<T>> result = new CompletableFuture<>();
    if (tasks.isEmpty()) {
      result.complete(new Result<>(Optional.empty(), List.of()));
      return result;
    }
    List<Try<T>> outcomes = new ArrayList<>();
    AtomicInteger remaining = new AtomicInteger(tasks.size());
    for (CompletableFuture<T> task : tasks) {
      task.whenComplete((value, error) -> {
        Try<T> outcome = error == null ? Try.success(value) : Try.failure(asException(error));
        boolean won;
        List<Try<T>> snapshot;
        synchronized (outcomes) {
          outcomes.add(outcome);
          snapshot = List.copyOf(outcomes);
          won = error == null && accept.test(value) && !result.isDone();
        }
        if (won && result.complete(new Result<>(Optional.of(value), snapshot))) {
          for (CompletableFuture<T> other : tasks) {
            if (other != task) {
              other.cancel(true);
            }
          }
        }
        if (remaining.decrementAndGet() == 0) {
          result.complete(new Result<>(Optional.empty(), snapshot));
        }
      });
    }
    return result;
  }

  private static Exception asException(Throwable error) {
    Throwable cause = Exceptions.unwrap(error);
    return cause instanceof Exception e ? e : new ExecutionException(cause);
  }
}
