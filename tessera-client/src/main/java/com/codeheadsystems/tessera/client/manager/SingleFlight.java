package com.codeheadsystems.tessera.client.manager;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Supplier;

/**
 * Collapses concurrent asynchronous calls for the same key into one in-flight call. Callers
 * that arrive while a call is running get the same future; the entry is released before the
 * future completes, so the next caller after completion starts a new call.
 *
 * @param <K> the key type
 * @param <V> the value type
 */
final class SingleFlight<K, V> {

  private final ConcurrentMap<K, CompletableFuture<V>> inFlight = new ConcurrentHashMap<>();

  CompletableFuture<V> run(final K key, final Supplier<CompletableFuture<V>> call) {
    CompletableFuture<V> mine = new CompletableFuture<>();
    CompletableFuture<V> existing = inFlight.putIfAbsent(key, mine);
    if (existing != null) {
      return existing;
    }
    CompletableFuture<V> started;
    try {
      started = call.get();
    } catch (RuntimeException e) {
      inFlight.remove(key, mine);
      mine.completeExceptionally(e);
      return mine;
    }
    started.whenComplete((value, throwable) -> {
      inFlight.remove(key, mine);
      if (throwable != null) {
        mine.completeExceptionally(throwable);
      } else {
        mine.complete(value);
      }
    });
    return mine;
  }

  boolean isRunning(final K key) {
    return inFlight.containsKey(key);
  }
}
