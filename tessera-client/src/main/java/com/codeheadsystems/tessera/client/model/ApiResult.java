package com.codeheadsystems.tessera.client.model;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

/**
 * Uniform outcome of every network-facing engine operation.
 * <p>
 * Exactly one of four variants: {@link Success}, {@link ProtocolError} (the server answered
 * with a non-2xx status), {@link TransportError} (connectivity, timeout or serialization
 * failure) and {@link ValidationError} (rejected locally, nothing was sent or the local
 * prerequisites are missing). Callers match exhaustively through {@link #fold(Cases)}.
 *
 * @param <T> the success value type
 */
public sealed interface ApiResult<T>
    permits ApiResult.Success, ApiResult.ProtocolError, ApiResult.TransportError, ApiResult.ValidationError {

  static <T> ApiResult<T> success(final T value) {
    return new Success<>(value);
  }

  static ApiResult<Void> done() {
    return new Success<>(null);
  }

  static <T> ApiResult<T> protocolError(final String message, final Integer httpStatus) {
    return new ProtocolError<>(message, httpStatus);
  }

  static <T> ApiResult<T> transportError(final Throwable cause) {
    return new TransportError<>(cause);
  }

  static <T> ApiResult<T> validationError(final ValidationError.Kind kind, final String message) {
    return new ValidationError<>(kind, message);
  }

  /**
   * Applies the case matching this variant.
   *
   * @param cases one handler per variant
   * @param <R>   the result type
   * @return the handler's result
   */
  <R> R fold(Cases<? super T, ? extends R> cases);

  /**
   * Transforms the success value; failures pass through unchanged.
   *
   * @param mapper the mapper
   * @param <U>    the new success type
   * @return the mapped result
   */
  <U> ApiResult<U> map(Function<? super T, ? extends U> mapper);

  /**
   * Re-types a failure. Calling this on a success is a programming error.
   *
   * @param <U> the new success type
   * @return the same failure with a different type parameter
   * @throws IllegalStateException if this is a success
   */
  <U> ApiResult<U> asFailure();

  default boolean isSuccess() {
    return this instanceof Success;
  }

  default Optional<T> toOptional() {
    if (this instanceof Success<T> success) {
      return Optional.ofNullable(success.value());
    }
    return Optional.empty();
  }

  default <U> ApiResult<U> flatMap(final Function<? super T, ApiResult<U>> next) {
    if (this instanceof Success<T> success) {
      return next.apply(success.value());
    }
    return asFailure();
  }

  default <U> CompletableFuture<ApiResult<U>> flatMapAsync(
      final Function<? super T, CompletableFuture<ApiResult<U>>> next) {
    if (this instanceof Success<T> success) {
      return next.apply(success.value());
    }
    return CompletableFuture.completedFuture(asFailure());
  }

  /**
   * Exhaustive handler set for {@link #fold(Cases)}.
   *
   * @param <T> the success value type
   * @param <R> the result type
   */
  interface Cases<T, R> {

    R success(T value);

    R protocolError(ProtocolError<?> error);

    R transportError(TransportError<?> error);

    R validationError(ValidationError<?> error);
  }

  /**
   * The operation completed.
   *
   * @param value the value, null for operations that produce none
   * @param <T>   the value type
   */
  record Success<T>(T value) implements ApiResult<T> {

    @Override
    public <R> R fold(final Cases<? super T, ? extends R> cases) {
      return cases.success(value);
    }

    @Override
    public <U> ApiResult<U> map(final Function<? super T, ? extends U> mapper) {
      return new Success<>(mapper.apply(value));
    }

    @Override
    public <U> ApiResult<U> asFailure() {
      throw new IllegalStateException("Not a failure");
    }
  }

  /**
   * The server rejected the request.
   *
   * @param message    the server-provided message, or a generic one
   * @param httpStatus the HTTP status, null when the rejection did not come from an HTTP response
   * @param <T>        the value type
   */
  record ProtocolError<T>(String message, Integer httpStatus) implements ApiResult<T> {

    @Override
    public <R> R fold(final Cases<? super T, ? extends R> cases) {
      return cases.protocolError(this);
    }

    @Override
    public <U> ApiResult<U> map(final Function<? super T, ? extends U> mapper) {
      return new ProtocolError<>(message, httpStatus);
    }

    @Override
    public <U> ApiResult<U> asFailure() {
      return new ProtocolError<>(message, httpStatus);
    }
  }

  /**
   * The request never produced a usable response. Eligible for caller-driven retry.
   *
   * @param cause the underlying cause
   * @param <T>   the value type
   */
  record TransportError<T>(Throwable cause) implements ApiResult<T> {

    public String message() {
      return cause == null ? "transport failure" : String.valueOf(cause.getMessage());
    }

    @Override
    public <R> R fold(final Cases<? super T, ? extends R> cases) {
      return cases.transportError(this);
    }

    @Override
    public <U> ApiResult<U> map(final Function<? super T, ? extends U> mapper) {
      return new TransportError<>(cause);
    }

    @Override
    public <U> ApiResult<U> asFailure() {
      return new TransportError<>(cause);
    }
  }

  /**
   * Rejected locally; never retried automatically.
   *
   * @param kind    what was wrong
   * @param message a description
   * @param <T>     the value type
   */
  record ValidationError<T>(Kind kind, String message) implements ApiResult<T> {

    /**
     * Categories of local rejection.
     */
    public enum Kind {
      /** The initial access token is malformed, has no expiry, or has expired. */
      INVALID_IAT,
      /** A caller-supplied value such as the server URL is malformed. */
      INVALID_INPUT,
      /** Required state (registration, tokens) is absent. */
      MISSING_PREREQUISITE,
      /** A callback's state did not match the pending flow (CSRF rejection). */
      STATE_MISMATCH,
      /** Key custody failed; the registration must be redone. */
      KEY_STORE,
      /** The credential store could not be read or written. */
      CREDENTIAL_STORE
    }

    public boolean fatal() {
      return kind == Kind.KEY_STORE || kind == Kind.CREDENTIAL_STORE;
    }

    @Override
    public <R> R fold(final Cases<? super T, ? extends R> cases) {
      return cases.validationError(this);
    }

    @Override
    public <U> ApiResult<U> map(final Function<? super T, ? extends U> mapper) {
      return new ValidationError<>(kind, message);
    }

    @Override
    public <U> ApiResult<U> asFailure() {
      return new ValidationError<>(kind, message);
    }
  }
}
