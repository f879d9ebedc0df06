package lorekeeper.domain.exceptionhandling;

import io.vavr.control.Try;

/**
 * Normalizes the failure held by a Try.
 */
public interface ExceptionMapping {
    <T> Try<T> map(Try<T> tryObject);
}
