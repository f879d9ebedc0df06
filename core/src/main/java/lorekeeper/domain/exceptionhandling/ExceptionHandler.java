package lorekeeper.domain.exceptionhandling;

/**
 * Turns an exception into something worth logging.
 */
public interface ExceptionHandler {
    String getExceptionMessage(Throwable e);
}
