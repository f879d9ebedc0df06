package lorekeeper.domain.exceptionhandling;

import io.vavr.API;
import io.vavr.control.Try;
import jakarta.enterprise.context.ApplicationScoped;
import lorekeeper.domain.exceptions.ExternalException;
import lorekeeper.domain.exceptions.ExternalFailure;
import lorekeeper.domain.exceptions.InternalFailure;

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Predicates.instanceOf;

/**
 * Maps every failure to either InternalFailure or ExternalFailure.
 * ExternalFailure means the same call might work later (the text service timed out, returned a 500, etc).
 * InternalFailure means it won't.
 */
@ApplicationScoped
public class StandardExceptionMapping implements ExceptionMapping {
    @Override
    public <T> Try<T> map(final Try<T> tryObject) {
        checkNotNull(tryObject);

        return tryObject.mapFailure(
                API.Case(API.$(instanceOf(InternalFailure.class)), throwable -> throwable),
                API.Case(API.$(instanceOf(ExternalFailure.class)), throwable -> throwable),
                // Only exceptions that explicitly implement ExternalException are treated as transient
                API.Case(API.$(instanceOf(ExternalException.class)), throwable -> new ExternalFailure(throwable)),
                API.Case(API.$(), throwable -> new InternalFailure(throwable)));
    }
}
