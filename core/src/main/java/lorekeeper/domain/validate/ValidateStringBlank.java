package lorekeeper.domain.validate;

import jakarta.enterprise.context.ApplicationScoped;
import lorekeeper.domain.exceptions.EmptyString;
import org.apache.commons.lang3.StringUtils;
import org.jspecify.annotations.Nullable;

import java.util.function.Function;

@ApplicationScoped
public class ValidateStringBlank implements ValidateString {
    @Override
    public String throwIfBlank(@Nullable final String value) {
        if (StringUtils.isBlank(value)) {
            throw new EmptyString("String validation failed - string is empty");
        }
        return value;
    }

    @Override
    public <T> T throwIfBlank(final T source, final Function<T, String> getContext) {
        if (StringUtils.isBlank(getContext.apply(source))) {
            throw new EmptyString("String validation failed - string is empty");
        }
        return source;
    }

    @Override
    public boolean isBlank(@Nullable final String value) {
        return StringUtils.isBlank(value);
    }

    @Override
    public boolean isNotBlank(@Nullable final String value) {
        return !isBlank(value);
    }
}
