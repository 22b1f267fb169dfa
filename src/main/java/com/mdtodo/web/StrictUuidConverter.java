package com.mdtodo.web;

import org.springframework.core.convert.converter.Converter;

import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Path/query {@link UUID} binding that only accepts the canonical 36-character form.
 *
 * <p>{@link UUID#fromString} also takes short forms such as {@code 1-1-1-1-1}; those are rejected
 * here so MVC reports a {@code MethodArgumentTypeMismatchException} instead of looking them up.
 */
public class StrictUuidConverter implements Converter<String, UUID> {

    private static final Pattern CANONICAL =
            Pattern.compile("[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}");

    @Override
    public UUID convert(String source) {
        if (!CANONICAL.matcher(source).matches())
            throw new IllegalArgumentException("not a canonical uuid: " + source);
        return UUID.fromString(source);
    }
}
