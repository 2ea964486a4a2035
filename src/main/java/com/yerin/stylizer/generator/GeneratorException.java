package com.yerin.stylizer.generator;

import lombok.Getter;

@Getter
public class GeneratorException extends RuntimeException {

    private final boolean resourceExhausted;

    public GeneratorException(String message) {
        this(message, null, false);
    }

    public GeneratorException(String message, Throwable cause) {
        this(message, cause, false);
    }

    private GeneratorException(String message, Throwable cause, boolean resourceExhausted) {
        super(message, cause);
        this.resourceExhausted = resourceExhausted;
    }

    public static GeneratorException resourceExhausted(String message, Throwable cause) {
        return new GeneratorException(message, cause, true);
    }
}
