package dev.extractioneval.normalize;

import javax.annotation.Nullable;

/** A raw value could not be read as an amount or a date. */
public class ValueParseException extends Exception {
    public ValueParseException(String message) {
        super(message);
    }

    public ValueParseException(String message, @Nullable Throwable cause) {
        super(message, cause);
    }
}
