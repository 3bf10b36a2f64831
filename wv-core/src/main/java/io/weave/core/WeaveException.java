package io.weave.core;

/** Root of the structural errors raised by the weave. */
public class WeaveException extends RuntimeException {
    public WeaveException(String message) {
        super(message);
    }
}
