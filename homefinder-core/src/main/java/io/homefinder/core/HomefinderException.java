package io.homefinder.core;

public class HomefinderException extends RuntimeException {

    public HomefinderException(Throwable cause) {
        super(cause);
    }

    public HomefinderException(String message, Throwable cause) {
        super(message, cause);
    }

    public HomefinderException(String message) {
        super(message);
    }

}
