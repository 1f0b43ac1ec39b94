package io.homefinder.core;

/**
 * Thrown when a predicate value or range cannot be applied to its attribute:
 * lower bound above upper bound, a non-numeric bound on a numeric attribute,
 * or a range on a boolean flag.
 */
public class InvalidRangeException extends HomefinderException {

    private final String attribute;

    public InvalidRangeException(String attribute, String message) {
        super(attribute + ": " + message);
        this.attribute = attribute;
    }

    public String attribute() {
        return attribute;
    }
}
