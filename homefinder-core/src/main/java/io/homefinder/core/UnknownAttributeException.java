package io.homefinder.core;

import java.util.List;

/**
 * Thrown when a filter names an attribute that no index covers.
 */
public class UnknownAttributeException extends HomefinderException {

    private final String attribute;

    public UnknownAttributeException(String attribute, List<String> indexedAttributes) {
        super("Unknown attribute '" + attribute + "', indexed attributes are " + indexedAttributes);
        this.attribute = attribute;
    }

    public String attribute() {
        return attribute;
    }
}
