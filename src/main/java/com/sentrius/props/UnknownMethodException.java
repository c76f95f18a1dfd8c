package com.sentrius.props;

public class UnknownMethodException extends UnsupportedOperationException {
    private final String method;
    private final String containerType;

    public UnknownMethodException(String method, String containerType) {
        super(method + " does not exist as a method or a macro on " + containerType + ".");
        this.method = method;
        this.containerType = containerType;
    }

    public String getMethod() {
        return method;
    }

    public String getContainerType() {
        return containerType;
    }
}
