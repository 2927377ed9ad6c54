package com.finopsguard.parser;

/**
 * Raised when IaC text is structurally malformed and no resource model can be built.
 *
 * The resource name (for example {@code aws_instance.web}) identifies the block
 * being read when the failure was detected; it is null for failures outside
 * any resource block.
 */
public class ParseException extends RuntimeException {

    private final String resourceName;

    public ParseException(String message, String resourceName) {
        super(resourceName == null ? message : message + " (resource: " + resourceName + ")");
        this.resourceName = resourceName;
    }

    public ParseException(String message, String resourceName, Throwable cause) {
        super(resourceName == null ? message : message + " (resource: " + resourceName + ")", cause);
        this.resourceName = resourceName;
    }

    public String getResourceName() {
        return resourceName;
    }
}
