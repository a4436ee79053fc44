package com.cred.freestyle.checkout.exception;

/**
 * Exception thrown when a requested resource (product, order) is not found
 * or is not visible to the caller.
 *
 * @author Checkout Team
 */
public class ResourceNotFoundException extends RuntimeException {

    private final String resourceType;
    private final String resourceId;

    public ResourceNotFoundException(String resourceType, String resourceId) {
        super(String.format("%s not found", resourceType));
        this.resourceType = resourceType;
        this.resourceId = resourceId;
    }

    public String getResourceType() {
        return resourceType;
    }

    public String getResourceId() {
        return resourceId;
    }
}
