package com.platform.wafoperator.error;

/**
 * Exception for writes rejected because the store holds a different version
 * of the object, or because the object already exists.
 */
public class ResourceConflictException extends OperatorException {
    
    private final String resourceType;
    private final String resourceId;
    
    public ResourceConflictException(ErrorCode errorCode, String resourceType, String resourceId, String message) {
        super(errorCode, message);
        this.resourceType = resourceType;
        this.resourceId = resourceId;
    }
    
    public static ResourceConflictException versionMismatch(String resourceType, String resourceId,
            String expectedVersion, String actualVersion) {
        return new ResourceConflictException(
            ErrorCode.RESOURCE_CONFLICT,
            resourceType,
            resourceId,
            String.format("Operation cannot be fulfilled on %s %s: the object has been modified "
                + "(resourceVersion %s, current %s)", resourceType, resourceId, expectedVersion, actualVersion)
        );
    }
    
    public static ResourceConflictException alreadyExists(String resourceType, String resourceId) {
        return new ResourceConflictException(
            ErrorCode.ALREADY_EXISTS,
            resourceType,
            resourceId,
            String.format("%s %s already exists", resourceType, resourceId)
        );
    }
    
    public String getResourceType() {
        return resourceType;
    }
    
    public String getResourceId() {
        return resourceId;
    }
}
