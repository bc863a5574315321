package com.tradeguard.exception;

import java.util.Map;

/**
 * A REST lookup for something this core does not hold. Unlike {@link UnknownOrderException}, which
 * flags an operation on an order the tracker never saw, this is an ordinary 404 for a read.
 */
public class ResourceNotFoundException extends BaseException {

    public ResourceNotFoundException(String resourceType, String idField, String identifier) {
        super(
                ErrorCode.NOT_FOUND,
                resourceType + " " + identifier + " is not tracked",
                Map.of("resource", resourceType, idField, identifier));
    }

    public static ResourceNotFoundException order(String clientId) {
        return new ResourceNotFoundException("Order", "clientId", clientId);
    }
}
