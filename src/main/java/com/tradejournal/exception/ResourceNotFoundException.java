package com.tradejournal.exception;

import java.util.Map;

/**
 * A requested day, file or trade does not exist: a missing broker export folder, a day with no stored
 * trades, or an unknown trade ID. The resource type and identifier are also returned as error details.
 */
public class ResourceNotFoundException extends BaseException {

    public ResourceNotFoundException(String resourceType, String identifier) {
        super(
                ErrorCode.NOT_FOUND,
                String.format("%s not found: %s", resourceType, identifier),
                Map.of("resource", resourceType, "identifier", identifier));
    }
}
