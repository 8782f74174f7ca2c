package com.propertyprice.map.application.service;

public class PropertyNotFoundException extends RuntimeException {

    private final Long propertyId;

    public PropertyNotFoundException(Long propertyId) {
        super("Property not found: " + propertyId);
        this.propertyId = propertyId;
    }

    public Long getPropertyId() {
        return propertyId;
    }
}
