package com.propertyprice.map.application.port.out;

import com.propertyprice.map.domain.model.Property;

import java.util.Optional;

/**
 * Output port for property persistence.
 */
public interface PropertyRepository {

  Optional<Property> findById(Long id);

  Property save(Property property);

  long count();
}
