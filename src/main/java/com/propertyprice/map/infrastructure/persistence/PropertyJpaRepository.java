package com.propertyprice.map.infrastructure.persistence;

import com.propertyprice.map.application.port.out.PropertyRepository;
import com.propertyprice.map.domain.model.Property;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * JPA implementation of PropertyRepository output port.
 */
@Repository
public interface PropertyJpaRepository extends JpaRepository<Property, Long>, PropertyRepository {
}
