package com.propertyprice.map.infrastructure.persistence;

import com.propertyprice.map.application.port.out.PriceHistoryRepository;
import com.propertyprice.map.domain.model.PriceHistory;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;

/**
 * JPA implementation of PriceHistoryRepository output port.
 */
@Repository
public interface PriceHistoryJpaRepository extends JpaRepository<PriceHistory, Long>, PriceHistoryRepository {

    @Override
    List<PriceHistory> findByPropertyIdOrderByDateOfSaleDesc(Long propertyId);

    @Override
    List<PriceHistory> findByPropertyIdOrderByDateOfSaleAsc(Long propertyId);

    /**
     * Latest sale per property within [start, end). When several sales share the
     * latest date the highest price wins.
     */
    @Query("SELECT h.property.id AS propertyId, MAX(h.price) AS price FROM PriceHistory h "
            + "WHERE h.property.id IN :propertyIds AND h.dateOfSale >= :start AND h.dateOfSale < :end "
            + "AND h.dateOfSale = (SELECT MAX(h2.dateOfSale) FROM PriceHistory h2 "
            + "WHERE h2.property = h.property AND h2.dateOfSale >= :start AND h2.dateOfSale < :end) "
            + "GROUP BY h.property.id")
    List<LatestPriceView> findLatestPricesInWindow(
        @Param("propertyIds") Collection<Long> propertyIds,
        @Param("start") LocalDate start,
        @Param("end") LocalDate end
    );

    interface LatestPriceView {
        Long getPropertyId();

        Long getPrice();
    }
}
