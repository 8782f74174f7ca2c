package com.propertyprice.map.infrastructure.persistence;

import com.propertyprice.map.application.port.out.SaleStatisticsSource;
import com.propertyprice.map.domain.model.BoundingBox;
import com.propertyprice.map.domain.model.CountyPrice;
import com.propertyprice.map.domain.model.PriceHistory;
import com.propertyprice.map.domain.model.Property;
import com.propertyprice.map.domain.model.RecordFilter;
import com.propertyprice.map.domain.model.SaleDateRange;
import com.propertyprice.map.domain.model.SaleObservation;
import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import jakarta.persistence.Tuple;
import jakarta.persistence.criteria.CriteriaBuilder;
import jakarta.persistence.criteria.CriteriaQuery;
import jakarta.persistence.criteria.Join;
import jakarta.persistence.criteria.Predicate;
import jakarta.persistence.criteria.Root;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * JPA implementation of SaleStatisticsSource output port.
 */
@Component
public class JpaSaleStatisticsSource implements SaleStatisticsSource {

    private static final Logger logger = LoggerFactory.getLogger(JpaSaleStatisticsSource.class);

    private static final String LATEST_COUNTY_PRICES = "SELECT p.county AS county, MAX(h.price) AS price "
            + "FROM PriceHistory h JOIN h.property p "
            + "WHERE p.county IS NOT NULL "
            + "AND h.dateOfSale = (SELECT MAX(h2.dateOfSale) FROM PriceHistory h2 WHERE h2.property = p) "
            + "GROUP BY p.id, p.county";

    private static final String SALE_DATE_RANGE = "SELECT MIN(h.dateOfSale) AS minDate, MAX(h.dateOfSale) AS maxDate "
            + "FROM PriceHistory h";

    private static final String COUNTIES = "SELECT DISTINCT p.county FROM Property p "
            + "WHERE p.county IS NOT NULL ORDER BY p.county";

    @PersistenceContext
    private EntityManager entityManager;

    @Override
    public List<SaleObservation> findSales(RecordFilter filter) {
        CriteriaBuilder cb = entityManager.getCriteriaBuilder();
        CriteriaQuery<Tuple> query = cb.createTupleQuery();
        Root<PriceHistory> sale = query.from(PriceHistory.class);
        Join<PriceHistory, Property> property = sale.join("property");

        query.multiselect(
                sale.get("dateOfSale").alias("dateOfSale"),
                sale.get("price").alias("price"),
                sale.get("description").alias("description"));
        query.where(predicates(cb, sale, property, filter).toArray(new Predicate[0]));
        query.orderBy(cb.asc(sale.get("dateOfSale")), cb.asc(sale.get("id")));

        List<Tuple> rows = entityManager.createQuery(query).getResultList();
        logger.debug("Fetched {} sales for filter {}", rows.size(), filter);

        List<SaleObservation> sales = new ArrayList<>(rows.size());
        for (Tuple row : rows) {
            sales.add(new SaleObservation(
                    row.get("dateOfSale", LocalDate.class),
                    row.get("price", Long.class),
                    row.get("description", String.class)));
        }
        return sales;
    }

    @Override
    public List<CountyPrice> findLatestCountyPrices() {
        List<Tuple> rows = entityManager.createQuery(LATEST_COUNTY_PRICES, Tuple.class).getResultList();
        logger.debug("Fetched latest prices of {} properties with a county", rows.size());
        List<CountyPrice> prices = new ArrayList<>(rows.size());
        for (Tuple row : rows) {
            prices.add(new CountyPrice(row.get("county", String.class), row.get("price", Long.class)));
        }
        return prices;
    }

    @Override
    public Optional<SaleDateRange> findSaleDateRange() {
        Tuple row = entityManager.createQuery(SALE_DATE_RANGE, Tuple.class).getSingleResult();
        LocalDate minDate = row.get("minDate", LocalDate.class);
        LocalDate maxDate = row.get("maxDate", LocalDate.class);
        if (minDate == null || maxDate == null) {
            return Optional.empty();
        }
        return Optional.of(new SaleDateRange(minDate, maxDate));
    }

    @Override
    public List<String> findCounties() {
        return entityManager.createQuery(COUNTIES, String.class).getResultList();
    }

    private List<Predicate> predicates(CriteriaBuilder cb, Root<PriceHistory> sale, Join<PriceHistory, Property> property,
            RecordFilter filter) {
        List<Predicate> predicates = new ArrayList<>();

        BoundingBox box = filter.getBoundingBox();
        if (box != null) {
            predicates.add(cb.between(property.<Double>get("latitude"), box.getSouth(), box.getNorth()));
            predicates.add(cb.between(property.<Double>get("longitude"), box.getWest(), box.getEast()));
        }
        if (Boolean.TRUE.equals(filter.getHasGeocoding())) {
            predicates.add(cb.isNotNull(property.get("latitude")));
            predicates.add(cb.isNotNull(property.get("longitude")));
        } else if (Boolean.FALSE.equals(filter.getHasGeocoding())) {
            predicates.add(cb.or(cb.isNull(property.get("latitude")), cb.isNull(property.get("longitude"))));
        }
        if (filter.getCounty() != null && !filter.getCounty().isBlank()) {
            predicates.add(cb.equal(cb.lower(property.<String>get("county")),
                    filter.getCounty().trim().toLowerCase(Locale.ROOT)));
        }
        if (filter.getStartDate() != null) {
            predicates.add(cb.greaterThanOrEqualTo(sale.<LocalDate>get("dateOfSale"), filter.getStartDate()));
        }
        if (filter.getEndDate() != null) {
            predicates.add(cb.lessThanOrEqualTo(sale.<LocalDate>get("dateOfSale"), filter.getEndDate()));
        }
        if (filter.getMinPrice() != null) {
            predicates.add(cb.ge(sale.<Long>get("price"), filter.getMinPrice()));
        }
        if (filter.getMaxPrice() != null) {
            predicates.add(cb.le(sale.<Long>get("price"), filter.getMaxPrice()));
        }
        return predicates;
    }
}
