package com.propertyprice.map.infrastructure.persistence;

import com.propertyprice.map.application.port.out.GeoRecordSource;
import com.propertyprice.map.domain.model.BoundingBox;
import com.propertyprice.map.domain.model.GeoRecord;
import com.propertyprice.map.domain.model.PriceHistory;
import com.propertyprice.map.domain.model.Property;
import com.propertyprice.map.domain.model.RecordFilter;
import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import jakarta.persistence.Tuple;
import jakarta.persistence.criteria.AbstractQuery;
import jakarta.persistence.criteria.CriteriaBuilder;
import jakarta.persistence.criteria.CriteriaQuery;
import jakarta.persistence.criteria.Predicate;
import jakarta.persistence.criteria.Root;
import jakarta.persistence.criteria.Subquery;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * JPA implementation of GeoRecordSource output port.
 *
 * One query per call: each property row is selected together with its latest
 * sale in the filter's date window (correlated subqueries), filtered, ordered by
 * id and limited in the database, by offset or by keyset. No COUNT is issued.
 */
@Component
public class JpaGeoRecordSource implements GeoRecordSource {

    private static final Logger logger = LoggerFactory.getLogger(JpaGeoRecordSource.class);

    @PersistenceContext
    private EntityManager entityManager;

    private final PriceHistoryJpaRepository priceHistoryJpaRepository;

    public JpaGeoRecordSource(PriceHistoryJpaRepository priceHistoryJpaRepository) {
        this.priceHistoryJpaRepository = priceHistoryJpaRepository;
    }

    @Override
    public List<GeoRecord> findRecords(RecordFilter filter, int offset, int limit) {
        if (offset < 0) {
            throw new IllegalArgumentException("Offset must not be negative, got " + offset);
        }
        return query(filter, null, offset, limit);
    }

    @Override
    public List<GeoRecord> findRecordsAfter(RecordFilter filter, long afterId, int limit) {
        return query(filter, afterId, 0, limit);
    }

    private List<GeoRecord> query(RecordFilter filter, Long afterId, int offset, int limit) {
        if (limit <= 0) {
            return List.of();
        }
        CriteriaBuilder cb = entityManager.getCriteriaBuilder();
        CriteriaQuery<Tuple> query = cb.createTupleQuery();
        Root<Property> property = query.from(Property.class);

        query.multiselect(
                property.get("id").alias("id"),
                property.get("latitude").alias("latitude"),
                property.get("longitude").alias("longitude"),
                property.get("address").alias("address"),
                property.get("county").alias("county"),
                latestPrice(query, cb, property, filter).alias("price"),
                latestSaleDate(query, cb, property, filter).alias("saleDate"));
        List<Predicate> where = predicates(query, cb, property, filter);
        if (afterId != null) {
            where.add(cb.greaterThan(property.<Long>get("id"), afterId));
        }
        query.where(where.toArray(new Predicate[0]));
        query.orderBy(cb.asc(property.get("id")));

        List<Tuple> rows = entityManager.createQuery(query)
                .setFirstResult(offset)
                .setMaxResults(limit)
                .getResultList();
        logger.debug("Fetched {} records (afterId={}, offset={}, limit={}) for filter {}",
                rows.size(), afterId, offset, limit, filter);

        List<GeoRecord> records = new ArrayList<>(rows.size());
        for (Tuple row : rows) {
            records.add(new GeoRecord(
                    row.get("id", Long.class),
                    row.get("latitude", Double.class),
                    row.get("longitude", Double.class),
                    row.get("price", Long.class),
                    row.get("saleDate", LocalDate.class),
                    row.get("address", String.class),
                    row.get("county", String.class)));
        }
        return records;
    }

    @Override
    public Map<Long, Long> findLatestPrices(Collection<Long> recordIds, LocalDate startInclusive,
            LocalDate endExclusive) {
        Map<Long, Long> prices = new HashMap<>();
        if (recordIds.isEmpty()) {
            return prices;
        }
        for (PriceHistoryJpaRepository.LatestPriceView view
                : priceHistoryJpaRepository.findLatestPricesInWindow(recordIds, startInclusive, endExclusive)) {
            prices.put(view.getPropertyId(), view.getPrice());
        }
        return prices;
    }

    private List<Predicate> predicates(CriteriaQuery<Tuple> query, CriteriaBuilder cb, Root<Property> property,
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
        if (filter.hasDateWindow()) {
            Subquery<Long> saleInWindow = query.subquery(Long.class);
            Root<PriceHistory> sale = saleInWindow.from(PriceHistory.class);
            List<Predicate> saleWhere = salePredicates(cb, sale, property, filter);
            saleInWindow.select(sale.<Long>get("id")).where(saleWhere.toArray(new Predicate[0]));
            predicates.add(cb.exists(saleInWindow));
        }
        if (filter.getMinPrice() != null) {
            predicates.add(cb.ge(latestPrice(query, cb, property, filter), filter.getMinPrice()));
        }
        if (filter.getMaxPrice() != null) {
            predicates.add(cb.le(latestPrice(query, cb, property, filter), filter.getMaxPrice()));
        }
        return predicates;
    }

    /**
     * Date of the property's latest sale in the filter's window.
     */
    private Subquery<LocalDate> latestSaleDate(AbstractQuery<?> parent, CriteriaBuilder cb, Root<Property> property,
            RecordFilter filter) {
        Subquery<LocalDate> subquery = parent.subquery(LocalDate.class);
        Root<PriceHistory> sale = subquery.from(PriceHistory.class);
        subquery.select(cb.greatest(sale.<LocalDate>get("dateOfSale")))
                .where(salePredicates(cb, sale, property, filter).toArray(new Predicate[0]));
        return subquery;
    }

    /**
     * Price of the property's latest sale in the filter's window; highest price on ties.
     */
    private Subquery<Long> latestPrice(AbstractQuery<?> parent, CriteriaBuilder cb, Root<Property> property,
            RecordFilter filter) {
        Subquery<Long> subquery = parent.subquery(Long.class);
        Root<PriceHistory> sale = subquery.from(PriceHistory.class);
        subquery.select(cb.max(sale.<Long>get("price")))
                .where(
                        cb.equal(sale.get("property"), property),
                        cb.equal(sale.get("dateOfSale"), latestSaleDate(subquery, cb, property, filter)));
        return subquery;
    }

    private List<Predicate> salePredicates(CriteriaBuilder cb, Root<PriceHistory> sale, Root<Property> property,
            RecordFilter filter) {
        List<Predicate> predicates = new ArrayList<>();
        predicates.add(cb.equal(sale.get("property"), property));
        if (filter.getStartDate() != null) {
            predicates.add(cb.greaterThanOrEqualTo(sale.<LocalDate>get("dateOfSale"), filter.getStartDate()));
        }
        if (filter.getEndDate() != null) {
            predicates.add(cb.lessThanOrEqualTo(sale.<LocalDate>get("dateOfSale"), filter.getEndDate()));
        }
        return predicates;
    }
}
