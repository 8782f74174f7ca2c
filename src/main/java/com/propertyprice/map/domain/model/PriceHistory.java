package com.propertyprice.map.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDate;

@Entity
@Table(name = "price_history", indexes = {
        @Index(name = "idx_price_history_property_date", columnList = "property_id,date_of_sale")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class PriceHistory {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "property_id", nullable = false)
    private Property property;

    @Column(name = "date_of_sale", nullable = false)
    private LocalDate dateOfSale;

    /** Sale price in whole euro. */
    @Column(name = "price", nullable = false)
    private Long price;

    @Column(name = "not_full_market_price", nullable = false)
    private boolean notFullMarketPrice;

    @Column(name = "vat_exclusive", nullable = false)
    private boolean vatExclusive;

    @Column(name = "description", length = 255)
    private String description;

    public PriceHistory(LocalDate dateOfSale, Long price) {
        this.dateOfSale = dateOfSale;
        this.price = price;
    }
}
