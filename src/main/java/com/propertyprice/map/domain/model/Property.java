package com.propertyprice.map.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.jpa.domain.support.AuditingEntityListener;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;

@Entity
@Table(name = "properties", indexes = {
        @Index(name = "idx_properties_lat_lng", columnList = "latitude,longitude"),
        @Index(name = "idx_properties_county", columnList = "county")
})
@EntityListeners(AuditingEntityListener.class)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class Property {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "address", nullable = false, length = 500)
    private String address;

    @Column(name = "county", nullable = false, length = 100)
    private String county;

    @Column(name = "eircode", length = 10)
    private String eircode;

    @Column(name = "latitude")
    private Double latitude;

    @Column(name = "longitude")
    private Double longitude;

    @OneToMany(mappedBy = "property", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("dateOfSale DESC")
    private List<PriceHistory> priceHistory = new ArrayList<>();

    @CreatedDate
    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    // Constructor for creating new properties
    public Property(String address, String county, Double latitude, Double longitude) {
        this.address = address;
        this.county = county;
        this.latitude = latitude;
        this.longitude = longitude;
    }

    public PriceHistory addSale(PriceHistory sale) {
        sale.setProperty(this);
        priceHistory.add(sale);
        return sale;
    }
}
