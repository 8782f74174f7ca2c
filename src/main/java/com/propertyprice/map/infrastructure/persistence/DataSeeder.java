package com.propertyprice.map.infrastructure.persistence;

import com.propertyprice.map.application.port.out.PropertyRepository;
import com.propertyprice.map.domain.model.PriceHistory;
import com.propertyprice.map.domain.model.Property;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.LocalDate;

/**
 * Data seeder for local development.
 * Runs when app.seeding.enabled=true and the property table is empty.
 */
@Configuration
public class DataSeeder {

    private static final Logger logger = LoggerFactory.getLogger(DataSeeder.class);

    @Bean
    @ConditionalOnProperty(name = "app.seeding.enabled", havingValue = "true", matchIfMissing = false)
    public CommandLineRunner seedLocalData(PropertyRepository propertyRepository) {
        return args -> {
            long existing = propertyRepository.count();
            if (existing > 0) {
                logger.info("Property data already exists ({} properties), skipping seed", existing);
                return;
            }

            logger.info("Seeding local development data...");

            // Two neighbouring Dublin sales that share a ~1 km grid cell
            Property mainStreet = new Property("1 Main Street, Dublin 2", "Dublin", 53.35, -6.26);
            mainStreet.setEircode("D02XY45");
            mainStreet.addSale(new PriceHistory(LocalDate.of(2021, 3, 15), 280_000L));
            mainStreet.addSale(new PriceHistory(LocalDate.of(2023, 6, 1), 300_000L));
            propertyRepository.save(mainStreet);

            Property nextDoor = new Property("2 Main Street, Dublin 2", "Dublin", 53.351, -6.261);
            nextDoor.addSale(new PriceHistory(LocalDate.of(2023, 7, 10), 500_000L));
            propertyRepository.save(nextDoor);

            // Geocoded, never sold
            propertyRepository.save(new Property("Rural Cottage, Ballymahon", "Longford", 54.0, -7.0));

            Property eyreSquare = new Property("5 Eyre Square, Galway", "Galway", 53.2743, -9.049);
            PriceHistory eyreSale = new PriceHistory(LocalDate.of(2022, 5, 20), 350_000L);
            eyreSale.setDescription("Second-Hand Dwelling house /Apartment");
            eyreSquare.addSale(eyreSale);
            propertyRepository.save(eyreSquare);

            // Not geocoded
            Property unknown = new Property("Unknown Lane, Galway", "Galway", null, null);
            unknown.addSale(new PriceHistory(LocalDate.of(2022, 1, 1), 250_000L));
            propertyRepository.save(unknown);

            logger.info("Local seeding complete");
        };
    }
}
