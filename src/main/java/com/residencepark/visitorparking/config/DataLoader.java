package com.residencepark.visitorparking.config;

import com.residencepark.visitorparking.entity.Visitor;
import com.residencepark.visitorparking.service.VisitorService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Seeds a few sample visitors on startup when parking.sample-data.enabled=true.
 * Skipped if any visitor already exists.
 */
@Component
@ConditionalOnProperty(name = "parking.sample-data.enabled", havingValue = "true")
@RequiredArgsConstructor
@Slf4j
public class DataLoader implements CommandLineRunner {

    private final VisitorService visitorService;

    @Override
    public void run(String... args) {
        if (visitorService.countAll() > 0) {
            log.info("Visitor data already exists, skipping sample data");
            return;
        }

        log.info("Loading sample visitors...");
        Visitor alice = visitorService.register("Alice Tan", "901231145678", "JOM1234", "B-1-01");
        Visitor bala  = visitorService.register("Bala Kumar", "880512105432", "WXY8821", "A-2-02");
        Visitor chong = visitorService.register("Chong Wei", "950101085511", "PKN77", "B-1-01");
        visitorService.updateStatus(String.valueOf(bala.getId()), "left");

        log.info("========================================");
        log.info("Sample visitors loaded: #{} {}, #{} {}, #{} {}",
                alice.getId(), alice.getLicensePlate(),
                bala.getId(), bala.getLicensePlate(),
                chong.getId(), chong.getLicensePlate());
        log.info("========================================");
    }
}
