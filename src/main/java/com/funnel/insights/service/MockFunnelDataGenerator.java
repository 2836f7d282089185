package com.funnel.insights.service;

import com.funnel.insights.model.DimensionValue;
import com.funnel.insights.model.FunnelRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Deterministic funnel records for demos and local testing.
 *
 * One record per day and (channel, device), with a browser drawn per record.
 * Social converts well below the rest at view to cart and Email well above,
 * so a default analysis always surfaces one critical issue and one
 * opportunity.
 */
@Component
public class MockFunnelDataGenerator {

    private static final Logger log = LoggerFactory.getLogger(MockFunnelDataGenerator.class);

    public static final int DEFAULT_DAYS = 30;

    private static final long SEED = 42L;

    private static final String[] CHANNELS = {"Organic Search", "Paid Search", "Direct", "Social", "Email"};
    // Share of daily views and view->cart multiplier, parallel to CHANNELS
    private static final double[] CHANNEL_SHARE = {0.35, 0.25, 0.20, 0.12, 0.08};
    private static final double[] CHANNEL_CART_FACTOR = {1.0, 1.05, 1.1, 0.45, 1.7};

    private static final String[] DEVICES = {"desktop", "mobile", "tablet"};
    private static final double[] DEVICE_SHARE = {0.45, 0.45, 0.10};
    private static final double[] DEVICE_CART_FACTOR = {1.1, 0.9, 1.0};

    private static final String[] BROWSERS = {"Chrome", "Safari", "Edge", "Firefox"};
    private static final double[] BROWSER_WEIGHT = {0.6, 0.25, 0.1, 0.05};

    private static final int DAILY_VIEWS = 4000;
    private static final double BASE_VIEW_TO_CART = 0.12;
    private static final double BASE_CART_TO_PURCHASE = 0.30;

    public List<FunnelRecord> generate(LocalDate endDate) {
        return generate(endDate, DEFAULT_DAYS);
    }

    public List<FunnelRecord> generate(LocalDate endDate, int days) {
        if (days <= 0) {
            throw new IllegalArgumentException("days must be > 0, got " + days);
        }

        Random random = new Random(SEED);
        List<FunnelRecord> records = new ArrayList<>(days * CHANNELS.length * DEVICES.length);

        for (int d = days - 1; d >= 0; d--) {
            LocalDate date = endDate.minusDays(d);
            double dailyNoise = 0.9 + random.nextDouble() * 0.2;

            for (int c = 0; c < CHANNELS.length; c++) {
                for (int v = 0; v < DEVICES.length; v++) {
                    long views = Math.round(DAILY_VIEWS * dailyNoise * CHANNEL_SHARE[c] * DEVICE_SHARE[v]);
                    double cartRate = BASE_VIEW_TO_CART * CHANNEL_CART_FACTOR[c] * DEVICE_CART_FACTOR[v]
                            * (0.95 + random.nextDouble() * 0.1);
                    long carts = Math.round(views * cartRate);
                    long purchases = Math.round(carts * BASE_CART_TO_PURCHASE * (0.9 + random.nextDouble() * 0.2));

                    records.add(FunnelRecord.builder()
                            .dimension("channel", DimensionValue.of(CHANNELS[c]))
                            .dimension("device", DimensionValue.of(DEVICES[v]))
                            .dimension("browser", DimensionValue.of(pickBrowser(random)))
                            .viewItem(views)
                            .addToCart(carts)
                            .purchase(purchases)
                            .date(date)
                            .build());
                }
            }
        }

        log.info("Generated {} mock funnel records for {} days ending {}", records.size(), days, endDate);
        return records;
    }

    private static String pickBrowser(Random random) {
        double roll = random.nextDouble();
        double cumulative = 0;
        for (int i = 0; i < BROWSERS.length; i++) {
            cumulative += BROWSER_WEIGHT[i];
            if (roll < cumulative) {
                return BROWSERS[i];
            }
        }
        return BROWSERS[BROWSERS.length - 1];
    }
}
