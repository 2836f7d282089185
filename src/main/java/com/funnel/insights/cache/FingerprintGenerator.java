package com.funnel.insights.cache;

import com.funnel.insights.config.FunnelAnalysisConfig;
import com.funnel.insights.model.BaselineRates;
import com.funnel.insights.model.CacheKeyInputs;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.List;
import java.util.Objects;

/**
 * Derives a stable SHA-256 fingerprint from analysis inputs. Dimension names
 * are de-duplicated and sorted, baseline rates rounded, so that request order
 * and float noise do not produce distinct keys.
 */
@Component
public class FingerprintGenerator {

    private final FunnelAnalysisConfig config;

    public FingerprintGenerator(FunnelAnalysisConfig config) {
        this.config = config;
    }

    public String fingerprint(CacheKeyInputs inputs) {
        return sha256(canonicalForm(inputs));
    }

    String canonicalForm(CacheKeyInputs inputs) {
        List<String> dimensions = inputs.getDimensions() == null ? List.of() : inputs.getDimensions().stream()
                .filter(Objects::nonNull)
                .map(String::trim)
                .distinct()
                .sorted()
                .toList();

        StringBuilder sb = new StringBuilder();
        sb.append("dimensions=").append(String.join(",", dimensions)).append('\n');
        sb.append("property=").append(nullSafe(inputs.getPropertyId())).append('\n');
        sb.append("dateRange=").append(nullSafe(inputs.getDateRange())).append('\n');

        BaselineRates baseline = inputs.getBaseline();
        if (baseline != null) {
            sb.append("viewToCart=").append(rounded(baseline.getViewToCartRate())).append('\n');
            sb.append("cartToPurchase=").append(rounded(baseline.getCartToPurchaseRate())).append('\n');
            sb.append("overall=").append(rounded(baseline.getOverallConversionRate())).append('\n');
        }
        return sb.toString();
    }

    private String rounded(double rate) {
        return BigDecimal.valueOf(rate)
                .setScale(config.getCache().getFingerprintPrecision(), RoundingMode.HALF_UP)
                .toPlainString();
    }

    private static String nullSafe(String value) {
        return value == null ? "" : value;
    }

    private static String sha256(String canonical) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(canonical.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
