package com.funnel.insights.engine;

import com.funnel.insights.exception.InsufficientDataException;
import com.funnel.insights.model.BaselineRates;
import com.funnel.insights.model.FunnelRecord;
import com.funnel.insights.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.funnel.insights.testutil.TestDataFactory.record;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BaselineCalculatorTest {

    private BaselineCalculator calculator;

    @BeforeEach
    void setUp() {
        calculator = new BaselineCalculator(TestDataFactory.defaultConfig());
    }

    @Test
    void calculate_socialEmailScenario_sumsThenDivides() {
        BaselineRates baseline = calculator.calculate(TestDataFactory.socialEmailScenario());

        assertThat(baseline.getViewToCartRate()).isEqualTo(0.20);
        assertThat(baseline.getCartToPurchaseRate()).isEqualTo(0.15);
        assertThat(baseline.getOverallConversionRate()).isEqualTo(0.03);
        assertThat(baseline.getTotalViewItem()).isEqualTo(200);
        assertThat(baseline.getRecordCount()).isEqualTo(2);
    }

    @Test
    void calculate_isNotAnAverageOfPerRecordRates() {
        // Per-record rates 0.5 and 0.01 average to 0.255; the pooled rate is 60/1010
        List<FunnelRecord> records = List.of(
                record("channel", "A", 10, 5, 1),
                record("channel", "B", 1000, 10, 1));

        BaselineRates baseline = calculator.calculate(records);

        assertThat(baseline.getViewToCartRate()).isEqualTo(0.0149);
    }

    @Test
    void calculate_ratesStayWithinUnitInterval() {
        // More carts than views can occur with event-level sampling
        List<FunnelRecord> records = List.of(record("channel", "A", 10, 40, 50));

        BaselineRates baseline = calculator.calculate(records);

        assertThat(baseline.getViewToCartRate()).isBetween(0.0, 1.0);
        assertThat(baseline.getCartToPurchaseRate()).isBetween(0.0, 1.0);
        assertThat(baseline.getOverallConversionRate()).isBetween(0.0, 1.0);
    }

    @Test
    void calculate_zeroCarts_cartToPurchaseIsZero() {
        BaselineRates baseline = calculator.calculate(List.of(record("channel", "A", 100, 0, 0)));

        assertThat(baseline.getViewToCartRate()).isZero();
        assertThat(baseline.getCartToPurchaseRate()).isZero();
    }

    @Test
    void calculate_noRecords_throwsInsufficientData() {
        assertThatThrownBy(() -> calculator.calculate(List.of()))
                .isInstanceOf(InsufficientDataException.class)
                .satisfies(e -> assertThat(((InsufficientDataException) e).getRecordCount()).isZero());
    }

    @Test
    void calculate_zeroViews_throwsInsufficientData() {
        List<FunnelRecord> records = List.of(record("channel", "A", 0, 0, 0), record("channel", "B", 0, 3, 1));

        assertThatThrownBy(() -> calculator.calculate(records))
                .isInstanceOf(InsufficientDataException.class)
                .hasMessageContaining("records=2");
    }
}
