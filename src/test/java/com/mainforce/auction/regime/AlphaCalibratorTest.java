package com.mainforce.auction.regime;

import com.mainforce.auction.model.AlphaCalibration;
import com.mainforce.auction.model.CalibrationStatus;
import com.mainforce.auction.model.DecileOutcome;
import com.mainforce.auction.model.MarketRegime;
import com.mainforce.auction.model.MarketRegimeState;
import com.mainforce.auction.model.PeriodStat;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AlphaCalibratorTest {

    private final AlphaCalibrator calibrator = new AlphaCalibrator();

    @Test
    void calibrate_shouldPassThroughWhenDisabled() {
        AlphaCalibration a = calibrator.calibrate(0.3, false, state(MarketRegime.CALM), predictiveWindow());

        assertEquals(CalibrationStatus.DISABLED, a.status);
        assertEquals(0.3, a.effective, 1e-12);
        assertEquals(0.3, a.input, 1e-12);
    }

    @Test
    void calibrate_shouldPassThroughWhenHistoryInsufficient() {
        AlphaCalibration a = calibrator.calibrate(0.25, true, MarketRegimeState.neutral(20, 4), predictiveWindow());

        assertEquals(CalibrationStatus.INSUFFICIENT_HISTORY, a.status);
        assertEquals(0.25, a.effective, 1e-12);
    }

    @Test
    void calibrate_shouldScaleByPredictiveStrength() {
        AlphaCalibration a = calibrator.calibrate(0.25, true, state(MarketRegime.CALM), predictiveWindow());

        // lift = 0.20 / 0.11, correlation = 1
        double lift = 0.20 / 0.11;
        double strength = 0.6 * (lift - 1.0) + 0.4;
        assertEquals(CalibrationStatus.CALIBRATED, a.status);
        assertEquals(lift, a.lift, 1e-9);
        assertEquals(1.0, a.correlation, 1e-9);
        assertEquals(strength, a.strength, 1e-9);
        assertEquals(0.25 * strength, a.effective, 1e-9);
        assertTrue(a.effective <= a.input);
    }

    @Test
    void calibrate_shouldHalveInVolatileRegime() {
        AlphaCalibration calm = calibrator.calibrate(0.25, true, state(MarketRegime.CALM), predictiveWindow());
        AlphaCalibration volatileDay = calibrator.calibrate(0.25, true, state(MarketRegime.VOLATILE), predictiveWindow());

        assertEquals(0.5, volatileDay.regimeFactor, 1e-12);
        assertEquals(calm.effective * 0.5, volatileDay.effective, 1e-9);
    }

    @Test
    void calibrate_shouldDropToZeroWithoutOutcomes() {
        AlphaCalibration a = calibrator.calibrate(0.4, true, state(MarketRegime.ACTIVE), List.of());

        assertEquals(CalibrationStatus.CALIBRATED, a.status);
        assertEquals(0.0, a.strength, 1e-12);
        assertEquals(0.0, a.effective, 1e-12);
    }

    @Test
    void calibrate_shouldIgnoreCorrelationWithTooFewDeciles() {
        List<PeriodStat> window = List.of(new PeriodStat(LocalDate.of(2024, 6, 3), 100, 100, 4000, 20, 0.1, 10.0, List.of(
                new DecileOutcome(1, 100, 5),
                new DecileOutcome(10, 100, 15)
        )));

        AlphaCalibration a = calibrator.calibrate(0.2, true, state(MarketRegime.CALM), window);

        assertEquals(0.0, a.correlation, 1e-12);
        assertEquals(1.5, a.lift, 1e-9);
        assertEquals(0.2 * 0.6 * 0.5, a.effective, 1e-9);
    }

    private static List<PeriodStat> predictiveWindow() {
        List<PeriodStat> window = new ArrayList<>();
        for (int day = 1; day <= 20; day++) {
            List<DecileOutcome> deciles = new ArrayList<>();
            for (int d = 1; d <= 10; d++) {
                deciles.add(new DecileOutcome(d, 100, 2 * d));
            }
            window.add(new PeriodStat(LocalDate.of(2024, 6, 28).minusDays(day), 100, 100, 4000, 20, 0.1, 10.0, deciles));
        }
        return window;
    }

    private static MarketRegimeState state(MarketRegime regime) {
        return MarketRegimeState.builder()
                .regime(regime)
                .requestedDays(20)
                .coveredDays(20)
                .meanBreadth(0.5)
                .build();
    }
}
