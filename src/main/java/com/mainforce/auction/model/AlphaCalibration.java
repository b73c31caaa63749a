package com.mainforce.auction.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

/**
 * Outcome of one α calibration: the requested value, the value actually applied and the
 * evidence behind it.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class AlphaCalibration {
    public final double input;
    public final double effective;
    public final double lift;
    public final double correlation;
    public final double strength;
    public final double regimeFactor;
    public final CalibrationStatus status;

    public static AlphaCalibration passThrough(double input, double effective, CalibrationStatus status) {
        return AlphaCalibration.builder()
                .input(input)
                .effective(effective)
                .strength(1.0)
                .regimeFactor(1.0)
                .status(status)
                .build();
    }
}
