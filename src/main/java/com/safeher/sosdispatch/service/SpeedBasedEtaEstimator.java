package com.safeher.sosdispatch.service;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Constant-speed estimate: ceil(distance / speed). 500 m/min (30 km/h) approximates urban
 * two-wheeler travel and can be tuned with alert.eta.meters-per-minute.
 */
@Component
public class SpeedBasedEtaEstimator implements EtaEstimator {

    @Value("${alert.eta.meters-per-minute:500}")
    private double metersPerMinute;

    @Override
    public Integer estimateMinutes(Long distanceMeters) {
        if (distanceMeters == null || metersPerMinute <= 0) {
            return null;
        }
        return (int) Math.ceil(distanceMeters / metersPerMinute);
    }
}
