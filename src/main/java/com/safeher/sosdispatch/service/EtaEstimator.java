package com.safeher.sosdispatch.service;

/**
 * Coarse arrival estimate sent to the alert owner when a volunteer accepts.
 */
public interface EtaEstimator {

    /**
     * @return whole minutes, or null when the distance is unknown
     */
    Integer estimateMinutes(Long distanceMeters);
}
