package com.safeher.sosdispatch.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class GeoUtilTest {

    private static final double LAT = 12.9716;
    private static final double LON = 77.5946;

    @Test
    @DisplayName("Distance from a point to itself is zero")
    void calculateDistance_samePoint_zero() {
        assertThat(GeoUtil.calculateDistance(LAT, LON, LAT, LON)).isZero();
    }

    @Test
    @DisplayName("Distance is symmetric")
    void calculateDistance_symmetric() {
        double ab = GeoUtil.calculateDistance(LAT, LON, 12.9352, 77.6245);
        double ba = GeoUtil.calculateDistance(12.9352, 77.6245, LAT, LON);
        assertThat(ab).isCloseTo(ba, within(1e-6));
    }

    @Test
    @DisplayName("0.0005° of latitude is roughly 55 m")
    void calculateDistance_shortHop() {
        double d = GeoUtil.calculateDistance(LAT, LON, LAT + 0.0005, LON);
        assertThat(d).isBetween(50.0, 60.0);
        assertThat(GeoUtil.calculateDistanceMeters(LAT, LON, LAT + 0.0005, LON)).isEqualTo(Math.round(d));
    }

    @Test
    @DisplayName("Diagonal hop across central Bangalore is about 60 m")
    void calculateDistance_diagonalHop() {
        // exact haversine value is ~62.1 m
        assertThat(GeoUtil.calculateDistance(12.9716, 77.5946, 12.9720, 77.5950)).isCloseTo(60.0, within(2.5));
        assertThat(GeoUtil.calculateDistanceMeters(12.9716, 77.5946, 12.9720, 77.5950)).isEqualTo(62L);
    }

    @Test
    @DisplayName("One degree of latitude is about 111.2 km")
    void calculateDistance_oneDegree() {
        assertThat(GeoUtil.calculateDistance(0, 0, 1, 0)).isCloseTo(111_195, within(1.0));
    }

    @Test
    void isWithinRadius_boundary() {
        assertThat(GeoUtil.isWithinRadius(LAT, LON, LAT + 0.0005, LON, 60)).isTrue();
        assertThat(GeoUtil.isWithinRadius(LAT, LON, LAT + 0.0005, LON, 50)).isFalse();
    }

    @Test
    @DisplayName("Coordinate validation rejects nulls, NaN and out-of-range values")
    void isValidCoordinate() {
        assertThat(GeoUtil.isValidCoordinate(LAT, LON)).isTrue();
        assertThat(GeoUtil.isValidCoordinate(90.0, -180.0)).isTrue();
        assertThat(GeoUtil.isValidCoordinate(null, LON)).isFalse();
        assertThat(GeoUtil.isValidCoordinate(LAT, Double.NaN)).isFalse();
        assertThat(GeoUtil.isValidCoordinate(90.01, LON)).isFalse();
        assertThat(GeoUtil.isValidCoordinate(LAT, 180.5)).isFalse();
    }

    @Test
    @DisplayName("Bounding box contains every point of the circle")
    void boundingBox_containsCircle() {
        double radius = 5000;
        double[] box = GeoUtil.boundingBox(LAT, LON, radius);

        assertThat(box[0]).isLessThan(LAT);
        assertThat(box[1]).isGreaterThan(LAT);
        // Points due north/east at exactly the radius must fall inside the box
        assertThat(GeoUtil.calculateDistance(LAT, LON, box[1], LON)).isGreaterThanOrEqualTo(radius - 1);
        assertThat(GeoUtil.calculateDistance(LAT, LON, LAT, box[3])).isGreaterThanOrEqualTo(radius - 1);
    }

    @Test
    @DisplayName("Bounding box near the antimeridian spans all longitudes")
    void boundingBox_antimeridian_fullBand() {
        double[] box = GeoUtil.boundingBox(0, 179.99, 5000);
        assertThat(box[2]).isEqualTo(-180);
        assertThat(box[3]).isEqualTo(180);
    }

    @Test
    void boundingBox_pole_fullBand() {
        double[] box = GeoUtil.boundingBox(90, 0, 1000);
        assertThat(box[1]).isEqualTo(90);
        assertThat(box[2]).isEqualTo(-180);
        assertThat(box[3]).isEqualTo(180);
    }
}
