package com.strollie.planner.engine.geo;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class HaversineTest {

    private static final GeoPoint PARIS = GeoPoint.of(48.8566, 2.3522);
    private static final GeoPoint LONDON = GeoPoint.of(51.5074, -0.1278);

    @Test
    void knownCityPairDistance() {
        assertThat(Haversine.distanceKm(PARIS, LONDON)).isCloseTo(343.56, within(0.05));
    }

    @Test
    void distanceIsSymmetric() {
        List<GeoPoint> points = List.of(
                PARIS, LONDON,
                GeoPoint.of(-33.8688, 151.2093),
                GeoPoint.of(89.9, -45.0),
                GeoPoint.of(0.0, -180.0),
                GeoPoint.of(-90.0, 0.0));

        for (GeoPoint a : points) {
            for (GeoPoint b : points) {
                assertThat(Haversine.distanceKm(a, b)).isEqualTo(Haversine.distanceKm(b, a));
            }
        }
    }

    @Test
    void samePointIsZero() {
        assertThat(Haversine.distanceKm(PARIS, PARIS)).isZero();
        assertThat(Haversine.distanceKm(GeoPoint.of(90, 0), GeoPoint.of(90, 0))).isZero();
    }

    @Test
    void crossingTheAntimeridianTakesTheShortWay() {
        double distance = Haversine.distanceKm(GeoPoint.of(0, 179.5), GeoPoint.of(0, -179.5));

        assertThat(distance).isCloseTo(111.19, within(0.01));
    }

    @Test
    void longitudeDoesNotMatterAtThePole() {
        double distance = Haversine.distanceKm(GeoPoint.of(90, 0), GeoPoint.of(90, 123));

        assertThat(distance).isCloseTo(0.0, within(1e-9));
    }

    @Test
    void antipodalPointsAreHalfTheCircumference() {
        double distance = Haversine.distanceKm(GeoPoint.of(0, 0), GeoPoint.of(0, 180));

        assertThat(distance).isCloseTo(Math.PI * Haversine.EARTH_RADIUS_KM, within(1e-6));
    }
}
