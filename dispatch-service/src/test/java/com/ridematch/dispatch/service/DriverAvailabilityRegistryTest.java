package com.ridematch.dispatch.service;

import com.ridematch.dispatch.exception.DispatchException;
import com.ridematch.dispatch.model.DriverAvailability;
import com.ridematch.dispatch.model.DriverCandidate;
import com.ridematch.dispatch.model.GeoPoint;
import com.ridematch.dispatch.store.DriverAvailabilityStore;
import com.ridematch.dispatch.support.DispatchTestFixture;
import com.ridematch.shared.enums.DriverStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static com.ridematch.dispatch.support.DispatchTestFixture.CITY_LAT;
import static com.ridematch.dispatch.support.DispatchTestFixture.CITY_LNG;
import static com.ridematch.dispatch.support.DispatchTestFixture.latNorthOfCenter;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.offset;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class DriverAvailabilityRegistryTest {

    private DispatchTestFixture fx;
    private DriverAvailabilityRegistry registry;

    @BeforeEach
    void setUp() {
        fx = new DispatchTestFixture();
        registry = fx.registry;
    }

    @Test
    @DisplayName("setAvailable stores location and status and indexes the driver")
    void setAvailable() {
        fx.profile("d1");

        DriverAvailability record = registry.setAvailable("d1", CITY_LAT, CITY_LNG);

        assertThat(record.getStatus()).isEqualTo(DriverStatus.AVAILABLE);
        assertThat(registry.isAvailable("d1")).isTrue();
        assertThat(fx.availabilityStore.isIndexed("d1")).isTrue();
        assertThat(fx.profileStore.findById("d1").orElseThrow().getStatus()).isEqualTo(DriverStatus.AVAILABLE);
    }

    @Test
    @DisplayName("Out-of-range coordinates are refused")
    void setAvailable_invalidCoordinates() {
        fx.profile("d1");
        assertThatThrownBy(() -> registry.setAvailable("d1", 91.0, 10.0))
                .isInstanceOf(DispatchException.class)
                .extracting("code").isEqualTo("INVALID_COORDINATES");
    }

    @Test
    @DisplayName("Unknown drivers cannot go online")
    void setAvailable_unknownDriver() {
        assertThatThrownBy(() -> registry.setAvailable("ghost", CITY_LAT, CITY_LNG))
                .isInstanceOf(DispatchException.class)
                .extracting("code").isEqualTo("DRIVER_NOT_FOUND");
    }

    @Test
    @DisplayName("Suspended drivers cannot go online")
    void setAvailable_suspended() {
        fx.profile("d1").setSuspended(true);
        assertThatThrownBy(() -> registry.setAvailable("d1", CITY_LAT, CITY_LNG))
                .isInstanceOf(DispatchException.class)
                .extracting("code").isEqualTo("DRIVER_SUSPENDED");
    }

    @Test
    @DisplayName("setBusy and setUnavailable keep the last location and leave the index")
    void busyAndUnavailableKeepLocation() {
        fx.onlineDriver("d1", CITY_LAT, CITY_LNG);

        registry.setBusy("d1");
        DriverAvailability busy = registry.getStatus("d1").orElseThrow();
        assertThat(busy.getStatus()).isEqualTo(DriverStatus.BUSY);
        assertThat(busy.getLat()).isEqualTo(CITY_LAT);
        assertThat(fx.availabilityStore.isIndexed("d1")).isFalse();

        registry.setUnavailable("d1");
        assertThat(registry.getStatus("d1").orElseThrow().getLng()).isEqualTo(CITY_LNG);
        assertThat(registry.isAvailable("d1")).isFalse();
    }

    @Test
    @DisplayName("updateLocation keeps the status; an unknown driver gets an unavailable record")
    void updateLocation() {
        fx.onlineDriver("d1", CITY_LAT, CITY_LNG);
        registry.updateLocation("d1", 22.70, 75.84);
        assertThat(registry.getStatus("d1").orElseThrow())
                .extracting(DriverAvailability::getStatus, DriverAvailability::getLat)
                .containsExactly(DriverStatus.AVAILABLE, 22.70);

        DriverAvailability fresh = registry.updateLocation("d2", 22.71, 75.85);
        assertThat(fresh.getStatus()).isEqualTo(DriverStatus.UNAVAILABLE);
        assertThat(fresh.hasLocation()).isTrue();
    }

    @Test
    @DisplayName("Records expire after 24h without a refresh")
    void recordExpires() {
        fx.onlineDriver("d1", CITY_LAT, CITY_LNG);
        fx.clock.advance(Duration.ofHours(24).plusSeconds(1));

        assertThat(registry.getStatus("d1")).isEmpty();
        assertThat(registry.isAvailable("d1")).isFalse();
    }

    @Test
    @DisplayName("findAvailableWithin returns only drivers inside the radius, closest first")
    void findAvailableWithin() {
        fx.onlineDriver("far", latNorthOfCenter(7), CITY_LNG);
        fx.onlineDriver("mid", latNorthOfCenter(2.5), CITY_LNG);
        fx.onlineDriver("near", latNorthOfCenter(1), CITY_LNG);
        fx.onlineDriver("busy", latNorthOfCenter(0.5), CITY_LNG);
        registry.setBusy("busy");

        List<DriverCandidate> found = registry.findAvailableWithin(new GeoPoint(CITY_LAT, CITY_LNG), 5.0);

        assertThat(found).extracting(DriverCandidate::getDriverId).containsExactly("near", "mid");
        assertThat(found.get(0).getDistanceKm()).isCloseTo(1.0, offset(0.01));
    }

    @Test
    @DisplayName("Index entries whose record expired are pruned during a search")
    void findAvailableWithin_prunesExpired() {
        fx.onlineDriver("d1", CITY_LAT, CITY_LNG);
        fx.clock.advance(Duration.ofHours(25));

        assertThat(registry.findAvailableWithin(new GeoPoint(CITY_LAT, CITY_LNG), 5.0)).isEmpty();
        assertThat(fx.availabilityStore.isIndexed("d1")).isFalse();
    }

    @Test
    @DisplayName("release puts a busy driver back at the last location, unless suspended")
    void release() {
        fx.onlineDriver("d1", CITY_LAT, CITY_LNG);
        fx.onlineDriver("d2", CITY_LAT, CITY_LNG);
        registry.setBusy("d1");
        registry.setBusy("d2");
        fx.profileStore.findById("d2").orElseThrow().setSuspended(true);

        registry.release("d1");
        registry.release("d2");

        assertThat(registry.isAvailable("d1")).isTrue();
        assertThat(registry.isAvailable("d2")).isFalse();
    }

    @Test
    @DisplayName("Index hits are cut at exactly R and re-ordered by the precise distance")
    void findAvailableWithin_exactCutOverIndexHits() {
        DriverAvailabilityStore store = mock(DriverAvailabilityStore.class);
        DriverAvailabilityRegistry overIndex =
                new DriverAvailabilityRegistry(store, fx.profileStore, fx.properties, fx.clock);
        GeoPoint center = new GeoPoint(CITY_LAT, CITY_LNG);
        when(store.findIndexedNear(center, 5.0)).thenReturn(List.of(
                available("edge", latNorthOfCenter(4.98)),
                available("near", latNorthOfCenter(1)),
                available("outside", latNorthOfCenter(5.03)),
                available("busy", latNorthOfCenter(2)).toBuilder().status(DriverStatus.BUSY).build()));

        List<DriverCandidate> found = overIndex.findAvailableWithin(center, 5.0);

        assertThat(found).extracting(DriverCandidate::getDriverId).containsExactly("near", "edge");
        assertThat(found.get(1).getDistanceKm()).isLessThanOrEqualTo(5.0);
    }

    private DriverAvailability available(String driverId, double lat) {
        return DriverAvailability.builder()
                .driverId(driverId)
                .status(DriverStatus.AVAILABLE)
                .lat(lat)
                .lng(CITY_LNG)
                .updatedAt(fx.clock.instant())
                .build();
    }
}
