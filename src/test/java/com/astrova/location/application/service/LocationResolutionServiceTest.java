package com.astrova.location.application.service;

import com.astrova.location.application.mapper.CandidateNormalizer;
import com.astrova.location.application.port.out.ExternalGeocoder;
import com.astrova.location.application.port.out.GeocoderRecord;
import com.astrova.location.domain.model.Coordinates;
import com.astrova.location.domain.model.LocationCandidate;
import com.astrova.location.domain.model.LocationSource;
import com.astrova.location.domain.service.CandidateDeduplicator;
import com.astrova.location.infrastructure.cache.GeocoderSearchCache;
import com.astrova.location.infrastructure.external.NominatimClient.GeocoderException;
import com.astrova.location.module.test.support.MutableClock;
import com.astrova.location.module.test.support.TestFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.cache.concurrent.ConcurrentMapCacheManager;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class LocationResolutionServiceTest {

    private ExternalGeocoder geocoder;
    private CandidateDeduplicator deduplicator;
    private LocationResolutionService service;

    @BeforeEach
    void setUp() {
        geocoder = mock(ExternalGeocoder.class);
        CandidateNormalizer normalizer = TestFixtures.normalizer();
        deduplicator = TestFixtures.deduplicator();
        GeocoderSearchCache searchCache = new GeocoderSearchCache(
            new ConcurrentMapCacheManager(GeocoderSearchCache.CACHE_NAME),
            new MutableClock(Instant.parse("2024-01-01T00:00:00Z")),
            Duration.ofMinutes(10));
        service = new LocationResolutionService(
            TestFixtures.curatedGazetteer(),
            new ExternalGeocoderAdapter(geocoder, normalizer, searchCache),
            deduplicator,
            normalizer,
            2,
            50);
    }

    @Test
    void searchLocations_ShortQuery_ReturnsEmptyWithoutCallingSources() {
        assertThat(service.searchLocations("N", 10)).isEmpty();
        assertThat(service.searchLocations("  N  ", 10)).isEmpty();
        assertThat(service.searchLocations(null, 10)).isEmpty();
        assertThat(service.searchLocations("Mumbai", 0)).isEmpty();

        verifyNoInteractions(geocoder);
    }

    @Test
    void searchLocations_ConnaughtPlace_ComesFromGazetteer() {
        givenExternalResults(List.of());

        List<LocationCandidate> results = service.searchLocations("Connaught", 10);

        assertThat(results).hasSize(1);
        LocationCandidate candidate = results.get(0);
        assertThat(candidate.getCity()).isEqualTo("Connaught Place");
        assertThat(candidate.getCountry()).isEqualTo("India");
        assertThat(candidate.getSource()).isEqualTo(LocationSource.LOCAL);
        assertThat(candidate.getTimezone()).isEqualTo("Asia/Kolkata");
        assertThat(candidate.getDisplayName()).isEqualTo("Connaught Place, Delhi, India (28.6315, 77.2167)");
    }

    @Test
    void searchLocations_MumbaiInBothSources_KeepsSingleExternalMumbai() {
        givenExternalResults(List.of(
            TestFixtures.addressedCity("Mumbai", "Maharashtra", "India", "19.07602", "72.87771"),
            TestFixtures.unaddressed("Mumbai Road, Pune, India", "18.5204", "73.8567")));

        List<LocationCandidate> results = service.searchLocations("Mumbai", 10);

        assertThat(results).filteredOn(candidate -> candidate.getName().equals("Mumbai")).singleElement()
            .satisfies(mumbai -> assertThat(mumbai.getSource()).isEqualTo(LocationSource.EXTERNAL));
        assertThat(results).extracting(LocationCandidate::getName)
            .containsExactly("Mumbai", "Mumbai Road", "Mumbai Central");
    }

    @Test
    void searchLocations_ExternalFailure_StillReturnsGazetteerResults() {
        when(geocoder.search(anyString(), anyInt()))
            .thenReturn(Mono.error(new GeocoderException("Geocoder search timed out")));

        List<LocationCandidate> results = service.searchLocations("Kolkata", 10);

        assertThat(results).extracting(LocationCandidate::getName).containsExactly("Kolkata", "Kolkata Central");
        assertThat(results).allSatisfy(candidate ->
            assertThat(candidate.getSource()).isEqualTo(LocationSource.LOCAL));
    }

    @Test
    void searchLocations_ResultsAreBoundedValidAndUnique() {
        givenExternalResults(List.of(
            TestFixtures.addressedCity("New Delhi", "Delhi", "India", "28.6139", "77.2090"),
            TestFixtures.addressedCity("Delhi", "Delhi", "India", "28.7041", "77.1025"),
            TestFixtures.unaddressed("Delhi Cantonment, Delhi, India", "28.5921", "77.1315")));

        List<LocationCandidate> results = service.searchLocations("Delhi", 4);

        assertThat(results).hasSize(4);
        Set<String> keys = new HashSet<>();
        for (LocationCandidate candidate : results) {
            assertThat(Coordinates.isValid(candidate.getLatitude(), candidate.getLongitude())).isTrue();
            assertThat(candidate.getTimezone()).isNotBlank();
            assertThat(candidate.getDisplayName()).isNotBlank();
            assertThat(keys.add(deduplicator.signatureOf(candidate) + "@" + deduplicator.coordinateKeyOf(candidate)))
                .isTrue();
        }
    }

    @Test
    void searchLocations_RepeatedQuery_IsStable() {
        givenExternalResults(List.of(
            TestFixtures.addressedCity("Chennai", "Tamil Nadu", "India", "13.0827", "80.2707")));

        assertThat(service.searchLocations("Chennai", 10)).isEqualTo(service.searchLocations("Chennai", 10));
    }

    @Test
    void searchLocations_LimitAboveMaximum_IsCapped() {
        givenExternalResults(List.of());

        service.searchLocations("Kolkata", 500);

        verify(geocoder).search("Kolkata", 50);
    }

    @Test
    void getLocationDetails_ProviderFailure_FallsBackToCoordinates() {
        when(geocoder.reverse(anyDouble(), anyDouble()))
            .thenReturn(Mono.error(new GeocoderException("Geocoder reverse returned error: Unable to geocode")));

        LocationCandidate candidate = service.getLocationDetails(0, 0);

        assertThat(candidate.getDisplayName()).isEqualTo("0.0000, 0.0000");
        assertThat(candidate.getLatitude()).isZero();
        assertThat(candidate.getLongitude()).isZero();
        assertThat(candidate.getTimezone()).isNotBlank();
    }

    @Test
    void getLocationDetails_ProviderSuccess_UsesProviderAddress() {
        GeocoderRecord record = TestFixtures.addressedCity("New Delhi", "Delhi", "India", "28.6139", "77.2090");
        when(geocoder.reverse(28.6315, 77.2167)).thenReturn(Mono.just(record));

        LocationCandidate candidate = service.getLocationDetails(28.6315, 77.2167);

        assertThat(candidate.getCity()).isEqualTo("New Delhi");
        assertThat(candidate.getDisplayName()).isEqualTo("New Delhi, Delhi, India");
        assertThat(candidate.getLatitude()).isEqualTo(28.6315);
        assertThat(candidate.getSource()).isEqualTo(LocationSource.EXTERNAL);
    }

    @Test
    void getLocationDetails_OutOfRange_IsRejected() {
        assertThatThrownBy(() -> service.getLocationDetails(95, 0))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> service.getLocationDetails(0, Double.NaN))
            .isInstanceOf(IllegalArgumentException.class);

        verifyNoInteractions(geocoder);
    }

    private void givenExternalResults(List<GeocoderRecord> records) {
        when(geocoder.search(anyString(), anyInt())).thenReturn(Mono.just(records));
    }
}
