package com.astrova.location.api.controller;

import com.astrova.location.application.port.out.ExternalGeocoder;
import com.astrova.location.application.port.out.GeocoderRecord;
import com.astrova.location.infrastructure.cache.GeocoderSearchCache;
import com.astrova.location.infrastructure.cache.TestCacheConfig;
import com.astrova.location.infrastructure.external.NominatimClient.GeocoderException;
import com.astrova.location.module.test.support.TestFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.cache.Cache;
import org.springframework.cache.CacheManager;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import reactor.core.publisher.Mono;

import java.util.List;

import static org.hamcrest.Matchers.hasSize;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@Import(TestCacheConfig.class)
class LocationControllerIntegrationTest {

        @Autowired
        private MockMvc mockMvc;

        @Autowired
        private CacheManager cacheManager;

        @MockBean
        private ExternalGeocoder externalGeocoder;

        /**
         * Clear caches before each test to ensure test isolation.
         */
        @BeforeEach
        void clearCaches() {
                Cache searchCache = cacheManager.getCache(GeocoderSearchCache.CACHE_NAME);
                if (searchCache != null) {
                        searchCache.clear();
                }
        }

        @Test
        void testSearch_MergesSources_Returns200() throws Exception {
                List<GeocoderRecord> records = List.of(
                                TestFixtures.addressedCity("Mumbai", "Maharashtra", "India", "19.0760", "72.8777"));
                when(externalGeocoder.search(anyString(), anyInt())).thenReturn(Mono.just(records));

                mockMvc.perform(get("/locations/search")
                                .param("q", "Mumbai")
                                .param("limit", "5"))
                                .andExpect(status().isOk())
                                .andExpect(jsonPath("$.query").value("Mumbai"))
                                .andExpect(jsonPath("$.count").value(2))
                                .andExpect(jsonPath("$.locations", hasSize(2)))
                                .andExpect(jsonPath("$.locations[0].name").value("Mumbai"))
                                .andExpect(jsonPath("$.locations[0].source").value("external"))
                                .andExpect(jsonPath("$.locations[0].timezone").value("Asia/Kolkata"))
                                .andExpect(jsonPath("$.locations[0].displayName")
                                                .value("Mumbai, Maharashtra, India (19.0760, 72.8777)"))
                                .andExpect(jsonPath("$.locations[1].name").value("Mumbai Central"))
                                .andExpect(jsonPath("$.locations[1].source").value("local"));
        }

        @Test
        void testSearch_GeocoderDown_ReturnsGazetteerResults() throws Exception {
                when(externalGeocoder.search(anyString(), anyInt()))
                                .thenReturn(Mono.error(new GeocoderException("Geocoder search timed out")));

                mockMvc.perform(get("/locations/search")
                                .param("q", "Connaught"))
                                .andExpect(status().isOk())
                                .andExpect(jsonPath("$.count").value(1))
                                .andExpect(jsonPath("$.locations[0].city").value("Connaught Place"))
                                .andExpect(jsonPath("$.locations[0].country").value("India"))
                                .andExpect(jsonPath("$.locations[0].source").value("local"));
        }

        @Test
        void testSearch_ShortQuery_ReturnsEmpty() throws Exception {
                mockMvc.perform(get("/locations/search")
                                .param("q", "N"))
                                .andExpect(status().isOk())
                                .andExpect(jsonPath("$.count").value(0))
                                .andExpect(jsonPath("$.locations").isEmpty());

                verifyNoInteractions(externalGeocoder);
        }

        @Test
        void testSearch_InvalidLimit_Returns400() throws Exception {
                mockMvc.perform(get("/locations/search")
                                .param("q", "Mumbai")
                                .param("limit", "0"))
                                .andExpect(status().isBadRequest())
                                .andExpect(jsonPath("$.error").value("VALIDATION_ERROR"))
                                .andExpect(jsonPath("$.fieldErrors.limit").exists());
        }

        @Test
        void testReverse_GeocoderFails_ReturnsCoordinateFallback() throws Exception {
                when(externalGeocoder.reverse(anyDouble(), anyDouble()))
                                .thenReturn(Mono.error(new GeocoderException("Geocoder reverse timed out")));

                mockMvc.perform(get("/locations/reverse")
                                .param("lat", "0")
                                .param("lng", "0"))
                                .andExpect(status().isOk())
                                .andExpect(jsonPath("$.displayName").value("0.0000, 0.0000"))
                                .andExpect(jsonPath("$.latitude").value(0.0))
                                .andExpect(jsonPath("$.timezone").isNotEmpty());
        }

        @Test
        void testReverse_InvalidLat_Returns400() throws Exception {
                mockMvc.perform(get("/locations/reverse")
                                .param("lat", "95")
                                .param("lng", "0"))
                                .andExpect(status().isBadRequest())
                                .andExpect(jsonPath("$.fieldErrors.lat").exists());
        }

        @Test
        void testReverse_NonNumericLat_Returns400() throws Exception {
                mockMvc.perform(get("/locations/reverse")
                                .param("lat", "abc")
                                .param("lng", "0"))
                                .andExpect(status().isBadRequest())
                                .andExpect(jsonPath("$.error").value("VALIDATION_ERROR"));
        }

        @Test
        void testReverse_MissingLng_Returns400() throws Exception {
                mockMvc.perform(get("/locations/reverse")
                                .param("lat", "10"))
                                .andExpect(status().isBadRequest());
        }
}
