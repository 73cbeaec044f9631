package com.astrova.location.infrastructure.external;

import com.astrova.location.application.port.out.ExternalGeocoder;
import com.astrova.location.application.port.out.GeocoderRecord;
import com.astrova.location.application.port.out.GeocoderRecord.AddressedRecord;
import com.astrova.location.application.port.out.GeocoderRecord.UnaddressedRecord;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeoutException;

/**
 * Client for a Nominatim-compatible geocoding API.
 * Handles request building, HTTP calls, and response parsing.
 */
@Service
public class NominatimClient implements ExternalGeocoder {

    private static final Logger logger = LoggerFactory.getLogger(NominatimClient.class);
    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final Duration timeout;

    public NominatimClient(
        WebClient.Builder webClientBuilder,
        ObjectMapper objectMapper,
        @Value("${app.geocoder.api-url:https://nominatim.openstreetmap.org}") String apiUrl,
        @Value("${app.geocoder.timeout-seconds:10}") int timeoutSeconds,
        @Value("${app.geocoder.user-agent:Astrova-App/1.0 (https://astrova.app)}") String userAgent,
        @Value("${app.geocoder.accept-language:en}") String acceptLanguage
    ) {
        this.objectMapper = objectMapper;
        this.timeout = Duration.ofSeconds(timeoutSeconds);
        this.webClient = webClientBuilder
            .baseUrl(apiUrl)
            .defaultHeader(HttpHeaders.USER_AGENT, userAgent)
            .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
            .defaultHeader(HttpHeaders.ACCEPT_LANGUAGE, acceptLanguage)
            .build();
    }

    /**
     * Forward geocoding search.
     *
     * @param query Free-text place name
     * @param limit Result cap
     * @return Parsed records; errors with {@link GeocoderException} if the call fails or times out
     */
    @Override
    public Mono<List<GeocoderRecord>> search(String query, int limit) {
        logger.debug("Geocoder search: q='{}', limit={}", query, limit);

        return webClient.get()
            .uri(uriBuilder -> uriBuilder
                .path("/search")
                .queryParam("q", "{q}")
                .queryParam("format", "json")
                .queryParam("limit", limit)
                .queryParam("addressdetails", 1)
                .queryParam("extratags", 1)
                .build(query))
            .retrieve()
            .bodyToMono(String.class)
            .timeout(timeout)
            .map(this::parseSearchResponse)
            .onErrorMap(e -> !(e instanceof GeocoderException), e -> translate("search", e));
    }

    /**
     * Reverse geocoding lookup.
     *
     * @return The place at the point; errors with {@link GeocoderException} on failure
     *         or when the provider reports no match
     */
    @Override
    public Mono<GeocoderRecord> reverse(double lat, double lng) {
        logger.debug("Geocoder reverse: lat={}, lng={}", lat, lng);

        return webClient.get()
            .uri(uriBuilder -> uriBuilder
                .path("/reverse")
                .queryParam("lat", lat)
                .queryParam("lon", lng)
                .queryParam("format", "json")
                .queryParam("addressdetails", 1)
                .queryParam("extratags", 1)
                .build())
            .retrieve()
            .bodyToMono(String.class)
            .timeout(timeout)
            .map(this::parseReverseResponse)
            .onErrorMap(e -> !(e instanceof GeocoderException), e -> translate("reverse", e));
    }

    private GeocoderException translate(String operation, Throwable e) {
        if (e instanceof WebClientResponseException responseException) {
            return new GeocoderException(
                "Geocoder " + operation + " returned " + responseException.getStatusCode(), e);
        }
        if (e instanceof TimeoutException) {
            return new GeocoderException("Geocoder " + operation + " timed out after " + timeout, e);
        }
        return new GeocoderException("Geocoder " + operation + " failed: " + e.getMessage(), e);
    }

    /**
     * Parse a search response (JSON array of places).
     */
    private List<GeocoderRecord> parseSearchResponse(String responseBody) {
        JsonNode root = readTree(responseBody);
        if (!root.isArray()) {
            throw new GeocoderException("Geocoder search response is not an array");
        }

        List<GeocoderRecord> records = new ArrayList<>();
        for (JsonNode element : root) {
            if (element.isObject()) {
                records.add(parseRecord(element));
            } else {
                logger.warn("Skipping non-object search element: {}", element);
            }
        }

        logger.debug("Parsed {} records from geocoder search response", records.size());
        return records;
    }

    /**
     * Parse a reverse response (single place object, or an object with an error field).
     */
    private GeocoderRecord parseReverseResponse(String responseBody) {
        JsonNode root = readTree(responseBody);
        if (!root.isObject()) {
            throw new GeocoderException("Geocoder reverse response is not an object");
        }
        if (root.hasNonNull("error")) {
            throw new GeocoderException("Geocoder reverse returned error: " + root.get("error").asText());
        }
        return parseRecord(root);
    }

    private JsonNode readTree(String responseBody) {
        if (responseBody == null || responseBody.isBlank()) {
            throw new GeocoderException("Geocoder returned an empty body");
        }
        try {
            return objectMapper.readTree(responseBody);
        } catch (Exception e) {
            throw new GeocoderException("Failed to parse geocoder response", e);
        }
    }

    /**
     * Classify a single place by shape: with an address breakdown or label-only.
     */
    private GeocoderRecord parseRecord(JsonNode element) {
        String lat = text(element, "lat");
        String lon = text(element, "lon");
        String displayName = text(element, "display_name");
        String timezone = text(element.path("extratags"), "timezone");

        JsonNode address = element.get("address");
        if (address == null || !address.isObject() || address.isEmpty()) {
            return new UnaddressedRecord(lat, lon, displayName, timezone);
        }

        return AddressedRecord.builder()
            .latitude(lat)
            .longitude(lon)
            .displayName(displayName)
            .timezone(timezone)
            .city(text(address, "city"))
            .town(text(address, "town"))
            .village(text(address, "village"))
            .hamlet(text(address, "hamlet"))
            .state(text(address, "state"))
            .region(text(address, "region"))
            .stateDistrict(text(address, "state_district"))
            .country(text(address, "country"))
            .build();
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    /**
     * Exception raised when geocoder calls fail.
     */
    public static class GeocoderException extends RuntimeException {
        public GeocoderException(String message) {
            super(message);
        }

        public GeocoderException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
