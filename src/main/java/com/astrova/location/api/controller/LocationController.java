package com.astrova.location.api.controller;

import com.astrova.location.api.dto.CoordinatesDto;
import com.astrova.location.api.dto.LocationResponseDto;
import com.astrova.location.api.dto.LocationSearchRequestDto;
import com.astrova.location.api.dto.LocationSearchResponseDto;
import com.astrova.location.application.mapper.LocationMapper;
import com.astrova.location.application.port.in.ResolveLocationUseCase;
import com.astrova.location.application.port.in.SearchLocationsUseCase;
import com.astrova.location.domain.model.LocationCandidate;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Controller for location search and reverse resolution.
 */
@RestController
@RequestMapping("/locations")
@Validated
public class LocationController {

    private static final Logger logger = LoggerFactory.getLogger(LocationController.class);

    private final SearchLocationsUseCase searchLocationsUseCase;
    private final ResolveLocationUseCase resolveLocationUseCase;
    private final LocationMapper locationMapper;
    private final int defaultLimit;

    public LocationController(
            SearchLocationsUseCase searchLocationsUseCase,
            ResolveLocationUseCase resolveLocationUseCase,
            LocationMapper locationMapper,
            @Value("${app.location.default-limit:10}") int defaultLimit) {
        this.searchLocationsUseCase = searchLocationsUseCase;
        this.resolveLocationUseCase = resolveLocationUseCase;
        this.locationMapper = locationMapper;
        this.defaultLimit = defaultLimit;
    }

    /**
     * GET /locations/search?q=X&limit=N
     *
     * Autocomplete search over the gazetteer and the external geocoder.
     * Queries shorter than the minimum length return an empty list.
     */
    @GetMapping("/search")
    public ResponseEntity<LocationSearchResponseDto> search(@Valid @ModelAttribute LocationSearchRequestDto request) {
        int limit = request.getLimit() != null ? request.getLimit() : defaultLimit;
        logger.info("Searching locations: q='{}', limit={}", request.getQ(), limit);

        List<LocationCandidate> candidates = searchLocationsUseCase.searchLocations(request.getQ(), limit);
        return ResponseEntity.ok(locationMapper.toSearchResponse(request.getQ(), candidates));
    }

    /**
     * GET /locations/reverse?lat=X&lng=Y
     *
     * Resolve a point to its best-effort place; never fails for valid coordinates.
     */
    @GetMapping("/reverse")
    public ResponseEntity<LocationResponseDto> reverse(@Valid @ModelAttribute CoordinatesDto coordinates) {
        logger.info("Reverse resolving: lat={}, lng={}", coordinates.getLat(), coordinates.getLng());

        LocationCandidate candidate = resolveLocationUseCase.getLocationDetails(
                coordinates.getLat().doubleValue(),
                coordinates.getLng().doubleValue());
        return ResponseEntity.ok(locationMapper.toDto(candidate));
    }
}
