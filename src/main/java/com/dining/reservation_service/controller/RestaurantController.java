package com.dining.reservation_service.controller;

import com.dining.reservation_service.dto.ApiResponse;
import com.dining.reservation_service.dto.CreateReservationRequest;
import com.dining.reservation_service.dto.ReservationResponse;
import com.dining.reservation_service.dto.RestaurantPage;
import com.dining.reservation_service.dto.RestaurantRequest;
import com.dining.reservation_service.dto.RestaurantResponse;
import com.dining.reservation_service.dto.UpdateRestaurantRequest;
import com.dining.reservation_service.security.Caller;
import com.dining.reservation_service.security.annotation.RequiresRole;
import com.dining.reservation_service.service.ReservationService;
import com.dining.reservation_service.service.RestaurantQuery;
import com.dining.reservation_service.service.RestaurantService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.util.MultiValueMap;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * Controller for the restaurant catalog and the reservations nested under a restaurant.
 * Catalog writes are admin only (AOP @RequiresRole).
 */
@RestController
@RequestMapping("/api/v1/restaurants")
@Tag(name = "Restaurants", description = "Restaurant catalog")
public class RestaurantController {

    private final RestaurantService restaurantService;
    private final ReservationService reservationService;

    public RestaurantController(RestaurantService restaurantService, ReservationService reservationService) {
        this.restaurantService = restaurantService;
        this.reservationService = reservationService;
    }

    /**
     * List restaurants with filtering, select, sort and pagination
     * GET /api/v1/restaurants?name[in]=a,b&select=name,tel&sort=-createdAt&page=1&limit=25
     * Authorization: PUBLIC
     */
    @GetMapping
    @Operation(summary = "List restaurants")
    public ResponseEntity<ApiResponse<List<Map<String, Object>>>> getRestaurants(
            @Parameter(hidden = true) @RequestParam MultiValueMap<String, String> params) {
        RestaurantPage page = restaurantService.getRestaurants(RestaurantQuery.parse(params));
        return ResponseEntity.ok(ApiResponse.page(page.getData(), page.getPagination()));
    }

    /**
     * GET /api/v1/restaurants/{id}
     * Authorization: PUBLIC
     */
    @GetMapping("/{id}")
    @Operation(summary = "Get a restaurant")
    public ResponseEntity<ApiResponse<RestaurantResponse>> getRestaurant(@PathVariable Long id) {
        return ResponseEntity.ok(ApiResponse.ok(restaurantService.getRestaurant(id)));
    }

    /**
     * POST /api/v1/restaurants
     * Authorization: ADMIN only
     */
    @PostMapping
    @RequiresRole({"ADMIN"})
    @Operation(summary = "Create a restaurant")
    public ResponseEntity<ApiResponse<RestaurantResponse>> createRestaurant(
            @Valid @RequestBody RestaurantRequest request) {
        RestaurantResponse response = restaurantService.createRestaurant(request);
        return new ResponseEntity<>(ApiResponse.ok(response), HttpStatus.CREATED);
    }

    /**
     * PUT /api/v1/restaurants/{id}
     * Authorization: ADMIN only
     */
    @PutMapping("/{id}")
    @RequiresRole({"ADMIN"})
    @Operation(summary = "Update a restaurant")
    public ResponseEntity<ApiResponse<RestaurantResponse>> updateRestaurant(
            @PathVariable Long id,
            @Valid @RequestBody UpdateRestaurantRequest request) {
        return ResponseEntity.ok(ApiResponse.ok(restaurantService.updateRestaurant(id, request)));
    }

    /**
     * Delete a restaurant and all of its reservations
     * DELETE /api/v1/restaurants/{id}
     * Authorization: ADMIN only
     */
    @DeleteMapping("/{id}")
    @RequiresRole({"ADMIN"})
    @Operation(summary = "Delete a restaurant and its reservations")
    public ResponseEntity<ApiResponse<Map<String, Object>>> deleteRestaurant(@PathVariable Long id) {
        restaurantService.deleteRestaurant(id);
        return ResponseEntity.ok(ApiResponse.empty());
    }

    /**
     * List reservations of one restaurant. Non-admin callers still only see their own.
     * GET /api/v1/restaurants/{restaurantId}/reservations
     * Authorization: AUTHENTICATED
     */
    @GetMapping("/{restaurantId}/reservations")
    @Operation(summary = "List reservations for a restaurant")
    public ResponseEntity<ApiResponse<List<ReservationResponse>>> getRestaurantReservations(
            @PathVariable Long restaurantId,
            HttpServletRequest httpRequest) {
        Caller caller = Caller.from(httpRequest);
        return ResponseEntity.ok(ApiResponse.list(reservationService.getReservations(caller, restaurantId)));
    }

    /**
     * Create a reservation for the caller
     * POST /api/v1/restaurants/{restaurantId}/reservations
     * Authorization: AUTHENTICATED
     * userId is extracted from JWT token
     */
    @PostMapping("/{restaurantId}/reservations")
    @Operation(summary = "Create a reservation")
    public ResponseEntity<ApiResponse<ReservationResponse>> createReservation(
            @PathVariable Long restaurantId,
            @Valid @RequestBody CreateReservationRequest request,
            HttpServletRequest httpRequest) {
        Caller caller = Caller.from(httpRequest);
        ReservationResponse response = reservationService.createReservation(caller, restaurantId, request);
        return new ResponseEntity<>(ApiResponse.ok(response), HttpStatus.CREATED);
    }
}
