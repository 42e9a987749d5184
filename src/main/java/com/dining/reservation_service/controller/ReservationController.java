package com.dining.reservation_service.controller;

import com.dining.reservation_service.dto.ApiResponse;
import com.dining.reservation_service.dto.ReservationResponse;
import com.dining.reservation_service.dto.UpdateReservationRequest;
import com.dining.reservation_service.security.Caller;
import com.dining.reservation_service.service.ReservationService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * Controller for reservation endpoints.
 * Ownership is enforced in ReservationService: users reach their own reservations, admins reach any.
 */
@RestController
@RequestMapping("/api/v1/reservations")
@Tag(name = "Reservations", description = "Reservation ledger")
public class ReservationController {

    private final ReservationService reservationService;

    public ReservationController(ReservationService reservationService) {
        this.reservationService = reservationService;
    }

    /**
     * GET /api/v1/reservations
     * Authorization: AUTHENTICATED, scoped by role
     */
    @GetMapping
    @Operation(summary = "List reservations visible to the caller")
    public ResponseEntity<ApiResponse<List<ReservationResponse>>> getReservations(HttpServletRequest httpRequest) {
        Caller caller = Caller.from(httpRequest);
        return ResponseEntity.ok(ApiResponse.list(reservationService.getReservations(caller, null)));
    }

    /**
     * GET /api/v1/reservations/{id}
     * Authorization: owner or ADMIN
     */
    @GetMapping("/{id}")
    @Operation(summary = "Get a reservation")
    public ResponseEntity<ApiResponse<ReservationResponse>> getReservation(
            @PathVariable Long id,
            HttpServletRequest httpRequest) {
        Caller caller = Caller.from(httpRequest);
        return ResponseEntity.ok(ApiResponse.ok(reservationService.getReservation(caller, id)));
    }

    /**
     * PUT /api/v1/reservations/{id}
     * Authorization: owner or ADMIN
     */
    @PutMapping("/{id}")
    @Operation(summary = "Update a reservation's appointment date")
    public ResponseEntity<ApiResponse<ReservationResponse>> updateReservation(
            @PathVariable Long id,
            @Valid @RequestBody UpdateReservationRequest request,
            HttpServletRequest httpRequest) {
        Caller caller = Caller.from(httpRequest);
        return ResponseEntity.ok(ApiResponse.ok(reservationService.updateReservation(caller, id, request)));
    }

    /**
     * DELETE /api/v1/reservations/{id}
     * Authorization: owner or ADMIN
     */
    @DeleteMapping("/{id}")
    @Operation(summary = "Delete a reservation")
    public ResponseEntity<ApiResponse<Map<String, Object>>> deleteReservation(
            @PathVariable Long id,
            HttpServletRequest httpRequest) {
        Caller caller = Caller.from(httpRequest);
        reservationService.deleteReservation(caller, id);
        return ResponseEntity.ok(ApiResponse.empty());
    }
}
