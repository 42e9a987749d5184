package com.dining.reservation_service.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import io.swagger.v3.oas.annotations.media.Schema;

import java.time.LocalDateTime;

/**
 * DTO for updating a reservation.
 * Tracks whether apptDate was sent at all so an explicit null can be told apart from an absent field.
 */
public class UpdateReservationRequest {

    @Schema(description = "Date of reservation", example = "2022-04-20")
    private LocalDateTime apptDate;

    @JsonIgnore
    private boolean apptDateProvided;

    public UpdateReservationRequest() {
    }

    public UpdateReservationRequest(LocalDateTime apptDate) {
        setApptDate(apptDate);
    }

    public LocalDateTime getApptDate() {
        return apptDate;
    }

    public void setApptDate(LocalDateTime apptDate) {
        this.apptDate = apptDate;
        this.apptDateProvided = true;
    }

    @JsonIgnore
    public boolean isApptDateProvided() {
        return apptDateProvided;
    }
}
