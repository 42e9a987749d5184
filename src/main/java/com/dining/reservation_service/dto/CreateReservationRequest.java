package com.dining.reservation_service.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;

import java.time.LocalDateTime;

/**
 * DTO for creating a reservation. Owner and restaurant come from the token and the path.
 */
public class CreateReservationRequest {

    @NotNull(message = "Please add an appointment date")
    @Schema(description = "Date of reservation", example = "2022-04-20")
    private LocalDateTime apptDate;

    public CreateReservationRequest() {
    }

    public CreateReservationRequest(LocalDateTime apptDate) {
        this.apptDate = apptDate;
    }

    public LocalDateTime getApptDate() {
        return apptDate;
    }

    public void setApptDate(LocalDateTime apptDate) {
        this.apptDate = apptDate;
    }
}
