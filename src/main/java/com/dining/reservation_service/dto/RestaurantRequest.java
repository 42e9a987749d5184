package com.dining.reservation_service.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * DTO for creating a restaurant
 */
@Schema(description = "Restaurant fields supplied by an administrator")
public class RestaurantRequest {

    @NotBlank(message = "Please add a name")
    @Size(max = 50, message = "Name can not be more than 50 characters")
    @Schema(example = "Happy Restaurant")
    private String name;

    @NotBlank(message = "Please add an address")
    @Schema(description = "House No., Street, Road, District, Province")
    private String address;

    @NotBlank(message = "Please add a telephone number")
    @Schema(example = "02-2187000")
    private String tel;

    @NotBlank(message = "Please add opening and closing times (e.g., 09:00-22:00)")
    @Schema(example = "09:00-22:00")
    private String openingHours;

    public RestaurantRequest() {
    }

    public RestaurantRequest(String name, String address, String tel, String openingHours) {
        this.name = name;
        this.address = address;
        this.tel = tel;
        this.openingHours = openingHours;
    }

    // Getters and Setters
    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getAddress() {
        return address;
    }

    public void setAddress(String address) {
        this.address = address;
    }

    public String getTel() {
        return tel;
    }

    public void setTel(String tel) {
        this.tel = tel;
    }

    public String getOpeningHours() {
        return openingHours;
    }

    public void setOpeningHours(String openingHours) {
        this.openingHours = openingHours;
    }
}
