package com.dining.reservation_service.dto;

import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

/**
 * DTO for updating a restaurant. Absent fields are left unchanged; present ones may not be blank.
 */
public class UpdateRestaurantRequest {

    private static final String NOT_BLANK = "(?s).*\\S.*";

    @Pattern(regexp = NOT_BLANK, message = "Please add a name")
    @Size(max = 50, message = "Name can not be more than 50 characters")
    private String name;

    @Pattern(regexp = NOT_BLANK, message = "Please add an address")
    private String address;

    @Pattern(regexp = NOT_BLANK, message = "Please add a telephone number")
    private String tel;

    @Pattern(regexp = NOT_BLANK, message = "Please add opening and closing times (e.g., 09:00-22:00)")
    private String openingHours;

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
