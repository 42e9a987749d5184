package com.dining.reservation_service.dto;

import java.util.List;
import java.util.Map;

/**
 * One page of the restaurant listing. Rows are field maps so that select can drop fields.
 */
public class RestaurantPage {

    private final List<Map<String, Object>> data;
    private final Pagination pagination;

    public RestaurantPage(List<Map<String, Object>> data, Pagination pagination) {
        this.data = data;
        this.pagination = pagination;
    }

    public List<Map<String, Object>> getData() {
        return data;
    }

    public Pagination getPagination() {
        return pagination;
    }
}
