package com.dining.reservation_service.service;

import com.dining.reservation_service.exception.ValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("RestaurantQuery parsing")
class RestaurantQueryTest {

    @Test
    @DisplayName("Defaults: page 1, limit 25, newest first, every field included")
    void defaults() {
        RestaurantQuery query = RestaurantQuery.defaults();

        assertThat(query.getPage()).isEqualTo(1);
        assertThat(query.getLimit()).isEqualTo(25);
        assertThat(query.getSort()).isEqualTo(Sort.by(Sort.Order.desc("createdAt"), Sort.Order.desc("id")));
        assertThat(query.getSelect()).isNull();
        assertThat(query.includes("reservations")).isTrue();
        assertThat(query.getFilters()).isEmpty();
    }

    @Test
    @DisplayName("Bracketed and suffixed operators are both recognised")
    void parsesOperators() {
        RestaurantQuery query = RestaurantQuery.parse(Map.of(
                "name[in]", "Bistro, Cafe",
                "createdAt_gte", "2022-04-20"));

        assertThat(query.getFilters()).hasSize(2);
        RestaurantQuery.Filter in = query.getFilters().stream()
                .filter(f -> f.getOperator() == RestaurantQuery.Operator.IN).findFirst().orElseThrow();
        assertThat(in.getValues()).containsExactly("Bistro", "Cafe");

        RestaurantQuery.Filter gte = query.getFilters().stream()
                .filter(f -> f.getOperator() == RestaurantQuery.Operator.GTE).findFirst().orElseThrow();
        assertThat(gte.getField()).isEqualTo(RestaurantQuery.RestaurantField.CREATED_AT);
        assertThat(gte.getValues()).containsExactly(LocalDateTime.of(2022, 4, 20, 0, 0));
    }

    @Test
    @DisplayName("Unknown filter fields and unsupported operators are dropped")
    void dropsUnknownFilters() {
        RestaurantQuery query = RestaurantQuery.parse(Map.of(
                "cuisine", "thai",
                "name[regex]", ".*",
                "$where", "1"));

        assertThat(query.getFilters()).isEmpty();
    }

    @Test
    @DisplayName("Unconvertible filter value fails with a validation error")
    void rejectsBadValue() {
        assertThatThrownBy(() -> RestaurantQuery.parse(Map.of("id[gt]", "abc")))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("abc");
    }

    @Test
    @DisplayName("Select always keeps id and ignores unknown names")
    void parsesSelect() {
        RestaurantQuery query = RestaurantQuery.parse(Map.of("select", "name,tel,bogus"));

        assertThat(query.getSelect()).containsExactly("id", "name", "tel");
        assertThat(query.includes("reservations")).isFalse();
    }

    @Test
    @DisplayName("Sort list honours the minus prefix for descending order")
    void parsesSort() {
        RestaurantQuery query = RestaurantQuery.parse(Map.of("sort", "name,-createdAt"));

        assertThat(query.getSort()).isEqualTo(Sort.by(Sort.Order.asc("name"), Sort.Order.desc("createdAt")));
    }

    @Test
    @DisplayName("Invalid page and limit fall back to defaults")
    void invalidPaging() {
        RestaurantQuery query = RestaurantQuery.parse(Map.of("page", "-2", "limit", "lots"));

        assertThat(query.getPage()).isEqualTo(RestaurantQuery.DEFAULT_PAGE);
        assertThat(query.getLimit()).isEqualTo(RestaurantQuery.DEFAULT_LIMIT);
    }

    @Test
    @DisplayName("Page and limit map onto a zero-based page request")
    void toPageable() {
        Pageable pageable = RestaurantQuery.parse(Map.of("page", "3", "limit", "2")).toPageable();

        assertThat(pageable.getPageNumber()).isEqualTo(2);
        assertThat(pageable.getPageSize()).isEqualTo(2);
    }

    @Test
    @DisplayName("A repeated parameter keeps its last value")
    void repeatedParameterLastWins() {
        MultiValueMap<String, String> params = new LinkedMultiValueMap<>();
        params.put("limit", List.of("5", "10"));
        params.put("name", List.of("Bistro", "Cafe"));

        RestaurantQuery query = RestaurantQuery.parse(params);

        assertThat(query.getLimit()).isEqualTo(10);
        assertThat(query.getFilters()).singleElement()
                .satisfies(filter -> assertThat(filter.getValues()).containsExactly("Cafe"));
    }
}
