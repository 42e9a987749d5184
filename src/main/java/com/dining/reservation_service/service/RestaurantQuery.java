package com.dining.reservation_service.service;

import com.dining.reservation_service.entity.Restaurant;
import com.dining.reservation_service.exception.ValidationException;
import jakarta.persistence.criteria.CriteriaBuilder;
import jakarta.persistence.criteria.Expression;
import jakarta.persistence.criteria.Predicate;
import jakarta.persistence.criteria.Root;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.util.MultiValueMap;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Catalog listing parameters parsed from the query string.
 *
 * <p>{@code select}, {@code sort}, {@code page} and {@code limit} are reserved. Every other parameter is a
 * filter: a field name, optionally followed by an operator as {@code name[gte]} or {@code name_gte}.
 * Filters on unknown fields are dropped. A repeated parameter keeps its last value.
 */
public class RestaurantQuery {

    public static final int DEFAULT_PAGE = 1;
    public static final int DEFAULT_LIMIT = 25;
    public static final String RESERVATIONS = "reservations";

    private static final Set<String> RESERVED = Set.of("select", "sort", "page", "limit");
    private static final Pattern FILTER_KEY =
            Pattern.compile("^([A-Za-z]+)(?:\\[(gt|gte|lt|lte|in)]|_(gt|gte|lt|lte|in))?$");

    private final List<Filter> filters;
    private final Set<String> select;
    private final Sort sort;
    private final int page;
    private final int limit;

    RestaurantQuery(List<Filter> filters, Set<String> select, Sort sort, int page, int limit) {
        this.filters = filters;
        this.select = select;
        this.sort = sort;
        this.page = page;
        this.limit = limit;
    }

    public static RestaurantQuery defaults() {
        return parse(Collections.<String, String>emptyMap());
    }

    public static RestaurantQuery parse(MultiValueMap<String, String> params) {
        Map<String, String> lastValues = params.entrySet().stream()
                .filter(entry -> entry.getValue() != null && !entry.getValue().isEmpty())
                .collect(Collectors.toMap(Map.Entry::getKey,
                        entry -> entry.getValue().get(entry.getValue().size() - 1)));
        return parse(lastValues);
    }

    public static RestaurantQuery parse(Map<String, String> params) {
        List<Filter> filters = new ArrayList<>();
        for (Map.Entry<String, String> entry : params.entrySet()) {
            if (RESERVED.contains(entry.getKey()) || entry.getValue() == null) {
                continue;
            }
            Filter filter = parseFilter(entry.getKey(), entry.getValue());
            if (filter != null) {
                filters.add(filter);
            }
        }

        return new RestaurantQuery(
                filters,
                parseSelect(params.get("select")),
                parseSort(params.get("sort")),
                parsePositive(params.get("page"), DEFAULT_PAGE),
                parsePositive(params.get("limit"), DEFAULT_LIMIT));
    }

    private static Filter parseFilter(String key, String value) {
        Matcher matcher = FILTER_KEY.matcher(key);
        if (!matcher.matches()) {
            return null;
        }
        RestaurantField field = RestaurantField.byName(matcher.group(1));
        if (field == null) {
            return null;
        }

        String op = matcher.group(2) != null ? matcher.group(2) : matcher.group(3);
        Operator operator = op == null ? Operator.EQ : Operator.valueOf(op.toUpperCase());

        List<Object> values = new ArrayList<>();
        if (operator == Operator.IN) {
            for (String part : value.split(",")) {
                if (!part.isBlank()) {
                    values.add(field.convert(key, part.trim()));
                }
            }
        } else {
            values.add(field.convert(key, value.trim()));
        }
        return new Filter(field, operator, values);
    }

    private static Set<String> parseSelect(String select) {
        if (select == null || select.isBlank()) {
            return null;
        }
        Set<String> fields = new LinkedHashSet<>();
        fields.add(RestaurantField.ID.getName());
        Arrays.stream(select.split(","))
                .map(String::trim)
                .filter(name -> RestaurantField.byName(name) != null || RESERVATIONS.equals(name))
                .forEach(fields::add);
        return fields;
    }

    private static Sort parseSort(String sort) {
        List<Sort.Order> orders = new ArrayList<>();
        if (sort != null) {
            for (String part : sort.split(",")) {
                String name = part.trim();
                boolean descending = name.startsWith("-");
                if (descending) {
                    name = name.substring(1);
                }
                RestaurantField field = RestaurantField.byName(name);
                if (field != null) {
                    orders.add(descending ? Sort.Order.desc(field.getName()) : Sort.Order.asc(field.getName()));
                }
            }
        }
        if (orders.isEmpty()) {
            orders.add(Sort.Order.desc(RestaurantField.CREATED_AT.getName()));
            orders.add(Sort.Order.desc(RestaurantField.ID.getName()));
        }
        return Sort.by(orders);
    }

    private static int parsePositive(String value, int defaultValue) {
        if (value == null) {
            return defaultValue;
        }
        try {
            int parsed = Integer.parseInt(value.trim());
            return parsed > 0 ? parsed : defaultValue;
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    public Specification<Restaurant> toSpecification() {
        return (root, query, cb) -> cb.and(filters.stream()
                .map(filter -> filter.toPredicate(root, cb))
                .toArray(Predicate[]::new));
    }

    public Pageable toPageable() {
        return PageRequest.of(page - 1, limit, sort);
    }

    /**
     * Whether a field appears in the response; everything is included when no select was given
     */
    public boolean includes(String field) {
        return select == null || select.contains(field);
    }

    public Set<String> getSelect() {
        return select;
    }

    public List<Filter> getFilters() {
        return filters;
    }

    public Sort getSort() {
        return sort;
    }

    public int getPage() {
        return page;
    }

    public int getLimit() {
        return limit;
    }

    enum Operator {
        EQ, GT, GTE, LT, LTE, IN
    }

    /**
     * Restaurant attributes that may be filtered and sorted on
     */
    enum RestaurantField {
        ID("id", Long.class),
        NAME("name", String.class),
        ADDRESS("address", String.class),
        TEL("tel", String.class),
        OPENING_HOURS("openingHours", String.class),
        CREATED_AT("createdAt", LocalDateTime.class);

        private final String name;
        private final Class<?> type;

        RestaurantField(String name, Class<?> type) {
            this.name = name;
            this.type = type;
        }

        static RestaurantField byName(String name) {
            for (RestaurantField field : values()) {
                if (field.name.equals(name)) {
                    return field;
                }
            }
            return null;
        }

        String getName() {
            return name;
        }

        Class<?> getType() {
            return type;
        }

        Object convert(String key, String raw) {
            try {
                if (type == Long.class) {
                    return Long.valueOf(raw);
                }
                if (type == LocalDateTime.class) {
                    return parseDateTime(raw);
                }
                return raw;
            } catch (NumberFormatException | DateTimeParseException e) {
                throw ValidationException.forField(key, "Invalid value '" + raw + "' for " + name);
            }
        }

        private static LocalDateTime parseDateTime(String raw) {
            if (raw.length() == 10) {
                return LocalDate.parse(raw).atStartOfDay();
            }
            if (raw.endsWith("Z")) {
                return LocalDateTime.ofInstant(Instant.parse(raw), ZoneOffset.UTC);
            }
            return LocalDateTime.parse(raw);
        }
    }

    static class Filter {
        private final RestaurantField field;
        private final Operator operator;
        private final List<Object> values;

        Filter(RestaurantField field, Operator operator, List<Object> values) {
            this.field = field;
            this.operator = operator;
            this.values = values;
        }

        RestaurantField getField() {
            return field;
        }

        Operator getOperator() {
            return operator;
        }

        List<Object> getValues() {
            return values;
        }

        Predicate toPredicate(Root<Restaurant> root, CriteriaBuilder cb) {
            if (field.getType() == Long.class) {
                return compare(cb, root.<Long>get(field.getName()), typedValues(Long.class));
            }
            if (field.getType() == LocalDateTime.class) {
                return compare(cb, root.<LocalDateTime>get(field.getName()), typedValues(LocalDateTime.class));
            }
            return compare(cb, root.<String>get(field.getName()), typedValues(String.class));
        }

        private <Y> List<Y> typedValues(Class<Y> type) {
            return values.stream().map(type::cast).collect(Collectors.toList());
        }

        private <Y extends Comparable<? super Y>> Predicate compare(CriteriaBuilder cb, Expression<Y> path,
                                                                   List<Y> typed) {
            if (operator == Operator.IN) {
                return typed.isEmpty() ? cb.disjunction() : path.in(typed);
            }

            Y value = typed.get(0);
            switch (operator) {
                case GT:
                    return cb.greaterThan(path, value);
                case GTE:
                    return cb.greaterThanOrEqualTo(path, value);
                case LT:
                    return cb.lessThan(path, value);
                case LTE:
                    return cb.lessThanOrEqualTo(path, value);
                default:
                    return cb.equal(path, value);
            }
        }
    }
}
