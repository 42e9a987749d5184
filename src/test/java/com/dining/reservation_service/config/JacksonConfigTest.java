package com.dining.reservation_service.config;

import com.dining.reservation_service.dto.CreateReservationRequest;
import com.dining.reservation_service.dto.RestaurantRequest;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.converter.json.Jackson2ObjectMapperBuilder;

import java.time.LocalDateTime;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("JacksonConfig object mapper")
class JacksonConfigTest {

    private ObjectMapper objectMapper;

    @BeforeEach
    void setUp() {
        objectMapper = new JacksonConfig().objectMapper(new Jackson2ObjectMapperBuilder());
    }

    private LocalDateTime readApptDate(String value) throws Exception {
        return objectMapper.readValue("{\"apptDate\":\"" + value + "\"}", CreateReservationRequest.class).getApptDate();
    }

    @Test
    @DisplayName("A plain date means the start of that day")
    void plainDate() throws Exception {
        assertThat(readApptDate("2022-04-20")).isEqualTo(LocalDateTime.of(2022, 4, 20, 0, 0));
    }

    @Test
    @DisplayName("Instants and offsets are normalised to UTC")
    void zonedValues() throws Exception {
        assertThat(readApptDate("2022-04-20T12:30:00Z")).isEqualTo(LocalDateTime.of(2022, 4, 20, 12, 30));
        assertThat(readApptDate("2022-04-20T19:30:00+07:00")).isEqualTo(LocalDateTime.of(2022, 4, 20, 12, 30));
        assertThat(readApptDate("2022-04-20T19:30:00")).isEqualTo(LocalDateTime.of(2022, 4, 20, 19, 30));
    }

    @Test
    @DisplayName("Timestamps are written with a Z suffix")
    void writesUtc() throws Exception {
        String json = objectMapper.writeValueAsString(Map.of("at", LocalDateTime.of(2022, 4, 20, 8, 5)));

        assertThat(json).isEqualTo("{\"at\":\"2022-04-20T08:05:00Z\"}");
    }

    @Test
    @DisplayName("HTML tags are stripped from incoming strings")
    void stripsTags() throws Exception {
        RestaurantRequest request = objectMapper.readValue(
                "{\"name\":\"<script>alert(1)</script>Bistro\",\"address\":\"1 <b>Main</b> St\"}",
                RestaurantRequest.class);

        assertThat(request.getName()).isEqualTo("alert(1)Bistro");
        assertThat(request.getAddress()).isEqualTo("1 Main St");
    }
}
