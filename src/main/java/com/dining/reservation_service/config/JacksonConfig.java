package com.dining.reservation_service.config;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.deser.std.StringDeserializer;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.fasterxml.jackson.datatype.jsr310.deser.LocalDateTimeDeserializer;
import com.fasterxml.jackson.datatype.jsr310.ser.LocalDateTimeSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.http.converter.json.Jackson2ObjectMapperBuilder;

import java.io.IOException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.regex.Pattern;

/**
 * Jackson configuration.
 * LocalDateTime values are read from plain dates, local date-times or UTC/offset instants and
 * written as UTC with a 'Z' suffix. Incoming strings have HTML tags stripped.
 */
@Configuration
public class JacksonConfig {

    private static final Logger logger = LoggerFactory.getLogger(JacksonConfig.class);

    private static final Pattern HTML_TAG = Pattern.compile("<[^>]*>");

    @Bean
    @Primary
    public ObjectMapper objectMapper(Jackson2ObjectMapperBuilder builder) {
        JavaTimeModule javaTimeModule = new JavaTimeModule();
        javaTimeModule.addDeserializer(LocalDateTime.class, new UtcLocalDateTimeDeserializer());
        javaTimeModule.addSerializer(LocalDateTime.class, new UtcLocalDateTimeSerializer());

        SimpleModule sanitizerModule = new SimpleModule("xss-sanitizer");
        sanitizerModule.addDeserializer(String.class, new SanitizingStringDeserializer());

        return builder
                .modules(javaTimeModule, sanitizerModule)
                .featuresToDisable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .featuresToDisable(DeserializationFeature.ADJUST_DATES_TO_CONTEXT_TIME_ZONE)
                .featuresToDisable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .build();
    }

    static String stripTags(String value) {
        return value == null ? null : HTML_TAG.matcher(value).replaceAll("");
    }

    /**
     * Accepts "2022-04-20", "2022-04-20T19:30:00", "2022-04-20T12:30:00Z" and "2022-04-20T19:30:00+07:00".
     * Zoned values are converted to UTC.
     */
    static class UtcLocalDateTimeDeserializer extends LocalDateTimeDeserializer {

        UtcLocalDateTimeDeserializer() {
            super(DateTimeFormatter.ISO_LOCAL_DATE_TIME);
        }

        @Override
        public LocalDateTime deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            if (!p.hasToken(com.fasterxml.jackson.core.JsonToken.VALUE_STRING)) {
                return super.deserialize(p, ctxt);
            }
            String text = p.getText().trim();
            if (text.isEmpty()) {
                return null;
            }

            try {
                if (text.length() == 10) {
                    return LocalDate.parse(text).atStartOfDay();
                }
                if (text.endsWith("Z") || text.endsWith("z")) {
                    return LocalDateTime.ofInstant(Instant.parse(text.toUpperCase()), ZoneOffset.UTC);
                }
                if (text.length() > 19 && (text.lastIndexOf('+') > 10 || text.lastIndexOf('-') > 10)) {
                    return OffsetDateTime.parse(text).withOffsetSameInstant(ZoneOffset.UTC).toLocalDateTime();
                }
            } catch (DateTimeParseException e) {
                logger.debug("Failed to parse date value: {}, falling back to default parser", text);
            }
            return super.deserialize(p, ctxt);
        }
    }

    static class UtcLocalDateTimeSerializer extends LocalDateTimeSerializer {

        UtcLocalDateTimeSerializer() {
            super(DateTimeFormatter.ISO_LOCAL_DATE_TIME);
        }

        @Override
        public void serialize(LocalDateTime value, JsonGenerator g, SerializerProvider provider) throws IOException {
            g.writeString(value.format(DateTimeFormatter.ISO_LOCAL_DATE_TIME) + "Z");
        }
    }

    static class SanitizingStringDeserializer extends StringDeserializer {

        @Override
        public String deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            return stripTags(super.deserialize(p, ctxt));
        }
    }
}
