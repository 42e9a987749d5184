package com.dining.reservation_service.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.amqp.core.*;
import org.springframework.amqp.rabbit.connection.ConnectionFactory;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.amqp.support.converter.Jackson2JsonMessageConverter;
import org.springframework.amqp.support.converter.MessageConverter;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * RabbitMQ configuration for reservation event publishing
 */
@Configuration
public class RabbitMQConfig {

    // Exchange names
    public static final String RESERVATION_EXCHANGE = "reservation.events";

    // Queue names
    public static final String RESERVATION_CREATED_QUEUE = "reservation.created";
    public static final String RESERVATION_UPDATED_QUEUE = "reservation.updated";
    public static final String RESERVATION_DELETED_QUEUE = "reservation.deleted";
    public static final String RESTAURANT_DELETED_QUEUE = "restaurant.deleted";

    // Routing keys
    public static final String RESERVATION_CREATED_ROUTING_KEY = "reservation.created";
    public static final String RESERVATION_UPDATED_ROUTING_KEY = "reservation.updated";
    public static final String RESERVATION_DELETED_ROUTING_KEY = "reservation.deleted";
    public static final String RESTAURANT_DELETED_ROUTING_KEY = "restaurant.deleted";

    @Bean
    public TopicExchange reservationExchange() {
        return new TopicExchange(RESERVATION_EXCHANGE, true, false);
    }

    @Bean
    public Queue reservationCreatedQueue() {
        return new Queue(RESERVATION_CREATED_QUEUE, true);
    }

    @Bean
    public Queue reservationUpdatedQueue() {
        return new Queue(RESERVATION_UPDATED_QUEUE, true);
    }

    @Bean
    public Queue reservationDeletedQueue() {
        return new Queue(RESERVATION_DELETED_QUEUE, true);
    }

    @Bean
    public Queue restaurantDeletedQueue() {
        return new Queue(RESTAURANT_DELETED_QUEUE, true);
    }

    @Bean
    public Binding reservationCreatedBinding() {
        return BindingBuilder
            .bind(reservationCreatedQueue())
            .to(reservationExchange())
            .with(RESERVATION_CREATED_ROUTING_KEY);
    }

    @Bean
    public Binding reservationUpdatedBinding() {
        return BindingBuilder
            .bind(reservationUpdatedQueue())
            .to(reservationExchange())
            .with(RESERVATION_UPDATED_ROUTING_KEY);
    }

    @Bean
    public Binding reservationDeletedBinding() {
        return BindingBuilder
            .bind(reservationDeletedQueue())
            .to(reservationExchange())
            .with(RESERVATION_DELETED_ROUTING_KEY);
    }

    @Bean
    public Binding restaurantDeletedBinding() {
        return BindingBuilder
            .bind(restaurantDeletedQueue())
            .to(reservationExchange())
            .with(RESTAURANT_DELETED_ROUTING_KEY);
    }

    /**
     * JSON message converter sharing the application's date handling
     */
    @Bean
    public MessageConverter messageConverter(ObjectMapper objectMapper) {
        return new Jackson2JsonMessageConverter(objectMapper);
    }

    @Bean
    public RabbitTemplate rabbitTemplate(ConnectionFactory connectionFactory, MessageConverter messageConverter) {
        RabbitTemplate template = new RabbitTemplate(connectionFactory);
        template.setMessageConverter(messageConverter);
        return template;
    }
}
