package com.dining.reservation_service.service;

import com.dining.reservation_service.config.RabbitMQConfig;
import com.dining.reservation_service.dto.ReservationResponse;
import com.dining.reservation_service.dto.RestaurantDeletedEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.stereotype.Service;

/**
 * Service for publishing reservation events to RabbitMQ.
 * A failed publish is logged and never fails the request that caused it.
 */
@Service
public class ReservationEventPublisher {

    private static final Logger logger = LoggerFactory.getLogger(ReservationEventPublisher.class);

    private final RabbitTemplate rabbitTemplate;

    public ReservationEventPublisher(RabbitTemplate rabbitTemplate) {
        this.rabbitTemplate = rabbitTemplate;
    }

    public void publishReservationCreated(ReservationResponse reservation) {
        publish(RabbitMQConfig.RESERVATION_CREATED_ROUTING_KEY, reservation, reservation.getId());
    }

    public void publishReservationUpdated(ReservationResponse reservation) {
        publish(RabbitMQConfig.RESERVATION_UPDATED_ROUTING_KEY, reservation, reservation.getId());
    }

    public void publishReservationDeleted(ReservationResponse reservation) {
        publish(RabbitMQConfig.RESERVATION_DELETED_ROUTING_KEY, reservation, reservation.getId());
    }

    public void publishRestaurantDeleted(RestaurantDeletedEvent event) {
        publish(RabbitMQConfig.RESTAURANT_DELETED_ROUTING_KEY, event, event.getRestaurantId());
    }

    private void publish(String routingKey, Object payload, Long id) {
        try {
            rabbitTemplate.convertAndSend(RabbitMQConfig.RESERVATION_EXCHANGE, routingKey, payload);
            logger.info("Published {} event for id: {}", routingKey, id);
        } catch (Exception e) {
            logger.error("Failed to publish {} event for id {}: {}", routingKey, id, e.getMessage());
        }
    }
}
