package com.dining.reservation_service.repository;

import com.dining.reservation_service.entity.Reservation;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Repository for Reservation entity
 */
@Repository
public interface ReservationRepository extends JpaRepository<Reservation, Long> {

    /**
     * Find a reservation with its restaurant loaded
     */
    @EntityGraph(attributePaths = "restaurant")
    @Query("SELECT r FROM Reservation r WHERE r.id = :id")
    Optional<Reservation> findWithRestaurantById(@Param("id") Long id);

    /**
     * Find every reservation with its restaurant loaded
     */
    @EntityGraph(attributePaths = "restaurant")
    @Query("SELECT r FROM Reservation r")
    List<Reservation> findAllWithRestaurant();

    /**
     * Find reservations owned by a user
     */
    @EntityGraph(attributePaths = "restaurant")
    List<Reservation> findByUserId(Long userId);

    /**
     * Find reservations made at a restaurant
     */
    @EntityGraph(attributePaths = "restaurant")
    List<Reservation> findByRestaurantId(Long restaurantId);

    /**
     * Find reservations for any of the given restaurants
     */
    @EntityGraph(attributePaths = "restaurant")
    List<Reservation> findByRestaurantIdIn(Collection<Long> restaurantIds);

    /**
     * Count reservations held by a user across all restaurants
     */
    long countByUserId(Long userId);

    /**
     * Delete every reservation that references a restaurant
     */
    @Modifying
    @Query("DELETE FROM Reservation r WHERE r.restaurant.id = :restaurantId")
    int deleteByRestaurantId(@Param("restaurantId") Long restaurantId);
}
