package com.dining.reservation_service.repository;

import com.dining.reservation_service.entity.Restaurant;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.stereotype.Repository;

/**
 * Repository for Restaurant entity
 */
@Repository
public interface RestaurantRepository extends JpaRepository<Restaurant, Long>, JpaSpecificationExecutor<Restaurant> {

    boolean existsByName(String name);

    boolean existsByNameAndIdNot(String name, Long id);
}
