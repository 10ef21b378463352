package com.rms.restaurantservice.repository;

import com.rms.restaurantservice.model.MenuItem;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface MenuItemRepository extends JpaRepository<MenuItem, Long> {

    @Query("SELECT m FROM MenuItem m WHERE m.available = true ORDER BY m.category, m.name")
    List<MenuItem> findAvailableOrderByCategoryAndName();

    long countByAvailableTrue();
}
