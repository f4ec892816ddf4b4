package com.cafepos.menu.repository;

import com.cafepos.menu.entity.MenuItem;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;

public interface MenuItemRepository extends JpaRepository<MenuItem, Long> {

    @Query("SELECT m FROM MenuItem m JOIN FETCH m.category WHERE m.id = :id")
    Optional<MenuItem> findWithCategoryById(@Param("id") Long id);
}
