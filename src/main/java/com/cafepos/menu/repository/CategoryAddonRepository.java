package com.cafepos.menu.repository;

import com.cafepos.menu.entity.CategoryAddon;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface CategoryAddonRepository extends JpaRepository<CategoryAddon, Long> {

    @Query("SELECT ca FROM CategoryAddon ca JOIN FETCH ca.addon " +
            "WHERE ca.category.id = :categoryId AND ca.active = true ORDER BY ca.id")
    List<CategoryAddon> findActiveByCategoryId(@Param("categoryId") Long categoryId);
}
