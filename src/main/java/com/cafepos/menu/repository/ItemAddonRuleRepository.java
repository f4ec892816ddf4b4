package com.cafepos.menu.repository;

import com.cafepos.menu.entity.ItemAddonRule;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface ItemAddonRuleRepository extends JpaRepository<ItemAddonRule, Long> {

    @Query("SELECT r FROM ItemAddonRule r JOIN FETCH r.addon WHERE r.menuItem.id = :menuItemId ORDER BY r.id")
    List<ItemAddonRule> findByMenuItemIdWithAddon(@Param("menuItemId") Long menuItemId);
}
