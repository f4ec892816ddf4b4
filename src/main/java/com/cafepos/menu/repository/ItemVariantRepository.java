package com.cafepos.menu.repository;

import com.cafepos.menu.entity.ItemVariant;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface ItemVariantRepository extends JpaRepository<ItemVariant, Long> {

    Optional<ItemVariant> findByIdAndMenuItemId(Long id, Long menuItemId);

    List<ItemVariant> findByMenuItemIdOrderByPriceAsc(Long menuItemId);
}
