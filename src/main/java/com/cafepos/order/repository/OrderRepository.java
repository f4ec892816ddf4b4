package com.cafepos.order.repository;

import com.cafepos.order.entity.Order;
import com.cafepos.order.entity.OrderStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface OrderRepository extends JpaRepository<Order, Long> {

    @Query("SELECT o FROM Order o LEFT JOIN FETCH o.items WHERE o.id = :id")
    Optional<Order> findWithItemsById(@Param("id") Long id);

    /**
     * Cancellation requests and decisions on one order run strictly one after another;
     * each re-reads the status under the lock before transitioning.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT o FROM Order o WHERE o.id = :id")
    Optional<Order> findByIdWithLock(@Param("id") Long id);

    Optional<Order> findTopByOrderNumberStartingWithOrderByOrderNumberDesc(String prefix);

    Page<Order> findByStatus(OrderStatus status, Pageable pageable);

    List<Order> findByStatusOrderByCancellationRequestedAtAsc(OrderStatus status);
}
