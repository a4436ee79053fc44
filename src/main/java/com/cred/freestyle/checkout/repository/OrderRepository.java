package com.cred.freestyle.checkout.repository;

import com.cred.freestyle.checkout.domain.model.Order;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Repository interface for Order entity.
 * The ledger is append-only: only inserts and reads are used.
 *
 * @author Checkout Team
 */
@Repository
public interface OrderRepository extends JpaRepository<Order, Long> {

    /**
     * Find all orders for a user, newest first.
     *
     * @param userId User ID
     * @return List of orders
     */
    List<Order> findByUserIdOrderByCreatedAtDescIdDesc(Long userId);

    /**
     * Find an order only if it belongs to the given user, with its line items
     * and their products loaded.
     *
     * @param id Order ID
     * @param userId Owning user ID
     * @return Optional containing the order if found and owned by the user
     */
    @Query("SELECT DISTINCT o FROM Order o " +
           "LEFT JOIN FETCH o.lineItems li " +
           "LEFT JOIN FETCH li.product " +
           "WHERE o.id = :id AND o.userId = :userId")
    Optional<Order> findDetailByIdAndUserId(@Param("id") Long id, @Param("userId") Long userId);
}
