package com.cred.freestyle.checkout.repository;

import com.cred.freestyle.checkout.domain.model.Product;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import jakarta.persistence.LockModeType;
import java.util.Collection;
import java.util.List;

/**
 * Repository interface for Product entity.
 * Provides catalog reads plus the locked read and conditional decrement used by checkout.
 *
 * @author Checkout Team
 */
@Repository
public interface ProductRepository extends JpaRepository<Product, Long> {

    /**
     * Find all products ordered by ID.
     *
     * @return List of products
     */
    List<Product> findAllByOrderByIdAsc();

    /**
     * Find products by IDs with pessimistic write lock.
     * Rows are locked in ascending ID order so that two checkouts touching the
     * same products always acquire locks in the same sequence.
     *
     * @param ids Product IDs
     * @return Locked products that exist (missing IDs are simply absent)
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT p FROM Product p WHERE p.id IN :ids ORDER BY p.id ASC")
    List<Product> findAllByIdForUpdate(@Param("ids") Collection<Long> ids);

    /**
     * Atomically decrement stock, only if enough stock remains.
     *
     * @param id Product ID
     * @param quantity Quantity to take
     * @return Number of rows updated (1 if successful, 0 if stock was insufficient)
     */
    @Modifying
    @Query("UPDATE Product p SET p.stock = p.stock - :quantity " +
           "WHERE p.id = :id AND p.stock >= :quantity")
    int decrementStock(@Param("id") Long id, @Param("quantity") Integer quantity);

    /**
     * Get current stock for a product.
     *
     * @param id Product ID
     * @return Stock, or null if product not found
     */
    @Query("SELECT p.stock FROM Product p WHERE p.id = :id")
    Integer getStock(@Param("id") Long id);
}
