package com.rms.restaurantservice.repository.inventory;

import com.rms.restaurantservice.model.InventoryItem;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

@Repository
public interface InventoryItemRepository extends JpaRepository<InventoryItem, Long> {
    List<InventoryItem> findAllByOrderByItemNameAsc();

    @Query("SELECT COUNT(i) FROM InventoryItem i WHERE i.quantity <= i.minQuantity")
    long countLowStock();

    /**
     * Subtracts {@code amount} only while enough stock remains. The check and the write are one
     * statement, so two concurrent callers can never both take the last unit.
     * <p>
     * SQLite keeps the column as a double, so the difference is rounded back to two decimals.
     * Without that, 0.3 - 0.1 - 0.1 is stored a hair below 0.1 and the next 0.1 is refused.
     *
     * @return 1 when stock was deducted, 0 when the row is missing or holds less than {@code amount}
     */
    @Modifying
    @Query("UPDATE InventoryItem i SET i.quantity = ROUND(i.quantity - :amount, 2), i.updatedAt = :now " +
            "WHERE i.id = :id AND i.quantity >= :amount")
    int decrementIfSufficient(@Param("id") Long id,
                              @Param("amount") BigDecimal amount,
                              @Param("now") LocalDateTime now);
}
