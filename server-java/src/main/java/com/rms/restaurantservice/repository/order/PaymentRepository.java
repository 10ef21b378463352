package com.rms.restaurantservice.repository.order;

import com.rms.restaurantservice.model.Payment;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface PaymentRepository extends JpaRepository<Payment, Long> {
    Optional<Payment> findFirstByOrderIdOrderByIdDesc(Long orderId);

    List<Payment> findByOrderId(Long orderId);

    /**
     * Rows of {@code [payment, customerName, customerPhone]}, newest payment first.
     */
    @Query("SELECT p, o.customerName, o.customerPhone FROM Payment p, Order o " +
            "WHERE o.id = p.orderId ORDER BY p.createdAt DESC, p.id DESC")
    List<Object[]> findAllWithCustomer();
}
