package com.rms.restaurantservice.service;

import com.rms.restaurantservice.dto.PaymentProcessRequest;
import com.rms.restaurantservice.dto.PaymentSummaryDto;
import com.rms.restaurantservice.exception.ResourceNotFoundException;
import com.rms.restaurantservice.exception.ValidationException;
import com.rms.restaurantservice.model.Order;
import com.rms.restaurantservice.model.Payment;
import com.rms.restaurantservice.model.PaymentStatus;
import com.rms.restaurantservice.repository.order.OrderRepository;
import com.rms.restaurantservice.repository.order.PaymentRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.List;

@Service
public class PaymentService {

    private static final Logger logger = LoggerFactory.getLogger(PaymentService.class);

    private final PaymentRepository paymentRepository;
    private final OrderRepository orderRepository;
    private final TransactionTemplate paymentTxTemplate;

    public PaymentService(PaymentRepository paymentRepository, OrderRepository orderRepository,
                          @Qualifier("transactionManager") PlatformTransactionManager transactionManager) {
        this.paymentRepository = paymentRepository;
        this.orderRepository = orderRepository;
        this.paymentTxTemplate = new TransactionTemplate(transactionManager);
    }

    @Transactional(readOnly = true)
    public List<PaymentSummaryDto> getPayments() {
        return paymentRepository.findAllWithCustomer().stream().map(row -> {
            Payment payment = (Payment) row[0];
            return new PaymentSummaryDto(
                    payment.getId(),
                    payment.getOrderId(),
                    payment.getAmount(),
                    payment.getPaymentMethod(),
                    payment.getTransactionId(),
                    payment.getStatus().value(),
                    payment.getCreatedAt(),
                    (String) row[1],
                    (String) row[2]);
        }).toList();
    }

    /**
     * Records the gateway outcome on the order's payment row and mirrors it onto the order.
     * Both writes commit together.
     */
    public Payment processPayment(Long orderId, PaymentProcessRequest request) {
        PaymentStatus status;
        try {
            status = PaymentStatus.from(request.getStatus());
        } catch (IllegalArgumentException e) {
            throw new ValidationException(e.getMessage());
        }

        Payment processed = paymentTxTemplate.execute(tx -> {
            Order order = orderRepository.findById(orderId)
                    .orElseThrow(() -> new ResourceNotFoundException("Order", orderId));
            Payment payment = paymentRepository.findFirstByOrderIdOrderByIdDesc(orderId)
                    .orElseThrow(() -> new ResourceNotFoundException("Payment for order", orderId));

            payment.setTransactionId(request.getTransactionId());
            payment.setStatus(status);
            order.setPaymentStatus(status);
            orderRepository.save(order);
            return paymentRepository.save(payment);
        });

        logger.info("Payment for order #{} marked {} (transaction {})",
                orderId, status.value(), request.getTransactionId());
        return processed;
    }
}
