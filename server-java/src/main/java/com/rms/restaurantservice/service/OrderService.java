package com.rms.restaurantservice.service;

import com.rms.restaurantservice.dto.OrderSummaryDto;
import com.rms.restaurantservice.exception.ErrorCode;
import com.rms.restaurantservice.exception.ResourceNotFoundException;
import com.rms.restaurantservice.exception.ValidationException;
import com.rms.restaurantservice.model.Order;
import com.rms.restaurantservice.model.OrderStatus;
import com.rms.restaurantservice.repository.order.OrderItemRepository;
import com.rms.restaurantservice.repository.order.OrderRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Service
public class OrderService {

    private static final Logger logger = LoggerFactory.getLogger(OrderService.class);

    private final OrderRepository orderRepository;
    private final OrderItemRepository orderItemRepository;

    public OrderService(OrderRepository orderRepository, OrderItemRepository orderItemRepository) {
        this.orderRepository = orderRepository;
        this.orderItemRepository = orderItemRepository;
    }

    @Transactional(readOnly = true)
    public List<OrderSummaryDto> getOrders() {
        List<Order> orders = orderRepository.findAllByOrderByCreatedAtDescIdDesc();
        if (orders.isEmpty()) {
            return List.of();
        }

        Map<Long, List<String>> itemsByOrder = new HashMap<>();
        List<Long> orderIds = orders.stream().map(Order::getId).toList();
        for (Object[] row : orderItemRepository.findItemNamesByOrderIds(orderIds)) {
            Long orderId = (Long) row[0];
            String name = row[2] != null ? (String) row[2] : "Menu item #" + row[1];
            itemsByOrder.computeIfAbsent(orderId, id -> new ArrayList<>()).add(name + " (" + row[3] + ")");
        }

        return orders.stream().map(order -> new OrderSummaryDto(
                order.getId(),
                order.getCustomerName(),
                order.getCustomerPhone(),
                order.getCustomerEmail(),
                order.getTotalAmount(),
                order.getStatus().value(),
                order.getPaymentStatus().value(),
                order.getPaymentMethod(),
                order.getCreatedAt(),
                String.join(", ", itemsByOrder.getOrDefault(order.getId(), List.of()))
        )).toList();
    }

    /**
     * Moves an order along pending, preparing, ready, delivered, or cancels it.
     * Re-applying the current status is accepted and changes nothing.
     */
    @Transactional
    public Order updateStatus(Long orderId, String status) {
        OrderStatus next;
        try {
            next = OrderStatus.from(status);
        } catch (IllegalArgumentException e) {
            throw new ValidationException(e.getMessage());
        }

        Order order = orderRepository.findById(orderId)
                .orElseThrow(() -> new ResourceNotFoundException("Order", orderId));
        OrderStatus current = order.getStatus();
        if (current == next) {
            return order;
        }
        if (current.isTerminal()) {
            throw new ValidationException(ErrorCode.INVALID_STATUS_TRANSITION,
                    "Order #" + orderId + " is already " + current.value() + " and can no longer change");
        }
        if (!current.canTransitionTo(next)) {
            throw new ValidationException(ErrorCode.INVALID_STATUS_TRANSITION,
                    "Cannot change order status from " + current.value() + " to " + next.value());
        }
        order.setStatus(next);
        Order saved = orderRepository.save(order);
        logger.info("Order #{} status {} -> {}", orderId, current.value(), next.value());
        return saved;
    }
}
