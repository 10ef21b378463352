package com.rms.restaurantservice.service;

import com.rms.restaurantservice.dto.OrderLineRequest;
import com.rms.restaurantservice.dto.PlaceOrderRequest;
import com.rms.restaurantservice.exception.InsufficientInventoryException;
import com.rms.restaurantservice.exception.OrderTransactionException;
import com.rms.restaurantservice.exception.RestaurantException;
import com.rms.restaurantservice.exception.ValidationException;
import com.rms.restaurantservice.model.*;
import com.rms.restaurantservice.repository.MenuItemRepository;
import com.rms.restaurantservice.repository.inventory.InventoryItemRepository;
import com.rms.restaurantservice.repository.inventory.MenuInventoryMappingRepository;
import com.rms.restaurantservice.repository.order.OrderItemRepository;
import com.rms.restaurantservice.repository.order.OrderRepository;
import com.rms.restaurantservice.repository.order.PaymentRepository;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Places an order as one unit of work: the order row, its lines, the stock deductions for every
 * mapped ingredient and a pending payment either all commit together or none of them do.
 * The confirmation email goes out only after the commit.
 */
@Service
public class OrderPlacementService {

    private static final Logger logger = LoggerFactory.getLogger(OrderPlacementService.class);

    enum TransactionState {
        NOT_STARTED, OPEN, COMMITTED, ROLLED_BACK
    }

    record PlacedOrder(Order order, List<String> itemLines) {
    }

    private final OrderRepository orderRepository;
    private final OrderItemRepository orderItemRepository;
    private final PaymentRepository paymentRepository;
    private final MenuItemRepository menuItemRepository;
    private final InventoryItemRepository inventoryItemRepository;
    private final MenuInventoryMappingRepository mappingRepository;
    private final NotificationService notificationService;
    private final Validator validator;
    private final TransactionTemplate orderTxTemplate;

    public OrderPlacementService(OrderRepository orderRepository, OrderItemRepository orderItemRepository,
                                 PaymentRepository paymentRepository, MenuItemRepository menuItemRepository,
                                 InventoryItemRepository inventoryItemRepository,
                                 MenuInventoryMappingRepository mappingRepository,
                                 NotificationService notificationService,
                                 Validator validator,
                                 @Qualifier("transactionManager") PlatformTransactionManager transactionManager) {
        this.orderRepository = orderRepository;
        this.orderItemRepository = orderItemRepository;
        this.paymentRepository = paymentRepository;
        this.menuItemRepository = menuItemRepository;
        this.inventoryItemRepository = inventoryItemRepository;
        this.mappingRepository = mappingRepository;
        this.notificationService = notificationService;
        this.validator = validator;
        this.orderTxTemplate = new TransactionTemplate(transactionManager);
    }

    public Order placeOrder(PlaceOrderRequest request) {
        validate(request);

        TransactionState state = TransactionState.NOT_STARTED;
        PlacedOrder placed;
        try {
            state = transition(state, TransactionState.OPEN, request);
            placed = orderTxTemplate.execute(status -> placeOrderInTransaction(request));
        } catch (RestaurantException e) {
            transition(state, TransactionState.ROLLED_BACK, request);
            throw e;
        } catch (RuntimeException e) {
            transition(state, TransactionState.ROLLED_BACK, request);
            throw new OrderTransactionException("Failed to place order", e);
        }
        if (placed == null) {
            transition(state, TransactionState.ROLLED_BACK, request);
            throw new OrderTransactionException("Failed to place order", null);
        }
        transition(state, TransactionState.COMMITTED, request);

        notifyCustomer(placed);
        return placed.order();
    }

    private PlacedOrder placeOrderInTransaction(PlaceOrderRequest request) {
        Order order = new Order();
        order.setCustomerName(request.getCustomerName().trim());
        order.setCustomerPhone(request.getCustomerPhone().trim());
        order.setCustomerEmail(normalizeEmail(request.getCustomerEmail()));
        order.setTotalAmount(request.getTotalAmount());
        order.setStatus(OrderStatus.PENDING);
        order.setPaymentStatus(PaymentStatus.PENDING);
        order.setPaymentMethod(request.getPaymentMethod() == null ? "" : request.getPaymentMethod());
        Order savedOrder = orderRepository.save(order);
        logger.debug("Inserted order #{}", savedOrder.getId());

        Map<Long, MenuItem> menuItems = menuItemRepository.findAllById(
                        request.getItems().stream().map(OrderLineRequest::getMenuItemId).distinct().toList())
                .stream()
                .collect(Collectors.toMap(MenuItem::getId, Function.identity()));

        List<OrderItem> orderItems = new ArrayList<>();
        List<String> itemLines = new ArrayList<>();
        for (OrderLineRequest line : request.getItems()) {
            MenuItem menuItem = menuItems.get(line.getMenuItemId());
            if (menuItem == null) {
                throw new ValidationException("Menu item not found: " + line.getMenuItemId());
            }
            orderItems.add(new OrderItem(null, savedOrder.getId(), line.getMenuItemId(),
                    line.getQuantity(), line.getPrice()));
            itemLines.add(menuItem.getName() + " x " + line.getQuantity());
        }
        orderItemRepository.saveAll(orderItems);

        for (OrderLineRequest line : request.getItems()) {
            deductIngredients(line);
        }

        Payment payment = new Payment();
        payment.setOrderId(savedOrder.getId());
        payment.setAmount(request.getTotalAmount());
        payment.setPaymentMethod(savedOrder.getPaymentMethod());
        payment.setStatus(PaymentStatus.PENDING);
        paymentRepository.save(payment);

        return new PlacedOrder(savedOrder, itemLines);
    }

    private void deductIngredients(OrderLineRequest line) {
        List<MenuInventoryMapping> mappings = mappingRepository.findByMenuItemIdOrderByIdAsc(line.getMenuItemId());
        LocalDateTime now = LocalDateTime.now();
        for (MenuInventoryMapping mapping : mappings) {
            BigDecimal required = mapping.requiredFor(line.getQuantity());
            int updated = inventoryItemRepository.decrementIfSufficient(mapping.getInventoryItemId(), required, now);
            if (updated == 0) {
                String ingredient = inventoryItemRepository.findById(mapping.getInventoryItemId())
                        .map(InventoryItem::getItemName)
                        .orElse("inventory item " + mapping.getInventoryItemId());
                logger.warn("Insufficient {} for menu item {}: required {}",
                        ingredient, line.getMenuItemId(), required.toPlainString());
                throw new InsufficientInventoryException(ingredient, line.getMenuItemId());
            }
        }
    }

    private void validate(PlaceOrderRequest request) {
        if (request == null) {
            throw new ValidationException("Order request is required");
        }
        if (isBlank(request.getCustomerName())) {
            throw new ValidationException("customer_name is required");
        }
        if (isBlank(request.getCustomerPhone())) {
            throw new ValidationException("customer_phone is required");
        }
        String email = normalizeEmail(request.getCustomerEmail());
        if (email != null) {
            Set<ConstraintViolation<PlaceOrderRequest>> violations =
                    validator.validateValue(PlaceOrderRequest.class, "customerEmail", email);
            if (!violations.isEmpty()) {
                throw new ValidationException(violations.iterator().next().getMessage());
            }
        }
        if (request.getItems() == null || request.getItems().isEmpty()) {
            throw new ValidationException("Order must contain at least one item");
        }
        if (request.getTotalAmount() == null || request.getTotalAmount().signum() < 0) {
            throw new ValidationException("total_amount must be a non-negative number");
        }

        BigDecimal lineTotal = BigDecimal.ZERO;
        for (OrderLineRequest line : request.getItems()) {
            if (line == null || line.getMenuItemId() == null) {
                throw new ValidationException("menu_item_id is required");
            }
            if (line.getQuantity() == null || line.getQuantity() <= 0) {
                throw new ValidationException("quantity must be a positive integer");
            }
            if (line.getPrice() == null || line.getPrice().signum() < 0) {
                throw new ValidationException("price must not be negative");
            }
            lineTotal = lineTotal.add(line.getPrice().multiply(BigDecimal.valueOf(line.getQuantity())));
        }
        if (lineTotal.compareTo(request.getTotalAmount()) != 0) {
            throw new ValidationException("total_amount " + request.getTotalAmount().toPlainString()
                    + " does not match item total " + lineTotal.toPlainString());
        }
    }

    private void notifyCustomer(PlacedOrder placed) {
        Order order = placed.order();
        if (order.getCustomerEmail() == null) {
            return;
        }
        try {
            notificationService.sendOrderConfirmation(order, placed.itemLines());
        } catch (RuntimeException e) {
            logger.warn("Order #{} placed but confirmation email to {} failed: {}",
                    order.getId(), order.getCustomerEmail(), e.getMessage());
        }
    }

    private TransactionState transition(TransactionState from, TransactionState to, PlaceOrderRequest request) {
        logger.info("Order placement for '{}' ({} lines): {} -> {}",
                request.getCustomerName(), request.getItems().size(), from, to);
        return to;
    }

    private static String normalizeEmail(String email) {
        return isBlank(email) ? null : email.trim();
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }
}
