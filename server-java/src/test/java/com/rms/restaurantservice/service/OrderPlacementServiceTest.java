package com.rms.restaurantservice.service;

import com.rms.restaurantservice.dto.OrderLineRequest;
import com.rms.restaurantservice.dto.PlaceOrderRequest;
import com.rms.restaurantservice.exception.InsufficientInventoryException;
import com.rms.restaurantservice.exception.OrderTransactionException;
import com.rms.restaurantservice.exception.ValidationException;
import com.rms.restaurantservice.model.*;
import com.rms.restaurantservice.repository.MenuItemRepository;
import com.rms.restaurantservice.repository.inventory.InventoryItemRepository;
import com.rms.restaurantservice.repository.inventory.MenuInventoryMappingRepository;
import com.rms.restaurantservice.repository.order.OrderItemRepository;
import com.rms.restaurantservice.repository.order.OrderRepository;
import com.rms.restaurantservice.repository.order.PaymentRepository;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.mail.MailSendException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionSystemException;
import org.springframework.transaction.support.SimpleTransactionStatus;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class OrderPlacementServiceTest {

    private static final Long PIZZA_ID = 1L;
    private static final Long FLOUR_ID = 7L;
    private static final Validator VALIDATOR = Validation.buildDefaultValidatorFactory().getValidator();

    @Mock
    private OrderRepository orderRepository;
    @Mock
    private OrderItemRepository orderItemRepository;
    @Mock
    private PaymentRepository paymentRepository;
    @Mock
    private MenuItemRepository menuItemRepository;
    @Mock
    private InventoryItemRepository inventoryItemRepository;
    @Mock
    private MenuInventoryMappingRepository mappingRepository;
    @Mock
    private NotificationService notificationService;
    @Mock
    private PlatformTransactionManager transactionManager;

    private OrderPlacementService service;

    @BeforeEach
    void setup() {
        service = new OrderPlacementService(orderRepository, orderItemRepository, paymentRepository,
                menuItemRepository, inventoryItemRepository, mappingRepository, notificationService,
                VALIDATOR, transactionManager);

        when(transactionManager.getTransaction(any())).thenReturn(new SimpleTransactionStatus());
        when(orderRepository.save(any(Order.class))).thenAnswer(invocation -> {
            Order order = invocation.getArgument(0);
            order.setId(42L);
            return order;
        });

        MenuItem pizza = new MenuItem();
        pizza.setId(PIZZA_ID);
        pizza.setName("Margherita Pizza");
        pizza.setPrice(new BigDecimal("250"));
        when(menuItemRepository.findAllById(any())).thenReturn(List.of(pizza));

        when(mappingRepository.findByMenuItemIdOrderByIdAsc(PIZZA_ID))
                .thenReturn(List.of(new MenuInventoryMapping(3L, PIZZA_ID, FLOUR_ID, new BigDecimal("0.2"))));

        InventoryItem flour = new InventoryItem();
        flour.setId(FLOUR_ID);
        flour.setItemName("Flour");
        when(inventoryItemRepository.findById(FLOUR_ID)).thenReturn(Optional.of(flour));
    }

    @Test
    void emptyItemsAreRejectedBeforeAnyStoreAccess() {
        PlaceOrderRequest request = request("a@example.com", new BigDecimal("0"));
        request.setItems(new ArrayList<>());

        assertThatThrownBy(() -> service.placeOrder(request))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("at least one item");

        verifyNoInteractions(transactionManager, orderRepository, orderItemRepository, paymentRepository,
                menuItemRepository, inventoryItemRepository, mappingRepository, notificationService);
    }

    @Test
    void malformedEmailIsRejectedBeforeAnyStoreAccess() {
        PlaceOrderRequest request = request("not-an-email", new BigDecimal("500"));

        assertThatThrownBy(() -> service.placeOrder(request))
                .isInstanceOf(ValidationException.class)
                .hasMessage("customer_email must be a valid email address");

        verifyNoInteractions(transactionManager, orderRepository, orderItemRepository, paymentRepository,
                menuItemRepository, inventoryItemRepository, mappingRepository, notificationService);
    }

    @Test
    void totalThatDoesNotMatchLinesIsRejectedBeforeAnyStoreAccess() {
        PlaceOrderRequest request = request("a@example.com", new BigDecimal("499.99"));

        assertThatThrownBy(() -> service.placeOrder(request))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("does not match");

        verifyNoInteractions(transactionManager, orderRepository, inventoryItemRepository, notificationService);
    }

    @Test
    void totalIsComparedByNumericValue() {
        when(inventoryItemRepository.decrementIfSufficient(eq(FLOUR_ID), any(), any())).thenReturn(1);

        Order order = service.placeOrder(request(null, new BigDecimal("500.000")));

        assertThat(order.getId()).isEqualTo(42L);
    }

    @Test
    void placesOrderWithLinesDeductionAndPendingPaymentThenNotifies() {
        when(inventoryItemRepository.decrementIfSufficient(eq(FLOUR_ID),
                argThat(amount -> amount.compareTo(new BigDecimal("0.4")) == 0), any())).thenReturn(1);

        Order order = service.placeOrder(request("guest@example.com", new BigDecimal("500")));

        assertThat(order.getId()).isEqualTo(42L);
        assertThat(order.getStatus()).isEqualTo(OrderStatus.PENDING);
        assertThat(order.getPaymentStatus()).isEqualTo(PaymentStatus.PENDING);

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<OrderItem>> itemsCaptor = ArgumentCaptor.forClass(List.class);
        verify(orderItemRepository).saveAll(itemsCaptor.capture());
        assertThat(itemsCaptor.getValue()).singleElement().satisfies(item -> {
            assertThat(item.getOrderId()).isEqualTo(42L);
            assertThat(item.getMenuItemId()).isEqualTo(PIZZA_ID);
            assertThat(item.getQuantity()).isEqualTo(2);
            assertThat(item.getPrice()).isEqualByComparingTo("250");
        });

        ArgumentCaptor<Payment> paymentCaptor = ArgumentCaptor.forClass(Payment.class);
        verify(paymentRepository).save(paymentCaptor.capture());
        assertThat(paymentCaptor.getValue().getAmount()).isEqualByComparingTo("500");
        assertThat(paymentCaptor.getValue().getStatus()).isEqualTo(PaymentStatus.PENDING);
        assertThat(paymentCaptor.getValue().getPaymentMethod()).isEqualTo("cash");

        InOrder inOrder = inOrder(transactionManager, notificationService);
        inOrder.verify(transactionManager).commit(any());
        inOrder.verify(notificationService).sendOrderConfirmation(eq(order), eq(List.of("Margherita Pizza x 2")));
        verify(transactionManager, never()).rollback(any());
    }

    @Test
    void insufficientIngredientRollsBackAndNamesIt() {
        when(inventoryItemRepository.decrementIfSufficient(eq(FLOUR_ID), any(), any())).thenReturn(0);

        assertThatThrownBy(() -> service.placeOrder(request("guest@example.com", new BigDecimal("500"))))
                .isInstanceOf(InsufficientInventoryException.class)
                .hasMessageContaining("Flour")
                .satisfies(e -> assertThat(((InsufficientInventoryException) e).getMenuItemId()).isEqualTo(PIZZA_ID))
                .satisfies(e -> assertThat(((InsufficientInventoryException) e).getIngredient()).isEqualTo("Flour"));

        verify(transactionManager).rollback(any());
        verify(transactionManager, never()).commit(any());
        verify(paymentRepository, never()).save(any());
        verifyNoInteractions(notificationService);
    }

    @Test
    void vanishedInventoryRowIsReportedById() {
        when(inventoryItemRepository.decrementIfSufficient(eq(FLOUR_ID), any(), any())).thenReturn(0);
        when(inventoryItemRepository.findById(FLOUR_ID)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.placeOrder(request(null, new BigDecimal("500"))))
                .isInstanceOf(InsufficientInventoryException.class)
                .hasMessageContaining("inventory item 7");
    }

    @Test
    void unknownMenuItemRollsBackAsValidationError() {
        when(menuItemRepository.findAllById(any())).thenReturn(List.of());

        assertThatThrownBy(() -> service.placeOrder(request(null, new BigDecimal("500"))))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("Menu item not found: 1");

        verify(transactionManager).rollback(any());
        verify(inventoryItemRepository, never()).decrementIfSufficient(any(), any(), any());
    }

    @Test
    void commitFailureBecomesTransactionError() {
        when(inventoryItemRepository.decrementIfSufficient(eq(FLOUR_ID), any(), any())).thenReturn(1);
        doThrow(new TransactionSystemException("disk I/O error")).when(transactionManager).commit(any());

        assertThatThrownBy(() -> service.placeOrder(request("guest@example.com", new BigDecimal("500"))))
                .isInstanceOf(OrderTransactionException.class)
                .hasCauseInstanceOf(TransactionSystemException.class);

        verifyNoInteractions(notificationService);
    }

    @Test
    void notificationFailureDoesNotFailTheOrder() {
        when(inventoryItemRepository.decrementIfSufficient(eq(FLOUR_ID), any(), any())).thenReturn(1);
        doThrow(new MailSendException("smtp unavailable"))
                .when(notificationService).sendOrderConfirmation(any(), any());

        Order order = service.placeOrder(request("guest@example.com", new BigDecimal("500")));

        assertThat(order.getId()).isEqualTo(42L);
        verify(transactionManager).commit(any());
    }

    @Test
    void noEmailMeansNoNotification() {
        when(inventoryItemRepository.decrementIfSufficient(eq(FLOUR_ID), any(), any())).thenReturn(1);

        service.placeOrder(request("  ", new BigDecimal("500")));

        verifyNoInteractions(notificationService);
    }

    @Test
    void lineWithoutMappingsConsumesNothing() {
        when(mappingRepository.findByMenuItemIdOrderByIdAsc(PIZZA_ID)).thenReturn(List.of());

        Order order = service.placeOrder(request(null, new BigDecimal("500")));

        assertThat(order.getId()).isEqualTo(42L);
        verify(inventoryItemRepository, never()).decrementIfSufficient(any(), any(), any());
        verify(paymentRepository).save(any(Payment.class));
    }

    private static PlaceOrderRequest request(String email, BigDecimal total) {
        PlaceOrderRequest request = new PlaceOrderRequest();
        request.setCustomerName("Asha");
        request.setCustomerPhone("9876543210");
        request.setCustomerEmail(email);
        request.setItems(new ArrayList<>(List.of(new OrderLineRequest(PIZZA_ID, 2, new BigDecimal("250")))));
        request.setTotalAmount(total);
        request.setPaymentMethod("cash");
        return request;
    }
}
