package com.rms.restaurantservice.service;

import com.rms.restaurantservice.model.Order;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.mail.MailException;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Sends order confirmation emails. Callers treat it as best effort.
 */
@Service
public class NotificationService {

    private static final Logger logger = LoggerFactory.getLogger(NotificationService.class);

    private final JavaMailSender mailSender;
    private final boolean enabled;
    private final String from;

    public NotificationService(JavaMailSender mailSender,
                               @Value("${restaurant.notification.enabled:true}") boolean enabled,
                               @Value("${restaurant.notification.from:no-reply@restaurant.local}") String from) {
        this.mailSender = mailSender;
        this.enabled = enabled;
        this.from = from;
    }

    /**
     * @param itemLines one "Name x quantity" entry per order line
     */
    public void sendOrderConfirmation(Order order, List<String> itemLines) throws MailException {
        if (!enabled) {
            logger.debug("Notifications disabled, skipping confirmation for order #{}", order.getId());
            return;
        }
        SimpleMailMessage message = new SimpleMailMessage();
        message.setFrom(from);
        message.setTo(order.getCustomerEmail());
        message.setSubject("Order #" + order.getId() + " Confirmation");
        message.setText("Dear " + order.getCustomerName() + ",\n\n"
                + "Your order #" + order.getId() + " has been placed successfully.\n"
                + "Total: " + order.getTotalAmount().toPlainString() + "\n"
                + "Items: " + String.join(", ", itemLines) + "\n\n"
                + "Thank you for choosing us!");
        mailSender.send(message);
        logger.info("Confirmation email sent to {} for order #{}", order.getCustomerEmail(), order.getId());
    }
}
