package com.rms.restaurantservice.config;

import com.rms.restaurantservice.model.*;
import com.rms.restaurantservice.repository.MenuItemRepository;
import com.rms.restaurantservice.repository.UserRepository;
import com.rms.restaurantservice.repository.inventory.InventoryItemRepository;
import com.rms.restaurantservice.repository.inventory.MenuInventoryMappingRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.List;

/**
 * Seeds an empty database with the default admin account, a starter menu, stock and the
 * ingredient recipe of each starter dish. Tables that already hold rows are left alone.
 */
@Component
public class DataInitializer implements CommandLineRunner {

    private static final Logger logger = LoggerFactory.getLogger(DataInitializer.class);

    private final UserRepository userRepository;
    private final MenuItemRepository menuItemRepository;
    private final InventoryItemRepository inventoryItemRepository;
    private final MenuInventoryMappingRepository mappingRepository;
    private final PasswordEncoder passwordEncoder;
    private final boolean seedEnabled;

    public DataInitializer(UserRepository userRepository, MenuItemRepository menuItemRepository,
                           InventoryItemRepository inventoryItemRepository,
                           MenuInventoryMappingRepository mappingRepository,
                           PasswordEncoder passwordEncoder,
                           @Value("${restaurant.seed.enabled:true}") boolean seedEnabled) {
        this.userRepository = userRepository;
        this.menuItemRepository = menuItemRepository;
        this.inventoryItemRepository = inventoryItemRepository;
        this.mappingRepository = mappingRepository;
        this.passwordEncoder = passwordEncoder;
        this.seedEnabled = seedEnabled;
    }

    @Override
    @Transactional
    public void run(String... args) {
        if (!seedEnabled) {
            logger.info("Sample data seeding disabled");
            return;
        }

        if (userRepository.count() == 0) {
            User admin = new User();
            admin.setUsername("admin");
            admin.setEmail("admin@example.com");
            admin.setPassword(passwordEncoder.encode("admin123"));
            admin.setRole(Role.ADMIN);
            userRepository.save(admin);
            logger.info("Created default admin account 'admin'");
        }

        if (menuItemRepository.count() > 0 || inventoryItemRepository.count() > 0) {
            logger.info("Menu or inventory already present, skipping sample data");
            return;
        }

        MenuItem pizza = menuItem("Margherita Pizza", "Classic pizza with tomato and mozzarella", "250", MenuCategory.MAIN);
        MenuItem salad = menuItem("Caesar Salad", "Fresh romaine with Caesar dressing", "150", MenuCategory.APPETIZER);
        MenuItem cake = menuItem("Chocolate Lava Cake", "Warm cake with molten chocolate center", "120", MenuCategory.DESSERT);
        MenuItem lassi = menuItem("Mango Lassi", "Creamy mango yogurt drink", "80", MenuCategory.BEVERAGE);
        menuItemRepository.saveAll(List.of(pizza, salad, cake, lassi));

        InventoryItem flour = stock("Flour", "50", "kg", "10", "20", "Local Supplier");
        InventoryItem cheese = stock("Mozzarella Cheese", "20", "kg", "5", "150", "Dairy Co");
        InventoryItem tomato = stock("Tomato", "30", "kg", "10", "30", "Farm Fresh");
        InventoryItem lettuce = stock("Romaine Lettuce", "15", "kg", "5", "50", "Farm Fresh");
        InventoryItem chocolate = stock("Chocolate", "10", "kg", "2", "200", "Sweet Imports");
        InventoryItem mango = stock("Mango Pulp", "25", "liters", "5", "100", "Fruit Co");
        inventoryItemRepository.saveAll(List.of(flour, cheese, tomato, lettuce, chocolate, mango));

        mappingRepository.saveAll(List.of(
                mapping(pizza, flour, "0.2"),
                mapping(pizza, cheese, "0.1"),
                mapping(pizza, tomato, "0.1"),
                mapping(salad, lettuce, "0.2"),
                mapping(cake, chocolate, "0.1"),
                mapping(lassi, mango, "0.3")
        ));
        logger.info("Seeded 4 menu items, 6 inventory items and their ingredient mappings");
    }

    private static MenuItem menuItem(String name, String description, String price, MenuCategory category) {
        MenuItem item = new MenuItem();
        item.setName(name);
        item.setDescription(description);
        item.setPrice(new BigDecimal(price));
        item.setCategory(category);
        item.setAvailable(Boolean.TRUE);
        return item;
    }

    private static InventoryItem stock(String name, String quantity, String unit, String minQuantity,
                                       String costPerUnit, String supplier) {
        InventoryItem item = new InventoryItem();
        item.setItemName(name);
        item.setQuantity(new BigDecimal(quantity));
        item.setUnit(unit);
        item.setMinQuantity(new BigDecimal(minQuantity));
        item.setCostPerUnit(new BigDecimal(costPerUnit));
        item.setSupplier(supplier);
        return item;
    }

    private static MenuInventoryMapping mapping(MenuItem menuItem, InventoryItem inventoryItem, String perUnit) {
        return new MenuInventoryMapping(null, menuItem.getId(), inventoryItem.getId(), new BigDecimal(perUnit));
    }
}
