package com.rms.restaurantservice.controller;

import com.rms.restaurantservice.exception.ResourceNotFoundException;
import com.rms.restaurantservice.exception.ValidationException;
import com.rms.restaurantservice.model.MenuCategory;
import com.rms.restaurantservice.model.MenuItem;
import com.rms.restaurantservice.service.JwtService;
import com.rms.restaurantservice.service.MenuService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class MenuControllerTest {

    private static final String NEW_ITEM = """
            {"name": "Paneer Tikka", "description": "Grilled cottage cheese", "price": 180, "category": "appetizer"}
            """;

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private JwtService jwtService;

    @MockBean
    private MenuService menuService;

    @MockBean
    private JavaMailSender mailSender;

    @Test
    void menuIsPublic() throws Exception {
        MenuItem item = new MenuItem(1L, "Mango Lassi", "Creamy mango yogurt drink", new BigDecimal("80"),
                MenuCategory.BEVERAGE, null, true, null);
        when(menuService.getAvailableMenu()).thenReturn(List.of(item));

        mockMvc.perform(get("/api/menu"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].name").value("Mango Lassi"))
                .andExpect(jsonPath("$[0].category").value("beverage"));
    }

    @Test
    void addingMenuItemsIsLimitedToAdminAndStaff() throws Exception {
        MenuItem saved = new MenuItem();
        saved.setId(9L);
        when(menuService.create(any())).thenReturn(saved);

        mockMvc.perform(post("/api/menu").contentType(MediaType.APPLICATION_JSON).content(NEW_ITEM))
                .andExpect(status().isUnauthorized());

        mockMvc.perform(post("/api/menu").header("Authorization", bearer(5L, "CUSTOMER"))
                        .contentType(MediaType.APPLICATION_JSON).content(NEW_ITEM))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.error").value("Access denied"));

        mockMvc.perform(post("/api/menu").header("Authorization", bearer(1L, "ADMIN"))
                        .contentType(MediaType.APPLICATION_JSON).content(NEW_ITEM))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value(9));
    }

    @Test
    void negativePriceIsRejected() throws Exception {
        String body = NEW_ITEM.replace("180", "-1");

        mockMvc.perform(post("/api/menu").header("Authorization", bearer(2L, "STAFF"))
                        .contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("price must not be negative"));

        verifyNoInteractions(menuService);
    }

    @Test
    void unknownCategoryIsRejected() throws Exception {
        when(menuService.create(any())).thenThrow(new ValidationException("Invalid category: brunch"));

        mockMvc.perform(post("/api/menu").header("Authorization", bearer(2L, "STAFF"))
                        .contentType(MediaType.APPLICATION_JSON).content(NEW_ITEM.replace("appetizer", "brunch")))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Invalid category: brunch"));
    }

    @Test
    void updatingOrDeletingUnknownItemIsNotFound() throws Exception {
        when(menuService.update(eq(77L), any())).thenThrow(new ResourceNotFoundException("Menu item", 77L));
        doThrow(new ResourceNotFoundException("Menu item", 78L)).when(menuService).delete(78L);

        mockMvc.perform(put("/api/menu/77").header("Authorization", bearer(1L, "ADMIN"))
                        .contentType(MediaType.APPLICATION_JSON).content(NEW_ITEM))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("Menu item not found: 77"));

        mockMvc.perform(delete("/api/menu/78").header("Authorization", bearer(1L, "ADMIN")))
                .andExpect(status().isNotFound());
    }

    private String bearer(Long userId, String role) {
        return "Bearer " + jwtService.generateToken(userId, "user" + userId, role);
    }
}
