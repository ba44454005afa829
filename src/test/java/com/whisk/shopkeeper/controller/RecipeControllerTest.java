package com.whisk.shopkeeper.controller;

import com.whisk.shopkeeper.repository.RecipeRepository;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.security.test.context.support.WithMockUser;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.transaction.annotation.Transactional;

import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest
@AutoConfigureMockMvc
@Transactional
@WithMockUser
class RecipeControllerTest {

    private static final String CROISSANT = "{\"name\":\"Butter Croissant\",\"sellingPrice\":75,"
            + "\"ingredients\":[{\"stockItemId\":\"1\",\"quantity\":0.05},{\"stockItemId\":\"3\",\"quantity\":0.025}]}";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private RecipeRepository recipeRepository;

    private long create() throws Exception {
        String body = mockMvc.perform(post("/api/recipes")
                .contentType(MediaType.APPLICATION_JSON)
                .content(CROISSANT))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.ingredients", hasSize(2)))
                .andReturn().getResponse().getContentAsString();
        return Long.parseLong(body.replaceAll(".*\"id\":(\\d+).*", "$1"));
    }

    @Test
    void create_ShouldBeFoundBySearch() throws Exception {
        create();

        mockMvc.perform(get("/api/recipes").param("search", "croiss"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total").value(1))
                .andExpect(jsonPath("$.results[0].name").value("Butter Croissant"));
    }

    @Test
    void update_ShouldReplaceIngredients() throws Exception {
        long id = create();

        mockMvc.perform(put("/api/recipes/" + id)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"name\":\"Butter Croissant\",\"sellingPrice\":80,"
                        + "\"ingredients\":[{\"stockItemId\":\"1\",\"quantity\":0.06}]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.sellingPrice").value(80))
                .andExpect(jsonPath("$.ingredients", hasSize(1)));
    }

    @Test
    void update_ShouldReturnNotFound_ForUnknownRecipe() throws Exception {
        mockMvc.perform(put("/api/recipes/987654")
                .contentType(MediaType.APPLICATION_JSON)
                .content(CROISSANT))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.message").value("Recipe not found"));
    }

    @Test
    void create_ShouldRejectMissingName() throws Exception {
        mockMvc.perform(post("/api/recipes")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"sellingPrice\":75,\"ingredients\":[]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.details", hasKey("name")));
    }

    @Test
    void list_ShouldRejectOversizedLimit() throws Exception {
        mockMvc.perform(get("/api/recipes").param("limit", "1001"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.kind").value("INVALID_INPUT"));
    }

    @Test
    void delete_ShouldRemoveRecipe() throws Exception {
        long id = create();

        mockMvc.perform(delete("/api/recipes/" + id))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.detail").value("Recipe deleted"));
        assertFalse(recipeRepository.existsById(id));
    }
}
