package com.whisk.shopkeeper.controller;

import com.whisk.shopkeeper.dto.PageResponse;
import com.whisk.shopkeeper.exception.NotFoundException;
import com.whisk.shopkeeper.model.Recipe;
import com.whisk.shopkeeper.repository.RecipeRepository;
import com.whisk.shopkeeper.util.PageParams;
import jakarta.validation.Valid;
import org.springframework.data.domain.Sort;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.ArrayList;
import java.util.Map;

@RestController
@RequestMapping("/api/recipes")
public class RecipeController {

    private final RecipeRepository recipeRepository;

    public RecipeController(RecipeRepository recipeRepository) {
        this.recipeRepository = recipeRepository;
    }

    @GetMapping
    public PageResponse<Recipe> list(@RequestParam(defaultValue = "0") int skip,
            @RequestParam(defaultValue = "10") int limit,
            @RequestParam(defaultValue = "") String search) {
        PageParams.check(skip, limit, 1000);
        return PageResponse.from(recipeRepository.findByNameContainingIgnoreCase(search.trim(),
                PageParams.of(skip, limit, Sort.by("id"))));
    }

    @PostMapping
    public ResponseEntity<Recipe> create(@Valid @RequestBody Recipe recipe) {
        recipe.setId(null);
        return ResponseEntity.status(HttpStatus.CREATED).body(recipeRepository.save(recipe));
    }

    @PutMapping("/{recipeId}")
    public Recipe update(@PathVariable Long recipeId, @Valid @RequestBody Recipe recipe) {
        Recipe existing = recipeRepository.findById(recipeId)
                .orElseThrow(() -> new NotFoundException("Recipe not found"));
        existing.setName(recipe.getName());
        existing.setIngredients(new ArrayList<>(recipe.getIngredients()));
        existing.setSellingPrice(recipe.getSellingPrice());
        return recipeRepository.save(existing);
    }

    @DeleteMapping("/{recipeId}")
    public Map<String, String> delete(@PathVariable Long recipeId) {
        if (!recipeRepository.existsById(recipeId)) {
            throw new NotFoundException("Recipe not found");
        }
        recipeRepository.deleteById(recipeId);
        return Map.of("detail", "Recipe deleted");
    }
}
