package com.example.clipscore_backend.controller;

import com.example.clipscore_backend.dto.CategoryResponse;
import com.example.clipscore_backend.scoring.profile.CategoryProfileRegistry;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/v1/categories")
public class CategoryController {

    private final CategoryProfileRegistry registry;

    public CategoryController(CategoryProfileRegistry registry) {
        this.registry = registry;
    }

    @GetMapping
    public List<CategoryResponse> list() {
        return registry.profiles().stream().map(CategoryResponse::of).toList();
    }
}
