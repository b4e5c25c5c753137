package com.prism.controller.rest;

import com.prism.service.core.catalog.SemanticCatalog;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** Lists the dimensions, metrics and segment fields a query may use. */
@RestController
@RequestMapping("/api/catalog")
public class CatalogController {

    @GetMapping
    public SemanticCatalog.Description describe() {
        return SemanticCatalog.describe();
    }
}
