package com.afs.maturity.api;

import com.afs.maturity.catalog.CatalogImportModels;
import com.afs.maturity.catalog.CatalogService;
import com.afs.maturity.error.ValidationException;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/catalog")
public class CatalogController {
    private final CatalogService catalogService;

    public CatalogController(CatalogService catalogService) {
        this.catalogService = catalogService;
    }

    @PostMapping
    public ResponseEntity<CatalogImportModels.ImportResult> importCatalog(@RequestBody CatalogImportModels.CatalogDocument document) {
        CatalogImportModels.ImportResult result = catalogService.importCatalog(document);
        if (!result.valid()) throw new ValidationException(result.issues());
        return ResponseEntity.ok(result);
    }

    @GetMapping
    public ResponseEntity<CatalogImportModels.CatalogView> catalog() {
        return ResponseEntity.ok(catalogService.view());
    }
}
