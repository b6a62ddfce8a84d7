package com.hhplus.orderengine.presentation.controller;

import com.hhplus.orderengine.domain.dto.ProductSearchCondition;
import com.hhplus.orderengine.domain.service.ProductService;
import com.hhplus.orderengine.presentation.dto.MessageResponse;
import com.hhplus.orderengine.presentation.dto.ProductRequest;
import com.hhplus.orderengine.presentation.dto.ProductResponse;
import com.hhplus.orderengine.presentation.dto.StockAdjustRequest;
import com.hhplus.orderengine.presentation.dto.StockResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.math.BigDecimal;
import java.util.List;

@RestController
@RequestMapping("/api/products")
@RequiredArgsConstructor
public class ProductController {

    private final ProductService productService;

    @GetMapping
    public ResponseEntity<List<ProductResponse>> getProducts(
            @RequestParam(required = false) String category,
            @RequestParam(required = false) BigDecimal minPrice,
            @RequestParam(required = false) BigDecimal maxPrice,
            @RequestParam(required = false) String search) {
        ProductSearchCondition condition = new ProductSearchCondition(category, minPrice, maxPrice, search);
        List<ProductResponse> response = productService.getProducts(condition).stream()
                .map(ProductResponse::from)
                .toList();
        return ResponseEntity.ok(response);
    }

    @GetMapping("/{productId}")
    public ResponseEntity<ProductResponse> getProduct(@PathVariable String productId) {
        return ResponseEntity.ok(ProductResponse.from(productService.getProduct(productId)));
    }

    @PostMapping
    public ResponseEntity<ProductResponse> createProduct(@RequestBody ProductRequest request) {
        ProductResponse response = ProductResponse.from(productService.createProduct(request.toCreateCommand()));
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @PutMapping("/{productId}")
    public ResponseEntity<ProductResponse> updateProduct(
            @PathVariable String productId,
            @RequestBody ProductRequest request) {
        return ResponseEntity.ok(ProductResponse.from(productService.updateProduct(productId, request.toUpdateCommand())));
    }

    @DeleteMapping("/{productId}")
    public ResponseEntity<MessageResponse> deleteProduct(@PathVariable String productId) {
        productService.deleteProduct(productId);
        return ResponseEntity.ok(MessageResponse.of("Product deleted successfully"));
    }

    /**
     * 관리자 재고 조정 (quantity 만큼 증감)
     */
    @PatchMapping("/{productId}/stock")
    public ResponseEntity<StockResponse> adjustStock(
            @PathVariable String productId,
            @RequestBody StockAdjustRequest request) {
        return ResponseEntity.ok(StockResponse.from(productService.adjustStock(productId, request.quantity())));
    }
}
