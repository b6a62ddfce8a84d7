package com.hhplus.orderengine.presentation.controller;

import com.hhplus.orderengine.domain.dto.StockResult;
import com.hhplus.orderengine.domain.exception.BusinessException;
import com.hhplus.orderengine.domain.exception.ErrorCode;
import com.hhplus.orderengine.domain.service.ProductService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.willThrow;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(ProductController.class)
class ProductControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ProductService productService;

    @Test
    @DisplayName("재고 조정 결과로 상품 ID 와 새 재고를 반환한다")
    void adjustStock() throws Exception {
        given(productService.adjustStock("p-1", -3)).willReturn(new StockResult("p-1", 7));

        mockMvc.perform(patch("/api/products/p-1/stock")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"quantity\":-3}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value("p-1"))
                .andExpect(jsonPath("$.stock").value(7));
    }

    @Test
    @DisplayName("음수 재고가 되는 조정은 409 로 응답한다")
    void adjustStock_Insufficient() throws Exception {
        given(productService.adjustStock("p-1", -30))
                .willThrow(new BusinessException(ErrorCode.INSUFFICIENT_STOCK, "Cup"));

        mockMvc.perform(patch("/api/products/p-1/stock")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"quantity\":-30}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("INSUFFICIENT_STOCK"));
    }

    @Test
    @DisplayName("주문이 참조하는 상품 삭제는 409 로 응답한다")
    void deleteProduct_InUse() throws Exception {
        willThrow(new BusinessException(ErrorCode.PRODUCT_IN_USE, "p-1")).given(productService).deleteProduct("p-1");

        mockMvc.perform(delete("/api/products/p-1"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.message").value("Product is referenced by existing orders: p-1"));
    }

    @Test
    @DisplayName("잘못된 JSON 본문은 400 으로 응답한다")
    void malformedBody() throws Exception {
        mockMvc.perform(post("/api/products")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{not-json"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_ARGUMENT"));
    }
}
