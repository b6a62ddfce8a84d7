package com.hhplus.orderengine.domain.repository;

import com.hhplus.orderengine.domain.dto.ProductSearchCondition;
import com.hhplus.orderengine.domain.entity.Product;
import com.hhplus.orderengine.domain.exception.BusinessException;
import com.hhplus.orderengine.domain.exception.ErrorCode;

import java.util.List;
import java.util.Optional;

public interface ProductRepository {
    Product save(Product product);

    Optional<Product> findById(String id);

    /**
     * 카테고리/가격 범위/검색어 조건 조회 (최신순)
     */
    List<Product> findByCondition(ProductSearchCondition condition);

    /**
     * 비관적 락(SELECT ... FOR UPDATE)을 사용한 조회
     * 트랜잭션 안에서만 호출해야 합니다.
     */
    Optional<Product> findByIdWithLock(String id);

    boolean existsById(String id);

    void delete(Product product);

    default Product findByIdOrThrow(String id) {
        return findById(id)
                .orElseThrow(() -> new BusinessException(ErrorCode.PRODUCT_NOT_FOUND, id));
    }

    default Product findByIdWithLockOrThrow(String id) {
        return findByIdWithLock(id)
                .orElseThrow(() -> new BusinessException(ErrorCode.PRODUCT_NOT_FOUND, id));
    }
}
