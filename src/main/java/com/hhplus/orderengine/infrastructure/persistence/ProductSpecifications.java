package com.hhplus.orderengine.infrastructure.persistence;

import com.hhplus.orderengine.domain.dto.ProductSearchCondition;
import com.hhplus.orderengine.domain.entity.Product;
import com.hhplus.orderengine.domain.vo.Money;
import org.springframework.data.jpa.domain.Specification;

/**
 * 상품 목록 조회 조건 → JPA Specification 변환
 */
final class ProductSpecifications {

    private ProductSpecifications() {
    }

    static Specification<Product> matches(ProductSearchCondition condition) {
        return Specification.where(categoryEquals(condition.category()))
                .and(priceAtLeast(condition))
                .and(priceAtMost(condition))
                .and(nameOrDescriptionContains(condition.search()));
    }

    private static Specification<Product> categoryEquals(String category) {
        if (category == null || category.isBlank()) {
            return null;
        }
        return (root, query, cb) -> cb.equal(root.get("category"), category);
    }

    private static Specification<Product> priceAtLeast(ProductSearchCondition condition) {
        if (condition.minPrice() == null) {
            return null;
        }
        Money min = Money.of(condition.minPrice());
        return (root, query, cb) -> cb.greaterThanOrEqualTo(root.<Money>get("price"), min);
    }

    private static Specification<Product> priceAtMost(ProductSearchCondition condition) {
        if (condition.maxPrice() == null) {
            return null;
        }
        Money max = Money.of(condition.maxPrice());
        return (root, query, cb) -> cb.lessThanOrEqualTo(root.<Money>get("price"), max);
    }

    private static Specification<Product> nameOrDescriptionContains(String search) {
        if (search == null || search.isBlank()) {
            return null;
        }
        String pattern = "%" + search.toLowerCase() + "%";
        return (root, query, cb) -> cb.or(
                cb.like(cb.lower(root.get("name")), pattern),
                cb.like(cb.lower(root.get("description")), pattern)
        );
    }
}
