package com.hhplus.orderengine.infrastructure.persistence;

import com.hhplus.orderengine.domain.dto.ProductSearchCondition;
import com.hhplus.orderengine.domain.entity.Product;
import com.hhplus.orderengine.domain.repository.ProductRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
@RequiredArgsConstructor
public class ProductRepositoryImpl implements ProductRepository {

    private static final Sort NEWEST_FIRST = Sort.by(Sort.Direction.DESC, "createdAt");

    private final ProductJpaRepository productJpaRepository;

    @Override
    public Product save(Product product) {
        return productJpaRepository.save(product);
    }

    @Override
    public Optional<Product> findById(String id) {
        return productJpaRepository.findById(id);
    }

    @Override
    public List<Product> findByCondition(ProductSearchCondition condition) {
        return productJpaRepository.findAll(ProductSpecifications.matches(condition), NEWEST_FIRST);
    }

    @Override
    public Optional<Product> findByIdWithLock(String id) {
        return productJpaRepository.findByIdWithLock(id);
    }

    @Override
    public boolean existsById(String id) {
        return productJpaRepository.existsById(id);
    }

    @Override
    public void delete(Product product) {
        productJpaRepository.delete(product);
    }
}
