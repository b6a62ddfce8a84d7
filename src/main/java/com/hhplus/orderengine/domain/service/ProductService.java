package com.hhplus.orderengine.domain.service;

import com.hhplus.orderengine.application.command.CreateProductCommand;
import com.hhplus.orderengine.application.command.UpdateProductCommand;
import com.hhplus.orderengine.domain.dto.ProductSearchCondition;
import com.hhplus.orderengine.domain.dto.StockResult;
import com.hhplus.orderengine.domain.entity.Product;
import com.hhplus.orderengine.domain.event.StockAdjustedEvent;
import com.hhplus.orderengine.domain.exception.BusinessException;
import com.hhplus.orderengine.domain.exception.ErrorCode;
import com.hhplus.orderengine.domain.repository.OrderItemRepository;
import com.hhplus.orderengine.domain.repository.ProductRepository;
import com.hhplus.orderengine.domain.vo.Money;
import com.hhplus.orderengine.domain.vo.Stock;
import com.hhplus.orderengine.infrastructure.lock.StockLockManager;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.List;

/**
 * 상품 카탈로그 서비스
 *
 * 상품 등록/조회/수정/삭제와 관리자 재고 조정을 담당합니다.
 * 재고를 바꾸는 연산은 상품 락 → 트랜잭션 → StockAdjuster 순서로 실행됩니다.
 */
@Slf4j
@Service
public class ProductService {

    private final ProductRepository productRepository;
    private final OrderItemRepository orderItemRepository;
    private final StockAdjuster stockAdjuster;
    private final StockLockManager stockLockManager;
    private final TransactionTemplate transactionTemplate;
    private final ApplicationEventPublisher eventPublisher;

    public ProductService(ProductRepository productRepository,
                          OrderItemRepository orderItemRepository,
                          StockAdjuster stockAdjuster,
                          StockLockManager stockLockManager,
                          TransactionTemplate transactionTemplate,
                          ApplicationEventPublisher eventPublisher) {
        this.productRepository = productRepository;
        this.orderItemRepository = orderItemRepository;
        this.stockAdjuster = stockAdjuster;
        this.stockLockManager = stockLockManager;
        this.transactionTemplate = transactionTemplate;
        this.eventPublisher = eventPublisher;
    }

    /**
     * 상품 등록
     *
     * @throws BusinessException 이름/가격 누락(MISSING_FIELDS), 음수 가격/재고(INVALID_ARGUMENT)
     */
    @Transactional
    public Product createProduct(CreateProductCommand command) {
        if (command.name() == null || command.name().isBlank() || command.price() == null) {
            throw new BusinessException(ErrorCode.MISSING_FIELDS, "name, price");
        }

        Product product = new Product(
                command.name(),
                command.description(),
                Money.of(command.price()),
                command.stock() != null ? Stock.of(command.stock()) : Stock.empty(),
                command.category(),
                command.imageUrl()
        );
        Product saved = productRepository.save(product);
        log.info("상품 등록: productId={}, name={}, stock={}", saved.getId(), saved.getName(), saved.getStockQuantity());
        return saved;
    }

    /**
     * 상품 조회
     *
     * @throws BusinessException 상품이 없는 경우 (PRODUCT_NOT_FOUND)
     */
    @Transactional(readOnly = true)
    public Product getProduct(String productId) {
        return productRepository.findByIdOrThrow(productId);
    }

    @Transactional(readOnly = true)
    public List<Product> getProducts(ProductSearchCondition condition) {
        return productRepository.findByCondition(condition);
    }

    /**
     * 상품 부분 수정
     *
     * 재고 값이 주어지면 현재 재고와의 차이를 StockAdjuster 로 반영합니다.
     *
     * @throws BusinessException 상품 없음(PRODUCT_NOT_FOUND), 음수 가격(INVALID_ARGUMENT), 음수 재고(INSUFFICIENT_STOCK)
     */
    public Product updateProduct(String productId, UpdateProductCommand command) {
        Money price = command.price() != null ? Money.of(command.price()) : null;

        return stockLockManager.executeWithLocks(List.of(productId), () ->
                transactionTemplate.execute(status -> {
                    Product product = productRepository.findByIdWithLockOrThrow(productId);
                    if (command.stock() != null && command.stock() < 0) {
                        throw new BusinessException(ErrorCode.INSUFFICIENT_STOCK, product.getName());
                    }
                    product.update(command.name(), command.description(), price, command.category(), command.imageUrl());

                    if (command.stock() != null) {
                        // 두 값 모두 0 이상이므로 뺄셈이 넘치지 않음
                        int delta = command.stock() - product.getStockQuantity();
                        if (delta != 0) {
                            stockAdjuster.adjust(productId, delta);
                        }
                    }
                    log.info("상품 수정: productId={}", productId);
                    return product;
                })
        );
    }

    /**
     * 상품 삭제
     *
     * 커밋된 주문 라인이 참조 중인 상품은 삭제할 수 없습니다.
     *
     * @throws BusinessException 상품 없음(PRODUCT_NOT_FOUND), 참조 중(PRODUCT_IN_USE)
     */
    public void deleteProduct(String productId) {
        stockLockManager.executeWithLocks(List.of(productId), () ->
                transactionTemplate.execute(status -> {
                    Product product = productRepository.findByIdWithLockOrThrow(productId);
                    if (orderItemRepository.existsByProductId(productId)) {
                        throw new BusinessException(ErrorCode.PRODUCT_IN_USE, productId);
                    }
                    productRepository.delete(product);
                    log.info("상품 삭제: productId={}", productId);
                    return null;
                })
        );
    }

    /**
     * 관리자 재고 조정
     *
     * @param productId 상품 ID
     * @param delta 증감량 (음수 가능)
     * @return 상품 ID 와 변경 후 재고
     * @throws BusinessException 상품 없음(PRODUCT_NOT_FOUND), 결과가 음수(INSUFFICIENT_STOCK)
     */
    public StockResult adjustStock(String productId, Integer delta) {
        if (delta == null) {
            throw new BusinessException(ErrorCode.MISSING_FIELDS, "quantity");
        }

        StockResult result = stockLockManager.executeWithLocks(List.of(productId), () ->
                transactionTemplate.execute(status -> {
                    int newStock = stockAdjuster.adjust(productId, delta);
                    eventPublisher.publishEvent(new StockAdjustedEvent(productId, delta, newStock));
                    return new StockResult(productId, newStock);
                })
        );
        log.info("재고 조정 완료: productId={}, delta={}, stock={}", productId, delta, result.stock());
        return result;
    }
}
