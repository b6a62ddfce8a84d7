package com.hhplus.orderengine.infrastructure.event;

import com.hhplus.orderengine.domain.event.OrderCancelledEvent;
import com.hhplus.orderengine.domain.event.OrderCreatedEvent;
import com.hhplus.orderengine.domain.event.OrderStatusChangedEvent;
import com.hhplus.orderengine.domain.event.StockAdjustedEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * 주문/재고 이벤트 로그 핸들러
 *
 * 커밋된 변경만 기록합니다. 롤백된 주문/취소는 이벤트가 전달되지 않습니다.
 */
@Slf4j
@Component
public class OrderEventLogHandler {

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void handleOrderCreated(OrderCreatedEvent event) {
        log.info("[주문] 커밋: orderId={}, userId={}, total={}, items={}",
                event.orderId(), event.userId(), event.total(), event.items());
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void handleOrderStatusChanged(OrderStatusChangedEvent event) {
        log.info("[주문] 상태 변경 커밋: orderId={}, {} -> {}",
                event.orderId(), event.previousStatus().getValue(), event.newStatus().getValue());
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void handleOrderCancelled(OrderCancelledEvent event) {
        log.info("[주문] 취소 커밋: orderId={}, userId={}, statusAtCancel={}, restored={}",
                event.orderId(), event.userId(), event.statusAtCancel().getValue(), event.restoredStock());
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void handleStockAdjusted(StockAdjustedEvent event) {
        log.info("[재고] 조정 커밋: productId={}, delta={}, stock={}",
                event.productId(), event.delta(), event.stock());
    }
}
