package com.flagship.hospital_cash.topic;

import com.flagship.hospital_cash.observability.CashMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

/**
 * Reporting reaction to finance events: one audit log line and one counter per event.
 */
@Service
@ConditionalOnProperty(name = "consumer.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class FinanceEventHandler {

    private final CashMetrics cashMetrics;

    public void onEvent(TopicEvent event) {
        if (event.getEntity() == Topic.Entity.PAYMENT && event.getEvent() == Topic.Event.CREATE) {
            log.info("Cash payment created: uuid={}, userId={}, user={}",
                    event.getUuid(), event.getUserId(), event.getUser());
        } else {
            log.info("Finance event: event={}, entity={}, uuid={}, userId={}",
                    event.getEvent(), event.getEntity(), event.getUuid(), event.getUserId());
        }

        cashMetrics.recordFinanceEvent(
                event.getEvent() == null ? null : event.getEvent().name(),
                event.getEntity() == null ? null : event.getEntity().name());
    }
}
