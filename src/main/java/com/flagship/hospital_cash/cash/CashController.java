package com.flagship.hospital_cash.cash;

import com.flagship.hospital_cash.auth.SessionAttributes;
import com.flagship.hospital_cash.auth.SessionProject;
import com.flagship.hospital_cash.auth.SessionUser;
import com.flagship.hospital_cash.cash.dto.CashCreatedResponse;
import com.flagship.hospital_cash.cash.dto.CashPaymentRequest;
import com.flagship.hospital_cash.cash.dto.CashResponse;
import com.flagship.hospital_cash.cash.dto.CreateCashRequest;
import com.flagship.hospital_cash.observability.CashMetrics;
import com.flagship.hospital_cash.observability.CorrelationContext;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.bind.annotation.SessionAttribute;

import java.util.UUID;

/**
 * Cash payments received at the hospital's cash windows.
 *
 * Project and user are read from the session, never from the body.
 */
@RestController
@RequestMapping("/api/cash")
@RequiredArgsConstructor
@Slf4j
public class CashController {

    private final CashPaymentService cashPaymentService;
    private final CashMetrics cashMetrics;

    /**
     * Creates a cash payment against previous invoices, or a caution payment.
     *
     * @return 201 with the payment uuid
     */
    @PostMapping
    public ResponseEntity<CashCreatedResponse> createCash(
            @Valid @RequestBody CreateCashRequest request,
            @SessionAttribute(SessionAttributes.USER) SessionUser user,
            @SessionAttribute(SessionAttributes.PROJECT) SessionProject project) {

        long startTime = System.currentTimeMillis();
        CashPaymentRequest payment = request.getPayment();
        String type = payment.isCautionPayment() ? CashMetrics.TYPE_CAUTION : CashMetrics.TYPE_INVOICE;

        log.info("Received cash payment: amount={}, cashboxId={}, caution={}, items={}",
                payment.getAmount(), payment.getCashboxId(), payment.isCautionPayment(),
                payment.hasItems() ? payment.getItems().size() : 0);

        try {
            UUID cashUuid = cashPaymentService.createPayment(payment, user, project);

            long duration = System.currentTimeMillis() - startTime;
            cashMetrics.recordPaymentCreated(type, "success");
            cashMetrics.recordLatency("create", duration);

            log.info("Cash payment created: duration={}ms", duration);

            return ResponseEntity.status(HttpStatus.CREATED).body(new CashCreatedResponse(cashUuid));

        } catch (RuntimeException e) {
            long duration = System.currentTimeMillis() - startTime;
            cashMetrics.recordPaymentCreated(type, "error");
            cashMetrics.recordLatency("create", duration);
            log.warn("Cash payment creation failed: error={}, duration={}ms", e.getMessage(), duration);
            throw e;
        } finally {
            MDC.remove(CorrelationContext.CASH_UUID_MDC_KEY);
        }
    }

    @GetMapping("/{uuid}")
    public ResponseEntity<CashResponse> getCash(@PathVariable("uuid") UUID uuid) {
        long startTime = System.currentTimeMillis();
        CashResponse response = CashResponse.from(cashPaymentService.getPayment(uuid));
        cashMetrics.recordLatency("read", System.currentTimeMillis() - startTime);
        return ResponseEntity.ok(response);
    }
}
