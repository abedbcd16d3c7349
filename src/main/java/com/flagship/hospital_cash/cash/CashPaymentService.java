package com.flagship.hospital_cash.cash;

import com.flagship.hospital_cash.auth.SessionProject;
import com.flagship.hospital_cash.auth.SessionUser;
import com.flagship.hospital_cash.cash.dto.CashPaymentRequest;
import com.flagship.hospital_cash.db.BinaryUuid;
import com.flagship.hospital_cash.db.DatabaseConnector;
import com.flagship.hospital_cash.db.Transaction;
import com.flagship.hospital_cash.exception.BadRequestException;
import com.flagship.hospital_cash.exception.NotFoundException;
import com.flagship.hospital_cash.observability.CashMetrics;
import com.flagship.hospital_cash.observability.CorrelationContext;
import com.flagship.hospital_cash.topic.Topic;
import com.flagship.hospital_cash.topic.TopicEvent;
import com.flagship.hospital_cash.topic.TopicPublisher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.UUID;

/**
 * Creates cash payments through the database's posting procedures.
 *
 * Posting runs as a flat sequence of procedure calls in one transaction:
 * StageCash, StageCashItem per item, CalculateCashInvoiceBalances, WriteCash,
 * WriteCashItems, PostCash. The item and balance steps are skipped for caution
 * payments. The balance and posting rules live in those procedures.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CashPaymentService {

    static final String MISSING_ITEMS_MESSAGE =
        "You must submit cash items with the payments against previous invoices.";

    static final String CAUTION_WITH_ITEMS_MESSAGE =
        "You submitted payment against items marked as a caution payment. " +
        "Submit either a caution with no items or a payment with is_caution = 0.";

    private final DatabaseConnector database;
    private final CashRepository cashRepository;
    private final TopicPublisher topicPublisher;
    private final CashMetrics cashMetrics;

    /**
     * Validates, stages and posts a cash payment, then announces it on the finance channel.
     *
     * @param request payment as submitted
     * @param user session user; recorded as the payment's author
     * @param project session project; the payment is written against it
     * @return the payment's uuid (client-supplied or generated)
     * @throws BadRequestException if an invoice payment has no items or a caution payment has items
     * @throws org.springframework.dao.DataAccessException if any posting step fails; nothing is written
     */
    public UUID createPayment(CashPaymentRequest request, SessionUser user, SessionProject project) {
        validate(request);

        UUID cashUuid = request.getUuid() != null ? request.getUuid() : UUID.randomUUID();
        MDC.put(CorrelationContext.CASH_UUID_MDC_KEY, cashUuid.toString());

        CashPayment payment = CashPayment.builder()
            .uuid(cashUuid)
            .amount(request.getAmount())
            .currencyId(request.getCurrencyId())
            .cashboxId(request.getCashboxId())
            .debtorUuid(request.getDebtorUuid())
            .projectId(project.getId())
            .date(request.getDate())
            .userId(user.getId())
            .caution(request.isCautionPayment())
            .description(request.getDescription())
            .items(CashRecordFormatter.prepareItems(cashUuid, request.getItems()))
            .build();

        post(payment);

        log.info("Cash payment posted: uuid={}, amount={}, items={}, caution={}",
            cashUuid, payment.getAmount(), payment.getItems().size(), payment.isCaution());

        topicPublisher.publish(Topic.Channel.FINANCE, TopicEvent.builder()
            .event(Topic.Event.CREATE)
            .entity(Topic.Entity.PAYMENT)
            .userId(user.getId())
            .user(user.getDisplayName())
            .uuid(cashUuid)
            .occurredAt(Instant.now())
            .build());

        return cashUuid;
    }

    /**
     * @throws NotFoundException if no payment has this uuid
     */
    public CashRecord getPayment(UUID uuid) {
        return cashRepository.findByUuid(uuid)
            .orElseThrow(() -> new NotFoundException("Could not find a cash payment with uuid " + uuid));
    }

    private void validate(CashPaymentRequest request) {
        boolean invoicePayment = !request.isCautionPayment();
        boolean hasItems = request.hasItems();

        if (invoicePayment && !hasItems) {
            cashMetrics.recordPaymentRejected("missing_items");
            throw new BadRequestException(MISSING_ITEMS_MESSAGE);
        }

        if (!invoicePayment && hasItems) {
            cashMetrics.recordPaymentRejected("caution_with_items");
            throw new BadRequestException(CAUTION_WITH_ITEMS_MESSAGE);
        }
    }

    private void post(CashPayment payment) {
        byte[] cashUuid = BinaryUuid.toBytes(payment.getUuid());
        Transaction transaction = database.transaction();

        transaction.addProcedure("StageCash", CashRecordFormatter.formatPayment(payment));

        if (payment.isInvoicePayment()) {
            payment.getItems().forEach(item ->
                transaction.addProcedure("StageCashItem", CashRecordFormatter.formatItem(item)));
            transaction.addProcedure("CalculateCashInvoiceBalances", (Object) cashUuid);
        }

        transaction.addProcedure("WriteCash", (Object) cashUuid);

        if (payment.isInvoicePayment()) {
            transaction.addProcedure("WriteCashItems", (Object) cashUuid);
        }

        transaction.addProcedure("PostCash", (Object) cashUuid);

        transaction.execute();
    }
}
