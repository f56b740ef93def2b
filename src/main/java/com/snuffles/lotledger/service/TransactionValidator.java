package com.snuffles.lotledger.service;

import com.snuffles.lotledger.config.LedgerProperties;
import com.snuffles.lotledger.domain.LedgerTransaction;
import com.snuffles.lotledger.service.exception.ValidationException;
import com.snuffles.lotledger.web.dto.TransactionRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Locale;

import static com.snuffles.lotledger.service.allocation.LotAllocationEngine.MONEY_SCALE;

/**
 * Checks a submitted transaction and turns it into an unsaved {@link LedgerTransaction} with
 * normalised symbol, side, amounts and date.
 */
@Component
@RequiredArgsConstructor
public class TransactionValidator {

    private final LedgerProperties ledgerProperties;

    public LedgerTransaction validate(String accountId, TransactionRequest request) {
        LedgerProperties.Validation limits = ledgerProperties.getValidation();

        if (request == null) {
            throw new ValidationException("Transaction payload is required");
        }
        if (isBlank(accountId)) {
            throw new ValidationException("Account id is required");
        }
        String account = accountId.trim();
        if (account.length() > limits.getMaxAccountIdLength()) {
            throw new ValidationException("Account id exceeds " + limits.getMaxAccountIdLength() + " characters");
        }

        if (isBlank(request.getSymbol())) {
            throw new ValidationException("Symbol is required");
        }
        String symbol = PositionService.normalize(request.getSymbol());
        if (symbol.length() > limits.getMaxSymbolLength()) {
            throw new ValidationException("Symbol exceeds " + limits.getMaxSymbolLength() + " characters");
        }

        LedgerTransaction.TransactionType side = parseSide(request.getSide());

        BigDecimal quantity = scaled(request.getQuantity(), "Quantity", true);
        if (quantity.compareTo(limits.getMaxQuantity()) > 0) {
            throw new ValidationException("Quantity exceeds maximum of " + limits.getMaxQuantity().toPlainString());
        }

        BigDecimal price = scaled(request.getPrice(), "Price", true);
        if (price.compareTo(limits.getMaxPrice()) > 0) {
            throw new ValidationException("Price exceeds maximum of " + limits.getMaxPrice().toPlainString());
        }

        BigDecimal commission = request.getCommission() == null
            ? BigDecimal.ZERO.setScale(MONEY_SCALE)
            : scaled(request.getCommission(), "Commission", false);
        BigDecimal maxCommission = quantity.multiply(price).multiply(limits.getMaxCommissionRate());
        if (commission.compareTo(maxCommission) > 0) {
            throw new ValidationException("Commission exceeds " + limits.getMaxCommissionRate().toPlainString()
                + " of trade value");
        }

        LocalDate transactionDate = parseDate(request.getTransactionDate());

        String externalId = isBlank(request.getExternalId()) ? null : request.getExternalId().trim();
        if (externalId != null && externalId.length() > limits.getMaxExternalIdLength()) {
            throw new ValidationException("External id exceeds " + limits.getMaxExternalIdLength() + " characters");
        }
        if (request.getNotes() != null && request.getNotes().length() > limits.getMaxNotesLength()) {
            throw new ValidationException("Notes exceed " + limits.getMaxNotesLength() + " characters");
        }

        LedgerTransaction transaction = new LedgerTransaction();
        transaction.setAccountId(account);
        transaction.setExternalId(externalId);
        transaction.setSymbol(symbol);
        transaction.setTransactionType(side);
        transaction.setQuantity(quantity);
        transaction.setPrice(price);
        transaction.setCommission(commission);
        transaction.setTransactionDate(transactionDate);
        transaction.setNotes(request.getNotes());
        return transaction;
    }

    private LedgerTransaction.TransactionType parseSide(String side) {
        if (isBlank(side)) {
            throw new ValidationException("Side is required");
        }
        try {
            return LedgerTransaction.TransactionType.valueOf(side.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new ValidationException("Side must be BUY or SELL, got '" + side + "'");
        }
    }

    private LocalDate parseDate(String value) {
        if (isBlank(value)) {
            throw new ValidationException("Transaction date is required");
        }
        try {
            return LocalDate.parse(value.trim());
        } catch (DateTimeParseException ex) {
            throw new ValidationException("Transaction date '" + value + "' is not an ISO-8601 date");
        }
    }

    /**
     * Sign check on the submitted value, then the value at storage scale. Digits beyond that
     * scale are rejected rather than rounded away.
     */
    private BigDecimal scaled(BigDecimal value, String field, boolean strictlyPositive) {
        if (value == null) {
            throw new ValidationException(field + " is required");
        }
        if (strictlyPositive && value.signum() <= 0) {
            throw new ValidationException(field + " must be positive");
        }
        if (!strictlyPositive && value.signum() < 0) {
            throw new ValidationException(field + " cannot be negative");
        }
        if (value.stripTrailingZeros().scale() > MONEY_SCALE) {
            throw new ValidationException(field + " allows at most " + MONEY_SCALE + " decimal places, got " + value.toPlainString());
        }
        return value.setScale(MONEY_SCALE, RoundingMode.UNNECESSARY);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
