package com.moneylens.domain;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * A financial commitment awaiting settlement: a bill or a scheduled loan payment.
 * Amount is the positive amount due; the settling transaction carries it with the sign of {@link #isExpense()}.
 */
public interface Obligation {

    String getId();

    /** Short name used for description matching, e.g. "Electricity". */
    String getName();

    BigDecimal getAmount();

    LocalDate getDueDate();

    /** Account the obligation is paid from or to; may be null. */
    String getAccountRef();

    /** May be null. */
    String getCategory();

    ObligationStatus getStatus();

    void setStatus(ObligationStatus status);

    String getMatchedTransactionId();

    void setMatchedTransactionId(String transactionId);

    /** Prefix for {@link #reference()}, unique per obligation type. */
    String referenceType();

    /** Stable cross-type reference stored on the settling transaction, e.g. "BILL:64f0...". */
    default String reference() {
        return referenceType() + ":" + getId();
    }

    /** Bills and loan payments are settled by outgoing money. */
    default boolean isExpense() {
        return true;
    }

    default boolean isOpenForMatching() {
        return getStatus() != null && getStatus().isOpen() && getMatchedTransactionId() == null;
    }
}
