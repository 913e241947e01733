package com.amot.backend.enums;

/**
 * Settlement transitions and the party that holds the authority for each one.
 */
public enum SettlementAction {
    MARK_PAID(ParticipantRole.DEBTOR, PaymentStatus.UNPAID, PaymentStatus.PENDING_CONFIRMATION),
    CANCEL_PAYMENT(ParticipantRole.DEBTOR, PaymentStatus.PENDING_CONFIRMATION, PaymentStatus.UNPAID),
    CONFIRM(ParticipantRole.CREDITOR, PaymentStatus.PENDING_CONFIRMATION, PaymentStatus.CONFIRMED),
    UNDO_CONFIRMATION(ParticipantRole.CREDITOR, PaymentStatus.CONFIRMED, PaymentStatus.PENDING_CONFIRMATION);

    private final ParticipantRole authority;
    private final PaymentStatus source;
    private final PaymentStatus target;

    SettlementAction(ParticipantRole authority, PaymentStatus source, PaymentStatus target) {
        this.authority = authority;
        this.source = source;
        this.target = target;
    }

    public ParticipantRole getAuthority() {
        return authority;
    }

    public PaymentStatus getSource() {
        return source;
    }

    public PaymentStatus getTarget() {
        return target;
    }
}
