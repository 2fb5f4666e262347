package com.demo.multisig.service.notification;

import java.time.Instant;
import java.util.List;

/** Structured body of a {@link NotificationMessage}; one shape per notification type. */
public interface NotificationPayload {

    NotificationType type();

    String proposalId();

    record NewProposal(
            String proposalId,
            String createdBy,
            String to,
            String value,
            int requiredSignatures,
            List<String> validatorIds,
            Instant expiresAt,
            String title
    ) implements NotificationPayload {
        @Override
        public NotificationType type() {
            return NotificationType.NEW_PROPOSAL;
        }
    }

    record SignatureAdded(
            String proposalId,
            String validatorId,
            int collectedSignatures,
            int requiredSignatures,
            int remainingSignatures
    ) implements NotificationPayload {
        @Override
        public NotificationType type() {
            return NotificationType.SIGNATURE_ADDED;
        }
    }

    record ProposalExecuted(String proposalId, String transactionHash, Instant executedAt) implements NotificationPayload {
        @Override
        public NotificationType type() {
            return NotificationType.PROPOSAL_EXECUTED;
        }
    }

    record ProposalCancelled(String proposalId, String cancelledBy, Instant cancelledAt) implements NotificationPayload {
        @Override
        public NotificationType type() {
            return NotificationType.PROPOSAL_CANCELLED;
        }
    }

    record ProposalExpired(
            String proposalId,
            Instant expiredAt,
            int collectedSignatures,
            int requiredSignatures
    ) implements NotificationPayload {
        @Override
        public NotificationType type() {
            return NotificationType.PROPOSAL_EXPIRED;
        }
    }
}
