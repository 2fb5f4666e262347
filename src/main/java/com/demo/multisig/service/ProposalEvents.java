package com.demo.multisig.service;

import com.demo.multisig.model.Proposal;
import com.demo.multisig.service.notification.NotificationMessage;
import com.demo.multisig.service.notification.NotificationPayload;
import com.demo.multisig.service.notification.NotificationService;
import com.demo.multisig.service.notification.NotificationType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Builds and publishes the notification for each proposal transition. Callers
 * invoke these after leaving the proposal's critical section.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ProposalEvents {

    private final ValidatorRegistry registry;
    private final NotificationService notifications;
    private final Clock clock;

    public void created(Proposal p) {
        String title = p.getMetadata() != null && p.getMetadata().title() != null
                ? p.getMetadata().title()
                : "Transfer " + CanonicalPayload.plain(p.getValue()) + " ETH";
        publish(p, NotificationType.NEW_PROPOSAL, "new_proposal_" + p.getId(),
                "New Multi-Sig Proposal",
                title + " requires " + p.getRequiredSignatures() + " signature(s).",
                new NotificationPayload.NewProposal(p.getId(), p.getCreatedBy(), p.getTo(),
                        CanonicalPayload.plain(p.getValue()), p.getRequiredSignatures(),
                        p.getValidatorIds(), p.getExpiresAt(), title));
    }

    public void signatureAdded(Proposal p, String validatorId) {
        publish(p, NotificationType.SIGNATURE_ADDED, "signature_added_" + p.getId() + "_" + validatorId,
                "Proposal Signed",
                "Proposal signed. " + p.getRemainingSignatures() + " more signature(s) needed.",
                new NotificationPayload.SignatureAdded(p.getId(), validatorId,
                        p.getCollectedSignatures(), p.getRequiredSignatures(), p.getRemainingSignatures()));
    }

    public void executed(Proposal p) {
        publish(p, NotificationType.PROPOSAL_EXECUTED, "proposal_executed_" + p.getId(),
                "Proposal Executed",
                "Transaction submitted: " + p.getTransactionHash(),
                new NotificationPayload.ProposalExecuted(p.getId(), p.getTransactionHash(), p.getExecutedAt()));
    }

    public void cancelled(Proposal p, String cancelledBy) {
        publish(p, NotificationType.PROPOSAL_CANCELLED, "proposal_cancelled_" + p.getId(),
                "Proposal Cancelled",
                "The proposal was cancelled by its creator.",
                new NotificationPayload.ProposalCancelled(p.getId(), cancelledBy, clock.instant()));
    }

    public void expired(Proposal p) {
        publish(p, NotificationType.PROPOSAL_EXPIRED, "proposal_expired_" + p.getId(),
                "Proposal Expired",
                "The proposal expired with " + p.getCollectedSignatures() + " of "
                        + p.getRequiredSignatures() + " signature(s).",
                new NotificationPayload.ProposalExpired(p.getId(), p.getExpiresAt(),
                        p.getCollectedSignatures(), p.getRequiredSignatures()));
    }

    /** Owners of the eligible validators plus the creator. */
    public Set<String> recipients(Proposal p) {
        Set<String> out = new LinkedHashSet<>(registry.ownersOf(p.getValidatorIds()));
        if (p.getCreatedBy() != null) out.add(p.getCreatedBy());
        return out;
    }

    private void publish(Proposal p, NotificationType type, String id, String title, String message,
                         NotificationPayload data) {
        Instant now = clock.instant();
        try {
            notifications.publish(new NotificationMessage(id, type, title, message, data, now, recipients(p)));
        } catch (RuntimeException e) {
            // a state change is already persisted; losing its event is repaired by resync
            log.warn("Failed to publish {} for proposal {}: {}", type.wire(), p.getId(), e.toString());
        }
    }
}
