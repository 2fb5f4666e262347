package com.demo.multisig.service;

import com.demo.multisig.model.Proposal;
import com.demo.multisig.repository.ProposalQuery;
import com.demo.multisig.service.notification.HistoryEntry;
import com.demo.multisig.service.notification.NotificationService;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Pull path for devices that may have missed real-time events. Reads only, so it
 * is safe to call after any suspected gap.
 */
@Service
public class ResyncService {

    private final ProposalService proposalService;
    private final NotificationService notifications;
    private final Clock clock;
    private final int pendingLimit;
    private final int historyLimit;

    public ResyncService(ProposalService proposalService,
                         NotificationService notifications,
                         Clock clock,
                         @Value("${multisig.notifications.resync-pending-limit:50}") int pendingLimit,
                         @Value("${multisig.notifications.resync-history-limit:20}") int historyLimit) {
        this.proposalService = proposalService;
        this.notifications = notifications;
        this.clock = clock;
        this.pendingLimit = pendingLimit;
        this.historyLimit = historyLimit;
    }

    public ResyncSnapshot resync(String userId) {
        Instant now = clock.instant();
        // overdue proposals the sweeper has not reached yet are no longer signable
        List<Proposal> pending = proposalService.listForUser(userId, ProposalQuery.pending(pendingLimit)).stream()
                .filter(p -> !p.expiredAt(now))
                .toList();
        List<HistoryEntry> recent = notifications.recentNotifications(userId, historyLimit);
        return new ResyncSnapshot(pending, recent, now);
    }
}
