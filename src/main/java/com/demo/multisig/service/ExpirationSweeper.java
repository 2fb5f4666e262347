package com.demo.multisig.service;

import com.demo.multisig.repository.ProposalRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;

/**
 * Periodically expires overdue pending proposals through the same locked path
 * as sign-time expiry. One bad record never stops the sweep.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "multisig.sweeper.enabled", havingValue = "true", matchIfMissing = true)
public class ExpirationSweeper {

    private final ProposalRepository proposalRepository;
    private final ProposalService proposalService;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${multisig.sweeper.interval-ms:60000}",
               initialDelayString = "${multisig.sweeper.interval-ms:60000}")
    public void sweep() {
        sweepOnce();
    }

    int sweepOnce() {
        List<String> due = proposalRepository.findExpiredPendingIds(clock.instant());
        int expired = 0;
        for (String id : due) {
            try {
                if (proposalService.expire(id)) expired++;
            } catch (RuntimeException e) {
                log.warn("Sweep failed for proposal {}: {}", id, e.toString());
            }
        }
        if (expired > 0) {
            log.info("Expired {} proposal(s)", expired);
        }
        return expired;
    }
}
