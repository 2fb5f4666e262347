package com.demo.multisig.service;

import com.demo.multisig.model.Proposal;
import com.demo.multisig.service.notification.HistoryEntry;

import java.time.Instant;
import java.util.List;

/** Full current state for a (re)connecting device; never a delta. */
public record ResyncSnapshot(List<Proposal> pendingProposals, List<HistoryEntry> recentNotifications, Instant timestamp) {
}
