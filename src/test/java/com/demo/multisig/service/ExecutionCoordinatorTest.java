package com.demo.multisig.service;

import com.demo.multisig.model.Proposal;
import com.demo.multisig.model.ProposalMetadata;
import com.demo.multisig.model.ProposalSignature;
import com.demo.multisig.model.ProposalStatus;
import com.demo.multisig.model.ValidatorKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ExecutionCoordinatorTest {

    private Engine engine;

    @BeforeEach
    void setUp() throws Exception {
        engine = new Engine();
        engine.passkey("alice", "v1");
        engine.passkey("bob", "v2");
        engine.passkey("carol", "v3");
    }

    @Test
    void concurrentFinalSignaturesExecuteExactlyOnce() throws Exception {
        when(engine.broadcaster.execute(any())).thenAnswer(inv -> {
            Thread.sleep(50);
            return "0xonce";
        });
        Proposal p = engine.propose("alice", 2, "v1", "v2", "v3");
        engine.sign(p.getId(), "v1", "alice");

        CountDownLatch start = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            List<Future<Boolean>> results = new ArrayList<>();
            for (String[] signer : new String[][]{{"v2", "bob"}, {"v3", "carol"}}) {
                Callable<Boolean> task = () -> {
                    start.await();
                    try {
                        return engine.sign(p.getId(), signer[0], signer[1]).executed();
                    } catch (MultiSigException e) {
                        // the loser may arrive after execution already resolved the proposal
                        assertThat(e.getCode()).isEqualTo(ErrorCode.NOT_PENDING);
                        return false;
                    }
                };
                results.add(pool.submit(task));
            }
            start.countDown();

            int executed = 0;
            for (Future<Boolean> f : results) {
                if (f.get(5, TimeUnit.SECONDS)) executed++;
            }
            assertThat(executed).isEqualTo(1);
        } finally {
            pool.shutdownNow();
        }

        verify(engine.broadcaster, times(1)).execute(any());
        Proposal after = engine.proposals.get(p.getId());
        assertThat(after.getStatus()).isEqualTo(ProposalStatus.EXECUTED);
        assertThat(after.getSignatures()).hasSize(after.getCollectedSignatures());
    }

    @Test
    void concurrentTryExecuteBroadcastsOnce() throws Exception {
        Proposal p = atQuorum(engine.propose("alice", 2, "v1", "v2"), "v1", "v2");

        CountDownLatch start = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Future<ExecutionResult>> results = new ArrayList<>();
            for (int i = 0; i < 8; i++) {
                results.add(pool.submit(() -> {
                    start.await();
                    return engine.coordinator.tryExecute(p.getId());
                }));
            }
            start.countDown();

            long executed = 0;
            for (Future<ExecutionResult> f : results) {
                ExecutionResult r = f.get(5, TimeUnit.SECONDS);
                if (r.executed()) executed++;
                else assertThat(r.errorCode()).isNull();
            }
            assertThat(executed).isEqualTo(1);
        } finally {
            pool.shutdownNow();
        }
        verify(engine.broadcaster, times(1)).execute(any());
    }

    @Test
    void belowQuorumDoesNothing() throws Exception {
        Proposal p = engine.propose("alice", 2, "v1", "v2");

        ExecutionResult r = engine.coordinator.tryExecute(p.getId());

        assertThat(r).isEqualTo(ExecutionResult.skipped());
        verify(engine.broadcaster, never()).execute(any());
    }

    @Test
    void overdueProposalAtQuorumExpiresInsteadOfExecuting() throws Exception {
        Proposal p = atQuorum(engine.propose("alice", 1, "v1"), "v1");
        engine.clock.advance(Duration.ofDays(2));

        ExecutionResult r = engine.coordinator.tryExecute(p.getId());

        assertThat(r.executed()).isFalse();
        assertThat(r.errorCode()).isEqualTo(ErrorCode.EXPIRED);
        assertThat(engine.proposals.get(p.getId()).getStatus()).isEqualTo(ProposalStatus.EXPIRED);
        verify(engine.broadcaster, never()).execute(any());
    }

    @Test
    void broadcastCarriesAggregateAndGas() throws Exception {
        Proposal p = atQuorum(engine.propose("alice", 2, "v1", "v2", "v3"), "v3", "v1");

        engine.coordinator.tryExecute(p.getId());

        ArgumentCaptor<ExecutionBroadcaster.ExecutionRequest> captor =
                ArgumentCaptor.forClass(ExecutionBroadcaster.ExecutionRequest.class);
        verify(engine.broadcaster).execute(captor.capture());
        ExecutionBroadcaster.ExecutionRequest req = captor.getValue();

        assertThat(req.to()).isEqualTo(Engine.TO);
        assertThat(req.valueWei()).isEqualTo(new BigInteger("1000000000000000000"));
        assertThat(req.data()).isEqualTo("0x");
        assertThat(req.gasLimit()).isEqualTo(BigInteger.valueOf(175_000));
        assertThat(req.gasPrice()).isEqualTo(Engine.GAS_PRICE);

        AggregatedSignature aggregate = req.aggregatedSignature();
        assertThat(aggregate.totalWeight()).isEqualTo(2);
        assertThat(aggregate.entries()).extracting(AggregatedSignature.Entry::signerAddress).isSorted();
        assertThat(aggregate.entries()).extracting(AggregatedSignature.Entry::validatorId)
                .containsExactlyInAnyOrder("v1", "v3");
        assertThat(aggregate.encoded()).startsWith("0x");
    }

    @Test
    void unresolvableSignerIsInsufficientWeight() throws Exception {
        Proposal p = engine.propose("alice", 1, "v1");
        engine.proposalRepository.replace(p.toBuilder()
                .validatorIds(List.of("v1", "ghost"))
                .build()
                .withSignature(signature("ghost")));

        MultiSigException e = catchThrowableOfType(() -> engine.coordinator.tryExecute(p.getId()), MultiSigException.class);

        assertThat(e.getCode()).isEqualTo(ErrorCode.INSUFFICIENT_WEIGHT);
        assertThat(engine.proposals.get(p.getId()).getStatus()).isEqualTo(ProposalStatus.PENDING);
        verify(engine.broadcaster, never()).execute(any());
    }

    @Test
    void executedProposalIsNotExecutedAgain() throws Exception {
        Proposal p = atQuorum(engine.propose("alice", 1, "v1"), "v1");

        assertThat(engine.coordinator.tryExecute(p.getId()).executed()).isTrue();
        assertThat(engine.coordinator.tryExecute(p.getId()).executed()).isFalse();
        verify(engine.broadcaster, times(1)).execute(any());
        assertThat(engine.history.recent("alice", 1).get(0).notification().id())
                .isEqualTo("proposal_executed_" + p.getId());
    }

    @Test
    void storeHiccupAfterBroadcastStillRecordsExecution() throws Exception {
        Proposal p = atQuorum(engine.propose("alice", 1, "v1"), "v1");
        engine.proposalRepository.failResolutions(ProposalStatus.EXECUTED, 1);

        ExecutionResult r = engine.coordinator.tryExecute(p.getId());

        assertThat(r.executed()).isTrue();
        Proposal stored = engine.proposals.get(p.getId());
        assertThat(stored.getStatus()).isEqualTo(ProposalStatus.EXECUTED);
        assertThat(stored.getTransactionHash()).isEqualTo("0xfeed");
        verify(engine.broadcaster, times(1)).execute(any());
    }

    @Test
    void unstoredExecutionIsNeverBroadcastTwice() throws Exception {
        Proposal p = atQuorum(engine.propose("alice", 1, "v1"), "v1");
        engine.proposalRepository.failResolutions(ProposalStatus.EXECUTED, 3);

        ExecutionResult first = engine.coordinator.tryExecute(p.getId());

        assertThat(first.executed()).isTrue();
        assertThat(first.transactionHash()).isEqualTo("0xfeed");
        assertThat(engine.proposals.get(p.getId()).getStatus()).isEqualTo(ProposalStatus.PENDING);

        ExecutionResult second = engine.coordinator.tryExecute(p.getId());

        assertThat(second.executed()).isTrue();
        assertThat(second.transactionHash()).isEqualTo("0xfeed");
        assertThat(engine.proposals.get(p.getId()).getStatus()).isEqualTo(ProposalStatus.EXECUTED);
        verify(engine.broadcaster, times(1)).execute(any());
    }

    @Test
    void gasEstimateCountsSignersAndCalldata() {
        Proposal p = engine.proposals.create("alice", new ProposalDraft(Engine.TO, BigDecimal.ZERO, "0x0001ff", 2,
                List.of("v1", "v2", "v3"), null, ProposalMetadata.empty()));

        GasEstimate estimate = engine.coordinator.estimateGas(p.getId());

        long expected = 100_000 + 2 * 25_000 + 25_000 + 4 + 16 + 16;
        assertThat(estimate.gasLimit()).isEqualTo(BigInteger.valueOf(expected));
        assertThat(estimate.gasPrice()).isEqualTo(Engine.GAS_PRICE);
        assertThat(estimate.totalCost()).isEqualTo(BigInteger.valueOf(expected).multiply(Engine.GAS_PRICE));
        assertThat(ExecutionCoordinator.calldataGas(null)).isZero();
    }

    @Test
    void preflightReportsWhatIsMissing() {
        Proposal p = engine.propose("alice", 2, "v1", "v2");
        engine.sign(p.getId(), "v1", "alice");

        Preflight none = engine.coordinator.canExecute(p.getId(), List.of());
        assertThat(none.canExecute()).isFalse();
        assertThat(none.validSignatures()).isEqualTo(1);
        assertThat(none.reason()).isEqualTo("Need 1 more signature(s)");

        Preflight withV2 = engine.coordinator.canExecute(p.getId(), List.of(signature("v2")));
        assertThat(withV2.canExecute()).isTrue();
        assertThat(withV2.validSignatures()).isEqualTo(2);

        Preflight outsider = engine.coordinator.canExecute(p.getId(), List.of(signature("v3")));
        assertThat(outsider.canExecute()).isFalse();
        assertThat(outsider.reason()).contains("not eligible");

        Preflight duplicate = engine.coordinator.canExecute(p.getId(), List.of(signature("v1")));
        assertThat(duplicate.canExecute()).isFalse();
        assertThat(duplicate.reason()).contains("already signed");

        // read-only
        assertThat(engine.proposals.get(p.getId()).getCollectedSignatures()).isEqualTo(1);
    }

    @Test
    void preflightRejectsStaleCandidates() {
        Proposal p = engine.propose("alice", 1, "v1");
        ProposalSignature stale = new ProposalSignature("v1", "c2lnbmF0dXJl", ValidatorKind.PASSKEY,
                engine.clock.instant().minus(Duration.ofDays(3)), "alice", null);

        Preflight result = engine.coordinator.canExecute(p.getId(), List.of(stale));

        assertThat(result.canExecute()).isFalse();
        assertThat(result.reason()).startsWith("Stale signature");
    }

    private Proposal atQuorum(Proposal p, String... signers) {
        Proposal signed = p;
        for (String id : signers) {
            signed = signed.withSignature(signature(id));
        }
        engine.proposalRepository.replace(signed);
        return signed;
    }

    private ProposalSignature signature(String validatorId) {
        return new ProposalSignature(validatorId, "c2lnbmF0dXJl", ValidatorKind.PASSKEY,
                engine.clock.instant(), null, null);
    }
}
