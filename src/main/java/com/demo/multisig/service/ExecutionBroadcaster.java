package com.demo.multisig.service;

import java.math.BigInteger;

/**
 * Submits an approved call to the chain. Implementations may block on a network
 * round trip; a failure is final for the proposal and never retried here.
 */
public interface ExecutionBroadcaster {

    /**
     * @return the transaction hash
     */
    String execute(ExecutionRequest request) throws BroadcastException;

    record ExecutionRequest(
            String to,
            BigInteger valueWei,
            String data,
            AggregatedSignature aggregatedSignature,
            BigInteger gasLimit,
            BigInteger gasPrice
    ) {}
}
