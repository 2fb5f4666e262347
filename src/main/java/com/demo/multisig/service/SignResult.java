package com.demo.multisig.service;

import com.demo.multisig.model.Proposal;

/** Proposal state after an accepted signature, plus whether it triggered execution. */
public record SignResult(Proposal proposal, boolean executed, String transactionHash, ErrorCode errorCode, String error) {

    static SignResult of(Proposal proposal, ExecutionResult execution) {
        return new SignResult(proposal, execution.executed(), execution.transactionHash(),
                execution.errorCode(), execution.error());
    }
}
