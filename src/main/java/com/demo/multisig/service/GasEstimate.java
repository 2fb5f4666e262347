package com.demo.multisig.service;

import java.math.BigInteger;

/** All amounts in wei except {@code gasLimit}, which is in gas units. */
public record GasEstimate(BigInteger gasLimit, BigInteger gasPrice, BigInteger totalCost) {
}
