package com.demo.multisig.service;

import java.math.BigInteger;

public interface GasPriceOracle {

    /** Current gas price in wei; never null. */
    BigInteger currentGasPrice();
}
