package com.demo.multisig.service.chain;

import com.demo.multisig.service.GasPriceOracle;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.web3j.protocol.Web3j;

import java.math.BigInteger;

@Slf4j
@Component
public class Web3jGasPriceOracle implements GasPriceOracle {

    private final Web3j web3j;
    private final BigInteger fallbackPrice;

    public Web3jGasPriceOracle(Web3j web3j,
                               @Value("${multisig.gas.fallback-price-wei:20000000000}") BigInteger fallbackPrice) {
        this.web3j = web3j;
        this.fallbackPrice = fallbackPrice;
    }

    @Override
    public BigInteger currentGasPrice() {
        try {
            BigInteger price = web3j.ethGasPrice().send().getGasPrice();
            return price == null || price.signum() <= 0 ? fallbackPrice : price;
        } catch (Exception ex) {
            log.warn("Gas price query failed, using fallback {} wei: {}", fallbackPrice, ex.toString());
            return fallbackPrice;
        }
    }
}
