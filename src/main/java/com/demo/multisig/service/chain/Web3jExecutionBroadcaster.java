package com.demo.multisig.service.chain;

import com.demo.multisig.service.BroadcastException;
import com.demo.multisig.service.ExecutionBroadcaster;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.web3j.abi.FunctionEncoder;
import org.web3j.abi.TypeReference;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.DynamicBytes;
import org.web3j.abi.datatypes.Function;
import org.web3j.abi.datatypes.Type;
import org.web3j.abi.datatypes.generated.Uint256;
import org.web3j.crypto.Credentials;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.core.methods.response.EthSendTransaction;
import org.web3j.tx.RawTransactionManager;
import org.web3j.tx.TransactionManager;
import org.web3j.utils.Numeric;

import java.io.IOException;
import java.math.BigInteger;
import java.util.Arrays;
import java.util.Collections;

/**
 * Relayer-signed call to the smart account's
 * {@code executeWithSignatures(address,uint256,bytes,bytes)}.
 */
@Slf4j
@Component
public class Web3jExecutionBroadcaster implements ExecutionBroadcaster {

    private final Web3j web3j;
    private final String accountAddress;
    private final String relayerPrivateKey;
    private final long chainId;

    public Web3jExecutionBroadcaster(Web3j web3j,
                                     @Value("${web3.account-address:}") String accountAddress,
                                     @Value("${web3.relayer-private-key:}") String relayerPrivateKey,
                                     @Value("${web3.chain-id:1337}") long chainId) {
        this.web3j = web3j;
        this.accountAddress = accountAddress;
        this.relayerPrivateKey = relayerPrivateKey;
        this.chainId = chainId;
    }

    @Override
    public String execute(ExecutionRequest req) throws BroadcastException {
        if (accountAddress == null || accountAddress.isBlank()) {
            throw new BroadcastException("Smart account address is not configured");
        }
        if (relayerPrivateKey == null || relayerPrivateKey.isBlank()) {
            throw new BroadcastException("Relayer key is not configured");
        }

        Function call = new Function("executeWithSignatures",
                Arrays.<Type>asList(new Address(req.to()),
                        new Uint256(req.valueWei()),
                        new DynamicBytes(Numeric.hexStringToByteArray(req.data())),
                        new DynamicBytes(Numeric.hexStringToByteArray(req.aggregatedSignature().encoded()))),
                Collections.<TypeReference<?>>emptyList());

        TransactionManager tm = new RawTransactionManager(web3j, Credentials.create(relayerPrivateKey), chainId);
        try {
            EthSendTransaction sent = tm.sendTransaction(req.gasPrice(), req.gasLimit(), accountAddress,
                    FunctionEncoder.encode(call), BigInteger.ZERO);
            if (sent.hasError()) {
                throw new BroadcastException("Node rejected transaction: " + sent.getError().getMessage());
            }
            log.debug("Submitted {} with {} signer(s)", sent.getTransactionHash(),
                    req.aggregatedSignature().entries().size());
            return sent.getTransactionHash();
        } catch (IOException ex) {
            throw new BroadcastException("RPC call failed: " + ex.getMessage(), ex);
        }
    }
}
