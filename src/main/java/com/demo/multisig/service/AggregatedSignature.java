package com.demo.multisig.service;

import com.demo.multisig.model.ValidatorKind;
import org.web3j.abi.FunctionEncoder;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.DynamicArray;
import org.web3j.abi.datatypes.DynamicBytes;
import org.web3j.abi.datatypes.Type;
import org.web3j.abi.datatypes.generated.Uint16;
import org.web3j.abi.datatypes.generated.Uint8;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * All collected signatures of a proposal combined into one payload for the smart
 * account. Entries are sorted by signer address, ignoring case.
 */
public record AggregatedSignature(List<Entry> entries) {

    public AggregatedSignature {
        entries = entries.stream()
                .sorted(Comparator.comparing(e -> e.signerAddress().toLowerCase(Locale.ROOT)))
                .toList();
    }

    public int totalWeight() {
        return entries.stream().mapToInt(Entry::weight).sum();
    }

    /** ABI encoding of {@code (address[], uint16[], uint8[], bytes[])}, 0x-prefixed. */
    public String encoded() {
        List<Address> signers = entries.stream().map(e -> new Address(e.signerAddress())).toList();
        List<Uint16> weights = entries.stream().map(e -> new Uint16(BigInteger.valueOf(e.weight()))).toList();
        List<Uint8> kinds = entries.stream().map(e -> new Uint8(BigInteger.valueOf(e.kind().abiTag()))).toList();
        List<DynamicBytes> sigs = entries.stream().map(e -> new DynamicBytes(e.signature())).toList();

        List<Type> params = Arrays.<Type>asList(
                new DynamicArray<>(Address.class, signers),
                new DynamicArray<>(Uint16.class, weights),
                new DynamicArray<>(Uint8.class, kinds),
                new DynamicArray<>(DynamicBytes.class, sigs));
        return "0x" + FunctionEncoder.encodeConstructor(params);
    }

    public record Entry(String validatorId, String signerAddress, int weight, ValidatorKind kind, byte[] signature) {}
}
