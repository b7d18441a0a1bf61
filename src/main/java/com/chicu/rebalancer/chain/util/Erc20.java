package com.chicu.rebalancer.chain.util;

import org.web3j.abi.FunctionEncoder;
import org.web3j.abi.FunctionReturnDecoder;
import org.web3j.abi.TypeReference;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.Bool;
import org.web3j.abi.datatypes.Function;
import org.web3j.abi.datatypes.Type;
import org.web3j.abi.datatypes.generated.Uint256;

import java.math.BigInteger;
import java.util.List;

/**
 * Минимальный ABI ERC-20: balanceOf / allowance / approve.
 */
public final class Erc20 {

    private Erc20() {}

    public static Function balanceOf(String owner) {
        return new Function("balanceOf",
                List.<Type>of(new Address(owner)),
                List.<TypeReference<?>>of(new TypeReference<Uint256>() {}));
    }

    public static Function allowance(String owner, String spender) {
        return new Function("allowance",
                List.<Type>of(new Address(owner), new Address(spender)),
                List.<TypeReference<?>>of(new TypeReference<Uint256>() {}));
    }

    public static Function approve(String spender, BigInteger amount) {
        return new Function("approve",
                List.<Type>of(new Address(spender), new Uint256(amount)),
                List.<TypeReference<?>>of(new TypeReference<Bool>() {}));
    }

    public static String encode(Function function) {
        return FunctionEncoder.encode(function);
    }

    /**
     * Разбор uint256 из ответа eth_call.
     *
     * @throws IllegalArgumentException если ответ пустой или не декодируется
     */
    @SuppressWarnings("rawtypes")
    public static BigInteger decodeUint(Function function, String raw) {
        if (raw == null || raw.isBlank() || "0x".equals(raw)) {
            throw new IllegalArgumentException("empty eth_call result for " + function.getName());
        }
        List<Type> out = FunctionReturnDecoder.decode(raw, function.getOutputParameters());
        if (out.isEmpty() || !(out.get(0).getValue() instanceof BigInteger value)) {
            throw new IllegalArgumentException("malformed eth_call result for " + function.getName() + ": " + raw);
        }
        return value;
    }
}
