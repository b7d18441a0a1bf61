package com.chicu.rebalancer.chain.util;

import java.util.Locale;
import java.util.Set;

public final class NativeTokens {

    private static final Set<String> SENTINELS = Set.of(
            "0xeeeeeeeeeeeeeeeeeeeeeeeeeeeeeeeeeeeeeeee",
            "0x0000000000000000000000000000000000000000"
    );

    public static final int NATIVE_DECIMALS = 18;

    private NativeTokens() {}

    /** Адрес-заглушка нативного актива (ETH, MNT и т.п.), а не ERC-20 контракт. */
    public static boolean isNative(String tokenAddress) {
        return tokenAddress != null && SENTINELS.contains(tokenAddress.toLowerCase(Locale.ROOT));
    }
}
