package com.chicu.rebalancer.bridge.model;

import com.chicu.rebalancer.chain.model.TransactionRequest;
import lombok.Builder;
import lombok.Value;

import java.math.BigInteger;

@Value
@Builder
public class BuildTxResult {
    String txData;
    String txTarget;
    BigInteger value;
    /** null — approve не требуется */
    ApprovalData approvalData;

    public TransactionRequest toTransactionRequest() {
        return TransactionRequest.builder()
                .to(txTarget)
                .data(txData)
                .value(value)
                .build();
    }
}
