package com.chicu.rebalancer.chain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;

/**
 * Транзакция к подписи: адресат, calldata, value и лимит газа.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class TransactionRequest {
    private String to;
    private String data;          // 0x… calldata
    private BigInteger value;     // wei, null = 0
    private BigInteger gasLimit;  // null = оценить при отправке
}
