package com.chicu.rebalancer.bridge.model;

import lombok.Value;

import java.math.BigInteger;

@Value
public class ApprovalData {
    String spender;
    BigInteger amount;
}
