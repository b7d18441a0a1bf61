package com.chicu.rebalancer.bridge.model;

import lombok.Value;

@Value
public class BridgeStatusReport {
    BridgeTxStatus sourceTxStatus;
    BridgeTxStatus destinationTxStatus;

    /** FAILED, если упала любая сторона; COMPLETED, только если завершены обе. */
    public BridgeTxStatus overall() {
        if (sourceTxStatus == BridgeTxStatus.FAILED || destinationTxStatus == BridgeTxStatus.FAILED) {
            return BridgeTxStatus.FAILED;
        }
        if (sourceTxStatus == BridgeTxStatus.COMPLETED && destinationTxStatus == BridgeTxStatus.COMPLETED) {
            return BridgeTxStatus.COMPLETED;
        }
        return BridgeTxStatus.PENDING;
    }
}
