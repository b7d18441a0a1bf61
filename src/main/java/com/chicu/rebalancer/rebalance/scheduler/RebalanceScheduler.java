package com.chicu.rebalancer.rebalance.scheduler;

public interface RebalanceScheduler {
    void start();
    /** Новые тики не планируются; текущий доработает сам. */
    void stop();
    boolean isRunning();
}
