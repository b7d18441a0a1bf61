package com.chicu.rebalancer.rebalance.model;

public enum TickOutcome {
    /** Предыдущий тик ещё работает */
    SKIPPED,
    /** Балансы в норме, операция не создавалась */
    NOTHING_TO_DO,
    /** Новая операция доведена до COMPLETED */
    COMPLETED,
    /** Незавершённая операция доведена до конца */
    RESUMED
}
