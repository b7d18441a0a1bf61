package com.chicu.rebalancer.bridge.model;

public enum RoutePath {
    /** Один маршрут агрегатора из токена в токен */
    DIRECT,
    /** Своп в нативный актив, мост, обратный своп на сети назначения */
    SWAP_BRIDGE_SWAP
}
