package com.tradinggateway.health;

/**
 * Receives DEGRADING and STALE signals from the {@link HealthMonitor}. The monitor never
 * changes session state itself; it only reports through this interface.
 */
public interface HealthSignalListener {

    void onHealthSignal(HealthSignal signal);
}
