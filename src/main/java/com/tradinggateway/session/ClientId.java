package com.tradinggateway.session;

import java.time.Instant;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * Identity presented to the gateway when opening a socket. The gateway rejects a
 * second connection that reuses an identity still bound to a half-closed socket,
 * so a value is never handed out twice within the process.
 */
@Getter
@EqualsAndHashCode(of = "value")
public class ClientId {

    private final int value;
    private final Instant allocatedAt;

    public ClientId(int value, Instant allocatedAt) {
        if (value <= 0) {
            throw new IllegalArgumentException("Client id must be positive (0 is reserved by the gateway): " + value);
        }
        this.value = value;
        this.allocatedAt = allocatedAt;
    }

    @Override
    public String toString() {
        return Integer.toString(value);
    }
}
