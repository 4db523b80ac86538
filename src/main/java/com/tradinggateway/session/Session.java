package com.tradinggateway.session;

import com.tradinggateway.transport.ContractDetails;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * The single logical gateway connection. Owned by {@link SessionManager}, which creates a
 * fresh instance on every connection attempt; nothing here survives a reconnect.
 *
 * <p>Mutators are package-private and called only while the manager holds its state lock.
 * The qualification map is concurrent so the request gate can read it without locking.
 */
class Session {

    private final ClientId clientId;
    private final Instant createdAt;
    private volatile Instant readyAt;
    private volatile Instant lastHeartbeatAt;

    /** Committed qualification outcomes, positive and negative. */
    private final Map<String, QualificationResult> qualifications = new ConcurrentHashMap<>();

    /** One pending gateway round-trip per contract key. */
    private final Map<String, CompletableFuture<QualificationResult>> pendingQualifications = new ConcurrentHashMap<>();

    Session(ClientId clientId, Instant createdAt) {
        this.clientId = clientId;
        this.createdAt = createdAt;
    }

    ClientId getClientId() {
        return clientId;
    }

    Instant getCreatedAt() {
        return createdAt;
    }

    Instant getReadyAt() {
        return readyAt;
    }

    Instant getLastHeartbeatAt() {
        return lastHeartbeatAt;
    }

    void markReady(Instant now) {
        this.readyAt = now;
        this.lastHeartbeatAt = now;
    }

    void heartbeat(Instant at) {
        this.lastHeartbeatAt = at;
    }

    QualificationResult cachedQualification(String contractKey) {
        return qualifications.get(contractKey);
    }

    Optional<ContractDetails> qualifiedContract(String contractKey) {
        QualificationResult result = qualifications.get(contractKey);
        return result != null && result.isQualified() ? Optional.of(result.getContract()) : Optional.empty();
    }

    void commit(QualificationResult result) {
        qualifications.put(result.getContractKey(), result);
    }

    Map<String, CompletableFuture<QualificationResult>> pendingQualifications() {
        return pendingQualifications;
    }

    Set<String> qualifiedKeys() {
        return qualifications.values().stream()
                .filter(QualificationResult::isQualified)
                .map(QualificationResult::getContractKey)
                .collect(Collectors.toUnmodifiableSet());
    }

    Set<String> rejectedKeys() {
        return qualifications.values().stream()
                .filter(r -> !r.isQualified())
                .map(QualificationResult::getContractKey)
                .collect(Collectors.toUnmodifiableSet());
    }
}
