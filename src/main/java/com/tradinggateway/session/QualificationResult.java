package com.tradinggateway.session;

import com.tradinggateway.transport.ContractDetails;
import lombok.Getter;
import lombok.ToString;

/**
 * Outcome of qualifying one contract key against the current session.
 *
 * <p>Both definitive outcomes are cached for the session's lifetime. An {@link #unavailable}
 * result (timeout, gateway error, session closed mid-flight) is returned to the caller but
 * never cached, so the next request tries again.
 */
@Getter
@ToString
public class QualificationResult {

    private final String contractKey;
    private final boolean qualified;
    private final ContractDetails contract;
    private final String failureReason;
    private final boolean cacheable;

    private QualificationResult(
            String contractKey, boolean qualified, ContractDetails contract, String failureReason, boolean cacheable) {
        this.contractKey = contractKey;
        this.qualified = qualified;
        this.contract = contract;
        this.failureReason = failureReason;
        this.cacheable = cacheable;
    }

    public static QualificationResult qualified(ContractDetails contract) {
        return new QualificationResult(contract.getContractKey(), true, contract, null, true);
    }

    public static QualificationResult rejected(String contractKey, String reason) {
        return new QualificationResult(contractKey, false, null, reason, true);
    }

    public static QualificationResult unavailable(String contractKey, String reason) {
        return new QualificationResult(contractKey, false, null, reason, false);
    }
}
