package com.equorum.governance.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;

import java.math.BigInteger;
import java.util.Objects;

/** One call a proposal wants the timelock to make. */
@Embeddable
public class ProposalAction {

    @Column(nullable = false, length = 64)
    private String target;

    @Column(name = "call_value", nullable = false, precision = 78, scale = 0)
    private BigInteger value = BigInteger.ZERO;

    @Column(nullable = false, length = 256)
    private String signature;

    @Column(nullable = false, length = 4000)
    private String calldata;

    public ProposalAction() {}

    public ProposalAction(String target, BigInteger value, String signature, String calldata) {
        this.target = target;
        this.value = value;
        this.signature = signature;
        this.calldata = calldata;
    }

    public String getTarget() { return target; }
    public void setTarget(String target) { this.target = target; }

    public BigInteger getValue() { return value; }
    public void setValue(BigInteger value) { this.value = value; }

    public String getSignature() { return signature; }
    public void setSignature(String signature) { this.signature = signature; }

    public String getCalldata() { return calldata; }
    public void setCalldata(String calldata) { this.calldata = calldata; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ProposalAction that)) return false;
        return Objects.equals(target, that.target)
            && Objects.equals(value, that.value)
            && Objects.equals(signature, that.signature)
            && Objects.equals(calldata, that.calldata);
    }

    @Override
    public int hashCode() {
        return Objects.hash(target, value, signature, calldata);
    }
}
