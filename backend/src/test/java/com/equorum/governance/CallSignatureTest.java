package com.equorum.governance;

import com.equorum.governance.error.ErrorCode;
import com.equorum.governance.error.GovernanceException;
import com.equorum.governance.target.CallSignature;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CallSignatureTest {

    @Test
    void parse_extractsFunctionAndTypes() {
        CallSignature sig = CallSignature.parse(" setParameter(string,uint256) ");

        assertThat(sig.function()).isEqualTo("setParameter");
        assertThat(sig.parameterTypes()).containsExactly("string", "uint256");
        assertThat(sig.arity()).isEqualTo(2);
        assertThat(sig.canonical()).isEqualTo("setParameter(string,uint256)");
    }

    @Test
    void parse_noArguments() {
        CallSignature sig = CallSignature.parse("acceptAdmin()");

        assertThat(sig.arity()).isZero();
        assertThat(sig.canonical()).isEqualTo("acceptAdmin()");
    }

    @Test
    void parse_rejectsMalformedAndUnsupported() {
        for (String bad : List.of("", "setParameter", "set Parameter()", "f(string,)", "f(int8)", "f(String)")) {
            assertThatThrownBy(() -> CallSignature.parse(bad))
                .as(bad)
                .isInstanceOfSatisfying(GovernanceException.class, e ->
                    assertThat(e.getCode()).isEqualTo(ErrorCode.INVALID_SIGNATURE));
        }
        assertThatThrownBy(() -> CallSignature.parse(null)).isInstanceOf(GovernanceException.class);
    }

    @Test
    void checkArguments_acceptsWellTypedValues() {
        CallSignature sig = CallSignature.parse("f(string,uint256,address,bool)");

        sig.checkArguments(List.of("anything at all", "115792089237316195423570985008687907853269984665640564039457584007913129639935",
            "multisig", "true"));
    }

    @Test
    void checkArguments_rejectsWrongArityOrType() {
        CallSignature sig = CallSignature.parse("f(uint256,bool)");

        assertInvalidCalldata(() -> sig.checkArguments(List.of("1")));
        assertInvalidCalldata(() -> sig.checkArguments(List.of("-1", "true")));
        assertInvalidCalldata(() -> sig.checkArguments(List.of("1.5", "true")));
        assertInvalidCalldata(() -> sig.checkArguments(List.of("1", "yes")));
        assertInvalidCalldata(() -> CallSignature.parse("g(address)").checkArguments(List.of("not an address")));
    }

    private static void assertInvalidCalldata(Runnable call) {
        assertThatThrownBy(call::run)
            .isInstanceOfSatisfying(GovernanceException.class, e ->
                assertThat(e.getCode()).isEqualTo(ErrorCode.INVALID_CALLDATA));
    }
}
