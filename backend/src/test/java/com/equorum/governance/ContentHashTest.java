package com.equorum.governance;

import com.equorum.governance.service.ContentHash;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class ContentHashTest {

    private static final Instant ETA = Instant.parse("2030-01-03T00:00:00Z");
    private static final String SIG = "setParameter(string,uint256)";
    private static final String DATA = "[\"baseApy\",\"450\"]";

    @Test
    void of_isStableLowercaseSha256Hex() {
        String hash = ContentHash.of("staking", BigInteger.ZERO, SIG, DATA, ETA);

        assertThat(hash).hasSize(64).matches("[0-9a-f]+");
        assertThat(ContentHash.of("staking", BigInteger.ZERO, SIG, DATA, ETA)).isEqualTo(hash);
    }

    @Test
    void of_everyFieldChangesTheHash() {
        String base = ContentHash.of("staking", BigInteger.ZERO, SIG, DATA, ETA);

        assertThat(ContentHash.of("faucet", BigInteger.ZERO, SIG, DATA, ETA)).isNotEqualTo(base);
        assertThat(ContentHash.of("staking", BigInteger.ONE, SIG, DATA, ETA)).isNotEqualTo(base);
        assertThat(ContentHash.of("staking", BigInteger.ZERO, "acceptAdmin()", DATA, ETA)).isNotEqualTo(base);
        assertThat(ContentHash.of("staking", BigInteger.ZERO, SIG, "[\"baseApy\",\"451\"]", ETA)).isNotEqualTo(base);
        assertThat(ContentHash.of("staking", BigInteger.ZERO, SIG, DATA, ETA.plusSeconds(1))).isNotEqualTo(base);
    }

    @Test
    void of_fieldBoundariesAreUnambiguous() {
        // same concatenation, different split between target and signature
        assertThat(ContentHash.of("ab", BigInteger.ZERO, "c()", "[]", ETA))
            .isNotEqualTo(ContentHash.of("a", BigInteger.ZERO, "bc()", "[]", ETA));
    }

    @Test
    void of_ignoresSubSecondPrecisionOfEta() {
        assertThat(ContentHash.of("staking", BigInteger.ZERO, SIG, DATA, ETA.plusMillis(999)))
            .isEqualTo(ContentHash.of("staking", BigInteger.ZERO, SIG, DATA, ETA));
    }
}
