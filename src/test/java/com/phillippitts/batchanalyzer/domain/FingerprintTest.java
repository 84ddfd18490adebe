package com.phillippitts.batchanalyzer.domain;

import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FingerprintTest {

    @Test
    void fromBitsPacksMostSignificantBitFirst() {
        boolean[] bits = new boolean[8];
        bits[0] = true;
        bits[7] = true;

        Fingerprint fp = Fingerprint.fromBits(HashAlgorithm.AVERAGE, bits);

        assertThat(fp.value()).isEqualTo("81");
        assertThat(fp.bitWidth()).isEqualTo(8);
    }

    @Test
    void fromBitsZeroPadsToFullWidth() {
        boolean[] bits = new boolean[64];
        bits[63] = true;

        Fingerprint fp = Fingerprint.fromBits(HashAlgorithm.DIFFERENCE, bits);

        assertThat(fp.value()).isEqualTo("0000000000000001");
        assertThat(fp.toBigInteger()).isEqualTo(BigInteger.ONE);
    }

    @Test
    void valueIsNormalisedToLowerCase() {
        Fingerprint fp = new Fingerprint(HashAlgorithm.FREQUENCY, 64, "F0F0F0F0F0F0F0F0");

        assertThat(fp.value()).isEqualTo("f0f0f0f0f0f0f0f0");
        assertThat(fp).isEqualTo(new Fingerprint(HashAlgorithm.FREQUENCY, 64, "f0f0f0f0f0f0f0f0"));
    }

    @Test
    void shouldRejectWrongLength() {
        assertThatThrownBy(() -> new Fingerprint(HashAlgorithm.AVERAGE, 64, "abc"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Expected 16 hex characters");
    }

    @Test
    void shouldRejectNonHexValue() {
        assertThatThrownBy(() -> new Fingerprint(HashAlgorithm.AVERAGE, 8, "zz"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not hex");
    }

    @Test
    void shouldRejectBitWidthNotMultipleOfFour() {
        assertThatThrownBy(() -> new Fingerprint(HashAlgorithm.AVERAGE, 6, "ab"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("bitWidth");
    }
}
