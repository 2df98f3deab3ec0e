package com.splitvault.api.conversion;

import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.assertj.core.api.Assertions.*;

class ConversionEngineTest {

    private final ConversionEngine engine = new ConversionEngine(100);

    @Test
    void feeIsFlooredPercent() {
        assertThat(engine.feeFor(BigInteger.valueOf(1000))).isEqualTo(BigInteger.TEN);
        assertThat(engine.feeFor(BigInteger.valueOf(1099))).isEqualTo(BigInteger.TEN);
        assertThat(engine.feeFor(BigInteger.valueOf(99))).isZero();
    }

    @Test
    void denominatorMustBePositive() {
        assertThatThrownBy(() -> new ConversionEngine(0)).isInstanceOf(IllegalArgumentException.class);
    }
}
