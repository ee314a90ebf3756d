package com.ryuqq.gateway.application.search;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * PiiMasker 유닛 테스트.
 *
 * @author Gateway Team
 * @since 1.0.0
 */
class PiiMaskerTest {

    @Test
    void mask_길이_3_이하는_별표_3개() {
        assertThat(PiiMasker.mask("ab")).isEqualTo("***");
        assertThat(PiiMasker.mask("abc")).isEqualTo("***");
        assertThat(PiiMasker.mask("")).isEqualTo("***");
    }

    @Test
    void mask_첫_글자와_마지막_글자만_유지() {
        assertThat(PiiMasker.mask("alice")).isEqualTo("a***e");
        assertThat(PiiMasker.mask("abcd")).isEqualTo("a**d");
        assertThat(PiiMasker.mask("john.doe@x.com")).isEqualTo("j************m");
    }

    @Test
    void isPii_대소문자_무시() {
        assertThat(PiiMasker.isPii("email")).isTrue();
        assertThat(PiiMasker.isPii("firstName")).isTrue();
        assertThat(PiiMasker.isPii("MANAGERID")).isTrue();
        assertThat(PiiMasker.isPii("department")).isFalse();
        assertThat(PiiMasker.isPii(null)).isFalse();
    }

    @Test
    void maskIfPii_PII가_아니면_원본() {
        assertThat(PiiMasker.maskIfPii("department", "Engineering")).isEqualTo("Engineering");
        assertThat(PiiMasker.maskIfPii("login", "alice")).isEqualTo("a***e");
        assertThat(PiiMasker.mask(null)).isNull();
    }
}
