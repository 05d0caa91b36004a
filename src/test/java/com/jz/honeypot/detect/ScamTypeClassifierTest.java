package com.jz.honeypot.detect;

import org.junit.jupiter.api.Test;

import java.util.Set;

import static com.jz.honeypot.detect.SignalLayers.*;
import static org.assertj.core.api.Assertions.assertThat;

class ScamTypeClassifierTest {

    private final ScamTypeClassifier classifier = new ScamTypeClassifier();

    @Test
    void specificCategoryWins() {
        assertThat(classifier.classify(Set.of(AUTHORITY, COURIER, OTP))).isEqualTo("courier");
        assertThat(classifier.classify(Set.of(PAYMENT, BANK_DETAIL))).isEqualTo("upi_fraud");
    }

    @Test
    void unmappedOrEmptyIsUnknown() {
        assertThat(classifier.classify(Set.of())).isEqualTo(ScamTypeClassifier.UNKNOWN);
        assertThat(classifier.classify(Set.of(HINGLISH, URGENCY))).isEqualTo(ScamTypeClassifier.UNKNOWN);
    }
}
