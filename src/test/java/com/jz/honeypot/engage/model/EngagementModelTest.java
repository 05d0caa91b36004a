package com.jz.honeypot.engage.model;

import com.jz.honeypot.domain.CandidateResponse;
import com.jz.honeypot.domain.SessionState;
import com.jz.honeypot.domain.Stage;
import com.jz.honeypot.domain.Tactic;
import com.jz.honeypot.domain.Theme;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EngagementModelTest {

    private static EngagementModel model;

    @BeforeAll
    static void build() {
        model = new EngagementModel(42L);
    }

    @Test
    void attentionKeepsWidthAndStaysFinite() {
        double[] out = model.getAttention().forward(model.getEncoder().encode("This is RBI, share OTP"));

        assertThat(out).hasSize(TextEncoder.DIM);
        assertThat(VectorMath.isFinite(out)).isTrue();
    }

    @Test
    void stateCellIsBoundedFromZeroState() {
        double[] x = model.getAttention().forward(model.getEncoder().encode("pay now"));
        double[] h = model.getStateCell().step(x, new double[SessionState.HIDDEN_DIM]);

        assertThat(h).hasSize(ConversationStateCell.DIM);
        assertThat(Arrays.stream(h).allMatch(v -> v > -1.0 && v < 1.0)).isTrue();
    }

    @Test
    void stateCellDoesNotMutateInput() {
        double[] x = model.getAttention().forward(model.getEncoder().encode("pay now"));
        double[] h0 = new double[SessionState.HIDDEN_DIM];
        Arrays.fill(h0, 0.25);
        double[] copy = h0.clone();

        model.getStateCell().step(x, h0);

        assertThat(h0).containsExactly(copy);
    }

    @Test
    void stateCellRejectsWrongWidth() {
        double[] x = new double[TextEncoder.DIM];

        assertThatThrownBy(() -> model.getStateCell().step(x, new double[3]))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void scorerOutputsProbability() {
        String msg = "Transfer the processing fee now";
        double[] ctx = model.getAttention().forward(model.getEncoder().encode(msg));
        double[] hidden = model.getStateCell().step(ctx, new double[SessionState.HIDDEN_DIM]);
        double[] intents = model.getIntentClassifier().classify(ctx, msg);
        CandidateResponse c = CandidateResponse.builder()
                .id("payment-x")
                .text("Which account should I send it to? Tell me the details slowly.")
                .stageAffinity(Stage.VERIFYING)
                .tacticAffinity(Tactic.PAYMENT)
                .theme(Theme.EXTRACTION)
                .build();
        double[] hand = HandFeatures.compute(c, Stage.SUSPICIOUS, Tactic.PAYMENT, null);

        double score = model.getScorer().score(ctx, model.getEncoder().encode(c.getText()), hidden, intents, hand);

        assertThat(score).isStrictlyBetween(0.0, 1.0);
        assertThat(EngagementScorer.INPUT).isEqualTo(345);
    }

    @Test
    void handFeaturesAreUnitBounded() {
        CandidateResponse c = CandidateResponse.builder()
                .id("confused-x")
                .text("Arre beta, wait, let me find my glasses. Which number should I call?")
                .stageAffinity(Stage.CONFUSED)
                .theme(Theme.STALLING)
                .build();

        double[] f = HandFeatures.compute(c, Stage.CONFUSED, null, Theme.STALLING);

        assertThat(f).hasSize(HandFeatures.SIZE);
        assertThat(Arrays.stream(f).allMatch(v -> v >= 0.0 && v <= 1.0)).isTrue();
        assertThat(f[0]).isEqualTo(1.0);
        assertThat(f[2]).isZero();
        assertThat(f[4]).isEqualTo(1.0);
    }
}
