package com.jz.honeypot.engage;

import com.jz.honeypot.config.EngagementProperties;
import com.jz.honeypot.domain.CandidateResponse;
import com.jz.honeypot.domain.RankedChoice;
import com.jz.honeypot.domain.SessionState;
import com.jz.honeypot.domain.Stage;
import com.jz.honeypot.domain.Tactic;
import com.jz.honeypot.domain.TacticStreak;
import com.jz.honeypot.domain.Theme;
import com.jz.honeypot.engage.model.EngagementModel;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class ResponseRankerTest {

    private static final String MSG = "Share the OTP now or your account will be blocked";

    private static EngagementModel model;
    private static ResponseCatalog catalog;

    private EngagementProperties props;
    private SimpleMeterRegistry registry;
    private ResponseRanker ranker;
    private SessionState s;

    @BeforeAll
    static void loadModel() {
        model = new EngagementModel(42L);
        catalog = new ResponseCatalog(model);
    }

    @BeforeEach
    void setUp() {
        props = new EngagementProperties();
        registry = new SimpleMeterRegistry();
        ranker = new ResponseRanker(model, props, registry);
        s = SessionState.create("rank-test", 0L);
        s.setStage(Stage.VERIFYING);
    }

    private List<CandidateResponse> verifyingOtpPool() {
        List<CandidateResponse> pool = new ArrayList<>(catalog.stagePool(Stage.VERIFYING));
        pool.addAll(catalog.tacticPool(Tactic.OTP, Stage.VERIFYING));
        return pool;
    }

    private double fallbackCount() {
        return registry.get("honeypot.ranker.fallback.count").counter().count();
    }

    @Nested
    @DisplayName("scoring path")
    class Scoring {

        @Test
        void sameSeedSameChoice() {
            List<CandidateResponse> pool = verifyingOtpPool();

            RankingOutcome a = ranker.rank(s, MSG, Stage.VERIFYING, Tactic.OTP, pool, 1, new Random(7));
            RankingOutcome b = ranker.rank(s, MSG, Stage.VERIFYING, Tactic.OTP, pool, 1, new Random(7));

            assertThat(a.chosen().getId()).isEqualTo(b.chosen().getId());
            assertThat(a.degraded()).isFalse();
            assertThat(pool).contains(a.chosen());
        }

        @Test
        void returnsHiddenStateAndIntents() {
            RankingOutcome out = ranker.rank(s, MSG, Stage.VERIFYING, Tactic.OTP, verifyingOtpPool(), 1, new Random(1));

            assertThat(out.hiddenState()).hasSize(SessionState.HIDDEN_DIM);
            assertThat(Arrays.stream(out.intents()).sum()).isCloseTo(1.0, within(1e-9));
            assertThat(out.ranking()).hasSize(verifyingOtpPool().size());
            assertThat(out.ranking().stream().mapToDouble(RankedChoice::probability).sum()).isCloseTo(1.0, within(1e-9));
        }

        @Test
        void probeAlwaysWins() {
            List<CandidateResponse> pool = verifyingOtpPool();
            CandidateResponse probe = CandidateResponse.builder()
                    .id("qp-4").text("Which branch are you from? Also, what is your employee ID?")
                    .stageAffinity(Stage.VERIFYING).theme(Theme.QUALITY_PROBE)
                    .probeParts(new CandidateResponse.ProbeParts(true, true, false))
                    .build();
            pool.add(probe);

            for (int seed = 0; seed < 20; seed++) {
                RankingOutcome out = ranker.rank(s, MSG, Stage.VERIFYING, Tactic.OTP, pool, 1, new Random(seed));
                assertThat(out.chosen()).isSameAs(probe);
            }
        }

        @Test
        void streakTagIsNeverPickedTwiceInARow() {
            s.setTacticStreak(new TacticStreak("otp", 1));
            List<CandidateResponse> pool = verifyingOtpPool();

            for (int seed = 0; seed < 50; seed++) {
                RankingOutcome out = ranker.rank(s, MSG, Stage.VERIFYING, Tactic.OTP, pool, 1, new Random(seed));
                assertThat(out.chosen().tacticTag()).isNotEqualTo("otp");
            }
        }

        @Test
        void excludedCandidatesRankBelowTheRest() {
            s.setTacticStreak(new TacticStreak("otp", 1));

            RankingOutcome out = ranker.rank(s, MSG, Stage.VERIFYING, Tactic.OTP, verifyingOtpPool(), 1, new Random(3));

            List<RankedChoice> ranking = out.ranking();
            int firstDemoted = -1;
            for (int i = 0; i < ranking.size(); i++) {
                if (ranking.get(i).demoted()) {
                    firstDemoted = i;
                    break;
                }
            }
            assertThat(firstDemoted).isPositive();
            assertThat(ranking.subList(firstDemoted, ranking.size())).allMatch(RankedChoice::demoted);
            assertThat(ranking.subList(firstDemoted, ranking.size())).allMatch(r -> r.probability() == 0.0);
        }

        @Test
        void emptyPoolIsRejected() {
            assertThatThrownBy(() -> ranker.rank(s, MSG, Stage.VERIFYING, Tactic.OTP, List.of(), 1, new Random()))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("fallback path")
    class Fallback {

        @Test
        void disabledRankerSamplesUniformly() {
            props.getRanker().setEnabled(false);

            RankingOutcome out = ranker.rank(s, MSG, Stage.VERIFYING, Tactic.OTP, verifyingOtpPool(), 1, new Random(5));

            assertThat(out.degraded()).isTrue();
            assertThat(out.hiddenState()).isNull();
            assertThat(fallbackCount()).isEqualTo(1.0);
        }

        @Test
        void numericFailureDegradesInsteadOfThrowing() {
            s.setHiddenState(new double[3]);

            RankingOutcome out = ranker.rank(s, MSG, Stage.VERIFYING, Tactic.OTP, verifyingOtpPool(), 1, new Random(5));

            assertThat(out.degraded()).isTrue();
            assertThat(out.chosen()).isNotNull();
            assertThat(fallbackCount()).isEqualTo(1.0);
        }

        @Test
        void fallbackStillHonoursStreak() {
            props.getRanker().setEnabled(false);
            s.setTacticStreak(new TacticStreak("otp", 1));

            for (int seed = 0; seed < 30; seed++) {
                RankingOutcome out = ranker.rank(s, MSG, Stage.VERIFYING, Tactic.OTP, verifyingOtpPool(), 1, new Random(seed));
                assertThat(out.chosen().tacticTag()).isNotEqualTo("otp");
            }
        }
    }

    @Nested
    @DisplayName("helpers")
    class Helpers {

        @Test
        void noExclusionWithoutAlternative() {
            List<CandidateResponse> onlyOtp = catalog.tacticPool(Tactic.OTP, Stage.VERIFYING);

            boolean[] excluded = ResponseRanker.streakExclusions(onlyOtp, new TacticStreak("otp", 3), 1);

            for (boolean x : excluded) assertThat(x).isFalse();
        }

        @Test
        void samplingIgnoresExcludedAndSharpensWithLowTemperature() {
            double[] scores = {1.0, 2.0, 3.0};
            boolean[] excluded = {false, false, true};

            double[] warm = ResponseRanker.sampling(scores, excluded, 1.0);
            double[] cold = ResponseRanker.sampling(scores, excluded, 0.1);

            assertThat(warm[2]).isZero();
            assertThat(warm[0] + warm[1]).isCloseTo(1.0, within(1e-12));
            assertThat(cold[1]).isGreaterThan(warm[1]);
        }

        @Test
        void drawSkipsZeroProbabilities() {
            double[] probs = {0.0, 1.0, 0.0};

            for (int seed = 0; seed < 10; seed++) {
                assertThat(ResponseRanker.draw(probs, new Random(seed))).isEqualTo(1);
            }
        }

        @Test
        void stageAlignment() {
            assertThat(ResponseRanker.stageAligned(Theme.CONFUSION, Stage.CONFUSED)).isTrue();
            assertThat(ResponseRanker.stageAligned(Theme.PROBING, Stage.SUSPICIOUS)).isTrue();
            assertThat(ResponseRanker.stageAligned(Theme.EXTRACTION, Stage.CONFUSED)).isFalse();
            assertThat(ResponseRanker.stageAligned(null, Stage.EXTRACTING)).isFalse();
        }
    }
}
