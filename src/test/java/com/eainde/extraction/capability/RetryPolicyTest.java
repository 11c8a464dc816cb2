package com.eainde.extraction.capability;

import com.eainde.extraction.exception.CapabilityUnavailableException;
import com.eainde.extraction.exception.TransientCapabilityException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RetryPolicyTest {

    private final List<Duration> sleeps = new ArrayList<>();

    private final RetryPolicy policy = new RetryPolicy(5,
            Duration.ofSeconds(2), Duration.ofSeconds(5), Duration.ofSeconds(1),
            sleeps::add, () -> 0.5);

    @Test
    void execute_shouldReturnValue_whenFirstAttemptSucceeds() {
        CallResult<String> result = policy.execute("call", () -> "ok");

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.value()).isEqualTo("ok");
        assertThat(result.attempts()).isEqualTo(1);
        assertThat(sleeps).isEmpty();
    }

    @Test
    @DisplayName("doubles the base delay per attempt and adds jitter")
    void execute_shouldBackOffExponentially_whenAttemptsFail() {
        AtomicInteger calls = new AtomicInteger();

        CallResult<String> result = policy.execute("call", () -> {
            if (calls.incrementAndGet() < 3) throw new IllegalStateException("boom");
            return "ok";
        });

        assertThat(result.value()).isEqualTo("ok");
        assertThat(result.attempts()).isEqualTo(3);
        assertThat(sleeps).containsExactly(Duration.ofMillis(2_500), Duration.ofMillis(4_500));
    }

    @Test
    @DisplayName("adds the penalty when the capability signals throttling")
    void execute_shouldAddPenalty_whenRateLimited() {
        AtomicInteger calls = new AtomicInteger();

        policy.execute("call", () -> {
            if (calls.incrementAndGet() == 1) throw new TransientCapabilityException("429 Too Many Requests", true);
            return "ok";
        });

        assertThat(sleeps).containsExactly(Duration.ofMillis(7_500));
    }

    @Test
    @DisplayName("returns the last error as a value after the final attempt")
    void execute_shouldReturnFailure_whenAttemptsExhausted() {
        AtomicInteger calls = new AtomicInteger();

        CallResult<String> result = policy.execute("final_merge", () -> {
            throw new IllegalStateException("attempt " + calls.incrementAndGet());
        });

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.attempts()).isEqualTo(5);
        assertThat(result.error()).hasMessage("attempt 5");
        assertThat(sleeps).hasSize(4);
        assertThat(result.orElseGet(Throwable::getMessage)).isEqualTo("attempt 5");
        assertThatThrownBy(() -> result.orElseThrow("final_merge"))
                .isInstanceOfSatisfying(CapabilityUnavailableException.class, e -> {
                    assertThat(e.getCallName()).isEqualTo("final_merge");
                    assertThat(e.getAttempts()).isEqualTo(5);
                });
    }

    @Test
    void delayFor_shouldMatchDefaults() {
        RetryPolicy defaults = new RetryPolicy(5,
                Duration.ofSeconds(2), Duration.ofSeconds(5), Duration.ofSeconds(1),
                sleeps::add, () -> 0.0);

        assertThat(defaults.delayFor(1, false)).isEqualTo(Duration.ofSeconds(2));
        assertThat(defaults.delayFor(4, false)).isEqualTo(Duration.ofSeconds(16));
        assertThat(defaults.delayFor(2, true)).isEqualTo(Duration.ofSeconds(9));
        assertThat(RetryPolicy.defaults().maxAttempts()).isEqualTo(5);
    }
}
