package com.ryuqq.fleetflow.adapter.inmemory.timeout;

import com.ryuqq.fleetflow.core.model.MessageId;
import com.ryuqq.fleetflow.core.spi.DeadlineResolution;
import com.ryuqq.fleetflow.testkit.support.Awaits;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ScheduledDeadlineManagerTest {

    private final ScheduledDeadlineManager deadlines = new ScheduledDeadlineManager(1);

    @AfterEach
    void tearDown() {
        deadlines.shutdown();
    }

    @Test
    void 콜백_예외가_다른_만료를_막지_않음() throws Exception {
        // given
        AtomicInteger healthy = new AtomicInteger();
        deadlines.register(MessageId.generate(), System.currentTimeMillis(), id -> {
            throw new IllegalStateException("callback failure");
        });

        // when
        CompletableFuture<DeadlineResolution> second =
            deadlines.register(MessageId.generate(), System.currentTimeMillis() + 20, id -> healthy.incrementAndGet());

        // then
        assertThat(second.get(1, TimeUnit.SECONDS)).isEqualTo(DeadlineResolution.EXPIRED);
        Awaits.until(() -> healthy.get() == 1, "second callback");
    }

    @Test
    void 만료_후_같은_ID_재등록_허용() throws Exception {
        // given
        MessageId id = MessageId.generate();
        deadlines.register(id, System.currentTimeMillis(), expired -> { }).get(1, TimeUnit.SECONDS);

        // when
        CompletableFuture<DeadlineResolution> again = deadlines.register(id, System.currentTimeMillis() + 5_000, expired -> { });

        // then
        assertThat(deadlines.pendingCount()).isEqualTo(1);
        assertThat(deadlines.acknowledge(id)).isTrue();
        assertThat(again.get(1, TimeUnit.SECONDS)).isEqualTo(DeadlineResolution.ACKNOWLEDGED);
    }

    @Test
    void 콜백_스레드_수_검증() {
        // when & then
        assertThatThrownBy(() -> new ScheduledDeadlineManager(0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("must be positive");
    }
}
