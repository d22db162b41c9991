package com.ryuqq.fleetflow.adapter.runner;

import com.ryuqq.fleetflow.core.contract.Channel;
import com.ryuqq.fleetflow.core.model.EntityId;
import com.ryuqq.fleetflow.core.spi.MessageBusUnavailableException;
import com.ryuqq.fleetflow.core.statemachine.WorkflowTrigger;
import com.ryuqq.fleetflow.core.workflow.Workflow;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * StalenessReaper 유닛 테스트.
 *
 * <ul>
 *   <li>임계값 초과 진행 중 워크플로만 실패 처리</li>
 *   <li>IDLE 워크플로 제외</li>
 *   <li>배치 크기 제한</li>
 *   <li>개별 실패 시에도 계속 진행</li>
 * </ul>
 *
 * @author Fleetflow Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class StalenessReaperTest {

    private static final long NOW = 10_000_000L;
    private static final long THRESHOLD = 300_000L;

    @Mock
    private WorkflowCoordinator coordinator;

    private WorkflowRegistry registry;
    private StalenessReaper reaper;

    @BeforeEach
    void setUp() {
        registry = new WorkflowRegistry(3, 10);
        reaper = new StalenessReaper(registry, coordinator, new ReaperConfig(), () -> NOW);
    }

    private Workflow activeSince(String entityId, long lastUpdate) {
        Workflow workflow = registry.getOrCreate(EntityId.of(entityId), lastUpdate);
        workflow.fire(WorkflowTrigger.NEW_INPUT, "test input", lastUpdate);
        return workflow;
    }

    @Test
    void scan_임계값을_넘긴_진행_중_워크플로를_실패_처리() {
        // given
        Workflow stale = activeSince("stale-1", NOW - THRESHOLD - 1);
        activeSince("fresh-1", NOW - 1_000);
        when(coordinator.failIfStale(stale, THRESHOLD)).thenReturn(true);

        // when
        int reaped = reaper.scan();

        // then
        assertThat(reaped).isEqualTo(1);
        verify(coordinator, times(1)).failIfStale(any(), anyLong());
    }

    @Test
    void scan_IDLE_워크플로는_제외() {
        // given
        registry.getOrCreate(EntityId.of("idle-1"), NOW - THRESHOLD * 2);

        // when
        int reaped = reaper.scan();

        // then
        assertThat(reaped).isZero();
        verify(coordinator, never()).failIfStale(any(), anyLong());
    }

    @Test
    void scan_배치_크기만큼만_처리() {
        // given
        reaper = new StalenessReaper(registry, coordinator, new ReaperConfig().withBatchSize(2), () -> NOW);
        for (int i = 0; i < 5; i++) {
            activeSince("stale-" + i, NOW - THRESHOLD - 1);
        }
        when(coordinator.failIfStale(any(), anyLong())).thenReturn(true);

        // when
        int reaped = reaper.scan();

        // then
        assertThat(reaped).isEqualTo(2);
        verify(coordinator, times(2)).failIfStale(any(), anyLong());
    }

    @Test
    void scan_개별_예외_발생해도_나머지_계속_처리() {
        // given
        Workflow broken = activeSince("broken", NOW - THRESHOLD - 1);
        Workflow healthy = activeSince("healthy", NOW - THRESHOLD - 1);
        when(coordinator.failIfStale(broken, THRESHOLD)).thenThrow(new IllegalStateException("boom"));
        when(coordinator.failIfStale(healthy, THRESHOLD)).thenReturn(true);

        // when
        int reaped = reaper.scan();

        // then
        assertThat(reaped).isEqualTo(1);
    }

    @Test
    void scan_버스_사용_불가는_전파() {
        // given
        Workflow stale = activeSince("stale-1", NOW - THRESHOLD - 1);
        when(coordinator.failIfStale(stale, THRESHOLD))
            .thenThrow(new MessageBusUnavailableException(Channel.SYSTEM_ERROR));

        // when & then
        assertThatThrownBy(() -> reaper.scan())
            .isInstanceOf(MessageBusUnavailableException.class);
    }

    @Test
    void 생성자_null_의존성_검증() {
        // when & then
        assertThatThrownBy(() -> new StalenessReaper(null, coordinator, new ReaperConfig(), () -> NOW))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("registry");
        assertThatThrownBy(() -> new StalenessReaper(registry, coordinator, null, () -> NOW))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("config");
    }
}
