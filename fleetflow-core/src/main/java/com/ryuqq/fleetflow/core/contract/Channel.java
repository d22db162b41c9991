package com.ryuqq.fleetflow.core.contract;

/**
 * 버스의 논리적 전달 지점.
 *
 * <p>채널은 처음 publish/subscribe 될 때 암묵적으로 생성되고 버스 수명 동안 유지됩니다.
 * 오케스트레이터와 협력 컴포넌트는 서로를 직접 참조하지 않고 채널 이름으로만 연결됩니다.</p>
 *
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>패턴: 소문자, 숫자, 점(.), 하이픈(-), 언더스코어(_)</li>
 * </ul>
 *
 * @author Fleetflow Team
 * @since 1.0.0
 */
public final class Channel {

    public static final Channel ANALYSIS_REQUEST = new Channel("analysis.request");
    public static final Channel ANALYSIS_RESULT = new Channel("analysis.result");
    public static final Channel ENGAGEMENT_REQUEST = new Channel("engagement.request");
    public static final Channel ENGAGEMENT_RESULT = new Channel("engagement.result");
    public static final Channel SCHEDULING_REQUEST = new Channel("scheduling.request");
    public static final Channel SCHEDULING_RESULT = new Channel("scheduling.result");
    public static final Channel SERVICE_COMPLETION = new Channel("service.completion");
    public static final Channel FEEDBACK_REQUEST = new Channel("feedback.request");
    public static final Channel FEEDBACK_RESULT = new Channel("feedback.result");

    /** 브로드캐스트 오류 채널. */
    public static final Channel SYSTEM_ERROR = new Channel("system.error");

    /** 데드라인 만료 알림 채널 (외부 모니터링 소비용). */
    public static final Channel SYSTEM_TIMEOUT = new Channel("system.timeout");

    /** 종료된 워크플로의 결과를 품질 리포팅으로 내보내는 채널. */
    public static final Channel QUALITY_INSIGHT = new Channel("quality.insight");

    private final String name;

    private Channel(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Channel name cannot be null or blank");
        }
        if (!name.matches("^[a-z0-9.\\-_]+$")) {
            throw new IllegalArgumentException("Channel name contains invalid characters: " + name);
        }
        this.name = name;
    }

    /**
     * Channel 생성.
     *
     * @param name 채널 이름 (예: "analysis.request")
     * @return Channel 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 이름인 경우
     */
    public static Channel of(String name) {
        return new Channel(name);
    }

    /**
     * 채널 이름 조회.
     *
     * @return 채널 이름
     */
    public String getName() {
        return name;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Channel channel = (Channel) o;
        return name.equals(channel.name);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    @Override
    public String toString() {
        return name;
    }
}
