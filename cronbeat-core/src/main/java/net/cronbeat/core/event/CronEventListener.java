package net.cronbeat.core.event;

/**
 * 스케줄러 생명주기 알림 수신자. 스케줄링 결정에는 영향을 주지 않는다.
 */
public interface CronEventListener {

    /** 하트비트 1회가 끝날 때마다 (잡 유무와 무관) */
    default void onTickCompleted(TickEvent event) {}

    default void onJobError(JobErrorEvent event) {}
}
