package net.cronbeat.core.service;

import net.cronbeat.core.model.CronJob;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * 선점된 잡 하나를 처리하는 콜백. 비동기로 오래 걸려도 되고, 루프는 완료될 때까지 다음 하트비트를 미룬다.
 * 던진 예외와 실패로 완료된 stage 는 똑같이 취급된다. null 반환은 즉시 성공.
 */
@FunctionalInterface
public interface CronJobHandler {
    CompletionStage<?> handle(CronJob job) throws Exception;

    @FunctionalInterface
    interface Body {
        void run(CronJob job) throws Exception;
    }

    /** 블로킹 본문을 핸들러로 (스케줄러 스레드에서 그대로 실행) */
    static CronJobHandler sync(Body body) {
        return job -> {
            body.run(job);
            return CompletableFuture.completedFuture(null);
        };
    }
}
