package net.cronbeat.core.spi;

import net.cronbeat.core.model.CronJob;
import net.cronbeat.core.model.CronState;
import net.cronbeat.core.model.JobCriterion;
import net.cronbeat.core.model.JobPatch;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * 잡 저장소 게이트웨이. 인스턴스 간 상호 배제는 {@link #claimNext} 하나로만 보장된다.
 */
public interface CronJobRepository {
    /**
     * 선점 가능한 잡 중 startAt 이 가장 이른 것 하나를 골라 같은 연산 안에서 locked/startedAt 을 세팅.
     * 동시에 여러 인스턴스가 호출해도 같은 잡을 두 번 돌려주지 않는다.
     */
    Optional<CronJob> claimNext(Instant now, List<JobCriterion> extra) throws Exception;

    void update(long id, JobPatch patch) throws Exception;

    void delete(long id) throws Exception;

    Optional<CronJob> findById(long id) throws Exception;

    Optional<CronJob> findByName(String name) throws Exception;

    List<CronJob> findAll(List<JobCriterion> criteria) throws Exception;

    /** 신규 저장. enabled/startAt 기본값을 채우고 interval 을 검증한다 */
    CronJob insert(CronJob job) throws Exception;

    /** name 기준 멱등 등록. 기존 잡이면 kind/payload/스케줄 정의만 갱신 (런타임 필드는 유지) */
    CronJob upsert(String name, String kind, String payload, CronState definition) throws Exception;

    /** startedAt 이 기준 시각 이전인 잠금 해제 (운영자 수동 복구용) */
    int unlockStale(Instant startedBefore) throws Exception;
}
