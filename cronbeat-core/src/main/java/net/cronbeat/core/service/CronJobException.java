package net.cronbeat.core.service;

/**
 * 루프에서 발생한 실패를 종류별로 감싼다. message 는 원인 메시지 그대로 (lastError 에 저장되는 값).
 */
public final class CronJobException extends RuntimeException {

    public enum Kind {
        /** 핸들러가 던졌거나 실패로 완료됨 (잡 단위) */
        HANDLER,
        /** 선점/갱신/삭제 실패 (인스턴스 단위) */
        STORE,
        /** 복구 상태 저장 자체가 실패 */
        RECOVERY
    }

    private final Kind kind;

    public CronJobException(Kind kind, Throwable cause) {
        super(messageOf(cause), cause);
        this.kind = kind;
    }

    public Kind kind() {
        return kind;
    }

    static String messageOf(Throwable t) {
        if (t == null) return "unknown error";
        String m = t.getMessage();
        return (m == null || m.isBlank()) ? t.getClass().getName() : m;
    }

    @Override
    public String toString() {
        return "CronJobException[" + kind + "]: " + getMessage();
    }
}
