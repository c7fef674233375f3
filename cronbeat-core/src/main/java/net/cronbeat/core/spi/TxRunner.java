package net.cronbeat.core.spi;

import java.util.concurrent.Callable;

public interface TxRunner {
    <T> T required(Callable<T> body) throws Exception;
    <T> T requiresNew(Callable<T> body) throws Exception;

    /** 트랜잭션 개념이 없는 저장소(인메모리 등)용 */
    static TxRunner direct() {
        return new TxRunner() {
            @Override public <T> T required(Callable<T> body) throws Exception { return body.call(); }
            @Override public <T> T requiresNew(Callable<T> body) throws Exception { return body.call(); }
        };
    }
}
