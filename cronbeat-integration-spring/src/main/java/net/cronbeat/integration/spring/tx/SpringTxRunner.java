package net.cronbeat.integration.spring.tx;

import net.cronbeat.adapter.jdbc.TxContext;
import net.cronbeat.core.spi.TxRunner;
import org.springframework.jdbc.datasource.DataSourceUtils;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.sql.Connection;
import java.util.concurrent.Callable;

/**
 * 스프링 트랜잭션의 물리 커넥션을 {@link TxContext} 에 꽂아 JDBC 저장소가 그대로 쓰게 한다.
 */
public final class SpringTxRunner implements TxRunner {
    private final PlatformTransactionManager tm;
    private final DataSource ds;

    public SpringTxRunner(PlatformTransactionManager tm, DataSource ds) {
        this.tm = tm;
        this.ds = ds;
    }

    @Override
    public <T> T required(Callable<T> body) throws Exception {
        return execute(TransactionDefinition.PROPAGATION_REQUIRED, body);
    }

    @Override
    public <T> T requiresNew(Callable<T> body) throws Exception {
        return execute(TransactionDefinition.PROPAGATION_REQUIRES_NEW, body);
    }

    private <T> T execute(int propagation, Callable<T> body) throws Exception {
        var tpl = new TransactionTemplate(tm);
        tpl.setPropagationBehavior(propagation);

        try {
            return tpl.execute(status -> {
                Connection outer = TxContext.get();
                // REQUIRED 중첩 호출은 바깥 커넥션 그대로 사용
                if (outer != null && propagation == TransactionDefinition.PROPAGATION_REQUIRED) {
                    return call(body);
                }

                // REQUIRES_NEW 면 스프링이 바깥 트랜잭션을 정지하고 새 커넥션을 묶어 둔 상태
                Connection con = DataSourceUtils.getConnection(ds);
                try {
                    TxContext.set(con);
                    return call(body);
                } finally {
                    if (outer != null) TxContext.set(outer); else TxContext.clear();
                    DataSourceUtils.releaseConnection(con, ds); // 스프링이 관리하는 방식으로 반납
                }
            });
        } catch (CheckedBodyException e) {
            throw e.getCause();
        }
    }

    private static <T> T call(Callable<T> body) {
        try {
            return body.call();
        } catch (RuntimeException re) {
            throw re;
        } catch (Exception e) {
            // 롤백을 위해 일단 unchecked 로 감싸고, 템플릿 밖에서 원래 예외로 되돌린다
            throw new CheckedBodyException(e);
        }
    }

    private static final class CheckedBodyException extends RuntimeException {
        CheckedBodyException(Exception cause) { super(cause); }

        @Override
        public synchronized Exception getCause() { return (Exception) super.getCause(); }
    }
}
