package net.cronbeat.core.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArraySet;
import java.util.function.Consumer;

/**
 * 리스너 등록/해제와 이벤트 전달. 리스너 예외는 WARN 로그로 남기고 다음 리스너로 넘어간다.
 *
 * <pre>{@code
 * Subscription sub = scheduler.events().subscribe(new CronEventListener() {
 *     @Override public void onJobError(JobErrorEvent e) { alert(e.error()); }
 * });
 * ...
 * sub.unsubscribe();
 * }</pre>
 */
public final class CronEvents {
    private static final Logger log = LoggerFactory.getLogger(CronEvents.class);

    private final Set<CronEventListener> listeners = new CopyOnWriteArraySet<>();

    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    public Subscription subscribe(CronEventListener listener) {
        Objects.requireNonNull(listener, "listener must not be null");
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    public int listenerCount() {
        return listeners.size();
    }

    public void clear() {
        listeners.clear();
    }

    public void tickCompleted(TickEvent event) {
        dispatch(l -> l.onTickCompleted(event), "tick-completed");
    }

    public void jobError(JobErrorEvent event) {
        dispatch(l -> l.onJobError(event), "job-error");
    }

    private void dispatch(Consumer<CronEventListener> call, String type) {
        for (CronEventListener l : listeners) {
            try {
                call.accept(l);
            } catch (RuntimeException e) {
                log.warn("cron event listener {} failed on {}", l, type, e);
            }
        }
    }
}
