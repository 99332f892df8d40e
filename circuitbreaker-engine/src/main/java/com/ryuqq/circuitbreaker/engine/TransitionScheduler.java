package com.ryuqq.circuitbreaker.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 시간 기반 상태 전이 스케줄러.
 *
 * <p>OPEN → HALF_OPEN 자동 전이와 HALF_OPEN 최대 대기 시간 만료를 예약합니다.
 * Circuit Breaker 엔진이 사용하는 유일한 내부 스레드입니다.</p>
 *
 * <p><strong>스레드 모델:</strong></p>
 * <ul>
 *   <li>{@link #shared()}: JVM 전체에서 공유하는 단일 daemon 스레드 (첫 예약 시 시작)</li>
 *   <li>{@link #TransitionScheduler(ScheduledExecutorService)}: 호출자가 소유한 실행기 주입</li>
 * </ul>
 *
 * <p>예약된 작업이 예외를 던지면 로깅 후 버립니다. 다른 Circuit Breaker의 예약 작업에는 영향이 없습니다.</p>
 *
 * @author CircuitBreaker Team
 * @since 1.0.0
 */
public final class TransitionScheduler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(TransitionScheduler.class);

    private final ScheduledExecutorService executor;

    /**
     * 생성자.
     *
     * @param executor 예약 실행기
     * @throws IllegalArgumentException executor가 null인 경우
     */
    public TransitionScheduler(ScheduledExecutorService executor) {
        if (executor == null) {
            throw new IllegalArgumentException("executor cannot be null");
        }
        this.executor = executor;
    }

    /**
     * 공유 스케줄러.
     *
     * @return JVM 전체 공유 인스턴스
     */
    public static TransitionScheduler shared() {
        return SharedHolder.INSTANCE;
    }

    /**
     * 단일 daemon 스레드를 사용하는 새 스케줄러.
     *
     * @return 새 스케줄러 (사용 후 {@link #close()} 필요)
     */
    public static TransitionScheduler newDaemonScheduler() {
        return new TransitionScheduler(Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory()));
    }

    /**
     * 작업 예약.
     *
     * @param task 실행할 작업
     * @param delayMs 지연 시간 (밀리초)
     * @return 취소용 핸들
     * @throws IllegalArgumentException task가 null이거나 delayMs가 음수인 경우
     */
    public ScheduledFuture<?> schedule(Runnable task, long delayMs) {
        if (task == null) {
            throw new IllegalArgumentException("task cannot be null");
        }
        if (delayMs < 0) {
            throw new IllegalArgumentException("delayMs cannot be negative, but was: " + delayMs);
        }
        return executor.schedule(() -> runSafely(task), delayMs, TimeUnit.MILLISECONDS);
    }

    /**
     * 실행기 종료.
     *
     * <p>공유 스케줄러는 종료하지 않습니다.</p>
     */
    @Override
    public void close() {
        if (this == SharedHolder.INSTANCE) {
            return;
        }
        executor.shutdownNow();
    }

    private static void runSafely(Runnable task) {
        try {
            task.run();
        } catch (RuntimeException e) {
            log.error("Scheduled circuit breaker transition failed", e);
        }
    }

    private static final class SharedHolder {
        private static final TransitionScheduler INSTANCE = newDaemonScheduler();
    }

    private static final class DaemonThreadFactory implements ThreadFactory {
        private static final AtomicInteger SEQUENCE = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "circuitbreaker-transition-" + SEQUENCE.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
