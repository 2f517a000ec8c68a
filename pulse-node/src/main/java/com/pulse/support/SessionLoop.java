package com.pulse.support;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 방 세션 하나의 모든 상태 변경을 직렬화하는 단일 스레드 루프.
 * 버스/트랜스포트 콜백과 공개 API 호출은 모두 이 루프 위에서 실행된다.
 */
public class SessionLoop implements Executor, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SessionLoop.class);

    private final String name;
    private final ScheduledExecutorService scheduler;
    private volatile Thread loopThread;

    public SessionLoop(String name) {
        this.name = name;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r);
            t.setDaemon(true);
            t.setName(name + "-loop");
            loopThread = t;
            return t;
        });
    }

    public String getName() {
        return name;
    }

    public boolean inLoop() {
        return Thread.currentThread() == loopThread;
    }

    /**
     * 작업을 루프에 넣는다. 작업의 예외는 로그로 남기고 루프는 계속 돈다.
     */
    @Override
    public void execute(Runnable task) {
        try {
            scheduler.execute(guarded(task));
        } catch (RejectedExecutionException ex) {
            log.debug("Loop {} closed, dropping task", name);
        }
    }

    /**
     * 루프 위에서 작업을 실행하고 결과를 기다린다. 이미 루프 스레드라면 바로 실행한다.
     * 작업이 던진 런타임 예외는 그대로 다시 던진다.
     */
    public <T> T call(Callable<T> task) {
        if (inLoop()) {
            return invoke(task);
        }
        Future<T> future;
        try {
            future = scheduler.submit(() -> invoke(task));
        } catch (RejectedExecutionException ex) {
            throw new IllegalStateException("Session loop " + name + " is closed", ex);
        }
        try {
            return future.get();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new IllegalStateException("Interrupted while waiting on loop " + name, ex);
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new IllegalStateException(cause);
        }
    }

    public void run(Runnable task) {
        call(() -> {
            task.run();
            return null;
        });
    }

    public ScheduledFuture<?> schedule(Runnable task, Duration delay) {
        try {
            return scheduler.schedule(guarded(task), delay.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException ex) {
            log.debug("Loop {} closed, dropping scheduled task", name);
            return null;
        }
    }

    public boolean isClosed() {
        return scheduler.isShutdown();
    }

    @Override
    public void close() {
        scheduler.shutdownNow();
    }

    private Runnable guarded(Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (RuntimeException ex) {
                log.error("Task on loop {} failed", name, ex);
            }
        };
    }

    private static <T> T invoke(Callable<T> task) {
        try {
            return task.call();
        } catch (RuntimeException ex) {
            throw ex;
        } catch (Exception ex) {
            throw new IllegalStateException(ex);
        }
    }
}
