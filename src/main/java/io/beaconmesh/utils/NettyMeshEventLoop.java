package io.beaconmesh.utils;

import io.netty.util.concurrent.DefaultEventExecutor;
import io.netty.util.concurrent.DefaultThreadFactory;
import io.netty.util.concurrent.EventExecutor;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * {@link MeshEventLoop} backed by a single threaded netty executor.
 */
@Slf4j
public class NettyMeshEventLoop implements MeshEventLoop {
    private final EventExecutor executor;

    public NettyMeshEventLoop() {
        this("beacon-mesh");
    }

    public NettyMeshEventLoop(String threadName) {
        this.executor = new DefaultEventExecutor(new DefaultThreadFactory(threadName, true));
    }

    @Override
    public void execute(Runnable task) {
        if (executor.isShuttingDown()) {
            log.debug("Event loop is shutting down, task dropped");
            return;
        }
        executor.execute(safe(task));
    }

    @Override
    public ScheduledTask schedule(Runnable task, Duration delay) {
        var future = executor.schedule(safe(task), delay.toMillis(), TimeUnit.MILLISECONDS);

        return new ScheduledTask() {
            @Override
            public boolean cancel() {
                return future.cancel(false);
            }

            @Override
            public boolean isDone() {
                return future.isDone();
            }
        };
    }

    @Override
    public boolean inEventLoop() {
        return executor.inEventLoop();
    }

    @Override
    public void shutdown() {
        executor.shutdownGracefully(0, 1, TimeUnit.SECONDS);
    }

    private static Runnable safe(Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (Exception e) {
                log.error("Error while execute task", e);
            }
        };
    }
}
