package world.willfrog.agentrun.service;

import lombok.extern.slf4j.Slf4j;
import world.willfrog.agentrun.cache.ActiveRunRegistry;
import world.willfrog.agentrun.cache.ControlSubscription;
import world.willfrog.agentrun.cache.RunLock;
import world.willfrog.agentrun.model.ControlSignal;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 每个执行中的 run 一个 watcher：按短超时轮询控制通道，收到 STOP 即置停止标记；
 * 同一个循环里按间隔续期执行锁和活跃标记。续期时发现锁已不属于本实例，也会请求停止。
 */
@Slf4j
public class StopSignalWatcher implements Runnable {

    private final String runId;
    private final String instanceId;
    private final ControlSubscription subscription;
    private final RunLock runLock;
    private final ActiveRunRegistry activeRunRegistry;
    private final Duration pollInterval;
    private final Duration refreshInterval;
    private final Duration leaseTtl;
    private final Clock clock;

    private final AtomicBoolean stopRequested = new AtomicBoolean(false);
    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final AtomicBoolean lockLost = new AtomicBoolean(false);
    private final CountDownLatch finished = new CountDownLatch(1);
    private volatile String stopReason;

    public StopSignalWatcher(String runId,
                             String instanceId,
                             ControlSubscription subscription,
                             RunLock runLock,
                             ActiveRunRegistry activeRunRegistry,
                             Duration pollInterval,
                             Duration refreshInterval,
                             Duration leaseTtl,
                             Clock clock) {
        this.runId = runId;
        this.instanceId = instanceId;
        this.subscription = subscription;
        this.runLock = runLock;
        this.activeRunRegistry = activeRunRegistry;
        this.pollInterval = pollInterval;
        this.refreshInterval = refreshInterval;
        this.leaseTtl = leaseTtl;
        this.clock = clock;
    }

    @Override
    public void run() {
        Instant nextRefresh = clock.instant().plus(refreshInterval);
        try {
            while (!cancelled.get() && !stopRequested.get()) {
                Optional<String> message = subscription.receive(pollInterval);
                if (message.isPresent() && handle(message.get())) {
                    break;
                }
                if (!clock.instant().isBefore(nextRefresh)) {
                    refreshLeases();
                    nextRefresh = clock.instant().plus(refreshInterval);
                }
            }
        } catch (InterruptedException e) {
            if (!cancelled.get()) {
                requestStop("watcher interrupted");
            }
            Thread.currentThread().interrupt();
        } catch (Exception e) {
            log.error("Stop signal watcher failed, stopping run: runId={}", runId, e);
            requestStop("watcher failed: " + e.getMessage());
        } finally {
            finished.countDown();
        }
    }

    private boolean handle(String payload) {
        Optional<ControlSignal> signal = ControlSignal.parse(payload);
        if (signal.isEmpty()) {
            log.debug("Ignore unknown control message: runId={}, payload={}", runId, payload);
            return false;
        }
        if (signal.get() == ControlSignal.STOP) {
            log.info("Received STOP signal: runId={}, instance={}", runId, instanceId);
            requestStop("STOP signal");
            return true;
        }
        // END_STREAM / ERROR 由本 run 结束时自己发出
        log.debug("Ignore control signal {}: runId={}", signal.get(), runId);
        return false;
    }

    private void refreshLeases() {
        try {
            if (!runLock.refresh(runId, instanceId, leaseTtl)) {
                log.warn("Run lock no longer held by this instance, stopping run: runId={}, instance={}, owner={}",
                        runId, instanceId, runLock.currentOwner(runId).orElse("<none>"));
                lockLost.set(true);
                requestStop("lock lost");
                return;
            }
        } catch (Exception e) {
            log.warn("Refresh run lock failed: runId={}", runId, e);
        }
        try {
            activeRunRegistry.refresh(instanceId, runId, leaseTtl);
        } catch (Exception e) {
            log.warn("Refresh active run marker failed: runId={}", runId, e);
        }
    }

    public void requestStop(String reason) {
        if (stopRequested.compareAndSet(false, true)) {
            stopReason = reason;
        }
    }

    public boolean isStopRequested() {
        return stopRequested.get();
    }

    /**
     * 续期时发现执行锁已归其它实例。此时 run 的终态与锁都由新持有者负责。
     */
    public boolean isLockLost() {
        return lockLost.get();
    }

    public String getStopReason() {
        return stopReason;
    }

    public void cancel() {
        cancelled.set(true);
    }

    /**
     * 等待 watcher 循环退出，最长一个轮询周期加上 timeout。
     */
    public boolean awaitTermination(Duration timeout) throws InterruptedException {
        return finished.await(timeout.plus(pollInterval).toMillis(), TimeUnit.MILLISECONDS);
    }
}
