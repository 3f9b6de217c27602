package world.willfrog.agentrun.service;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.exception.ExceptionUtils;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import world.willfrog.agentrun.cache.ActiveRunRegistry;
import world.willfrog.agentrun.cache.ControlSignalBus;
import world.willfrog.agentrun.cache.ControlSubscription;
import world.willfrog.agentrun.cache.ResponseStreamStore;
import world.willfrog.agentrun.cache.RunLock;
import world.willfrog.agentrun.config.AgentRunProperties;
import world.willfrog.agentrun.config.InstanceIdentity;
import world.willfrog.agentrun.context.AgentRunContext;
import world.willfrog.agentrun.model.AgentRunOutcome;
import world.willfrog.agentrun.model.AgentRunRequest;
import world.willfrog.agentrun.model.AgentRunStatus;
import world.willfrog.agentrun.model.ControlSignal;
import world.willfrog.agentrun.model.RunKeys;
import world.willfrog.agentrun.model.UsageSummary;
import world.willfrog.agentrun.model.event.ResponseEvent;
import world.willfrog.agentrun.model.event.StatusEvent;
import world.willfrog.agentrun.producer.AgentResponseProducer;
import world.willfrog.agentrun.producer.AgentResponseStream;
import world.willfrog.agentrun.trace.NoOpRunTracer;
import world.willfrog.agentrun.trace.RunTrace;
import world.willfrog.agentrun.trace.RunTracer;
import world.willfrog.agentrun.trace.TraceLevel;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;

/**
 * 在集群中恰好执行一次某个 agent run。
 * <p>
 * 流程：
 * <ol>
 *   <li>抢占执行锁，抢不到说明其它实例在跑，直接返回</li>
 *   <li>写活跃标记、订阅实例与全局控制通道、启动 {@link StopSignalWatcher}</li>
 *   <li>驱动 producer，按产出顺序把事件写入共享响应列表</li>
 *   <li>确定终态，写入 agent_runs 并做用量汇总</li>
 *   <li>无论成功与否：发布终止信号，停 watcher，关订阅，设置响应列表过期，删活跃标记，释放锁</li>
 * </ol>
 * 执行中锁被其它实例接管时，本实例只停止转发并清理自己的订阅与活跃标记，
 * 不写终态、不汇总用量、不发终止信号、不释放锁。
 */
@Service
@Slf4j
public class AgentRunCoordinator {

    static final String COMPLETED_MESSAGE = "Agent run completed successfully";
    static final String STOPPED_MESSAGE = "Agent run stopped";

    private final RunLock runLock;
    private final ActiveRunRegistry activeRunRegistry;
    private final ControlSignalBus controlSignalBus;
    private final ResponseStreamStore responseStreamStore;
    private final AgentRunRecordWriter recordWriter;
    private final AgentRunFinalizer finalizer;
    private final AgentResponseProducer producer;
    private final RunTracer runTracer;
    private final AgentRunProperties properties;
    private final InstanceIdentity instanceIdentity;
    private final ExecutorService watcherExecutor;
    private final ExecutorService ioExecutor;
    private final Clock clock;

    public AgentRunCoordinator(RunLock runLock,
                               ActiveRunRegistry activeRunRegistry,
                               ControlSignalBus controlSignalBus,
                               ResponseStreamStore responseStreamStore,
                               AgentRunRecordWriter recordWriter,
                               AgentRunFinalizer finalizer,
                               AgentResponseProducer producer,
                               RunTracer runTracer,
                               AgentRunProperties properties,
                               InstanceIdentity instanceIdentity,
                               @Qualifier("agentRunWatcherExecutor") ExecutorService watcherExecutor,
                               @Qualifier("agentRunIoExecutor") ExecutorService ioExecutor,
                               Clock clock) {
        this.runLock = runLock;
        this.activeRunRegistry = activeRunRegistry;
        this.controlSignalBus = controlSignalBus;
        this.responseStreamStore = responseStreamStore;
        this.recordWriter = recordWriter;
        this.finalizer = finalizer;
        this.producer = producer;
        this.runTracer = runTracer;
        this.properties = properties;
        this.instanceIdentity = instanceIdentity;
        this.watcherExecutor = watcherExecutor;
        this.ioExecutor = ioExecutor;
        this.clock = clock;
    }

    public AgentRunOutcome run(AgentRunRequest request) {
        String runId = request.runId();
        String instanceId = instanceIdentity.get();
        if (!acquireLock(runId, instanceId)) {
            return AgentRunOutcome.skipped(runId);
        }

        AgentRunContext.bind(request);
        Instant startTime = clock.instant();
        log.info("Starting agent run: runId={}, threadId={}, instance={}, model={}",
                runId, request.threadId(), instanceId, request.modelName());

        RunTrace trace = startTrace(request);
        RunWriteQueue writes = new RunWriteQueue(runId, responseStreamStore, ioExecutor);
        List<ResponseEvent> relayed = Collections.synchronizedList(new ArrayList<>());
        ControlSubscription subscription = null;
        StopSignalWatcher watcher = null;
        AgentResponseStream stream = null;
        AgentRunStatus finalStatus = AgentRunStatus.FAILED;
        String error = null;
        UsageSummary usage = null;
        boolean finalized = false;
        boolean lockLost = false;
        try {
            markActive(instanceId, runId);
            subscription = controlSignalBus.subscribe(
                    RunKeys.instanceControlChannel(runId, instanceId),
                    RunKeys.globalControlChannel(runId));
            watcher = new StopSignalWatcher(runId, instanceId, subscription, runLock, activeRunRegistry,
                    properties.getControlPollInterval(), properties.getLockRefreshInterval(),
                    properties.getLockTtl(), clock);
            watcherExecutor.execute(AgentRunContext.propagate(watcher));

            stream = producer.start(request, trace);
            RelayResult result = relay(runId, stream, watcher, writes, relayed);
            finalStatus = result.status();
            error = result.error();
            if (watcher.isLockLost()) {
                // 锁已被其它实例接管：终态、用量和锁都留给新持有者
                lockLost = true;
                log.warn("Run lock taken over, leaving run state to the new owner: runId={}, instance={}, owner={}",
                        runId, instanceId, runLock.currentOwner(runId).orElse("<none>"));
                safeMark(trace, "agent_run_lock_lost", TraceLevel.WARNING, watcher.getStopReason());
            } else {
                if (finalStatus == AgentRunStatus.STOPPED) {
                    safeMark(trace, "agent_run_stopped", TraceLevel.WARNING, watcher.getStopReason());
                } else if (finalStatus == AgentRunStatus.COMPLETED) {
                    safeMark(trace, "agent_run_completed", TraceLevel.DEFAULT, null);
                }
                finalized = true;
                usage = complete(runId, finalStatus, error, startTime, request, writes, relayed);
            }
        } catch (Throwable e) {
            String message = StringUtils.defaultIfBlank(e.getMessage(), e.getClass().getSimpleName());
            log.error("Error in agent run after {}s: runId={}, instance={}",
                    elapsedSeconds(startTime), runId, instanceId, e);
            finalStatus = AgentRunStatus.FAILED;
            error = message + "\n" + ExceptionUtils.getStackTrace(e);
            safeMark(trace, "agent_run_failed", TraceLevel.ERROR, message);

            lockLost = watcher != null && watcher.isLockLost();
            if (!lockLost) {
                append(StatusEvent.of(StatusEvent.STATUS_ERROR, message), writes, relayed);
                if (!finalized) {
                    finalized = true;
                    usage = complete(runId, finalStatus, error, startTime, request, writes, relayed);
                }
            }
            if (e instanceof Error fatal) {
                throw fatal;
            }
        } finally {
            cleanup(runId, instanceId, finalStatus, lockLost, subscription, watcher, writes, stream);
            safeEnd(trace, finalStatus);
            log.info("Agent run background task fully completed: runId={}, instance={}, status={}",
                    runId, instanceId, finalStatus.wireName());
            AgentRunContext.clear();
        }
        return new AgentRunOutcome(runId, true, finalStatus, relayed.size(), error, usage);
    }

    private boolean acquireLock(String runId, String instanceId) {
        Duration ttl = properties.getLockTtl();
        if (runLock.acquire(runId, instanceId, ttl)) {
            return true;
        }
        Optional<String> owner = runLock.currentOwner(runId);
        if (owner.isPresent()) {
            log.info("Agent run is already being processed by another instance: runId={}, owner={}", runId, owner.get());
            return false;
        }
        // 锁在两次调用之间过期，重试一次
        if (runLock.acquire(runId, instanceId, ttl)) {
            return true;
        }
        log.info("Failed to acquire run lock, skipping: runId={}", runId);
        return false;
    }

    /**
     * 逐条转发 producer 事件，直到 producer 结束、给出终态或收到停止请求。
     * 停止标记在每条事件产出之后、转发之前检查。
     */
    private RelayResult relay(String runId,
                              AgentResponseStream stream,
                              StopSignalWatcher watcher,
                              RunWriteQueue writes,
                              List<ResponseEvent> relayed) {
        while (true) {
            if (watcher.isStopRequested()) {
                return stopped(runId, watcher, writes, relayed);
            }
            if (!stream.hasNext()) {
                break;
            }
            ResponseEvent event = stream.next();
            if (watcher.isStopRequested()) {
                return stopped(runId, watcher, writes, relayed);
            }
            append(event, writes, relayed);

            if (event instanceof StatusEvent status) {
                Optional<AgentRunStatus> terminal = status.terminalStatus();
                if (terminal.isPresent()) {
                    AgentRunStatus value = terminal.get();
                    log.info("Agent run finished via status message: runId={}, status={}", runId, value.wireName());
                    String error = value == AgentRunStatus.COMPLETED
                            ? null
                            : StringUtils.defaultIfBlank(status.message(), "Run ended with status: " + value.wireName());
                    return new RelayResult(value, error);
                }
            }
        }
        log.info("Agent run completed normally: runId={}, responses={}", runId, relayed.size());
        append(StatusEvent.of(AgentRunStatus.COMPLETED, COMPLETED_MESSAGE), writes, relayed);
        return new RelayResult(AgentRunStatus.COMPLETED, null);
    }

    private RelayResult stopped(String runId, StopSignalWatcher watcher, RunWriteQueue writes, List<ResponseEvent> relayed) {
        log.info("Agent run stopped: runId={}, reason={}", runId, watcher.getStopReason());
        if (!watcher.isLockLost()) {
            append(StatusEvent.of(AgentRunStatus.STOPPED, STOPPED_MESSAGE), writes, relayed);
        }
        return new RelayResult(AgentRunStatus.STOPPED, null);
    }

    private void append(ResponseEvent event, RunWriteQueue writes, List<ResponseEvent> relayed) {
        relayed.add(event);
        writes.submit(event);
    }

    /**
     * 写入终态并汇总用量。两步都不抛异常。
     */
    private UsageSummary complete(String runId,
                                  AgentRunStatus status,
                                  String error,
                                  Instant startTime,
                                  AgentRunRequest request,
                                  RunWriteQueue writes,
                                  List<ResponseEvent> relayed) {
        List<ResponseEvent> transcript = readTranscript(runId, writes, relayed);
        recordWriter.writeTerminal(runId, status, OffsetDateTime.now(clock), error, transcript);
        try {
            return finalizer.finalizeRun(runId, startTime, clock.instant(), request.reasoningMode(), transcript);
        } catch (Exception e) {
            log.error("Error during agent run finalization: runId={}", runId, e);
            return null;
        }
    }

    /**
     * 以共享响应列表为准；读取失败或不完整时退回本实例转发过的事件。
     */
    private List<ResponseEvent> readTranscript(String runId, RunWriteQueue writes, List<ResponseEvent> relayed) {
        List<ResponseEvent> local;
        synchronized (relayed) {
            local = List.copyOf(relayed);
        }
        if (!writes.awaitPending(properties.getPendingWriteTimeout())) {
            log.warn("Pending response writes not finished before status update: runId={}, pending={}",
                    runId, writes.pendingCount());
            return local;
        }
        try {
            List<ResponseEvent> stored = responseStreamStore.readAll(runId);
            if (stored.size() < local.size()) {
                log.warn("Shared response list shorter than relayed events: runId={}, stored={}, relayed={}",
                        runId, stored.size(), local.size());
                return local;
            }
            return stored;
        } catch (Exception e) {
            log.error("Failed to fetch responses from shared cache: runId={}", runId, e);
            return local;
        }
    }

    private void cleanup(String runId,
                         String instanceId,
                         AgentRunStatus finalStatus,
                         boolean lockLost,
                         ControlSubscription subscription,
                         StopSignalWatcher watcher,
                         RunWriteQueue writes,
                         AgentResponseStream stream) {
        ControlSignal signal = finalStatus.terminalSignal();
        if (!lockLost) {
            try {
                controlSignalBus.publish(RunKeys.globalControlChannel(runId), signal.payload());
                log.debug("Published final control signal {}: runId={}", signal, runId);
            } catch (Exception e) {
                log.warn("Failed to publish final control signal {}: runId={}", signal, runId, e);
            }
        }

        if (watcher != null) {
            watcher.cancel();
            try {
                if (!watcher.awaitTermination(properties.getWatcherStopTimeout())) {
                    log.warn("Stop signal watcher did not exit in time: runId={}", runId);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while waiting for stop signal watcher: runId={}", runId);
            }
        }

        if (subscription != null) {
            try {
                subscription.close();
            } catch (Exception e) {
                log.warn("Error closing control subscription: runId={}", runId, e);
            }
        }

        try {
            responseStreamStore.expire(runId, properties.getResponseListTtl());
        } catch (Exception e) {
            log.warn("Failed to set TTL on response list: runId={}", runId, e);
        }

        try {
            activeRunRegistry.clear(instanceId, runId);
        } catch (Exception e) {
            log.warn("Failed to clean up active run marker: runId={}", runId, e);
        }

        if (!lockLost) {
            try {
                runLock.release(runId);
            } catch (Exception e) {
                log.warn("Failed to release run lock: runId={}", runId, e);
            }
        }

        if (!writes.awaitPending(properties.getPendingWriteTimeout())) {
            log.warn("Timeout waiting for pending response writes: runId={}, pending={}", runId, writes.pendingCount());
        }

        if (stream != null) {
            try {
                stream.close();
            } catch (Exception e) {
                log.warn("Error closing producer stream: runId={}", runId, e);
            }
        }
    }

    private void markActive(String instanceId, String runId) {
        try {
            activeRunRegistry.markActive(instanceId, runId, properties.getLockTtl());
        } catch (Exception e) {
            log.warn("Failed to write active run marker: runId={}", runId, e);
        }
    }

    private RunTrace startTrace(AgentRunRequest request) {
        try {
            return runTracer.start(request);
        } catch (Exception e) {
            log.warn("Start run trace failed: runId={}", request.runId(), e);
            return NoOpRunTracer.NOOP_TRACE;
        }
    }

    private void safeMark(RunTrace trace, String name, TraceLevel level, String message) {
        try {
            trace.mark(name, level, message);
        } catch (Exception e) {
            log.debug("Trace mark failed: {}", name, e);
        }
    }

    private void safeEnd(RunTrace trace, AgentRunStatus status) {
        try {
            trace.end(status.wireName());
        } catch (Exception e) {
            log.debug("Trace end failed", e);
        }
    }

    private String elapsedSeconds(Instant startTime) {
        return String.format("%.2f", Duration.between(startTime, clock.instant()).toMillis() / 1000D);
    }

    private record RelayResult(AgentRunStatus status, String error) {
    }
}
