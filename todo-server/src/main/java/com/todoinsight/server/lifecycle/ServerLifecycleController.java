package com.todoinsight.server.lifecycle;

import com.todoinsight.server.persistence.TodoItemStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.SmartLifecycle;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicReference;

/**
 * 类说明 / Class Description:
 * 中文：服务生命周期控制器，按 STARTING → LISTENING → DRAINING → STOPPED 驱动持久化模块的初始化与释放。
 * English: Server lifecycle controller driving persistence init and teardown through
 * STARTING → LISTENING → DRAINING → STOPPED.
 *
 * 使用场景 / Use Cases:
 * 中文：phase 为 0，早于内嵌 Web 服务器启动、晚于其停止；init() 失败会使上下文刷新失败，端口永不绑定。
 * English: Phase 0 starts before the embedded web server and stops after it; a failing init() fails the
 * context refresh so the port is never bound.
 *
 * 设计目的 / Design Purpose:
 * 中文：SIGINT/SIGTERM 经 JVM 关闭钩子关闭上下文并调用 stop()；teardown 的结果被忽略。
 * English: SIGINT/SIGTERM close the context through the JVM shutdown hook, which calls stop(); the
 * teardown outcome is ignored.
 */
@Slf4j
@Component
public class ServerLifecycleController implements SmartLifecycle {

    static final int PHASE = 0;

    private final TodoItemStore store;
    private final AtomicReference<ServerState> state = new AtomicReference<>(ServerState.STARTING);
    private volatile boolean running = false;

    public ServerLifecycleController(TodoItemStore store) {
        this.store = store;
    }

    @Override
    public void start() {
        if (state.get() != ServerState.STARTING) {
            log.warn("Skipping persistence initialization, server is already {}", state.get());
            return;
        }
        log.info("Initializing persistence");
        store.init();
        running = true;
    }

    @EventListener
    public void onWebServerInitialized(WebServerInitializedEvent event) {
        if (state.compareAndSet(ServerState.STARTING, ServerState.LISTENING)) {
            log.info("Listening on port {}", event.getWebServer().getPort());
        }
    }

    @Override
    public void stop() {
        ServerState previous;
        do {
            previous = state.get();
            if (previous == ServerState.DRAINING || previous == ServerState.STOPPED) {
                return;
            }
        } while (!state.compareAndSet(previous, ServerState.DRAINING));
        log.info("Shutting down from {}, tearing down persistence", previous);
        try {
            store.teardown();
        } catch (RuntimeException e) {
            log.warn("Persistence teardown failed, continuing shutdown", e);
        } finally {
            running = false;
            state.set(ServerState.STOPPED);
            log.info("Server stopped");
        }
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public int getPhase() {
        return PHASE;
    }

    public ServerState currentState() {
        return state.get();
    }
}
