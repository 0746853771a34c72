package com.dbguardian.server.bus;

import com.dbguardian.server.exception.DbGuardianException;
import com.dbguardian.server.model.internal.ScheduleChangeEvent;
import com.dbguardian.server.service.bussiness.DebounceService;
import com.dbguardian.server.service.scheduler.PeriodicDispatcher;
import com.dbguardian.server.util.JsonUtil;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.collections4.CollectionUtils;
import org.apache.commons.lang3.ObjectUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Long-lived subscriber on the schedule change channel. Every valid change event asks the
 * dispatcher to refresh; bursts inside the debounce window collapse into one refresh.
 */
@Component
@Slf4j
public class ScheduleChangeListener {

    private static final String REFRESH_KEY = "refresh";

    private final ScheduleChangeChannel scheduleChangeChannel;

    private final PeriodicDispatcher periodicDispatcher;

    private final DebounceService.ModuleDebounceService moduleDebounceService;

    private final long backoffMillis;

    private final long keepaliveMillis;

    private final long refreshDebounceMillis;

    private final AtomicBoolean running = new AtomicBoolean(false);

    private volatile Thread listenThread;

    private volatile ScheduleChangeChannel.Subscription currentSubscription;

    @Autowired
    public ScheduleChangeListener(
            ScheduleChangeChannel scheduleChangeChannel,
            PeriodicDispatcher periodicDispatcher,
            DebounceService debounceService,
            @Value("${dbguardian.server.listener.backoffMillis:5000}") long backoffMillis,
            @Value("${dbguardian.server.listener.keepaliveMillis:60000}") long keepaliveMillis,
            @Value("${dbguardian.server.listener.refreshDebounceMillis:500}") long refreshDebounceMillis) {
        this.scheduleChangeChannel = scheduleChangeChannel;
        this.periodicDispatcher = periodicDispatcher;
        this.moduleDebounceService = debounceService.forModule(ScheduleChangeListener.class.getSimpleName());
        this.backoffMillis = backoffMillis;
        this.keepaliveMillis = keepaliveMillis;
        this.refreshDebounceMillis = refreshDebounceMillis;
    }

    public void startListen() {
        if (!this.running.compareAndSet(false, true)) {
            log.debug("schedule change listener is already running");
            return;
        }
        // 起一个固定线程, 监听 channel
        Thread thread = new Thread(this::listenLoop, "Schedule-Change-Listener");
        thread.setDaemon(true);
        this.listenThread = thread;
        thread.start();
    }

    public void stopListen() {
        if (!this.running.compareAndSet(true, false)) {
            return;
        }
        Thread thread = this.listenThread;
        if (thread != null) {
            thread.interrupt();
        }
        ScheduleChangeChannel.Subscription subscription = this.currentSubscription;
        if (subscription != null) {
            subscription.close();
        }
        log.info("Schedule Change Listener Stop");
    }

    public boolean isRunning() {
        return this.running.get();
    }

    private void listenLoop() {
        log.info("Schedule Change Listener Start");
        while (this.running.get() && !Thread.currentThread().isInterrupted()) {
            try (ScheduleChangeChannel.Subscription subscription = this.scheduleChangeChannel.subscribe()) {
                this.currentSubscription = subscription;
                log.info("subscribed to {}", ScheduleChangeChannel.CHANNEL_NAME);
                while (this.running.get() && !Thread.currentThread().isInterrupted()) {
                    List<String> payloads = subscription.poll(this.keepaliveMillis);
                    if (CollectionUtils.isEmpty(payloads)) {
                        subscription.ping();
                        continue;
                    }
                    for (String payload : payloads) {
                        // 单条 payload 出错不影响订阅
                        try {
                            this.handlePayload(payload);
                        } catch (Exception e) {
                            log.warn("handle schedule change payload failed: {}", payload, e);
                        }
                    }
                }
            } catch (Exception e) {
                if (!this.running.get()) {
                    break;
                }
                log.warn("schedule change subscription lost. resubscribe in {} ms", this.backoffMillis, e);
                try {
                    Thread.sleep(this.backoffMillis);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                }
            } finally {
                this.currentSubscription = null;
            }
        }
        log.info("Schedule Change Listener exit");
    }

    void handlePayload(String payload) {
        ScheduleChangeEvent event;
        try {
            event = JsonUtil.parseJsonDocument(payload, ScheduleChangeEvent.class);
        } catch (DbGuardianException e) {
            log.warn("ignore malformed schedule change payload: {}", payload, e);
            return;
        }
        if (event == null || ObjectUtils.anyNull(event.getAction(), event.getScheduleId())) {
            log.warn("ignore schedule change without action or schedule id: {}", payload);
            return;
        }
        log.debug("receive schedule change: {}", event);
        if (this.refreshDebounceMillis <= 0) {
            this.refreshDispatcher();
            return;
        }
        this.moduleDebounceService.debounce(REFRESH_KEY, this::refreshDispatcher, this.refreshDebounceMillis);
    }

    private void refreshDispatcher() {
        try {
            if (!this.periodicDispatcher.refresh()) {
                log.warn("dispatcher refresh after schedule change failed, previous triggers kept");
            }
        } catch (Exception e) {
            log.error("dispatcher refresh after schedule change threw", e);
        }
    }
}
