package com.dbguardian.server.configuration;

import com.dbguardian.server.bus.ScheduleChangeListener;
import com.dbguardian.server.service.db.impl.SchemaInitService;
import com.dbguardian.server.service.scheduler.PeriodicDispatcher;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;

@Configuration
@Slf4j
public class ApplicationLifeCycleConfig {

    @Value("${spring.profiles.active:prod}")
    private String activeProfile;

    private final SchemaInitService schemaInitService;

    private final PeriodicDispatcher periodicDispatcher;

    private final ScheduleChangeListener scheduleChangeListener;

    @Autowired
    public ApplicationLifeCycleConfig(
            SchemaInitService schemaInitService,
            PeriodicDispatcher periodicDispatcher,
            ScheduleChangeListener scheduleChangeListener) {
        this.schemaInitService = schemaInitService;
        this.periodicDispatcher = periodicDispatcher;
        this.scheduleChangeListener = scheduleChangeListener;
    }

    @PostConstruct
    public void startUp() {
        log.info("Starting up {} environment", this.activeProfile);
        // schema 初始化失败则降级运行
        if (!this.schemaInitService.initWithRetry()) {
            log.warn("schema is not ready. schedules will load once the store is reachable");
        }
        // 启动时加载全部 schedule
        if (!this.periodicDispatcher.refresh()) {
            log.warn("initial schedule load failed. waiting for the next change notification");
        }
        // 启动 listener
        this.scheduleChangeListener.startListen();
    }

    @PreDestroy
    public void shutDown() {
        this.scheduleChangeListener.stopListen();
    }
}
