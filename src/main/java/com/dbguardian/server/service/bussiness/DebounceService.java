package com.dbguardian.server.service.bussiness;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.ObjectUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;


@Slf4j
@Service
public class DebounceService {

    private final TaskScheduler generalTaskScheduler;

    private final Map<String, ScheduledFuture<?>> taskMap = new ConcurrentHashMap<>();

    @Autowired
    public DebounceService(@Qualifier("generalTaskScheduler") TaskScheduler generalTaskScheduler) {
        this.generalTaskScheduler = generalTaskScheduler;
    }

    public void debounce(String key, Runnable task, long delayMillis) {
        // 有重复的未执行的task则取消
        this.cancel(key);
        // 规划新的task
        ScheduledFuture<?> newTask = this.generalTaskScheduler.schedule(() -> {
            // 先移除自己, 执行期间到达的新 task 不会被覆盖
            this.taskMap.remove(key);
            try {
                task.run();
            } catch (Exception e) {
                log.warn("execute debounce task(key:{}, task:{}) failed", key, task, e);
            }
        }, Instant.now().plusMillis(delayMillis));
        // 新的task放进map中
        this.taskMap.put(key, newTask);
    }

    private void cancel(String key) {
        ScheduledFuture<?> existingTask = taskMap.remove(key);
        if (ObjectUtils.isNotEmpty(existingTask)) {
            existingTask.cancel(false);
        }
    }

    // 创建模块专用的Debounce服务
    public ModuleDebounceService forModule(String moduleName) {
        return new ModuleDebounceService(this, moduleName);
    }

    // 模块专用的Debounce包装器
    public static class ModuleDebounceService {

        private final DebounceService debounceService;

        private final String modulePrefix;

        public ModuleDebounceService(DebounceService debounceService, String moduleName) {
            this.debounceService = debounceService;
            this.modulePrefix = moduleName + "::";
        }

        public void debounce(String key, Runnable task, long delayMillis) {
            debounceService.debounce(modulePrefix + key, task, delayMillis);
        }
    }
}
