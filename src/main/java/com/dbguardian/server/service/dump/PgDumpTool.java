package com.dbguardian.server.service.dump;

import com.dbguardian.server.exception.ValidationException;
import com.dbguardian.server.model.internal.CommandResult;
import com.dbguardian.server.model.internal.ConnectionParams;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.exec.CommandLine;
import org.apache.commons.exec.DefaultExecutor;
import org.apache.commons.exec.ExecuteException;
import org.apache.commons.exec.ExecuteResultHandler;
import org.apache.commons.exec.ExecuteWatchdog;
import org.apache.commons.exec.Executor;
import org.apache.commons.exec.PumpStreamHandler;
import org.apache.commons.exec.environment.EnvironmentUtils;
import org.apache.commons.lang3.ObjectUtils;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

@Slf4j
@Component
public class PgDumpTool implements DumpTool {

    private final String executable;

    private final long timeoutSec;

    @Autowired
    public PgDumpTool(
            @Value("${dbguardian.server.dump.executable:pg_dump}") String executable,
            @Value("${dbguardian.server.dump.timeoutSec:3600}") long timeoutSec) {
        this.executable = executable;
        this.timeoutSec = timeoutSec;
    }

    @Override
    public CompletableFuture<CommandResult> dump(ConnectionParams connectionParams, Path outputFile) {
        CompletableFuture<CommandResult> future = new CompletableFuture<>();
        CommandLine commandLine;
        Map<String, String> env;
        try {
            commandLine = this.buildCommandLine(connectionParams, outputFile);
            env = buildEnv(connectionParams);
        } catch (Exception e) {
            future.complete(CommandResult.failed(-1, "pg_dump failed before command exec. " + e.getMessage()));
            return future;
        }
        Executor executor = DefaultExecutor.builder().get();
        // 捕获 stdout/stderr, pg_dump 的 verbose 输出在 stderr
        ByteArrayOutputStream stdout = new ByteArrayOutputStream();
        ByteArrayOutputStream stderr = new ByteArrayOutputStream();
        executor.setStreamHandler(new PumpStreamHandler(stdout, stderr));
        executor.setWatchdog(ExecuteWatchdog.builder().setTimeout(Duration.ofSeconds(this.timeoutSec)).get());
        log.info("pg_dump {} on {}:{} into {}",
                connectionParams.getDatabase(), connectionParams.getHost(), connectionParams.getPort(), outputFile);
        try {
            executor.execute(commandLine, env, new ExecuteResultHandler() {
                @Override
                public void onProcessComplete(int exitCode) {
                    future.complete(CommandResult.success(exitCode, asString(stdout)));
                }

                @Override
                public void onProcessFailed(ExecuteException e) {
                    String error = asString(stderr);
                    if (StringUtils.isBlank(error)) {
                        error = e.getMessage();
                    }
                    future.complete(CommandResult.failed(e.getExitValue(), error));
                }
            });
        } catch (Exception e) {
            future.complete(CommandResult.failed(-1, "pg_dump failed before command exec. " + e.getMessage()));
        }
        return future;
    }

    CommandLine buildCommandLine(ConnectionParams connectionParams, Path outputFile) throws ValidationException {
        // 参数检查
        if (ObjectUtils.anyNull(connectionParams, outputFile)) {
            throw new ValidationException("buildCommandLine failed. connectionParams or outputFile is null");
        }
        if (StringUtils.isAnyBlank(
                connectionParams.getHost(), connectionParams.getDatabase(), connectionParams.getUsername())) {
            throw new ValidationException("buildCommandLine failed. host, database or username is blank. " +
                    "connectionParams is %s".formatted(connectionParams));
        }
        CommandLine commandLine = new CommandLine(this.executable);
        commandLine.addArgument("-h");
        commandLine.addArgument(connectionParams.getHost(), false);
        commandLine.addArgument("-p");
        commandLine.addArgument(String.valueOf(connectionParams.getPort()));
        commandLine.addArgument("-U");
        commandLine.addArgument(connectionParams.getUsername(), false);
        commandLine.addArgument("-d");
        commandLine.addArgument(connectionParams.getDatabase(), false);
        commandLine.addArgument("-f");
        commandLine.addArgument(outputFile.toAbsolutePath().toString(), false);
        commandLine.addArgument("--no-password");
        commandLine.addArgument("--format=custom");
        commandLine.addArgument("--compress=9");
        commandLine.addArgument("--verbose");
        return commandLine;
    }

    static Map<String, String> buildEnv(ConnectionParams connectionParams) throws IOException {
        Map<String, String> env = EnvironmentUtils.getProcEnvironment();
        if (connectionParams.getPassword() != null) {
            env.put("PGPASSWORD", connectionParams.getPassword());
        }
        return env;
    }

    private static String asString(ByteArrayOutputStream outputStream) {
        return outputStream.toString(StandardCharsets.UTF_8).trim();
    }
}
