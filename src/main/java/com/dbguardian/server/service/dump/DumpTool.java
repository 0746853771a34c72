package com.dbguardian.server.service.dump;

import com.dbguardian.server.model.internal.CommandResult;
import com.dbguardian.server.model.internal.ConnectionParams;

import java.nio.file.Path;
import java.util.concurrent.CompletableFuture;

public interface DumpTool {

    /**
     * Dump one database into {@code outputFile}. The future always completes normally; a failed
     * run is reported through {@link CommandResult#isSuccess()}.
     */
    CompletableFuture<CommandResult> dump(ConnectionParams connectionParams, Path outputFile);
}
