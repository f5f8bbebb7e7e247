package me.golemcore.hindsight.testsupport;

import me.golemcore.hindsight.domain.model.ReasoningOutput;
import me.golemcore.hindsight.domain.model.ReasoningRequest;
import me.golemcore.hindsight.port.outbound.ReasoningPort;

import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

/**
 * Reasoning stub returning whatever the test scripted, and remembering the
 * last request.
 */
public class ScriptedReasoning implements ReasoningPort {

    private volatile Function<ReasoningRequest, ReasoningOutput> script = request -> ReasoningOutput.builder()
            .answer("no opinion")
            .build();
    private volatile ReasoningRequest lastRequest;

    public void answerWith(Function<ReasoningRequest, ReasoningOutput> script) {
        this.script = script;
    }

    public ReasoningRequest getLastRequest() {
        return lastRequest;
    }

    @Override
    public CompletableFuture<ReasoningOutput> reason(ReasoningRequest request) {
        lastRequest = request;
        try {
            return CompletableFuture.completedFuture(script.apply(request));
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }
}
