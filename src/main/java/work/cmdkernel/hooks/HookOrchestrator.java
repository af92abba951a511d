package work.cmdkernel.hooks;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.cmdkernel.error.ExecutionFailedException;
import work.cmdkernel.model.HookPhase;
import work.cmdkernel.model.HookSpec;
import work.cmdkernel.runtime.CancellationToken;
import work.cmdkernel.runtime.DispatchCancelledException;
import work.cmdkernel.runtime.HandlerRegistry;
import work.cmdkernel.runtime.InvocationContext;
import work.cmdkernel.runtime.ResolvedInvocation;

/**
 * Runs before-hooks, the action, then after- or error-hooks for one resolved invocation.
 *
 * <p>Hooks of a phase run command-level first (outermost command first) and action-level last,
 * each group by ascending {@code order}. Every before-hook runs even after one cancels; the action
 * then does not run. A failure in a before-hook, the action or an after-hook enters the error
 * phase: if any error hook reports it handled, the outcome carries the mapped exit code, otherwise
 * {@link ExecutionFailedException} is thrown.</p>
 */
public final class HookOrchestrator {
    private static final Logger LOG = LoggerFactory.getLogger(HookOrchestrator.class);
    private static final long POLL_MILLIS = 50;

    private final HandlerRegistry registry;
    private final int failureExitCode;

    public HookOrchestrator(HandlerRegistry registry) {
        this(registry, 1);
    }

    public HookOrchestrator(HandlerRegistry registry, int failureExitCode) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.failureExitCode = failureExitCode;
    }

    public HookOutcome run(ResolvedInvocation invocation, CancellationToken token) {
        var cancellation = token == null ? new CancellationToken() : token;
        var data = new ConcurrentHashMap<String, Object>();
        var context = new HookContext(invocation, cancellation, data);

        // all ids resolve before any hook runs
        var handler = registry.requireAction(invocation.action().handlerId());
        var befores = new ArrayList<BeforeExecuteHook>();
        ordered(invocation, HookPhase.BEFORE).forEach(spec -> befores.add(registry.requireBeforeHook(spec.handlerId())));
        var afters = new ArrayList<AfterExecuteHook>();
        ordered(invocation, HookPhase.AFTER).forEach(spec -> afters.add(registry.requireAfterHook(spec.handlerId())));
        var errors = new ArrayList<ErrorHook>();
        ordered(invocation, HookPhase.ON_ERROR).forEach(spec -> errors.add(registry.requireErrorHook(spec.handlerId())));

        for (BeforeExecuteHook hook : befores) {
            try {
                var decision = hook.beforeExecute(context);
                if (decision != null && decision.cancelled()) {
                    LOG.debug("Before-hook cancelled '{}': {}", invocation.displayName(), decision.message());
                    context.recordCancellation(decision.message());
                }
            } catch (Exception ex) {
                if (isCancellation(ex, cancellation)) {
                    return cancelled(ex.getMessage());
                }
                LOG.warn("Before-hook failed for '{}': {}", invocation.displayName(), ex.toString());
                return handleFailure(context, errors, ex);
            }
        }
        if (context.isCancelled()) {
            return HookOutcome.cancelled(context.terminationReason(), context.cancellationMessages());
        }
        if (cancellation.isCancelled()) {
            return cancelled(null);
        }

        Object result;
        try {
            result = await(handler.invoke(new InvocationContext(invocation, cancellation, data), invocation.values()), cancellation);
        } catch (Exception ex) {
            if (isCancellation(ex, cancellation)) {
                return cancelled(ex.getMessage());
            }
            LOG.debug("Action '{}' failed: {}", invocation.displayName(), ex.toString());
            return handleFailure(context, errors, ex);
        }

        for (AfterExecuteHook hook : afters) {
            try {
                hook.afterExecute(context, result);
            } catch (Exception ex) {
                LOG.warn("After-hook failed for '{}': {}", invocation.displayName(), ex.toString());
                return handleFailure(context, errors, ex);
            }
        }
        return HookOutcome.completed(result);
    }

    static List<HookSpec> ordered(ResolvedInvocation invocation, HookPhase phase) {
        var byOrder = Comparator.comparingInt(HookSpec::order);
        var specs = new ArrayList<HookSpec>();
        for (var node : invocation.commandPath()) {
            node.hooks().stream().filter(hook -> hook.phase() == phase).sorted(byOrder).forEach(specs::add);
        }
        invocation.action().hooks().stream().filter(hook -> hook.phase() == phase).sorted(byOrder).forEach(specs::add);
        return specs;
    }

    private HookOutcome handleFailure(HookContext context, List<ErrorHook> errors, Exception failure) {
        var invocation = context.invocation();
        boolean handled = false;
        for (ErrorHook hook : errors) {
            try {
                if (hook.onError(context, failure)) {
                    handled = true;
                }
            } catch (Exception hookFailure) {
                var escaped = new ExecutionFailedException(invocation.displayName(), hookFailure);
                escaped.addSuppressed(failure);
                throw escaped;
            }
        }
        if (!handled) {
            throw new ExecutionFailedException(invocation.displayName(), failure);
        }
        int exitCode = ExitCodeResolver.resolve(failure, invocation.commandPath(), invocation.action(), failureExitCode);
        LOG.debug("Failure of '{}' handled, exit code {}", invocation.displayName(), exitCode);
        return HookOutcome.handled(exitCode, failure);
    }

    private static HookOutcome cancelled(String message) {
        var reason = message == null || message.isBlank() ? "Execution cancelled" : message;
        return HookOutcome.cancelled(reason, List.of(reason));
    }

    private static boolean isCancellation(Exception ex, CancellationToken token) {
        return token.isCancelled() && (ex instanceof DispatchCancelledException || ex instanceof CancellationException);
    }

    /**
     * Waits for an asynchronous action, polling the token so a cancellation stops the wait.
     */
    private static Object await(Object result, CancellationToken token) throws Exception {
        if (!(result instanceof CompletionStage<?> stage)) {
            return result;
        }
        var future = stage.toCompletableFuture();
        while (true) {
            if (token.isCancelled()) {
                future.cancel(true);
                throw new DispatchCancelledException("Execution cancelled");
            }
            try {
                return future.get(POLL_MILLIS, TimeUnit.MILLISECONDS);
            } catch (TimeoutException pending) {
                continue;
            } catch (ExecutionException | CompletionException ex) {
                throw unwrap(ex);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                token.cancel();
                throw new DispatchCancelledException("Execution interrupted");
            }
        }
    }

    private static Exception unwrap(Exception wrapper) {
        var cause = wrapper.getCause();
        while ((cause instanceof ExecutionException || cause instanceof CompletionException) && cause.getCause() != null) {
            cause = cause.getCause();
        }
        if (cause instanceof Error error) {
            throw error;
        }
        return cause instanceof Exception exception ? exception : wrapper;
    }
}
