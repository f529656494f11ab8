package com.planmarshall.core.support;

import com.planmarshall.core.config.OrchestratorConfig;
import com.planmarshall.core.error.EscalationException;
import com.planmarshall.core.error.TransientException;
import com.planmarshall.core.model.Finding;
import com.planmarshall.core.model.Severity;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Wraps calls to external collaborators (extension handlers, executors, verifier, finalizer).
 * <p>
 * A {@link TransientException} or a timeout is retried once. A second failure is escalated as an
 * {@link EscalationException} carrying a blocker finding with source {@value #SOURCE}. Any other
 * exception propagates unchanged.
 */
@Component
public class ResilientInvoker {

    private static final Logger log = LoggerFactory.getLogger(ResilientInvoker.class);

    public static final String SOURCE = "orchestrator";
    private static final int MAX_ATTEMPTS = 2;

    private final Duration timeout;
    private final ExecutorService timeoutExecutor;

    @Autowired
    public ResilientInvoker(OrchestratorConfig config) {
        this(config.invocationTimeout());
    }

    public ResilientInvoker(Duration timeout) {
        this.timeout = timeout == null ? Duration.ZERO : timeout;
        this.timeoutExecutor = this.timeout.isZero() ? null : Executors.newCachedThreadPool(r -> {
            var thread = new Thread(r, "plan-invoker");
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * @param operation short name used in logs and the escalation rule, e.g. "execute"
     * @param domain    domain attached to the escalation finding, may be {@code null}
     * @param call      the external call
     * @throws EscalationException after the retry also failed transiently
     */
    public <T> T invoke(String operation, String domain, Supplier<T> call) {
        RuntimeException last = null;
        for (int attempt = 1; attempt <= MAX_ATTEMPTS; attempt++) {
            try {
                return attempt(call);
            } catch (TransientException e) {
                last = e;
                log.warn("{} failed transiently (attempt {}/{}): {}", operation, attempt, MAX_ATTEMPTS, e.getMessage());
            } catch (InvocationTimeoutException e) {
                last = e;
                log.warn("{} timed out after {} ms (attempt {}/{})", operation, timeout.toMillis(), attempt, MAX_ATTEMPTS);
            }
        }
        String message = operation + " failed after retry: " + last.getMessage();
        var finding = new Finding(null, SOURCE, "escalation/" + operation, null, null, Severity.BLOCKER,
                message, false, domain, null);
        log.error("Escalating {} as blocking finding {}", operation, finding.id());
        throw new EscalationException(message, finding, last);
    }

    /**
     * Interrupts calls still waiting on the timeout pool. Invocations after shutdown fail.
     */
    @PreDestroy
    public void shutdown() {
        if (timeoutExecutor != null) {
            int pending = timeoutExecutor.shutdownNow().size();
            log.info("Invoker pool stopped ({} queued call(s) dropped)", pending);
        }
    }

    public void run(String operation, String domain, Runnable call) {
        invoke(operation, domain, () -> {
            call.run();
            return null;
        });
    }

    private <T> T attempt(Supplier<T> call) {
        if (timeoutExecutor == null) {
            return call.get();
        }
        Map<String, String> mdc = MDC.getCopyOfContextMap();
        Future<T> future = timeoutExecutor.submit(() -> {
            if (mdc != null) MDC.setContextMap(mdc);
            try {
                return call.get();
            } finally {
                MDC.clear();
            }
        });
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new InvocationTimeoutException("no result within " + timeout.toMillis() + " ms");
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for external call", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re) throw re;
            if (cause instanceof Error err) throw err;
            throw new IllegalStateException(cause);
        }
    }

    private static final class InvocationTimeoutException extends RuntimeException {
        InvocationTimeoutException(String message) {
            super(message);
        }
    }
}
