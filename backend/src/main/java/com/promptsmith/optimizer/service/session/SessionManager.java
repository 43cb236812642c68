package com.promptsmith.optimizer.service.session;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;

import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Service;

import com.promptsmith.optimizer.exception.ErrorKind;
import com.promptsmith.optimizer.exception.OperationCancelledException;
import com.promptsmith.optimizer.exception.OptimizerException;
import com.promptsmith.optimizer.exception.SessionNotFoundException;
import com.promptsmith.optimizer.service.config.TaskConfig;
import com.promptsmith.optimizer.service.execution.CancellationToken;

import lombok.extern.slf4j.Slf4j;

/**
 * Registry of live sessions. Passes on one session are serialized by the session's lock and run
 * on the orchestration executor; passes on different sessions run in parallel.
 */
@Slf4j
@Service
public class SessionManager {

  static final String MDC_SESSION_ID = "sessionId";

  private final Map<String, OptimizationSession> sessions = new ConcurrentHashMap<>();
  private final ExecutorService orchestrationExecutor;
  private final Clock clock;

  @Autowired
  public SessionManager(
      @Qualifier("orchestrationExecutor") ThreadPoolTaskExecutor orchestrationExecutor) {
    this(orchestrationExecutor.getThreadPoolExecutor(), Clock.systemUTC());
  }

  SessionManager(ExecutorService orchestrationExecutor, Clock clock) {
    this.orchestrationExecutor = orchestrationExecutor;
    this.clock = clock;
  }

  public OptimizationSession create(String sessionId, String initialHumanInput, TaskConfig config) {
    OptimizationSession session =
        new OptimizationSession(sessionId, initialHumanInput, config, clock);
    if (sessions.putIfAbsent(sessionId, session) != null) {
      throw new OptimizerException(ErrorKind.INTERNAL, "Session " + sessionId + " already exists");
    }
    session.record(
        SessionEventType.SESSION_START,
        Map.of("initialInput", initialHumanInput == null ? "" : initialHumanInput));
    log.info("Created session {}", sessionId);
    return session;
  }

  public Optional<OptimizationSession> get(String sessionId) {
    return sessionId == null ? Optional.empty() : Optional.ofNullable(sessions.get(sessionId));
  }

  public OptimizationSession require(String sessionId) {
    return get(sessionId).orElseThrow(() -> new SessionNotFoundException(sessionId));
  }

  public List<OptimizationSession> list() {
    List<OptimizationSession> all = new ArrayList<>(sessions.values());
    all.sort(Comparator.comparing(OptimizationSession::getCreatedAt));
    return all;
  }

  /**
   * Runs {@code pass} on the orchestration executor while holding the session's lock and waits
   * for its result. The lock is taken on the calling thread, so passes queued behind a busy
   * session never occupy an executor worker. Exceptions thrown by the pass are rethrown; a pass
   * cancelled by {@link #discard} ends in {@link OperationCancelledException}.
   */
  public <T> T runExclusive(String sessionId, Function<CancellationToken, T> pass) {
    return runExclusive(require(sessionId), pass);
  }

  <T> T runExclusive(OptimizationSession session, Function<CancellationToken, T> pass) {
    String sessionId = session.getSessionId();
    CancellationToken token = new CancellationToken();
    OptimizationSession.InFlightPass handle = new OptimizationSession.InFlightPass(token);
    session.register(handle);
    try {
      // a discard between lookup and register finds nothing to cancel
      if (session.isDiscarded()) {
        token.cancel("Session " + sessionId + " was discarded");
      }
      acquire(session, token);
      try {
        token.throwIfCancelled();
        return submitAndAwait(session, token, handle, pass);
      } finally {
        session.getPassLock().unlock();
      }
    } finally {
      session.unregister(handle);
    }
  }

  private void acquire(OptimizationSession session, CancellationToken token) {
    try {
      session.getPassLock().lockInterruptibly();
    } catch (InterruptedException e) {
      token.cancel("Caller interrupted");
      Thread.currentThread().interrupt();
      throw new OperationCancelledException("Interrupted while waiting for the session");
    }
  }

  private <T> T submitAndAwait(
      OptimizationSession session,
      CancellationToken token,
      OptimizationSession.InFlightPass handle,
      Function<CancellationToken, T> pass) {
    String sessionId = session.getSessionId();
    Map<String, String> mdc = MDC.getCopyOfContextMap();
    // claimed by whichever side comes first: the worker to run, or the caller to abandon
    AtomicBoolean claimed = new AtomicBoolean();
    CountDownLatch finished = new CountDownLatch(1);

    Future<T> future =
        orchestrationExecutor.submit(
            () -> {
              if (claimed.getAndSet(true)) {
                throw new OperationCancelledException("Pass abandoned before it started");
              }
              if (mdc != null) {
                MDC.setContextMap(mdc);
              }
              MDC.put(MDC_SESSION_ID, sessionId);
              try {
                token.throwIfCancelled();
                log.debug("Pass started on session {}", sessionId);
                return pass.apply(token);
              } finally {
                MDC.clear();
                finished.countDown();
              }
            });
    handle.attach(future);
    if (token.isCancelled()) {
      future.cancel(true);
    }
    try {
      return await(future, token);
    } finally {
      // the lock is released only once the worker has left the pass
      if (claimed.getAndSet(true)) {
        awaitUninterruptibly(finished);
      }
    }
  }

  private static void awaitUninterruptibly(CountDownLatch latch) {
    boolean interrupted = false;
    while (true) {
      try {
        latch.await();
        break;
      } catch (InterruptedException e) {
        interrupted = true;
      }
    }
    if (interrupted) {
      Thread.currentThread().interrupt();
    }
  }

  private <T> T await(Future<T> future, CancellationToken token) {
    try {
      return future.get();
    } catch (CancellationException e) {
      throw new OperationCancelledException(
          token.getReason() != null ? token.getReason() : "Pass cancelled");
    } catch (InterruptedException e) {
      token.cancel("Caller interrupted");
      future.cancel(true);
      Thread.currentThread().interrupt();
      throw new OperationCancelledException("Interrupted while waiting for the pass");
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof RuntimeException) {
        throw (RuntimeException) cause;
      }
      if (cause instanceof Error) {
        throw (Error) cause;
      }
      throw new OptimizerException(ErrorKind.INTERNAL, cause.getMessage(), cause);
    }
  }

  /**
   * Removes the session and cancels its queued and running passes.
   *
   * @throws SessionNotFoundException when the session does not exist
   */
  public OptimizationSession discard(String sessionId) {
    OptimizationSession session = sessions.remove(sessionId);
    if (session == null) {
      throw new SessionNotFoundException(sessionId);
    }
    session.markDiscarded();
    int cancelled = session.cancelPasses("Session " + sessionId + " was discarded");
    session.record(SessionEventType.SESSION_DISCARDED, Map.of("cancelledPasses", cancelled));
    log.info("Discarded session {} ({} passes cancelled)", sessionId, cancelled);
    return session;
  }
}
