package ca.gc.cra.sentinel.application.engine;

import ca.gc.cra.sentinel.application.analysis.AnalyzerRegistry;
import ca.gc.cra.sentinel.domain.task.AnalysisTask;
import ca.gc.cra.sentinel.domain.task.TaskId;
import ca.gc.cra.sentinel.domain.task.TaskResult;
import ca.gc.cra.sentinel.domain.worker.WorkerCommand;
import ca.gc.cra.sentinel.domain.worker.WorkerReply;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Callable;
import java.util.concurrent.LinkedBlockingQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Isolated execution unit that runs one analysis task at a time.
 * <p><strong>Why:</strong> Analyzers may be slow or misbehave; running each worker on its own thread
 * with private state confines the damage to the task in flight.</p>
 * <p><strong>Protocol:</strong> builds its analyzer registry, emits READY, then processes inbox
 * commands in FIFO order. A TASK yields RESULT or ERROR; SHUTDOWN yields SHUTDOWN_COMPLETE and ends
 * the loop, so later commands are never processed. An {@link Error} thrown by an analyzer ends the
 * worker; the coordinator sees it as a crash through {@link WorkerChannel#onExit}.</p>
 * <p><strong>Thread-safety:</strong> {@link #deliver} may be called from any thread; everything else
 * runs on the worker thread.</p>
 *
 * @since 0.1.0
 */
public final class AnalysisWorker implements Runnable {
  private static final Logger log = LoggerFactory.getLogger(AnalysisWorker.class);
  static final String MDC_WORKER_ID = "workerId";
  static final String MDC_TASK_ID = "taskId";

  private final int workerId;
  private final Callable<AnalyzerRegistry> setup;
  private final WorkerChannel channel;
  private final BlockingQueue<WorkerCommand> inbox = new LinkedBlockingQueue<>();

  /**
   * Creates a worker.
   *
   * @param workerId identifier unique within the owning pool
   * @param setup one-time setup producing the worker's private analyzer registry
   * @param channel outbound channel to the coordinator
   */
  public AnalysisWorker(int workerId, Callable<AnalyzerRegistry> setup, WorkerChannel channel) {
    this.workerId = workerId;
    this.setup = Objects.requireNonNull(setup, "setup");
    this.channel = Objects.requireNonNull(channel, "channel");
  }

  public int workerId() {
    return workerId;
  }

  /**
   * Appends a command to the worker's inbox.
   *
   * @param command command to process after every previously delivered command
   */
  public void deliver(WorkerCommand command) {
    inbox.add(Objects.requireNonNull(command, "command"));
  }

  @Override
  public void run() {
    MDC.put(MDC_WORKER_ID, Integer.toString(workerId));
    Throwable failure = null;
    try {
      AnalyzerRegistry registry = setup.call();
      log.debug("Worker {} ready", workerId);
      channel.onReply(WorkerReply.ready(workerId));
      processInbox(Objects.requireNonNull(registry, "registry"));
    } catch (InterruptedException interrupted) {
      Thread.currentThread().interrupt();
      log.debug("Worker {} interrupted", workerId);
    } catch (Exception setupFailure) {
      failure = setupFailure;
      log.error("Worker {} failed during setup", workerId, setupFailure);
    } catch (Error fatal) {
      failure = fatal;
      log.error("Worker {} terminated by fatal error", workerId, fatal);
      throw fatal;
    } finally {
      MDC.remove(MDC_TASK_ID);
      MDC.remove(MDC_WORKER_ID);
      channel.onExit(workerId, failure);
    }
  }

  private void processInbox(AnalyzerRegistry registry) throws InterruptedException {
    while (true) {
      WorkerCommand command = inbox.take();
      switch (command.type()) {
        case TASK -> execute(registry, command.task());
        case SHUTDOWN -> {
          log.debug("Worker {} shutting down", workerId);
          channel.onReply(WorkerReply.shutdownComplete(workerId));
          return;
        }
      }
    }
  }

  private void execute(AnalyzerRegistry registry, AnalysisTask task) throws InterruptedException {
    TaskId taskId = task.id();
    MDC.put(MDC_TASK_ID, taskId.value());
    try {
      TaskResult result = registry.run(task);
      channel.onReply(WorkerReply.result(workerId, taskId, result));
    } catch (InterruptedException interrupted) {
      throw interrupted;
    } catch (Exception ex) {
      log.warn("Analyzer {} failed for {}: {}", task.analyzerName(), task.filePath(), ex.toString());
      channel.onReply(WorkerReply.error(workerId, taskId, describe(ex)));
    } finally {
      MDC.remove(MDC_TASK_ID);
    }
  }

  private static String describe(Exception ex) {
    String message = ex.getMessage();
    return message == null || message.isBlank() ? ex.getClass().getSimpleName() : message;
  }
}
