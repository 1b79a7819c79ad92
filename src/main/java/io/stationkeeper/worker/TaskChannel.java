package io.stationkeeper.worker;

import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * One-way message channel from a task running off the worker thread (a child
 * process wrapper, a long computation) back to the worker that launched it.
 * The task posts heartbeats and exactly one terminal message.
 */
public final class TaskChannel<T> {
    private final ConcurrentLinkedQueue<TaskMessage<T>> queue = new ConcurrentLinkedQueue<>();
    private volatile Instant lastHeartbeat;
    private volatile TaskMessage<T> terminal;

    public void heartbeat() {
        Instant now = Instant.now();
        lastHeartbeat = now;
        queue.add(new TaskMessage.Heartbeat<>(now));
    }

    public synchronized void complete(T result) {
        finish(new TaskMessage.Result<>(result));
    }

    public synchronized void fail(String error) {
        finish(new TaskMessage.Failure<>(error));
    }

    private void finish(TaskMessage<T> message) {
        if (terminal != null) {
            throw new IllegalStateException("task already finished with " + terminal);
        }
        terminal = message;
        queue.add(message);
    }

    public boolean isFinished() {
        return terminal != null;
    }

    public Optional<TaskMessage<T>> terminal() {
        return Optional.ofNullable(terminal);
    }

    public Optional<Instant> lastHeartbeat() {
        return Optional.ofNullable(lastHeartbeat);
    }

    /**
     * Next pending message, oldest first.
     */
    public Optional<TaskMessage<T>> poll() {
        return Optional.ofNullable(queue.poll());
    }

    public interface TaskMessage<T> {
        record Heartbeat<T>(Instant at) implements TaskMessage<T> {
        }

        record Result<T>(T value) implements TaskMessage<T> {
        }

        record Failure<T>(String error) implements TaskMessage<T> {
        }
    }
}
