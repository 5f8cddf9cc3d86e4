package com.oraclex.relay.service;

import com.oraclex.relay.model.QueuedCommand;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.locks.ReentrantLock;

/**
 * FIFO of approved commands. Each command is handed to exactly one poller.
 */
@Service
@Slf4j
public class CommandQueue {

    private final ReentrantLock lock = new ReentrantLock();
    private final Deque<QueuedCommand> commands = new ArrayDeque<>();
    private final RelayMetrics metrics;

    public CommandQueue(RelayMetrics metrics) {
        this.metrics = metrics;
        metrics.gauge("relay_command_queue_depth", this::size);
    }

    public void push(QueuedCommand command) {
        lock.lock();
        try {
            commands.addLast(command);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes and returns the oldest command, or {@link QueuedCommand#NONE} when the
     * queue is empty.
     */
    public QueuedCommand popNext() {
        QueuedCommand next;
        lock.lock();
        try {
            next = commands.pollFirst();
        } finally {
            lock.unlock();
        }
        if (next == null) {
            return QueuedCommand.NONE;
        }
        metrics.recordCommandDispatched();
        log.info("Dispatching {} {} ({})", next.getAction(), next.getSymbol(), next.getCmdId());
        return next;
    }

    public int flush() {
        int cleared;
        lock.lock();
        try {
            cleared = commands.size();
            commands.clear();
        } finally {
            lock.unlock();
        }
        log.info("Command queue flushed, {} commands dropped", cleared);
        return cleared;
    }

    public int size() {
        lock.lock();
        try {
            return commands.size();
        } finally {
            lock.unlock();
        }
    }
}
