package io.beaconmesh.transport;

import io.beaconmesh.message.Message;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.collections4.queue.CircularFifoQueue;

import java.util.List;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

import static io.beaconmesh.constant.MeshConstant.OUTBOUND_QUEUE_CAPACITY;
import static java.util.Objects.nonNull;

/**
 * Messages waiting for a transmit slot. A send is never rejected: when full, the oldest message is dropped.
 */
@Slf4j
public class OutboundQueue {
    private final Lock lock = new ReentrantLock();
    private final CircularFifoQueue<Message> queue;

    public OutboundQueue() {
        this(OUTBOUND_QUEUE_CAPACITY);
    }

    public OutboundQueue(int capacity) {
        this.queue = new CircularFifoQueue<>(capacity);
    }

    /**
     * @return message dropped to make room, or null
     */
    public Message enqueue(@NonNull Message message) {
        Message evicted = null;
        lock.lock();
        try {
            if (queue.isAtFullCapacity()) {
                evicted = queue.poll();
            }
            queue.add(message);
        } finally {
            lock.unlock();
        }

        if (nonNull(evicted)) {
            log.warn("Outbound queue full, dropped message {} for #{}", evicted.getId(), evicted.getChannelId());
        }

        return evicted;
    }

    public boolean contains(String messageId) {
        lock.lock();
        try {
            return queue.stream().anyMatch(message -> message.getId().equals(messageId));
        } finally {
            lock.unlock();
        }
    }

    public Message dequeue() {
        lock.lock();
        try {
            return queue.poll();
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return queue.size();
        } finally {
            lock.unlock();
        }
    }

    public boolean isEmpty() {
        return size() == 0;
    }

    public List<Message> snapshot() {
        lock.lock();
        try {
            return List.copyOf(queue);
        } finally {
            lock.unlock();
        }
    }

    public void clear() {
        lock.lock();
        try {
            queue.clear();
        } finally {
            lock.unlock();
        }
    }
}
