package queuesim.discipline;

import queuesim.packet.Packet;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.OptionalInt;

/**
 * Round robin over a fixed number of FIFO queues.
 *
 * A packet is placed in queue {@code id mod N}, independent of its flow. Selection scans
 * forward from the pointer for the first non-empty queue, serves its head, and moves the
 * pointer to the slot after the one served. Service is non-preemptive: the time quantum
 * is accepted but every packet runs to completion.
 *
 * With a capacity bound, arrivals are tail-dropped once the total across all queues is full.
 */
public class RoundRobinDiscipline extends AbstractQueueingDiscipline {

    private final int queueCount;
    private final double timeQuantum;
    private final List<Deque<Packet>> queues;
    private int pointer = 0;
    private int queued = 0;

    public RoundRobinDiscipline(int queueCount, double timeQuantum) {
        this(queueCount, timeQuantum, OptionalInt.empty());
    }

    public RoundRobinDiscipline(int queueCount, double timeQuantum, OptionalInt capacity) {
        super(DisciplineType.ROUND_ROBIN, capacity);
        if (queueCount <= 0) {
            throw new IllegalArgumentException("Queue count must be positive, got: " + queueCount);
        }
        if (!Double.isFinite(timeQuantum) || timeQuantum <= 0.0) {
            throw new IllegalArgumentException("Time quantum must be positive, got: " + timeQuantum);
        }
        this.queueCount = queueCount;
        this.timeQuantum = timeQuantum;
        this.queues = new ArrayList<>(queueCount);
        for (int i = 0; i < queueCount; i++) {
            queues.add(new ArrayDeque<>());
        }
    }

    public int queueCount() {
        return queueCount;
    }

    public double timeQuantum() {
        return timeQuantum;
    }

    /**
     * Number of packets currently held in the given queue.
     */
    public int queueSize(int index) {
        return queues.get(index).size();
    }

    /**
     * Index of the queue the next scan starts from.
     */
    public int pointer() {
        return pointer;
    }

    @Override
    protected boolean enqueue(Packet packet) {
        if (isFull()) {
            drop(packet);
            return false;
        }
        queues.get(Math.floorMod(packet.id(), queueCount)).addLast(packet);
        queued++;
        return true;
    }

    @Override
    protected Packet dequeueNext() {
        for (int attempt = 0; attempt < queueCount; attempt++) {
            int index = (pointer + attempt) % queueCount;
            Deque<Packet> queue = queues.get(index);
            if (!queue.isEmpty()) {
                pointer = (index + 1) % queueCount;
                queued--;
                return queue.pollFirst();
            }
        }
        return null;
    }

    @Override
    protected void clearQueues() {
        queues.forEach(Deque::clear);
        pointer = 0;
        queued = 0;
    }

    @Override
    public boolean isEmpty() {
        return queued == 0;
    }

    @Override
    public int size() {
        return queued;
    }
}
