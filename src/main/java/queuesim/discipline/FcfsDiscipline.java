package queuesim.discipline;

import queuesim.packet.Packet;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.OptionalInt;

/**
 * First-come, first-served: a single FIFO queue with tail-drop when full.
 */
public class FcfsDiscipline extends AbstractQueueingDiscipline {

    private final Deque<Packet> queue = new ArrayDeque<>();

    public FcfsDiscipline() {
        this(OptionalInt.empty());
    }

    public FcfsDiscipline(int capacity) {
        this(OptionalInt.of(capacity));
    }

    public FcfsDiscipline(OptionalInt capacity) {
        super(DisciplineType.FCFS, capacity);
    }

    @Override
    protected boolean enqueue(Packet packet) {
        if (isFull()) {
            drop(packet);
            return false;
        }
        queue.addLast(packet);
        return true;
    }

    @Override
    protected Packet dequeueNext() {
        return queue.pollFirst();
    }

    @Override
    protected void clearQueues() {
        queue.clear();
    }

    @Override
    public boolean isEmpty() {
        return queue.isEmpty();
    }

    @Override
    public int size() {
        return queue.size();
    }
}
