package queuesim.discipline;

import queuesim.packet.Packet;

import java.util.Comparator;
import java.util.OptionalInt;
import java.util.PriorityQueue;

/**
 * Strict priority: the highest-priority packet is always served first, earlier arrival
 * breaking ties. Low-priority flows starve under sustained high-priority load; that is
 * the behaviour of this discipline and is not mitigated.
 *
 * Unbounded by default. With a capacity bound, arrivals to a full queue are tail-dropped.
 */
public class PriorityDiscipline extends AbstractQueueingDiscipline {

    // Admission order settles packets equal in priority and arrival time.
    private static final Comparator<Entry> ORDER = Comparator
            .comparing(Entry::packet, Packet.PRIORITY_ORDER)
            .thenComparingLong(Entry::sequence);

    private final PriorityQueue<Entry> heap = new PriorityQueue<>(ORDER);
    private long nextSequence = 0;

    public PriorityDiscipline() {
        this(OptionalInt.empty());
    }

    public PriorityDiscipline(int capacity) {
        this(OptionalInt.of(capacity));
    }

    public PriorityDiscipline(OptionalInt capacity) {
        super(DisciplineType.PRIORITY, capacity);
    }

    @Override
    protected boolean enqueue(Packet packet) {
        if (isFull()) {
            drop(packet);
            return false;
        }
        heap.offer(new Entry(packet, nextSequence++));
        return true;
    }

    @Override
    protected Packet dequeueNext() {
        Entry entry = heap.poll();
        return entry == null ? null : entry.packet();
    }

    @Override
    protected void clearQueues() {
        heap.clear();
        nextSequence = 0;
    }

    @Override
    public boolean isEmpty() {
        return heap.isEmpty();
    }

    @Override
    public int size() {
        return heap.size();
    }

    private record Entry(Packet packet, long sequence) {}
}
