package queuesim.discipline;

import queuesim.packet.Packet;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.OptionalInt;
import java.util.TreeMap;

/**
 * Least-attained-service: one FIFO queue per flow, and the flow that has received the
 * least service so far is served next (lowest flow id on ties). New flows therefore go
 * ahead of flows that already consumed service; long-running flows can starve while
 * short flows keep arriving.
 *
 * <p>Under a capacity bound a full buffer evicts the tail packet of the queued flow with
 * the greatest attained service (lowest flow id on ties), whichever flow the arriving packet
 * belongs to. The arriving packet is dropped only when no flow has queued packets.
 */
public class LasDiscipline extends AbstractQueueingDiscipline {

    private final TreeMap<Integer, Deque<Packet>> flowQueues = new TreeMap<>();
    private final Map<Integer, Double> attainedService = new TreeMap<>();
    private int queued = 0;

    public LasDiscipline() {
        this(OptionalInt.empty());
    }

    public LasDiscipline(int capacity) {
        this(OptionalInt.of(capacity));
    }

    public LasDiscipline(OptionalInt capacity) {
        super(DisciplineType.LAS, capacity);
    }

    /**
     * Service received by the flow so far.
     */
    public double attainedService(int flowId) {
        return attainedService.getOrDefault(flowId, 0.0);
    }

    /**
     * Number of packets queued for the given flow, 0 if the flow has no queue.
     */
    public int flowQueueSize(int flowId) {
        Deque<Packet> queue = flowQueues.get(flowId);
        return queue == null ? 0 : queue.size();
    }

    @Override
    protected boolean enqueue(Packet packet) {
        if (isFull()) {
            int victimFlow = findEvictionVictim();
            if (victimFlow < 0) {
                drop(packet);
                return false;
            }
            evictTail(victimFlow);
        }
        flowQueues.computeIfAbsent(packet.flowId(), k -> new ArrayDeque<>()).addLast(packet);
        queued++;
        return true;
    }

    /**
     * Finds the queued flow with the greatest attained service, lowest flow id on ties.
     *
     * @return the flow id, or -1 if no flow has queued packets
     */
    private int findEvictionVictim() {
        int victim = -1;
        double mostService = Double.NEGATIVE_INFINITY;
        for (Integer flowId : flowQueues.keySet()) {
            double service = attainedService(flowId);
            if (service > mostService) {
                mostService = service;
                victim = flowId;
            }
        }
        return victim;
    }

    private void evictTail(int flowId) {
        Deque<Packet> queue = flowQueues.get(flowId);
        Packet evicted = queue.pollLast();
        queued--;
        if (queue.isEmpty()) {
            flowQueues.remove(flowId);
        }
        drop(evicted);
    }

    @Override
    protected Packet dequeueNext() {
        int selected = -1;
        double leastService = Double.POSITIVE_INFINITY;
        for (Integer flowId : flowQueues.keySet()) {
            double service = attainedService(flowId);
            if (service < leastService) {
                leastService = service;
                selected = flowId;
            }
        }
        if (selected < 0) {
            return null;
        }

        Deque<Packet> queue = flowQueues.get(selected);
        Packet packet = queue.pollFirst();
        queued--;
        if (queue.isEmpty()) {
            flowQueues.remove(selected);
        }
        attainedService.put(selected, leastService + packet.serviceTime());
        return packet;
    }

    @Override
    protected void clearQueues() {
        flowQueues.clear();
        attainedService.clear();
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
