package queuesim.discipline;

import queuesim.packet.Packet;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.TreeMap;

/**
 * Flow-based fair queueing: one FIFO queue per flow, served by virtual-time bookkeeping.
 *
 * <p>In {@link FairQueueMode#VIRTUAL_FINISH_TIME} mode the head packet of each flow gets a
 * candidate finish time {@code max(virtualTime, lastFinish[flow]) + serviceTime}; the smallest
 * candidate is served, its flow's last finish is committed and the global virtual time moves
 * to it.
 *
 * <p>In {@link FairQueueMode#VIRTUAL_ROUND_ROBIN} mode each flow accumulates the service it has
 * been granted and the flow with the smallest total is served.
 *
 * <p>Ties on the candidate finish time go to the flow with the older last finish, then to the
 * lowest flow id; ties on granted service go to the lowest flow id. With a capacity bound, each flow may hold
 * at most {@code max(1, capacity / flowCount)} packets; arrivals beyond that share are dropped.
 * Flow queues are removed once they drain so the flow count stays current.
 */
public class FairQueueDiscipline extends AbstractQueueingDiscipline {

    private final FairQueueMode mode;

    // Sorted by flow id so that iteration order is the tie-break order.
    private final TreeMap<Integer, Deque<Packet>> flowQueues = new TreeMap<>();
    private final Map<Integer, Double> lastFinish = new TreeMap<>();
    private final Map<Integer, Double> grantedService = new TreeMap<>();
    private double virtualTime = 0.0;
    private int queued = 0;

    public FairQueueDiscipline() {
        this(FairQueueMode.VIRTUAL_FINISH_TIME, OptionalInt.empty());
    }

    public FairQueueDiscipline(FairQueueMode mode) {
        this(mode, OptionalInt.empty());
    }

    public FairQueueDiscipline(FairQueueMode mode, int capacity) {
        this(mode, OptionalInt.of(capacity));
    }

    public FairQueueDiscipline(FairQueueMode mode, OptionalInt capacity) {
        super(DisciplineType.FAIR_QUEUE, capacity);
        this.mode = Objects.requireNonNull(mode, "mode cannot be null");
    }

    public FairQueueMode mode() {
        return mode;
    }

    @Override
    public String name() {
        return mode == FairQueueMode.VIRTUAL_FINISH_TIME ? super.name() : super.name() + " (VRR)";
    }

    /**
     * Number of flows that currently have a queue.
     */
    public int flowCount() {
        return flowQueues.size();
    }

    /**
     * Number of packets queued for the given flow, 0 if the flow has no queue.
     */
    public int flowQueueSize(int flowId) {
        Deque<Packet> queue = flowQueues.get(flowId);
        return queue == null ? 0 : queue.size();
    }

    public double virtualTime() {
        return virtualTime;
    }

    /**
     * Last committed virtual finish time of the flow, 0 if it has never been served.
     */
    public double lastFinishTime(int flowId) {
        return lastFinish.getOrDefault(flowId, 0.0);
    }

    /**
     * Total service granted to the flow so far.
     */
    public double grantedService(int flowId) {
        return grantedService.getOrDefault(flowId, 0.0);
    }

    /**
     * Largest number of packets the given flow may hold right now, or empty when unbounded.
     */
    public OptionalInt perFlowLimit(int flowId) {
        if (capacity().isEmpty()) {
            return OptionalInt.empty();
        }
        int flows = flowQueues.size() + (flowQueues.containsKey(flowId) ? 0 : 1);
        return OptionalInt.of(Math.max(1, capacity().getAsInt() / flows));
    }

    @Override
    protected boolean enqueue(Packet packet) {
        int flowId = packet.flowId();
        OptionalInt limit = perFlowLimit(flowId);
        if (limit.isPresent() && flowQueueSize(flowId) >= limit.getAsInt()) {
            drop(packet);
            return false;
        }
        flowQueues.computeIfAbsent(flowId, k -> new ArrayDeque<>()).addLast(packet);
        queued++;
        return true;
    }

    @Override
    protected Packet dequeueNext() {
        if (flowQueues.isEmpty()) {
            return null;
        }
        int flowId = mode == FairQueueMode.VIRTUAL_FINISH_TIME ? selectByFinishTime() : selectByGrantedService();

        Deque<Packet> queue = flowQueues.get(flowId);
        Packet packet = queue.pollFirst();
        queued--;
        if (queue.isEmpty()) {
            flowQueues.remove(flowId);
        }
        return packet;
    }

    private int selectByFinishTime() {
        int bestFlow = -1;
        double bestFinish = Double.POSITIVE_INFINITY;
        double bestLastFinish = Double.POSITIVE_INFINITY;
        for (Map.Entry<Integer, Deque<Packet>> entry : flowQueues.entrySet()) {
            Packet head = entry.getValue().peekFirst();
            double previous = lastFinishTime(entry.getKey());
            double finish = Math.max(virtualTime, previous) + head.serviceTime();
            // Equal candidates: the flow whose last finish is older goes first, then the lower flow id.
            if (finish < bestFinish || (finish == bestFinish && previous < bestLastFinish)) {
                bestFinish = finish;
                bestLastFinish = previous;
                bestFlow = entry.getKey();
            }
        }
        lastFinish.put(bestFlow, bestFinish);
        virtualTime = bestFinish;
        return bestFlow;
    }

    private int selectByGrantedService() {
        int bestFlow = -1;
        double bestTotal = Double.POSITIVE_INFINITY;
        for (Integer flowId : flowQueues.keySet()) {
            double total = grantedService(flowId);
            if (total < bestTotal) {
                bestTotal = total;
                bestFlow = flowId;
            }
        }
        Packet head = flowQueues.get(bestFlow).peekFirst();
        grantedService.put(bestFlow, bestTotal + head.serviceTime());
        return bestFlow;
    }

    @Override
    protected void clearQueues() {
        flowQueues.clear();
        lastFinish.clear();
        grantedService.clear();
        virtualTime = 0.0;
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
