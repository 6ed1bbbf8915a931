package com.tripmatch.server.recommend;

import com.tripmatch.pojo.model.ScoredTrip;

import java.util.ArrayList;
import java.util.List;
import java.util.PriorityQueue;

/**
 * 容量为 k 的最小堆，堆顶是当前保留结果中排名最差的一条。
 * <p>非线程安全：每个请求 / 每个打分分片各自持有一个实例。</p>
 */
final class BoundedTopK {

    private final int k;
    private final PriorityQueue<ScoredTrip> heap;

    BoundedTopK(int k) {
        this.k = k;
        this.heap = new PriorityQueue<>(Math.min(k, 1024) + 1, ScoredTrip.RANKING.reversed());
    }

    boolean isFull() {
        return heap.size() >= k;
    }

    ScoredTrip worst() {
        return heap.peek();
    }

    /**
     * 未满直接插入；已满时只有排名严格优于堆顶（得分更高，或同分且 tripId 更小）才替换堆顶。
     */
    void offer(ScoredTrip candidate) {
        if (heap.size() < k) {
            heap.add(candidate);
        } else if (candidate.ranksBefore(heap.peek())) {
            heap.poll();
            heap.add(candidate);
        }
    }

    void offerAll(List<ScoredTrip> candidates) {
        for (ScoredTrip c : candidates) {
            offer(c);
        }
    }

    List<ScoredTrip> toSortedList() {
        List<ScoredTrip> result = new ArrayList<>(heap);
        result.sort(ScoredTrip.RANKING);
        return result;
    }
}
