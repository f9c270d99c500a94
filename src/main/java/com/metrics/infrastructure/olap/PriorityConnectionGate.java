package com.metrics.infrastructure.olap;

import java.util.Comparator;
import java.util.PriorityQueue;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounds concurrent backend connections and hands free slots to the
 * highest-priority waiter first, FIFO among equal priorities.
 */
public class PriorityConnectionGate {
    
    private final ReentrantLock lock = new ReentrantLock();
    private final PriorityQueue<Waiter> waiters = new PriorityQueue<>(
            Comparator.comparingInt((Waiter w) -> w.priority).reversed()
                    .thenComparingLong(w -> w.sequence));
    
    private int available;
    private long sequence;
    
    public PriorityConnectionGate(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.available = capacity;
    }
    
    public void acquire(int priority) throws InterruptedException {
        lock.lock();
        try {
            if (available > 0 && waiters.isEmpty()) {
                available--;
                return;
            }
            Waiter waiter = new Waiter(priority, sequence++, lock.newCondition());
            waiters.add(waiter);
            try {
                while (!waiter.granted) {
                    waiter.condition.await();
                }
            } catch (InterruptedException e) {
                if (waiter.granted) {
                    // Slot was handed over while we were being interrupted
                    grantNext();
                } else {
                    waiters.remove(waiter);
                }
                throw e;
            }
        } finally {
            lock.unlock();
        }
    }
    
    public void release() {
        lock.lock();
        try {
            grantNext();
        } finally {
            lock.unlock();
        }
    }
    
    public int getAvailable() {
        lock.lock();
        try {
            return available;
        } finally {
            lock.unlock();
        }
    }
    
    public int getWaiting() {
        lock.lock();
        try {
            return waiters.size();
        } finally {
            lock.unlock();
        }
    }
    
    private void grantNext() {
        Waiter next = waiters.poll();
        if (next == null) {
            available++;
            return;
        }
        next.granted = true;
        next.condition.signal();
    }
    
    private static final class Waiter {
        
        final int priority;
        final long sequence;
        final Condition condition;
        boolean granted;
        
        Waiter(int priority, long sequence, Condition condition) {
            this.priority = priority;
            this.sequence = sequence;
            this.condition = condition;
        }
    }
}
