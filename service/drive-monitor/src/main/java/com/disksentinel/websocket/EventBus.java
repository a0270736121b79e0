package com.disksentinel.websocket;

import com.disksentinel.config.ApplicationConfig;
import com.disksentinel.model.ScanEvent;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 事件广播总线
 *
 * 设计原则：
 * - 发布方不阻塞：publish 只把消息放进每个订阅者的有界队列
 * - 队列满时丢弃该订阅者最旧的一条
 * - 每个订阅者同一时刻最多一个投递任务，保证单订阅者内顺序与发布顺序一致
 * - 投递失败即移除订阅者，不重试
 */
@Slf4j
@Service
public class EventBus {

    private final Map<String, Registration> subscribers = new ConcurrentHashMap<>();
    private final ObjectMapper mapper;
    private final TaskExecutor deliveryExecutor;
    private final Clock clock;
    private final int queueCapacity;

    public EventBus(
            ApplicationConfig config,
            ObjectMapper mapper,
            @Qualifier("deliveryExecutor")
            TaskExecutor deliveryExecutor,
            Clock clock) {
        this.mapper = mapper;
        this.deliveryExecutor = deliveryExecutor;
        this.clock = clock;
        this.queueCapacity = Math.max(1, config.getWebsocket().getSubscriberQueueCapacity());
    }

    public SubscriptionHandle subscribe(Subscriber subscriber) {
        return subscribe(subscriber, null);
    }

    /**
     * 注册订阅者。greeting 在订阅者对 publish 可见之前入队，保证它是收到的第一条消息。
     */
    public SubscriptionHandle subscribe(Subscriber subscriber, Object greeting) {
        SubscriptionHandle handle = new SubscriptionHandle(subscriber.getId());
        Registration registration = new Registration(handle, subscriber);
        if (greeting != null) {
            String payload = serialize(greeting);
            if (payload != null) {
                registration.offer(payload);
            }
        }
        if (registration.rejected) {
            subscriber.close();
            log.warn("Subscriber {} rejected: delivery executor saturated", handle.getId());
            return handle;
        }
        subscribers.put(handle.getId(), registration);
        log.info("Subscriber connected: {} (total {})", handle.getId(), subscribers.size());
        return handle;
    }

    public void unsubscribe(SubscriptionHandle handle) {
        Registration r = subscribers.remove(handle.getId());
        if (r != null) {
            r.discard();
            log.info("Subscriber removed: {} (total {})", handle.getId(), subscribers.size());
        }
    }

    /**
     * 扇出到所有在线订阅者
     */
    public void publish(ScanEvent event) {
        String payload = serialize(event);
        if (payload == null) return;
        // 快照后再遍历，投递期间不持有任何锁
        for (Registration r : new ArrayList<>(subscribers.values())) {
            r.offer(payload);
        }
        if (log.isTraceEnabled()) {
            log.trace("Published {} to {} subscribers", payload, subscribers.size());
        }
    }

    /**
     * 只发给一个订阅者，与广播共用同一队列以保持顺序
     */
    public boolean send(SubscriptionHandle handle, Object message) {
        Registration r = subscribers.get(handle.getId());
        if (r == null) return false;
        String payload = serialize(message);
        if (payload == null) return false;
        r.offer(payload);
        return true;
    }

    public int subscriberCount() {
        return subscribers.size();
    }

    public boolean isSubscribed(SubscriptionHandle handle) {
        return subscribers.containsKey(handle.getId());
    }

    public long droppedCount(SubscriptionHandle handle) {
        Registration r = subscribers.get(handle.getId());
        return r == null ? 0 : r.dropped.get();
    }

    /**
     * 存活探测：超时未响应的订阅者移除并关闭，其余发送 ping
     */
    public int probeLiveness(Duration pongTimeout) {
        long now = clock.millis();
        int removed = 0;
        for (Registration r : new ArrayList<>(subscribers.values())) {
            Subscriber s = r.subscriber;
            long silentMs = now - s.getLastActivityMs();
            if (!s.isOpen() || silentMs > pongTimeout.toMillis()) {
                log.warn("Subscriber {} silent for {} ms, dropping", r.handle.getId(), silentMs);
                drop(r);
                removed++;
                continue;
            }
            try {
                s.ping();
            } catch (Exception e) {
                log.warn("Ping to subscriber {} failed: {}", r.handle.getId(), e.getMessage());
                drop(r);
                removed++;
            }
        }
        return removed;
    }

    @PreDestroy
    public void shutdown() {
        for (Registration r : new ArrayList<>(subscribers.values())) {
            drop(r);
        }
        subscribers.clear();
        log.info("EventBus shutdown completed");
    }

    private void drop(Registration r) {
        if (subscribers.remove(r.handle.getId(), r)) {
            r.discard();
            r.subscriber.close();
        }
    }

    private String serialize(Object message) {
        try {
            return mapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize event {}: {}", message, e.getMessage());
            return null;
        }
    }

    private final class Registration {

        final SubscriptionHandle handle;
        final Subscriber subscriber;
        final Deque<String> queue = new ArrayDeque<>();
        final AtomicBoolean draining = new AtomicBoolean(false);
        final AtomicLong dropped = new AtomicLong();
        volatile boolean rejected;

        Registration(SubscriptionHandle handle, Subscriber subscriber) {
            this.handle = handle;
            this.subscriber = subscriber;
        }

        void offer(String payload) {
            synchronized (queue) {
                if (queue.size() >= queueCapacity) {
                    queue.pollFirst();
                    long n = dropped.incrementAndGet();
                    if (n == 1 || n % 100 == 0) {
                        log.warn("Subscriber {} is slow, dropped {} events so far", handle.getId(), n);
                    }
                }
                queue.addLast(payload);
            }
            scheduleDrain();
        }

        void discard() {
            synchronized (queue) {
                queue.clear();
            }
        }

        private void scheduleDrain() {
            if (!draining.compareAndSet(false, true)) {
                return;
            }
            try {
                deliveryExecutor.execute(this::drain);
            } catch (RejectedExecutionException e) {
                // 投递线程池已满：队列中的消息无人投递，按投递失败处理
                rejected = true;
                log.warn("Delivery executor saturated, removing subscriber {}", handle.getId());
                drop(this);
            }
        }

        private void drain() {
            while (true) {
                String payload;
                synchronized (queue) {
                    payload = queue.pollFirst();
                    if (payload == null) {
                        draining.set(false);
                        return;
                    }
                }
                if (!subscriber.isOpen()) {
                    log.info("Subscriber {} closed, removing", handle.getId());
                    drop(this);
                    return;
                }
                try {
                    subscriber.send(payload);
                } catch (Exception e) {
                    log.warn("Delivery to subscriber {} failed, removing: {}", handle.getId(), e.getMessage());
                    drop(this);
                    return;
                }
            }
        }
    }
}
