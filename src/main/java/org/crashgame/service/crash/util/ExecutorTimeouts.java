package org.crashgame.service.crash.util;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicLong;

@Slf4j
@Component
public class ExecutorTimeouts implements Timeouts {

    private record Slot(long generation, ScheduledFuture<?> future) {}

    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "crash-timer");
        t.setDaemon(true);
        return t;
    });
    private final Map<String, Slot> tasks = new ConcurrentHashMap<>();
    private final AtomicLong generations = new AtomicLong();

    @Override
    public synchronized void schedule(String name, long delayMs, Runnable task) {
        cancel(name);
        long gen = generations.incrementAndGet();
        ScheduledFuture<?> f = scheduler.schedule(() -> {
            if (!claim(name, gen)) return; // remplacée entre-temps
            runSafely(name, task);
        }, delayMs, TimeUnit.MILLISECONDS);
        tasks.put(name, new Slot(gen, f));
    }

    @Override
    public synchronized void scheduleAtFixedRate(String name, long periodMs, Runnable task) {
        cancel(name);
        long gen = generations.incrementAndGet();
        ScheduledFuture<?> f = scheduler.scheduleAtFixedRate(() -> {
            if (!stillCurrent(name, gen)) return;
            runSafely(name, task);
        }, periodMs, periodMs, TimeUnit.MILLISECONDS);
        tasks.put(name, new Slot(gen, f));
    }

    @Override
    public synchronized void cancel(String name) {
        Slot s = tasks.remove(name);
        if (s != null) s.future().cancel(false);
    }

    @Override
    public synchronized void cancelAll() {
        tasks.keySet().forEach(this::cancel);
    }

    @PreDestroy
    public void shutdown() {
        cancelAll();
        scheduler.shutdownNow();
    }

    private synchronized boolean claim(String name, long gen) {
        Slot s = tasks.get(name);
        return s != null && s.generation() == gen && tasks.remove(name, s);
    }

    private synchronized boolean stillCurrent(String name, long gen) {
        Slot s = tasks.get(name);
        return s != null && s.generation() == gen;
    }

    // une exception ne doit pas tuer un scheduleAtFixedRate
    private void runSafely(String name, Runnable task) {
        try {
            task.run();
        } catch (Exception ex) {
            log.error("Minuterie '{}' en échec", name, ex);
        }
    }
}
