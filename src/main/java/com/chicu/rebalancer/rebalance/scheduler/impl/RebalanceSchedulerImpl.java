package com.chicu.rebalancer.rebalance.scheduler.impl;

import com.chicu.rebalancer.bot.notify.Notifier;
import com.chicu.rebalancer.config.RebalancerProperties;
import com.chicu.rebalancer.rebalance.model.TickOutcome;
import com.chicu.rebalancer.rebalance.scheduler.RebalanceScheduler;
import com.chicu.rebalancer.rebalance.service.RebalanceEngine;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Цикл ребалансировки на одном фоновом потоке.
 * Следующий тик планируется после окончания текущего: через poll-interval,
 * а после ошибки через error-delay.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RebalanceSchedulerImpl implements RebalanceScheduler {

    private static final AtomicLong SCHEDULER_THREAD_SEQ = new AtomicLong();

    private final RebalanceEngine engine;
    private final Notifier notifier;
    private final RebalancerProperties props;

    @Value("${rebalancer.shutdown-wait-ms:10000}")
    private long shutdownWaitMs;

    private ScheduledThreadPoolExecutor scheduler;
    private final AtomicBoolean running = new AtomicBoolean(false);

    @PostConstruct
    void init() {
        this.scheduler = new ScheduledThreadPoolExecutor(1, r -> {
            Thread t = new Thread(r);
            t.setName("rebalance-loop-" + SCHEDULER_THREAD_SEQ.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        this.scheduler.setRemoveOnCancelPolicy(true);
        log.info("Планировщик ребалансировки инициализирован, интервал {} мс", props.getPollIntervalMs());
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (!props.isAutostart()) {
            log.info("Автозапуск ребалансировки отключён (rebalancer.autostart=false)");
            return;
        }
        notifier.sendInfo("🚀 Rebalancing bot started");
        start();
    }

    @Override
    public void start() {
        if (scheduler.isShutdown()) {
            throw new IllegalStateException("Scheduler is already shut down");
        }
        if (!running.compareAndSet(false, true)) {
            log.info("Цикл ребалансировки уже запущен");
            return;
        }
        log.info("▶️ Цикл ребалансировки запущен");
        scheduleNext(0);
    }

    @Override
    public void stop() {
        if (running.compareAndSet(true, false)) {
            log.info("⏹ Цикл ребалансировки остановлен, новые тики не планируются");
        }
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    @PreDestroy
    void shutdown() {
        log.info("Останавливаю планировщик…");
        stop();
        notifier.sendInfo("Bot is shutting down...");
        // без shutdownNow: прерывать отправку транзакции посреди тика нельзя
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(shutdownWaitMs, TimeUnit.MILLISECONDS)) {
                log.warn("Тик не завершился за {} мс, поток daemon остановится вместе с JVM", shutdownWaitMs);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Ожидание завершения тика прервано");
        }
    }

    /** Один проход цикла; возвращает паузу до следующего. */
    long runTick() {
        long delay = props.getPollIntervalMs();
        try {
            TickOutcome outcome = engine.checkAndRebalance();
            log.info("Тик завершён: {}. Следующая проверка через {} мс", outcome, delay);
        } catch (Exception e) {
            delay = props.getErrorDelayMs();
            log.error("Ошибка в итерации ребалансировки: {}. Повтор через {} мс", e.getMessage(), delay, e);
        }
        return delay;
    }

    private void loop() {
        long delay = runTick();
        scheduleNext(delay);
    }

    private void scheduleNext(long delayMs) {
        if (!running.get()) {
            return;
        }
        try {
            scheduler.schedule(this::loop, delayMs, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.warn("Планировщик уже остановлен, следующий тик не запланирован");
            running.set(false);
        }
    }
}
