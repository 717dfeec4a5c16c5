package com.deals.collector.scheduler;

import com.deals.collector.service.CycleResult;
import com.deals.collector.service.IngestionCycleService;
import com.deals.collector.telegram.DealsTelegramBot;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Runs an ingestion cycle on the configured cron, every six hours by default.
 */
@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(name = "deals.ingestion.scheduler.enabled", havingValue = "true", matchIfMissing = true)
public class IngestionScheduler {

    private final IngestionCycleService cycleService;
    private final ObjectProvider<DealsTelegramBot> telegramBot;

    @Scheduled(cron = "${deals.ingestion.cron:0 0 */6 * * *}")
    public void runScheduledCycle() {
        try {
            log.info("Running scheduled ingestion cycle...");

            CycleResult result = cycleService.runCycle();

            log.info("Scheduled cycle finished: {}", result.summary());

            if (result.needsAttention()) {
                notifyProblem(result);
            }

        } catch (Exception e) {
            log.error("Error during scheduled ingestion: {}", e.getMessage(), e);
        }
    }

    private void notifyProblem(CycleResult result) {
        DealsTelegramBot bot = telegramBot.getIfAvailable();
        if (bot == null) {
            return;
        }
        try {
            bot.sendMessage("Ingestion cycle " + result.status() + "\n\n" + result.summary());
        } catch (Exception e) {
            log.error("Failed to send cycle notification: {}", e.getMessage());
        }
    }
}
