package com.deals.collector.telegram;

import com.deals.collector.persistence.DealRecordEntity;
import com.deals.collector.persistence.DealRecordRepository;
import com.deals.collector.persistence.GenerationStatus;
import com.deals.collector.persistence.IngestionGenerationEntity;
import com.deals.collector.persistence.IngestionGenerationRepository;
import com.deals.collector.service.CycleResult;
import com.deals.collector.service.DealCategory;
import com.deals.collector.service.IngestionCycleService;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Component;
import org.telegram.telegrambots.bots.TelegramLongPollingBot;
import org.telegram.telegrambots.meta.TelegramBotsApi;
import org.telegram.telegrambots.meta.api.methods.send.SendMessage;
import org.telegram.telegrambots.meta.api.objects.Update;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;
import org.telegram.telegrambots.updatesreceivers.DefaultBotSession;

import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Component
@Slf4j
@ConditionalOnProperty(name = "telegram.enabled", havingValue = "true")
public class DealsTelegramBot extends TelegramLongPollingBot {

    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm");
    private static final int TOP_LIMIT = 10;

    private final IngestionCycleService cycleService;
    private final DealRecordRepository dealRepository;
    private final IngestionGenerationRepository generationRepository;
    private final ExecutorService executor = Executors.newSingleThreadExecutor();

    @Value("${telegram.bot.token}")
    private String botToken;

    @Value("${telegram.bot.username}")
    private String botUsername;

    @Value("${telegram.alert.chat-id:}")
    private String alertChatId;

    public DealsTelegramBot(IngestionCycleService cycleService,
                            DealRecordRepository dealRepository,
                            IngestionGenerationRepository generationRepository) {
        this.cycleService = cycleService;
        this.dealRepository = dealRepository;
        this.generationRepository = generationRepository;
    }

    @PostConstruct
    public void init() {
        try {
            TelegramBotsApi botsApi = new TelegramBotsApi(DefaultBotSession.class);
            botsApi.registerBot(this);
            log.info("Telegram bot registered successfully");
        } catch (TelegramApiException e) {
            log.error("Failed to register Telegram bot: {}", e.getMessage());
        }
    }

    @Override
    public String getBotUsername() {
        return botUsername;
    }

    @Override
    public String getBotToken() {
        return botToken;
    }

    @Override
    public void onUpdateReceived(Update update) {
        if (!update.hasMessage() || !update.getMessage().hasText()) {
            return;
        }

        String messageText = update.getMessage().getText();
        long chatId = update.getMessage().getChatId();

        log.debug("Received message: {} from chat: {}", messageText, chatId);

        String response = processCommand(messageText);
        sendMessage(chatId, response);
    }

    String processCommand(String command) {
        String cmd = command.toLowerCase(Locale.ROOT).trim();
        String[] parts = cmd.split("\\s+", 2);
        String baseCmd = parts[0];
        String args = parts.length > 1 ? parts[1].trim() : "";

        return switch (baseCmd) {
            case "/start" -> handleStart();
            case "/status" -> handleStatus();
            case "/run" -> handleRun();
            case "/cancel" -> handleCancel();
            case "/top" -> handleTop(args);
            default -> handleUnknown();
        };
    }

    private String handleStart() {
        return """
                Deal Collector Bot

                /status - Current generation and last cycle
                /run - Start an ingestion cycle
                /cancel - Cancel the running cycle before it commits
                /top [category] - Top deals by hot score

                Status: ONLINE
                """;
    }

    private String handleStatus() {
        StringBuilder sb = new StringBuilder();
        sb.append("Deal Collector\n\n");
        sb.append("Active deals: ").append(dealRepository.countByActiveTrue()).append("\n");

        Optional<IngestionGenerationEntity> current =
                generationRepository.findTopByStatusOrderByCompletedAtDesc(GenerationStatus.COMMITTED);
        if (current.isPresent()) {
            IngestionGenerationEntity generation = current.get();
            sb.append("Generation: ").append(generation.getGenerationId()).append("\n");
            sb.append("Committed: ").append(generation.getCompletedAt().format(DATE_FORMAT)).append(" UTC\n");
            sb.append("Records: ").append(generation.getRecordCount())
                    .append(" of ").append(generation.getCandidateCount()).append(" candidates\n");
        } else {
            sb.append("No generation committed yet\n");
        }

        generationRepository.findTopByOrderByCompletedAtDesc()
                .filter(latest -> latest.getStatus() != GenerationStatus.COMMITTED)
                .ifPresent(latest -> sb.append("Last attempt ").append(latest.getStatus())
                        .append(": ").append(latest.getMessage()).append("\n"));

        CycleResult last = cycleService.getLastResult();
        if (last != null) {
            sb.append("\nLast cycle: ").append(last.summary()).append("\n");
        }

        if (cycleService.isRunning()) {
            sb.append("\nCycle: IN PROGRESS");
        }

        return sb.toString();
    }

    private String handleRun() {
        if (cycleService.isRunning()) {
            return "A cycle is already running.";
        }

        executor.submit(() -> {
            CycleResult result = cycleService.runCycle();
            log.info("Manual cycle finished: {}", result.summary());
            sendMessage(result.summary());
        });

        return "Ingestion cycle started. Use /status to monitor progress.";
    }

    private String handleCancel() {
        return cycleService.requestCancel()
                ? "Cancellation requested. The cycle stops before committing."
                : "No cycle is running.";
    }

    private String handleTop(String slug) {
        PageRequest page = PageRequest.of(0, TOP_LIMIT,
                Sort.by(Sort.Order.desc("hotScore"), Sort.Order.desc("score")));

        List<DealRecordEntity> deals;
        if (slug.isEmpty()) {
            deals = dealRepository.findByActiveTrue(page);
        } else {
            Optional<DealCategory> category = DealCategory.fromSlug(slug);
            if (category.isEmpty()) {
                return "Unknown category: " + slug;
            }
            deals = dealRepository.findByActiveTrueAndCategory(category.get(), page);
        }

        if (deals.isEmpty()) {
            return "No active deals.";
        }

        StringBuilder sb = new StringBuilder("Top deals\n\n");
        int rank = 1;
        for (DealRecordEntity deal : deals) {
            sb.append(rank++).append(". ").append(deal.getTitle() == null ? deal.getAsin() : deal.getTitle())
                    .append("\n   ").append(deal.getPriceCurrent() == null ? "-" : "£" + deal.getPriceCurrent())
                    .append(formatChange(deal.getDiscountPct90d()))
                    .append(String.format(" hot %.0f / deal %.0f", deal.getHotScore(), deal.getScore()))
                    .append("\n   ").append(deal.getAmazonUrl()).append("\n");
        }
        return sb.toString();
    }

    /**
     * Price change against the 90-day median: a 25% discount prints as "(-25%)", a price above
     * the median as "(+12%)".
     */
    static String formatChange(Double discount) {
        if (discount == null) {
            return "";
        }
        return String.format(Locale.ROOT, " (%+.0f%%)", 0.0 - discount * 100);
    }

    private String handleUnknown() {
        return "Unknown command. Use /start to see available commands.";
    }

    private void sendMessage(long chatId, String text) {
        SendMessage message = new SendMessage();
        message.setChatId(String.valueOf(chatId));
        message.setText(text);

        try {
            execute(message);
        } catch (TelegramApiException e) {
            log.error("Failed to send message: {}", e.getMessage());
        }
    }

    /**
     * Send message to configured alert chat.
     */
    public void sendMessage(String text) {
        if (alertChatId == null || alertChatId.isEmpty()) {
            log.warn("Alert chat ID not configured, cannot send message");
            return;
        }

        SendMessage message = new SendMessage();
        message.setChatId(alertChatId);
        message.setText(text);

        try {
            execute(message);
        } catch (TelegramApiException e) {
            log.error("Failed to send message to alert chat: {}", e.getMessage());
        }
    }
}
