package com.deals.collector.history;

import java.time.LocalDateTime;

public record RankPoint(LocalDateTime timestamp, long rank) {
}
