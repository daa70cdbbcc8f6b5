package com.tradeadvisor.backend.trading.pipeline;

import java.util.List;

public interface NewsFeed {
    List<NewsItem> recentNews(String ticker, int limit);
}
