package com.tradeadvisor.backend.trading.pipeline;

import com.tradeadvisor.backend.exception.AdvisorUnavailableException;

/**
 * One call to the AI advisor. Implementations perform a single attempt; retries belong to the caller.
 */
public interface AdvisorClient {

    /**
     * @return the advisor's raw text answer
     * @throws AdvisorUnavailableException when no answer could be obtained
     */
    String requestRecommendation(AdvisorPrompt prompt);
}
