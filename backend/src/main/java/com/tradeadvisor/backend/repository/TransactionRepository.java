package com.tradeadvisor.backend.repository;

import com.tradeadvisor.backend.model.Transaction;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

@Repository
public interface TransactionRepository extends JpaRepository<Transaction, Long> {

    List<Transaction> findByPortfolioIdOrderByTimestampDescIdDesc(Long portfolioId, Pageable pageable);

    List<Transaction> findByPortfolioIdAndTimestampGreaterThanEqualOrderByTimestampAsc(Long portfolioId, Instant since);

    List<Transaction> findByPortfolioIdOrderByTimestampAsc(Long portfolioId);

    long countByPortfolioIdAndTimestampGreaterThanEqual(Long portfolioId, Instant since);

    long countByRecommendationId(Long recommendationId);
}
