package com.tradeadvisor.backend.repository;

import com.tradeadvisor.backend.model.Position;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface PositionRepository extends JpaRepository<Position, Long> {

    Optional<Position> findByPortfolioIdAndTicker(Long portfolioId, String ticker);

    List<Position> findByPortfolioIdOrderByTickerAsc(Long portfolioId);
}
