package com.dealengine.deal;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Repository for deal lookups.
 */
@Repository
public interface DealRepository extends JpaRepository<Deal, String> {

    Optional<Deal> findByDealId(String dealId);

    /**
     * Published deals for a team that carry a non-blank condition.
     */
    @Query("select d from Deal d where d.teamId = :teamId and d.status = com.dealengine.deal.DealStatus.PUBLISHED "
        + "and d.conditionString is not null and trim(d.conditionString) <> ''")
    List<Deal> findEvaluableByTeamId(@Param("teamId") String teamId);
}
