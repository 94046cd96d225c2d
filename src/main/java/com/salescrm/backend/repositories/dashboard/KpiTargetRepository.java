package com.salescrm.backend.repositories.dashboard;

import com.salescrm.backend.models.User;
import com.salescrm.backend.models.dashboard.KpiTarget;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;

@Repository
public interface KpiTargetRepository extends JpaRepository<KpiTarget, Long> {

    /**
     * Active targets of the given type whose period contains the day.
     */
    @Query("SELECT k FROM KpiTarget k WHERE k.user = :user AND k.kpiType = :type AND k.isActive = true " +
            "AND k.periodStart <= :day AND k.periodEnd >= :day")
    List<KpiTarget> findCurrent(@Param("user") User user,
                                @Param("type") KpiTarget.KpiType type,
                                @Param("day") LocalDate day);

    @Query("SELECT k FROM KpiTarget k WHERE k.user = :user AND k.isActive = true " +
            "AND k.periodStart <= :day AND k.periodEnd >= :day ORDER BY k.kpiType ASC")
    List<KpiTarget> findAllCurrent(@Param("user") User user, @Param("day") LocalDate day);

    @Query("SELECT k FROM KpiTarget k WHERE k.user = :user AND k.isActive = true " +
            "AND k.periodStart <= :to AND k.periodEnd >= :from ORDER BY k.periodStart ASC, k.kpiType ASC")
    List<KpiTarget> findOverlapping(@Param("user") User user,
                                    @Param("from") LocalDate from,
                                    @Param("to") LocalDate to);

    boolean existsByUserAndKpiTypeAndPeriodStartAndPeriodEnd(User user,
                                                             KpiTarget.KpiType kpiType,
                                                             LocalDate periodStart,
                                                             LocalDate periodEnd);
}
