package com.library.circulation.scheduler;

import com.library.circulation.service.CirculationFacade;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically persists {@code OVERDUE} on past-due loans.
 *
 * <p>Off unless {@code library.circulation.overdue-sweep.enabled=true}; without it overdue is
 * computed on read only. Past-due rows are selected {@code FOR UPDATE}, so a sweep and a
 * concurrent return of the same loan serialise.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(
        name = "library.circulation.overdue-sweep.enabled",
        havingValue = "true"
)
public class OverdueLoanSweeper {

    private final CirculationFacade circulationFacade;

    @Scheduled(cron = "${library.circulation.overdue-sweep.cron}")
    public void sweep() {
        int marked = circulationFacade.markOverdueLoans();
        log.debug("Overdue sweep finished, {} loans marked", marked);
    }
}
