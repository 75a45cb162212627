package dao.tron.rdist.scheduler;

import dao.tron.rdist.config.KeeperProperties;
import dao.tron.rdist.keeper.KeeperService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Slf4j
@Component
public class KeeperScheduler {

    private final KeeperService keeperService;
    private final KeeperProperties keeperProps;

    public KeeperScheduler(KeeperService keeperService, KeeperProperties keeperProps) {
        this.keeperService = keeperService;
        this.keeperProps = keeperProps;
    }

    // fixedDelay: a tick that gave up waits the full interval before the next one
    @Scheduled(fixedDelayString = "${keeper.interval-ms:60000}", initialDelayString = "${keeper.initial-delay-ms:5000}")
    public void tick() {
        if (!keeperProps.isEnabled()) {
            return;
        }
        keeperService.runTick();
    }
}
