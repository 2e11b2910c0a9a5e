package dev.jobharvest;

import dev.jobharvest.config.HarvestProperties;
import dev.jobharvest.model.RunResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.function.IntConsumer;

/**
 * Ends the process once a harvest run is over: status 0 after a completed run,
 * 1 after a failed one. With {@code harvest.exit-on-completion=false} the JVM
 * keeps running and only the status is logged.
 */
@Slf4j
@Component
public class ExitManager {

    static final int COMPLETED = 0;
    static final int FAILED = 1;

    private final boolean exitOnCompletion;
    private final IntConsumer terminator;

    @Autowired
    public ExitManager(HarvestProperties harvestProperties) {
        this(harvestProperties.isExitOnCompletion(), System::exit);
    }

    ExitManager(boolean exitOnCompletion, IntConsumer terminator) {
        this.exitOnCompletion = exitOnCompletion;
        this.terminator = terminator;
    }

    public void completed(RunResult result) {
        if (result != null) {
            log.info("Harvest finished: {} rows appended, {} errors",
                    result.totals().rowsAppended(), result.totals().errors());
        }
        terminate(COMPLETED);
    }

    public void failed(Throwable cause) {
        log.error("Harvest aborted: {}", cause.getMessage());
        terminate(FAILED);
    }

    private void terminate(int status) {
        if (!exitOnCompletion) {
            log.debug("Exit with status {} skipped (harvest.exit-on-completion=false)", status);
            return;
        }
        terminator.accept(status);
    }
}
