package com.stepwise.dispatch.cli;

import com.stepwise.core.model.FailureEntry;
import com.stepwise.core.model.RunReport;
import com.stepwise.core.rollback.FailureLedger;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: stepwise failures
 * <p>
 * Prints the failure ledger, most recent last.
 */
@Command(name = "failures", mixinStandardHelpOptions = true, description = "Show recorded task failures")
@Component
public class FailuresCommand implements Callable<Integer> {

    @Option(names = {"--task", "-t"}, description = "Only failures of this task")
    private String taskId;

    @Option(names = {"--limit", "-n"}, description = "Show at most this many entries (default: ${DEFAULT-VALUE})",
            defaultValue = "20")
    private int limit;

    private final FailureLedger ledger;

    public FailuresCommand(FailureLedger ledger) {
        this.ledger = ledger;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        List<FailureEntry> entries = ledger.entries().stream()
                .filter(e -> taskId == null || taskId.equals(e.taskId()))
                .toList();
        if (entries.isEmpty()) {
            ConsoleOutput.info("No failures recorded");
            return RunReport.EXIT_OK;
        }

        List<FailureEntry> shown = entries.subList(Math.max(0, entries.size() - limit), entries.size());
        for (FailureEntry entry : shown) {
            ConsoleOutput.error(entry.timestamp() + "  " + entry.taskId() + "  " + entry.reason());
        }
        if (shown.size() < entries.size()) {
            ConsoleOutput.info((entries.size() - shown.size()) + " older entries not shown");
        }
        return RunReport.EXIT_OK;
    }
}
