package org.pixelbattle.cli.commands;

import org.pixelbattle.ledger.model.ActorId;
import org.pixelbattle.ledger.persistence.JsonSnapshotStore;
import org.pixelbattle.ledger.persistence.LedgerSnapshot;
import org.pixelbattle.ledger.prize.WinnerResolver;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.Callable;

/**
 * Prints a summary of a ledger snapshot file: cycle state, prize pool and cell counts of the
 * current cycle's owners.
 */
@Command(
    name = "inspect",
    description = "Prints the cycle state and current leaders stored in a ledger snapshot file."
)
public class InspectCommand implements Callable<Integer> {

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "Snapshot file written by the ledger process.")
    private Path snapshotFile;

    @Override
    public Integer call() {
        final PrintWriter out = spec.commandLine().getOut();
        final PrintWriter err = spec.commandLine().getErr();

        final Optional<LedgerSnapshot> loaded;
        try {
            loaded = new JsonSnapshotStore(snapshotFile).load();
        } catch (final IOException e) {
            err.println("Could not read snapshot " + snapshotFile + ": " + e.getMessage());
            return 1;
        }
        if (loaded.isEmpty()) {
            err.println("Snapshot file not found: " + snapshotFile);
            return 1;
        }

        final LedgerSnapshot snapshot = loaded.get();
        final LedgerSnapshot.CycleRecord cycle = snapshot.cycle();
        final Map<ActorId, Integer> counts = new TreeMap<>();
        for (final LedgerSnapshot.CellRecord cell : snapshot.cells()) {
            if (cell.owner() != null && cell.lastUpdateCycle() == cycle.cycleId()) {
                counts.merge(cell.owner(), 1, Integer::sum);
            }
        }
        final Set<ActorId> leaders = new WinnerResolver().resolve(counts);

        out.printf("Grid:            %dx%d%n", snapshot.width(), snapshot.height());
        out.printf("Cycle:           %d (%s)%n", cycle.cycleId(), cycle.active() ? "active" : "ended");
        out.printf("Started at:      %s%n", formatMillis(cycle.startedAt()));
        out.printf("Last activity:   %s%n", formatMillis(cycle.lastActivityAt()));
        out.printf("Prize pool:      %d%n", cycle.prizePool());
        out.printf("Owners:          %d%n", counts.size());
        counts.forEach((actor, count) ->
            out.printf("  %-30s %6d%s%n", actor, count, leaders.contains(actor) ? "  *" : ""));
        out.flush();
        return CommandLine.ExitCode.OK;
    }

    private static String formatMillis(final Long epochMillis) {
        return epochMillis == null ? "-" : Instant.ofEpochMilli(epochMillis).toString();
    }
}
