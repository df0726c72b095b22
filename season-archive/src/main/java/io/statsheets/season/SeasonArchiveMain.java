package io.statsheets.season;

import com.google.inject.Guice;
import com.google.inject.Injector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.util.concurrent.Callable;

/**
 * CLI that archives one season's game and player statsheets under {@code out/}.
 */
@CommandLine.Command(name = "season-archive", mixinStandardHelpOptions = true, version = "season-archive 0.1.0",
        description = "Download every game and player statsheet of a season as JSON files")
public final class SeasonArchiveMain implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(SeasonArchiveMain.class);

    @CommandLine.Parameters(index = "0", arity = "0..1", paramLabel = "SEASON", description = "Season number, starting at 1")
    String season;

    public static void main(String[] args) {
        int code = new CommandLine(new SeasonArchiveMain()).execute(args);
        System.exit(code);
    }

    @Override
    public Integer call() {
        try {
            SeasonOrchestrator.parseSeason(season);
            Injector injector = Guice.createInjector(new ArchiveModule(ArchiveConfig.fromSystemProperties()));
            try {
                injector.getInstance(SeasonOrchestrator.class).run(season);
            } finally {
                ArchiveModule.shutdown(injector);
            }
            return 0;
        } catch (ArgumentException e) {
            System.err.println("error: " + e.getMessage());
            return 2;
        } catch (StatsheetException e) {
            log.error("season archive failed", e);
            System.err.println("error: " + e.getMessage());
            return 1;
        }
    }
}
